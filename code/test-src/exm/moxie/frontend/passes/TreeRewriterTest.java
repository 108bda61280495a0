package exm.moxie.frontend.passes;

import static exm.moxie.ast.Trees.binary;
import static exm.moxie.ast.Trees.block;
import static exm.moxie.ast.Trees.compositeLit;
import static exm.moxie.ast.Trees.exprStmt;
import static exm.moxie.ast.Trees.field;
import static exm.moxie.ast.Trees.forStmt;
import static exm.moxie.ast.Trees.funcLit;
import static exm.moxie.ast.Trees.funcType;
import static exm.moxie.ast.Trees.ident;
import static exm.moxie.ast.Trees.ifStmt;
import static exm.moxie.ast.Trees.incDec;
import static exm.moxie.ast.Trees.intLit;
import static exm.moxie.ast.Trees.names;
import static exm.moxie.ast.Trees.params;
import static exm.moxie.ast.Trees.results;
import static exm.moxie.ast.Trees.returnStmt;
import static exm.moxie.ast.Trees.sliceType;
import static exm.moxie.ast.Trees.star;
import static exm.moxie.frontend.TreeFixtures.context;
import static exm.moxie.frontend.TreeFixtures.define;
import static exm.moxie.frontend.TreeFixtures.mainFile;
import static exm.moxie.frontend.TreeFixtures.stmt;
import static exm.moxie.frontend.TreeFixtures.str;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.frontend.TransformContext;

public class TreeRewriterTest {

  /**
   * Records the type of x wherever the identifier mark appears
   */
  private static class TypeRecorder extends TreeRewriter {
    final List<String> seen = new ArrayList<String>();

    TypeRecorder(TransformContext context) {
      super(context);
    }

    @Override
    protected MoxieAST exit(MoxieAST node) {
      if (node.getType() == MoxieTokens.IDENT &&
          node.getText().equals("mark")) {
        seen.add(types.typeOf("x").toString());
      }
      return node;
    }
  }

  /**
   * Renames old to new
   */
  private static class Renamer extends TreeRewriter {
    Renamer(TransformContext context) {
      super(context);
    }

    @Override
    protected MoxieAST exit(MoxieAST node) {
      if (node.getType() == MoxieTokens.IDENT &&
          node.getText().equals("old")) {
        MoxieAST repl = ident("new");
        replace(node, repl);
        return repl;
      }
      return node;
    }
  }

  private static MoxieAST mark() {
    return exprStmt(ident("mark"));
  }

  @Test
  public void testScopes() throws UserException {
    MoxieAST inIf = ifStmt(define("x", intLit("1")), ident("cond"),
                           block(mark()), null);
    MoxieAST inFor = forStmt(define("i", intLit("0")),
        binary("<", ident("i"), intLit("3")), incDec("++", ident("i")),
        block(define("x", compositeLit(sliceType(ident("int")))), mark()));
    MoxieAST lit = funcLit(
        funcType(params(field(names("x"), star(sliceType(ident("int64"))),
                              null)),
                 results()),
        block(mark(), returnStmt(ident("x"))));
    MoxieAST file = mainFile(define("x", str("s")), mark(), inIf, mark(),
                             inFor, define("f", lit), mark());
    TransformContext context = context();
    TypeRecorder p = new TypeRecorder(context);
    assertFalse(p.rewrite(file));
    assertEquals("[string, int, string, []int, *[]int64, string]",
                 p.seen.toString());
    // Walk leaves the tracker at file scope
    assertEquals(0, context.getTypes().nesting());
    assertEquals(0, context.getLevel());
  }

  @Test
  public void testReplacement() throws UserException {
    MoxieAST use = ident("old").at(4, 8);
    MoxieAST file = mainFile(define("a", use), define("b", ident("old")));
    Renamer r = new Renamer(context());
    assertTrue(r.rewrite(file));
    assertEquals(2, r.changeCount());
    MoxieAST renamed = stmt(file, 0).child(1).child(0);
    assertEquals("new", renamed.getText());
    assertEquals(4, renamed.getLine());
    assertEquals(8, renamed.getCharPositionInLine());

    // Nothing left to rename
    assertFalse(r.rewrite(file));
    assertEquals(0, r.changeCount());
  }
}
