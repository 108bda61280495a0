package exm.moxie.frontend.passes;

import static exm.moxie.ast.Trees.addressOf;
import static exm.moxie.ast.Trees.assign;
import static exm.moxie.ast.Trees.binary;
import static exm.moxie.ast.Trees.call;
import static exm.moxie.ast.Trees.compositeLit;
import static exm.moxie.ast.Trees.constDecl;
import static exm.moxie.ast.Trees.field;
import static exm.moxie.ast.Trees.funcDecl;
import static exm.moxie.ast.Trees.ident;
import static exm.moxie.ast.Trees.index;
import static exm.moxie.ast.Trees.intLit;
import static exm.moxie.ast.Trees.names;
import static exm.moxie.ast.Trees.params;
import static exm.moxie.ast.Trees.results;
import static exm.moxie.ast.Trees.selector;
import static exm.moxie.ast.Trees.sliceType;
import static exm.moxie.ast.Trees.star;
import static exm.moxie.ast.Trees.valueSpec;
import static exm.moxie.ast.Trees.block;
import static exm.moxie.frontend.TreeFixtures.context;
import static exm.moxie.frontend.TreeFixtures.define;
import static exm.moxie.frontend.TreeFixtures.file;
import static exm.moxie.frontend.TreeFixtures.mainFile;
import static exm.moxie.frontend.TreeFixtures.rhs;
import static exm.moxie.frontend.TreeFixtures.stmt;
import static exm.moxie.frontend.TreeFixtures.str;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.common.Logging;
import exm.moxie.common.Settings;
import exm.moxie.common.exceptions.UnresolvedTypeException;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.frontend.SyntaxTransformer;
import exm.moxie.frontend.TransformContext;
import exm.moxie.frontend.TreeFixtures;

public class ConcatLoweringTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private TransformContext transform(MoxieAST file) throws UserException {
    TransformContext context = context();
    SyntaxTransformer.transform(Logging.getMoxieLogger(), context, file);
    return context;
  }

  @Test
  public void testNumericAdditionUntouched() throws UserException {
    MoxieAST file = mainFile(
        define("n", intLit("1")),
        define("m", binary("+", ident("n"), intLit("2"))));
    TransformContext context = transform(file);
    assertEquals("(+ n 2)", rhs(stmt(file, 1), 0).toStringTree());
    assertTrue(context.getImports().isEmpty());
  }

  @Test
  public void testLiteralOperand() throws UserException {
    MoxieAST file = mainFile(
        define("s", str("a")),
        define("t", binary("+", ident("s"), str("!"))));
    transform(file);
    assertEquals("(call (. moxie Concat) s (& (lit ([] byte) '!')))",
                 rhs(stmt(file, 1), 0).toStringTree());
  }

  @Test
  public void testBareSliceLiteralOperand() throws UserException {
    MoxieAST file = mainFile(
        define("zs", binary("+",
            compositeLit(sliceType(ident("int")), intLit("1")),
            compositeLit(sliceType(ident("int")), intLit("2")))));
    transform(file);
    MoxieAST call = rhs(stmt(file, 0), 0);
    assertEquals("(index (. moxie ConcatSlice) int)",
                 call.child(0).toStringTree());
  }

  @Test
  public void testConcatOfConcatSlice() throws UserException {
    MoxieAST xs = addressOf(compositeLit(sliceType(ident("int64")),
                                         intLit("1")));
    MoxieAST file = mainFile(
        define("xs", xs),
        define("ys", binary("+", binary("+", ident("xs"), ident("xs")),
                            ident("xs"))));
    transform(file);
    MoxieAST outer = rhs(stmt(file, 1), 0);
    assertEquals("(call (index (. moxie ConcatSlice) int64) " +
        "(call (index (. moxie ConcatSlice) int64) xs xs) xs)",
        outer.toStringTree());
  }

  @Test
  public void testParamTypes() throws UserException {
    MoxieAST f = funcDecl("join",
        params(field(names("a", "b"), star(sliceType(ident("uint16"))), null)),
        results(),
        block(define("c", binary("+", ident("a"), ident("b")))));
    transform(file(f));
    MoxieAST c = TreeFixtures.find(f, MoxieTokens.ASSIGN);
    assertEquals("(call (index (. moxie ConcatSlice) uint16) a b)",
                 rhs(c, 0).toStringTree());
  }

  @Test
  public void testPlusAssign() throws UserException {
    MoxieAST file = mainFile(
        define("s", str("a")),
        assign("+=", ident("s"), str("b")));
    transform(file);
    assertEquals("(= (lhs s) (rhs (call (. moxie Concat) s " +
                 "(& (lit ([] byte) 'b')))))", stmt(file, 1).toStringTree());
  }

  @Test
  public void testConstExpressionsUntouched() throws UserException {
    MoxieAST file = mainFile(constDecl(valueSpec(names("Greeting"), null,
                                       binary("+", str("a"), str("b")))));
    transform(file);
    MoxieAST plus = TreeFixtures.find(file, MoxieTokens.BINARY);
    assertEquals("(+ \"a\" \"b\")", plus.toStringTree());
  }

  @Test
  public void testBaseStringConcatUntouched() throws UserException {
    MoxieAST first = index(ident("names"), intLit("0"));
    MoxieAST file = mainFile(
        define("names", compositeLit(sliceType(ident("string")), str("a"))),
        define("t", binary("+", first, first.copyTree())),
        define("u", binary("+", binary("+", first.copyTree(), str("-")),
                           str("!"))));
    TransformContext context = transform(file);
    assertEquals("(+ (index names 0) (index names 0))",
                 rhs(stmt(file, 1), 0).toStringTree());
    // Literals added to a base language string stay literals
    assertEquals("(+ (+ (index names 0) \"-\") \"!\")",
                 rhs(stmt(file, 2), 0).toStringTree());
    assertTrue(context.getImports().isEmpty());
  }

  @Test
  public void testUnresolvedElementType() throws UserException {
    // Helper call without its type argument, plus an untracked name
    MoxieAST helper = call(selector(ident("moxie"), "ConcatSlice"),
                           ident("p"), ident("q"));
    MoxieAST file = mainFile(define("z", binary("+", helper, ident("r"))));
    exception.expect(UnresolvedTypeException.class);
    new ConcatLowering().apply(context(), file);
  }

  @Test
  public void testFixedPointWithinBound() throws Exception {
    Settings settings = Settings.defaultSettings()
                          .with(Settings.CONCAT_MAX_ITERATIONS, "2");
    MoxieAST file = mainFile(define("s", binary("+",
        binary("+", binary("+", str("a"), str("b")), str("c")), str("d"))));
    TransformContext context = new TransformContext(TreeFixtures.FILE_NAME,
                                                    settings);
    SyntaxTransformer.transform(Logging.getMoxieLogger(), context, file);
    assertEquals(3, TreeFixtures.findAll(file, MoxieTokens.CALL).size());
    assertEquals(0, TreeFixtures.findAll(file, MoxieTokens.BINARY).size());
  }
}
