package exm.moxie.frontend.passes;

import static exm.moxie.ast.Trees.addressOf;
import static exm.moxie.ast.Trees.call;
import static exm.moxie.ast.Trees.chanType;
import static exm.moxie.ast.Trees.compositeLit;
import static exm.moxie.ast.Trees.exprStmt;
import static exm.moxie.ast.Trees.ident;
import static exm.moxie.ast.Trees.intLit;
import static exm.moxie.ast.Trees.names;
import static exm.moxie.ast.Trees.sliceType;
import static exm.moxie.ast.Trees.valueSpec;
import static exm.moxie.ast.Trees.varDecl;
import static exm.moxie.frontend.TreeFixtures.context;
import static exm.moxie.frontend.TreeFixtures.define;
import static exm.moxie.frontend.TreeFixtures.mainFile;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.moxie.ast.MoxieAST;
import exm.moxie.common.exceptions.UnsupportedConstructException;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.frontend.TransformContext;

public class UnsupportedConstructCheckTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static MoxieAST makeSlice() {
    return call(ident("make"), sliceType(ident("int")), intLit("3"));
  }

  private void check(MoxieAST file) throws UserException {
    new UnsupportedConstructCheck().apply(context(), file);
  }

  @Test
  public void testMakeStatement() throws UserException {
    exception.expect(UnsupportedConstructException.class);
    check(mainFile(exprStmt(makeSlice())));
  }

  @Test
  public void testMakeInVarDecl() throws UserException {
    exception.expect(UnsupportedConstructException.class);
    check(mainFile(varDecl(valueSpec(names("xs"), null, makeSlice()))));
  }

  @Test
  public void testMakeNested() throws UserException {
    exception.expect(UnsupportedConstructException.class);
    check(mainFile(exprStmt(call(ident("use"), call(ident("f"),
                                                    makeSlice())))));
  }

  @Test
  public void testMessageNamesAlternatives() {
    MoxieAST make = makeSlice().at(7, 4);
    try {
      check(mainFile(exprStmt(make)));
      fail("make() not rejected");
    } catch (UnsupportedConstructException e) {
      assertEquals(7, e.getPosition().line);
      assertTrue(e.getMessage(), e.getMessage().contains("make([]int, 3)"));
      assertTrue(e.getMessage().contains("&[]T{}"));
      assertTrue(e.getMessage().contains("&map[K]V{}"));
      assertTrue(e.getMessage().contains("&chan T{}"));
    } catch (UserException e) {
      fail("Unexpected " + e);
    }
  }

  @Test
  public void testLoweredChannelAllowed() throws UserException {
    MoxieAST file = mainFile(
        define("c", addressOf(compositeLit(chanType("chan", ident("int"))))));
    TransformContext context = context();
    new ReferencePointerization().apply(context, file);
    assertFalse(new UnsupportedConstructCheck().apply(context, file));
  }
}
