package exm.moxie.frontend;

import static exm.moxie.ast.Trees.addressOf;
import static exm.moxie.ast.Trees.binary;
import static exm.moxie.ast.Trees.call;
import static exm.moxie.ast.Trees.compositeLit;
import static exm.moxie.ast.Trees.constDecl;
import static exm.moxie.ast.Trees.ident;
import static exm.moxie.ast.Trees.intLit;
import static exm.moxie.ast.Trees.names;
import static exm.moxie.ast.Trees.sliceType;
import static exm.moxie.ast.Trees.valueSpec;
import static exm.moxie.frontend.TreeFixtures.define;
import static exm.moxie.frontend.TreeFixtures.mainFile;
import static exm.moxie.frontend.TreeFixtures.rhs;
import static exm.moxie.frontend.TreeFixtures.stmt;
import static exm.moxie.frontend.TreeFixtures.str;
import static exm.moxie.frontend.TreeFixtures.transpile;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.ClassRule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.moxie.ast.FilePosition;
import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.Logging;
import exm.moxie.common.Settings;
import exm.moxie.common.exceptions.ConstMutationException;
import exm.moxie.common.exceptions.ConstViolationsException;
import exm.moxie.common.exceptions.UnsupportedConstructException;
import exm.moxie.common.exceptions.UserException;

public class FileTranspilerTest {

  private static final String RUNTIME = "github.com/mleku/moxie/runtime";

  @ClassRule
  public static TemporaryFolder logDir = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(logDir.newFile("transpile.log").getPath(), true);
  }

  @AfterClass
  public static void closeLogFile() {
    Logging.closeLogFile();
  }

  @Test
  public void testStringConcatUsesByteStringHelper() throws UserException {
    MoxieAST file = mainFile(
        define("s1", str("ab")),
        define("s2", str("cd")),
        define("s3", binary("+", ident("s1"), ident("s2"))));

    FileTranspiler.Result result = transpile(file);
    MoxieAST out = result.getFile();
    assertEquals("(call (. moxie Concat) s1 s2)",
                 rhs(stmt(out, 2), 0).toStringTree());
    assertEquals("(& (lit ([] byte) 'a' 'b'))",
                 rhs(stmt(out, 0), 0).toStringTree());
    assertEquals(Arrays.asList(RUNTIME), result.getAddedImports());
  }

  @Test
  public void testSliceConcatUsesElementType() throws UserException {
    MoxieAST file = mainFile(
        define("xs", addressOf(compositeLit(sliceType(ident("int32")),
                      intLit("1"), intLit("2"), intLit("3")))),
        define("ys", addressOf(compositeLit(sliceType(ident("int32")),
                      intLit("4"), intLit("5")))),
        define("zs", binary("+", ident("xs"), ident("ys"))));

    MoxieAST out = transpile(file).getFile();
    assertEquals("(call (index (. moxie ConcatSlice) int32) xs ys)",
                 rhs(stmt(out, 2), 0).toStringTree());
  }

  @Test
  public void testConcatChainConverges() throws UserException {
    MoxieAST file = mainFile(
        define("s", binary("+", binary("+", str("a"), str("b")), str("c"))));

    MoxieAST out = transpile(file).getFile();
    MoxieAST outer = rhs(stmt(out, 0), 0);
    assertEquals("(call (. moxie Concat) " +
          "(call (. moxie Concat) (& (lit ([] byte) 'a')) " +
                                 "(& (lit ([] byte) 'b'))) " +
          "(& (lit ([] byte) 'c')))", outer.toStringTree());
  }

  @Test
  public void testConstMutationReported() {
    MoxieAST limitNames = names("Limit");
    limitNames.child(0).at(3, 6);
    MoxieAST decl = constDecl(valueSpec(limitNames, null, intLit("10")));
    MoxieAST mutation = Trees.assign("=", ident("Limit").at(5, 2),
                                     intLit("20"));
    MoxieAST file = mainFile(decl, mutation);
    String before = file.toStringTree();

    try {
      transpile(file);
      fail("Expected const violation");
    } catch (ConstViolationsException e) {
      List<ConstMutationException> violations = e.getViolations();
      assertEquals(1, violations.size());
      ConstMutationException v = violations.get(0);
      assertEquals("Limit", v.getName());
      assertEquals(new FilePosition(TreeFixtures.FILE_NAME, 5, 2),
                   v.getPosition());
      assertEquals(new FilePosition(TreeFixtures.FILE_NAME, 3, 6),
                   v.getDeclaredAt());
    } catch (UserException e) {
      fail("Unexpected " + e);
    }
    // Input is never modified
    assertEquals(before, file.toStringTree());
  }

  @Test
  public void testInputNotModified() throws UserException {
    MoxieAST file = mainFile(define("s", str("x")));
    String before = file.toStringTree();
    MoxieAST out = transpile(file).getFile();
    assertEquals(before, file.toStringTree());
    assertFalse(before.equals(out.toStringTree()));
  }

  @Test
  public void testNoPartialOutputOnError() {
    MoxieAST file = mainFile(
        define("s", str("x")),
        define("xs", call(ident("make"), sliceType(ident("int")),
                          intLit("3"))));
    String before = file.toStringTree();
    try {
      transpile(file);
      fail("make() should be rejected");
    } catch (UnsupportedConstructException e) {
      // expected
    } catch (UserException e) {
      fail("Unexpected " + e);
    }
    assertEquals(before, file.toStringTree());
  }

  @Test
  public void testImportsSpliced() throws UserException {
    MoxieAST file = mainFile(
        define("a", str("x")),
        define("eq", binary("==", ident("a"), str("y"))));
    FileTranspiler.Result result = transpile(file);
    MoxieAST out = result.getFile();

    MoxieAST imports = out.child(1);
    assertEquals(MoxieTokens.IMPORT_DECL, imports.getType());
    assertTrue(imports.isSynthetic());
    assertEquals("(import \"bytes\")", imports.toStringTree());
    assertEquals(Arrays.asList("bytes"), result.getAddedImports());
  }

  @Test
  public void testNoImportsWhenNothingRewritten() throws UserException {
    MoxieAST file = mainFile(define("n", binary("+", intLit("1"),
                                                 intLit("2"))));
    FileTranspiler.Result result = transpile(file);
    assertTrue(result.getAddedImports().isEmpty());
    assertEquals(MoxieTokens.FUNC_DECL, result.getFile().child(1).getType());
  }

  @Test
  public void testCheckReturnsDiagnostics() {
    MoxieAST file = mainFile(
        Trees.exprStmt(call(ident("make"), Trees.mapType(ident("int"),
                                                         ident("int")))));
    List<Diagnostic> diags = new FileTranspiler(Settings.defaultSettings())
                                .check(TreeFixtures.FILE_NAME, file);
    assertEquals(1, diags.size());
    assertEquals(DiagnosticKind.UNSUPPORTED_CONSTRUCT, diags.get(0).kind);
    assertTrue(diags.get(0).isFatal());
  }

  @Test
  public void testWarningsCollected() throws UserException {
    MoxieAST file = mainFile(
        Trees.exprStmt(call(ident("clone"), ident("unknown"))));
    FileTranspiler.Result result = transpile(file);
    assertEquals(1, result.getWarnings().size());
    Diagnostic warning = result.getWarnings().get(0);
    assertEquals(DiagnosticKind.UNRESOLVED_TYPE_WARNING, warning.kind);
    assertFalse(warning.isFatal());
  }

  @Test
  public void testFilesAreIndependent() throws UserException {
    FileTranspiler transpiler = new FileTranspiler(Settings.defaultSettings());
    MoxieAST first = mainFile(define("s", binary("+", str("x"), str("y"))));
    MoxieAST second = mainFile(define("n", intLit("1")));
    assertEquals(1, transpiler.transpile("a.mx", first)
                              .getAddedImports().size());
    assertTrue(transpiler.transpile("b.mx", second)
                         .getAddedImports().isEmpty());
  }
}
