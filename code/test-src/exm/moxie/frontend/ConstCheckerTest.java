package exm.moxie.frontend;

import static exm.moxie.ast.Trees.assign;
import static exm.moxie.ast.Trees.constDecl;
import static exm.moxie.ast.Trees.ident;
import static exm.moxie.ast.Trees.incDec;
import static exm.moxie.ast.Trees.index;
import static exm.moxie.ast.Trees.intLit;
import static exm.moxie.ast.Trees.names;
import static exm.moxie.ast.Trees.selector;
import static exm.moxie.ast.Trees.valueSpec;
import static exm.moxie.frontend.TreeFixtures.FILE_NAME;
import static exm.moxie.frontend.TreeFixtures.file;
import static exm.moxie.frontend.TreeFixtures.mainFunc;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.moxie.ast.FilePosition;
import exm.moxie.ast.MoxieAST;
import exm.moxie.common.exceptions.ConstMutationException;
import exm.moxie.common.exceptions.ConstViolationsException;
import exm.moxie.common.exceptions.MoxieRuntimeError;

public class ConstCheckerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  /** const (Limit = 10; A, B = 1, 2) with Limit declared at 3:6 */
  private static MoxieAST consts() {
    MoxieAST limit = names("Limit");
    limit.child(0).at(3, 6);
    MoxieAST ab = names("A", "B");
    ab.child(0).at(4, 2);
    ab.child(1).at(4, 5);
    return constDecl(valueSpec(limit, null, intLit("10")),
                     valueSpec(ab, null, intLit("1"), intLit("2")));
  }

  private static MoxieAST target(String name, int line, int col) {
    return ident(name).at(line, col);
  }

  @Test
  public void testNoConsts() {
    MoxieAST f = file(mainFunc(assign("=", ident("x"), intLit("1"))));
    assertTrue(new ConstChecker(FILE_NAME).check(f).isEmpty());
  }

  @Test
  public void testAssignment() {
    MoxieAST f = file(consts(),
        mainFunc(assign("=", target("Limit", 7, 2), intLit("5"))));
    ConstChecker checker = new ConstChecker(FILE_NAME);
    List<ConstMutationException> found = checker.check(f);
    assertEquals(1, found.size());
    ConstMutationException v = found.get(0);
    assertEquals("Limit", v.getName());
    assertEquals(new FilePosition(FILE_NAME, 7, 2), v.getPosition());
    assertEquals(new FilePosition(FILE_NAME, 3, 6), v.getDeclaredAt());

    Diagnostic d = v.toDiagnostic();
    assertEquals(DiagnosticKind.CONST_MUTATION, d.kind);
    assertEquals(new FilePosition(FILE_NAME, 3, 6), d.relatedPosition);
    assertTrue(d.isFatal());
  }

  @Test
  public void testIncrementDecrement() {
    MoxieAST f = file(consts(),
        mainFunc(incDec("++", target("A", 8, 1)),
                 incDec("--", target("B", 9, 1))));
    List<ConstMutationException> found = new ConstChecker(FILE_NAME).check(f);
    assertEquals(2, found.size());
    assertEquals("A", found.get(0).getName());
    assertEquals(new FilePosition(FILE_NAME, 4, 5),
                 found.get(1).getDeclaredAt());
  }

  @Test
  public void testEachTargetReported() {
    // Limit, A = 1, 2 and a field write through a const base
    MoxieAST multi = assign("=",
        Arrays.asList(target("Limit", 10, 0), target("A", 10, 7)),
        Arrays.asList(intLit("1"), intLit("2")));
    MoxieAST f = file(consts(), mainFunc(multi,
        assign("=", selector(target("B", 11, 0), "x"), intLit("3")),
        assign("=", index(ident("ok"), ident("Limit")), intLit("4"))));
    List<ConstMutationException> found = new ConstChecker(FILE_NAME).check(f);
    assertEquals(3, found.size());
    assertEquals("Limit", found.get(0).getName());
    assertEquals("A", found.get(1).getName());
    assertEquals("B", found.get(2).getName());
  }

  @Test
  public void testDeclarationsCollectedFirst() {
    // Mutation appears before the declaration in tree order
    MoxieAST f = file(mainFunc(assign("=", target("Limit", 2, 1),
                                      intLit("0"))),
                      consts());
    ConstChecker checker = new ConstChecker(FILE_NAME);
    assertEquals(1, checker.check(f).size());
    assertEquals(3, checker.getDeclarations().size());
  }

  @Test
  public void testRedeclaredConstReportsLastDeclaration() {
    // Limit declared again in main's scope at 6:8
    MoxieAST again = names("Limit");
    again.child(0).at(6, 8);
    MoxieAST f = file(consts(),
        mainFunc(constDecl(valueSpec(again, null, intLit("20"))),
                 assign("=", target("Limit", 7, 2), intLit("5"))));
    ConstChecker checker = new ConstChecker(FILE_NAME);
    List<ConstMutationException> found = checker.check(f);
    assertEquals(1, found.size());
    assertEquals(new FilePosition(FILE_NAME, 6, 8),
                 found.get(0).getDeclaredAt());
    assertEquals(3, checker.getDeclarations().size());
    assertEquals(new FilePosition(FILE_NAME, 6, 8),
                 checker.getDeclarations().get("Limit"));
  }

  @Test
  public void testCheckOrThrow() {
    MoxieAST f = file(consts(),
        mainFunc(assign("=", target("Limit", 5, 2), intLit("5")),
                 incDec("++", target("Limit", 6, 2))));
    try {
      new ConstChecker(FILE_NAME).checkOrThrow(f);
      fail("Expected violations");
    } catch (ConstViolationsException e) {
      assertEquals(2, e.getViolations().size());
      assertEquals(2, e.toDiagnostics().size());
      assertTrue(e.getMessage().contains("2 const violations"));
    }
  }

  @Test
  public void testSingleUse() {
    MoxieAST f = file(consts());
    ConstChecker checker = new ConstChecker(FILE_NAME);
    checker.check(f);
    exception.expect(MoxieRuntimeError.class);
    checker.check(f);
  }
}
