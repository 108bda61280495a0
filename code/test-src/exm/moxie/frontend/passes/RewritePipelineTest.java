package exm.moxie.frontend.passes;

import static exm.moxie.ast.Trees.ident;
import static exm.moxie.frontend.TreeFixtures.context;
import static exm.moxie.frontend.TreeFixtures.define;
import static exm.moxie.frontend.TreeFixtures.mainFile;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import exm.moxie.ast.MoxieAST;
import exm.moxie.common.Logging;
import exm.moxie.common.exceptions.InternalPassLimitError;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.frontend.DiagnosticKind;
import exm.moxie.frontend.SyntaxTransformer;
import exm.moxie.frontend.TransformContext;

public class RewritePipelineTest {

  /**
   * Reports a change for the first few applications
   */
  private static class CountingPass implements RewritePass {
    private final String name;
    private final boolean fixedPoint;
    private final int changingApplies;
    private final List<String> log;
    int applies = 0;

    CountingPass(String name, boolean fixedPoint, int changingApplies,
                 List<String> log) {
      this.name = name;
      this.fixedPoint = fixedPoint;
      this.changingApplies = changingApplies;
      this.log = log;
    }

    @Override
    public String getPassName() {
      return name;
    }

    @Override
    public boolean isFixedPoint() {
      return fixedPoint;
    }

    @Override
    public boolean apply(TransformContext context, MoxieAST file)
                                                throws UserException {
      applies++;
      log.add(name);
      return applies <= changingApplies;
    }
  }

  private static MoxieAST smallFile() {
    return mainFile(define("x", ident("y")));
  }

  @Test
  public void testPassOrder() throws UserException {
    List<String> log = new ArrayList<String>();
    RewritePipeline pipeline = new RewritePipeline(10);
    pipeline.addPass(new CountingPass("first", false, 1, log));
    pipeline.addPass(new CountingPass("second", true, 2, log));
    pipeline.addPass(new CountingPass("third", false, 1, log));
    pipeline.runPipeline(Logging.getMoxieLogger(), context(), smallFile());
    // Fixed point pass runs until a traversal changes nothing
    assertEquals("[first, second, second, second, third]", log.toString());
  }

  @Test
  public void testOneShotPassRunsOnce() throws UserException {
    List<String> log = new ArrayList<String>();
    CountingPass pass = new CountingPass("once", false, 100, log);
    RewritePipeline pipeline = new RewritePipeline(3);
    pipeline.addPass(pass);
    pipeline.runPipeline(Logging.getMoxieLogger(), context(), smallFile());
    assertEquals(1, pass.applies);
  }

  @Test
  public void testIterationCeiling() throws UserException {
    List<String> log = new ArrayList<String>();
    CountingPass pass = new CountingPass("restless", true, 100, log);
    RewritePipeline pipeline = new RewritePipeline(3);
    pipeline.addPass(pass);
    try {
      pipeline.runPipeline(Logging.getMoxieLogger(), context(), smallFile());
      fail("Expected pass limit error");
    } catch (InternalPassLimitError e) {
      assertEquals(3, pass.applies);
      assertEquals("restless", e.getPassName());
      assertEquals(3, e.getLimit());
      assertEquals(DiagnosticKind.INTERNAL_PASS_LIMIT,
                   e.toDiagnostic().kind);
    }
  }

  @Test
  public void testConvergesOnLastAllowedIteration() throws UserException {
    List<String> log = new ArrayList<String>();
    CountingPass pass = new CountingPass("settles", true, 2, log);
    RewritePipeline pipeline = new RewritePipeline(3);
    pipeline.addPass(pass);
    pipeline.runPipeline(Logging.getMoxieLogger(), context(), smallFile());
    assertEquals(3, pass.applies);
  }

  @Test
  public void testStandardPipeline() {
    RewritePipeline pipeline = SyntaxTransformer.buildPipeline(64);
    List<String> names = new ArrayList<String>();
    for (RewritePass pass: pipeline.getPasses()) {
      names.add(pass.getClass().getSimpleName());
    }
    assertEquals("[ReferencePointerization, UnsupportedConstructCheck, " +
                 "StringLiteralization, ConcatLowering, ComparisonLowering, " +
                 "BuiltinDispatch, CoercionLowering, ForeignLibraryLowering]",
                 names.toString());
  }
}
