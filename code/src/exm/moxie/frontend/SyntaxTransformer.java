/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.moxie.frontend;

import org.apache.log4j.Logger;

import exm.moxie.ast.MoxieAST;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.frontend.passes.BuiltinDispatch;
import exm.moxie.frontend.passes.CoercionLowering;
import exm.moxie.frontend.passes.ComparisonLowering;
import exm.moxie.frontend.passes.ConcatLowering;
import exm.moxie.frontend.passes.ForeignLibraryLowering;
import exm.moxie.frontend.passes.ReferencePointerization;
import exm.moxie.frontend.passes.RewritePipeline;
import exm.moxie.frontend.passes.StringLiteralization;
import exm.moxie.frontend.passes.UnsupportedConstructCheck;

public class SyntaxTransformer {

  /**
   * Rewrite all dialect constructs in the file to the base language.
   *
   * NOTE: the file is modified in-place
   * @param context per-file state; collects required imports and warnings
   * @param file FILE node
   */
  public static void transform(Logger logger, TransformContext context,
                               MoxieAST file) throws UserException {
    RewritePipeline pipe = buildPipeline(context.getSettings()
                                                .concatMaxIterations());
    pipe.runPipeline(logger, context, file);
  }

  /**
   * The order matters: each pass relies on the tree shapes produced by
   * the passes before it.
   */
  public static RewritePipeline buildPipeline(int maxIterations) {
    RewritePipeline pipe = new RewritePipeline(maxIterations);
    // Synthesizes make(chan T) before make() is rejected
    pipe.addPass(new ReferencePointerization());
    pipe.addPass(new UnsupportedConstructCheck());
    // Consults LiteralContextExemption for literals in composite literals
    pipe.addPass(new StringLiteralization());
    // Needs lowered literals to pick Concat
    pipe.addPass(new ConcatLowering());
    pipe.addPass(new ComparisonLowering());
    pipe.addPass(new BuiltinDispatch());
    pipe.addPass(new CoercionLowering());
    pipe.addPass(new ForeignLibraryLowering());
    return pipe;
  }
}
