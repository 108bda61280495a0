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
package exm.moxie.frontend.passes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.moxie.ast.MoxieAST;
import exm.moxie.common.exceptions.InternalPassLimitError;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.frontend.TransformContext;

/**
 * Runs rewrite passes in order.  Fixed point passes are repeated until a
 * traversal changes nothing.
 */
public class RewritePipeline {

  private final List<RewritePass> passes = new ArrayList<RewritePass>();
  private final int maxIterations;

  /**
   * @param maxIterations most traversals a fixed point pass may make
   */
  public RewritePipeline(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public void addPass(RewritePass pass) {
    passes.add(pass);
  }

  public List<RewritePass> getPasses() {
    return Collections.unmodifiableList(passes);
  }

  public void runPipeline(Logger logger, TransformContext context,
                          MoxieAST file) throws UserException {
    for (RewritePass pass: passes) {
      logger.debug("Pass: " + pass.getPassName());
      if (pass.isFixedPoint()) {
        runToFixedPoint(logger, context, file, pass);
      } else {
        boolean changed = pass.apply(context, file);
        logger.debug("Pass " + pass.getPassName() + " done, changed: " +
                     changed);
      }
    }
  }

  private void runToFixedPoint(Logger logger, TransformContext context,
                   MoxieAST file, RewritePass pass) throws UserException {
    int iteration = 0;
    boolean changed;
    do {
      changed = pass.apply(context, file);
      iteration++;
      logger.debug("Iteration: " + iteration + " Pass: " +
                   pass.getPassName() + " changed: " + changed);
    } while (changed && iteration < maxIterations);

    if (changed) {
      throw new InternalPassLimitError(pass.getPassName(), maxIterations,
                                       context.getPosition());
    }
  }
}
