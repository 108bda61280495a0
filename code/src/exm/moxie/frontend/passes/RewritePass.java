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

import exm.moxie.ast.MoxieAST;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.frontend.TransformContext;

/**
 * A rewrite pass over a whole file
 */
public interface RewritePass {
  public abstract String getPassName();

  /**
   * @return true if the pass is repeated until it makes no change
   */
  public abstract boolean isFixedPoint();

  /**
   * @param context transformation state for the file
   * @param file FILE node, rewritten in place
   * @return true if the tree was changed
   */
  public abstract boolean apply(TransformContext context, MoxieAST file)
                                                  throws UserException;
}
