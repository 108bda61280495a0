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
package exm.moxie.common.exceptions;

import exm.moxie.ast.FilePosition;
import exm.moxie.frontend.Diagnostic;
import exm.moxie.frontend.DiagnosticKind;

/**
 * A fixed point pass kept changing the tree past its iteration ceiling
 */
public class InternalPassLimitError extends MoxieRuntimeError {

  private final String passName;
  private final int limit;
  private final FilePosition position;

  public InternalPassLimitError(String passName, int limit,
                                FilePosition position) {
    super(position + ": pass " + passName + " did not converge after " +
          limit + " iterations");
    this.passName = passName;
    this.limit = limit;
    this.position = position;
  }

  public String getPassName() {
    return passName;
  }

  public int getLimit() {
    return limit;
  }

  public Diagnostic toDiagnostic() {
    return new Diagnostic(DiagnosticKind.INTERNAL_PASS_LIMIT, getMessage(),
                          position, null);
  }

  private static final long serialVersionUID = 1L;
}
