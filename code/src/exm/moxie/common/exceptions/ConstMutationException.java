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
 * Assignment or increment of a name declared const
 */
public class ConstMutationException extends UserException {

  private final String name;
  private final FilePosition declaredAt;

  public ConstMutationException(FilePosition position, String name,
                                FilePosition declaredAt) {
    super(DiagnosticKind.CONST_MUTATION, position,
          "cannot assign to const " + name + " (declared at " +
          declaredAt + ")");
    this.name = name;
    this.declaredAt = declaredAt;
  }

  public String getName() {
    return name;
  }

  public FilePosition getDeclaredAt() {
    return declaredAt;
  }

  @Override
  public Diagnostic toDiagnostic() {
    return new Diagnostic(getKind(), getRawMessage(), getPosition(),
                          declaredAt);
  }

  private static final long serialVersionUID = 1L;
}
