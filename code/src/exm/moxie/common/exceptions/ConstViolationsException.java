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

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.moxie.frontend.Diagnostic;
import exm.moxie.frontend.DiagnosticKind;

/**
 * All const mutations found in a file, reported together
 */
public class ConstViolationsException extends UserException {

  private final ImmutableList<ConstMutationException> violations;

  public ConstViolationsException(List<ConstMutationException> violations) {
    super(DiagnosticKind.CONST_MUTATION, first(violations).getPosition(),
          summary(violations));
    this.violations = ImmutableList.copyOf(violations);
  }

  private static ConstMutationException first(
                          List<ConstMutationException> violations) {
    if (violations.isEmpty()) {
      throw new MoxieRuntimeError("No const violations to report");
    }
    return violations.get(0);
  }

  private static String summary(List<ConstMutationException> violations) {
    StringBuilder sb = new StringBuilder();
    sb.append(violations.size());
    sb.append(violations.size() == 1 ? " const violation" :
                                       " const violations");
    for (ConstMutationException v: violations) {
      sb.append("\n  ");
      sb.append(v.getMessage());
    }
    return sb.toString();
  }

  public List<ConstMutationException> getViolations() {
    return violations;
  }

  public List<Diagnostic> toDiagnostics() {
    List<Diagnostic> result = new ArrayList<Diagnostic>(violations.size());
    for (ConstMutationException v: violations) {
      result.add(v.toDiagnostic());
    }
    return result;
  }

  private static final long serialVersionUID = 1L;
}
