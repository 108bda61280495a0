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

import exm.moxie.ast.FilePosition;

/**
 * A message about a construct in the file being transformed.
 */
public class Diagnostic {
  public final DiagnosticKind kind;
  public final String message;
  public final FilePosition position;
  /** Other position the message refers to, null if none */
  public final FilePosition relatedPosition;

  public Diagnostic(DiagnosticKind kind, String message,
                    FilePosition position, FilePosition relatedPosition) {
    this.kind = kind;
    this.message = message;
    this.position = position;
    this.relatedPosition = relatedPosition;
  }

  public boolean isFatal() {
    return kind.isFatal();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(position);
    sb.append(": ");
    sb.append(isFatal() ? "error: " : "warning: ");
    sb.append(message);
    if (relatedPosition != null) {
      sb.append(" [see ");
      sb.append(relatedPosition);
      sb.append("]");
    }
    return sb.toString();
  }
}
