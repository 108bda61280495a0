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
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  private final DiagnosticKind kind;
  private final FilePosition position;
  private final String rawMessage;

  public UserException(DiagnosticKind kind, FilePosition position,
                       String message) {
    super(position + ": " + message);
    this.kind = kind;
    this.position = position;
    this.rawMessage = message;
  }

  public DiagnosticKind getKind() {
    return kind;
  }

  public FilePosition getPosition() {
    return position;
  }

  /**
   * @return message without location prefix
   */
  public String getRawMessage() {
    return rawMessage;
  }

  public Diagnostic toDiagnostic() {
    return new Diagnostic(kind, rawMessage, position, null);
  }

  private static final long serialVersionUID = 1L;
}
