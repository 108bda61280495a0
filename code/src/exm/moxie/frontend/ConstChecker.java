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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.moxie.ast.FilePosition;
import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.common.Logging;
import exm.moxie.common.exceptions.ConstMutationException;
import exm.moxie.common.exceptions.ConstViolationsException;
import exm.moxie.common.exceptions.MoxieRuntimeError;
import exm.moxie.frontend.tree.Assignment;

/**
 * Finds assignments and increments of names declared const.
 *
 * Runs in two phases over a file: first every const declaration is
 * collected, then every assignment and increment/decrement statement is
 * checked.  Tracking is per file, not per scope.  A checker is used for
 * one file only.
 */
public class ConstChecker {

  private static final Logger logger = Logging.getMoxieLogger();

  private static enum State {
    COLLECTING,
    CHECKING,
    DONE,
  }

  private final String inputFile;
  private State state = State.COLLECTING;

  /** Declaration positions, last declaration of each name */
  private final Map<String, FilePosition> consts =
                          new LinkedHashMap<String, FilePosition>();

  private final List<ConstMutationException> violations =
                          new ArrayList<ConstMutationException>();

  public ConstChecker(String inputFile) {
    this.inputFile = inputFile;
  }

  /**
   * Check the file
   * @param file FILE node, not modified
   * @return all violations, in tree order
   */
  public List<ConstMutationException> check(MoxieAST file) {
    if (state != State.COLLECTING) {
      throw new MoxieRuntimeError("Const checker already used for " +
                                  inputFile);
    }
    collect(file);
    state = State.CHECKING;
    logger.debug("Const declarations in " + inputFile + ": " +
                 consts.keySet());
    if (!consts.isEmpty()) {
      checkMutations(file);
    }
    state = State.DONE;
    return Collections.unmodifiableList(violations);
  }

  /**
   * As check(), but throw if there were any violations
   * @throws ConstViolationsException
   */
  public void checkOrThrow(MoxieAST file) throws ConstViolationsException {
    List<ConstMutationException> found = check(file);
    if (!found.isEmpty()) {
      throw new ConstViolationsException(found);
    }
  }

  /**
   * @return const names and their declaration positions
   */
  public Map<String, FilePosition> getDeclarations() {
    return Collections.unmodifiableMap(consts);
  }

  private void collect(MoxieAST tree) {
    if (tree.getType() == MoxieTokens.CONST_DECL) {
      for (MoxieAST spec: tree.children()) {
        // Names of each VALUE_SPEC, grouped or not.  A later
        // declaration of the same name replaces the earlier one.
        for (MoxieAST name: spec.child(0).children()) {
          String n = name.getText();
          if (!n.equals("_")) {
            consts.put(n, name.position(inputFile));
          }
        }
      }
    }
    for (MoxieAST child: tree.children()) {
      collect(child);
    }
  }

  private void checkMutations(MoxieAST tree) {
    switch (tree.getType()) {
      case MoxieTokens.ASSIGN:
        for (MoxieAST target: tree.child(0).children()) {
          checkTarget(target);
        }
        break;
      case MoxieTokens.INC_DEC:
        checkTarget(tree.child(0));
        break;
      default:
        break;
    }
    for (MoxieAST child: tree.children()) {
      checkMutations(child);
    }
  }

  private void checkTarget(MoxieAST target) {
    MoxieAST base = Assignment.baseIdentifier(target);
    if (base == null) {
      return;
    }
    FilePosition declaredAt = consts.get(base.getText());
    if (declaredAt != null) {
      ConstMutationException violation = new ConstMutationException(
            base.position(inputFile), base.getText(), declaredAt);
      logger.debug(violation.getMessage());
      violations.add(violation);
    }
  }
}
