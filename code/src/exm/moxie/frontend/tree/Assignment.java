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
package exm.moxie.frontend.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.common.util.Pair;

public class Assignment {
  public static final String DEFINE = ":=";
  public static final String ASSIGN = "=";

  public final String op;
  public final List<MoxieAST> lVals;
  public final List<MoxieAST> rValExprs;

  public Assignment(String op, List<MoxieAST> lVals,
                    List<MoxieAST> rValExprs) {
    super();
    this.op = op;
    this.lVals = Collections.unmodifiableList(new ArrayList<MoxieAST>(lVals));
    this.rValExprs = Collections.unmodifiableList(
                                         new ArrayList<MoxieAST>(rValExprs));
  }

  public boolean isDefine() {
    return op.equals(DEFINE);
  }

  /**
   * @return true for = and :=, false for compound assignment
   */
  public boolean isSimple() {
    return op.equals(DEFINE) || op.equals(ASSIGN);
  }

  /**
   * Match up lvals and corresponding rvals.  With a single multi-valued
   * expression on the right, each lval is paired with null.
   * @return List of paired lvals and rvals
   */
  public List<Pair<MoxieAST, MoxieAST>> getMatchedAssignments() {
    List<Pair<MoxieAST, MoxieAST>> paired =
              new ArrayList<Pair<MoxieAST, MoxieAST>>();
    boolean matched = lVals.size() == rValExprs.size();
    for (int i = 0; i < lVals.size(); i++) {
      paired.add(Pair.create(lVals.get(i), matched ? rValExprs.get(i) : null));
    }
    return paired;
  }

  /**
   * Find the variable an assignment target writes to, looking through
   * dereferences, field selection, indexing and parentheses
   * @param target
   * @return IDENT node, or null if there is none (e.g. a call result)
   */
  public static MoxieAST baseIdentifier(MoxieAST target) {
    MoxieAST curr = target;
    while (true) {
      switch (curr.getType()) {
        case MoxieTokens.IDENT:
          return curr;
        case MoxieTokens.STAR:
        case MoxieTokens.PAREN:
        case MoxieTokens.SELECTOR:
        case MoxieTokens.INDEX:
          curr = curr.child(0);
          break;
        default:
          return null;
      }
    }
  }

  public static final Assignment fromAST(MoxieAST tree) {
    assert(tree.getType() == MoxieTokens.ASSIGN);
    return new Assignment(tree.getText(), tree.child(0).children(),
                          tree.child(1).children());
  }
}
