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

import java.util.List;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.common.lang.Builtins;
import exm.moxie.common.util.Pair;
import exm.moxie.frontend.TransformContext;
import exm.moxie.frontend.tree.Assignment;
import exm.moxie.frontend.tree.CompositeLiteral;
import exm.moxie.frontend.tree.FunctionCall;
import exm.moxie.frontend.tree.Literals;

/**
 * Slices, maps and channels are held by pointer in the dialect.  Rewrite
 * the sites where the base language needs the value behind the pointer:
 * <ul>
 * <li>x = append(x, ...) becomes *x = append(*x, ...)</li>
 * <li>clear(m) becomes clear(*m)</li>
 * <li>channel literals &amp;chan T{n} become make(chan T, n)</li>
 * <li>the string type becomes *[]byte where a value's type is declared</li>
 * </ul>
 */
public class ReferencePointerization implements RewritePass {

  @Override
  public String getPassName() {
    return "Reference pointerization";
  }

  @Override
  public boolean isFixedPoint() {
    return false;
  }

  @Override
  public boolean apply(TransformContext context, MoxieAST file)
                                              throws UserException {
    return new Rewriter(context).rewrite(file);
  }

  private static class Rewriter extends TreeRewriter {

    public Rewriter(TransformContext context) {
      super(context);
    }

    @Override
    protected boolean enter(MoxieAST node) throws UserException {
      if (node.getType() == MoxieTokens.UNARY && node.getText().equals("&")
          && isChanLiteral(node.child(0))) {
        replace(node, makeChan(node.child(0)));
        return false;
      } else if (isChanLiteral(node)) {
        // Written without the &
        replace(node, makeChan(node));
        return false;
      }
      return true;
    }

    @Override
    protected MoxieAST exit(MoxieAST node) throws UserException {
      switch (node.getType()) {
        case MoxieTokens.ASSIGN:
          derefAppends(node);
          break;
        case MoxieTokens.CALL: {
          FunctionCall call = FunctionCall.fromAST(node);
          if (call.isCallTo(Builtins.CLEAR) && call.args().size() == 1 &&
              call.arg(0).getType() != MoxieTokens.STAR) {
            wrapInStar(call.arg(0));
          }
          break;
        }
        case MoxieTokens.IDENT:
          if (node.getText().equals(Builtins.STRING) && isDeclaredType(node)) {
            MoxieAST byteString = Trees.byteStringType();
            replace(node, byteString);
            return byteString;
          }
          break;
        default:
          break;
      }
      return node;
    }

    /**
     * s = append(s, x) becomes *s = append(*s, x)
     */
    private void derefAppends(MoxieAST assignment) {
      Assignment assign = Assignment.fromAST(assignment);
      for (Pair<MoxieAST, MoxieAST> p: assign.getMatchedAssignments()) {
        MoxieAST target = p.val1;
        MoxieAST expr = p.val2;
        if (expr == null || expr.getType() != MoxieTokens.CALL) {
          continue;
        }
        FunctionCall call = FunctionCall.fromAST(expr);
        if (!call.isCallTo(Builtins.APPEND) || call.args().isEmpty()) {
          continue;
        }
        if (call.arg(0).getType() != MoxieTokens.STAR) {
          wrapInStar(call.arg(0));
        }
        // := declares a new name, which can't be dereferenced
        if (!assign.isDefine() && target.getType() != MoxieTokens.STAR) {
          wrapInStar(target);
        }
      }
    }

    /**
     * Type expression children that declare the type of a value:
     * fields, parameters, results, var specs and type assertions
     */
    private boolean isDeclaredType(MoxieAST ident) {
      MoxieAST parent = ident.parent();
      if (parent == null || ident.getChildIndex() != 1) {
        return false;
      }
      switch (parent.getType()) {
        case MoxieTokens.FIELD:
        case MoxieTokens.VALUE_SPEC:
        case MoxieTokens.TYPE_ASSERT:
          return true;
        default:
          return false;
      }
    }

    private boolean isChanLiteral(MoxieAST node) {
      if (node.getType() != MoxieTokens.COMPOSITE_LIT) {
        return false;
      }
      MoxieAST type = node.child(0);
      return type.getType() == MoxieTokens.CHAN_TYPE || isChanMarker(type);
    }

    /**
     * @return true for __MoxieChan[T] and the directional variants
     */
    private boolean isChanMarker(MoxieAST type) {
      return type.getType() == MoxieTokens.INDEX &&
             type.child(0).getType() == MoxieTokens.IDENT &&
             Builtins.CHAN_MARKERS.contains(type.child(0).getText()) &&
             type.childCount() == 2;
    }

    /**
     * Build make(chan T) or make(chan T, n) from a channel literal
     */
    private MoxieAST makeChan(MoxieAST lit) {
      CompositeLiteral chanLit = CompositeLiteral.fromAST(lit);
      MoxieAST type = chanLit.type();
      MoxieAST chanType;
      if (type.getType() == MoxieTokens.CHAN_TYPE) {
        chanType = type;
      } else {
        String dir = Builtins.markerDirection(type.child(0).getText());
        chanType = Trees.chanType(dir, type.child(1));
      }

      List<MoxieAST> elems = chanLit.elements();
      MoxieAST capacity = elems.isEmpty() ? null : elems.get(0);
      if (capacity != null) {
        Long value = Literals.extractIntLit(capacity);
        if (value != null && value == 0) {
          // Unbuffered
          capacity = null;
        }
      }

      MoxieAST make = capacity == null ?
          Trees.call(Trees.ident(Builtins.MAKE), chanType) :
          Trees.call(Trees.ident(Builtins.MAKE), chanType, capacity);
      make.markSynthetic();
      return make;
    }
  }
}
