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

import exm.moxie.ast.ExprPrinter;
import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieAST.LoweredForm;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.UnresolvedTypeException;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.common.lang.RuntimeHelpers.Helper;
import exm.moxie.common.lang.Types;
import exm.moxie.common.lang.Types.Type;
import exm.moxie.frontend.TransformContext;
import exm.moxie.frontend.tree.Assignment;

/**
 * Lower + on byte strings and slices to runtime helper calls:
 * <pre>
 *   s1 + s2           =&gt;  moxie.Concat(s1, s2)
 *   xs + ys           =&gt;  moxie.ConcatSlice[int32](xs, ys)
 *   s += t            =&gt;  s = moxie.Concat(s, t)
 * </pre>
 * Operands are rewritten before the expressions containing them, so the
 * type of a lowered operand is visible when its parent is lowered.  The
 * pass is repeated until nothing changes.
 */
public class ConcatLowering implements RewritePass {

  private static final String PLUS = "+";
  private static final String PLUS_ASSIGN = "+=";

  @Override
  public String getPassName() {
    return "Concatenation lowering";
  }

  @Override
  public boolean isFixedPoint() {
    return true;
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
    protected MoxieAST exit(MoxieAST node) throws UserException {
      if (node.getType() == MoxieTokens.BINARY &&
          node.getText().equals(PLUS)) {
        return lowerBinary(node);
      } else if (node.getType() == MoxieTokens.ASSIGN &&
                 node.getText().equals(PLUS_ASSIGN)) {
        return lowerPlusAssign(node);
      }
      return node;
    }

    private MoxieAST lowerBinary(MoxieAST plus) throws UserException {
      MoxieAST x = plus.child(0);
      MoxieAST y = plus.child(1);
      if (!canLower(plus, x, y)) {
        return plus;
      }
      MoxieAST.Slot slot = plus.slot();
      MoxieAST call = concatCall(plus, x, y);
      replace(slot, plus, call);
      return call;
    }

    /**
     * x += y becomes x = concat(x, y)
     */
    private MoxieAST lowerPlusAssign(MoxieAST assign) throws UserException {
      Assignment a = Assignment.fromAST(assign);
      if (a.lVals.size() != 1 || a.rValExprs.size() != 1) {
        return assign;
      }
      MoxieAST target = a.lVals.get(0);
      MoxieAST value = a.rValExprs.get(0);
      if (!canLower(assign, target, value)) {
        return assign;
      }
      MoxieAST.Slot slot = assign.slot();
      MoxieAST call = concatCall(assign, target.copyTree(), value);
      MoxieAST result = Trees.assign(Assignment.ASSIGN, target, call);
      replace(slot, assign, result);
      return result;
    }

    private boolean canLower(MoxieAST node, MoxieAST x, MoxieAST y) {
      if (node.hasAncestor(MoxieTokens.CONST_DECL)) {
        return false;
      }
      if (Types.isGoString(types.inferExprType(x)) ||
          Types.isGoString(types.inferExprType(y))) {
        // Base language strings, e.g. literals left alone by
        // literalization or elements of []string
        return false;
      }
      return isSliceLike(x) || isSliceLike(y);
    }

    private boolean isSliceLike(MoxieAST expr) {
      if (expr.isLoweredFrom(LoweredForm.STRING_LITERAL) ||
          types.isHelperCall(expr, Helper.CONCAT) ||
          types.isHelperCall(expr, Helper.CONCAT_SLICE)) {
        return true;
      }
      MoxieAST lit = expr;
      if (lit.getType() == MoxieTokens.UNARY && lit.getText().equals("&")) {
        lit = lit.child(0);
      }
      if (lit.getType() == MoxieTokens.COMPOSITE_LIT &&
          lit.child(0).getType() == MoxieTokens.SLICE_TYPE) {
        return true;
      }
      return types.isSliceType(types.inferExprType(expr));
    }

    /**
     * Pick the helper from the operand types
     * @param node node being lowered, for error positions
     */
    private MoxieAST concatCall(MoxieAST node, MoxieAST x, MoxieAST y)
                                              throws UserException {
      Type xType = types.inferExprType(x);
      Type yType = types.inferExprType(y);
      if (Types.isByteString(xType) || Types.isByteString(yType)) {
        return Trees.call(context.runtimeRef(Helper.CONCAT), x, y);
      }

      Type elem = types.elementType(xType);
      if (elem.isUnknown()) {
        elem = types.elementType(yType);
      }
      if (elem.isUnknown()) {
        throw new UnresolvedTypeException(context.positionOf(node),
            "cannot determine element type of slice concatenation " +
            ExprPrinter.print(node));
      }
      MoxieAST fun = context.runtimeRef(Helper.CONCAT_SLICE,
                                        Types.toTypeExpr(elem));
      return Trees.call(fun, x, y);
    }
  }
}
