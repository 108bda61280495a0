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

import java.util.ArrayList;
import java.util.List;

import exm.moxie.ast.ExprPrinter;
import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.InvalidSyntaxException;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.common.lang.Builtins;
import exm.moxie.common.lang.RuntimeHelpers;
import exm.moxie.common.lang.RuntimeHelpers.Helper;
import exm.moxie.common.lang.Types;
import exm.moxie.common.lang.Types.Type;
import exm.moxie.common.util.Pair;
import exm.moxie.frontend.Diagnostic;
import exm.moxie.frontend.DiagnosticKind;
import exm.moxie.frontend.LogHelper;
import exm.moxie.frontend.TransformContext;
import exm.moxie.frontend.tree.FunctionCall;

/**
 * Dispatch the generic memory built-ins clone, copy, grow and free to
 * the runtime helper for their argument's type, and lower conversions
 * between strings, integers and runes.
 */
public class BuiltinDispatch implements RewritePass {

  @Override
  public String getPassName() {
    return "Built-in dispatch";
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
    protected MoxieAST exit(MoxieAST node) throws UserException {
      if (node.getType() != MoxieTokens.CALL) {
        return node;
      }
      FunctionCall call = FunctionCall.fromAST(node);
      if (call.isUnqualified() && !types.isBound(call.name())) {
        if (Builtins.MEMORY_BUILTINS.contains(call.name())) {
          dispatchMemoryBuiltin(call);
          return node;
        } else if (call.name().equals(Builtins.STRING)) {
          return lowerStringConversion(call);
        }
      }
      if (isRuneSliceConversion(call)) {
        return lowerToHelper(call, Helper.STRING_TO_RUNES, call.arg(0));
      }
      return node;
    }

    /**
     * clone(s) becomes moxie.CloneSlice[T](s), etc.  The callee is
     * replaced and the arguments are kept.
     */
    private void dispatchMemoryBuiltin(FunctionCall call)
                                              throws UserException {
      String builtin = call.name();
      if (call.args().isEmpty()) {
        throw new InvalidSyntaxException(context.positionOf(call.tree()),
                            builtin + "() requires at least one argument");
      }

      Type t = types.inferExprType(call.arg(0));
      Helper helper;
      List<MoxieAST> typeArgs = new ArrayList<MoxieAST>();
      if (types.isSliceType(t)) {
        helper = RuntimeHelpers.sliceVariant(builtin);
        typeArgs.add(Types.toTypeExpr(types.elementType(t)));
      } else if (types.isMapType(t)) {
        helper = RuntimeHelpers.mapVariant(builtin);
        Pair<Type, Type> kv = types.keyValueTypes(t);
        typeArgs.add(Types.toTypeExpr(kv.val1));
        typeArgs.add(Types.toTypeExpr(kv.val2));
      } else {
        helper = RuntimeHelpers.fallbackVariant(builtin);
        if (t.isUnknown()) {
          warnUnresolved(call);
        } else if (helper.typeParams() > 0) {
          typeArgs.add(Types.toTypeExpr(Types.stripPointer(t)));
        }
      }

      if (LogHelper.isDebugEnabled()) {
        LogHelper.debug(context, builtin + "() on " + t + " dispatched to "
                                 + helper.goName());
      }
      MoxieAST oldFun = call.tree().child(0);
      replace(oldFun, context.runtimeRef(helper, typeArgs));
    }

    private void warnUnresolved(FunctionCall call) {
      if (!context.getSettings().warnUnresolvedDispatch()) {
        return;
      }
      String msg = "type of " + ExprPrinter.print(call.arg(0)) +
          " is unknown: " + call.name() + "() falls back to reflection";
      context.addWarning(new Diagnostic(DiagnosticKind.UNRESOLVED_TYPE_WARNING,
                         msg, context.positionOf(call.tree()), null));
    }

    /**
     * string(x): the helper depends on what x is
     */
    private MoxieAST lowerStringConversion(FunctionCall call) {
      if (call.args().size() != 1) {
        return call.tree();
      }
      MoxieAST arg = call.arg(0);
      switch (arg.getType()) {
        case MoxieTokens.INT_LIT:
          return lowerToHelper(call, Helper.INT_TO_STRING, arg);
        case MoxieTokens.CHAR_LIT:
          return lowerToHelper(call, Helper.RUNE_TO_STRING, arg);
        case MoxieTokens.STAR:
          // string(*runes)
          return lowerToHelper(call, Helper.RUNES_TO_STRING, arg.child(0));
        default:
          break;
      }

      Type t = types.inferExprType(arg);
      if (Types.isRune(t)) {
        return lowerToHelper(call, Helper.RUNE_TO_STRING, arg);
      } else if (Types.isInteger(t)) {
        return lowerToHelper(call, Helper.INT_TO_STRING, arg);
      } else if (isRuneSlice(t)) {
        return lowerToHelper(call, Helper.RUNES_TO_STRING, arg);
      } else if (t.isUnknown()) {
        if (context.getSettings().warnUnresolvedDispatch()) {
          context.addWarning(new Diagnostic(
              DiagnosticKind.UNRESOLVED_TYPE_WARNING,
              "type of " + ExprPrinter.print(arg) +
              " is unknown: string() assumes an integer",
              context.positionOf(call.tree()), null));
        }
        return lowerToHelper(call, Helper.INT_TO_STRING, arg);
      }
      // Already a string, or a type the base language converts itself
      return call.tree();
    }

    private boolean isRuneSlice(Type t) {
      Type inner = Types.stripPointer(t);
      return inner.kind() == Types.Kind.SLICE &&
             Types.isRune(types.elementType(inner));
    }

    /**
     * []rune(s) or *[]rune(s), without parentheses around the type
     */
    private boolean isRuneSliceConversion(FunctionCall call) {
      if (call.args().size() != 1) {
        return false;
      }
      MoxieAST fun = call.tree().child(0);
      if (fun.getType() == MoxieTokens.STAR) {
        fun = fun.child(0);
      }
      return fun.getType() == MoxieTokens.SLICE_TYPE &&
             fun.child(0).getType() == MoxieTokens.IDENT &&
             Types.isRune(Types.fromTypeExpr(fun.child(0)));
    }

    private MoxieAST lowerToHelper(FunctionCall call, Helper helper,
                                   MoxieAST arg) {
      MoxieAST.Slot slot = call.tree().slot();
      MoxieAST result = Trees.call(context.runtimeRef(helper), arg);
      replace(slot, call.tree(), result);
      return result;
    }
  }
}
