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

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.InvalidSyntaxException;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.common.lang.Builtins;
import exm.moxie.common.lang.RuntimeHelpers.Helper;
import exm.moxie.common.lang.Types;
import exm.moxie.common.lang.Types.Type;
import exm.moxie.frontend.TransformContext;

/**
 * Lower zero-copy slice coercions:
 * <pre>
 *   (*[]uint32)(buf)               =&gt;  moxie.Coerce[byte, uint32](buf)
 *   (*[]uint32)(buf, BigEndian)    =&gt;  moxie.Coerce[byte, uint32](buf, moxie.BigEndian)
 * </pre>
 */
public class CoercionLowering implements RewritePass {

  @Override
  public String getPassName() {
    return "Coercion lowering";
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
      switch (node.getType()) {
        case MoxieTokens.IDENT:
          if (isEndianTag(node)) {
            MoxieAST ref = Trees.selector(Trees.ident(context.runtimeAlias()),
                                          node.getText());
            context.requireRuntime();
            replace(node, ref);
            return ref;
          }
          return node;
        case MoxieTokens.CALL: {
          MoxieAST target = coercionTarget(node.child(0));
          if (target != null) {
            return lowerCoercion(node, target);
          }
          return node;
        }
        default:
          return node;
      }
    }

    /**
     * @param fun callee
     * @return U for a callee (*[]U), otherwise null
     */
    private MoxieAST coercionTarget(MoxieAST fun) {
      if (fun.getType() == MoxieTokens.PAREN) {
        fun = fun.child(0);
      }
      if (fun.getType() != MoxieTokens.STAR ||
          fun.child(0).getType() != MoxieTokens.SLICE_TYPE) {
        return null;
      }
      return fun.child(0).child(0);
    }

    private MoxieAST lowerCoercion(MoxieAST call, MoxieAST target)
                                              throws UserException {
      List<MoxieAST> args = call.children(1);
      if (args.isEmpty() || args.size() > 2) {
        throw new InvalidSyntaxException(context.positionOf(call),
            "slice coercion takes a source and an optional byte order, " +
            "but got " + args.size() + " arguments");
      }
      Type srcElem = types.elementType(types.inferExprType(args.get(0)));
      if (srcElem.isUnknown()) {
        srcElem = Types.BYTE;
      }

      List<MoxieAST> typeArgs = new ArrayList<MoxieAST>();
      typeArgs.add(Types.toTypeExpr(srcElem));
      typeArgs.add(target);
      MoxieAST.Slot slot = call.slot();
      MoxieAST result = Trees.call(context.runtimeRef(Helper.COERCE, typeArgs),
                                   new ArrayList<MoxieAST>(args));
      replace(slot, call, result);
      return result;
    }

    private boolean isEndianTag(MoxieAST ident) {
      if (!Builtins.ENDIAN_TAGS.contains(ident.getText())) {
        return false;
      }
      return isFreeName(ident);
    }
  }
}
