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

import org.apache.commons.lang3.StringUtils;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.InvalidSyntaxException;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.common.lang.Builtins;
import exm.moxie.common.lang.RuntimeHelpers.Helper;
import exm.moxie.frontend.TransformContext;
import exm.moxie.frontend.tree.FunctionCall;

/**
 * Route the dynamic library built-ins and their flags through the
 * runtime: dlsym[T](h, "f") becomes moxie.Dlsym[T](h, "f") and RTLD_NOW
 * becomes moxie.RTLD_NOW.
 */
public class ForeignLibraryLowering implements RewritePass {

  @Override
  public String getPassName() {
    return "Foreign library lowering";
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
        case MoxieTokens.CALL:
          lowerCall(FunctionCall.fromAST(node));
          return node;
        case MoxieTokens.IDENT:
          if (Builtins.DL_FLAGS.contains(node.getText()) && isFreeName(node)) {
            MoxieAST ref = Trees.selector(Trees.ident(context.runtimeAlias()),
                                          node.getText());
            context.requireRuntime();
            replace(node, ref);
            return ref;
          }
          return node;
        default:
          return node;
      }
    }

    private void lowerCall(FunctionCall call) throws UserException {
      if (!call.isUnqualified() ||
          !Builtins.DL_FUNCTIONS.contains(call.name()) ||
          types.isBound(call.name())) {
        return;
      }
      Helper helper = Helper.fromGoName(StringUtils.capitalize(call.name()));
      List<MoxieAST> typeArgs = new ArrayList<MoxieAST>(call.typeArgs());
      if (!typeArgs.isEmpty() && typeArgs.size() != helper.typeParams()) {
        throw new InvalidSyntaxException(context.positionOf(call.tree()),
            call.name() + " takes " + helper.typeParams() +
            " type arguments, but got " + typeArgs.size());
      }
      replace(call.tree().child(0), context.runtimeRef(helper, typeArgs));
    }
  }
}
