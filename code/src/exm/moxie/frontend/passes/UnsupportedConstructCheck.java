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
import exm.moxie.ast.MoxieTokens;
import exm.moxie.common.exceptions.UnsupportedConstructException;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.common.lang.Builtins;
import exm.moxie.frontend.TransformContext;
import exm.moxie.frontend.tree.FunctionCall;

/**
 * Reject calls to make written in the source.  Slices, maps and channels
 * are created with composite literals instead.  Calls to make that
 * channel lowering produced are allowed.
 */
public class UnsupportedConstructCheck implements RewritePass {

  @Override
  public String getPassName() {
    return "Unsupported construct check";
  }

  @Override
  public boolean isFixedPoint() {
    return false;
  }

  @Override
  public boolean apply(TransformContext context, MoxieAST file)
                                              throws UserException {
    new Checker(context).rewrite(file);
    return false;
  }

  private static class Checker extends TreeRewriter {

    public Checker(TransformContext context) {
      super(context);
    }

    @Override
    protected boolean enter(MoxieAST node) throws UserException {
      if (node.getType() == MoxieTokens.CALL && !node.isSynthetic()) {
        FunctionCall call = FunctionCall.fromAST(node);
        if (call.isCallTo(Builtins.MAKE) && !types.isBound(Builtins.MAKE)) {
          throw new UnsupportedConstructException(context.positionOf(node),
              "make() is not supported: " + ExprPrinter.print(node) +
              ". Use &[]T{}, &map[K]V{} or &chan T{} instead");
        }
      }
      return true;
    }
  }
}
