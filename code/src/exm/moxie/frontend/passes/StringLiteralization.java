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
import exm.moxie.ast.MoxieAST.LoweredForm;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.common.lang.Builtins;
import exm.moxie.frontend.TransformContext;
import exm.moxie.frontend.tree.FunctionCall;
import exm.moxie.frontend.tree.Literals;

/**
 * Lower string literals to mutable byte slices: "hi" becomes
 * &amp;[]byte{'h', 'i'}.
 *
 * Literals stay as they are in import paths, struct tags, constant
 * declarations, arguments to pass-through packages and where
 * {@link LiteralContextExemption} finds a base language string is
 * expected.
 */
public class StringLiteralization implements RewritePass {

  @Override
  public String getPassName() {
    return "String literalization";
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
    private final LiteralContextExemption exemption;

    public Rewriter(TransformContext context) {
      super(context);
      this.exemption = new LiteralContextExemption(types);
    }

    @Override
    protected boolean enter(MoxieAST node) throws UserException {
      switch (node.getType()) {
        case MoxieTokens.IMPORT_DECL:
          return false;
        case MoxieTokens.STRING_LIT:
          if (!isExempt(node)) {
            replace(node, lower(node));
          }
          return false;
        default:
          return true;
      }
    }

    private boolean isExempt(MoxieAST lit) {
      if (lit.hasAncestor(MoxieTokens.CONST_DECL)) {
        // Constants must stay constant expressions
        return true;
      }
      MoxieAST parent = lit.parent();
      int index = lit.getChildIndex();
      switch (parent.getType()) {
        case MoxieTokens.IMPORT_SPEC:
          return true;
        case MoxieTokens.FIELD:
          // Struct tag
          return index == 2;
        case MoxieTokens.CALL: {
          if (index == 0) {
            return false;
          }
          String pkg = FunctionCall.fromAST(parent).packageName();
          return pkg != null &&
                 context.getSettings().passthroughPackages().contains(pkg);
        }
        default:
          return exemption.isExempt(lit);
      }
    }

    private MoxieAST lower(MoxieAST lit) throws UserException {
      byte[] bytes = Literals.decodeStringLiteral(context.positionOf(lit),
                                                  lit.getText());
      List<MoxieAST> elems = new ArrayList<MoxieAST>(bytes.length);
      for (byte b: bytes) {
        elems.add(Trees.charLit(Literals.byteCharLit(b)));
      }
      MoxieAST sliceLit = Trees.compositeLit(
              Trees.sliceType(Trees.ident(Builtins.BYTE)), elems);
      sliceLit.markSynthetic().setLoweredFrom(LoweredForm.STRING_LITERAL);
      MoxieAST ref = Trees.addressOf(sliceLit);
      ref.markSynthetic().setLoweredFrom(LoweredForm.STRING_LITERAL);
      return ref;
    }
  }
}
