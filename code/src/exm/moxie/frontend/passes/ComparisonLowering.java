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

import com.google.common.collect.ImmutableSet;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieAST.LoweredForm;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.common.lang.Builtins;
import exm.moxie.common.lang.Types;
import exm.moxie.frontend.TransformContext;

/**
 * Compare byte strings by content rather than by pointer.
 * <pre>
 *   a == b   =&gt;  bytes.Equal(*a, *b)
 *   a != b   =&gt;  !bytes.Equal(*a, *b)
 *   a &lt; b    =&gt;  bytes.Compare(*a, *b) &lt; 0
 * </pre>
 */
public class ComparisonLowering implements RewritePass {

  private static final ImmutableSet<String> COMPARISON_OPS =
      ImmutableSet.of("==", "!=", "<", "<=", ">", ">=");

  private static final String EQUAL = "Equal";
  private static final String COMPARE = "Compare";

  @Override
  public String getPassName() {
    return "Comparison lowering";
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
      if (node.getType() != MoxieTokens.BINARY ||
          !COMPARISON_OPS.contains(node.getText()) ||
          node.hasAncestor(MoxieTokens.CONST_DECL)) {
        return node;
      }
      MoxieAST x = node.child(0);
      MoxieAST y = node.child(1);
      if (!Types.isByteString(types.inferExprType(x)) ||
          !Types.isByteString(types.inferExprType(y))) {
        return node;
      }

      String op = node.getText();
      MoxieAST.Slot slot = node.slot();
      MoxieAST result;
      if (op.equals("==")) {
        result = bytesCall(EQUAL, x, y);
      } else if (op.equals("!=")) {
        result = Trees.unary("!", bytesCall(EQUAL, x, y));
      } else {
        result = Trees.binary(op, bytesCall(COMPARE, x, y),
                              Trees.intLit("0"));
      }
      context.requireBytes();
      replace(slot, node, result);
      return result;
    }

    private MoxieAST bytesCall(String function, MoxieAST x, MoxieAST y) {
      MoxieAST fun = Trees.selector(Trees.ident(Builtins.BYTES_PACKAGE),
                                    function);
      return Trees.call(fun, contents(x), contents(y));
    }

    /**
     * The []byte behind a byte string operand
     */
    private MoxieAST contents(MoxieAST operand) {
      if (operand.isLoweredFrom(LoweredForm.STRING_LITERAL) &&
          operand.getType() == MoxieTokens.UNARY) {
        // &[]byte{...} is passed as []byte{...}
        return operand.child(0);
      }
      return Trees.star(operand);
    }
  }
}
