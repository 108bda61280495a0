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
package exm.moxie.ast;

import java.util.List;

/**
 * Render expressions and type expressions as base language source text,
 * for use in messages and logs.
 */
public class ExprPrinter {

  public static String print(MoxieAST tree) {
    StringBuilder sb = new StringBuilder();
    print(sb, tree);
    return sb.toString();
  }

  private static void print(StringBuilder sb, MoxieAST tree) {
    switch (tree.getType()) {
      case MoxieTokens.IDENT:
      case MoxieTokens.INT_LIT:
      case MoxieTokens.FLOAT_LIT:
      case MoxieTokens.CHAR_LIT:
      case MoxieTokens.STRING_LIT:
        sb.append(tree.getText());
        break;
      case MoxieTokens.EMPTY:
        break;
      case MoxieTokens.BINARY:
        print(sb, tree.child(0));
        sb.append(' ').append(tree.getText()).append(' ');
        print(sb, tree.child(1));
        break;
      case MoxieTokens.UNARY:
        sb.append(tree.getText());
        print(sb, tree.child(0));
        break;
      case MoxieTokens.STAR:
        sb.append('*');
        print(sb, tree.child(0));
        break;
      case MoxieTokens.PAREN:
        sb.append('(');
        print(sb, tree.child(0));
        sb.append(')');
        break;
      case MoxieTokens.SELECTOR:
        print(sb, tree.child(0));
        sb.append('.');
        print(sb, tree.child(1));
        break;
      case MoxieTokens.INDEX:
        print(sb, tree.child(0));
        sb.append('[');
        printList(sb, tree.children(1));
        sb.append(']');
        break;
      case MoxieTokens.CALL:
        print(sb, tree.child(0));
        sb.append('(');
        printList(sb, tree.children(1));
        sb.append(')');
        break;
      case MoxieTokens.COMPOSITE_LIT:
        print(sb, tree.child(0));
        sb.append('{');
        printList(sb, tree.children(1));
        sb.append('}');
        break;
      case MoxieTokens.KEY_VALUE:
        print(sb, tree.child(0));
        sb.append(": ");
        print(sb, tree.child(1));
        break;
      case MoxieTokens.TYPE_ASSERT:
        print(sb, tree.child(0));
        sb.append(".(");
        print(sb, tree.child(1));
        sb.append(')');
        break;
      case MoxieTokens.SLICE_TYPE:
        sb.append("[]");
        print(sb, tree.child(0));
        break;
      case MoxieTokens.ARRAY_TYPE:
        sb.append('[');
        print(sb, tree.child(0));
        sb.append(']');
        print(sb, tree.child(1));
        break;
      case MoxieTokens.MAP_TYPE:
        sb.append("map[");
        print(sb, tree.child(0));
        sb.append(']');
        print(sb, tree.child(1));
        break;
      case MoxieTokens.CHAN_TYPE:
        sb.append(tree.getText()).append(' ');
        print(sb, tree.child(0));
        break;
      case MoxieTokens.STRUCT_TYPE:
        sb.append(tree.childCount() == 0 ? "struct{}" : "struct{...}");
        break;
      case MoxieTokens.INTERFACE_TYPE:
        sb.append(tree.childCount() == 0 ? "interface{}" : "interface{...}");
        break;
      case MoxieTokens.FUNC_TYPE:
      case MoxieTokens.FUNC_LIT:
        sb.append("func(...)");
        break;
      default:
        sb.append(MoxieTokens.tokName(tree.getType()));
        break;
    }
  }

  private static void printList(StringBuilder sb, List<MoxieAST> trees) {
    boolean first = true;
    for (MoxieAST t: trees) {
      if (first) {
        first = false;
      } else {
        sb.append(", ");
      }
      print(sb, t);
    }
  }
}
