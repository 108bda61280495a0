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
import exm.moxie.ast.MoxieTokens;
import exm.moxie.common.lang.Builtins;
import exm.moxie.common.lang.Types;
import exm.moxie.common.lang.Types.Type;
import exm.moxie.common.util.Pair;
import exm.moxie.frontend.TypeTracker;
import exm.moxie.frontend.tree.Assignment;

/**
 * Decides whether a string literal keeps the base language string type
 * because of where it is used.  Container element types and struct field
 * types that were not lowered to the byte string are base language
 * strings, so a literal filling one must stay as it is.  The same goes for
 * a literal compared with, added to or assigned to a base language
 * string, and for a key into a map with string keys.
 */
public class LiteralContextExemption {

  private static final ImmutableSet<String> STRING_OPS = ImmutableSet.of(
      "+", "==", "!=", "<", "<=", ">", ">=");

  private final TypeTracker types;

  public LiteralContextExemption(TypeTracker types) {
    this.types = types;
  }

  /**
   * @param lit a STRING_LIT node
   * @return true if a base language string is expected where the literal
   *        appears
   */
  public boolean isExempt(MoxieAST lit) {
    MoxieAST parent = lit.parent();
    if (parent == null) {
      return false;
    }
    int index = lit.getChildIndex();
    switch (parent.getType()) {
      case MoxieTokens.COMPOSITE_LIT:
        return index >= 1 &&
               !acceptsByteString(parent, Position.ELEMENT, null);
      case MoxieTokens.KEY_VALUE: {
        MoxieAST outer = parent.parent();
        if (outer == null || outer.getType() != MoxieTokens.COMPOSITE_LIT) {
          return false;
        }
        if (index == 0) {
          return !acceptsByteString(outer, Position.KEY, null);
        }
        return !acceptsByteString(outer, Position.VALUE, fieldName(parent));
      }
      case MoxieTokens.BINARY:
        return STRING_OPS.contains(parent.getText()) &&
               isGoString(parent.child(1 - index));
      case MoxieTokens.INDEX:
        // m["k"] on a map with string keys
        return index == 1 && Types.isGoString(
            types.keyValueTypes(types.inferExprType(parent.child(0))).val1);
      case MoxieTokens.RHS:
        return assignsToGoString(parent.parent(), lit);
      default:
        return false;
    }
  }

  /**
   * @return true if expr is known to be a base language string.  Other
   *        literals don't count: they may yet be lowered.
   */
  private boolean isGoString(MoxieAST expr) {
    expr = unparen(expr);
    switch (expr.getType()) {
      case MoxieTokens.STRING_LIT:
        return false;
      case MoxieTokens.BINARY:
        return expr.getText().equals("+") &&
               (isGoString(expr.child(0)) || isGoString(expr.child(1)));
      default:
        return Types.isGoString(types.inferExprType(expr));
    }
  }

  private boolean assignsToGoString(MoxieAST assign, MoxieAST lit) {
    if (assign == null || assign.getType() != MoxieTokens.ASSIGN) {
      return false;
    }
    Assignment a = Assignment.fromAST(assign);
    if (a.isDefine()) {
      // A new name takes whatever type the literal has
      return false;
    }
    for (Pair<MoxieAST, MoxieAST> p: a.getMatchedAssignments()) {
      if (p.val2 == lit) {
        return isGoString(p.val1);
      }
    }
    return false;
  }

  private static enum Position {
    /** Element without key */
    ELEMENT,
    KEY,
    VALUE,
  }

  /**
   * @param compositeLit the literal the string appears in
   * @param pos where the string appears in it
   * @param field field name for keyed struct values, otherwise null
   */
  private boolean acceptsByteString(MoxieAST compositeLit, Position pos,
                                    String field) {
    MoxieAST type = literalType(compositeLit);
    if (type == null) {
      // Nothing to go on
      return true;
    }
    switch (type.getType()) {
      case MoxieTokens.SLICE_TYPE:
        return pos == Position.KEY || isByteStringType(type.child(0));
      case MoxieTokens.ARRAY_TYPE:
        // Keys of array literals are indices
        return pos == Position.KEY || isByteStringType(type.child(1));
      case MoxieTokens.MAP_TYPE:
        if (pos == Position.KEY) {
          return isByteStringType(type.child(0));
        }
        return isByteStringType(type.child(1));
      case MoxieTokens.STRUCT_TYPE:
        return acceptsField(anonymousFieldType(type, field));
      default:
        Type t = Types.fromTypeExpr(type);
        if (field != null && types.isStructType(t)) {
          return acceptsField(types.fieldType(t, field));
        }
        // Positional struct fields and types declared elsewhere
        return true;
    }
  }

  private static boolean acceptsField(Type fieldType) {
    return fieldType.isUnknown() || Types.isByteString(fieldType) ||
           fieldType.equals(Types.pointer(Types.slice(Types.BYTE)));
  }

  /**
   * Type of a composite literal, following elided types out to the
   * enclosing literal.
   * @return type expression without parentheses, or null if unknown
   */
  private MoxieAST literalType(MoxieAST compositeLit) {
    MoxieAST type = compositeLit.child(0);
    if (!type.isEmptyNode()) {
      return unparen(type);
    }

    MoxieAST parent = compositeLit.parent();
    if (parent == null) {
      return null;
    }
    MoxieAST outer;
    boolean isKey = false;
    if (parent.getType() == MoxieTokens.COMPOSITE_LIT) {
      outer = parent;
    } else if (parent.getType() == MoxieTokens.KEY_VALUE &&
               parent.parent() != null &&
               parent.parent().getType() == MoxieTokens.COMPOSITE_LIT) {
      outer = parent.parent();
      isKey = compositeLit.getChildIndex() == 0;
    } else {
      return null;
    }

    MoxieAST outerType = literalType(outer);
    if (outerType == null) {
      return null;
    }
    MoxieAST elem;
    switch (outerType.getType()) {
      case MoxieTokens.SLICE_TYPE:
        elem = outerType.child(0);
        break;
      case MoxieTokens.ARRAY_TYPE:
        elem = outerType.child(1);
        break;
      case MoxieTokens.MAP_TYPE:
        elem = isKey ? outerType.child(0) : outerType.child(1);
        break;
      default:
        return null;
    }
    elem = unparen(elem);
    if (elem.getType() == MoxieTokens.STAR) {
      // []*T{{...}} elides &T
      elem = unparen(elem.child(0));
    }
    return elem;
  }

  private static MoxieAST unparen(MoxieAST type) {
    while (type.getType() == MoxieTokens.PAREN) {
      type = type.child(0);
    }
    return type;
  }

  private static String fieldName(MoxieAST keyValue) {
    MoxieAST key = keyValue.child(0);
    if (key.getType() == MoxieTokens.IDENT) {
      return key.getText();
    }
    return null;
  }

  private static Type anonymousFieldType(MoxieAST structType, String field) {
    if (field == null) {
      return Types.UNKNOWN;
    }
    for (MoxieAST f: structType.children()) {
      for (MoxieAST name: f.child(0).children()) {
        if (name.getText().equals(field)) {
          return Types.fromTypeExpr(f.child(1));
        }
      }
    }
    return Types.UNKNOWN;
  }

  /**
   * The string type written inside container types is the base language
   * string: only an explicit or lowered *[]byte holds a byte string.
   */
  private static boolean isByteStringType(MoxieAST typeExpr) {
    typeExpr = unparen(typeExpr);
    if (typeExpr.getType() != MoxieTokens.STAR) {
      return false;
    }
    if (typeExpr.isLoweredFrom(MoxieAST.LoweredForm.STRING_TYPE)) {
      return true;
    }
    MoxieAST slice = unparen(typeExpr.child(0));
    return slice.getType() == MoxieTokens.SLICE_TYPE &&
           slice.child(0).getType() == MoxieTokens.IDENT &&
           slice.child(0).getText().equals(Builtins.BYTE);
  }
}
