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

/**
 * Node types of the Moxie tree.  The front end maps each node of the
 * base language parse tree onto one of these.
 *
 * Child layouts are documented next to each constant.
 */
public final class MoxieTokens {

  private MoxieTokens() {}

  /** Placeholder for an absent optional child */
  public static final int EMPTY = 4;

  // Declarations and file structure
  /** text: file name.  children: PACKAGE, then top level declarations */
  public static final int FILE = 5;
  /** text: package name */
  public static final int PACKAGE = 6;
  /** children: IMPORT_SPEC* */
  public static final int IMPORT_DECL = 7;
  /** text: quoted path.  children: IDENT alias? */
  public static final int IMPORT_SPEC = 8;
  /** text: function name.  children: RECEIVER?, PARAMS, RESULTS, BLOCK? */
  public static final int FUNC_DECL = 9;
  public static final int RECEIVER = 10;
  public static final int PARAMS = 11;
  public static final int RESULTS = 12;
  /** children: NAMES, type, STRING_LIT tag? */
  public static final int FIELD = 13;
  /** children: IDENT* */
  public static final int NAMES = 14;
  /** children: TYPE_SPEC* */
  public static final int TYPE_DECL = 15;
  /** text: type name.  children: type */
  public static final int TYPE_SPEC = 16;
  /** children: VALUE_SPEC* */
  public static final int VAR_DECL = 17;
  /** children: VALUE_SPEC* */
  public static final int CONST_DECL = 18;
  /** children: NAMES, type or EMPTY, VALUES */
  public static final int VALUE_SPEC = 19;
  /** children: expr* */
  public static final int VALUES = 20;

  // Statements
  public static final int BLOCK = 21;
  /** text: assignment operator.  children: LHS, RHS */
  public static final int ASSIGN = 22;
  public static final int LHS = 23;
  public static final int RHS = 24;
  /** text: ++ or --.  children: expr */
  public static final int INC_DEC = 25;
  public static final int EXPR_STMT = 26;
  public static final int RETURN = 27;
  /** children: init or EMPTY, cond, BLOCK, else? */
  public static final int IF = 28;
  /** children: init or EMPTY, cond or EMPTY, post or EMPTY, BLOCK */
  public static final int FOR = 29;
  /** text: := or =.  children: key or EMPTY, value or EMPTY, expr, BLOCK */
  public static final int RANGE = 30;

  // Expressions
  public static final int IDENT = 31;
  public static final int INT_LIT = 32;
  public static final int FLOAT_LIT = 33;
  public static final int CHAR_LIT = 34;
  /** text: the literal as written, with quotes or backquotes */
  public static final int STRING_LIT = 35;
  /** text: operator.  children: X, Y */
  public static final int BINARY = 36;
  /** text: operator.  children: X */
  public static final int UNARY = 37;
  /** Dereference or pointer type.  children: X */
  public static final int STAR = 38;
  public static final int PAREN = 39;
  /** children: X, IDENT */
  public static final int SELECTOR = 40;
  /** children: X, index+.  Also used for type argument lists */
  public static final int INDEX = 41;
  /** children: fun, args* */
  public static final int CALL = 42;
  /** children: type or EMPTY, elements* */
  public static final int COMPOSITE_LIT = 43;
  /** children: key, value */
  public static final int KEY_VALUE = 44;
  /** children: X, type */
  public static final int TYPE_ASSERT = 45;
  /** children: FUNC_TYPE, BLOCK */
  public static final int FUNC_LIT = 46;

  // Types
  /** children: elem */
  public static final int SLICE_TYPE = 47;
  /** children: len, elem */
  public static final int ARRAY_TYPE = 48;
  /** children: key, value */
  public static final int MAP_TYPE = 49;
  /** text: chan, chan&lt;- or &lt;-chan.  children: elem */
  public static final int CHAN_TYPE = 50;
  /** children: FIELD* */
  public static final int STRUCT_TYPE = 51;
  /** children: PARAMS, RESULTS */
  public static final int FUNC_TYPE = 52;
  public static final int INTERFACE_TYPE = 53;

  public static final String[] tokenNames = new String[] {
    "<invalid>", "<EOR>", "<DOWN>", "<UP>",
    "EMPTY", "FILE", "PACKAGE", "IMPORT_DECL", "IMPORT_SPEC", "FUNC_DECL",
    "RECEIVER", "PARAMS", "RESULTS", "FIELD", "NAMES", "TYPE_DECL",
    "TYPE_SPEC", "VAR_DECL", "CONST_DECL", "VALUE_SPEC", "VALUES",
    "BLOCK", "ASSIGN", "LHS", "RHS", "INC_DEC", "EXPR_STMT", "RETURN", "IF",
    "FOR", "RANGE", "IDENT", "INT_LIT", "FLOAT_LIT", "CHAR_LIT",
    "STRING_LIT", "BINARY", "UNARY", "STAR", "PAREN", "SELECTOR", "INDEX",
    "CALL", "COMPOSITE_LIT", "KEY_VALUE", "TYPE_ASSERT", "FUNC_LIT",
    "SLICE_TYPE", "ARRAY_TYPE", "MAP_TYPE", "CHAN_TYPE", "STRUCT_TYPE",
    "FUNC_TYPE", "INTERFACE_TYPE",
  };

  /**
   * @param tokenNum token type of a node
   * @return descriptive string containing token name, or token number if
   *        unknown token type
   */
  public static String tokName(int tokenNum) {
    if (tokenNum < 0 || tokenNum > tokenNames.length - 1) {
      return "Invalid token number (" + tokenNum + ")";
    } else {
      return tokenNames[tokenNum];
    }
  }

  /**
   * @return true if a node of this type can appear where a type is expected
   *        (identifiers and selectors are names that may denote types too)
   */
  public static boolean isTypeExpr(int type) {
    switch (type) {
      case SLICE_TYPE:
      case ARRAY_TYPE:
      case MAP_TYPE:
      case CHAN_TYPE:
      case STRUCT_TYPE:
      case FUNC_TYPE:
      case INTERFACE_TYPE:
      case STAR:
      case IDENT:
      case SELECTOR:
      case INDEX:
        return true;
      default:
        return false;
    }
  }
}
