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

import java.util.Arrays;
import java.util.List;

import exm.moxie.ast.MoxieAST.LoweredForm;
import exm.moxie.common.lang.Builtins;

/**
 * Construct tree nodes.  Text of structural nodes is a short label so that
 * toStringTree() output reads like the source.
 */
public class Trees {

  public static MoxieAST node(int type, String text) {
    return new MoxieAST(type, text);
  }

  private static MoxieAST node(int type, String text,
                               List<MoxieAST> children) {
    MoxieAST result = new MoxieAST(type, text);
    for (MoxieAST child: children) {
      result.addChild(child);
    }
    return result;
  }

  public static MoxieAST empty() {
    return node(MoxieTokens.EMPTY, "<empty>");
  }

  public static MoxieAST ident(String name) {
    return node(MoxieTokens.IDENT, name);
  }

  /**
   * @param name identifier, optionally qualified with a package
   */
  public static MoxieAST qualifiedName(String name) {
    int dot = name.lastIndexOf('.');
    if (dot < 0) {
      return ident(name);
    }
    return selector(qualifiedName(name.substring(0, dot)),
                    name.substring(dot + 1));
  }

  public static MoxieAST intLit(String text) {
    return node(MoxieTokens.INT_LIT, text);
  }

  public static MoxieAST charLit(String text) {
    return node(MoxieTokens.CHAR_LIT, text);
  }

  /**
   * @param text literal including quotes
   */
  public static MoxieAST stringLit(String text) {
    return node(MoxieTokens.STRING_LIT, text);
  }

  public static MoxieAST selector(MoxieAST x, String sel) {
    return node(MoxieTokens.SELECTOR, ".").add(x).add(ident(sel));
  }

  public static MoxieAST call(MoxieAST fun, MoxieAST ...args) {
    return call(fun, Arrays.asList(args));
  }

  public static MoxieAST call(MoxieAST fun, List<MoxieAST> args) {
    return node(MoxieTokens.CALL, "call").add(fun)
            .addAll(args);
  }

  public static MoxieAST index(MoxieAST x, MoxieAST ...indices) {
    return index(x, Arrays.asList(indices));
  }

  public static MoxieAST index(MoxieAST x, List<MoxieAST> indices) {
    return node(MoxieTokens.INDEX, "index").add(x).addAll(indices);
  }

  public static MoxieAST star(MoxieAST x) {
    return node(MoxieTokens.STAR, "*").add(x);
  }

  public static MoxieAST unary(String op, MoxieAST x) {
    return node(MoxieTokens.UNARY, op).add(x);
  }

  public static MoxieAST addressOf(MoxieAST x) {
    return unary("&", x);
  }

  public static MoxieAST binary(String op, MoxieAST x, MoxieAST y) {
    return node(MoxieTokens.BINARY, op).add(x).add(y);
  }

  public static MoxieAST paren(MoxieAST x) {
    return node(MoxieTokens.PAREN, "()").add(x);
  }

  public static MoxieAST typeAssert(MoxieAST x, MoxieAST type) {
    return node(MoxieTokens.TYPE_ASSERT, ".(type)").add(x).add(type);
  }

  public static MoxieAST keyValue(MoxieAST key, MoxieAST value) {
    return node(MoxieTokens.KEY_VALUE, ":").add(key).add(value);
  }

  /**
   * @param type literal type, or null for an elided type
   */
  public static MoxieAST compositeLit(MoxieAST type, MoxieAST ...elems) {
    return compositeLit(type, Arrays.asList(elems));
  }

  public static MoxieAST compositeLit(MoxieAST type, List<MoxieAST> elems) {
    return node(MoxieTokens.COMPOSITE_LIT, "lit")
            .add(type == null ? empty() : type).addAll(elems);
  }

  public static MoxieAST sliceType(MoxieAST elem) {
    return node(MoxieTokens.SLICE_TYPE, "[]").add(elem);
  }

  public static MoxieAST arrayType(MoxieAST len, MoxieAST elem) {
    return node(MoxieTokens.ARRAY_TYPE, "[N]").add(len).add(elem);
  }

  public static MoxieAST mapType(MoxieAST key, MoxieAST value) {
    return node(MoxieTokens.MAP_TYPE, "map").add(key).add(value);
  }

  /**
   * @param dir chan, chan&lt;- or &lt;-chan
   */
  public static MoxieAST chanType(String dir, MoxieAST elem) {
    return node(MoxieTokens.CHAN_TYPE, dir).add(elem);
  }

  public static MoxieAST structType(MoxieAST ...fields) {
    return node(MoxieTokens.STRUCT_TYPE, "struct", Arrays.asList(fields));
  }

  /**
   * Base language form of the byte string type: *[]byte
   */
  public static MoxieAST byteStringType() {
    MoxieAST t = star(sliceType(ident(Builtins.BYTE)));
    t.markSynthetic();
    t.setLoweredFrom(LoweredForm.STRING_TYPE);
    return t;
  }

  // Statements
  public static MoxieAST exprStmt(MoxieAST x) {
    return node(MoxieTokens.EXPR_STMT, "expr").add(x);
  }

  public static MoxieAST assign(String op, List<MoxieAST> lhs,
                                List<MoxieAST> rhs) {
    return node(MoxieTokens.ASSIGN, op)
            .add(node(MoxieTokens.LHS, "lhs", lhs))
            .add(node(MoxieTokens.RHS, "rhs", rhs));
  }

  public static MoxieAST assign(String op, MoxieAST lhs, MoxieAST rhs) {
    return assign(op, Arrays.asList(lhs), Arrays.asList(rhs));
  }

  public static MoxieAST incDec(String op, MoxieAST x) {
    return node(MoxieTokens.INC_DEC, op).add(x);
  }

  public static MoxieAST returnStmt(MoxieAST ...results) {
    return node(MoxieTokens.RETURN, "return", Arrays.asList(results));
  }

  public static MoxieAST block(MoxieAST ...stmts) {
    return block(Arrays.asList(stmts));
  }

  public static MoxieAST block(List<MoxieAST> stmts) {
    return node(MoxieTokens.BLOCK, "block", stmts);
  }

  /**
   * @param init init statement or null
   * @param elseBranch BLOCK, IF or null
   */
  public static MoxieAST ifStmt(MoxieAST init, MoxieAST cond,
                                MoxieAST body, MoxieAST elseBranch) {
    MoxieAST result = node(MoxieTokens.IF, "if")
        .add(init == null ? empty() : init).add(cond).add(body);
    if (elseBranch != null) {
      result.add(elseBranch);
    }
    return result;
  }

  public static MoxieAST forStmt(MoxieAST init, MoxieAST cond,
                                 MoxieAST post, MoxieAST body) {
    return node(MoxieTokens.FOR, "for")
        .add(init == null ? empty() : init)
        .add(cond == null ? empty() : cond)
        .add(post == null ? empty() : post)
        .add(body);
  }

  public static MoxieAST rangeStmt(String op, MoxieAST key, MoxieAST value,
                                   MoxieAST expr, MoxieAST body) {
    return node(MoxieTokens.RANGE, op)
        .add(key == null ? empty() : key)
        .add(value == null ? empty() : value)
        .add(expr).add(body);
  }

  // Declarations
  public static MoxieAST file(String fileName, String pkg,
                              MoxieAST ...decls) {
    return node(MoxieTokens.FILE, fileName)
        .add(node(MoxieTokens.PACKAGE, pkg))
        .addAll(Arrays.asList(decls));
  }

  public static MoxieAST importDecl(MoxieAST ...specs) {
    return node(MoxieTokens.IMPORT_DECL, "import", Arrays.asList(specs));
  }

  /**
   * @param path unquoted import path
   * @param alias alias or null
   */
  public static MoxieAST importSpec(String path, String alias) {
    MoxieAST spec = node(MoxieTokens.IMPORT_SPEC, "\"" + path + "\"");
    if (alias != null) {
      spec.add(ident(alias));
    }
    return spec;
  }

  public static MoxieAST names(String ...names) {
    MoxieAST result = node(MoxieTokens.NAMES, "names");
    for (String name: names) {
      result.add(ident(name));
    }
    return result;
  }

  /**
   * @param type field type
   * @param tag STRING_LIT tag or null
   */
  public static MoxieAST field(MoxieAST names, MoxieAST type, MoxieAST tag) {
    MoxieAST result = node(MoxieTokens.FIELD, "field").add(names).add(type);
    if (tag != null) {
      result.add(tag);
    }
    return result;
  }

  public static MoxieAST params(MoxieAST ...fields) {
    return node(MoxieTokens.PARAMS, "params", Arrays.asList(fields));
  }

  public static MoxieAST results(MoxieAST ...fields) {
    return node(MoxieTokens.RESULTS, "results", Arrays.asList(fields));
  }

  public static MoxieAST funcDecl(String name, MoxieAST params,
                                  MoxieAST results, MoxieAST body) {
    MoxieAST result = node(MoxieTokens.FUNC_DECL, name)
                        .add(params).add(results);
    if (body != null) {
      result.add(body);
    }
    return result;
  }

  public static MoxieAST funcType(MoxieAST params, MoxieAST results) {
    return node(MoxieTokens.FUNC_TYPE, "func").add(params).add(results);
  }

  public static MoxieAST funcLit(MoxieAST funcType, MoxieAST body) {
    return node(MoxieTokens.FUNC_LIT, "func").add(funcType).add(body);
  }

  /**
   * @param type declared type, or null
   */
  public static MoxieAST valueSpec(MoxieAST names, MoxieAST type,
                                   MoxieAST ...values) {
    return node(MoxieTokens.VALUE_SPEC, "spec").add(names)
        .add(type == null ? empty() : type)
        .add(node(MoxieTokens.VALUES, "values", Arrays.asList(values)));
  }

  public static MoxieAST varDecl(MoxieAST ...specs) {
    return node(MoxieTokens.VAR_DECL, "var", Arrays.asList(specs));
  }

  public static MoxieAST constDecl(MoxieAST ...specs) {
    return node(MoxieTokens.CONST_DECL, "const", Arrays.asList(specs));
  }

  public static MoxieAST typeDecl(MoxieAST ...specs) {
    return node(MoxieTokens.TYPE_DECL, "type", Arrays.asList(specs));
  }

  public static MoxieAST typeSpec(String name, MoxieAST type) {
    return node(MoxieTokens.TYPE_SPEC, name).add(type);
  }

  /**
   * Give every node of a new subtree that has no position of its own
   * the position of the node it replaces.
   */
  public static MoxieAST stampPosition(MoxieAST tree, MoxieAST from) {
    if (tree.getToken().getLine() <= 0) {
      tree.positionFrom(from);
    }
    for (MoxieAST child: tree.children()) {
      stampPosition(child, from);
    }
    return tree;
  }
}
