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
package exm.moxie.frontend.tree;

import java.util.Collections;
import java.util.List;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;

/**
 * View of a CALL node: callee, optional type arguments, and arguments.
 */
public class FunctionCall {
  private final MoxieAST tree;
  /** Callee without type arguments */
  private final MoxieAST fun;
  private final List<MoxieAST> typeArgs;
  private final List<MoxieAST> args;

  /** Package qualifier, null if unqualified or not a plain name */
  private final String packageName;
  /** Function name, null if callee isn't a (qualified) name */
  private final String name;

  private FunctionCall(MoxieAST tree, MoxieAST fun, List<MoxieAST> typeArgs,
                       List<MoxieAST> args, String packageName, String name) {
    this.tree = tree;
    this.fun = fun;
    this.typeArgs = typeArgs;
    this.args = args;
    this.packageName = packageName;
    this.name = name;
  }

  public static FunctionCall fromAST(MoxieAST tree) {
    assert(tree.getType() == MoxieTokens.CALL);
    MoxieAST fun = tree.child(0);
    List<MoxieAST> typeArgs = Collections.emptyList();
    if (fun.getType() == MoxieTokens.INDEX) {
      typeArgs = fun.children(1);
      fun = fun.child(0);
    }

    String packageName = null;
    String name = null;
    if (fun.getType() == MoxieTokens.IDENT) {
      name = fun.getText();
    } else if (fun.getType() == MoxieTokens.SELECTOR &&
               fun.child(0).getType() == MoxieTokens.IDENT) {
      packageName = fun.child(0).getText();
      name = fun.child(1).getText();
    }
    return new FunctionCall(tree, fun, typeArgs, tree.children(1),
                            packageName, name);
  }

  /**
   * @return true if this is a call to an unqualified name, e.g. a
   *        built-in
   */
  public boolean isCallTo(String functionName) {
    return packageName == null && functionName.equals(name);
  }

  public boolean isUnqualified() {
    return packageName == null && name != null;
  }

  public MoxieAST tree() {
    return tree;
  }

  public MoxieAST fun() {
    return fun;
  }

  public List<MoxieAST> typeArgs() {
    return typeArgs;
  }

  public List<MoxieAST> args() {
    return args;
  }

  public MoxieAST arg(int i) {
    return args.get(i);
  }

  public String packageName() {
    return packageName;
  }

  public String name() {
    return name;
  }
}
