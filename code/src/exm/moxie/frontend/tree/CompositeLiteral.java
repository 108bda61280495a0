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

import java.util.List;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;

/**
 * View of a COMPOSITE_LIT node
 */
public class CompositeLiteral {
  private final MoxieAST tree;
  /** Literal type, null if elided */
  private final MoxieAST type;
  private final List<MoxieAST> elements;

  private CompositeLiteral(MoxieAST tree, MoxieAST type,
                           List<MoxieAST> elements) {
    this.tree = tree;
    this.type = type;
    this.elements = elements;
  }

  public static CompositeLiteral fromAST(MoxieAST tree) {
    assert(tree.getType() == MoxieTokens.COMPOSITE_LIT);
    MoxieAST type = tree.child(0);
    if (type.isEmptyNode()) {
      type = null;
    }
    return new CompositeLiteral(tree, type, tree.children(1));
  }

  public MoxieAST tree() {
    return tree;
  }

  public MoxieAST type() {
    return type;
  }

  public List<MoxieAST> elements() {
    return elements;
  }
}
