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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.CommonToken;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;

import exm.moxie.common.exceptions.MoxieRuntimeError;

/**
 * A custom tree class for the Moxie AST with slots to store information
 * the transformer attaches to the nodes it creates.
 *
 */
public class MoxieAST extends CommonTree {

  /**
   * Dialect constructs that a synthetic node stands in for
   */
  public static enum LoweredForm {
    /** &amp;[]byte{...} produced from a string literal */
    STRING_LITERAL,
    /** *[]byte produced from the string type */
    STRING_TYPE,
  }

  /** True if created by the transformer rather than the front end */
  private boolean synthetic = false;
  private LoweredForm loweredFrom = null;

  public MoxieAST(Token t) {
    super(t);
  }

  public MoxieAST(int type, String text) {
    super(new CommonToken(type, text));
  }

  /**
   * Copy constructor: copies token and annotations but not children
   */
  public MoxieAST(MoxieAST node) {
    super(node);
    // Don't share token: positions of copies are set independently
    this.token = new CommonToken(node.token);
    this.synthetic = node.synthetic;
    this.loweredFrom = node.loweredFrom;
  }

  public boolean isSynthetic() {
    return synthetic;
  }

  public MoxieAST markSynthetic() {
    this.synthetic = true;
    return this;
  }

  public LoweredForm getLoweredFrom() {
    return loweredFrom;
  }

  public boolean isLoweredFrom(LoweredForm form) {
    return loweredFrom == form;
  }

  public MoxieAST setLoweredFrom(LoweredForm loweredFrom) {
    this.loweredFrom = loweredFrom;
    return this;
  }

  /**
   * Set source position of this node
   * @param line 1-based line
   * @param col 0-based column
   * @return this node
   */
  public MoxieAST at(int line, int col) {
    token.setLine(line);
    token.setCharPositionInLine(col);
    return this;
  }

  /**
   * Copy position of another node, e.g. onto a replacement node
   */
  public MoxieAST positionFrom(MoxieAST other) {
    return at(other.getLine(), other.getCharPositionInLine());
  }

  public FilePosition position(String file) {
    return new FilePosition(file, getLine(), getCharPositionInLine());
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * MoxieAST everywhere
   */
  public MoxieAST child(int i) {
    return (MoxieAST)super.getChild(i);
  }

  public MoxieAST parent() {
    return (MoxieAST)getParent();
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<MoxieAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  public List<MoxieAST> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children().subList(start, children.size());
  }

  public boolean isEmptyNode() {
    return getType() == MoxieTokens.EMPTY;
  }

  /**
   * Add a child node
   * @return this node, to allow chaining
   */
  public MoxieAST add(MoxieAST child) {
    addChild(child);
    return this;
  }

  public MoxieAST addAll(List<MoxieAST> newChildren) {
    for (MoxieAST child: newChildren) {
      addChild(child);
    }
    return this;
  }

  public void insertChildAt(int i, MoxieAST child) {
    if (children == null) {
      children = createChildrenList();
    }
    children.add(i, child);
    child.setParent(this);
    freshenParentAndChildIndexes(i);
  }

  /**
   * Replace this node in its parent with another node
   * @param replacement
   */
  public void replaceWith(MoxieAST replacement) {
    MoxieAST parent = parent();
    if (parent == null) {
      throw new MoxieRuntimeError("Cannot replace root node "
                                  + MoxieTokens.tokName(getType()));
    }
    int index = getChildIndex();
    if (parent.getChild(index) != this) {
      throw new MoxieRuntimeError("Child index out of sync for node "
          + MoxieTokens.tokName(getType()) + " at " + getLine() + ":"
          + getCharPositionInLine());
    }
    parent.setChild(index, replacement);
  }

  /**
   * Position of a node within its parent.  Taken before the node is
   * moved under a new parent, so the replacement can go in its place.
   */
  public static class Slot {
    public final MoxieAST parent;
    public final int index;

    private Slot(MoxieAST parent, int index) {
      this.parent = parent;
      this.index = index;
    }

    public void fill(MoxieAST replacement) {
      parent.setChild(index, replacement);
    }
  }

  public Slot slot() {
    MoxieAST parent = parent();
    if (parent == null) {
      throw new MoxieRuntimeError("Root node "
                    + MoxieTokens.tokName(getType()) + " has no slot");
    }
    return new Slot(parent, getChildIndex());
  }

  /**
   * Deep copy of this subtree, including annotations
   */
  public MoxieAST copyTree() {
    MoxieAST copy = new MoxieAST(this);
    for (MoxieAST c: children()) {
      copy.addChild(c.copyTree());
    }
    return copy;
  }

  public boolean hasAncestor(int tokenType) {
    MoxieAST curr = parent();
    while (curr != null) {
      if (curr.getType() == tokenType) {
        return true;
      }
      curr = curr.parent();
    }
    return false;
  }

  /**
   * @return list of nodes from this one up to the root
   */
  public List<MoxieAST> ancestry() {
    List<MoxieAST> result = new ArrayList<MoxieAST>();
    MoxieAST curr = this;
    while (curr != null) {
      result.add(curr);
      curr = curr.parent();
    }
    return result;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    writer.println("printTree:");
    printTree(writer, 0);
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.print(MoxieTokens.tokName(getType()));
    writer.print(' ');
    writer.println(this.getText());
    for (int i = 0; i < this.getChildCount(); i++)
      this.child(i).printTree(writer, indent+2);
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

  @Override
  public MoxieAST dupNode() {
    return new MoxieAST(this);
  }
}
