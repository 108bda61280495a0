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
import java.util.Collections;
import java.util.List;

import exm.moxie.ast.ExprPrinter;
import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.UserException;
import exm.moxie.frontend.LogHelper;
import exm.moxie.frontend.TransformContext;
import exm.moxie.frontend.TypeTracker;
import exm.moxie.frontend.tree.Assignment;

/**
 * Walks a whole file, keeping the type tracker up to date with the
 * scopes, declarations and assignments it passes through.  Subclasses
 * rewrite nodes on the way down ({@link #enter}) or on the way up
 * ({@link #exit}).
 *
 * Replacement nodes are not walked again in the same traversal.
 */
public abstract class TreeRewriter {
  protected final TransformContext context;
  protected final TypeTracker types;
  private int changes = 0;

  public TreeRewriter(TransformContext context) {
    this.context = context;
    this.types = context.getTypes();
  }

  /**
   * Walk the file once
   * @param file FILE node
   * @return true if anything was rewritten
   */
  public boolean rewrite(MoxieAST file) throws UserException {
    changes = 0;
    types.reset();
    types.recordFileSignatures(file);
    walk(file);
    return changes > 0;
  }

  public int changeCount() {
    return changes;
  }

  /**
   * Called before a node's children are walked
   * @return false to skip the node's children, e.g. if it was replaced
   */
  protected boolean enter(MoxieAST node) throws UserException {
    return true;
  }

  /**
   * Called after a node's children were walked
   * @return the node, or the node that replaced it
   */
  protected MoxieAST exit(MoxieAST node) throws UserException {
    return node;
  }

  /**
   * Put replacement where a node was.  The slot must have been taken
   * before the old node was used in the replacement.
   */
  protected void replace(MoxieAST.Slot slot, MoxieAST old,
                         MoxieAST replacement) {
    Trees.stampPosition(replacement, old);
    slot.fill(replacement);
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(context, "rewrite " + ExprPrinter.print(old) + " => "
                               + ExprPrinter.print(replacement));
    }
    changes++;
  }

  protected void replace(MoxieAST old, MoxieAST replacement) {
    replace(old.slot(), old, replacement);
  }

  /**
   * Wrap a node in a dereference
   * @return the new STAR node
   */
  protected MoxieAST wrapInStar(MoxieAST node) {
    MoxieAST.Slot slot = node.slot();
    MoxieAST star = Trees.star(node);
    replace(slot, node, star);
    return star;
  }

  /**
   * @return true if the identifier isn't a selected field, a declared
   *        name or shadowed by a local binding
   */
  protected boolean isFreeName(MoxieAST ident) {
    MoxieAST parent = ident.parent();
    if (parent.getType() == MoxieTokens.SELECTOR &&
        ident.getChildIndex() == 1) {
      return false;
    }
    if (parent.getType() == MoxieTokens.NAMES) {
      return false;
    }
    return !types.isBound(ident.getText());
  }

  private void walk(MoxieAST tree) throws UserException {
    context.syncFilePos(tree);
    if (!enter(tree)) {
      return;
    }

    boolean scoped = opensScope(tree.getType());
    if (scoped) {
      types.enterScope();
      context.increaseLevel();
    }

    switch (tree.getType()) {
      case MoxieTokens.FUNC_DECL:
        types.recordParams(tree);
        walkChildren(tree);
        break;
      case MoxieTokens.FUNC_LIT:
        types.recordParams(tree.child(0));
        walkChildren(tree);
        break;
      case MoxieTokens.RANGE:
        walkRange(tree);
        break;
      default:
        walkChildren(tree);
        break;
    }

    MoxieAST result = exit(tree);
    if (scoped) {
      types.exitScope();
      context.decreaseLevel();
    }
    record(result);
  }

  private void walkChildren(MoxieAST tree) throws UserException {
    // Children may be replaced as we go
    for (int i = 0; i < tree.childCount(); i++) {
      walk(tree.child(i));
    }
  }

  private void walkRange(MoxieAST range) throws UserException {
    // Key, value and ranged expression are outside the loop body
    for (int i = 0; i < 3; i++) {
      walk(range.child(i));
    }
    types.recordRange(range);
    for (int i = 3; i < range.childCount(); i++) {
      walk(range.child(i));
    }
  }

  private static boolean opensScope(int tokenType) {
    switch (tokenType) {
      case MoxieTokens.FUNC_DECL:
      case MoxieTokens.FUNC_LIT:
      case MoxieTokens.BLOCK:
      case MoxieTokens.IF:
      case MoxieTokens.FOR:
      case MoxieTokens.RANGE:
        return true;
      default:
        return false;
    }
  }

  /**
   * Update type facts for declarations and assignments
   */
  private void record(MoxieAST tree) {
    switch (tree.getType()) {
      case MoxieTokens.ASSIGN: {
        Assignment assign = Assignment.fromAST(tree);
        if (assign.isSimple()) {
          types.recordAssignment(assign.lVals, assign.rValExprs,
                                 assign.isDefine());
        }
        break;
      }
      case MoxieTokens.VALUE_SPEC: {
        List<String> names = new ArrayList<String>();
        for (MoxieAST name: tree.child(0).children()) {
          names.add(name.getText());
        }
        MoxieAST type = tree.child(1).isEmptyNode() ? null : tree.child(1);
        List<MoxieAST> values = tree.child(2).children();
        MoxieAST decl = tree.parent();
        if (decl != null && decl.getType() == MoxieTokens.CONST_DECL) {
          // Untyped constants keep base language types
          values = Collections.emptyList();
        }
        types.recordDeclaration(names, type, values);
        break;
      }
      default:
        break;
    }
  }
}
