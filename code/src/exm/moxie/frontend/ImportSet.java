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
package exm.moxie.frontend;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map.Entry;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.MoxieRuntimeError;
import exm.moxie.frontend.tree.Literals;

/**
 * Imports that rewritten code needs, in the order they were first
 * required.  Requiring a path again has no effect.
 */
public class ImportSet {
  /** Map from path to alias, null alias if none */
  private final LinkedHashMap<String, String> required =
                          new LinkedHashMap<String, String>();
  private boolean spliced = false;

  public void require(String path) {
    require(path, null);
  }

  public void require(String path, String alias) {
    checkNotSpliced();
    if (!required.containsKey(path)) {
      required.put(path, alias);
    }
  }

  public boolean isEmpty() {
    return required.isEmpty();
  }

  public boolean contains(String path) {
    return required.containsKey(path);
  }

  public List<String> paths() {
    return ImmutableList.copyOf(required.keySet());
  }

  public String alias(String path) {
    return required.get(path);
  }

  /**
   * Add one import declaration with the required paths the file doesn't
   * import already, straight after the package clause.  Can only be done
   * once.
   * @param file FILE node
   * @return number of imports added
   */
  public int splice(MoxieAST file) {
    checkNotSpliced();
    spliced = true;

    Set<String> present = new HashSet<String>();
    int packageIndex = -1;
    for (MoxieAST decl: file.children()) {
      if (decl.getType() == MoxieTokens.PACKAGE) {
        packageIndex = decl.getChildIndex();
      } else if (decl.getType() == MoxieTokens.IMPORT_DECL) {
        for (MoxieAST spec: decl.children()) {
          present.add(Literals.importPath(spec));
        }
      }
    }

    MoxieAST importDecl = Trees.importDecl();
    importDecl.markSynthetic();
    for (Entry<String, String> e: required.entrySet()) {
      if (!present.contains(e.getKey())) {
        importDecl.add(Trees.importSpec(e.getKey(), e.getValue()));
      }
    }

    if (importDecl.childCount() > 0) {
      file.insertChildAt(packageIndex + 1, importDecl);
    }
    return importDecl.childCount();
  }

  private void checkNotSpliced() {
    if (spliced) {
      throw new MoxieRuntimeError("Imports already spliced into file");
    }
  }

  @Override
  public String toString() {
    return required.toString();
  }
}
