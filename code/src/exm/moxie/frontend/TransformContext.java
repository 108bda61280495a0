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

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.moxie.ast.FilePosition;
import exm.moxie.ast.MoxieAST;
import exm.moxie.common.Settings;
import exm.moxie.common.lang.Builtins;
import exm.moxie.common.lang.RuntimeHelpers;
import exm.moxie.common.lang.RuntimeHelpers.Helper;

/**
 * State for transforming one file: settings, type facts, required
 * imports, warnings and the current source position.
 */
public class TransformContext {
  private final String inputFile;
  private final Settings settings;
  private final TypeTracker types;
  private final ImportSet imports;
  private final List<Diagnostic> warnings = new ArrayList<Diagnostic>();

  private int line = 0;
  private int col = -1;

  /** Nesting level, used for log indentation */
  private int level = 0;

  public TransformContext(String inputFile, Settings settings) {
    this.inputFile = inputFile;
    this.settings = settings;
    this.types = new TypeTracker(settings.runtimeAlias());
    this.imports = new ImportSet();
  }

  public String getInputFile() {
    return inputFile;
  }

  public Settings getSettings() {
    return settings;
  }

  public TypeTracker getTypes() {
    return types;
  }

  public ImportSet getImports() {
    return imports;
  }

  /**
   * Update current position from a tree node
   * @param tree node being visited
   */
  public void syncFilePos(MoxieAST tree) {
    // Synthetic nodes may have no position
    if (tree.getLine() > 0) {
      this.line = tree.getLine();
      this.col = tree.getCharPositionInLine();
    }
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return col;
  }

  public int getLevel() {
    return level;
  }

  public void increaseLevel() {
    level++;
  }

  public void decreaseLevel() {
    level--;
  }

  public FilePosition getPosition() {
    return new FilePosition(inputFile, line, col);
  }

  /**
   * @return position of node, or current position if node has none
   */
  public FilePosition positionOf(MoxieAST tree) {
    if (tree.getLine() > 0) {
      return tree.position(inputFile);
    }
    return getPosition();
  }

  /**
     @return E.g.; "file.mx:42:3: "
   */
  public String getLocation() {
    String res = new File(inputFile).getName() + ":" + line;
    if (col >= 0) {
      res += ":" + (col + 1);
    }
    return res + ": ";
  }

  public String runtimeAlias() {
    return settings.runtimeAlias();
  }

  /**
   * Reference to a runtime helper.  Requires the runtime import.
   */
  public MoxieAST runtimeRef(Helper helper, List<MoxieAST> typeArgs) {
    requireRuntime();
    return RuntimeHelpers.ref(runtimeAlias(), helper, typeArgs);
  }

  public MoxieAST runtimeRef(Helper helper, MoxieAST ...typeArgs) {
    requireRuntime();
    return RuntimeHelpers.ref(runtimeAlias(), helper, typeArgs);
  }

  public void requireRuntime() {
    imports.require(settings.runtimeImportPath(), settings.runtimeAlias());
  }

  public void requireBytes() {
    imports.require(Builtins.BYTES_PACKAGE);
  }

  /**
   * Record a non-fatal diagnostic
   */
  public void addWarning(Diagnostic warning) {
    warnings.add(warning);
    LogHelper.warn(this, warning.message);
  }

  public List<Diagnostic> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }
}
