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

import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.moxie.ast.MoxieAST;
import exm.moxie.common.Logging;
import exm.moxie.common.Settings;
import exm.moxie.common.exceptions.ConstViolationsException;
import exm.moxie.common.exceptions.UserException;

/**
 * Transforms one file: checks constants, rewrites dialect constructs and
 * adds the imports the rewritten code needs.  Each call uses fresh
 * per-file state, so one transpiler may be used for many files.
 */
public class FileTranspiler {

  /**
   * Outcome of transforming a file
   */
  public static class Result {
    private final MoxieAST file;
    private final List<Diagnostic> warnings;
    private final List<String> addedImports;

    private Result(MoxieAST file, List<Diagnostic> warnings,
                   List<String> addedImports) {
      this.file = file;
      this.warnings = warnings;
      this.addedImports = addedImports;
    }

    /**
     * @return the rewritten FILE tree
     */
    public MoxieAST getFile() {
      return file;
    }

    public List<Diagnostic> getWarnings() {
      return warnings;
    }

    /**
     * @return paths of imports requested by the rewrites
     */
    public List<String> getAddedImports() {
      return addedImports;
    }
  }

  private final Logger logger;
  private final Settings settings;

  /**
   * Log as the settings direct
   */
  public FileTranspiler(Settings settings) {
    this(Logging.setupLogging(settings.logFile(), settings.logTrace()),
         settings);
  }

  public FileTranspiler(Logger logger, Settings settings) {
    this.logger = logger;
    this.settings = settings;
  }

  /**
   * The input tree is not modified.  If an exception is thrown, no
   * partially rewritten tree escapes.
   * @param inputFile name of the file, for diagnostics
   * @param file FILE node
   * @throws ConstViolationsException if constants are assigned to
   * @throws UserException if the file uses an unsupported construct, or a
   *          needed type can't be determined
   */
  public Result transpile(String inputFile, MoxieAST file)
                                                throws UserException {
    logger.debug("Transforming " + inputFile);

    new ConstChecker(inputFile).checkOrThrow(file);

    MoxieAST copy = file.copyTree();
    TransformContext context = new TransformContext(inputFile, settings);
    SyntaxTransformer.transform(logger, context, copy);

    int added = context.getImports().splice(copy);
    logger.debug("Done transforming " + inputFile + ": added " + added +
                 " imports, " + context.getWarnings().size() + " warnings");
    return new Result(copy, context.getWarnings(),
                      context.getImports().paths());
  }

  /**
   * Like {@link #transpile(String, MoxieAST)}, but returns failures as
   * diagnostics
   * @return diagnostics for all errors and warnings.  The file was
   *         transformed successfully if none is fatal.
   */
  public List<Diagnostic> check(String inputFile, MoxieAST file) {
    try {
      return transpile(inputFile, file).getWarnings();
    } catch (ConstViolationsException e) {
      return e.toDiagnostics();
    } catch (UserException e) {
      return ImmutableList.of(e.toDiagnostic());
    }
  }
}
