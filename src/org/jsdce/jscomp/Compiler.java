/*
 * Copyright 2026 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package org.jsdce.jscomp;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.io.PrintStream;
import java.util.List;
import java.util.logging.Logger;
import org.jsdce.jscomp.parsing.ParserRunner;
import org.jsdce.rhino.IR;
import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * Compiler (and the other classes in this package) does the following:
 *
 * <ul>
 *   <li>parses JS code
 *   <li>removes the code a whole-program value flow analysis proves dead
 *   <li>generates JS code from the rewritten tree
 * </ul>
 */
public class Compiler {

  static final DiagnosticType READ_ERROR =
      DiagnosticType.error("JSC_READ_ERROR", "Cannot read file {0}: {1}");

  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  private ErrorManager errorManager;
  private CompilerOptions options = new CompilerOptions();
  private @Nullable Node jsRoot;
  private DeadCodeSummary deadCodeSummary = new DeadCodeSummary();

  /** Creates a Compiler that reports errors and warnings to its logger. */
  public Compiler() {
    this(new LoggerErrorManager(logger));
  }

  /** Creates a Compiler that reports errors and warnings to an output stream. */
  public Compiler(PrintStream outStream) {
    this(new PrintStreamErrorManager(outStream));
  }

  /** Creates a Compiler that uses a custom error manager. */
  public Compiler(ErrorManager errorManager) {
    setErrorManager(errorManager);
  }

  /**
   * Sets the error manager.
   *
   * @param errorManager the error manager, it cannot be {@code null}
   */
  public void setErrorManager(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager, "the error manager cannot be null");
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Compiles a list of inputs.
   *
   * <p>This is a convenience method to wrap up all the work of compilation, including generating
   * the error and warning report.
   */
  public Result compile(List<SourceFile> inputs, CompilerOptions options) {
    // The compile method should only be called once.
    checkState(jsRoot == null, "compile() called twice");
    this.options = options;
    try {
      parse(inputs);
      if (!hasErrors() && options.getFlowDeadCodeElimination()) {
        FlowDeadCodeElimination pass = new FlowDeadCodeElimination(options);
        pass.process(checkNotNull(jsRoot));
        deadCodeSummary = pass.getSummary();
      }
    } finally {
      errorManager.generateReport();
    }
    return getResult();
  }

  /** Parses every input into one SCRIPT under a shared ROOT. */
  private void parse(List<SourceFile> inputs) {
    Node root = IR.root();
    RhinoErrorReporter reporter = new RhinoErrorReporter(errorManager);
    for (SourceFile input : inputs) {
      logger.fine("Parsing " + input.getName());
      Node script = ParserRunner.parse(input.getName(), input.getCode(), reporter).ast();
      if (script != null) {
        root.addChildToBack(script);
      }
    }
    jsRoot = root;
  }

  /** Reports an error found outside of parsing, such as an unreadable input file. */
  public void report(JSError error) {
    errorManager.report(error.defaultLevel(), error);
  }

  public boolean hasErrors() {
    return errorManager.hasHaltingErrors();
  }

  public Result getResult() {
    return new Result(errorManager.getErrors(), errorManager.getWarnings(), deadCodeSummary);
  }

  /** Returns the root of the parsed program, or null before {@link #compile}. */
  public @Nullable Node getRoot() {
    return jsRoot;
  }

  /** Converts the main parse tree back to JS code. */
  public String toSource() {
    if (jsRoot == null) {
      return "";
    }
    return new CodePrinter.Builder(jsRoot).setCompilerOptions(options).build();
  }
}
