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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsdce.rhino.Node;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.OptionHandler;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;

/**
 * CommandLineRunner translates flags into options for the {@link Compiler}, runs it on the input
 * files and writes the rewritten program.
 *
 * <pre>
 *   java -jar jsdce.jar --js app.js --js lib.js --js_output_file out.js
 * </pre>
 *
 * <p>Bare arguments are inputs too. Errors go to the error stream; the exit status is 0 on success
 * and 1 on usage or compile errors.
 */
public class CommandLineRunner {

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--print_tree",
        handler = BooleanOptionHandler.class,
        usage = "Prints out the parse tree and exits")
    private boolean printTree = false;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level values) for Compiler progress."
                + " Does not control errors or warnings for the JavaScript code under compilation")
    private String loggingLevel = Level.WARNING.getName();

    @Option(
        name = "--js",
        usage =
            "The JavaScript filename. You may specify multiple. The flag name is optional,"
                + " because args are interpreted as files by default")
    private List<String> js = new ArrayList<>();

    @Option(
        name = "--js_output_file",
        usage = "Primary output filename. If not specified, output is written to stdout")
    private String jsOutputFile = "";

    @Option(
        name = "--dead_code_elimination",
        handler = BooleanOptionHandler.class,
        usage = "Removes the functions, properties and references the flow analysis proves dead")
    private boolean deadCodeElimination = true;

    @Option(
        name = "--stub_uncalled_functions",
        handler = BooleanOptionHandler.class,
        usage = "Empties the body of functions that are referenced but never called")
    private boolean stubUncalledFunctions = true;

    @Option(
        name = "--formatting",
        usage = "Specifies which formatting options, if any, should be applied to the output JS")
    private List<FormattingOption> formatting = new ArrayList<>();

    @Argument(multiValued = true)
    private List<String> arguments = new ArrayList<>();

    private final CmdLineParser parser;

    Flags() {
      parser = new CmdLineParser(this);
    }

    /** Parse the given args list. */
    private void parse(List<String> args) throws CmdLineException {
      parser.parseArgument(args.toArray(new String[] {}));
      try {
        Level.parse(loggingLevel);
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --logging_level: " + loggingLevel, e);
      }
    }

    private ImmutableList<String> getJsFiles() {
      return ImmutableList.<String>builder().addAll(js).addAll(arguments).build();
    }

    private void printUsage(PrintStream ps) {
      ps.println("Usage: jsdce [options] [file ...]");
      parser.printUsage(ps);
      ps.flush();
    }
  }

  /** Set of options that can be used with the --formatting flag. */
  private static enum FormattingOption {
    PRETTY_PRINT;

    private void applyToOptions(CompilerOptions options) {
      switch (this) {
        case PRETTY_PRINT:
          options.setPrettyPrint(true);
          break;
        default:
          throw new IllegalStateException("Unknown formatting option: " + this);
      }
    }
  }

  /**
   * Accepts {@code --flag}, {@code --flag true} and {@code --flag false}, with the usual
   * spellings of the two values.
   */
  public static class BooleanOptionHandler extends OptionHandler<Boolean> {
    private static final Set<String> TRUES = ImmutableSet.of("true", "on", "yes", "1");
    private static final Set<String> FALSES = ImmutableSet.of("false", "off", "no", "0");

    public BooleanOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      String param = params.size() > 0 ? params.getParameter(0) : null;
      if (param == null) {
        setter.addValue(true);
        return 0;
      }
      String lowerParam = param.toLowerCase();
      if (TRUES.contains(lowerParam)) {
        setter.addValue(true);
      } else if (FALSES.contains(lowerParam)) {
        setter.addValue(false);
      } else {
        // The next argument is not a value for this flag.
        setter.addValue(true);
        return 0;
      }
      return 1;
    }

    @Override
    public String getDefaultMetaVariable() {
      return null;
    }
  }

  private final Flags flags = new Flags();
  private final PrintStream out;
  private final PrintStream err;
  private boolean errors = false;
  private boolean runCompiler = false;

  public CommandLineRunner(String[] args) {
    this(args, System.out, System.err);
  }

  public CommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
    try {
      flags.parse(processArgs(args));
    } catch (CmdLineException e) {
      reportError(e.getMessage());
    }

    if (errors) {
      err.println("Sample usage: --js app.js --js_output_file out.js");
      err.println("Run with --help for all options.");
    } else if (flags.displayHelp) {
      flags.printUsage(out);
    } else if (flags.getJsFiles().isEmpty()) {
      reportError("ERROR - No input files. Pass them with --js or as arguments.");
    } else {
      runCompiler = true;
    }
  }

  /** Rewrites {@code --flag=value} into the two arguments args4j expects. */
  private static List<String> processArgs(String[] args) {
    Pattern argPattern = Pattern.compile("(--?[a-zA-Z_]+)=(.*)");
    Pattern quotesPattern = Pattern.compile("^['\"](.*)['\"]$");
    List<String> processedArgs = new ArrayList<>();

    for (String arg : args) {
      Matcher matcher = argPattern.matcher(arg);
      if (matcher.matches()) {
        processedArgs.add(matcher.group(1));

        String value = matcher.group(2);
        Matcher quotesMatcher = quotesPattern.matcher(value);
        processedArgs.add(quotesMatcher.matches() ? quotesMatcher.group(1) : value);
      } else {
        processedArgs.add(arg);
      }
    }
    return processedArgs;
  }

  private void reportError(String message) {
    errors = true;
    err.println(message);
    err.flush();
  }

  public boolean shouldRunCompiler() {
    return runCompiler;
  }

  public boolean hasErrors() {
    return errors;
  }

  CompilerOptions createOptions() {
    CompilerOptions options = new CompilerOptions();
    options.setFlowDeadCodeElimination(flags.deadCodeElimination && !flags.printTree);
    options.setStubUncalledFunctions(flags.stubUncalledFunctions);
    for (FormattingOption formattingOption : flags.formatting) {
      formattingOption.applyToOptions(options);
    }
    return options;
  }

  /**
   * Runs the compiler and writes its output.
   *
   * @return the exit status
   */
  public int doRun() throws IOException {
    Logger.getLogger("org.jsdce").setLevel(Level.parse(flags.loggingLevel));

    Compiler compiler = new Compiler(err);
    List<SourceFile> inputs = new ArrayList<>();
    for (String fileName : flags.getJsFiles()) {
      try {
        inputs.add(SourceFile.fromFile(fileName));
      } catch (IOException e) {
        compiler.report(
            JSError.make(Compiler.READ_ERROR, fileName, String.valueOf(e.getMessage())));
      }
    }
    if (compiler.hasErrors()) {
      compiler.getErrorManager().generateReport();
      return 1;
    }

    Result result = compiler.compile(inputs, createOptions());
    if (!result.success) {
      return 1;
    }

    String output;
    if (flags.printTree) {
      Node root = compiler.getRoot();
      output = root == null ? "" : root.toStringTree();
    } else {
      output = compiler.toSource();
    }
    writeOutput(output);
    return 0;
  }

  private void writeOutput(String output) throws IOException {
    if (flags.jsOutputFile.isEmpty()) {
      out.append(output);
      if (!output.endsWith("\n")) {
        out.append('\n');
      }
      out.flush();
    } else {
      Files.asCharSink(new File(flags.jsOutputFile), UTF_8).write(output);
    }
  }

  /** Runs the compiler and exits with its status. */
  public void run() {
    int result;
    try {
      result = doRun();
    } catch (IOException e) {
      err.println("ERROR - " + e.getMessage());
      result = 1;
    }
    System.exit(result);
  }

  /** Runs the Compiler. Exits cleanly in the event of an error. */
  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args);
    if (runner.shouldRunCompiler()) {
      runner.run();
    }
    if (runner.hasErrors()) {
      System.exit(1);
    }
  }
}
