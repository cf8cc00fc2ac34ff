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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommandLineRunnerTest {

  @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

  private ByteArrayOutputStream outReader;
  private ByteArrayOutputStream errReader;

  @Before
  public void setUp() {
    outReader = new ByteArrayOutputStream();
    errReader = new ByteArrayOutputStream();
  }

  private CommandLineRunner createRunner(String... args) {
    return new CommandLineRunner(
        args, new PrintStream(outReader, true, UTF_8), new PrintStream(errReader, true, UTF_8));
  }

  private String writeInput(String name, String code) throws IOException {
    File file = tempFolder.newFile(name);
    Files.asCharSink(file, UTF_8).write(code);
    return file.getPath();
  }

  private String out() {
    return outReader.toString(UTF_8);
  }

  private String err() {
    return errReader.toString(UTF_8);
  }

  @Test
  public void testRemovesDeadFunctions() throws IOException {
    String input = writeInput("in.js", "function f() {} function g() {} g();");
    CommandLineRunner runner = createRunner("--js", input);
    assertThat(runner.shouldRunCompiler()).isTrue();
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(out()).isEqualTo("function g(){}g();\n");
  }

  @Test
  public void testBareArgumentsAreInputs() throws IOException {
    String lib = writeInput("lib.js", "function used() {}");
    String main = writeInput("main.js", "used();");
    CommandLineRunner runner = createRunner(lib, "--js=" + main);
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(out()).isEqualTo("function used(){}used();\n");
  }

  @Test
  public void testDeadCodeEliminationCanBeDisabled() throws IOException {
    String input = writeInput("in.js", "function f() {}");
    CommandLineRunner runner = createRunner("--dead_code_elimination=false", input);
    assertThat(runner.createOptions().getFlowDeadCodeElimination()).isFalse();
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(out()).isEqualTo("function f(){}\n");
  }

  @Test
  public void testStubbingCanBeDisabled() throws IOException {
    String input = writeInput("in.js", "var o = {m: function() { return 1; }}; window.o = o;");
    CommandLineRunner runner = createRunner("--stub_uncalled_functions", "false", input);
    assertThat(runner.createOptions().getStubUncalledFunctions()).isFalse();
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(out()).contains("return 1");
  }

  @Test
  public void testBooleanFlagWithoutValue() {
    CommandLineRunner runner = createRunner("--stub_uncalled_functions", "in.js");
    assertThat(runner.shouldRunCompiler()).isTrue();
    assertThat(runner.createOptions().getStubUncalledFunctions()).isTrue();
  }

  @Test
  public void testPrettyPrint() throws IOException {
    String input = writeInput("in.js", "function g() { return 1; } g();");
    CommandLineRunner runner = createRunner("--formatting=PRETTY_PRINT", input);
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(out()).isEqualTo("function g() {\n  return 1;\n}\ng();\n");
  }

  @Test
  public void testPrintTreeSkipsElimination() throws IOException {
    String input = writeInput("in.js", "function f() {}");
    CommandLineRunner runner = createRunner("--print_tree", input);
    assertThat(runner.createOptions().getFlowDeadCodeElimination()).isFalse();
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(out()).startsWith("ROOT\n    SCRIPT");
    assertThat(out()).contains("FUNCTION f");
  }

  @Test
  public void testOutputFile() throws IOException {
    String input = writeInput("in.js", "function g() {} g();");
    File output = new File(tempFolder.getRoot(), "out.js");
    CommandLineRunner runner = createRunner("--js", input, "--js_output_file", output.getPath());
    assertThat(runner.doRun()).isEqualTo(0);
    assertThat(Files.asCharSource(output, UTF_8).read()).isEqualTo("function g(){}g();");
    assertThat(out()).isEmpty();
  }

  @Test
  public void testParseErrorExitsWithFailure() throws IOException {
    String input = writeInput("bad.js", "var = 1;");
    CommandLineRunner runner = createRunner(input);
    assertThat(runner.doRun()).isEqualTo(1);
    assertThat(err()).contains("ERROR - [JSC_PARSE_ERROR]");
    assertThat(out()).isEmpty();
  }

  @Test
  public void testMissingInputFile() throws IOException {
    String missing = new File(tempFolder.getRoot(), "missing.js").getPath();
    CommandLineRunner runner = createRunner(missing);
    assertThat(runner.doRun()).isEqualTo(1);
    assertThat(err()).contains("ERROR - [JSC_READ_ERROR] Cannot read file " + missing);
  }

  @Test
  public void testNoInputs() {
    CommandLineRunner runner = createRunner();
    assertThat(runner.shouldRunCompiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
    assertThat(err()).contains("No input files");
  }

  @Test
  public void testHelp() {
    CommandLineRunner runner = createRunner("--help");
    assertThat(runner.shouldRunCompiler()).isFalse();
    assertThat(runner.hasErrors()).isFalse();
    assertThat(out()).contains("--js_output_file");
    assertThat(out()).contains("--dead_code_elimination");
  }

  @Test
  public void testUnknownFlag() {
    CommandLineRunner runner = createRunner("--no_such_flag", "in.js");
    assertThat(runner.shouldRunCompiler()).isFalse();
    assertThat(runner.hasErrors()).isTrue();
    assertThat(err()).contains("Run with --help for all options.");
  }

  @Test
  public void testBadLoggingLevel() {
    CommandLineRunner runner = createRunner("--logging_level=LOUD", "in.js");
    assertThat(runner.hasErrors()).isTrue();
    assertThat(err()).contains("Bad value for --logging_level: LOUD");
  }

  @Test
  public void testBadFormattingOption() {
    CommandLineRunner runner = createRunner("--formatting=UGLY", "in.js");
    assertThat(runner.hasErrors()).isTrue();
  }
}
