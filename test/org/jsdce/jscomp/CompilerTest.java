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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest {

  private ByteArrayOutputStream errStream;
  private Compiler compiler;

  @Before
  public void setUp() {
    errStream = new ByteArrayOutputStream();
    compiler = new Compiler(new PrintStream(errStream, true, UTF_8));
  }

  private static CompilerOptions deadCodeOptions() {
    CompilerOptions options = new CompilerOptions();
    options.setFlowDeadCodeElimination(true);
    return options;
  }

  @Test
  public void testParseErrorFailsCompilation() {
    Result result =
        compiler.compile(ImmutableList.of(SourceFile.fromCode("in.js", "a b")), deadCodeOptions());

    assertThat(result.success).isFalse();
    assertThat(result.errors).hasSize(1);
    JSError error = result.errors.get(0);
    assertThat(error.type()).isEqualTo(RhinoErrorReporter.PARSE_ERROR);
    assertThat(error.sourceName()).isEqualTo("in.js");
    assertThat(error.lineno()).isEqualTo(1);
    assertThat(error.charno()).isEqualTo(2);
    assertThat(result.deadCodeSummary.isEmpty()).isTrue();

    String printed = errStream.toString(UTF_8);
    assertThat(printed).contains("in.js:1:2: ERROR - [JSC_PARSE_ERROR] Parse error. ");
    assertThat(printed).contains("1 error(s), 0 warning(s)");
  }

  @Test
  public void testErrorsInSeveralInputsAreAllReported() {
    Result result =
        compiler.compile(
            ImmutableList.of(
                SourceFile.fromCode("one.js", "var = 1;"),
                SourceFile.fromCode("two.js", "f();"),
                SourceFile.fromCode("three.js", "return;")),
            deadCodeOptions());
    assertThat(result.errors).hasSize(2);
    assertThat(result.errors.get(0).sourceName()).isEqualTo("one.js");
    assertThat(result.errors.get(1).sourceName()).isEqualTo("three.js");
  }

  @Test
  public void testDeadCodeElimination() {
    Result result =
        compiler.compile(
            ImmutableList.of(SourceFile.fromCode("in.js", "function f() {} function g() {} g();")),
            deadCodeOptions());

    assertThat(result.success).isTrue();
    assertThat(result.deadCodeSummary.getRemovedFunctions()).isEqualTo(1);
    assertThat(compiler.toSource()).isEqualTo("function g(){}g();");
    assertThat(errStream.toString(UTF_8)).isEmpty();
  }

  @Test
  public void testKeepingDeadReferencesStubsInsteadOfRemoving() {
    CompilerOptions options = deadCodeOptions();
    options.setRemoveDeadReferences(false);
    Result result =
        compiler.compile(
            ImmutableList.of(SourceFile.fromCode("in.js", "function f() { x(); }")), options);

    assertThat(result.success).isTrue();
    assertThat(result.deadCodeSummary.getRemovedFunctions()).isEqualTo(0);
    assertThat(result.deadCodeSummary.getStubbedFunctions()).isEqualTo(1);
    assertThat(compiler.toSource()).isEqualTo("function f(){}");
  }

  @Test
  public void testInputsShareOneProgram() {
    Result result =
        compiler.compile(
            ImmutableList.of(
                SourceFile.fromCode("lib.js", "function used() {} function unused() {}"),
                SourceFile.fromCode("main.js", "used();")),
            deadCodeOptions());

    assertThat(result.success).isTrue();
    assertThat(compiler.getRoot().getChildCount()).isEqualTo(2);
    assertThat(compiler.toSource()).isEqualTo("function used(){}used();");
  }

  @Test
  public void testPassIsOffByDefault() {
    Result result =
        compiler.compile(
            ImmutableList.of(SourceFile.fromCode("in.js", "function f() {}")),
            new CompilerOptions());
    assertThat(result.success).isTrue();
    assertThat(result.deadCodeSummary.isEmpty()).isTrue();
    assertThat(compiler.toSource()).isEqualTo("function f(){}");
  }

  @Test
  public void testPrettyPrintOption() {
    CompilerOptions options = deadCodeOptions();
    options.setPrettyPrint(true);
    compiler.compile(
        ImmutableList.of(SourceFile.fromCode("in.js", "function g() { return 1; } g();")), options);
    assertThat(compiler.toSource()).isEqualTo("function g() {\n  return 1;\n}\ng();\n");
  }

  @Test
  public void testToSourceBeforeCompile() {
    assertThat(compiler.toSource()).isEmpty();
    assertThat(compiler.getRoot()).isNull();
  }

  @Test
  public void testCompileTwiceFails() {
    compiler.compile(ImmutableList.of(SourceFile.fromCode("in.js", "")), new CompilerOptions());
    assertThrows(
        IllegalStateException.class,
        () -> compiler.compile(ImmutableList.of(), new CompilerOptions()));
  }

  @Test
  public void testReportedErrorHalts() {
    compiler.report(JSError.make(Compiler.READ_ERROR, "missing.js", "not found"));
    assertThat(compiler.hasErrors()).isTrue();
    assertThat(compiler.getResult().errors.get(0).description())
        .isEqualTo("Cannot read file missing.js: not found");
  }

  @Test
  public void testNullErrorManagerRejected() {
    assertThrows(NullPointerException.class, () -> compiler.setErrorManager(null));
  }
}
