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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BasicErrorManagerTest {

  private static final DiagnosticType FOO_TYPE =
      DiagnosticType.error("TEST_FOO", "Foo description {0}");
  private static final DiagnosticType BAR_TYPE =
      DiagnosticType.warning("TEST_BAR", "Bar description");

  private final List<String> printed = new ArrayList<>();
  private BasicErrorManager manager;

  @Before
  public void setUp() {
    printed.clear();
    manager =
        new BasicErrorManager() {
          @Override
          public void println(CheckLevel level, JSError error) {
            printed.add(error.format(level));
          }

          @Override
          protected void printSummary() {
            printed.add(getErrorCount() + "/" + getWarningCount());
          }
        };
  }

  @Test
  public void testErrorsAreSortedBySourceThenPosition() {
    manager.report(CheckLevel.ERROR, JSError.make("b.js", 1, 0, FOO_TYPE, "3"));
    manager.report(CheckLevel.ERROR, JSError.make("a.js", 7, 2, FOO_TYPE, "2"));
    manager.report(CheckLevel.ERROR, JSError.make("a.js", 3, 9, FOO_TYPE, "1"));
    manager.generateReport();
    assertThat(printed)
        .containsExactly(
            "a.js:3:9: ERROR - [TEST_FOO] Foo description 1",
            "a.js:7:2: ERROR - [TEST_FOO] Foo description 2",
            "b.js:1:0: ERROR - [TEST_FOO] Foo description 3",
            "3/0")
        .inOrder();
  }

  @Test
  public void testErrorsComeBeforeWarnings() {
    manager.report(CheckLevel.WARNING, JSError.make("a.js", 1, 0, BAR_TYPE));
    manager.report(CheckLevel.ERROR, JSError.make("z.js", 9, 0, FOO_TYPE, "x"));
    manager.generateReport();
    assertThat(printed.get(0)).startsWith("z.js");
    assertThat(printed.get(1)).isEqualTo("a.js:1:0: WARNING - [TEST_BAR] Bar description");
    assertThat(manager.getErrors()).hasSize(1);
    assertThat(manager.getWarnings()).hasSize(1);
    assertThat(manager.hasHaltingErrors()).isTrue();
  }

  @Test
  public void testDuplicatesAreReportedOnce() {
    JSError error = JSError.make("a.js", 1, 0, FOO_TYPE, "x");
    manager.report(CheckLevel.ERROR, error);
    manager.report(CheckLevel.ERROR, JSError.make("a.js", 1, 0, FOO_TYPE, "x"));
    assertThat(manager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testWarningsDoNotHalt() {
    manager.report(CheckLevel.WARNING, JSError.make(BAR_TYPE));
    assertThat(manager.hasHaltingErrors()).isFalse();
    assertThat(manager.getWarningCount()).isEqualTo(1);
  }

  @Test
  public void testOffLevelIsNotCounted() {
    DiagnosticType off = DiagnosticType.make("TEST_OFF", CheckLevel.OFF, "quiet");
    JSError error = JSError.make(off);
    manager.report(error.defaultLevel(), error);
    assertThat(manager.getErrorCount()).isEqualTo(0);
    assertThat(manager.getWarningCount()).isEqualTo(0);
    assertThat(error.format(CheckLevel.OFF)).isNull();
  }

  @Test
  public void testErrorWithoutSource() {
    JSError error = JSError.make(FOO_TYPE, "y");
    assertThat(error.format(CheckLevel.ERROR)).isEqualTo("ERROR - [TEST_FOO] Foo description y");
    assertThat(error.toString())
        .isEqualTo(
            "TEST_FOO. Foo description y at (unknown source) line (unknown line) : (unknown"
                + " column)");
  }

  @Test
  public void testPrintStreamSummary() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    PrintStreamErrorManager printer =
        new PrintStreamErrorManager(new PrintStream(out, true, UTF_8));
    printer.generateReport();
    assertThat(out.toString(UTF_8)).isEmpty();

    printer.setSummaryDetailLevel(2);
    printer.generateReport();
    assertThat(out.toString(UTF_8)).isEqualTo(String.format("0 error(s), 0 warning(s)%n"));
  }
}
