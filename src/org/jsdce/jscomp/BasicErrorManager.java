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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.TreeSet;

/**
 * An error manager that sorts the reported diagnostics and generates a report when the {@link
 * #generateReport()} method is called.
 *
 * <p>This error manager does not produce any output, but subclasses can override the {@link
 * #println(CheckLevel, JSError)} method to generate custom output.
 */
public abstract class BasicErrorManager implements ErrorManager {

  private static final Comparator<ErrorWithLevel> LEVELED_ERROR_ORDER =
      Comparator.<ErrorWithLevel, CheckLevel>comparing(e -> e.level)
          .thenComparing(
              e -> e.error.sourceName(), Comparator.nullsFirst(Comparator.naturalOrder()))
          .thenComparingInt(e -> e.error.lineno())
          .thenComparingInt(e -> e.error.charno())
          .thenComparing(e -> e.error.description());

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(LEVELED_ERROR_ORDER);
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, JSError error) {
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, JSError error);

  /** Print the summary of the compilation - number of errors and warnings. */
  protected abstract void printSummary();

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<JSError> getErrors() {
    return filter(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<JSError> getWarnings() {
    return filter(CheckLevel.WARNING);
  }

  private ImmutableList<JSError> filter(CheckLevel level) {
    ImmutableList.Builder<JSError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  private static final class ErrorWithLevel {
    final JSError error;
    final CheckLevel level;

    ErrorWithLevel(JSError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }
}
