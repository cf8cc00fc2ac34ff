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

/**
 * The error manager is in charge of storing, organizing and displaying errors and warnings
 * reported by the compiler.
 */
public interface ErrorManager {

  /** Reports an error. The errors will be displayed by {@link #generateReport()}. */
  void report(CheckLevel level, JSError error);

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  /** Gets the number of errors. */
  int getErrorCount();

  /** Gets the number of warnings. */
  int getWarningCount();

  /** Gets all errors, sorted by source position. */
  ImmutableList<JSError> getErrors();

  /** Gets all warnings, sorted by source position. */
  ImmutableList<JSError> getWarnings();

  /** Returns whether compilation should stop. */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
