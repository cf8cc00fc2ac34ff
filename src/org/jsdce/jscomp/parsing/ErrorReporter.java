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

package org.jsdce.jscomp.parsing;

/** Receives the syntax errors found while parsing one source. */
public interface ErrorReporter {

  /**
   * Report an error.
   *
   * @param message a String describing the error
   * @param sourceName a String describing the JavaScript source where the error occurred
   * @param line the one-indexed line number associated with the error
   * @param lineOffset the zero-indexed column within that line
   */
  void error(String message, String sourceName, int line, int lineOffset);
}
