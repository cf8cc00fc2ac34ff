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

import org.jsdce.jscomp.parsing.ErrorReporter;

/** An error reporter for serializing parser errors into our error format. */
class RhinoErrorReporter implements ErrorReporter {

  static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("JSC_PARSE_ERROR", "Parse error. {0}");

  private final ErrorManager errorManager;

  RhinoErrorReporter(ErrorManager errorManager) {
    this.errorManager = errorManager;
  }

  @Override
  public void error(String message, String sourceName, int line, int lineOffset) {
    JSError error = JSError.make(sourceName, line, lineOffset, PARSE_ERROR, message);
    errorManager.report(error.defaultLevel(), error);
  }
}
