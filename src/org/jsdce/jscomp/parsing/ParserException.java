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

/** Unwinds the parser to {@link ParserRunner} after the first syntax error. */
final class ParserException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int lineno;
  private final int charno;

  ParserException(String message, int lineno, int charno) {
    super(message);
    this.lineno = lineno;
    this.charno = charno;
  }

  int getLineno() {
    return lineno;
  }

  int getCharno() {
    return charno;
  }
}
