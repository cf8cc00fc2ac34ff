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

import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/** Runs the scanner and parser over one source and reports syntax errors. */
public final class ParserRunner {

  private ParserRunner() {}

  /**
   * Parses the source into a SCRIPT node whose nodes all carry {@code sourceName}.
   *
   * @return a result whose AST is null if a syntax error was reported
   */
  public static ParseResult parse(
      String sourceName, String sourceString, ErrorReporter errorReporter) {
    try {
      Node script = new Parser(new Scanner(sourceString).tokenize()).parseScript();
      setSourceFileName(script, sourceName);
      return new ParseResult(script);
    } catch (ParserException e) {
      errorReporter.error(e.getMessage(), sourceName, e.getLineno(), e.getCharno());
      return new ParseResult(null);
    }
  }

  private static void setSourceFileName(Node n, String sourceName) {
    n.setSourceFileName(sourceName);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      setSourceFileName(c, sourceName);
    }
  }

  /** Holds the results of running the parser. */
  public record ParseResult(@Nullable Node ast) {}
}
