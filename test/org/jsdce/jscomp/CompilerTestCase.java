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

import static com.google.common.truth.Truth.assertWithMessage;

import org.jsdce.jscomp.parsing.ParserRunner;
import org.jsdce.rhino.IR;
import org.jsdce.rhino.Node;
import org.junit.Before;

/**
 * Base class for testing JS compiler classes that change the node tree of a compiled JS input.
 *
 * <p>Pulls in shared functionality from different test cases. Parses both the input and the
 * expected output, runs the pass returned by {@link #getProcessor()} over the input and compares
 * the two trees structurally.
 */
public abstract class CompilerTestCase {

  /** The root of the last input the pass ran on. */
  private Node lastRoot;

  @Before
  public void setUp() throws Exception {
    lastRoot = null;
  }

  /** Gets a compiler pass for running tests. */
  protected abstract CompilerPass getProcessor();

  /**
   * Verifies that the compiler pass's JS output matches the expected output.
   *
   * @param js Input
   * @param expected Expected JS output
   */
  protected void test(String js, String expected) {
    CompilerPass pass = getProcessor();
    Node root = parse(js);
    pass.process(root);
    lastRoot = root;

    Node expectedRoot = parse(expected);
    assertWithMessage(
            "\nExpected: %s\nResult:   %s\n\nExpected tree:\n%s\nResult tree:\n%s",
            toSource(expectedRoot),
            toSource(root),
            expectedRoot.toStringTree(),
            root.toStringTree())
        .that(root.isEquivalentTo(expectedRoot))
        .isTrue();
  }

  /** Verifies that the compiler pass's JS output is the same as its input. */
  protected void testSame(String js) {
    test(js, js);
  }

  /** Returns the tree the last test ran the pass on. */
  protected Node getLastRoot() {
    return lastRoot;
  }

  /** Parses one source into a {@code ROOT(SCRIPT)} tree, failing the test on a syntax error. */
  protected static Node parse(String js) {
    Node script =
        ParserRunner.parse(
                "testcode",
                js,
                (message, sourceName, line, lineOffset) -> {
                  throw new AssertionError(
                      "Unexpected parse error: " + message + " at " + line + ":" + lineOffset);
                })
            .ast();
    return IR.root(script);
  }

  protected static String toSource(Node root) {
    return new CodePrinter.Builder(root).build();
  }
}
