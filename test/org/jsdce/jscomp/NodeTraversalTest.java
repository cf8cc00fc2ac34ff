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
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.jsdce.jscomp.NodeTraversal.AbstractScopedCallback;
import org.jsdce.jscomp.NodeTraversal.Callback;
import org.jsdce.rhino.IR;
import org.jsdce.rhino.Node;
import org.jsdce.rhino.Token;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTraversalTest {

  @Test
  public void testPostOrder() {
    Node root = CompilerTestCase.parse("a + b;");
    List<Token> visited = new ArrayList<>();
    NodeTraversal.traverse(
        root, (NodeTraversal t, Node n, Node parent) -> visited.add(n.getToken()));
    assertThat(visited)
        .containsExactly(
            Token.NAME, Token.NAME, Token.ADD, Token.EXPR_RESULT, Token.SCRIPT, Token.ROOT)
        .inOrder();
  }

  @Test
  public void testPrunedSubtreeIsNotVisited() {
    Node root = CompilerTestCase.parse("function f() { a; } b;");
    List<String> names = new ArrayList<>();
    Callback callback =
        new Callback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            return !n.isFunction();
          }

          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isName()) {
              names.add(n.getString());
            }
          }
        };
    NodeTraversal.traverse(root, callback);
    assertThat(names).containsExactly("b");
  }

  @Test
  public void testScopesFollowFunctions() {
    Node root = CompilerTestCase.parse("var x; function f(p) { var y = function g() {}; }");
    List<String> events = new ArrayList<>();
    AbstractScopedCallback callback =
        new AbstractScopedCallback() {
          @Override
          public void enterScope(NodeTraversal t) {
            events.add("enter" + t.getScope().getDepth());
          }

          @Override
          public void exitScope(NodeTraversal t) {
            events.add("exit" + t.getScope().getDepth());
          }

          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isName() && n.getString().equals("p")) {
              assertThat(t.inGlobalScope()).isFalse();
              assertThat(t.getScope().getVar("p").isParam()).isTrue();
            }
            if (n.isName() && n.getString().equals("x")) {
              assertThat(t.inGlobalScope()).isTrue();
              assertThat(t.getScope().getRootNode().isRoot()).isTrue();
            }
          }
        };
    NodeTraversal.traverse(root, callback);
    assertThat(events)
        .containsExactly("enter0", "enter1", "enter2", "exit2", "exit1", "exit0")
        .inOrder();
  }

  @Test
  public void testDeclarationNameIsVisitedInOuterScope() {
    Node root = CompilerTestCase.parse("function f() {} var e = function g() {};");
    List<String> seen = new ArrayList<>();
    NodeTraversal.traverse(
        root,
        (NodeTraversal t, Node n, Node parent) -> {
          if (n.isName() && parent != null && parent.isFunction()) {
            seen.add(n.getString() + "@" + t.getScope().getDepth());
          }
        });
    assertThat(seen).containsExactly("f@0", "g@1").inOrder();
  }

  @Test
  public void testReplacingVisitedNode() {
    Node root = CompilerTestCase.parse("a; b;");
    NodeTraversal.traverse(
        root,
        (NodeTraversal t, Node n, Node parent) -> {
          if (n.isName() && n.getString().equals("a")) {
            n.replaceWith(IR.nullNode());
          }
        });
    assertThat(root.getFirstChild().getFirstChild().getOnlyChild().isNull()).isTrue();
  }

  @Test
  public void testCallbackFailureIsWrappedWithContext() {
    Node root = CompilerTestCase.parse("a;");
    RuntimeException e =
        assertThrows(
            RuntimeException.class,
            () ->
                NodeTraversal.traverse(
                    root,
                    (NodeTraversal t, Node n, Node parent) -> {
                      throw new IllegalStateException("boom");
                    }));
    assertThat(e).hasMessageThat().contains("INTERNAL COMPILER ERROR");
    assertThat(e).hasMessageThat().contains("boom");
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }
}
