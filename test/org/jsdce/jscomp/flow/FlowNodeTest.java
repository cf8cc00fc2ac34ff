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

package org.jsdce.jscomp.flow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FlowNodeTest {
  private final FlowGraph graph = new FlowGraph();

  @Test
  public void testAddValueIsIdempotent() {
    FlowNode node = graph.createNode(null, "n");
    FlowValue value = graph.createValue(null, "v");
    assertThat(node.addValue(value)).isTrue();
    assertThat(node.addValue(value)).isFalse();
    assertThat(node.getValues()).containsExactly(value);
  }

  @Test
  public void testEdgeForwardsPresentAndFutureValues() {
    FlowNode a = graph.createNode(null, "a");
    FlowNode b = graph.createNode(null, "b");
    FlowValue early = graph.createValue(null, "early");
    FlowValue late = graph.createValue(null, "late");

    a.addValue(early);
    assertThat(a.connectTo(b)).isTrue();
    a.addValue(late);
    assertThat(b.getValues()).isEmpty();

    graph.getWorklist().drain();
    assertThat(b.getValues()).containsExactly(early, late);
  }

  @Test
  public void testEdgesAreDeduplicated() {
    FlowNode a = graph.createNode(null, "a");
    FlowNode b = graph.createNode(null, "b");
    assertThat(a.connectTo(b)).isTrue();
    assertThat(a.connectTo(b)).isFalse();
    assertThat(a.connectTo(a)).isFalse();
    assertThat(a.getSuccessors()).containsExactly(b);
  }

  @Test
  public void testCycleConverges() {
    FlowNode a = graph.createNode(null, "a");
    FlowNode b = graph.createNode(null, "b");
    FlowNode c = graph.createNode(null, "c");
    a.connectTo(b);
    b.connectTo(c);
    c.connectTo(a);
    FlowValue value = graph.createValue(null, "v");
    b.addValue(value);

    graph.getWorklist().drain();
    assertThat(a.contains(value)).isTrue();
    assertThat(c.contains(value)).isTrue();
    assertThat(graph.getWorklist().isEmpty()).isTrue();
  }

  @Test
  public void testUseMarksPresentAndFutureValues() {
    FlowNode node = graph.createNode(null, "n");
    FlowValue before = graph.createValue(null, "before");
    FlowValue after = graph.createValue(null, "after");
    node.addValue(before);
    assertThat(node.hasUsedValue()).isFalse();

    node.use();
    assertThat(node.isUsed()).isTrue();
    assertThat(before.isUsed()).isTrue();

    node.addValue(after);
    assertThat(after.isUsed()).isTrue();
    assertThat(node.hasUsedValue()).isTrue();
  }

  @Test
  public void testUsedValuesDoNotMarkNodes() {
    FlowNode node = graph.createNode(null, "n");
    FlowValue value = graph.createValue(null, "v");
    value.use();
    node.addValue(value);
    assertThat(node.hasUsedValue()).isTrue();
    assertThat(node.isUsed()).isFalse();
  }

  @Test
  public void testSubscribeReplaysExistingValuesThroughWorklist() {
    FlowNode node = graph.createNode(null, "n");
    FlowValue first = graph.createValue(null, "first");
    FlowValue second = graph.createValue(null, "second");
    node.addValue(first);

    List<FlowValue> seen = new ArrayList<>();
    node.subscribe(seen::add);
    assertThat(seen).isEmpty();

    node.addValue(second);
    graph.getWorklist().drain();
    assertThat(seen).containsExactly(first, second).inOrder();
  }

  @Test
  public void testValuesOfAnotherGraphAreRejected() {
    FlowNode node = graph.createNode(null, "n");
    FlowValue foreign = new FlowGraph().createValue(null, "foreign");
    assertThrows(IllegalArgumentException.class, () -> node.addValue(foreign));
  }
}
