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

import java.util.ArrayList;
import java.util.List;
import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * The arena of one analysis run. Owns every {@link FlowNode}, every {@link FlowValue} and the
 * {@link Worklist} that carries their notifications. Nodes and values are numbered in creation
 * order and never removed; the graph only grows.
 */
public final class FlowGraph {
  private final Worklist worklist = new Worklist();
  private final List<FlowNode> nodes = new ArrayList<>();
  private final List<FlowValue> values = new ArrayList<>();

  public FlowNode createNode(@Nullable Node origin, String label) {
    FlowNode node = new FlowNode(this, nodes.size(), origin, label);
    nodes.add(node);
    return node;
  }

  /** Creates a node that starts out holding {@code value}. */
  public FlowNode createNodeOf(FlowValue value) {
    FlowNode node = createNode(value.getOrigin(), value.getLabel());
    node.addValue(value);
    return node;
  }

  public FlowValue createValue(@Nullable Node origin, String label) {
    return addValue(new FlowValue(this, values.size(), origin, label, null));
  }

  /** Creates a value standing for the string {@code constant}. */
  public FlowValue createStringValue(@Nullable Node origin, String constant) {
    return addValue(new FlowValue(this, values.size(), origin, "'" + constant + "'", constant));
  }

  private FlowValue addValue(FlowValue value) {
    values.add(value);
    return value;
  }

  public Worklist getWorklist() {
    return worklist;
  }

  void defer(Runnable action) {
    worklist.add(action);
  }

  public int getNodeCount() {
    return nodes.size();
  }

  public int getValueCount() {
    return values.size();
  }
}
