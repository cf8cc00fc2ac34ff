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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * A slot of the flow graph: the set of abstract values observable at one program point or held by
 * one binding.
 *
 * <p>Values, successor edges and the used flag only ever accumulate. An edge to another node
 * forwards every value this node holds now or later. Once the node is used every value it holds,
 * now or later, is used as well.
 */
public final class FlowNode {
  private final FlowGraph graph;
  private final int id;
  private final @Nullable Node origin;
  private final String label;
  private final Set<FlowValue> values = new LinkedHashSet<>();
  private final Set<FlowNode> successors = new LinkedHashSet<>();
  private final List<NodeListener> listeners = new ArrayList<>();
  private boolean used;

  FlowNode(FlowGraph graph, int id, @Nullable Node origin, String label) {
    this.graph = graph;
    this.id = id;
    this.origin = origin;
    this.label = label;
  }

  /**
   * Adds a value to this node and schedules its delivery to the listeners.
   *
   * @return false if the node already held the value, in which case nothing happens
   */
  @CanIgnoreReturnValue
  public boolean addValue(FlowValue value) {
    checkArgument(value.getGraph() == graph, "%s belongs to another graph", value);
    if (!values.add(value)) {
      return false;
    }
    if (used) {
      value.use();
    }
    ImmutableList<NodeListener> targets = ImmutableList.copyOf(listeners);
    if (!targets.isEmpty()) {
      graph.defer(
          () -> {
            for (NodeListener listener : targets) {
              listener.valueAdded(value);
            }
          });
    }
    return true;
  }

  /**
   * Adds an edge to {@code other}: every value this node holds or will hold also reaches it.
   *
   * @return false if the edge already existed
   */
  @CanIgnoreReturnValue
  public boolean connectTo(FlowNode other) {
    checkArgument(other.graph == graph, "%s belongs to another graph", other);
    if (other == this || !successors.add(other)) {
      return false;
    }
    subscribe(other::addValue);
    return true;
  }

  /** Marks this node used, which marks every value it holds or will hold used. */
  public void use() {
    if (used) {
      return;
    }
    used = true;
    for (FlowValue value : ImmutableList.copyOf(values)) {
      value.use();
    }
  }

  /**
   * Registers a listener. Values already held are replayed through the worklist, so the order in
   * which listeners and values arrive never changes what a listener sees.
   */
  public void subscribe(NodeListener listener) {
    listeners.add(listener);
    for (FlowValue value : values) {
      graph.defer(() -> listener.valueAdded(value));
    }
  }

  public boolean isUsed() {
    return used;
  }

  /** Whether at least one value held here has been used. */
  public boolean hasUsedValue() {
    for (FlowValue value : values) {
      if (value.isUsed()) {
        return true;
      }
    }
    return false;
  }

  public boolean contains(FlowValue value) {
    return values.contains(value);
  }

  public Set<FlowValue> getValues() {
    return Collections.unmodifiableSet(values);
  }

  public Set<FlowNode> getSuccessors() {
    return Collections.unmodifiableSet(successors);
  }

  public int getId() {
    return id;
  }

  public @Nullable Node getOrigin() {
    return origin;
  }

  public String getLabel() {
    return label;
  }

  FlowGraph getGraph() {
    return graph;
  }

  @Override
  public String toString() {
    return "node#" + id + (label.isEmpty() ? "" : " " + label);
  }
}
