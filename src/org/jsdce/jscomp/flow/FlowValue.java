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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * An abstract runtime object: an ordinary object, a function, a string constant or one of the
 * sentinels of the analysis.
 *
 * <p>A value owns its slots: one node per named member, one dynamic member standing for every
 * computed name, positional parameters (0 is the receiver) and a return node. Slot accessors
 * create the slot on first request and return the same node afterwards. Listeners hear about every
 * slot through the worklist, and about the value becoming used.
 *
 * <p>The dynamic member aliases the named members: once it exists, it and every named member
 * forward their values to each other, so a computed-name access sees every property and a
 * property access sees every computed-name write.
 */
public final class FlowValue {
  private final FlowGraph graph;
  private final int id;
  private final @Nullable Node origin;
  private final String label;
  private final @Nullable String stringConstant;
  private final Map<String, FlowNode> members = new LinkedHashMap<>();
  private @Nullable FlowNode dynamicMember;
  private final List<FlowNode> parameters = new ArrayList<>();
  private @Nullable FlowNode returnNode;
  private final List<ValueListener> listeners = new ArrayList<>();
  private boolean used;

  FlowValue(
      FlowGraph graph,
      int id,
      @Nullable Node origin,
      String label,
      @Nullable String stringConstant) {
    this.graph = graph;
    this.id = id;
    this.origin = origin;
    this.label = label;
    this.stringConstant = stringConstant;
  }

  /** Returns the member slot for {@code name}, creating it on first request. */
  public FlowNode getMember(String name) {
    FlowNode member = members.get(name);
    if (member == null) {
      member = graph.createNode(origin, label + "." + name);
      members.put(name, member);
      FlowNode created = member;
      notifyListeners(listener -> listener.memberAdded(name, created));
    }
    return member;
  }

  /** Returns the member slot for {@code name} if some access already created it. */
  public @Nullable FlowNode getExistingMember(String name) {
    return members.get(name);
  }

  public FlowNode getDynamicMember() {
    if (dynamicMember == null) {
      FlowNode created = graph.createNode(origin, label + "[*]");
      dynamicMember = created;
      notifyListeners(listener -> listener.dynamicMemberAdded(created));
      subscribe(
          new ValueListener() {
            @Override
            public void memberAdded(String name, FlowNode member) {
              created.connectTo(member);
              member.connectTo(created);
            }
          });
    }
    return dynamicMember;
  }

  public boolean hasDynamicMember() {
    return dynamicMember != null;
  }

  /**
   * Returns the parameter slot at {@code index}, creating it and every missing slot below it on
   * first request.
   */
  public FlowNode getParameter(int index) {
    checkArgument(index >= 0, "Negative parameter index %s", index);
    while (parameters.size() <= index) {
      int created = parameters.size();
      FlowNode parameter = graph.createNode(origin, label + "|" + created);
      parameters.add(parameter);
      notifyListeners(listener -> listener.parameterAdded(created, parameter));
    }
    return parameters.get(index);
  }

  public int getParameterCount() {
    return parameters.size();
  }

  public FlowNode getReturn() {
    if (returnNode == null) {
      FlowNode created = graph.createNode(origin, label + "|return");
      returnNode = created;
      notifyListeners(listener -> listener.returnAdded(created));
    }
    return returnNode;
  }

  /** Marks this value used; listeners hear about it through the worklist. */
  public void use() {
    if (used) {
      return;
    }
    used = true;
    notifyListeners(ValueListener::used);
  }

  public boolean isUsed() {
    return used;
  }

  /**
   * Registers a listener. Slots that already exist, and the used flag if set, are replayed through
   * the worklist.
   */
  public void subscribe(ValueListener listener) {
    listeners.add(listener);
    if (dynamicMember != null) {
      FlowNode existing = dynamicMember;
      graph.defer(() -> listener.dynamicMemberAdded(existing));
    }
    for (Map.Entry<String, FlowNode> entry : members.entrySet()) {
      String name = entry.getKey();
      FlowNode member = entry.getValue();
      graph.defer(() -> listener.memberAdded(name, member));
    }
    for (int i = 0; i < parameters.size(); i++) {
      int index = i;
      FlowNode parameter = parameters.get(i);
      graph.defer(() -> listener.parameterAdded(index, parameter));
    }
    if (returnNode != null) {
      FlowNode existing = returnNode;
      graph.defer(() -> listener.returnAdded(existing));
    }
    if (used) {
      graph.defer(listener::used);
    }
  }

  private void notifyListeners(Notification notification) {
    ImmutableList<ValueListener> targets = ImmutableList.copyOf(listeners);
    if (!targets.isEmpty()) {
      graph.defer(
          () -> {
            for (ValueListener listener : targets) {
              notification.deliver(listener);
            }
          });
    }
  }

  /** The string this value stands for, or null if it is not a string constant. */
  public @Nullable String getStringConstant() {
    return stringConstant;
  }

  /** Whether this value was created by a function literal. */
  public boolean isFunction() {
    return origin != null && origin.isFunction();
  }

  public int getId() {
    return id;
  }

  /** The tree node this value was created for, if any. */
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
    return "value#" + id + (label.isEmpty() ? "" : " " + label);
  }

  private interface Notification {
    void deliver(ValueListener listener);
  }
}
