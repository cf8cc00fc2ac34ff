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

/**
 * Receives the slots a {@link FlowValue} creates and the moment it becomes used. A listener sees
 * every slot exactly once, whether it was created before or after the listener subscribed.
 */
public interface ValueListener {
  default void memberAdded(String name, FlowNode member) {}

  default void dynamicMemberAdded(FlowNode member) {}

  /** Slot 0 is the receiver; call arguments start at 1. */
  default void parameterAdded(int index, FlowNode parameter) {}

  default void returnAdded(FlowNode returnNode) {}

  default void used() {}
}
