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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;

/**
 * A FIFO queue of deferred graph reactions.
 *
 * <p>Every listener notification in a {@link FlowGraph} goes through the worklist instead of being
 * invoked synchronously, so a long chain of subscribers never grows the call stack and a listener
 * never observes a half-updated node. Analysis runs in two phases: the tree is walked once while
 * actions accumulate, then {@link #drain()} runs actions until no more are produced.
 */
public final class Worklist {
  private final ArrayDeque<Runnable> queue = new ArrayDeque<>();
  private long executed;

  /** Enqueues an action to run after every action already queued. */
  public void add(Runnable action) {
    queue.add(action);
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  /** The number of actions waiting to run. */
  public int size() {
    return queue.size();
  }

  /** The number of actions run since this worklist was created. */
  public long getExecutedCount() {
    return executed;
  }

  /**
   * Runs the action at the head of the queue.
   *
   * @return false if the queue was empty
   */
  @CanIgnoreReturnValue
  public boolean runNext() {
    Runnable action = queue.poll();
    if (action == null) {
      return false;
    }
    executed++;
    action.run();
    return true;
  }

  /**
   * Runs queued actions, including the ones they enqueue, until the queue is empty.
   *
   * @return the number of actions run
   */
  @CanIgnoreReturnValue
  public long drain() {
    long count = 0;
    while (runNext()) {
      count++;
    }
    return count;
  }
}
