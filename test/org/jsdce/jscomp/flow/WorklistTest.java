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

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class WorklistTest {

  @Test
  public void testRunNextOnEmptyQueue() {
    Worklist worklist = new Worklist();
    assertThat(worklist.isEmpty()).isTrue();
    assertThat(worklist.runNext()).isFalse();
    assertThat(worklist.getExecutedCount()).isEqualTo(0);
  }

  @Test
  public void testActionsRunInInsertionOrder() {
    Worklist worklist = new Worklist();
    List<String> log = new ArrayList<>();
    worklist.add(() -> log.add("a"));
    worklist.add(() -> log.add("b"));
    assertThat(worklist.size()).isEqualTo(2);

    assertThat(worklist.runNext()).isTrue();
    assertThat(log).containsExactly("a");
    worklist.drain();
    assertThat(log).containsExactly("a", "b").inOrder();
  }

  @Test
  public void testDrainRunsActionsEnqueuedWhileDraining() {
    Worklist worklist = new Worklist();
    List<Integer> log = new ArrayList<>();
    worklist.add(
        () -> {
          log.add(1);
          worklist.add(() -> log.add(3));
        });
    worklist.add(() -> log.add(2));

    assertThat(worklist.drain()).isEqualTo(3);
    assertThat(log).containsExactly(1, 2, 3).inOrder();
    assertThat(worklist.isEmpty()).isTrue();
    assertThat(worklist.getExecutedCount()).isEqualTo(3);
  }
}
