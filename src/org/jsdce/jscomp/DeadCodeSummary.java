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

import com.google.common.base.MoreObjects;

/** Counts what a dead code elimination run removed from the tree. */
public final class DeadCodeSummary {
  private int removedFunctions;
  private int removedProperties;
  private int stubbedFunctions;
  private int replacedReferences;

  void recordRemovedFunction() {
    removedFunctions++;
  }

  void recordRemovedProperty() {
    removedProperties++;
  }

  void recordStubbedFunction() {
    stubbedFunctions++;
  }

  void recordReplacedReference() {
    replacedReferences++;
  }

  /** Function declarations deleted because their value is never observed. */
  public int getRemovedFunctions() {
    return removedFunctions;
  }

  /** Object literal properties deleted along with their never observed function. */
  public int getRemovedProperties() {
    return removedProperties;
  }

  /** Functions that are observed but never called, left with an empty body. */
  public int getStubbedFunctions() {
    return stubbedFunctions;
  }

  /** Identifier reads replaced by {@code null}. */
  public int getReplacedReferences() {
    return replacedReferences;
  }

  public boolean isEmpty() {
    return removedFunctions + removedProperties + stubbedFunctions + replacedReferences == 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("removedFunctions", removedFunctions)
        .add("removedProperties", removedProperties)
        .add("stubbedFunctions", stubbedFunctions)
        .add("replacedReferences", replacedReferences)
        .toString();
  }
}
