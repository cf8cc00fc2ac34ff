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

/** Compiler options */
public class CompilerOptions {

  /** Removes code the value flow analysis proves is never observed. */
  private boolean flowDeadCodeElimination = false;

  /**
   * Empties the body of functions that are observed but never called. When off, such functions are
   * analyzed as if called once they are observed.
   */
  private boolean stubUncalledFunctions = true;

  /** Replaces identifier reads whose value is never observed with {@code null}. */
  private boolean removeDeadReferences = true;

  /** Output in pretty indented format */
  private boolean prettyPrint = false;

  public CompilerOptions() {}

  public void setFlowDeadCodeElimination(boolean flowDeadCodeElimination) {
    this.flowDeadCodeElimination = flowDeadCodeElimination;
  }

  public boolean getFlowDeadCodeElimination() {
    return flowDeadCodeElimination;
  }

  public void setStubUncalledFunctions(boolean stubUncalledFunctions) {
    this.stubUncalledFunctions = stubUncalledFunctions;
  }

  public boolean getStubUncalledFunctions() {
    return stubUncalledFunctions;
  }

  public void setRemoveDeadReferences(boolean removeDeadReferences) {
    this.removeDeadReferences = removeDeadReferences;
  }

  public boolean getRemoveDeadReferences() {
    return removeDeadReferences;
  }

  public void setPrettyPrint(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  public boolean isPrettyPrint() {
    return prettyPrint;
  }
}
