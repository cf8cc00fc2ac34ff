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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * Scope contains information about a variable scope in JavaScript. Scopes can be nested, a scope
 * points back to its parent scope. A Scope contains information about variables defined in that
 * scope.
 *
 * <p>Scopes are function level: the global scope is rooted at the ROOT node and every FUNCTION
 * node roots a local scope.
 *
 * @see NodeTraversal
 */
public final class Scope {

  private final Map<String, Var> vars = new LinkedHashMap<>();
  private final @Nullable Scope parent;
  private final int depth;
  private final Node rootNode;
  private @Nullable Var arguments;

  static Scope createGlobalScope(Node rootNode) {
    return new Scope(null, rootNode);
  }

  static Scope createChildScope(Scope parent, Node rootNode) {
    checkArgument(rootNode.isFunction(), "Child scopes must be rooted at a function: %s", rootNode);
    return new Scope(parent, rootNode);
  }

  private Scope(@Nullable Scope parent, Node rootNode) {
    this.parent = parent;
    this.depth = parent == null ? 0 : parent.getDepth() + 1;
    this.rootNode = rootNode;
  }

  public int getDepth() {
    return depth;
  }

  public @Nullable Scope getParent() {
    return parent;
  }

  /** Gets the container node of the scope: a FUNCTION, or the ROOT for the global scope. */
  public Node getRootNode() {
    return rootNode;
  }

  public boolean isGlobal() {
    return parent == null;
  }

  public boolean isLocal() {
    return parent != null;
  }

  /**
   * Declares a variable.
   *
   * @param name name of the variable
   * @param nameNode the NAME node declaring the variable
   */
  Var declare(String name, Node nameNode) {
    checkArgument(!name.isEmpty());
    // Make sure that it's declared only once
    checkState(getOwnSlot(name) == null, "Duplicate declaration of %s", name);
    Var var = new Var(name, nameNode, this, vars.size());
    vars.put(name, var);
    return var;
  }

  /** Returns the variable declared directly in this scope, ignoring parents. */
  public @Nullable Var getOwnSlot(String name) {
    return vars.get(name);
  }

  public boolean hasOwnSlot(String name) {
    return vars.containsKey(name);
  }

  /**
   * Returns the variable, may be null. Walks the scope chain; the implicit {@code arguments}
   * variable of a function scope is found if nothing closer declares the name.
   */
  public @Nullable Var getVar(String name) {
    for (Scope s = this; s != null; s = s.parent) {
      Var var = s.vars.get(name);
      if (var != null) {
        return var;
      }
      if (s.isLocal() && name.equals(Var.ARGUMENTS)) {
        return s.getArgumentsVar();
      }
    }
    return null;
  }

  /** Get a unique Var object to represent "arguments" within this scope. */
  public Var getArgumentsVar() {
    checkState(isLocal(), "The global scope has no arguments object");
    if (arguments == null) {
      arguments = Var.makeArgumentsVar(this);
    }
    return arguments;
  }

  public int getVarCount() {
    return vars.size();
  }

  @Override
  public String toString() {
    return (isGlobal() ? "Global" : "Local") + "Scope@" + rootNode;
  }
}
