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

import org.jsdce.rhino.Node;
import org.jsdce.rhino.Token;
import org.jspecify.annotations.Nullable;

/** Used by {@code Scope} to store information about variables. */
public class Var {

  static final String ARGUMENTS = "arguments";

  final String name;

  /** Var node */
  final @Nullable Node nameNode;

  /** Scope of the variable */
  final Scope scope;

  /** @see #getIndex() */
  final int index;

  Var(String name, @Nullable Node nameNode, Scope scope, int index) {
    this.name = name;
    this.nameNode = nameNode;
    this.scope = scope;
    this.index = index;
  }

  static Var makeArgumentsVar(Scope scope) {
    return new Arguments(scope);
  }

  /** Returns the name of the variable. */
  public final String getName() {
    return name;
  }

  /** Returns the NAME node that declares this variable, or null for implicit variables. */
  public final @Nullable Node getNameNode() {
    return nameNode;
  }

  public final Scope getScope() {
    return scope;
  }

  /** The index at which the var is declared. e.g. if it's 0, it's the first declared variable. */
  public final int getIndex() {
    return index;
  }

  public final boolean isGlobal() {
    return scope.isGlobal();
  }

  public final boolean isLocal() {
    return scope.isLocal();
  }

  /** Returns the node declaring this variable: the VAR, FUNCTION, PARAM_LIST or CATCH. */
  public final @Nullable Node getParentNode() {
    return nameNode == null ? null : nameNode.getParent();
  }

  private @Nullable Token declarationType() {
    Node parent = getParentNode();
    return parent == null ? null : parent.getToken();
  }

  public final boolean isVar() {
    return declarationType() == Token.VAR;
  }

  public final boolean isParam() {
    return declarationType() == Token.PARAM_LIST;
  }

  public final boolean isCatch() {
    return declarationType() == Token.CATCH;
  }

  public final boolean isFunctionDeclaration() {
    return declarationType() == Token.FUNCTION && NodeUtil.isFunctionDeclaration(getParentNode());
  }

  /** Whether this is the name of a function expression, visible only inside its own body. */
  public boolean isBleedingFunction() {
    return declarationType() == Token.FUNCTION && NodeUtil.isFunctionExpression(getParentNode());
  }

  public boolean isArguments() {
    return false;
  }

  @Override
  public String toString() {
    return "Var " + name + " @ " + nameNode;
  }

  /** A special subclass of Var used to distinguish "arguments" in the current scope. */
  private static class Arguments extends Var {
    Arguments(Scope scope) {
      super(
          ARGUMENTS, // always arguments
          null, // no declaration node
          scope,
          -1); // no variable index
    }

    @Override
    public boolean isArguments() {
      return true;
    }

    @Override
    public boolean isBleedingFunction() {
      return false;
    }
  }
}
