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

import static com.google.common.base.Preconditions.checkState;

import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * The syntactic scope creator scans the parse tree to create a Scope object containing all the
 * variable declarations in that scope.
 *
 * <p>This implementation is not thread-safe.
 */
public class SyntacticScopeCreator implements ScopeCreator {
  private @Nullable Scope scope;

  @Override
  public Scope createScope(Node n, @Nullable Scope parent) {
    if (parent == null) {
      scope = Scope.createGlobalScope(n);
    } else {
      scope = Scope.createChildScope(parent, n);
    }

    scanRoot(n);

    Scope returnedScope = scope;
    scope = null;
    return returnedScope;
  }

  private void scanRoot(Node n) {
    if (n.isFunction()) {
      final Node fnNameNode = n.getFirstChild();
      final Node args = fnNameNode.getNext();
      final Node body = args.getNext();

      // Bleed the function name into the scope, if it hasn't
      // been declared in the outer scope.
      String fnName = fnNameNode.getString();
      if (!fnName.isEmpty() && NodeUtil.isFunctionExpression(n)) {
        declareVar(fnNameNode);
      }

      // Args: Declare function variables
      checkState(args.isParamList());
      for (Node a = args.getFirstChild(); a != null; a = a.getNext()) {
        checkState(a.isName());
        declareVar(a);
      }

      // Body
      scanVars(body);
    } else {
      checkState(scope.getParent() == null, "Expected %s to be the global scope.", scope);
      scanVars(n);
    }
  }

  /** Scans and gather variables declarations under a Node */
  private void scanVars(Node n) {
    switch (n.getToken()) {
      case VAR:
        // Declare all variables. e.g. var x = 1, y, z;
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          declareVar(child);
        }
        return;

      case FUNCTION:
        if (NodeUtil.isFunctionExpression(n)) {
          return;
        }

        String fnName = n.getFirstChild().getString();
        if (fnName.isEmpty()) {
          // This is invalid, but allow it so the checks can catch it.
          return;
        }
        declareVar(n.getFirstChild());
        return; // should not examine function's children

      case CATCH:
        checkState(n.hasTwoChildren(), n);
        // The first child is the catch var and the second child
        // is the code block.

        final Node var = n.getFirstChild();
        checkState(var.isName(), var);

        declareVar(var);
        scanVars(var.getNext());
        return; // only one child to scan

      default:
        break;
    }

    // Variables can only occur in statement-level nodes, so
    // we only need to traverse children in a couple special cases.
    if (isVarContainer(n)) {
      for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
        scanVars(child);
      }
    }
  }

  private static boolean isVarContainer(Node n) {
    switch (n.getToken()) {
      case ROOT:
      case SCRIPT:
      case BLOCK:
      case IF:
      case WHILE:
      case DO:
      case FOR:
      case FOR_IN:
      case SWITCH:
      case CASE:
      case DEFAULT_CASE:
      case TRY:
      case LABEL:
      case WITH:
        return true;
      default:
        return false;
    }
  }

  /**
   * Declares a variable.
   *
   * @param n The node corresponding to the variable name.
   */
  private void declareVar(Node n) {
    checkState(n.isName(), n);

    String name = n.getString();
    if (!scope.hasOwnSlot(name) && (!scope.isLocal() || !name.equals(Var.ARGUMENTS))) {
      scope.declare(name, n);
    }
  }
}
