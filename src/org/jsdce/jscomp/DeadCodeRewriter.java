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

import java.util.logging.Logger;
import org.jsdce.jscomp.NodeTraversal.Callback;
import org.jsdce.jscomp.flow.FlowNode;
import org.jsdce.rhino.IR;
import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites the tree after the flow graph has converged.
 *
 * <p>A function that no call ever reached is dropped when its value is never observed, along with
 * the object literal property holding it, and otherwise left with an empty body. Identifier reads
 * whose binding never holds an observed value are replaced with {@code null}. The bodies of
 * functions that were never called are not visited: their names were never resolved.
 */
class DeadCodeRewriter implements Callback {

  private static final Logger logger = Logger.getLogger(DeadCodeRewriter.class.getName());

  private final FlowGraphBuilder builder;
  private final MemoizedScopeCreator scopeCreator;
  private final boolean stubUncalledFunctions;
  private final boolean removeDeadReferences;
  private final DeadCodeSummary summary = new DeadCodeSummary();

  DeadCodeRewriter(
      FlowGraphBuilder builder,
      MemoizedScopeCreator scopeCreator,
      boolean stubUncalledFunctions,
      boolean removeDeadReferences) {
    this.builder = builder;
    this.scopeCreator = scopeCreator;
    this.stubUncalledFunctions = stubUncalledFunctions;
    this.removeDeadReferences = removeDeadReferences;
  }

  void rewrite(Node root) {
    NodeTraversal.builder().setCallback(this).setScopeCreator(scopeCreator).traverse(root);
  }

  DeadCodeSummary getSummary() {
    return summary;
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isFunction() || builder.isActivated(n)) {
      return true;
    }
    FlowNode literal = builder.getFunctionLiteralNode(n);
    boolean observed = literal != null && literal.hasUsedValue();
    if (!observed && parent != null && removeDeadReferences) {
      if (NodeUtil.isFunctionDeclaration(n)) {
        logger.finer("Removing uncalled function " + describe(n));
        n.detach();
        summary.recordRemovedFunction();
        return false;
      }
      if (isPropertyValue(n, parent)) {
        logger.finer("Removing property " + parent.getString() + " holding " + describe(n));
        parent.detach();
        summary.recordRemovedProperty();
        return false;
      }
    }
    if (stubUncalledFunctions) {
      stub(n, parent);
    }
    return false;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!removeDeadReferences || !n.isName() || parent == null || parent.isFunction()) {
      return;
    }
    if (NodeUtil.isLValue(n)) {
      return;
    }
    Var var = t.getScope().getVar(n.getString());
    if (var == null) {
      return;
    }
    FlowNode binding = builder.getBinding(var);
    if (binding != null && !binding.hasUsedValue()) {
      logger.finer("Replacing dead reference to " + var.getName() + " at " + position(n));
      n.replaceWith(IR.nullNode().setSourceInfoFrom(n));
      summary.recordReplacedReference();
    }
  }

  private static boolean isPropertyValue(Node n, Node parent) {
    return parent.isStringKey() || parent.isGetterDef() || parent.isSetterDef();
  }

  private void stub(Node n, @Nullable Node parent) {
    Node params = NodeUtil.getFunctionParameters(n);
    Node body = NodeUtil.getFunctionBody(n);
    // A setter keeps its single parameter.
    boolean keepParams = parent != null && parent.isSetterDef();
    if (!body.hasChildren() && (keepParams || !params.hasChildren())) {
      return;
    }
    logger.finer("Stubbing uncalled function " + describe(n));
    body.detachChildren();
    if (!keepParams) {
      params.detachChildren();
    }
    summary.recordStubbedFunction();
  }

  private static String describe(Node function) {
    String name = function.getFirstChild().getString();
    return (name.isEmpty() ? "<anonymous>" : name) + " at " + position(function);
  }

  private static String position(Node n) {
    return n.getSourceFileName() + ":" + n.getLineno() + ":" + n.getCharno();
  }
}
