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

import java.util.logging.Logger;
import org.jsdce.jscomp.flow.FlowGraph;
import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * Whole-program dead code elimination driven by a value flow graph.
 *
 * <p>The pass builds the graph for the top level of the program, runs the worklist until no
 * action is pending, and rewrites the tree with what the graph proved: uncalled functions, the
 * properties holding them, and identifier reads whose value nobody observes.
 */
public class FlowDeadCodeElimination implements CompilerPass {

  private static final Logger logger = Logger.getLogger(FlowDeadCodeElimination.class.getName());

  private final boolean stubUncalledFunctions;
  private final boolean removeDeadReferences;
  private @Nullable DeadCodeSummary summary;

  public FlowDeadCodeElimination(CompilerOptions options) {
    this(options.getStubUncalledFunctions(), options.getRemoveDeadReferences());
  }

  FlowDeadCodeElimination(boolean stubUncalledFunctions, boolean removeDeadReferences) {
    this.stubUncalledFunctions = stubUncalledFunctions;
    this.removeDeadReferences = removeDeadReferences;
  }

  @Override
  public void process(Node root) {
    FlowGraph graph = new FlowGraph();
    MemoizedScopeCreator scopeCreator = new MemoizedScopeCreator(new SyntacticScopeCreator());
    // Bodies kept verbatim are analyzed once observed.
    FlowGraphBuilder builder =
        new FlowGraphBuilder(
            graph, scopeCreator, /* activateUsedFunctions= */ !stubUncalledFunctions);
    builder.build(root);

    long steps = graph.getWorklist().drain();
    logger.fine(
        "Flow graph converged after " + steps + " steps: " + graph.getNodeCount() + " nodes, "
            + graph.getValueCount() + " values, " + builder.getActivatedCount()
            + " functions called");

    DeadCodeRewriter rewriter =
        new DeadCodeRewriter(builder, scopeCreator, stubUncalledFunctions, removeDeadReferences);
    rewriter.rewrite(root);
    summary = rewriter.getSummary();
    logger.fine("Dead code eliminated: " + summary);
  }

  /** Returns what the last run of {@link #process} removed. */
  public DeadCodeSummary getSummary() {
    checkState(summary != null, "The pass has not run");
    return summary;
  }
}
