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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jsdce.jscomp.flow.FlowGraph;
import org.jsdce.jscomp.flow.FlowNode;
import org.jsdce.jscomp.flow.FlowValue;
import org.jsdce.jscomp.flow.Worklist;
import org.jsdce.rhino.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FlowGraphBuilder}. */
@RunWith(JUnit4.class)
public final class FlowGraphBuilderTest {

  private static final String CLOSURE_FLOW =
      """
      function f(a) { return a.m; }
      var o = { m: function() { return 'x'; } };
      var r = f(o);
      var s = r();
      """;

  private Node root;
  private MemoizedScopeCreator scopeCreator;
  private FlowGraph graph;
  private FlowGraphBuilder builder;

  private void analyze(String js) {
    build(js);
    graph.getWorklist().drain();
  }

  /** Walks the top level of {@code js} without draining the worklist. */
  private void build(String js) {
    root = CompilerTestCase.parse(js);
    scopeCreator = new MemoizedScopeCreator(new SyntacticScopeCreator());
    graph = new FlowGraph();
    builder = new FlowGraphBuilder(graph, scopeCreator);
    builder.build(root);
  }

  private FlowNode globalBinding(String name) {
    Var var = scopeCreator.getScope(root).getVar(name);
    assertThat(var).isNotNull();
    FlowNode binding = builder.getBinding(var);
    assertThat(binding).isNotNull();
    return binding;
  }

  private ImmutableList<String> stringsIn(FlowNode node) {
    return node.getValues().stream()
        .map(FlowValue::getStringConstant)
        .filter(Objects::nonNull)
        .collect(toImmutableList());
  }

  /** Returns the n-th statement of the only script. */
  private Node statement(int index) {
    return root.getFirstChild().getChildAtIndex(index);
  }

  @Test
  public void testOnlyCalledFunctionsAreActivated() {
    analyze("function f() {} function g() {} f();");
    assertThat(builder.isActivated(statement(0))).isTrue();
    assertThat(builder.isActivated(statement(1))).isFalse();
    assertThat(builder.getActivatedCount()).isEqualTo(1);
  }

  @Test
  public void testBodiesOfUncalledFunctionsAreNotWalked() {
    analyze("function f() { var inner = function() {}; } ");
    Node inner = statement(0).getLastChild().getFirstChild().getFirstChild().getFirstChild();
    assertThat(inner.isFunction()).isTrue();
    assertThat(builder.getFunctionLiteralNode(statement(0))).isNotNull();
    assertThat(builder.getFunctionLiteralNode(inner)).isNull();
  }

  @Test
  public void testStringLiteralFlowsIntoBinding() {
    analyze("var x = 'a'; var y = x;");
    assertThat(stringsIn(globalBinding("y"))).containsExactly("a");
  }

  @Test
  public void testUninitializedVarHoldsScalar() {
    analyze("var x;");
    assertThat(globalBinding("x").getValues())
        .containsExactly(builder.getIntrinsics().scalarValue());
  }

  @Test
  public void testUnknownGlobalIsDynamic() {
    analyze("var u = somethingElse;");
    assertThat(globalBinding("u").contains(builder.getIntrinsics().dynamicValue())).isTrue();
  }

  @Test
  public void testLogicalOperatorsUnionTheirOperands() {
    analyze("var a = 'a'; var b = 'b'; var c = a || b; var d = a && b; var e = (a, b);");
    assertThat(stringsIn(globalBinding("c"))).containsExactly("a", "b");
    assertThat(stringsIn(globalBinding("d"))).containsExactly("a", "b");
    assertThat(stringsIn(globalBinding("e"))).containsExactly("b");
  }

  @Test
  public void testForInKeysAreMemberNames() {
    analyze("var o = { a: 1, b: 2 }; var k; for (k in o) {}");
    assertThat(stringsIn(globalBinding("k"))).containsExactly("a", "b");
  }

  @Test
  public void testParametersReceiveArguments() {
    analyze("function f(p) { return p; } var r = f('x');");
    assertThat(stringsIn(globalBinding("r"))).containsExactly("x");
  }

  @Test
  public void testPropertyWriteThenRead() {
    analyze("var o = {}; o.p = 'v'; var r = o.p; var s = o['p'];");
    assertThat(stringsIn(globalBinding("r"))).containsExactly("v");
    assertThat(stringsIn(globalBinding("s"))).containsExactly("v");
  }

  @Test
  public void testComputedWriteReachesNamedRead() {
    analyze("var o = {}; var k = somethingElse; o[k] = 'v'; var r = o.p;");
    assertThat(stringsIn(globalBinding("r"))).containsExactly("v");
  }

  @Test
  public void testDefinePropertyReturnsItsFirstArgument() {
    analyze("var o = {}; var r = Object.defineProperty(o, 'p', { value: 'v' }); var s = o.p;");
    assertThat(globalBinding("r").getValues())
        .containsExactlyElementsIn(globalBinding("o").getValues());
    assertThat(stringsIn(globalBinding("s"))).containsExactly("v");
  }

  @Test
  public void testGetterIsActivatedByRead() {
    analyze("var o = { get p() { return 'g'; } }; var r = o.p;");
    Node getter = statement(0).getFirstChild().getFirstChild().getFirstChild().getFirstChild();
    assertThat(getter.isFunction()).isTrue();
    assertThat(builder.isActivated(getter)).isTrue();
    assertThat(stringsIn(globalBinding("r"))).containsExactly("g");
  }

  @Test
  public void testConstructorReceivesNewObject() {
    analyze("function C() { this.p = 'v'; } var c = new C(); var r = c.p;");
    assertThat(builder.isActivated(statement(0))).isTrue();
    assertThat(stringsIn(globalBinding("r"))).containsExactly("v");
  }

  @Test
  public void testCallBindsReceiver() {
    analyze("function f() { return this.p; } var o = { p: 'v' }; var r = f.call(o);");
    assertThat(stringsIn(globalBinding("r"))).containsExactly("v");
  }

  @Test
  public void testApplySpreadsArrayElements() {
    analyze("function f(a) { return a; } var r = f.apply(null, ['x', 'y']);");
    assertThat(stringsIn(globalBinding("r"))).containsExactly("x", "y");
  }

  @Test
  public void testCatchVariableIsDynamic() {
    analyze("try {} catch (e) {}");
    assertThat(globalBinding("e").getValues())
        .containsExactly(builder.getIntrinsics().dynamicValue());
  }

  @Test
  public void testValuesAndUsedFlagsOnlyGrowWhileDraining() {
    build(CLOSURE_FLOW);
    ImmutableList<String> names = ImmutableList.of("f", "o", "r", "s");
    Map<String, ImmutableSet<FlowValue>> seen = new LinkedHashMap<>();
    Set<FlowValue> used = new LinkedHashSet<>();
    Worklist worklist = graph.getWorklist();
    do {
      for (String name : names) {
        ImmutableSet<FlowValue> values = ImmutableSet.copyOf(globalBinding(name).getValues());
        ImmutableSet<FlowValue> before = seen.put(name, values);
        if (before != null) {
          assertThat(values).containsAtLeastElementsIn(before);
        }
        for (FlowValue value : values) {
          if (value.isUsed()) {
            used.add(value);
          }
        }
      }
      for (FlowValue value : used) {
        assertThat(value.isUsed()).isTrue();
      }
    } while (worklist.runNext());

    assertThat(stringsIn(globalBinding("s"))).containsExactly("x");
    assertThat(used).isNotEmpty();
  }

  @Test
  public void testReaddingValuesAndEdgesLeavesFixpointUnchanged() {
    analyze(CLOSURE_FLOW);
    Map<String, ImmutableSet<FlowValue>> converged = new LinkedHashMap<>();
    for (String name : ImmutableList.of("f", "o", "r", "s")) {
      FlowNode binding = globalBinding(name);
      converged.put(name, ImmutableSet.copyOf(binding.getValues()));
      for (FlowValue value : ImmutableSet.copyOf(binding.getValues())) {
        assertThat(binding.addValue(value)).isFalse();
      }
      for (FlowNode successor : ImmutableSet.copyOf(binding.getSuccessors())) {
        assertThat(binding.connectTo(successor)).isFalse();
      }
    }

    assertThat(graph.getWorklist().isEmpty()).isTrue();
    for (Map.Entry<String, ImmutableSet<FlowValue>> entry : converged.entrySet()) {
      assertThat(globalBinding(entry.getKey()).getValues())
          .containsExactlyElementsIn(entry.getValue());
    }
  }

  @Test
  public void testBuildingTwiceReachesTheSameFixpoint() {
    analyze(CLOSURE_FLOW);
    int firstActivated = builder.getActivatedCount();
    ImmutableList<String> firstStrings = stringsIn(globalBinding("s"));
    boolean firstUsed = globalBinding("o").hasUsedValue();

    analyze(CLOSURE_FLOW);
    assertThat(builder.getActivatedCount()).isEqualTo(firstActivated);
    assertThat(stringsIn(globalBinding("s"))).isEqualTo(firstStrings);
    assertThat(globalBinding("o").hasUsedValue()).isEqualTo(firstUsed);
  }

  @Test
  public void testUnmodeledBuiltinMemberIsDynamic() {
    analyze("var k = Object.keys; var i = Array.isArray;");
    FlowValue dynamic = builder.getIntrinsics().dynamicValue();
    assertThat(globalBinding("k").getValues()).containsExactly(dynamic);
    assertThat(globalBinding("i").getValues()).containsExactly(dynamic);
  }

  @Test
  public void testInheritedFunctionMemberIsDynamic() {
    analyze("function f() {} var n = f.name;");
    assertThat(globalBinding("n").contains(builder.getIntrinsics().dynamicValue())).isTrue();
  }

  @Test
  public void testBoundFunctionForwardsCalls() {
    analyze("function f(a, b) { return b; } var g = f.bind(null, 'a'); var r = g('b');");
    assertThat(builder.isActivated(statement(0))).isTrue();
    assertThat(stringsIn(globalBinding("r"))).containsExactly("b");
  }

  @Test
  public void testUsedFunctionsAreActivatedWhenAsked() {
    root = CompilerTestCase.parse("var o = { m: function() {} }; use(o);");
    scopeCreator = new MemoizedScopeCreator(new SyntacticScopeCreator());
    graph = new FlowGraph();
    builder = new FlowGraphBuilder(graph, scopeCreator, /* activateUsedFunctions= */ true);
    builder.build(root);
    graph.getWorklist().drain();
    assertThat(builder.getActivatedCount()).isEqualTo(1);
  }

  @Test
  public void testObjectLiteralInheritsFromObjectPrototype() {
    analyze("Object.prototype.p = 'v'; var o = {}; var r = o.p;");
    assertThat(stringsIn(globalBinding("r"))).containsExactly("v");
  }
}
