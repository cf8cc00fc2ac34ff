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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.jsdce.rhino.IR;
import org.jsdce.rhino.Node;
import org.jsdce.rhino.Token;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FlowDeadCodeElimination}. */
@RunWith(JUnit4.class)
public final class FlowDeadCodeEliminationTest extends CompilerTestCase {

  private boolean stubUncalledFunctions;
  private boolean removeDeadReferences;
  private FlowDeadCodeElimination lastPass;

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    stubUncalledFunctions = true;
    removeDeadReferences = true;
  }

  @Override
  protected CompilerPass getProcessor() {
    lastPass = new FlowDeadCodeElimination(stubUncalledFunctions, removeDeadReferences);
    return lastPass;
  }

  @Test
  public void testUncalledDeclarationRemoved() {
    test(
        "function f() { g(); } function h() {} h();", //
        "function h() {} h();");
    assertThat(lastPass.getSummary().getRemovedFunctions()).isEqualTo(1);
  }

  @Test
  public void testCalledFunctionKept() {
    testSame("function f(a) { return a; } var r = f(1); use(r);");
  }

  @Test
  public void testNestedUncalledDeclarationRemoved() {
    test(
        "function f() { function g() { return 1; } return 2; } f();",
        "function f() { return 2; } f();");
  }

  @Test
  public void testUnusedReferenceToRemovedFunctionReplaced() {
    test(
        "function f() { var x = {}; return x; } var h = f;", //
        "var h = null;");
    assertThat(lastPass.getSummary().getRemovedFunctions()).isEqualTo(1);
    assertThat(lastPass.getSummary().getReplacedReferences()).isEqualTo(1);
  }

  @Test
  public void testDeadReferenceReplacedWithNull() {
    test(
        "var x = {}; var y = x;", //
        "var x = {}; var y = null;");
  }

  @Test
  public void testScalarReadsAreAlwaysObserved() {
    // Every primitive shares one value, which is observed from the start.
    testSame("var x = compute(); var y = 1; use(x); var z = y;");
    assertThat(lastPass.getSummary().isEmpty()).isTrue();
  }

  @Test
  public void testObservedReferenceKept() {
    testSame("var x = {}; use(x);");
  }

  @Test
  public void testDeclarationNamesNeverReplaced() {
    testSame("var x = {}; x = {}; x.p = 1;");
  }

  @Test
  public void testReachableButUncalledFunctionStubbed() {
    test(
        "var o = { m: function() { dangerous(); } }; exportsGlobal.api = o;",
        "var o = { m: function() {} }; exportsGlobal.api = o;");
    assertThat(lastPass.getSummary().getStubbedFunctions()).isEqualTo(1);
  }

  @Test
  public void testEscapedFunctionExpressionStubbed() {
    test(
        "var f = function(a, b) { g(a, b); }; use(f);", //
        "var f = function() {}; use(f);");
  }

  @Test
  public void testGlobalPropertyWriteEscapes() {
    test(
        "this.api = { m: function() { return 1; } };", //
        "this.api = { m: function() {} };");
  }

  @Test
  public void testUnobservedPropertyRemoved() {
    test(
        "var o = { a: function() {}, b: 1 }; o.b;", //
        "var o = { b: 1 }; o.b;");
    assertThat(lastPass.getSummary().getRemovedProperties()).isEqualTo(1);
  }

  @Test
  public void testCalledMethodKept() {
    testSame("var o = { m: function() { return 1; } }; o.m();");
  }

  @Test
  public void testPrototypeMethods() {
    test(
        """
        function C() {}
        C.prototype.m = function() { return 1; };
        C.prototype.n = function() { return 2; };
        var c = new C();
        c.m();
        """,
        """
        function C() {}
        C.prototype.m = function() { return 1; };
        C.prototype.n = function() {};
        var c = new C();
        c.m();
        """);
  }

  @Test
  public void testConstructorThisWrites() {
    testSame("function C() { this.x = 1; } var c = new C(); use(c.x);");
  }

  @Test
  public void testGetterInstalledByDefinePropertyIsCalled() {
    testSame(
        """
        var obj = {};
        Object.defineProperty(obj, "p", { get: function() { return 1; } });
        use(obj.p);
        """);
  }

  @Test
  public void testEscapedGetterStubbed() {
    test(
        "var o = { get p() { return 1; } }; use(o);", //
        "var o = { get p() {} }; use(o);");
  }

  @Test
  public void testUnobservedGetterPropertyRemoved() {
    test(
        "var o = { get p() { return 1; }, q: 2 }; o.q;", //
        "var o = { q: 2 }; o.q;");
  }

  @Test
  public void testGetterLiteralIsCalledOnRead() {
    testSame("var o = { get p() { return 1; } }; use(o.p);");
  }

  @Test
  public void testSetterLiteralIsCalledOnWrite() {
    testSame("var o = { set p(v) { sink = v; } }; o.p = 1;");
  }

  @Test
  public void testStubbedSetterKeepsItsParameter() {
    test(
        "var o = { set p(v) { sink = v; } }; use(o);", //
        "var o = { set p(v) {} }; use(o);");
  }

  @Test
  public void testFunctionCallActivates() {
    testSame("function f() { return 1; } f.call(null);");
  }

  @Test
  public void testFunctionApplyActivates() {
    testSame("function f() { return 1; } f.apply(null, []);");
  }

  @Test
  public void testCallPassesArguments() {
    testSame("function f(a, b) { return b(); } f.call(null, 1, function() { return 2; });");
  }

  @Test
  public void testApplyPassesArrayElements() {
    testSame("function f(a, b) { return b(); } f.apply(null, [1, function() { return 2; }]);");
  }

  @Test
  public void testUnmodeledBuiltinObservesItsArguments() {
    test(
        "var o = { m: function() { return 1; } }; sink(Object.keys(o));",
        "var o = { m: function() {} }; sink(Object.keys(o));");
    assertThat(lastPass.getSummary().getRemovedProperties()).isEqualTo(0);
  }

  @Test
  public void testUnmodeledArrayStaticObservesItsArguments() {
    test(
        "var a = [function() { return 1; }]; sink(Array.isArray(a));",
        "var a = [function() {}]; sink(Array.isArray(a));");
  }

  @Test
  public void testBoundFunctionIsCalled() {
    testSame("function f(a) { sink(a); } var g = f.bind(null, 1); g();");
  }

  @Test
  public void testInheritedFunctionMemberReadIsKept() {
    test(
        "function f() { return 1; } var n = f.name; sink(n);",
        "function f() {} var n = f.name; sink(n);");
  }

  @Test
  public void testObjectPrototypeMethodObservesItsArguments() {
    testSame(
        """
        var o = { m: function() { return 1; } };
        var k = 'm';
        if (Object.prototype.hasOwnProperty.call(o, k)) {
          o.m();
        }
        """);
  }

  @Test
  public void testObjectCreateInheritsMembers() {
    testSame(
        """
        var proto = { m: function() { return 1; } };
        var o = Object.create(proto);
        o.m();
        """);
  }

  @Test
  public void testArgumentsObjectHoldsParameters() {
    testSame("function f() { return arguments[0](); } f(function() { return 1; });");
  }

  @Test
  public void testForInReachesEveryMember() {
    testSame(
        """
        var o = { a: function() { return 1; } };
        for (var k in o) {
          o[k]();
        }
        """);
  }

  @Test
  public void testComputedMemberCall() {
    testSame("var o = { a: function() { return 1; } }; var k = 'a'; o[k]();");
  }

  @Test
  public void testBleedingFunctionName() {
    testSame("var f = function g(n) { return n ? g(0) : 1; }; f(1);");
  }

  @Test
  public void testFunctionReturningFunction() {
    testSame("function f() { return function() { return 1; }; } f()();");
  }

  @Test
  public void testUncalledInnerClosureStubbed() {
    test(
        "function f() { return function() { return 1; }; } use(f());",
        "function f() { return function() {}; } use(f());");
  }

  @Test
  public void testConditionsAreObserved() {
    testSame("var x = {}; if (x) { use(1); }");
  }

  @Test
  public void testCatchVariableIsUnknown() {
    testSame("try { use(1); } catch (e) { var y = e; y(); }");
  }

  @Test
  public void testCompoundAssignmentReadsTarget() {
    testSame("var x = 1; x += 2; use(x);");
  }

  @Test
  public void testStubbingDisabled() {
    stubUncalledFunctions = false;
    testSame("var o = { m: function() { dangerous(); } }; exportsGlobal.api = o;");
  }

  @Test
  public void testStubbingDisabledKeepsWhatKeptBodiesCall() {
    stubUncalledFunctions = false;
    testSame(
        """
        function helper() { sink(); }
        var o = { m: function() { helper(); } };
        exportsGlobal.api = o;
        """);
  }

  @Test
  public void testStubbingDisabledKeepsNestedCallees() {
    stubUncalledFunctions = false;
    test(
        """
        function unused() {}
        function helper() { return 1; }
        use(function() { return helper(); });
        """,
        """
        function helper() { return 1; }
        use(function() { return helper(); });
        """);
  }

  @Test
  public void testStubbingDisabledStillRemovesUnobservedFunctions() {
    stubUncalledFunctions = false;
    test(
        "function f() { g(); } var x = {}; var y = x;", //
        "var x = {}; var y = null;");
  }

  @Test
  public void testReferenceRemovalDisabled() {
    removeDeadReferences = false;
    test(
        "function f() { g(); } var x = {}; var y = x;", //
        "function f() {} var x = {}; var y = x;");
  }

  @Test
  public void testEliminationDoesNotDependOnStatementOrder() {
    test(
        """
        function unused() { return 1; }
        function used() { return 2; }
        used();
        var o = { a: function() {}, b: 1 };
        o.b;
        var x = {}; var y = x;
        var p = { m: function() { return 3; } }; use(p);
        """,
        """
        function used() { return 2; }
        used();
        var o = { b: 1 };
        o.b;
        var x = {}; var y = null;
        var p = { m: function() {} }; use(p);
        """);
    String forward = lastPass.getSummary().toString();

    test(
        """
        var p = { m: function() { return 3; } }; use(p);
        var x = {}; var y = x;
        var o = { a: function() {}, b: 1 };
        function unused() { return 1; }
        o.b;
        function used() { return 2; }
        used();
        """,
        """
        var p = { m: function() {} }; use(p);
        var x = {}; var y = null;
        var o = { b: 1 };
        o.b;
        function used() { return 2; }
        used();
        """);
    assertThat(lastPass.getSummary().toString()).isEqualTo(forward);
  }

  @Test
  public void testSecondRunChangesNothing() {
    test(
        "function f() {} var o = { a: function() {}, b: 1 }; use(o.b); var x = {}; var y = x;",
        "var o = { b: 1 }; use(o.b); var x = {}; var y = null;");
    String once = toSource(getLastRoot());

    testSame(once);
    assertThat(lastPass.getSummary().isEmpty()).isTrue();
  }

  @Test
  public void testBadAssignmentTargetIsFatal() {
    Node assign = new Node(Token.ASSIGN, IR.number(1), IR.number(2));
    Node root = IR.root(IR.script(IR.exprResult(assign)));
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> getProcessor().process(root));
    assertThat(e).hasMessageThat().contains("Unexpected assignment target");
  }

  @Test
  public void testBadCompoundAssignmentTargetIsFatal() {
    Node assign = new Node(Token.ASSIGN_ADD, IR.number(1), IR.number(2));
    Node root = IR.root(IR.script(IR.exprResult(assign)));
    assertThrows(IllegalStateException.class, () -> getProcessor().process(root));
  }
}
