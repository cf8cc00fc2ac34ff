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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jsdce.jscomp.flow.FlowGraph;
import org.jsdce.jscomp.flow.FlowNode;
import org.jsdce.jscomp.flow.FlowValue;
import org.jsdce.jscomp.flow.ValueListener;
import org.jsdce.rhino.Node;
import org.jsdce.rhino.Token;
import org.jspecify.annotations.Nullable;

/**
 * Turns a tree into flow graph structure following the operational semantics of each construct.
 *
 * <p>Every expression is evaluated to a result node holding the values it may produce; statements
 * only add structure. Function bodies are not walked when the literal is met: a body is walked the
 * first time a call, a {@code new}, an accessor or {@code call}/{@code apply} reaches a value of
 * that function. Bodies that no call ever reaches are never walked, and the rewriter removes or
 * stubs them. When uncalled bodies are kept as they are, a function is also walked once any of its
 * values is used, since the kept body may still run.
 *
 * <p>Property accesses go through descriptors. Writing V to {@code o.p} stores a descriptor whose
 * {@code value} member holds V into the {@code p} slot of every object {@code o} may be. A read
 * forwards the {@code value} member of every descriptor in the slot, and calls the {@code get}
 * member if there is one. Writes call any {@code set} member the same way.
 */
final class FlowGraphBuilder {

  private static final Logger logger = Logger.getLogger(FlowGraphBuilder.class.getName());

  private final FlowGraph graph;
  private final ScopeCreator scopeCreator;
  private final IntrinsicLibrary intrinsics;
  private final boolean activateUsedFunctions;

  private final Map<Var, FlowNode> bindings = new LinkedHashMap<>();
  private final Map<Node, FlowValue> functionValues = new HashMap<>();
  private final Map<Node, FlowNode> functionLiteralNodes = new HashMap<>();
  private final Map<Node, Scope> definingScopes = new HashMap<>();
  private final Set<Node> activatedFunctions = new LinkedHashSet<>();

  /**
   * The ambient state of the walk: the scope names resolve in, the node {@code this} evaluates to
   * and the node {@code return} feeds, which is null outside function bodies.
   */
  private record FunctionContext(Scope scope, FlowNode thisNode, @Nullable FlowNode returnNode) {}

  /** One call or accessor invocation: its receiver, arguments and result. */
  record CallSite(
      Node node, FlowNode receiver, ImmutableList<FlowNode> arguments, FlowNode result) {

    /** Returns the argument node at {@code index}, or null if the call passes fewer arguments. */
    @Nullable FlowNode argument(int index) {
      return index < arguments.size() ? arguments.get(index) : null;
    }
  }

  FlowGraphBuilder(FlowGraph graph, ScopeCreator scopeCreator) {
    this(graph, scopeCreator, /* activateUsedFunctions= */ false);
  }

  FlowGraphBuilder(FlowGraph graph, ScopeCreator scopeCreator, boolean activateUsedFunctions) {
    this.graph = graph;
    this.scopeCreator = scopeCreator;
    this.intrinsics = new IntrinsicLibrary(graph);
    this.activateUsedFunctions = activateUsedFunctions;
  }

  /**
   * Seeds the intrinsics and walks the top level of {@code root}. Function bodies are walked later,
   * from the worklist, as calls reach them.
   */
  void build(Node root) {
    intrinsics.seed();
    Scope globalScope = scopeCreator.createScope(root, null);
    FunctionContext context =
        new FunctionContext(globalScope, intrinsics.globalScopeNode(), /* returnNode= */ null);
    visitStatement(root, context);
    logger.fine(
        "Top level walked: " + graph.getNodeCount() + " nodes, " + graph.getValueCount()
            + " values, " + graph.getWorklist().size() + " pending actions");
  }

  // Results

  boolean isActivated(Node function) {
    return activatedFunctions.contains(function);
  }

  int getActivatedCount() {
    return activatedFunctions.size();
  }

  /** Returns the node holding the value of a function literal, or null if it was never walked. */
  @Nullable FlowNode getFunctionLiteralNode(Node function) {
    return functionLiteralNodes.get(function);
  }

  /** Returns the node of a binding, or null if no walked code declares or references it. */
  @Nullable FlowNode getBinding(Var var) {
    return bindings.get(var);
  }

  IntrinsicLibrary getIntrinsics() {
    return intrinsics;
  }

  // Statements

  private void visitStatement(Node n, FunctionContext context) {
    switch (n.getToken()) {
      case ROOT:
      case SCRIPT:
      case BLOCK:
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          visitStatement(child, context);
        }
        break;

      case EMPTY:
      case BREAK:
      case CONTINUE:
      case DEBUGGER:
        break;

      case EXPR_RESULT:
        visitExpression(n.getFirstChild(), context);
        break;

      case VAR:
        for (Node name = n.getFirstChild(); name != null; name = name.getNext()) {
          FlowNode binding = bindingOf(name, context);
          if (name.hasChildren()) {
            visitExpression(name.getFirstChild(), context).connectTo(binding);
          } else {
            binding.addValue(intrinsics.scalarValue());
          }
        }
        break;

      case FUNCTION:
        visitFunction(n, context);
        break;

      case RETURN:
        if (n.hasChildren()) {
          FlowNode result = visitExpression(n.getFirstChild(), context);
          if (context.returnNode() != null) {
            result.connectTo(context.returnNode());
          }
        }
        break;

      case THROW:
        visitExpression(n.getFirstChild(), context).use();
        break;

      case IF:
        visitCondition(n.getFirstChild(), context);
        for (Node branch = n.getSecondChild(); branch != null; branch = branch.getNext()) {
          visitStatement(branch, context);
        }
        break;

      case WHILE:
        visitCondition(n.getFirstChild(), context);
        visitStatement(n.getLastChild(), context);
        break;

      case DO:
        visitStatement(n.getFirstChild(), context);
        visitCondition(n.getLastChild(), context);
        break;

      case FOR:
        {
          Node init = n.getFirstChild();
          Node condition = init.getNext();
          Node increment = condition.getNext();
          if (init.isVar()) {
            visitStatement(init, context);
          } else if (!init.isEmpty()) {
            visitExpression(init, context);
          }
          if (!condition.isEmpty()) {
            visitCondition(condition, context);
          }
          if (!increment.isEmpty()) {
            visitExpression(increment, context);
          }
          visitStatement(n.getLastChild(), context);
          break;
        }

      case FOR_IN:
        visitForIn(n, context);
        break;

      case SWITCH:
        visitCondition(n.getFirstChild(), context);
        for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
          if (c.getToken() == Token.CASE) {
            visitCondition(c.getFirstChild(), context);
          }
          visitStatement(c.getLastChild(), context);
        }
        break;

      case TRY:
        visitStatement(n.getFirstChild(), context);
        Node catchNode = n.getSecondChild().getFirstChild();
        if (catchNode != null) {
          bindingOf(catchNode.getFirstChild(), context).addValue(intrinsics.dynamicValue());
          visitStatement(catchNode.getLastChild(), context);
        }
        if (n.getChildCount() == 3) {
          visitStatement(n.getLastChild(), context);
        }
        break;

      case LABEL:
        visitStatement(n.getLastChild(), context);
        break;

      case WITH:
        // Names inside a with body may resolve to members of the object; nothing is modeled.
        visitExpression(n.getFirstChild(), context).use();
        visitStatement(n.getLastChild(), context);
        break;

      default:
        throw new IllegalStateException("Unexpected statement: " + n.getToken());
    }
  }

  private void visitCondition(Node n, FunctionContext context) {
    visitExpression(n, context).use();
  }

  private void visitForIn(Node n, FunctionContext context) {
    Node target = n.getFirstChild();
    FlowNode objectNode = visitExpression(target.getNext(), context);
    objectNode.use();

    FlowNode keys = graph.createNode(n, "for-in keys");
    Map<String, FlowValue> keyValues = new HashMap<>();
    FlowValue scalar = intrinsics.scalarValue();
    objectNode.subscribe(
        object ->
            object.subscribe(
                new ValueListener() {
                  @Override
                  public void dynamicMemberAdded(FlowNode member) {
                    keys.addValue(scalar);
                  }

                  @Override
                  public void memberAdded(String name, FlowNode member) {
                    // Once any key is possible, the names seen later add nothing.
                    if (!keys.contains(scalar)) {
                      keys.addValue(
                          keyValues.computeIfAbsent(
                              name, key -> graph.createStringValue(n, key)));
                    }
                  }
                }));

    if (target.isVar()) {
      keys.connectTo(bindingOf(target.getFirstChild(), context));
    } else {
      evaluateReference(target, context).write(keys);
    }
    visitStatement(n.getLastChild(), context);
  }

  // Expressions

  private FlowNode visitExpression(Node n, FunctionContext context) {
    switch (n.getToken()) {
      case NAME:
        return evaluateReference(n, context).read();

      case THIS:
        return context.thisNode();

      case STRINGLIT:
        return graph.createNodeOf(graph.createStringValue(n, n.getString()));

      case NUMBER:
      case TRUE:
      case FALSE:
      case NULL:
      case REGEXP:
        return scalarNode(n);

      case FUNCTION:
        return visitFunction(n, context);

      case OBJECTLIT:
        return visitObjectLiteral(n, context);

      case ARRAYLIT:
        return visitArrayLiteral(n, context);

      case GETPROP:
      case GETELEM:
        return evaluateReference(n, context).read();

      case CALL:
        return visitCall(n, context);

      case NEW:
        return visitNew(n, context);

      case ASSIGN:
        {
          Reference target = evaluateReference(n.getFirstChild(), context);
          FlowNode value = visitExpression(n.getLastChild(), context);
          target.write(value);
          return value;
        }

      case OR:
      case AND:
      case COALESCE:
        return union(n, context, n.getFirstChild(), n.getLastChild());

      case HOOK:
        visitCondition(n.getFirstChild(), context);
        return union(n, context, n.getSecondChild(), n.getLastChild());

      case COMMA:
        visitExpression(n.getFirstChild(), context);
        return visitExpression(n.getLastChild(), context);

      case INC:
      case DEC:
        return visitUpdate(n, context, null);

      case DELPROP:
        {
          Node target = n.getFirstChild();
          if (NodeUtil.isGet(target)) {
            evaluateReference(target, context);
            return scalarNode(n);
          }
          return visitUnmodeled(n, context);
        }

      default:
        if (n.getToken().isCompoundAssignmentOp()) {
          return visitUpdate(n, context, n.getLastChild());
        }
        if (n.getToken().isBinaryOp() || n.getToken().isUnaryOp()) {
          for (Node operand = n.getFirstChild(); operand != null; operand = operand.getNext()) {
            visitExpression(operand, context).use();
          }
          return scalarNode(n);
        }
        return visitUnmodeled(n, context);
    }
  }

  private FlowNode scalarNode(Node n) {
    FlowNode result = graph.createNode(n, "scalar");
    result.addValue(intrinsics.scalarValue());
    return result;
  }

  /** Uses every child and assumes the worst about the result. */
  private FlowNode visitUnmodeled(Node n, FunctionContext context) {
    logger.finer("Unmodeled expression: " + n.getToken());
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      visitExpression(child, context).use();
    }
    return graph.createNodeOf(intrinsics.dynamicValue());
  }

  private FlowNode union(Node n, FunctionContext context, Node left, Node right) {
    FlowNode result = graph.createNode(n, n.getToken().toString());
    visitExpression(left, context).connectTo(result);
    visitExpression(right, context).connectTo(result);
    return result;
  }

  /** Compound assignments and {@code ++}/{@code --}: read and use, then store a scalar. */
  private FlowNode visitUpdate(Node n, FunctionContext context, @Nullable Node operand) {
    Reference target = evaluateReference(n.getFirstChild(), context);
    target.read().use();
    if (operand != null) {
      visitExpression(operand, context).use();
    }
    FlowNode result = scalarNode(n);
    target.write(result);
    return result;
  }

  private FlowNode visitFunction(Node n, FunctionContext context) {
    checkState(!functionValues.containsKey(n), "Function literal walked twice: %s", n);
    String name = n.getFirstChild().getString();
    String label = name.isEmpty() ? "<anonymous>" : name;
    FlowValue value = construct(intrinsics.functionNode(), ImmutableList.of(), n, label);
    FlowValue prototype =
        construct(intrinsics.objectNode(), ImmutableList.of(), null, label + ".prototype");
    FlowValue prototypeDescriptor = graph.createValue(null, label + ".prototype#descriptor");
    prototypeDescriptor.getMember("value").addValue(prototype);
    value.getMember("prototype").addValue(prototypeDescriptor);

    functionValues.put(n, value);
    definingScopes.put(n, context.scope());
    if (activateUsedFunctions) {
      value.subscribe(
          new ValueListener() {
            @Override
            public void used() {
              activate(value);
            }
          });
    }
    FlowNode result = graph.createNodeOf(value);
    functionLiteralNodes.put(n, result);
    if (NodeUtil.isFunctionDeclaration(n) && !name.isEmpty()) {
      result.connectTo(bindingOf(n.getFirstChild(), context));
    }
    return result;
  }

  private FlowNode visitObjectLiteral(Node n, FunctionContext context) {
    FlowValue object = construct(intrinsics.objectNode(), ImmutableList.of(), n, "object");
    for (Node property = n.getFirstChild(); property != null; property = property.getNext()) {
      switch (property.getToken()) {
        case STRING_KEY:
          writeProperty(
              object, property.getString(), visitExpression(property.getFirstChild(), context));
          break;
        case GETTER_DEF:
        case SETTER_DEF:
          {
            FlowNode accessor = visitExpression(property.getFirstChild(), context);
            FlowValue descriptor = graph.createValue(property, property.getString() + "#accessor");
            accessor.connectTo(descriptor.getMember(property.isGetterDef() ? "get" : "set"));
            object.getMember(property.getString()).addValue(descriptor);
            break;
          }
        case COMPUTED_PROP:
          visitExpression(property.getFirstChild(), context).use();
          writeDynamicProperty(object, visitExpression(property.getLastChild(), context));
          break;
        default:
          throw new IllegalStateException("Unexpected object literal property: " + property);
      }
    }
    return graph.createNodeOf(object);
  }

  private FlowNode visitArrayLiteral(Node n, FunctionContext context) {
    FlowValue array = construct(intrinsics.arrayNode(), ImmutableList.of(), n, "array");
    for (Node element = n.getFirstChild(); element != null; element = element.getNext()) {
      if (!element.isEmpty()) {
        writeDynamicProperty(array, visitExpression(element, context));
      }
    }
    return graph.createNodeOf(array);
  }

  private FlowNode visitCall(Node n, FunctionContext context) {
    Node callee = n.getFirstChild();
    FlowNode result = graph.createNode(n, "call");
    FlowNode receiver;
    FlowNode qualifier;
    if (callee.isName()) {
      Var var = context.scope().getVar(callee.getString());
      if (var != null) {
        receiver = binding(var);
        qualifier = receiver;
      } else {
        receiver = intrinsics.globalScopeNode();
        qualifier = evaluateReference(callee, context).read();
      }
    } else if (NodeUtil.isGet(callee)) {
      Reference reference = evaluateReference(callee, context);
      receiver = checkNotNull(reference.object);
      qualifier = reference.read();
    } else {
      receiver = graph.createNode(n, "receiver");
      qualifier = visitExpression(callee, context);
    }
    receiver.use();

    ImmutableList.Builder<FlowNode> arguments = ImmutableList.builder();
    for (Node argument = callee.getNext(); argument != null; argument = argument.getNext()) {
      arguments.add(visitExpression(argument, context));
    }

    CallSite site = new CallSite(n, receiver, arguments.build(), result);
    qualifier.subscribe(function -> invoke(function, site));
    qualifier.use();
    return result;
  }

  private FlowNode visitNew(Node n, FunctionContext context) {
    FlowNode constructor = visitExpression(n.getFirstChild(), context);
    ImmutableList.Builder<FlowNode> arguments = ImmutableList.builder();
    for (Node argument = n.getSecondChild(); argument != null; argument = argument.getNext()) {
      arguments.add(visitExpression(argument, context));
    }
    FlowNode result = graph.createNodeOf(construct(constructor, arguments.build(), n, "new"));
    constructor.use();
    return result;
  }

  // Graph construction rules shared with the intrinsics

  /** Wires one call of {@code function} at {@code site} and analyzes the function if needed. */
  void invoke(FlowValue function, CallSite site) {
    if (intrinsics.invoke(this, function, site)) {
      return;
    }
    site.receiver().connectTo(function.getParameter(0));
    for (int i = 0; i < site.arguments().size(); i++) {
      site.arguments().get(i).connectTo(function.getParameter(i + 1));
    }
    function.getReturn().connectTo(site.result());
    activate(function);
  }

  /**
   * Creates an object constructed by every value {@code constructor} may hold. Each constructor
   * receives the object as its receiver and the arguments as its parameters, and the object
   * inherits the members of whatever the constructor's {@code prototype} property holds.
   */
  private FlowValue construct(
      FlowNode constructor,
      ImmutableList<FlowNode> arguments,
      @Nullable Node origin,
      String label) {
    FlowValue object = graph.createValue(origin, label);
    FlowNode prototypeNode = graph.createNode(origin, label + "#prototype");
    constructor.subscribe(
        function -> {
          function.getParameter(0).addValue(object);
          for (int i = 0; i < arguments.size(); i++) {
            arguments.get(i).connectTo(function.getParameter(i + 1));
          }
          activate(function);
          readProperty(function, "prototype", prototypeNode);
        });
    prototypeNode.subscribe(prototype -> inherit(object, prototype));
    return object;
  }

  /** Forwards every member of {@code prototype}, present and future, into {@code object}. */
  void inherit(FlowValue object, FlowValue prototype) {
    if (intrinsics.inheritFromIntrinsic(object, prototype)) {
      return;
    }
    prototype.subscribe(
        new ValueListener() {
          @Override
          public void memberAdded(String name, FlowNode member) {
            member.connectTo(object.getMember(name));
          }

          @Override
          public void dynamicMemberAdded(FlowNode member) {
            member.connectTo(object.getDynamicMember());
          }
        });
  }

  /**
   * Walks the body of a function the first time one of its values is invoked. Values that are not
   * function literals, and functions already walked, are ignored.
   */
  void activate(FlowValue function) {
    Node n = function.getOrigin();
    if (n == null || !n.isFunction() || functionValues.get(n) != function) {
      return;
    }
    if (!activatedFunctions.add(n)) {
      return;
    }
    logger.finer("Activating " + function);

    Scope scope = scopeCreator.createScope(n, definingScopes.get(n));
    Node fnName = n.getFirstChild();
    if (NodeUtil.isFunctionExpression(n) && !fnName.getString().isEmpty()) {
      Var bleeding = scope.getOwnSlot(fnName.getString());
      if (bleeding != null && bleeding.getNameNode() == fnName) {
        binding(bleeding).addValue(function);
      }
    }

    int index = 1;
    for (Node param = fnName.getNext().getFirstChild(); param != null; param = param.getNext()) {
      Var paramVar = checkNotNull(scope.getVar(param.getString()));
      function.getParameter(index++).connectTo(binding(paramVar));
    }

    FlowValue arguments = graph.createValue(n, function.getLabel() + ".arguments");
    binding(scope.getArgumentsVar()).addValue(arguments);
    function.subscribe(
        new ValueListener() {
          @Override
          public void parameterAdded(int parameterIndex, FlowNode parameter) {
            if (parameterIndex > 0) {
              writeDynamicProperty(arguments, parameter);
            }
          }
        });

    visitStatement(
        n.getLastChild(),
        new FunctionContext(scope, function.getParameter(0), function.getReturn()));
  }

  void readProperty(FlowValue owner, String name, FlowNode to) {
    readSlot(owner, owner.getMember(name), to);
  }

  void readDynamicProperty(FlowValue owner, FlowNode to) {
    readSlot(owner, owner.getDynamicMember(), to);
  }

  private void readSlot(FlowValue owner, FlowNode slot, FlowNode to) {
    slot.subscribe(
        descriptor -> {
          descriptor.getMember("value").connectTo(to);
          descriptor
              .getMember("get")
              .subscribe(
                  getter -> {
                    getter.getParameter(0).addValue(owner);
                    getter.getReturn().connectTo(to);
                    activate(getter);
                  });
        });
  }

  void writeProperty(FlowValue owner, String name, FlowNode value) {
    writeSlot(owner, owner.getMember(name), value);
  }

  void writeDynamicProperty(FlowValue owner, FlowNode value) {
    writeSlot(owner, owner.getDynamicMember(), value);
  }

  private void writeSlot(FlowValue owner, FlowNode slot, FlowNode value) {
    FlowValue descriptor = graph.createValue(value.getOrigin(), slot.getLabel() + "#descriptor");
    value.connectTo(descriptor.getMember("value"));
    slot.addValue(descriptor);
    slot.subscribe(
        existing -> {
          value.connectTo(existing.getMember("value"));
          existing
              .getMember("set")
              .subscribe(
                  setter -> {
                    setter.getParameter(0).addValue(owner);
                    value.connectTo(setter.getParameter(1));
                    activate(setter);
                  });
        });
  }

  // Bindings and references

  private FlowNode binding(Var var) {
    return bindings.computeIfAbsent(var, v -> graph.createNode(v.getNameNode(), v.getName()));
  }

  /** The binding a declaring NAME node introduces in the current scope. */
  private FlowNode bindingOf(Node name, FunctionContext context) {
    Var var = context.scope().getVar(name.getString());
    checkState(var != null, "Undeclared name %s", name);
    return binding(var);
  }

  /**
   * Evaluates the parts of an assignment target or property access that come before the access
   * itself.
   */
  private Reference evaluateReference(Node n, FunctionContext context) {
    switch (n.getToken()) {
      case NAME:
        {
          Var var = context.scope().getVar(n.getString());
          if (var != null) {
            return new Reference(n, binding(var), null, null);
          }
          return new Reference(n, null, intrinsics.globalScopeNode(), n.getString());
        }
      case GETPROP:
        {
          FlowNode object = visitExpression(n.getFirstChild(), context);
          object.use();
          return new Reference(n, null, object, n.getString());
        }
      case GETELEM:
        {
          FlowNode object = visitExpression(n.getFirstChild(), context);
          object.use();
          Node index = n.getLastChild();
          String name = NodeUtil.getStringValue(index);
          if (name == null) {
            visitExpression(index, context).use();
          }
          return new Reference(n, null, object, name);
        }
      default:
        throw new IllegalStateException("Unexpected assignment target: " + n.toStringTree());
    }
  }

  /**
   * A place that can be read and written: a binding, a named property of whatever an object
   * expression evaluates to, or a computed property of it when the name is null.
   */
  private final class Reference {
    private final Node node;
    private final @Nullable FlowNode binding;
    private final @Nullable FlowNode object;
    private final @Nullable String name;

    Reference(
        Node node, @Nullable FlowNode binding, @Nullable FlowNode object, @Nullable String name) {
      this.node = node;
      this.binding = binding;
      this.object = object;
      this.name = name;
    }

    FlowNode read() {
      if (binding != null) {
        return binding;
      }
      FlowNode result = graph.createNode(node, name == null ? "[*]" : name);
      checkNotNull(object)
          .subscribe(
              owner -> {
                if (name != null) {
                  readProperty(owner, name, result);
                } else {
                  readDynamicProperty(owner, result);
                }
              });
      return result;
    }

    void write(FlowNode value) {
      if (binding != null) {
        value.connectTo(binding);
        return;
      }
      checkNotNull(object)
          .subscribe(
              owner -> {
                if (name != null) {
                  writeProperty(owner, name, value);
                } else {
                  writeDynamicProperty(owner, value);
                }
              });
    }
  }
}
