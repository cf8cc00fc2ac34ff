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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Set;
import org.jsdce.jscomp.FlowGraphBuilder.CallSite;
import org.jsdce.jscomp.flow.FlowGraph;
import org.jsdce.jscomp.flow.FlowNode;
import org.jsdce.jscomp.flow.FlowValue;
import org.jsdce.jscomp.flow.ValueListener;

/**
 * The well-known values the analysis starts from, and the hand-written semantics of the built-ins
 * it models: {@code Object.create}, {@code Object.defineProperty}, {@code Function.prototype.call},
 * {@code Function.prototype.apply} and {@code Function.prototype.bind}.
 *
 * <p>Everything outside the program is the "unknown world", represented by the fully-dynamic
 * sentinel. Every slot of that sentinel holds the sentinel itself and is an escape slot: a value
 * that reaches one is used, and so is everything reachable from its members and return value. Any
 * member of a built-in that is not modeled here holds the sentinel.
 */
final class IntrinsicLibrary {

  /** The global names the library models; reading any other global name yields the sentinel. */
  static final ImmutableSet<String> MODELED_GLOBALS =
      ImmutableSet.of("Object", "Function", "Array");

  private static final ImmutableSet<String> MODELED_OBJECT_MEMBERS =
      ImmutableSet.of("create", "defineProperty", "prototype");
  private static final ImmutableSet<String> MODELED_FUNCTION_PROTOTYPE_MEMBERS =
      ImmutableSet.of("apply", "bind", "call");
  private static final ImmutableSet<String> MODELED_CONSTRUCTOR_MEMBERS =
      ImmutableSet.of("prototype");

  /**
   * Members every function inherits without the program naming {@code Function.prototype}.
   * Inheritance only forwards slots the prototype already has, so these are created up front.
   */
  private static final ImmutableSet<String> INHERITED_FUNCTION_MEMBERS =
      ImmutableSet.of("length", "name", "toString");

  private final FlowGraph graph;

  private final FlowValue globalScope;
  private final FlowNode globalScopeNode;
  private final FlowValue objectValue;
  private final FlowNode objectNode;
  private final FlowValue objectPrototypeValue;
  private final FlowValue functionValue;
  private final FlowNode functionNode;
  private final FlowValue functionPrototypeValue;
  private final FlowValue arrayValue;
  private final FlowNode arrayNode;
  private final FlowValue arrayPrototypeValue;
  private final FlowValue objectCreateValue;
  private final FlowValue objectDefinePropertyValue;
  private final FlowValue functionCallValue;
  private final FlowValue functionApplyValue;
  private final FlowValue functionBindValue;
  private final FlowValue scalarValue;
  private final FlowValue dynamicValue;

  private final Set<FlowNode> escapedNodes = new HashSet<>();
  private final Set<FlowValue> escapedValues = new HashSet<>();

  IntrinsicLibrary(FlowGraph graph) {
    this.graph = graph;
    this.globalScope = graph.createValue(null, "<global>");
    this.globalScopeNode = graph.createNodeOf(globalScope);
    this.objectValue = graph.createValue(null, "<global>.Object");
    this.objectNode = graph.createNodeOf(objectValue);
    this.objectPrototypeValue = graph.createValue(null, "<global>.Object.prototype");
    this.functionValue = graph.createValue(null, "<global>.Function");
    this.functionNode = graph.createNodeOf(functionValue);
    this.functionPrototypeValue = graph.createValue(null, "<global>.Function.prototype");
    this.arrayValue = graph.createValue(null, "<global>.Array");
    this.arrayNode = graph.createNodeOf(arrayValue);
    this.arrayPrototypeValue = graph.createValue(null, "<global>.Array.prototype");
    this.objectCreateValue = graph.createValue(null, "<global>.Object.create");
    this.objectDefinePropertyValue = graph.createValue(null, "<global>.Object.defineProperty");
    this.functionCallValue = graph.createValue(null, "<global>.Function.prototype.call");
    this.functionApplyValue = graph.createValue(null, "<global>.Function.prototype.apply");
    this.functionBindValue = graph.createValue(null, "<global>.Function.prototype.bind");
    this.scalarValue = graph.createValue(null, "<scalar>");
    this.dynamicValue = graph.createValue(null, "<dynamic>");
  }

  /** Installs the sentinels and the modeled globals. Runs before the tree is walked. */
  void seed() {
    scalarValue.use();
    dynamicValue.use();
    escapedValues.add(dynamicValue);
    dynamicValue.subscribe(
        new ValueListener() {
          @Override
          public void memberAdded(String name, FlowNode member) {
            fillWithDynamic(member);
          }

          @Override
          public void dynamicMemberAdded(FlowNode member) {
            fillWithDynamic(member);
          }

          @Override
          public void parameterAdded(int index, FlowNode parameter) {
            fillWithDynamic(parameter);
          }

          @Override
          public void returnAdded(FlowNode returnNode) {
            fillWithDynamic(returnNode);
          }
        });

    globalScope.getMember("Object").addValue(descriptorOf(objectValue));
    globalScope.getMember("Function").addValue(descriptorOf(functionValue));
    globalScope.getMember("Array").addValue(descriptorOf(arrayValue));

    objectValue.getMember("create").addValue(descriptorOf(objectCreateValue));
    objectValue.getMember("defineProperty").addValue(descriptorOf(objectDefinePropertyValue));
    objectValue.getMember("prototype").addValue(descriptorOf(objectPrototypeValue));

    functionValue.getMember("prototype").addValue(descriptorOf(functionPrototypeValue));
    functionPrototypeValue.getMember("apply").addValue(descriptorOf(functionApplyValue));
    functionPrototypeValue.getMember("call").addValue(descriptorOf(functionCallValue));
    functionPrototypeValue.getMember("bind").addValue(descriptorOf(functionBindValue));

    arrayValue.getMember("prototype").addValue(descriptorOf(arrayPrototypeValue));

    // Any other global property, or member of a built-in, belongs to the unknown world.
    fillUnmodeledMembers(globalScope, MODELED_GLOBALS);
    fillUnmodeledMembers(objectValue, MODELED_OBJECT_MEMBERS);
    fillUnmodeledMembers(objectPrototypeValue, ImmutableSet.of());
    fillUnmodeledMembers(functionValue, MODELED_CONSTRUCTOR_MEMBERS);
    fillUnmodeledMembers(functionPrototypeValue, MODELED_FUNCTION_PROTOTYPE_MEMBERS);
    fillUnmodeledMembers(arrayValue, MODELED_CONSTRUCTOR_MEMBERS);
    fillUnmodeledMembers(arrayPrototypeValue, ImmutableSet.of());

    for (String name : INHERITED_FUNCTION_MEMBERS) {
      functionPrototypeValue.getMember(name);
    }
  }

  private void fillUnmodeledMembers(FlowValue builtin, ImmutableSet<String> modeled) {
    builtin.subscribe(
        new ValueListener() {
          @Override
          public void memberAdded(String name, FlowNode member) {
            if (!modeled.contains(name)) {
              fillWithDynamic(member);
            }
          }

          @Override
          public void dynamicMemberAdded(FlowNode member) {
            fillWithDynamic(member);
          }
        });
  }

  private void fillWithDynamic(FlowNode node) {
    node.addValue(dynamicValue);
    escapeNode(node);
  }

  private FlowValue descriptorOf(FlowValue value) {
    FlowValue descriptor = graph.createValue(null, value.getLabel() + "#descriptor");
    descriptor.getMember("value").addValue(value);
    return descriptor;
  }

  /**
   * Makes {@code node} an escape slot: it is used, and every value it holds or will hold escapes.
   */
  void escapeNode(FlowNode node) {
    if (!escapedNodes.add(node)) {
      return;
    }
    node.use();
    node.subscribe(this::escapeValue);
  }

  /**
   * Hands {@code value} to the unknown world. Its member, dynamic member and return slots become
   * escape slots and its parameters receive the fully-dynamic sentinel. Escape does not analyze a
   * function's body.
   */
  void escapeValue(FlowValue value) {
    if (!escapedValues.add(value)) {
      return;
    }
    value.use();
    value.subscribe(
        new ValueListener() {
          @Override
          public void memberAdded(String name, FlowNode member) {
            escapeNode(member);
          }

          @Override
          public void dynamicMemberAdded(FlowNode member) {
            escapeNode(member);
          }

          @Override
          public void parameterAdded(int index, FlowNode parameter) {
            parameter.addValue(dynamicValue);
          }

          @Override
          public void returnAdded(FlowNode returnNode) {
            escapeNode(returnNode);
          }
        });
  }

  /**
   * Applies a built-in prototype that has no modeled members.
   *
   * @return false if {@code prototype} is an ordinary value the caller must forward members from
   */
  boolean inheritFromIntrinsic(FlowValue object, FlowValue prototype) {
    if (prototype == dynamicValue) {
      object.subscribe(
          new ValueListener() {
            @Override
            public void memberAdded(String name, FlowNode member) {
              member.addValue(dynamicValue);
            }

            @Override
            public void dynamicMemberAdded(FlowNode member) {
              member.addValue(dynamicValue);
            }
          });
      return true;
    }
    if (prototype == arrayPrototypeValue) {
      // Array methods are not modeled: every named member of an array may be anything.
      object.subscribe(
          new ValueListener() {
            @Override
            public void memberAdded(String name, FlowNode member) {
              member.addValue(dynamicValue);
            }
          });
      return true;
    }
    return false;
  }

  /**
   * Runs the modeled semantics of {@code callee} at {@code site}.
   *
   * @return false if {@code callee} is not a modeled built-in function
   */
  boolean invoke(FlowGraphBuilder builder, FlowValue callee, CallSite site) {
    if (callee == objectCreateValue) {
      handleObjectCreate(builder, site);
    } else if (callee == objectDefinePropertyValue) {
      handleObjectDefineProperty(builder, site);
    } else if (callee == functionCallValue) {
      handleFunctionCall(builder, site);
    } else if (callee == functionApplyValue) {
      handleFunctionApply(builder, site);
    } else if (callee == functionBindValue) {
      handleFunctionBind(builder, site);
    } else {
      return false;
    }
    return true;
  }

  private void handleObjectCreate(FlowGraphBuilder builder, CallSite site) {
    FlowValue object = graph.createValue(site.node(), "Object.create");
    FlowNode prototypeNode = site.argument(0);
    if (prototypeNode != null) {
      prototypeNode.use();
      prototypeNode.subscribe(prototype -> builder.inherit(object, prototype));
    }
    site.result().addValue(object);
  }

  private void handleObjectDefineProperty(FlowGraphBuilder builder, CallSite site) {
    ImmutableList<FlowNode> arguments = site.arguments();
    if (arguments.isEmpty()) {
      return;
    }
    FlowNode objectNode = arguments.get(0);
    objectNode.connectTo(site.result());
    if (arguments.size() < 3) {
      return;
    }
    FlowNode propertyNameNode = arguments.get(1);
    FlowNode descriptorNode = arguments.get(2);
    objectNode.use();
    propertyNameNode.use();
    descriptorNode.use();

    FlowValue descriptor = graph.createValue(site.node(), "defineProperty#descriptor");
    descriptorNode.subscribe(
        value -> {
          builder.readProperty(value, "get", descriptor.getMember("get"));
          builder.readProperty(value, "set", descriptor.getMember("set"));
          builder.readProperty(value, "value", descriptor.getMember("value"));
        });

    propertyNameNode.subscribe(
        propertyName -> {
          // A name that may be any scalar is not tracked; this depends on arrival order.
          if (propertyNameNode.contains(scalarValue)) {
            return;
          }
          String name = propertyName.getStringConstant();
          if (name == null) {
            objectNode.subscribe(object -> object.getDynamicMember().addValue(descriptor));
          } else {
            objectNode.subscribe(object -> object.getMember(name).addValue(descriptor));
          }
        });
  }

  private void handleFunctionCall(FlowGraphBuilder builder, CallSite site) {
    FlowNode thisNode = site.argument(0);
    ImmutableList<FlowNode> arguments = site.arguments();
    site.receiver()
        .subscribe(
            function -> {
              builder.activate(function);
              function.use();
              if (thisNode != null) {
                thisNode.connectTo(function.getParameter(0));
              }
              for (int i = 1; i < arguments.size(); i++) {
                arguments.get(i).connectTo(function.getParameter(i));
              }
              function.getReturn().connectTo(site.result());
            });
  }

  private void handleFunctionApply(FlowGraphBuilder builder, CallSite site) {
    FlowNode thisNode = site.argument(0);
    FlowNode argumentsNode = site.argument(1);
    site.receiver()
        .subscribe(
            function -> {
              builder.activate(function);
              function.use();
              if (thisNode != null) {
                thisNode.connectTo(function.getParameter(0));
              }
              FlowNode argumentsHub = graph.createNode(site.node(), function.getLabel() + "#args");
              if (argumentsNode != null) {
                argumentsNode.subscribe(
                    array ->
                        array.subscribe(
                            new ValueListener() {
                              @Override
                              public void dynamicMemberAdded(FlowNode elements) {
                                elements.subscribe(
                                    element ->
                                        element.getMember("value").connectTo(argumentsHub));
                              }
                            }));
              }
              function.subscribe(
                  new ValueListener() {
                    @Override
                    public void parameterAdded(int index, FlowNode parameter) {
                      argumentsHub.connectTo(parameter);
                    }
                  });
              function.getReturn().connectTo(site.result());
            });
  }

  /**
   * A bound function forwards every call to each function the receiver holds. The target is walked
   * as soon as it is bound. The bound receiver and arguments come first; the receiver a call passes
   * to the bound function is forwarded too, which covers {@code new} on it.
   */
  private void handleFunctionBind(FlowGraphBuilder builder, CallSite site) {
    FlowNode thisNode = site.argument(0);
    ImmutableList<FlowNode> arguments = site.arguments();
    int boundCount = Math.max(arguments.size() - 1, 0);
    FlowValue bound = graph.createValue(site.node(), "bound");
    site.result().addValue(bound);
    site.receiver()
        .subscribe(
            function -> {
              builder.activate(function);
              function.use();
              if (thisNode != null) {
                thisNode.connectTo(function.getParameter(0));
              }
              for (int i = 1; i < arguments.size(); i++) {
                arguments.get(i).connectTo(function.getParameter(i));
              }
              function.getMember("prototype").connectTo(bound.getMember("prototype"));
              bound.subscribe(
                  new ValueListener() {
                    @Override
                    public void parameterAdded(int index, FlowNode parameter) {
                      parameter.connectTo(
                          function.getParameter(index == 0 ? 0 : index + boundCount));
                    }

                    @Override
                    public void returnAdded(FlowNode returnNode) {
                      function.getReturn().connectTo(returnNode);
                    }
                  });
            });
  }

  FlowNode globalScopeNode() {
    return globalScopeNode;
  }

  FlowNode objectNode() {
    return objectNode;
  }

  FlowNode functionNode() {
    return functionNode;
  }

  FlowNode arrayNode() {
    return arrayNode;
  }

  FlowValue scalarValue() {
    return scalarValue;
  }

  FlowValue dynamicValue() {
    return dynamicValue;
  }
}
