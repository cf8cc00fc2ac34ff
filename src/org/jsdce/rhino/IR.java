/*
 *
 * ***** BEGIN LICENSE BLOCK *****
 * Version: MPL 1.1/GPL 2.0
 *
 * The contents of this file are subject to the Mozilla Public License Version
 * 1.1 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * http://www.mozilla.org/MPL/
 *
 * Software distributed under the License is distributed on an "AS IS" basis,
 * WITHOUT WARRANTY OF ANY KIND, either express or implied. See the License
 * for the specific language governing rights and limitations under the
 * License.
 *
 * The Original Code is Rhino code, released
 * May 6, 1999.
 *
 * The Initial Developer of the Original Code is
 * Netscape Communications Corporation.
 * Portions created by the Initial Developer are Copyright (C) 1997-1999
 * the Initial Developer. All Rights Reserved.
 *
 * Contributor(s):
 *   Norris Boyd
 *   Roger Lawrence
 *   Mike McCabe
 *
 * Alternatively, the contents of this file may be used under the terms of
 * the GNU General Public License Version 2 or later (the "GPL"), in which
 * case the provisions of the GPL are applicable instead of those above. If
 * you wish to allow use of your version of this file only under the terms of
 * the GPL and not to allow others to use your version of this file under the
 * MPL, indicate your decision by deleting the provisions above and replacing
 * them with the notice and other provisions required by the GPL. If you do
 * not delete the provisions above, a recipient may use your version of this
 * file under either the MPL or the GPL.
 *
 * ***** END LICENSE BLOCK ***** */

package org.jsdce.rhino;

import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node root(Node... rootChildren) {
    Node root = new Node(Token.ROOT);
    for (Node child : rootChildren) {
      checkState(child.isRoot() || child.isScript());
      root.addChildToBack(child);
    }
    return root;
  }

  public static Node script(Node... stmts) {
    Node script = new Node(Token.SCRIPT);
    for (Node stmt : stmts) {
      checkState(mayBeStatementNoReturn(stmt), "Script cannot contain %s", stmt.getToken());
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isName());
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node var(Node name) {
    checkState(name.isName());
    return new Node(Token.VAR, name);
  }

  public static Node var(Node name, Node value) {
    checkState(name.isName() && !name.hasChildren());
    checkState(mayBeExpression(value));
    name.addChildToBack(value);
    return new Node(Token.VAR, name);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node throwNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.THROW, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node forIn(Node target, Node object, Node body) {
    checkState(target.isVar() || mayBeExpression(target));
    checkState(mayBeExpression(object));
    checkState(body.isBlock());
    return new Node(Token.FOR_IN, target, object, body);
  }

  public static Node catchNode(Node expr, Node body) {
    checkState(expr.isName());
    checkState(body.isBlock());
    return new Node(Token.CATCH, expr, body);
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node getprop(Node target, String prop) {
    checkState(mayBeExpression(target));
    Node getprop = Node.newString(Token.GETPROP, prop);
    getprop.addChildToBack(target);
    return getprop;
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target));
    checkState(mayBeExpression(elem));
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node assign(Node target, Node expr) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(expr));
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node call(Node target, Node... args) {
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node objectlit(Node... propdefs) {
    Node objectlit = new Node(Token.OBJECTLIT);
    for (Node propdef : propdefs) {
      checkState(
          propdef.isStringKey()
              || propdef.isGetterDef()
              || propdef.isSetterDef()
              || propdef.isComputedProp(),
          propdef);
      objectlit.addChildToBack(propdef);
    }
    return objectlit;
  }

  public static Node arraylit(Node... exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr) || expr.isEmpty(), expr);
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node stringKey(String s, Node value) {
    checkState(mayBeExpression(value));
    Node stringKey = Node.newString(Token.STRING_KEY, s);
    stringKey.addChildToBack(value);
    return stringKey;
  }

  public static Node getterDef(String name, Node function) {
    checkState(function.isFunction());
    Node def = Node.newString(Token.GETTER_DEF, name);
    def.addChildToBack(function);
    return def;
  }

  public static Node setterDef(String name, Node function) {
    checkState(function.isFunction());
    Node def = Node.newString(Token.SETTER_DEF, name);
    def.addChildToBack(function);
    return def;
  }

  public static Node computedProp(Node key, Node value) {
    checkState(mayBeExpression(key));
    checkState(mayBeExpression(value));
    return new Node(Token.COMPUTED_PROP, key, value);
  }

  public static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(token.isBinaryOp() || token.isAssignmentOp(), token);
    checkState(mayBeExpression(expr1));
    checkState(mayBeExpression(expr2));
    return new Node(token, expr1, expr2);
  }

  public static Node unaryOp(Token token, Node expr) {
    checkState(token.isUnaryOp() || token == Token.INC || token == Token.DEC, token);
    checkState(mayBeExpression(expr));
    return new Node(token, expr);
  }

  public static Node hook(Node cond, Node expr1, Node expr2) {
    checkState(mayBeExpression(cond));
    checkState(mayBeExpression(expr1));
    checkState(mayBeExpression(expr2));
    return new Node(Token.HOOK, cond, expr1, expr2);
  }

  public static boolean isAssignmentTarget(Node n) {
    switch (n.getToken()) {
      case NAME:
      case GETPROP:
      case GETELEM:
        return true;
      default:
        return false;
    }
  }

  static boolean mayBeStatementNoReturn(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case FUNCTION:
        // Function declarations are statements.
        return true;
      case BLOCK:
      case BREAK:
      case CONTINUE:
      case DEBUGGER:
      case DO:
      case EXPR_RESULT:
      case FOR:
      case FOR_IN:
      case IF:
      case LABEL:
      case SWITCH:
      case THROW:
      case TRY:
      case VAR:
      case WHILE:
      case WITH:
        return true;
      default:
        return false;
    }
  }

  public static boolean mayBeStatement(Node n) {
    return mayBeStatementNoReturn(n) || n.isReturn();
  }

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best
   * guess.
   */
  public static boolean mayBeExpression(Node n) {
    Token token = n.getToken();
    if (token.isBinaryOp() || token.isUnaryOp() || token.isAssignmentOp()) {
      return true;
    }
    switch (token) {
      case FUNCTION:
      case ARRAYLIT:
      case CALL:
      case DEC:
      case FALSE:
      case GETELEM:
      case GETPROP:
      case HOOK:
      case INC:
      case NAME:
      case NEW:
      case NULL:
      case NUMBER:
      case OBJECTLIT:
      case REGEXP:
      case STRINGLIT:
      case THIS:
      case TRUE:
        return true;
      default:
        return false;
    }
  }
}
