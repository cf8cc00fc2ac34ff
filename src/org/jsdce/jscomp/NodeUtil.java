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
import static com.google.common.collect.Sets.immutableEnumSet;

import com.google.common.collect.ImmutableSet;
import org.jsdce.rhino.Node;
import org.jsdce.rhino.Token;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  private static final ImmutableSet<Token> IS_STATEMENT_PARENT =
      immutableEnumSet(Token.SCRIPT, Token.BLOCK, Token.LABEL);

  public static boolean isStatementParent(Node parent) {
    // A FUNCTION node can be either part of an expression or a statement, so
    // a detached node is never considered a statement.
    return IS_STATEMENT_PARENT.contains(parent.getToken());
  }

  public static boolean isStatement(Node n) {
    return n.getParent() != null && !n.isScript() && isStatementParent(n.getParent());
  }

  /** Is this node a function declaration, {@code function f() {}} in statement position? */
  public static boolean isFunctionDeclaration(Node n) {
    return n.isFunction() && isStatement(n);
  }

  public static boolean isFunctionExpression(Node n) {
    return n.isFunction() && !isStatement(n);
  }

  public static Node getFunctionParameters(Node fn) {
    checkArgument(fn.isFunction(), fn);
    return fn.getSecondChild();
  }

  public static Node getFunctionBody(Node fn) {
    checkArgument(fn.isFunction(), fn);
    return fn.getLastChild();
  }

  public static boolean isObjLitProperty(Node n) {
    return n.isStringKey() || n.isGetterDef() || n.isSetterDef() || n.isComputedProp();
  }

  public static boolean isGet(Node n) {
    return n.isGetProp() || n.isGetElem();
  }

  /**
   * Determines whether this node is assigned to or declared, rather than read. Covers the names
   * of VAR declarations, parameters, function and catch names, assignment and update targets, and
   * for-in targets.
   */
  public static boolean isLValue(Node n) {
    switch (n.getToken()) {
      case NAME:
      case GETPROP:
      case GETELEM:
        break;
      default:
        return false;
    }

    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }

    switch (parent.getToken()) {
      case VAR:
      case PARAM_LIST:
      case INC:
      case DEC:
        return true;
      case CATCH:
      case FUNCTION:
      case FOR_IN:
        return parent.getFirstChild() == n;
      default:
        return parent.getToken().isAssignmentOp() && parent.getFirstChild() == n;
    }
  }

  /** Returns the string constant a GETELEM index or property key statically denotes. */
  static @Nullable String getStringValue(Node n) {
    return n.isStringLit() ? n.getString() : null;
  }

  /** The operator precedence of the node type; higher binds tighter. */
  public static int precedence(Token type) {
    switch (type) {
      case COMMA:
        return 0;
      case ASSIGN_BITOR:
      case ASSIGN_BITXOR:
      case ASSIGN_BITAND:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
      case ASSIGN_URSH:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
      case ASSIGN:
        return 1;
      case HOOK:
        return 3; // ?: operator
      case OR:
        return 4;
      case AND:
        return 5;
      case COALESCE:
        return 6;
      case BITOR:
        return 7;
      case BITXOR:
        return 8;
      case BITAND:
        return 9;
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return 10;
      case LT:
      case GT:
      case LE:
      case GE:
      case INSTANCEOF:
      case IN:
        return 11;
      case LSH:
      case RSH:
      case URSH:
        return 12;
      case SUB:
      case ADD:
        return 13;
      case MUL:
      case MOD:
      case DIV:
        return 14;

      case NEW:
      case DELPROP:
      case TYPEOF:
      case VOID:
      case NOT:
      case BITNOT:
      case POS:
      case NEG:
        return 16; // Unary operators

      case INC:
      case DEC:
        return 17; // Update operators

      case CALL:
      case GETELEM:
      case GETPROP:
        // Data values
      case ARRAYLIT:
      case EMPTY:
      case FALSE:
      case FUNCTION:
      case NAME:
      case NULL:
      case NUMBER:
      case OBJECTLIT:
      case REGEXP:
      case STRINGLIT:
      case STRING_KEY:
      case THIS:
      case TRUE:
        return 18;

      default:
        throw new IllegalStateException("Unknown precedence for " + type);
    }
  }

  /** Returns the source text of a binary operator, or null if the token is not one. */
  public static @Nullable String opToStr(Token operator) {
    switch (operator) {
      case COMMA:
        return ",";
      case BITOR:
        return "|";
      case OR:
        return "||";
      case BITXOR:
        return "^";
      case AND:
        return "&&";
      case COALESCE:
        return "??";
      case BITAND:
        return "&";
      case SHEQ:
        return "===";
      case EQ:
        return "==";
      case NOT:
        return "!";
      case NE:
        return "!=";
      case SHNE:
        return "!==";
      case LSH:
        return "<<";
      case IN:
        return "in";
      case LE:
        return "<=";
      case LT:
        return "<";
      case URSH:
        return ">>>";
      case RSH:
        return ">>";
      case GE:
        return ">=";
      case GT:
        return ">";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case BITNOT:
        return "~";
      case ADD:
      case POS:
        return "+";
      case SUB:
      case NEG:
        return "-";
      case ASSIGN:
        return "=";
      case ASSIGN_BITOR:
        return "|=";
      case ASSIGN_BITXOR:
        return "^=";
      case ASSIGN_BITAND:
        return "&=";
      case ASSIGN_LSH:
        return "<<=";
      case ASSIGN_RSH:
        return ">>=";
      case ASSIGN_URSH:
        return ">>>=";
      case ASSIGN_ADD:
        return "+=";
      case ASSIGN_SUB:
        return "-=";
      case ASSIGN_MUL:
        return "*=";
      case ASSIGN_DIV:
        return "/=";
      case ASSIGN_MOD:
        return "%=";
      case VOID:
        return "void";
      case TYPEOF:
        return "typeof";
      case INSTANCEOF:
        return "instanceof";
      default:
        return null;
    }
  }

  /** Like {@link #opToStr(Token)} but fails on a token with no operator text. */
  static String opToStrNoFail(Token operator) {
    String res = opToStr(operator);
    if (res == null) {
      throw new IllegalStateException("Unknown op " + operator);
    }
    return res;
  }
}
