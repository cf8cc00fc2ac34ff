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
import org.jsdce.rhino.Token;
import org.jsdce.rhino.TokenStream;

/**
 * CodeGenerator generates codes from a parse tree, sending it to the specified {@link
 * CodeConsumer}.
 */
public class CodeGenerator {

  private final CodeConsumer cc;

  CodeGenerator(CodeConsumer consumer) {
    this.cc = consumer;
  }

  enum Context {
    STATEMENT,
    START_OF_EXPR,
    // Are we inside the init clause of a for loop?  If so, the containing
    // expression can't contain an in operator.  Pass this context flag down
    // until we reach expressions which no longer have the limitation.
    IN_FOR_INIT_CLAUSE,
    OTHER; // nothing special to watch out for.

    boolean inForInInitClause() {
      return this == IN_FOR_INIT_CLAUSE;
    }
  }

  void add(String str) {
    cc.add(str);
  }

  void add(Node n) {
    add(n, Context.OTHER);
  }

  void add(Node n, Context context) {
    Token type = n.getToken();
    String opstr = NodeUtil.opToStr(type);
    int childCount = n.getChildCount();
    Node first = n.getFirstChild();
    Node last = n.getLastChild();

    // Handle all binary operators
    if (opstr != null && first != last) {
      checkState(
          childCount == 2,
          "Bad binary operator \"%s\": expected 2 arguments but got %s",
          opstr,
          childCount);
      int p = NodeUtil.precedence(type);

      // For right-hand-side of operations, only pass context if it's
      // the IN_FOR_INIT_CLAUSE one.
      Context rhsContext = getContextForNoInOperator(context);

      if (type.isAssignmentOp()) {
        // Assignment operators are the only right-associative binary operators
        addExpr(first, p + 1, context);
        cc.addOp(opstr, true);
        addExpr(last, p, rhsContext);
      } else if (type == Token.COMMA) {
        unrollBinaryOperator(n, type, opstr, context, rhsContext, 0, 0);
      } else {
        unrollBinaryOperator(n, type, opstr, context, rhsContext, p, p + 1);
      }
      return;
    }

    switch (type) {
      case TRY:
        {
          checkState(first.getNext().isBlock() && childCount >= 2 && childCount <= 3, n);
          add("try");
          add(first);

          // second child contains the catch block, or nothing if there
          // isn't a catch block
          Node catchblock = first.getNext().getFirstChild();
          if (catchblock != null) {
            add(catchblock);
          }

          if (childCount == 3) {
            cc.maybeInsertSpace();
            add("finally");
            add(last);
          }
          break;
        }

      case CATCH:
        checkState(childCount == 2, n);
        cc.maybeInsertSpace();
        add("catch");
        cc.maybeInsertSpace();
        add("(");
        add(first);
        add(")");
        add(last);
        break;

      case THROW:
        checkState(childCount == 1, n);
        add("throw");
        cc.maybeInsertSpace();
        add(first);
        cc.endStatement(true);
        break;

      case RETURN:
        add("return");
        if (childCount == 1) {
          cc.maybeInsertSpace();
          add(first);
        } else {
          checkState(childCount == 0, n);
        }
        cc.endStatement();
        break;

      case VAR:
        add("var ");
        addList(first, false, getContextForNoInOperator(context), ",");
        if (n.getParent() == null || NodeUtil.isStatement(n)) {
          cc.endStatement();
        }
        break;

      case LABEL_NAME:
        checkState(!n.getString().isEmpty(), n);
        cc.addIdentifier(n.getString());
        break;

      case NAME:
        cc.addIdentifier(n.getString());
        if (first != null) {
          checkState(childCount == 1, n);
          cc.addOp("=", true);
          addExpr(first, NodeUtil.precedence(Token.ASSIGN), getContextForNoInOperator(context));
        }
        break;

      case ARRAYLIT:
        add("[");
        addArrayList(first);
        add("]");
        break;

      case PARAM_LIST:
        add("(");
        addList(first, false, Context.OTHER, ",");
        add(")");
        break;

      case NUMBER:
        checkState(childCount == 0, n);
        cc.addNumber(n.getDouble());
        break;

      case TYPEOF:
      case VOID:
      case NOT:
      case BITNOT:
      case POS:
        {
          // All of these unary operators are right-associative
          checkState(childCount == 1, n);
          cc.addOp(NodeUtil.opToStrNoFail(type), false);
          addExpr(first, NodeUtil.precedence(type), Context.OTHER);
          break;
        }

      case NEG:
        {
          checkState(childCount == 1, n);
          // Print "-2" rather than "- 2" for a negated literal; it parses back the same.
          if (first.isNumber()) {
            cc.addNumber(-first.getDouble());
          } else {
            cc.addOp(NodeUtil.opToStrNoFail(type), false);
            addExpr(first, NodeUtil.precedence(type), Context.OTHER);
          }
          break;
        }

      case DELPROP:
        checkState(childCount == 1, n);
        add("delete ");
        addExpr(first, NodeUtil.precedence(type), Context.OTHER);
        break;

      case HOOK:
        {
          checkState(childCount == 3, n);
          int p = NodeUtil.precedence(type);
          Context rhsContext = getContextForNoInOperator(context);
          addExpr(first, p + 1, context);
          cc.addOp("?", true);
          addExpr(first.getNext(), 1, rhsContext);
          cc.addOp(":", true);
          addExpr(last, 1, rhsContext);
          break;
        }

      case REGEXP:
        {
          checkState(first.isStringLit() && last.isStringLit(), n);
          String regexp = "/" + first.getString() + "/";
          // I only use one .add because whitespace matters
          if (childCount == 2) {
            add(regexp + last.getString());
          } else {
            checkState(childCount == 1, n);
            add(regexp);
          }
          break;
        }

      case FUNCTION:
        checkState(childCount == 3, n);
        addFunction(n, first, last, context);
        break;

      case SCRIPT:
      case ROOT:
        for (Node c = first; c != null; c = c.getNext()) {
          add(c, Context.STATEMENT);
          if (c.isFunction()) {
            cc.maybeLineBreak();
          }
        }
        break;

      case BLOCK:
        cc.beginBlock();
        for (Node c = first; c != null; c = c.getNext()) {
          add(c, Context.STATEMENT);
          if (c.isFunction()) {
            cc.maybeLineBreak();
          }
        }
        cc.endBlock(cc.breakAfterBlockFor(n, context == Context.STATEMENT));
        break;

      case FOR:
        checkState(childCount == 4, n);
        add("for");
        cc.maybeInsertSpace();
        add("(");
        if (first.isVar()) {
          add(first, Context.IN_FOR_INIT_CLAUSE);
        } else {
          addExpr(first, 0, Context.IN_FOR_INIT_CLAUSE);
        }
        add(";");
        if (!first.getNext().isEmpty()) {
          cc.maybeInsertSpace();
        }
        add(first.getNext());
        add(";");
        if (!first.getNext().getNext().isEmpty()) {
          cc.maybeInsertSpace();
        }
        add(first.getNext().getNext());
        add(")");
        add(last, getContextForNonEmptyExpression(context));
        break;

      case FOR_IN:
        checkState(childCount == 3, n);
        add("for");
        cc.maybeInsertSpace();
        add("(");
        add(first);
        add("in");
        add(first.getNext());
        add(")");
        add(last, getContextForNonEmptyExpression(context));
        break;

      case DO:
        checkState(childCount == 2, n);
        add("do");
        add(first, Context.OTHER);
        cc.maybeInsertSpace();
        add("while");
        cc.maybeInsertSpace();
        add("(");
        add(last);
        add(")");
        cc.endStatement();
        break;

      case WHILE:
        checkState(childCount == 2, n);
        add("while");
        cc.maybeInsertSpace();
        add("(");
        add(first);
        add(")");
        add(last, getContextForNonEmptyExpression(context));
        break;

      case EMPTY:
        checkState(childCount == 0, n);
        if (context == Context.STATEMENT) {
          cc.endStatement(true);
        }
        break;

      case GETPROP:
        {
          checkState(childCount == 1, "Bad GETPROP: expected 1 child, but got %s", childCount);
          boolean needsParens = first.isNumber();
          if (needsParens) {
            add("(");
          }
          addExpr(first, NodeUtil.precedence(type), context);
          if (needsParens) {
            add(")");
          }
          add(".");
          cc.addIdentifier(n.getString());
          break;
        }

      case GETELEM:
        checkState(childCount == 2, "Bad GETELEM node: Expected 2 children but got %s", childCount);
        addExpr(first, NodeUtil.precedence(type), context);
        add("[");
        add(first.getNext());
        add("]");
        break;

      case WITH:
        checkState(childCount == 2, n);
        add("with(");
        add(first);
        add(")");
        add(last, getContextForNonEmptyExpression(context));
        break;

      case INC:
      case DEC:
        {
          checkState(childCount == 1, n);
          String o = type == Token.INC ? "++" : "--";
          if (n.getBooleanProp(Node.Prop.INCRDECR)) {
            addExpr(first, NodeUtil.precedence(type), context);
            cc.addOp(o, false);
          } else {
            cc.addOp(o, false);
            add(first);
          }
          break;
        }

      case CALL:
        if (n.getBooleanProp(Node.Prop.FREE_CALL) && NodeUtil.isGet(first)) {
          add("(0,");
          addExpr(first, NodeUtil.precedence(Token.COMMA), Context.OTHER);
          add(")");
        } else {
          addExpr(first, NodeUtil.precedence(type), context);
        }
        add("(");
        addList(first.getNext(), true, Context.OTHER, ",");
        add(")");
        break;

      case IF:
        checkState(childCount == 2 || childCount == 3, n);
        add("if");
        cc.maybeInsertSpace();
        add("(");
        add(first);
        add(")");
        if (childCount == 3) {
          add(first.getNext(), Context.OTHER);
          cc.maybeInsertSpace();
          add("else");
          add(last, getContextForNonEmptyExpression(context));
        } else {
          add(first.getNext(), getContextForNonEmptyExpression(context));
        }
        break;

      case NULL:
        checkState(childCount == 0, n);
        cc.addConstant("null");
        break;

      case THIS:
        checkState(childCount == 0, n);
        add("this");
        break;

      case FALSE:
        checkState(childCount == 0, n);
        cc.addConstant("false");
        break;

      case TRUE:
        checkState(childCount == 0, n);
        cc.addConstant("true");
        break;

      case CONTINUE:
      case BREAK:
        checkState(childCount <= 1, n);
        add(type == Token.BREAK ? "break" : "continue");
        if (childCount == 1) {
          checkState(first.getToken() == Token.LABEL_NAME, first);
          add(" ");
          add(first);
        }
        cc.endStatement();
        break;

      case DEBUGGER:
        checkState(childCount == 0, n);
        add("debugger");
        cc.endStatement();
        break;

      case EXPR_RESULT:
        checkState(childCount == 1, n);
        add(first, Context.START_OF_EXPR);
        cc.endStatement();
        break;

      case NEW:
        {
          add("new ");
          int precedence = NodeUtil.precedence(type);
          if (containsCallInTarget(first)) {
            precedence = NodeUtil.precedence(first.getToken()) + 1;
          }
          addExpr(first, precedence, Context.OTHER);

          Node next = first.getNext();
          if (next != null) {
            add("(");
            addList(next, true, Context.OTHER, ",");
            add(")");
          }
          break;
        }

      case STRING_KEY:
        checkState(childCount == 1, "Object lit key must have 1 child");
        addObjectLitKey(n);
        cc.addOp(":", false);
        addExpr(first, 1, Context.OTHER);
        break;

      case GETTER_DEF:
      case SETTER_DEF:
        {
          checkState(n.getParent().isObjectLit(), n);
          checkState(childCount == 1 && first.isFunction(), n);
          add(type == Token.GETTER_DEF ? "get " : "set ");
          addObjectLitKey(n);
          add(first.getSecondChild());
          add(first.getLastChild());
          break;
        }

      case COMPUTED_PROP:
        checkState(childCount == 2, n);
        add("[");
        addExpr(first, 1, Context.OTHER);
        add("]");
        cc.addOp(":", false);
        addExpr(last, 1, Context.OTHER);
        break;

      case STRINGLIT:
        checkState(childCount == 0, "String node %s may not have children", n);
        add(jsString(n.getString()));
        break;

      case OBJECTLIT:
        {
          boolean needsParens = context == Context.START_OF_EXPR;
          if (needsParens) {
            add("(");
          }
          add("{");
          for (Node c = first; c != null; c = c.getNext()) {
            if (c != first) {
              cc.listSeparator();
            }
            checkState(NodeUtil.isObjLitProperty(c), c);
            add(c);
          }
          add("}");
          if (needsParens) {
            add(")");
          }
          break;
        }

      case SWITCH:
        add("switch(");
        add(first);
        add(")");
        cc.beginBlock();
        for (Node c = first.getNext(); c != null; c = c.getNext()) {
          add(c);
        }
        cc.endBlock(context == Context.STATEMENT);
        break;

      case CASE:
        checkState(childCount == 2, n);
        add("case ");
        add(first);
        addCaseBody(last);
        break;

      case DEFAULT_CASE:
        checkState(childCount == 1, n);
        add("default");
        addCaseBody(first);
        break;

      case LABEL:
        checkState(childCount == 2 && first.getToken() == Token.LABEL_NAME, n);
        add(first);
        add(":");
        if (!last.isBlock()) {
          cc.maybeInsertSpace();
        }
        add(last, getContextForNonEmptyExpression(context));
        break;

      default:
        throw new IllegalStateException("Unknown token " + type + "\n" + n.toStringTree());
    }
  }

  private void addFunction(Node n, Node first, Node last, Context context) {
    boolean funcNeedsParens = (context == Context.START_OF_EXPR);
    if (funcNeedsParens) {
      add("(");
    }

    add("function");
    add(first);

    add(first.getNext()); // param list
    add(last);
    cc.endFunction(context == Context.STATEMENT);

    if (funcNeedsParens) {
      add(")");
    }
  }

  private void addExpr(Node n, int minPrecedence, Context context) {
    if (opRequiresParentheses(n, minPrecedence, context)) {
      add("(");
      add(n, Context.OTHER);
      add(")");
    } else {
      add(n, context);
    }
  }

  private static boolean opRequiresParentheses(Node n, int minPrecedence, Context context) {
    if (context.inForInInitClause() && n.getToken() == Token.IN) {
      // make sure this operator 'in' isn't confused with the for-loop 'in'
      return true;
    }
    return NodeUtil.precedence(n.getToken()) < minPrecedence;
  }

  /**
   * We could use addList recursively here, but sometimes we produce very deeply nested operators
   * and run out of stack space, so we just unroll the recursion when possible.
   *
   * <p>We assume nodes are left-recursive.
   */
  private void unrollBinaryOperator(
      Node n,
      Token op,
      String opStr,
      Context context,
      Context rhsContext,
      int leftPrecedence,
      int rightPrecedence) {
    Node firstNonOperator = n.getFirstChild();
    while (firstNonOperator.getToken() == op) {
      firstNonOperator = firstNonOperator.getFirstChild();
    }

    addExpr(firstNonOperator, leftPrecedence, context);

    Node current = firstNonOperator;
    do {
      current = current.getParent();
      cc.addOp(opStr, true);
      addExpr(current.getSecondChild(), rightPrecedence, rhsContext);
    } while (current != n);
  }

  void addList(
      Node firstInList, boolean isArrayOrFunctionArgument, Context lhsContext, String separator) {
    for (Node n = firstInList; n != null; n = n.getNext()) {
      boolean isFirst = n == firstInList;
      if (isFirst) {
        addExpr(n, isArrayOrFunctionArgument ? 1 : 0, lhsContext);
      } else {
        cc.addOp(separator, true);
        addExpr(n, isArrayOrFunctionArgument ? 1 : 0, getContextForNoInOperator(lhsContext));
      }
    }
  }

  /**
   * This function adds a comma-separated list as is specified by an ARRAYLIT node with the
   * associated skipIndexes array. This is a space optimization since we avoid creating a whole
   * Node object for each empty array literal slot.
   */
  private void addArrayList(Node firstInList) {
    boolean lastWasEmpty = false;
    for (Node n = firstInList; n != null; n = n.getNext()) {
      if (n != firstInList) {
        cc.listSeparator();
      }
      addExpr(n, 1, Context.OTHER);
      lastWasEmpty = n.isEmpty();
    }

    if (lastWasEmpty) {
      cc.listSeparator();
    }
  }

  private void addCaseBody(Node caseBody) {
    cc.beginCaseBody();
    for (Node c = caseBody.getFirstChild(); c != null; c = c.getNext()) {
      add(c, Context.STATEMENT);
    }
    cc.endCaseBody();
  }

  private void addObjectLitKey(Node n) {
    String key = n.getString();
    if (!n.getBooleanProp(Node.Prop.QUOTED) && TokenStream.isJSIdentifier(key)) {
      add(key);
    } else {
      double d = getSimpleNumber(key);
      if (!Double.isNaN(d)) {
        cc.addNumber(d);
      } else {
        add(jsString(key));
      }
    }
  }

  /** Returns the canonical number a key spells, or NaN. */
  static double getSimpleNumber(String s) {
    if (isSimpleNumber(s)) {
      try {
        long l = Long.parseLong(s);
        if (l < 1L << 53) {
          return l;
        }
      } catch (NumberFormatException e) {
        // The number is too long to be a simple index.
        return Double.NaN;
      }
    }
    return Double.NaN;
  }

  static boolean isSimpleNumber(String s) {
    int len = s.length();
    if (len == 0) {
      return false;
    }
    for (int index = 0; index < len; index++) {
      char c = s.charAt(index);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return len == 1 || s.charAt(0) != '0';
  }

  private static boolean containsCallInTarget(Node n) {
    for (Node c = n; ; c = c.getFirstChild()) {
      switch (c.getToken()) {
        case CALL:
          return true;
        case GETPROP:
        case GETELEM:
          break;
        default:
          return false;
      }
    }
  }

  private static Context getContextForNonEmptyExpression(Context currentContext) {
    return currentContext == Context.STATEMENT ? Context.STATEMENT : Context.OTHER;
  }

  private static Context getContextForNoInOperator(Context context) {
    return context.inForInInitClause() ? context : Context.OTHER;
  }

  /** Outputs a JS string, using the optimal (single/double) quote character. */
  static String jsString(String s) {
    int singleq = 0;
    int doubleq = 0;

    // could count the quotes and pick the optimal quote character
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
        case '"':
          doubleq++;
          break;
        case '\'':
          singleq++;
          break;
        default:
          break;
      }
    }

    char quote = doubleq > singleq ? '\'' : '"';
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append(quote);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\0':
          sb.append("\\x00");
          break;
        case '\u000B':
          sb.append("\\v");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '"':
        case '\'':
          if (c == quote) {
            sb.append('\\');
          }
          sb.append(c);
          break;
        default:
          if (c < 0x20 || c > 0x7e) {
            // Other characters can be misinterpreted by some JS parsers, or perhaps mangled by
            // proxies along the way, so we play it safe and unicode escape them.
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append(quote);
    return sb.toString();
  }
}
