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

package org.jsdce.jscomp.parsing;

import com.google.common.collect.ImmutableList;
import org.jsdce.jscomp.parsing.Scanner.JsToken;
import org.jsdce.jscomp.parsing.Scanner.Kind;
import org.jsdce.rhino.IR;
import org.jsdce.rhino.Node;
import org.jsdce.rhino.Token;

/**
 * This class implements the JavaScript parser. It is a recursive descent parser over the ES5
 * statement and expression grammar (plus computed object literal keys and {@code ??}), producing
 * the tree shapes built by {@link IR}.
 *
 * <p>The first syntax error aborts the parse with a {@link ParserException}.
 */
final class Parser {

  private final ImmutableList<JsToken> tokens;
  private int index = 0;

  // Per function state, saved and restored around function bodies.
  private boolean inFunction = false;

  Parser(ImmutableList<JsToken> tokens) {
    this.tokens = tokens;
  }

  /** Parses a whole program into a SCRIPT node. */
  Node parseScript() {
    Node script = new Node(Token.SCRIPT);
    script.setLinenoCharno(1, 0);
    while (peek().kind != Kind.EOF) {
      script.addChildToBack(statement());
    }
    return script;
  }

  // Token stream helpers.

  private JsToken peek() {
    return tokens.get(index);
  }

  private JsToken peekSecond() {
    return tokens.get(Math.min(index + 1, tokens.size() - 1));
  }

  private JsToken next() {
    JsToken t = tokens.get(index);
    if (t.kind != Kind.EOF) {
      index++;
    }
    return t;
  }

  private boolean matchPunctuator(String value) {
    if (peek().isPunctuator(value)) {
      index++;
      return true;
    }
    return false;
  }

  private boolean matchKeyword(String value) {
    if (peek().isKeyword(value)) {
      index++;
      return true;
    }
    return false;
  }

  private JsToken mustMatchPunctuator(String value, String message) {
    JsToken t = peek();
    if (!t.isPunctuator(value)) {
      throw reportError(t, message);
    }
    return next();
  }

  private JsToken mustMatchName(String message) {
    JsToken t = peek();
    if (t.kind != Kind.NAME) {
      throw reportError(t, message);
    }
    return next();
  }

  private static ParserException reportError(JsToken t, String message) {
    return new ParserException(message + " (found " + t + ")", t.lineno, t.charno);
  }

  private static <T extends Node> T at(T n, JsToken t) {
    n.setLinenoCharno(t.lineno, t.charno);
    return n;
  }

  /** Consumes a semicolon or applies automatic semicolon insertion. */
  private void autoSemicolon() {
    JsToken t = peek();
    if (t.isPunctuator(";")) {
      index++;
      return;
    }
    if (t.isPunctuator("}") || t.kind == Kind.EOF || t.afterLineTerminator) {
      return;
    }
    throw reportError(t, "missing ; before statement");
  }

  private boolean canInsertSemicolonHere() {
    JsToken t = peek();
    return t.isPunctuator(";")
        || t.isPunctuator("}")
        || t.kind == Kind.EOF
        || t.afterLineTerminator;
  }

  // Statements.

  private Node statement() {
    JsToken t = peek();
    if (t.kind == Kind.PUNCTUATOR) {
      if (t.value.equals("{")) {
        return block();
      }
      if (t.value.equals(";")) {
        next();
        return at(IR.empty(), t);
      }
    } else if (t.kind == Kind.KEYWORD) {
      switch (t.value) {
        case "var":
          {
            next();
            Node var = variables(t, false);
            autoSemicolon();
            return var;
          }
        case "function":
          return function(true);
        case "if":
          return ifStatement();
        case "while":
          {
            next();
            Node cond = condition();
            return at(new Node(Token.WHILE, cond, blockOf(statement())), t);
          }
        case "do":
          {
            next();
            Node body = blockOf(statement());
            if (!matchKeyword("while")) {
              throw reportError(peek(), "missing while after do-loop body");
            }
            Node cond = condition();
            matchPunctuator(";");
            return at(new Node(Token.DO, body, cond), t);
          }
        case "for":
          return forStatement();
        case "break":
        case "continue":
          {
            next();
            Node jump = at(new Node(t.value.equals("break") ? Token.BREAK : Token.CONTINUE), t);
            if (peek().kind == Kind.NAME && !peek().afterLineTerminator) {
              JsToken label = next();
              jump.addChildToBack(at(Node.newString(Token.LABEL_NAME, label.value), label));
            }
            autoSemicolon();
            return jump;
          }
        case "return":
          {
            next();
            if (!inFunction) {
              throw reportError(t, "invalid return");
            }
            Node ret = at(IR.returnNode(), t);
            if (!canInsertSemicolonHere()) {
              ret.addChildToBack(expr(false));
            }
            autoSemicolon();
            return ret;
          }
        case "throw":
          {
            next();
            if (canInsertSemicolonHere()) {
              throw reportError(peek(), "syntax error");
            }
            Node thrown = at(IR.throwNode(expr(false)), t);
            autoSemicolon();
            return thrown;
          }
        case "try":
          return tryStatement();
        case "switch":
          return switchStatement();
        case "with":
          {
            next();
            Node object = condition();
            return at(new Node(Token.WITH, object, blockOf(statement())), t);
          }
        case "debugger":
          next();
          autoSemicolon();
          return at(new Node(Token.DEBUGGER), t);
        default:
          break;
      }
    } else if (t.kind == Kind.NAME && peekSecond().isPunctuator(":")) {
      next();
      next();
      Node label = at(Node.newString(Token.LABEL_NAME, t.value), t);
      return at(new Node(Token.LABEL, label, statement()), t);
    }

    Node e = expr(false);
    autoSemicolon();
    return at(IR.exprResult(e), t);
  }

  private Node block() {
    JsToken open = mustMatchPunctuator("{", "missing { before block");
    Node block = at(IR.block(), open);
    while (!peek().isPunctuator("}")) {
      if (peek().kind == Kind.EOF) {
        throw reportError(peek(), "missing } in compound statement");
      }
      block.addChildToBack(statement());
    }
    next();
    return block;
  }

  /** Wraps a statement in a BLOCK unless it already is one. */
  private static Node blockOf(Node stmt) {
    if (stmt.isBlock()) {
      return stmt;
    }
    Node block = IR.block(stmt);
    block.setSourceInfoFrom(stmt);
    return block;
  }

  private Node condition() {
    mustMatchPunctuator("(", "missing ( before condition");
    Node cond = expr(false);
    mustMatchPunctuator(")", "missing ) after condition");
    return cond;
  }

  private Node variables(JsToken varToken, boolean inForInit) {
    Node var = at(new Node(Token.VAR), varToken);
    do {
      JsToken nameToken = mustMatchName("missing variable name");
      Node name = at(IR.name(nameToken.value), nameToken);
      if (matchPunctuator("=")) {
        name.addChildToBack(assignExpr(inForInit));
      }
      var.addChildToBack(name);
    } while (matchPunctuator(","));
    return var;
  }

  private Node ifStatement() {
    JsToken t = next();
    Node cond = condition();
    Node then = blockOf(statement());
    if (matchKeyword("else")) {
      return at(IR.ifNode(cond, then, blockOf(statement())), t);
    }
    return at(IR.ifNode(cond, then), t);
  }

  private Node forStatement() {
    JsToken t = next();
    mustMatchPunctuator("(", "missing ( after for");
    Node init;
    JsToken initToken = peek();
    if (peek().isPunctuator(";")) {
      init = at(IR.empty(), initToken);
    } else if (matchKeyword("var")) {
      init = variables(initToken, true);
    } else {
      init = expr(true);
    }

    if (matchKeyword("in")) {
      if (init.isVar()) {
        if (!init.hasOneChild() || init.getFirstChild().hasChildren()) {
          throw reportError(initToken, "invalid for/in left-hand side");
        }
      } else if (!IR.isAssignmentTarget(init)) {
        throw reportError(initToken, "invalid for/in left-hand side");
      }
      Node object = expr(false);
      mustMatchPunctuator(")", "missing ) after for-loop control");
      return at(IR.forIn(init, object, blockOf(statement())), t);
    }

    mustMatchPunctuator(";", "missing ; after for-loop initializer");
    Node cond = peek().isPunctuator(";") ? at(IR.empty(), peek()) : expr(false);
    mustMatchPunctuator(";", "missing ; after for-loop condition");
    Node incr = peek().isPunctuator(")") ? at(IR.empty(), peek()) : expr(false);
    mustMatchPunctuator(")", "missing ) after for-loop control");
    Node forNode = at(new Node(Token.FOR, init, cond, incr), t);
    forNode.addChildToBack(blockOf(statement()));
    return forNode;
  }

  private Node tryStatement() {
    JsToken t = next();
    Node tryBlock = block();
    Node catchBlock = at(IR.block(), peek());
    boolean sawCatchOrFinally = false;
    if (peek().isKeyword("catch")) {
      JsToken catchToken = next();
      mustMatchPunctuator("(", "missing ( before catch-block condition");
      JsToken nameToken = mustMatchName("invalid catch block condition");
      mustMatchPunctuator(")", "missing ) after catch-block condition");
      Node catchName = at(IR.name(nameToken.value), nameToken);
      Node catchNode = at(IR.catchNode(catchName, block()), catchToken);
      catchBlock.addChildToBack(catchNode);
      sawCatchOrFinally = true;
    }
    Node tryNode = at(new Node(Token.TRY, tryBlock, catchBlock), t);
    if (matchKeyword("finally")) {
      tryNode.addChildToBack(block());
      sawCatchOrFinally = true;
    }
    if (!sawCatchOrFinally) {
      throw reportError(peek(), "try without catch or finally");
    }
    return tryNode;
  }

  private Node switchStatement() {
    JsToken t = next();
    Node discriminant = condition();
    Node switchNode = at(new Node(Token.SWITCH, discriminant), t);
    mustMatchPunctuator("{", "missing { before switch body");
    boolean sawDefault = false;
    while (!matchPunctuator("}")) {
      JsToken caseToken = next();
      Node caseNode;
      if (caseToken.isKeyword("case")) {
        caseNode = at(new Node(Token.CASE, expr(false)), caseToken);
      } else if (caseToken.isKeyword("default")) {
        if (sawDefault) {
          throw reportError(caseToken, "double default label in the switch statement");
        }
        sawDefault = true;
        caseNode = at(new Node(Token.DEFAULT_CASE), caseToken);
      } else {
        throw reportError(caseToken, "invalid switch statement");
      }
      mustMatchPunctuator(":", "missing : after case expression");
      Node body = at(IR.block(), caseToken);
      while (!peek().isKeyword("case")
          && !peek().isKeyword("default")
          && !peek().isPunctuator("}")) {
        if (peek().kind == Kind.EOF) {
          throw reportError(peek(), "missing } after switch body");
        }
        body.addChildToBack(statement());
      }
      caseNode.addChildToBack(body);
      switchNode.addChildToBack(caseNode);
    }
    return switchNode;
  }

  private Node function(boolean isStatement) {
    JsToken t = next();
    Node name;
    if (peek().kind == Kind.NAME) {
      JsToken nameToken = next();
      name = at(IR.name(nameToken.value), nameToken);
    } else if (isStatement) {
      throw reportError(peek(), "missing name after function keyword");
    } else {
      name = at(IR.name(""), t);
    }

    JsToken open = mustMatchPunctuator("(", "missing ( before formal parameters");
    Node params = at(IR.paramList(), open);
    if (!peek().isPunctuator(")")) {
      do {
        JsToken paramToken = mustMatchName("missing formal parameter");
        params.addChildToBack(at(IR.name(paramToken.value), paramToken));
      } while (matchPunctuator(","));
    }
    mustMatchPunctuator(")", "missing ) after formal parameters");

    boolean savedInFunction = inFunction;
    inFunction = true;
    try {
      return at(IR.function(name, params, block()), t);
    } finally {
      inFunction = savedInFunction;
    }
  }

  // Expressions, lowest precedence first.

  private Node expr(boolean inForInit) {
    Node pn = assignExpr(inForInit);
    while (peek().isPunctuator(",")) {
      JsToken t = next();
      pn = at(new Node(Token.COMMA, pn, assignExpr(inForInit)), t);
    }
    return pn;
  }

  private Node assignExpr(boolean inForInit) {
    Node pn = condExpr(inForInit);
    JsToken t = peek();
    Token op = t.kind == Kind.PUNCTUATOR ? assignmentOp(t.value) : null;
    if (op != null) {
      next();
      if (!IR.isAssignmentTarget(pn)) {
        throw reportError(t, "invalid assignment left-hand side");
      }
      pn = at(new Node(op, pn, assignExpr(inForInit)), t);
    }
    return pn;
  }

  private static Token assignmentOp(String value) {
    switch (value) {
      case "=":
        return Token.ASSIGN;
      case "|=":
        return Token.ASSIGN_BITOR;
      case "^=":
        return Token.ASSIGN_BITXOR;
      case "&=":
        return Token.ASSIGN_BITAND;
      case "<<=":
        return Token.ASSIGN_LSH;
      case ">>=":
        return Token.ASSIGN_RSH;
      case ">>>=":
        return Token.ASSIGN_URSH;
      case "+=":
        return Token.ASSIGN_ADD;
      case "-=":
        return Token.ASSIGN_SUB;
      case "*=":
        return Token.ASSIGN_MUL;
      case "/=":
        return Token.ASSIGN_DIV;
      case "%=":
        return Token.ASSIGN_MOD;
      default:
        return null;
    }
  }

  private Node condExpr(boolean inForInit) {
    Node pn = orExpr(inForInit);
    if (peek().isPunctuator("?")) {
      JsToken t = next();
      Node ifTrue = assignExpr(false);
      mustMatchPunctuator(":", "missing : in conditional expression");
      Node ifFalse = assignExpr(inForInit);
      return at(IR.hook(pn, ifTrue, ifFalse), t);
    }
    return pn;
  }

  private Node orExpr(boolean inForInit) {
    Node pn = andExpr(inForInit);
    while (peek().isPunctuator("||") || peek().isPunctuator("??")) {
      JsToken t = next();
      Token op = t.value.equals("||") ? Token.OR : Token.COALESCE;
      pn = at(new Node(op, pn, andExpr(inForInit)), t);
    }
    return pn;
  }

  private Node andExpr(boolean inForInit) {
    Node pn = bitOrExpr(inForInit);
    while (peek().isPunctuator("&&")) {
      JsToken t = next();
      pn = at(new Node(Token.AND, pn, bitOrExpr(inForInit)), t);
    }
    return pn;
  }

  private Node bitOrExpr(boolean inForInit) {
    Node pn = bitXorExpr(inForInit);
    while (peek().isPunctuator("|")) {
      JsToken t = next();
      pn = at(new Node(Token.BITOR, pn, bitXorExpr(inForInit)), t);
    }
    return pn;
  }

  private Node bitXorExpr(boolean inForInit) {
    Node pn = bitAndExpr(inForInit);
    while (peek().isPunctuator("^")) {
      JsToken t = next();
      pn = at(new Node(Token.BITXOR, pn, bitAndExpr(inForInit)), t);
    }
    return pn;
  }

  private Node bitAndExpr(boolean inForInit) {
    Node pn = eqExpr(inForInit);
    while (peek().isPunctuator("&")) {
      JsToken t = next();
      pn = at(new Node(Token.BITAND, pn, eqExpr(inForInit)), t);
    }
    return pn;
  }

  private Node eqExpr(boolean inForInit) {
    Node pn = relExpr(inForInit);
    while (true) {
      JsToken t = peek();
      Token op = null;
      if (t.kind == Kind.PUNCTUATOR) {
        switch (t.value) {
          case "==":
            op = Token.EQ;
            break;
          case "!=":
            op = Token.NE;
            break;
          case "===":
            op = Token.SHEQ;
            break;
          case "!==":
            op = Token.SHNE;
            break;
          default:
            break;
        }
      }
      if (op == null) {
        return pn;
      }
      next();
      pn = at(new Node(op, pn, relExpr(inForInit)), t);
    }
  }

  private Node relExpr(boolean inForInit) {
    Node pn = shiftExpr();
    while (true) {
      JsToken t = peek();
      Token op = null;
      if (t.kind == Kind.PUNCTUATOR) {
        switch (t.value) {
          case "<":
            op = Token.LT;
            break;
          case "<=":
            op = Token.LE;
            break;
          case ">":
            op = Token.GT;
            break;
          case ">=":
            op = Token.GE;
            break;
          default:
            break;
        }
      } else if (t.isKeyword("instanceof")) {
        op = Token.INSTANCEOF;
      } else if (t.isKeyword("in") && !inForInit) {
        op = Token.IN;
      }
      if (op == null) {
        return pn;
      }
      next();
      pn = at(new Node(op, pn, shiftExpr()), t);
    }
  }

  private Node shiftExpr() {
    Node pn = addExpr();
    while (true) {
      JsToken t = peek();
      Token op;
      if (t.isPunctuator("<<")) {
        op = Token.LSH;
      } else if (t.isPunctuator(">>")) {
        op = Token.RSH;
      } else if (t.isPunctuator(">>>")) {
        op = Token.URSH;
      } else {
        return pn;
      }
      next();
      pn = at(new Node(op, pn, addExpr()), t);
    }
  }

  private Node addExpr() {
    Node pn = mulExpr();
    while (peek().isPunctuator("+") || peek().isPunctuator("-")) {
      JsToken t = next();
      Token op = t.value.equals("+") ? Token.ADD : Token.SUB;
      pn = at(new Node(op, pn, mulExpr()), t);
    }
    return pn;
  }

  private Node mulExpr() {
    Node pn = unaryExpr();
    while (true) {
      JsToken t = peek();
      Token op;
      if (t.isPunctuator("*")) {
        op = Token.MUL;
      } else if (t.isPunctuator("/")) {
        op = Token.DIV;
      } else if (t.isPunctuator("%")) {
        op = Token.MOD;
      } else {
        return pn;
      }
      next();
      pn = at(new Node(op, pn, unaryExpr()), t);
    }
  }

  private Node unaryExpr() {
    JsToken t = peek();
    Token op = null;
    if (t.kind == Kind.PUNCTUATOR) {
      switch (t.value) {
        case "!":
          op = Token.NOT;
          break;
        case "~":
          op = Token.BITNOT;
          break;
        case "+":
          op = Token.POS;
          break;
        case "-":
          op = Token.NEG;
          break;
        case "++":
          op = Token.INC;
          break;
        case "--":
          op = Token.DEC;
          break;
        default:
          break;
      }
    } else if (t.kind == Kind.KEYWORD) {
      switch (t.value) {
        case "typeof":
          op = Token.TYPEOF;
          break;
        case "void":
          op = Token.VOID;
          break;
        case "delete":
          op = Token.DELPROP;
          break;
        default:
          break;
      }
    }
    if (op != null) {
      next();
      Node operand = unaryExpr();
      if ((op == Token.INC || op == Token.DEC) && !IR.isAssignmentTarget(operand)) {
        throw reportError(t, "invalid increment/decrement operand");
      }
      return at(new Node(op, operand), t);
    }

    Node pn = memberExpr(true);
    JsToken post = peek();
    if ((post.isPunctuator("++") || post.isPunctuator("--")) && !post.afterLineTerminator) {
      next();
      if (!IR.isAssignmentTarget(pn)) {
        throw reportError(post, "invalid increment/decrement operand");
      }
      Node update = at(new Node(post.value.equals("++") ? Token.INC : Token.DEC, pn), post);
      update.putBooleanProp(Node.Prop.INCRDECR, true);
      return update;
    }
    return pn;
  }

  private Node memberExpr(boolean allowCallSyntax) {
    Node pn;
    JsToken t = peek();
    if (t.isKeyword("new")) {
      next();
      pn = at(new Node(Token.NEW, memberExpr(false)), t);
      if (peek().isPunctuator("(")) {
        next();
        argumentList(pn);
      }
    } else {
      pn = primaryExpr();
    }
    return memberExprTail(allowCallSyntax, pn);
  }

  private Node memberExprTail(boolean allowCallSyntax, Node pn) {
    while (true) {
      JsToken t = peek();
      if (t.isPunctuator(".")) {
        next();
        JsToken nameToken = next();
        if (nameToken.kind != Kind.NAME && nameToken.kind != Kind.KEYWORD) {
          throw reportError(nameToken, "missing name after . operator");
        }
        pn = at(IR.getprop(pn, nameToken.value), t);
      } else if (t.isPunctuator("[")) {
        next();
        Node index = expr(false);
        mustMatchPunctuator("]", "missing ] in index expression");
        pn = at(IR.getelem(pn, index), t);
      } else if (allowCallSyntax && t.isPunctuator("(")) {
        next();
        boolean freeCall = !pn.isGetProp() && !pn.isGetElem();
        Node call = at(new Node(Token.CALL, pn), t);
        call.putBooleanProp(Node.Prop.FREE_CALL, freeCall);
        argumentList(call);
        pn = call;
      } else {
        return pn;
      }
    }
  }

  /** Parses arguments after an opening parenthesis, appending them to {@code call}. */
  private void argumentList(Node call) {
    if (matchPunctuator(")")) {
      return;
    }
    do {
      call.addChildToBack(assignExpr(false));
    } while (matchPunctuator(","));
    mustMatchPunctuator(")", "missing ) after argument list");
  }

  private Node primaryExpr() {
    JsToken t = peek();
    switch (t.kind) {
      case NAME:
        next();
        return at(IR.name(t.value), t);
      case NUMBER:
        next();
        return at(IR.number(t.number), t);
      case STRING:
        next();
        return at(IR.string(t.value), t);
      case REGEXP:
        {
          next();
          int lastSlash = t.value.lastIndexOf('/');
          Node regexp = at(new Node(Token.REGEXP), t);
          regexp.addChildToBack(at(IR.string(t.value.substring(1, lastSlash)), t));
          String flags = t.value.substring(lastSlash + 1);
          if (!flags.isEmpty()) {
            regexp.addChildToBack(at(IR.string(flags), t));
          }
          return regexp;
        }
      case KEYWORD:
        switch (t.value) {
          case "function":
            return function(false);
          case "this":
            next();
            return at(IR.thisNode(), t);
          case "null":
            next();
            return at(IR.nullNode(), t);
          case "true":
            next();
            return at(IR.trueNode(), t);
          case "false":
            next();
            return at(IR.falseNode(), t);
          default:
            throw reportError(t, "syntax error");
        }
      case PUNCTUATOR:
        switch (t.value) {
          case "(":
            {
              next();
              Node pn = expr(false);
              mustMatchPunctuator(")", "missing ) in parenthetical");
              return pn;
            }
          case "[":
            return arrayLiteral();
          case "{":
            return objectLiteral();
          default:
            throw reportError(t, "syntax error");
        }
      default:
        throw reportError(t, "syntax error");
    }
  }

  private Node arrayLiteral() {
    JsToken t = next();
    Node array = at(new Node(Token.ARRAYLIT), t);
    boolean afterComma = true;
    while (!matchPunctuator("]")) {
      JsToken e = peek();
      if (e.isPunctuator(",")) {
        next();
        if (afterComma) {
          array.addChildToBack(at(IR.empty(), e));
        }
        afterComma = true;
      } else if (afterComma) {
        array.addChildToBack(assignExpr(false));
        afterComma = false;
      } else {
        throw reportError(e, "missing ] after element list");
      }
    }
    return array;
  }

  private Node objectLiteral() {
    JsToken t = next();
    Node object = at(new Node(Token.OBJECTLIT), t);
    while (!matchPunctuator("}")) {
      object.addChildToBack(propertyDefinition());
      if (!matchPunctuator(",")) {
        mustMatchPunctuator("}", "missing } after property list");
        break;
      }
    }
    return object;
  }

  private Node propertyDefinition() {
    JsToken t = peek();
    if (t.kind == Kind.NAME
        && (t.value.equals("get") || t.value.equals("set"))
        && !peekSecond().isPunctuator(":")
        && !peekSecond().isPunctuator(",")
        && !peekSecond().isPunctuator("}")) {
      next();
      boolean isGetter = t.value.equals("get");
      JsToken keyToken = next();
      String key = propertyName(keyToken);
      Node fn = accessorFunction(keyToken, isGetter);
      Node def = at(isGetter ? IR.getterDef(key, fn) : IR.setterDef(key, fn), keyToken);
      if (keyToken.kind == Kind.STRING) {
        def.putBooleanProp(Node.Prop.QUOTED, true);
      }
      return def;
    }
    if (t.isPunctuator("[")) {
      next();
      Node key = assignExpr(false);
      mustMatchPunctuator("]", "missing ] in computed property name");
      mustMatchPunctuator(":", "missing : after property id");
      return at(IR.computedProp(key, assignExpr(false)), t);
    }
    next();
    String key = propertyName(t);
    mustMatchPunctuator(":", "missing : after property id");
    Node stringKey = at(IR.stringKey(key, assignExpr(false)), t);
    if (t.kind == Kind.STRING) {
      stringKey.putBooleanProp(Node.Prop.QUOTED, true);
    }
    return stringKey;
  }

  private static String propertyName(JsToken t) {
    switch (t.kind) {
      case NAME:
      case KEYWORD:
      case STRING:
        return t.value;
      case NUMBER:
        return numberToPropertyName(t.number);
      default:
        throw reportError(t, "invalid property id");
    }
  }

  static String numberToPropertyName(double d) {
    if (d == (long) d) {
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }

  private Node accessorFunction(JsToken keyToken, boolean isGetter) {
    JsToken open = mustMatchPunctuator("(", "missing ( before formal parameters");
    Node params = at(IR.paramList(), open);
    if (!isGetter) {
      JsToken paramToken = mustMatchName("setter must have exactly one parameter");
      params.addChildToBack(at(IR.name(paramToken.value), paramToken));
    }
    mustMatchPunctuator(")", "missing ) after formal parameters");
    boolean savedInFunction = inFunction;
    inFunction = true;
    try {
      return at(IR.function(at(IR.name(""), keyToken), params, block()), keyToken);
    } finally {
      inFunction = savedInFunction;
    }
  }
}
