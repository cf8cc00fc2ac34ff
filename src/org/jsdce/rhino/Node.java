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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children are kept in an intrusive list: {@code first.previous} is the last child and the last
 * child's {@code next} is null, so appending and detaching are O(1).
 */
public class Node {

  /** Boolean annotations attached to a node. */
  public enum Prop {
    /** A STRING_KEY or GETPROP-like key that was written in quotes. */
    QUOTED,
    /** An INC or DEC node that is a postfix expression. */
    INCRDECR,
    /** A CALL whose callee was not a property access. */
    FREE_CALL,
  }

  private static final class NumberNode extends Node {

    private double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      return super.isEquivalentToShallow(node) && this.number == ((NumberNode) node).number;
    }

    @Override
    Node cloneNode() {
      NumberNode clone = new NumberNode(number);
      clone.copyBaseNodeFields(this);
      return clone;
    }
  }

  private static final class StringNode extends Node {

    private String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      return super.isEquivalentToShallow(node) && this.str.equals(((StringNode) node).str);
    }

    @Override
    Node cloneNode() {
      StringNode clone = new StringNode(getToken(), str);
      clone.copyBaseNodeFields(this);
      return clone;
    }
  }

  private Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  // The previous sibling; the first child's previous pointer is the last child.
  private @Nullable Node previous;
  private @Nullable Node next;

  private int propBits;

  private @Nullable String sourceFileName;
  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  public static Node newString(String str) {
    return new StringNode(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public final Token getToken() {
    return token;
  }

  // Children and siblings.

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "Expected one child: %s", this);
    return first;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final @Nullable Node getGrandparent() {
    return parent == null ? null : parent.parent;
  }

  /** Gets the ith child, note that this is O(N) where N is the number of children. */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final boolean hasTwoChildren() {
    return first != null && first.next != null && first.next == getLastChild();
  }

  public final Iterable<Node> children() {
    final Node start = first;
    return () -> new Iterator<Node>() {
      private @Nullable Node cur = start;

      @Override
      public boolean hasNext() {
        return cur != null;
      }

      @Override
      public Node next() {
        if (cur == null) {
          throw new NoSuchElementException();
        }
        Node n = cur;
        cur = cur.next;
        return n;
      }
    };
  }

  public final void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    if (first == null) {
      child.previous = child;
    } else {
      child.previous = first.previous;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    child.checkDetached();

    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  public final void insertAfter(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    Node existingParent = existing.parent;
    Node existingNext = existing.next;

    this.parent = existingParent;
    existing.next = this;
    this.previous = existing;
    if (existingNext == null) {
      existingParent.first.previous = this;
    } else {
      existingNext.previous = this;
      this.next = existingNext;
    }
  }

  public final void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    Node existingParent = existing.parent;
    Node existingPrevious = existing.previous;

    this.parent = existingParent;
    this.next = existing;
    existing.previous = this;
    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
    } else {
      existingPrevious.next = this;
    }
  }

  /** Swaps {@code replacement} and its subtree into the position of {@code this}. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();
    if (replacement.lineno == -1) {
      replacement.setSourceInfoFrom(this);
    }

    Node existingParent = this.parent;
    Node existingNext = this.next;
    Node existingPrevious = this.previous;

    // Also works when this is an only child, where several of the locals alias.
    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
    } else {
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      existingParent.first.previous = replacement;
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  @CanIgnoreReturnValue
  public final Node detach() {
    this.checkAttached();

    Node existingParent = this.parent;
    Node existingNext = this.next;
    Node existingPrevious = this.previous;

    this.parent = null;
    if (existingNext == null) {
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
    } else {
      existingPrevious.next = existingNext;
    }
    return this;
  }

  /** Removes all children from this node and isolates the children from each other. */
  public final void detachChildren() {
    for (Node child = first; child != null; ) {
      Node nextChild = child.next;
      child.parent = null;
      child.next = null;
      child.previous = null;
      child = nextChild;
    }
    first = null;
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  // Payload.

  public double getDouble() {
    checkState(this instanceof NumberNode, "%s is not a number node", token);
    return ((NumberNode) this).number;
  }

  public final String getString() {
    checkState(this instanceof StringNode, "%s is not a string node", token);
    return ((StringNode) this).str;
  }

  public final boolean getBooleanProp(Prop prop) {
    return (propBits & (1 << prop.ordinal())) != 0;
  }

  public final void putBooleanProp(Prop prop, boolean value) {
    if (value) {
      propBits |= 1 << prop.ordinal();
    } else {
      propBits &= ~(1 << prop.ordinal());
    }
  }

  // Source positions.

  public final @Nullable String getSourceFileName() {
    return sourceFileName;
  }

  public final void setSourceFileName(@Nullable String sourceFileName) {
    this.sourceFileName = sourceFileName;
  }

  /** One-indexed line number, or -1 when unknown. */
  public final int getLineno() {
    return lineno;
  }

  /** Zero-indexed column number, or -1 when unknown. */
  public final int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public final Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  @CanIgnoreReturnValue
  public final Node setSourceInfoFrom(Node other) {
    this.sourceFileName = other.sourceFileName;
    this.lineno = other.lineno;
    this.charno = other.charno;
    return this;
  }

  /** Applies the source information of {@code other} to this node and its unpositioned subtree. */
  @CanIgnoreReturnValue
  public final Node setSourceInfoForTree(Node other) {
    if (lineno == -1) {
      setSourceInfoFrom(other);
    }
    for (Node c = first; c != null; c = c.next) {
      c.setSourceInfoForTree(other);
    }
    return this;
  }

  // Copies and comparison.

  Node cloneNode() {
    Node clone = new Node(token);
    clone.copyBaseNodeFields(this);
    return clone;
  }

  final void copyBaseNodeFields(Node source) {
    this.propBits = source.propBits;
    this.sourceFileName = source.sourceFileName;
    this.lineno = source.lineno;
    this.charno = source.charno;
  }

  /** Returns a detached deep copy of this subtree. */
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node c = first; c != null; c = c.next) {
      result.addChildToBack(c.cloneTree());
    }
    return result;
  }

  boolean isEquivalentToShallow(Node node) {
    return token == node.token
        && getClass() == node.getClass()
        && propBits == node.propBits;
  }

  /** Returns true if this subtree has the same shape, payloads and props as {@code node}. */
  public final boolean isEquivalentTo(Node node) {
    if (!isEquivalentToShallow(node)) {
      return false;
    }
    Node a = first;
    Node b = node.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ').append(getString());
    } else if (this instanceof NumberNode) {
      sb.append(' ').append(getDouble());
    } else if (token == Token.FUNCTION && first != null && first.isName()) {
      sb.append(' ').append(first.getString());
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    for (Prop p : Prop.values()) {
      if (getBooleanProp(p)) {
        sb.append(" [").append(p.name().toLowerCase(Locale.ROOT)).append(']');
      }
    }
    return sb.toString();
  }

  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendStringTree(sb, level + 1);
    }
  }

  // Token predicates.

  public final boolean isRoot() {
    return token == Token.ROOT;
  }

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isForIn() {
    return token == Token.FOR_IN;
  }

  public final boolean isCatch() {
    return token == Token.CATCH;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isStringLit() {
    return token == Token.STRINGLIT;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isNull() {
    return token == Token.NULL;
  }

  public final boolean isObjectLit() {
    return token == Token.OBJECTLIT;
  }

  public final boolean isStringKey() {
    return token == Token.STRING_KEY;
  }

  public final boolean isGetterDef() {
    return token == Token.GETTER_DEF;
  }

  public final boolean isSetterDef() {
    return token == Token.SETTER_DEF;
  }

  public final boolean isComputedProp() {
    return token == Token.COMPUTED_PROP;
  }

  public final boolean isArrayLit() {
    return token == Token.ARRAYLIT;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isNew() {
    return token == Token.NEW;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }
}
