/*
 * Copyright 2025 The Closure Compiler Authors.
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

package com.esupgrade.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node of the JavaScript syntax tree.
 *
 * <p>Children are kept in a sibling linked list; every child holds a non-owning reference to its
 * parent which is only used for upward traversal. Trees are built once (usually through {@link
 * IR}) and then treated as read-only snapshots by the analysis.
 */
public class Node {

  enum Prop {
    // Whether an INC or DEC is postfix (true) or prefix (false).
    INCRDECR,
    // Set if the FUNCTION node is an arrow function.
    ARROW_FN,
    // Set if an object literal or pattern key was written without quotes but with the value
    // omitted, e.g. {x}.
    SHORTHAND_PROPERTY,
    // Set to indicate a quoted object lit key.
    QUOTED
  }

  private static final class NumberNode extends Node {

    private final double number;

    NumberNode(double number) {
      super(Token.NUMBER, true);
      this.number = number;
    }

    @Override
    public double getDouble() {
      return number;
    }
  }

  private static final class StringNode extends Node {

    private final String str;

    StringNode(Token token, String str) {
      super(token, true);
      checkArgument(isStringToken(token), "%s does not hold a string", token);
      this.str = checkNotNull(str);
    }

    @Override
    public String getString() {
      return str;
    }
  }

  private final Token token;
  private @Nullable Node parent;
  private @Nullable Node first; // first element of a linked list of children
  private @Nullable Node next; // next sibling, a linked list
  private @Nullable Node previous; // previous sibling, a circular linked list
  private final EnumSet<Prop> props = EnumSet.noneOf(Prop.class);
  private int lineno = -1;
  private int charno = -1;

  /**
   * Creates a node without a payload. NAME, NUMBER and the other tokens that carry a string or a
   * number are created with {@link #newString} and {@link #newNumber}.
   */
  public Node(Token token) {
    this(token, false);
  }

  private Node(Token token, boolean hasPayload) {
    this.token = checkNotNull(token);
    checkArgument(
        hasPayload || !(isStringToken(token) || token == Token.NUMBER),
        "%s nodes are created with newString or newNumber",
        token);
  }

  private static boolean isStringToken(Token token) {
    switch (token) {
      case NAME:
      case STRINGLIT:
      case STRING_KEY:
      case MEMBER_FUNCTION_DEF:
      case TEMPLATELIT_STRING:
      case LABEL_NAME:
        return true;
      default:
        return false;
    }
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

  public final NodeKind getKind() {
    return token.kind();
  }

  /** Returns the string payload of NAME, STRINGLIT, STRING_KEY and template string nodes. */
  public String getString() {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  /** Returns the value of a NUMBER node. */
  public double getDouble() {
    throw new UnsupportedOperationException(this + " is not a number node");
  }

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

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return (parent == null || this == parent.first) ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final @Nullable Node getGrandparent() {
    return parent == null ? null : parent.parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @return The ith child, or null if there are not that many children
   */
  public final @Nullable Node getChildAtIndex(int i) {
    Node n = first;
    while (n != null && i > 0) {
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

  public final boolean hasXChildren(int x) {
    return getChildCount() == x;
  }

  public final boolean isFirstChildOf(Node possibleParent) {
    return possibleParent == parent && possibleParent.first == this;
  }

  public final boolean isSecondChildOf(Node possibleParent) {
    return possibleParent == parent && possibleParent.getSecondChild() == this;
  }

  /** Whether this node is {@code node} or is contained in the subtree rooted at {@code node}. */
  public final boolean isDescendantOf(Node node) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  /** Iterates over the direct children of this node. */
  public final Iterable<Node> children() {
    return () -> new SiblingIterator(first);
  }

  /** Iterates over the parent, grandparent and so on, up to the root. */
  public final Iterable<Node> getAncestors() {
    return () -> new AncestorIterator(parent);
  }

  @CanIgnoreReturnValue
  public final Node addChildToBack(Node child) {
    checkArgument(child.parent == null, "new child has existing parent");
    checkArgument(child.next == null && child.previous == null, "new child has siblings");
    child.parent = this;
    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    return this;
  }

  @CanIgnoreReturnValue
  public final Node addChildToFront(Node child) {
    checkArgument(child.parent == null, "new child has existing parent");
    checkArgument(child.next == null && child.previous == null, "new child has siblings");
    child.parent = this;
    if (first == null) {
      child.previous = child;
    } else {
      child.next = first;
      child.previous = first.previous;
      first.previous = child;
    }
    first = child;
    return this;
  }

  final boolean getBooleanProp(Prop prop) {
    return props.contains(prop);
  }

  final void putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props.add(prop);
    } else {
      props.remove(prop);
    }
  }

  public final void setIsArrowFunction(boolean isArrow) {
    checkState(isFunction(), this);
    putBooleanProp(Prop.ARROW_FN, isArrow);
  }

  public final boolean isArrowFunction() {
    return isFunction() && getBooleanProp(Prop.ARROW_FN);
  }

  /** Whether an INC or DEC is written after its operand. */
  public final boolean isPostfix() {
    return getBooleanProp(Prop.INCRDECR);
  }

  public final boolean isShorthandProperty() {
    return getBooleanProp(Prop.SHORTHAND_PROPERTY);
  }

  public final boolean isQuotedString() {
    return getBooleanProp(Prop.QUOTED);
  }

  @CanIgnoreReturnValue
  public final Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  public final int getLineno() {
    return lineno;
  }

  public final int getCharno() {
    return charno;
  }

  /** Returns a short human readable location, e.g. {@code 3:14}, or {@code ?} if unknown. */
  public final String getLocation() {
    return lineno < 0 ? "?" : lineno + ":" + charno;
  }

  public final boolean matchesName(String name) {
    return isName() && getString().equals(name);
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ').append(getString());
    } else if (this instanceof NumberNode) {
      sb.append(' ').append(getDouble());
    }
    if (lineno >= 0) {
      sb.append(' ').append(getLocation());
    }
    return sb.toString();
  }

  /** Prints the subtree rooted at this node, one node per line, indented by depth. */
  @CheckReturnValue
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    Node n = this;
    int level = 0;
    // Iterative pre-order walk so that deep trees don't exhaust the stack.
    while (n != null) {
      sb.append("    ".repeat(level)).append(n).append('\n');
      if (n.first != null) {
        n = n.first;
        level++;
        continue;
      }
      while (n != null && n != this && n.next == null) {
        n = n.parent;
        level--;
      }
      n = (n == null || n == this) ? null : n.next;
    }
    return sb.toString();
  }

  public final boolean isAddOp() {
    return token == Token.ADD;
  }

  public final boolean isArrayLit() {
    return token == Token.ARRAYLIT;
  }

  public final boolean isArrayPattern() {
    return token == Token.ARRAY_PATTERN;
  }

  public final boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isCatch() {
    return token == Token.CATCH;
  }

  public final boolean isClass() {
    return token == Token.CLASS;
  }

  public final boolean isComputedProp() {
    return token == Token.COMPUTED_PROP;
  }

  public final boolean isConst() {
    return token == Token.CONST;
  }

  public final boolean isDec() {
    return token == Token.DEC;
  }

  public final boolean isDefaultValue() {
    return token == Token.DEFAULT_VALUE;
  }

  public final boolean isDestructuringLhs() {
    return token == Token.DESTRUCTURING_LHS;
  }

  public final boolean isDestructuringPattern() {
    return isObjectPattern() || isArrayPattern();
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public final boolean isFor() {
    return token == Token.FOR;
  }

  public final boolean isForIn() {
    return token == Token.FOR_IN;
  }

  public final boolean isForOf() {
    return token == Token.FOR_OF;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isInc() {
    return token == Token.INC;
  }

  public final boolean isLet() {
    return token == Token.LET;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isNeg() {
    return token == Token.NEG;
  }

  public final boolean isNew() {
    return token == Token.NEW;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isObjectPattern() {
    return token == Token.OBJECT_PATTERN;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isRest() {
    return token == Token.ITER_REST || token == Token.OBJECT_REST;
  }

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isString() {
    return token == Token.STRINGLIT;
  }

  public final boolean isStringKey() {
    return token == Token.STRING_KEY;
  }

  public final boolean isTemplateLit() {
    return token == Token.TEMPLATELIT;
  }

  public final boolean isThis() {
    return token == Token.THIS;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  /** Whether this node may appear as the target of an assignment or in a pattern slot. */
  public final boolean isValidAssignmentTarget() {
    switch (token) {
      case NAME:
      case GETPROP:
      case GETELEM:
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
        return true;
      default:
        return false;
    }
  }

  private static final class SiblingIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingIterator(@Nullable Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.next;
      return n;
    }
  }

  private static final class AncestorIterator implements Iterator<Node> {
    private @Nullable Node current;

    AncestorIterator(@Nullable Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.parent;
      return n;
    }
  }
}
