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

package com.esupgrade.safety;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.esupgrade.ast.Node;
import com.esupgrade.ast.Token;
import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities for the safety analysis. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Returns the first of {@code n} and its ancestors that matches {@code pred}. */
  public static @Nullable Node getEnclosingNode(Node n, Predicate<Node> pred) {
    Node curr = n;
    while (curr != null && !pred.apply(curr)) {
      curr = curr.getParent();
    }
    return curr;
  }

  /** Finds the function containing the given node. */
  public static @Nullable Node getEnclosingFunction(Node n) {
    return getEnclosingNode(n, Node::isFunction);
  }

  /** Returns the root of the tree containing {@code n}, the analysis unit. */
  public static Node getRoot(Node n) {
    Node curr = n;
    while (curr.getParent() != null) {
      curr = curr.getParent();
    }
    return curr;
  }

  /**
   * Returns the nearest function that is {@code n} or encloses it, or the unit root when there is
   * none. Function-scoped declarations are visible throughout this node.
   */
  public static Node getEnclosingHoistScopeRoot(Node n) {
    Node fn = getEnclosingFunction(n);
    return fn != null ? fn : getRoot(n);
  }

  /** Returns the nearest node that is {@code n} or encloses it and opens a block scope. */
  public static Node getEnclosingBlockScopeRoot(Node n) {
    return checkNotNull(getEnclosingNode(n, NodeUtil::createsBlockScope));
  }

  /** Whether {@code n} opens a lexical scope for let, const, class and catch bindings. */
  public static boolean createsBlockScope(Node n) {
    switch (n.getToken()) {
      case SCRIPT:
      case BLOCK:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case SWITCH:
      case CATCH:
      case FUNCTION:
        return true;
      default:
        // A detached subtree is its own unit.
        return n.getParent() == null;
    }
  }

  /** Is this node a name declaration? */
  public static boolean isNameDeclaration(@Nullable Node n) {
    return n != null && (n.isVar() || n.isLet() || n.isConst());
  }

  /** Whether the node is a FOR_IN or FOR_OF. */
  public static boolean isEnhancedFor(@Nullable Node n) {
    return n != null && (n.isForOf() || n.isForIn());
  }

  /** Whether {@code n} is a declaration statement directly inside the unit root. */
  public static boolean isTopLevelStatement(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.getParent() == null;
  }

  /**
   * Is this node a function declaration? A function declaration is a function that has a name
   * and is a statement.
   */
  public static boolean isFunctionDeclaration(Node n) {
    if (!n.isFunction() || n.isArrowFunction()) {
      return false;
    }
    Node name = n.getFirstChild();
    Node parent = n.getParent();
    return name != null
        && !name.getString().isEmpty()
        && parent != null
        && (parent.isScript() || parent.isBlock() || parent.getToken() == Token.LABEL);
  }

  /** Whether {@code n} is a named function used as an expression. */
  public static boolean isNamedFunctionExpression(Node n) {
    if (!n.isFunction() || n.isArrowFunction() || isFunctionDeclaration(n)) {
      return false;
    }
    Node name = n.getFirstChild();
    return name != null && !name.getString().isEmpty();
  }

  /**
   * Whether {@code n} is a class declaration statement, as opposed to a class expression.
   */
  public static boolean isClassDeclaration(Node n) {
    Node parent = n.getParent();
    Node name = n.getFirstChild();
    return n.isClass()
        && name != null
        && !name.getString().isEmpty()
        && parent != null
        && (parent.isScript() || parent.isBlock() || parent.getToken() == Token.LABEL);
  }

  /**
   * Returns true if the given node is an LHS node in a destructuring pattern, e.g. the {@code b}
   * in {@code var {a: b = 3} = ...}.
   */
  public static boolean isLhsByDestructuring(Node n) {
    switch (n.getToken()) {
      case NAME:
      case GETPROP:
      case GETELEM:
        break;
      default:
        return false;
    }
    Node current = n;
    while (true) {
      Node parent = current.getParent();
      if (parent == null) {
        return false;
      }
      switch (parent.getToken()) {
        case ARRAY_PATTERN:
        case ITER_REST:
        case OBJECT_REST:
          return true;
        case COMPUTED_PROP:
          if (current.isFirstChildOf(parent)) {
            return false;
          }
          // Fall through.
        case STRING_KEY:
          Node grandparent = parent.getParent();
          return grandparent != null && grandparent.isObjectPattern();
        case DEFAULT_VALUE:
          if (!current.isFirstChildOf(parent)) {
            // The second child is the default value, never a LHS node.
            return false;
          }
          current = parent;
          break;
        default:
          return false;
      }
    }
  }

  /**
   * Returns the NAME, GETPROP and GETELEM nodes assigned by {@code target}, in source order.
   * {@code target} may be a simple target, a destructuring pattern, a DESTRUCTURING_LHS, or any
   * pattern element. Default values and computed keys are not targets and are skipped.
   */
  public static ImmutableList<Node> findLhsNodesInTarget(Node target) {
    ImmutableList.Builder<Node> lhs = ImmutableList.builder();
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(target);
    while (!stack.isEmpty()) {
      Node n = stack.pop();
      switch (n.getToken()) {
        case NAME, GETPROP, GETELEM -> lhs.add(n);
        case DESTRUCTURING_LHS, DEFAULT_VALUE, ITER_REST, OBJECT_REST, STRING_KEY ->
            pushIfPresent(stack, n.getFirstChild());
        case COMPUTED_PROP -> pushIfPresent(stack, n.getSecondChild());
        case ARRAY_PATTERN, OBJECT_PATTERN -> {
          for (Node c = n.getLastChild(); c != null; c = c.getPrevious()) {
            stack.push(c);
          }
        }
        default -> {
          // EMPTY holes and malformed elements bind nothing.
        }
      }
    }
    return lhs.build();
  }

  /** Returns the NAME nodes bound by {@code target}, see {@link #findLhsNodesInTarget}. */
  public static ImmutableList<Node> findNamesInTarget(Node target) {
    ImmutableList.Builder<Node> names = ImmutableList.builder();
    for (Node lhs : findLhsNodesInTarget(target)) {
      if (lhs.isName()) {
        names.add(lhs);
      }
    }
    return names.build();
  }

  private static void pushIfPresent(Deque<Node> stack, @Nullable Node n) {
    if (n != null) {
      stack.push(n);
    }
  }

  /**
   * Returns the initializer of a VAR, LET or CONST declarator, or null when it has none.
   *
   * @param declarator a NAME or DESTRUCTURING_LHS child of a name declaration
   */
  public static @Nullable Node getDeclarationInitializer(Node declarator) {
    checkArgument(declarator.isName() || declarator.isDestructuringLhs(), declarator);
    return declarator.isName() ? declarator.getFirstChild() : declarator.getSecondChild();
  }

  /**
   * Whether {@code declarator} is the loop variable of a for-of or for-in, which is assigned on
   * each iteration instead of by an initializer.
   */
  public static boolean isEnhancedForLoopVariable(Node declarator) {
    Node declaration = declarator.getParent();
    return isNameDeclaration(declaration)
        && isEnhancedFor(declaration.getParent())
        && declaration.isFirstChildOf(declaration.getParent());
  }

  /**
   * Whether {@code n} is the property name of a GETPROP, a string that looks like a child but is
   * never evaluated.
   */
  public static boolean isGetPropName(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.isGetProp() && n.isSecondChildOf(parent);
  }

  /**
   * Returns true if the subtree contains a node matching {@code pred}, not descending into nodes
   * that don't match {@code traverseChildrenPred}.
   */
  public static boolean has(Node node, Predicate<Node> pred, Predicate<Node> traverseChildrenPred) {
    for (Node n : preOrderIterable(node, traverseChildrenPred)) {
      if (pred.apply(n)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the number of nodes in the subtree matching {@code pred}. */
  public static int getCount(Node n, Predicate<Node> pred, Predicate<Node> traverseChildrenPred) {
    int total = 0;
    for (Node c : preOrderIterable(n, traverseChildrenPred)) {
      if (pred.apply(c)) {
        total++;
      }
    }
    return total;
  }

  /**
   * A pre-order traversal, producing Node objects.
   *
   * <p>The given predicate determines whether a node's children will be iterated over. If a node
   * does not match the predicate, none of its children will be visited. The root itself is always
   * returned.
   *
   * @param root Root of the tree.
   * @param traverseNodePredicate Matches nodes in the tree whose children should be traversed.
   */
  public static Iterable<Node> preOrderIterable(Node root, Predicate<Node> traverseNodePredicate) {
    return () -> new PreOrderIterator(root, traverseNodePredicate);
  }

  /**
   * Same as {@link #preOrderIterable(Node, Predicate)} but iterates over all nodes in the tree
   * without exception.
   */
  public static Iterable<Node> preOrderIterable(Node root) {
    return preOrderIterable(root, Predicates.alwaysTrue());
  }

  /**
   * Utility class for {@link #preOrderIterable}. Iterates over nodes in tree in depth-first
   * pre-order, never leaving the subtree of the root.
   */
  private static final class PreOrderIterator extends AbstractIterator<Node> {

    private final Node root;
    private final Predicate<Node> traverseNodePredicate;
    private @Nullable Node current;

    PreOrderIterator(Node root, Predicate<Node> traverseNodePredicate) {
      this.root = checkNotNull(root);
      this.traverseNodePredicate = checkNotNull(traverseNodePredicate);
      this.current = root;
    }

    @Override
    protected Node computeNext() {
      if (current == null) {
        return endOfData();
      }

      Node returnValue = current;
      current = calculateNextNode(returnValue);
      return returnValue;
    }

    private @Nullable Node calculateNextNode(Node currentNode) {
      // If node does not match the predicate, do not descend into it.
      if (traverseNodePredicate.apply(currentNode) && currentNode.hasChildren()) {
        // In prefix order, the next node is the leftmost child.
        return currentNode.getFirstChild();
      }

      // To find the next node, walk up the ancestry chain (including current node) and return
      // the first sibling we see, without going above the root.
      while (currentNode != null && currentNode != root) {
        Node next = currentNode.getNext();
        if (next != null) {
          return next;
        }
        currentNode = currentNode.getParent();
      }
      return null;
    }
  }
}
