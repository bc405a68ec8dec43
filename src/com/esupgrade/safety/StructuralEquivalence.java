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

import static com.google.common.base.Preconditions.checkNotNull;

import com.esupgrade.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Purely syntactic equality of expression subtrees.
 *
 * <p>Only identifiers, literals, member accesses and calls are compared structurally; every other
 * shape is unequal unless both sides are the same node. Nothing is evaluated, so {@code 1 + 1} is
 * not equivalent to {@code 2}.
 */
public final class StructuralEquivalence {

  private StructuralEquivalence() {}

  /** A pair of nodes still to be compared. */
  private record Pending(Node left, Node right) {}

  public static boolean areEquivalent(Node a, Node b) {
    checkNotNull(a);
    checkNotNull(b);
    Deque<Pending> work = new ArrayDeque<>();
    work.push(new Pending(a, b));
    while (!work.isEmpty()) {
      Pending pending = work.pop();
      Node left = pending.left();
      Node right = pending.right();
      if (left == right) {
        continue;
      }
      if (left.getToken() != right.getToken()) {
        return false;
      }
      boolean matches =
          switch (left.getKind()) {
            case IDENTIFIER -> left.getString().equals(right.getString());
            case LITERAL -> literalsEqual(left, right);
            case MEMBER_ACCESS -> pushChildren(left, right, work);
            // Constructor calls are not compared.
            case CALL -> left.isCall() && pushChildren(left, right, work);
            case TEMPLATE,
                COLLECTION,
                ASSIGNMENT,
                UPDATE,
                OPERATOR,
                DECLARATION,
                FUNCTION,
                PATTERN,
                STATEMENT,
                OTHER ->
                false;
          };
      if (!matches) {
        return false;
      }
    }
    return true;
  }

  private static boolean literalsEqual(Node left, Node right) {
    switch (left.getToken()) {
      case STRINGLIT:
        return left.getString().equals(right.getString());
      case NUMBER:
        // IEEE comparison: NaN is never equal to itself, 0 and -0 are equal.
        return left.getDouble() == right.getDouble();
      case TRUE:
      case FALSE:
      case NULL:
        return true;
      default:
        // Regular expressions create a new object per evaluation.
        return false;
    }
  }

  /** Queues the children of both nodes pairwise; false if their counts differ. */
  private static boolean pushChildren(Node left, Node right, Deque<Pending> work) {
    if (left.getChildCount() != right.getChildCount()) {
      return false;
    }
    Node l = left.getFirstChild();
    Node r = right.getFirstChild();
    while (l != null && r != null) {
      work.push(new Pending(l, r));
      l = l.getNext();
      r = r.getNext();
    }
    return true;
  }
}
