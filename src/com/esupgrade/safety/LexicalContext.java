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
import com.esupgrade.ast.Token;
import com.google.common.base.Predicate;

/**
 * Searches a subtree for uses of names and function-bound values without leaving the function the
 * subtree belongs to.
 *
 * <p>Regular functions rebind {@code this} and {@code arguments}, so they are never entered
 * (unless the search starts at one). Arrow functions inherit both and are searched. Identifier
 * searches skip every nested function.
 */
public final class LexicalContext {

  private LexicalContext() {}

  /** Whether {@code root} uses the {@code this} of its enclosing function. */
  public static boolean usesThis(Node root) {
    return NodeUtil.has(checkNotNull(root), Node::isThis, enteringArrows(root));
  }

  /** Whether {@code root} uses {@code super}, which like {@code this} is bound per function. */
  public static boolean usesSuper(Node root) {
    return NodeUtil.has(
        checkNotNull(root), n -> n.getToken() == Token.SUPER, enteringArrows(root));
  }

  /** Whether {@code root} reads the {@code arguments} object of its enclosing function. */
  public static boolean usesArguments(Node root) {
    return NodeUtil.has(
        checkNotNull(root), n -> n.matchesName("arguments"), enteringArrows(root));
  }

  /** Whether {@code root} contains the identifier {@code name} outside nested functions. */
  public static boolean usesIdentifier(Node root, String name) {
    checkNotNull(name);
    return NodeUtil.has(checkNotNull(root), n -> n.matchesName(name), skippingFunctions(root));
  }

  /** Returns how often {@code name} occurs in {@code root} outside nested functions. */
  public static int countIdentifierUsages(Node root, String name) {
    checkNotNull(name);
    return NodeUtil.getCount(
        checkNotNull(root), n -> n.matchesName(name), skippingFunctions(root));
  }

  private static Predicate<Node> enteringArrows(Node root) {
    return n -> n == root || !n.isFunction() || n.isArrowFunction();
  }

  private static Predicate<Node> skippingFunctions(Node root) {
    return n -> n == root || !n.isFunction();
  }
}
