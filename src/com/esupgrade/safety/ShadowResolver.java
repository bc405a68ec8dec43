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
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether an occurrence of a name is intercepted by a nearer declaration before it
 * reaches a given binding.
 *
 * <p>The walk starts at the usage and moves outward. Every declaration of the same name whose
 * scope is crossed on the way (a function's parameters and body declarations, a named function
 * expression's own name, a block-scoped declaration of an enclosing block) intercepts the usage.
 * A usage inside a parameter list is not intercepted by the vars and function declarations of
 * that function's body. Reaching the scope of the original binding ends the walk without a
 * verdict, as does reaching the unit root.
 */
public final class ShadowResolver {

  private final BindingCatalog catalog;

  public ShadowResolver(BindingCatalog catalog) {
    this.catalog = checkNotNull(catalog);
  }

  /**
   * Returns true if {@code usage} refers to a declaration of {@code name} other than {@code
   * original}.
   *
   * <p>A false answer is conservative: it means the usage may belong to {@code original}.
   */
  public boolean isShadowed(Node usage, String name, Binding original) {
    checkNotNull(usage);
    checkNotNull(name);
    checkNotNull(original);
    ListMultimap<Node, Binding> interceptingByScope =
        Multimaps.newListMultimap(
            new IdentityHashMap<Node, Collection<Binding>>(), ArrayList::new);
    for (Binding other : catalog.bindingsOf(name)) {
      // A redeclaration in the same scope is the same variable.
      if (!other.equals(original) && other.scopeRoot() != original.scopeRoot()) {
        interceptingByScope.put(other.scopeRoot(), other);
      }
    }
    if (interceptingByScope.isEmpty()) {
      return false;
    }
    Node child = null;
    for (Node n = usage; n != null; child = n, n = n.getParent()) {
      if (n == original.scopeRoot()) {
        return false;
      }
      for (Binding other : interceptingByScope.get(n)) {
        if (!isHiddenFromParameters(other, n, child)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Whether {@code binding} is declared in the body of {@code scopeRoot} while the walk arrived
   * from its parameter list. Parameter expressions are evaluated in their own environment, so
   * body vars and function declarations are not visible to them.
   */
  private static boolean isHiddenFromParameters(
      Binding binding, Node scopeRoot, @Nullable Node child) {
    if (!scopeRoot.isFunction() || child == null || !child.isParamList()) {
      return false;
    }
    return switch (binding.declarationType()) {
      case VAR -> true;
      // A function expression's own name is visible to its parameters.
      case FUNCTION -> binding.declarationNode() != scopeRoot;
      default -> false;
    };
  }

  /**
   * Same as {@link #isShadowed(Node, String, Binding)} for the binding introduced by {@code
   * originalNameNode}. A node that declares nothing yields false.
   */
  public boolean isShadowed(Node usage, String name, Node originalNameNode) {
    Binding original = catalog.bindingForNameNode(checkNotNull(originalNameNode));
    return original != null && isShadowed(usage, name, original);
  }
}
