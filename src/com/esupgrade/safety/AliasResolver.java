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
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Resolves a variable initialized from a wrapper call, such as {@code var el = $(node)}, to the
 * wrapped argument.
 *
 * <p>A name resolves only when every simple declaration and every plain assignment of it stores
 * a single-argument wrapper call, all the wrapped arguments are structurally equivalent, the name
 * is never incremented or decremented, and every occurrence of it is a declarator, the target of
 * a plain assignment or the object of a member access. Results are cached per name for the
 * lifetime of the resolver.
 */
public final class AliasResolver {

  private static final Logger logger = Logger.getLogger(AliasResolver.class.getName());

  private final BindingCatalog catalog;
  private final ImmutableSet<String> wrapperCalleeNames;
  private final @Nullable String opaquePrefix;

  private final Map<String, Optional<Node>> cache = new HashMap<>();

  public AliasResolver(BindingCatalog catalog, SafetyOptions options) {
    this.catalog = checkNotNull(catalog);
    this.wrapperCalleeNames = options.getWrapperCalleeNames();
    this.opaquePrefix = options.getOpaqueTopLevelPrefix();
  }

  /** Returns the node wrapped by every value stored in {@code name}, if there is one. */
  public Optional<Node> resolve(String name) {
    checkNotNull(name);
    Optional<Node> cached = cache.get(name);
    if (cached != null) {
      return cached;
    }
    Optional<Node> target = Optional.ofNullable(computeTarget(name));
    cache.put(name, target);
    return target;
  }

  /** Whether {@link #resolve} has already answered for {@code name}. */
  boolean isCached(String name) {
    return cache.containsKey(name);
  }

  private @Nullable Node computeTarget(String name) {
    Node found = null;

    for (Node declarator : catalog.variableDeclarationsOf(name)) {
      Node arg = getWrappedArgument(declarator.getFirstChild());
      if (arg == null) {
        logger.fine("Not resolving " + name + ": " + declarator + " is not a wrapper call");
        return null;
      }
      if (NodeUtil.isTopLevelStatement(checkNotNull(declarator.getParent()))
          && hasOpaquePrefix(name)) {
        logger.fine("Not resolving top-level " + name);
        return null;
      }
      if (found == null) {
        found = arg;
      } else if (!StructuralEquivalence.areEquivalent(found, arg)) {
        logger.fine("Not resolving " + name + ": wraps both " + found + " and " + arg);
        return null;
      }
    }

    for (Node assign : catalog.assignmentsTo(name)) {
      Node target = assign.getFirstChild();
      if (!assign.isAssign() || target == null || !target.isName()) {
        // Compound and destructuring writes are rejected as unsafe usages below.
        continue;
      }
      Node arg = getWrappedArgument(target.getNext());
      if (arg == null) {
        logger.fine("Not resolving " + name + ": " + assign + " does not store a wrapper call");
        return null;
      }
      if (found == null) {
        found = arg;
      } else if (!StructuralEquivalence.areEquivalent(found, arg)) {
        logger.fine("Not resolving " + name + ": wraps both " + found + " and " + arg);
        return null;
      }
    }

    if (found == null) {
      return null;
    }

    if (!catalog.updatesOf(name).isEmpty()) {
      logger.fine("Not resolving " + name + ": it is incremented or decremented");
      return null;
    }

    for (Node reference : catalog.referencesTo(name)) {
      if (!isSafeUsage(reference)) {
        logger.fine("Not resolving " + name + ": escapes at " + reference.getLocation());
        return null;
      }
    }
    return found;
  }

  /**
   * Returns the argument of {@code n} if it is a call to one of the wrapper functions with
   * exactly one argument, or null otherwise.
   */
  public @Nullable Node getWrappedArgument(@Nullable Node n) {
    if (n == null || !n.isCall() || !n.hasTwoChildren()) {
      return null;
    }
    Node callee = n.getFirstChild();
    if (!callee.isName() || !wrapperCalleeNames.contains(callee.getString())) {
      return null;
    }
    return n.getSecondChild();
  }

  /** Whether {@code n} is a wrapper call or a name that resolves to a wrapped node. */
  public boolean isWrapperObject(Node n) {
    checkNotNull(n);
    if (n.isCall()) {
      return getWrappedArgument(n) != null;
    }
    return n.isName() && resolve(n.getString()).isPresent();
  }

  /**
   * Whether the wrapper call {@code call} can be rewritten in place. A call stored in a variable
   * can only be rewritten if that variable resolves as an alias, or is never read. A call used
   * any other way can.
   */
  public boolean isSafeToRewriteInitializer(Node call) {
    checkNotNull(call);
    Node parent = call.getParent();
    if (parent == null) {
      return true;
    }

    if (parent.isName() && call.isFirstChildOf(parent)) {
      Node declaration = parent.getParent();
      if (!NodeUtil.isNameDeclaration(declaration)) {
        return true;
      }
      String name = parent.getString();
      if (hasOpaquePrefix(name) && NodeUtil.isTopLevelStatement(declaration)) {
        return false;
      }
      if (countNonDeclaratorUsages(name) == 0) {
        return true;
      }
      return resolve(name).isPresent();
    }

    if (parent.isAssign() && call.isSecondChildOf(parent) && parent.getFirstChild().isName()) {
      String name = parent.getFirstChild().getString();
      if (hasOpaquePrefix(name)) {
        return false;
      }
      return resolve(name).isPresent();
    }

    return true;
  }

  /** Returns the number of occurrences of {@code name} that are not declarators. */
  public int countNonDeclaratorUsages(String name) {
    int count = 0;
    for (Node reference : catalog.referencesTo(name)) {
      if (!NodeUtil.isNameDeclaration(reference.getParent())) {
        count++;
      }
    }
    return count;
  }

  private boolean hasOpaquePrefix(String name) {
    return opaquePrefix != null && name.startsWith(opaquePrefix);
  }

  private static boolean isSafeUsage(Node reference) {
    Node parent = reference.getParent();
    if (parent == null) {
      return false;
    }
    if (NodeUtil.isNameDeclaration(parent)) {
      return true;
    }
    if (parent.isAssign() && reference.isFirstChildOf(parent)) {
      return true;
    }
    return (parent.isGetProp() || parent.isGetElem()) && reference.isFirstChildOf(parent);
  }
}
