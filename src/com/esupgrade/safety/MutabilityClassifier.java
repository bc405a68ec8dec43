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
import com.google.common.collect.ImmutableList;

/**
 * Decides whether a var, let or const declarator could be declared with {@code const}.
 *
 * <p>A declarator is immutable-safe when it has an initializer (or is the loop variable of a
 * for-of or for-in) and every assignment, increment and decrement of every name it binds is
 * shadowed by a nearer declaration. A function-scoped redeclaration of the name in the same scope
 * counts as a write too.
 */
public final class MutabilityClassifier {

  private final BindingCatalog catalog;
  private final ShadowResolver shadowResolver;

  public MutabilityClassifier(BindingCatalog catalog, ShadowResolver shadowResolver) {
    this.catalog = checkNotNull(catalog);
    this.shadowResolver = checkNotNull(shadowResolver);
  }

  /**
   * Classifies a declarator.
   *
   * @param declarator a NAME or DESTRUCTURING_LHS child of a VAR, LET or CONST node. Any other
   *     node is classified {@link Mutability#MUST_ALLOW_REASSIGNMENT}.
   */
  public Mutability classify(Node declarator) {
    checkNotNull(declarator);
    if (!NodeUtil.isNameDeclaration(declarator.getParent())
        || !(declarator.isName() || declarator.isDestructuringLhs())) {
      return Mutability.MUST_ALLOW_REASSIGNMENT;
    }
    if (NodeUtil.getDeclarationInitializer(declarator) == null
        && !NodeUtil.isEnhancedForLoopVariable(declarator)) {
      return Mutability.MUST_ALLOW_REASSIGNMENT;
    }

    for (Node nameNode : NodeUtil.findNamesInTarget(declarator)) {
      Binding binding = catalog.bindingForNameNode(nameNode);
      if (binding == null || isWritten(binding)) {
        return Mutability.MUST_ALLOW_REASSIGNMENT;
      }
    }
    return Mutability.IMMUTABLE_SAFE;
  }

  private boolean isWritten(Binding binding) {
    String name = binding.name();
    for (Binding other : catalog.bindingsOf(name)) {
      if (!other.equals(binding)
          && other.isFunctionScoped()
          && other.scopeRoot() == binding.scopeRoot()) {
        return true;
      }
    }
    return hasUnshadowedWrite(catalog.assignmentsTo(name), binding)
        || hasUnshadowedWrite(catalog.updatesOf(name), binding);
  }

  private boolean hasUnshadowedWrite(ImmutableList<Node> writes, Binding binding) {
    for (Node write : writes) {
      if (!shadowResolver.isShadowed(write, binding.name(), binding)) {
        return true;
      }
    }
    return false;
  }
}
