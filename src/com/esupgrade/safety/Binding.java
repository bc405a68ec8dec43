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

/**
 * A name together with one declaring node within a unit.
 *
 * @param name the declared name
 * @param nameNode the NAME node that introduces the binding
 * @param declarationNode the VAR, LET, CONST, FUNCTION, PARAM_LIST, CLASS or CATCH node that owns
 *     {@code nameNode}
 * @param declarationType the token of {@code declarationNode}
 * @param scopeRoot the node the binding is visible in: a function or the unit root for
 *     function-scoped bindings, the nearest block scope for block-scoped ones
 */
public record Binding(
    String name, Node nameNode, Node declarationNode, Token declarationType, Node scopeRoot) {

  public Binding {
    checkNotNull(name);
    checkArgument(nameNode.isName(), nameNode);
    checkArgument(declarationNode.getToken() == declarationType, declarationNode);
    checkNotNull(scopeRoot);
  }

  public DeclarationKind kind() {
    return DeclarationKind.forDeclarationType(declarationType);
  }

  public boolean isFunctionScoped() {
    return kind() == DeclarationKind.FUNCTION_SCOPED;
  }

  public boolean isBlockScoped() {
    return kind() == DeclarationKind.BLOCK_SCOPED;
  }

  /** Whether {@code n} is inside the region where this binding is visible. */
  public boolean isVisibleAt(Node n) {
    return n.isDescendantOf(scopeRoot);
  }

  @Override
  public String toString() {
    return declarationType + " " + name + "@" + nameNode.getLocation();
  }
}
