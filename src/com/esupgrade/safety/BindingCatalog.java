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
import com.esupgrade.ast.NodeKind;
import com.esupgrade.ast.Token;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Scans a unit once and records, per name, where it is declared, assigned, updated and
 * referenced.
 *
 * <p>Names are matched by spelling only; it is up to the caller (usually {@link ShadowResolver})
 * to decide which declaration a given occurrence belongs to. Shapes that the scan does not
 * recognize are skipped, so every query is total and an empty answer is a valid one.
 */
public final class BindingCatalog {

  private static final Logger logger = Logger.getLogger(BindingCatalog.class.getName());

  private final Node root;

  private final ListMultimap<String, Binding> bindings = LinkedListMultimap.create();

  /** Assignment-operator nodes and enhanced-for loops that write a name. */
  private final ListMultimap<String, Node> assignments = LinkedListMultimap.create();

  /** INC and DEC nodes whose operand is a name. */
  private final ListMultimap<String, Node> updates = LinkedListMultimap.create();

  private final ListMultimap<String, Node> references = LinkedListMultimap.create();

  /** NAME declarators of var, let and const, without destructuring. */
  private final ListMultimap<String, Node> variableDeclarations = LinkedListMultimap.create();

  private final Map<Node, Binding> bindingsByNameNode = new HashMap<>();

  private BindingCatalog(Node root) {
    this.root = root;
  }

  /** Scans the tree rooted at {@code root}. */
  public static BindingCatalog build(Node root) {
    checkNotNull(root);
    BindingCatalog catalog = new BindingCatalog(root);
    catalog.scan();
    return catalog;
  }

  public Node getRoot() {
    return root;
  }

  /** Returns every binding declared with this name, in source order. */
  public ImmutableList<Binding> bindingsOf(String name) {
    return ImmutableList.copyOf(bindings.get(name));
  }

  /**
   * Returns every assignment (plain or compound) whose target is {@code name}, or binds {@code
   * name} through a destructuring pattern, plus every for-of or for-in loop that assigns it
   * without declaring it.
   */
  public ImmutableList<Node> assignmentsTo(String name) {
    return ImmutableList.copyOf(assignments.get(name));
  }

  /** Returns every increment and decrement of the identifier {@code name}. */
  public ImmutableList<Node> updatesOf(String name) {
    return ImmutableList.copyOf(updates.get(name));
  }

  /** Returns every NAME node spelled {@code name}, declarations included. */
  public ImmutableList<Node> referencesTo(String name) {
    return ImmutableList.copyOf(references.get(name));
  }

  /** Returns the simple var, let and const declarators of {@code name}. */
  public ImmutableList<Node> variableDeclarationsOf(String name) {
    return ImmutableList.copyOf(variableDeclarations.get(name));
  }

  /** Returns the binding introduced by a declaring NAME node, or null if it declares nothing. */
  public @Nullable Binding bindingForNameNode(Node nameNode) {
    return bindingsByNameNode.get(nameNode);
  }

  private void scan() {
    for (Node n : NodeUtil.preOrderIterable(root)) {
      switch (n.getToken()) {
        case VAR:
        case LET:
        case CONST:
          visitNameDeclaration(n);
          break;
        case FUNCTION:
          visitFunction(n);
          break;
        case CLASS:
          visitClass(n);
          break;
        case CATCH:
          visitCatch(n);
          break;
        case FOR_IN:
        case FOR_OF:
          visitEnhancedFor(n);
          break;
        case INC:
        case DEC:
          Node operand = n.getFirstChild();
          if (operand != null && operand.isName()) {
            updates.put(operand.getString(), n);
          }
          break;
        case NAME:
          if (!n.getString().isEmpty()) {
            references.put(n.getString(), n);
          }
          break;
        default:
          if (n.getKind() == NodeKind.ASSIGNMENT && n.hasChildren()) {
            for (Node target : NodeUtil.findNamesInTarget(n.getFirstChild())) {
              assignments.put(target.getString(), n);
            }
          }
          break;
      }
    }
    logger.fine(
        "Cataloged "
            + bindings.size()
            + " bindings, "
            + assignments.size()
            + " assignments and "
            + updates.size()
            + " updates of "
            + references.keySet().size()
            + " names");
  }

  private void visitNameDeclaration(Node declaration) {
    Token type = declaration.getToken();
    Node scopeRoot =
        type == Token.VAR
            ? NodeUtil.getEnclosingHoistScopeRoot(declaration)
            : enclosingBlockScope(declaration);
    for (Node declarator : declaration.children()) {
      if (declarator.isName()) {
        variableDeclarations.put(declarator.getString(), declarator);
      }
      for (Node name : NodeUtil.findNamesInTarget(declarator)) {
        addBinding(name, declaration, scopeRoot);
      }
    }
  }

  private void visitFunction(Node function) {
    Node name = function.getFirstChild();
    if (name != null && name.isName() && !name.getString().isEmpty()) {
      if (NodeUtil.isFunctionDeclaration(function)) {
        Node parent = checkNotNull(function.getParent());
        addBinding(name, function, NodeUtil.getEnclosingHoistScopeRoot(parent));
      } else {
        // A function expression's name is only visible inside the function.
        addBinding(name, function, function);
      }
    }
    Node params = function.getSecondChild();
    if (params != null && params.isParamList()) {
      for (Node param : params.children()) {
        for (Node paramName : NodeUtil.findNamesInTarget(param)) {
          addBinding(paramName, params, function);
        }
      }
    }
  }

  private void visitClass(Node clazz) {
    Node name = clazz.getFirstChild();
    if (name == null || !name.isName() || name.getString().isEmpty()) {
      return;
    }
    Node scopeRoot = NodeUtil.isClassDeclaration(clazz) ? enclosingBlockScope(clazz) : clazz;
    addBinding(name, clazz, scopeRoot);
  }

  private void visitCatch(Node catchNode) {
    Node param = catchNode.getFirstChild();
    if (param == null) {
      return;
    }
    for (Node name : NodeUtil.findNamesInTarget(param)) {
      addBinding(name, catchNode, catchNode);
    }
  }

  private void visitEnhancedFor(Node forNode) {
    Node target = forNode.getFirstChild();
    if (target == null || NodeUtil.isNameDeclaration(target)) {
      // Declared loop variables are handled as declarations.
      return;
    }
    for (Node name : NodeUtil.findNamesInTarget(target)) {
      assignments.put(name.getString(), forNode);
    }
  }

  private static Node enclosingBlockScope(Node declaration) {
    Node parent = declaration.getParent();
    return parent == null ? declaration : NodeUtil.getEnclosingBlockScopeRoot(parent);
  }

  private void addBinding(Node nameNode, Node declarationNode, Node scopeRoot) {
    Binding binding =
        new Binding(
            nameNode.getString(), nameNode, declarationNode, declarationNode.getToken(), scopeRoot);
    bindings.put(binding.name(), binding);
    bindingsByNameNode.put(nameNode, binding);
  }
}
