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
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The safety analysis of one unit.
 *
 * <p>A session owns everything computed about its tree: the binding catalog, built on the first
 * query that needs it, and the alias cache. Answers are memoized, so if the underlying
 * tree changes the session is out of sync and a new one must be created.
 *
 * <p>Sessions are not thread-safe. Independent units can be analyzed concurrently with one
 * session each.
 */
public final class AnalysisSession {

  private static final Logger logger = Logger.getLogger(AnalysisSession.class.getName());

  private final Node root;
  private final SafetyOptions options;

  private @Nullable BindingCatalog catalog;
  private @Nullable ShadowResolver shadowResolver;
  private @Nullable MutabilityClassifier mutabilityClassifier;
  private @Nullable AliasResolver aliasResolver;

  private AnalysisSession(Node root, SafetyOptions options) {
    this.root = root;
    this.options = options;
  }

  /** Creates a session for the unit rooted at {@code root} with the default options. */
  public static AnalysisSession create(Node root) {
    return create(root, new SafetyOptions());
  }

  /**
   * Creates a session for the unit rooted at {@code root}. The options are read once, later
   * changes to them do not affect the session.
   */
  public static AnalysisSession create(Node root, SafetyOptions options) {
    checkNotNull(root);
    checkNotNull(options);
    checkArgument(!root.hasParent(), "Not the root of a unit: %s", root);
    SafetyOptions copy = new SafetyOptions();
    copy.setWrapperCalleeNames(options.getWrapperCalleeNames());
    copy.setOpaqueTopLevelPrefix(options.getOpaqueTopLevelPrefix());
    return new AnalysisSession(root, copy);
  }

  public Node getRoot() {
    return root;
  }

  public BindingCatalog getBindingCatalog() {
    if (catalog == null) {
      catalog = BindingCatalog.build(root);
      logger.fine("Built binding catalog for " + root);
    }
    return catalog;
  }

  private ShadowResolver getShadowResolver() {
    if (shadowResolver == null) {
      shadowResolver = new ShadowResolver(getBindingCatalog());
    }
    return shadowResolver;
  }

  private MutabilityClassifier getMutabilityClassifier() {
    if (mutabilityClassifier == null) {
      mutabilityClassifier = new MutabilityClassifier(getBindingCatalog(), getShadowResolver());
    }
    return mutabilityClassifier;
  }

  AliasResolver getAliasResolver() {
    if (aliasResolver == null) {
      aliasResolver = new AliasResolver(getBindingCatalog(), options);
    }
    return aliasResolver;
  }

  // Binding queries

  public ImmutableList<Binding> bindingsOf(String name) {
    return getBindingCatalog().bindingsOf(checkNotNull(name));
  }

  /** See {@link ShadowResolver#isShadowed(Node, String, Binding)}. */
  public boolean isShadowed(Node usage, String name, Binding original) {
    checkInUnit(usage);
    return getShadowResolver().isShadowed(usage, name, original);
  }

  /** See {@link ShadowResolver#isShadowed(Node, String, Node)}. */
  public boolean isShadowed(Node usage, String name, Node originalNameNode) {
    checkInUnit(usage);
    checkInUnit(originalNameNode);
    return getShadowResolver().isShadowed(usage, name, originalNameNode);
  }

  /** See {@link MutabilityClassifier#classify(Node)}. */
  public Mutability classify(Node declarator) {
    checkInUnit(declarator);
    return getMutabilityClassifier().classify(declarator);
  }

  // Alias queries

  /** See {@link AliasResolver#resolve(String)}. */
  public Optional<Node> resolveAlias(String name) {
    return getAliasResolver().resolve(name);
  }

  public boolean isWrapperObject(Node n) {
    checkInUnit(n);
    return getAliasResolver().isWrapperObject(n);
  }

  public boolean isSafeToRewriteInitializer(Node call) {
    checkInUnit(call);
    return getAliasResolver().isSafeToRewriteInitializer(call);
  }

  public int countNonDeclaratorUsages(String name) {
    return getAliasResolver().countNonDeclaratorUsages(checkNotNull(name));
  }

  // Tree-local queries, which need no catalog

  public boolean areEquivalent(Node a, Node b) {
    return StructuralEquivalence.areEquivalent(a, b);
  }

  public boolean isProvablyIterable(Node n) {
    return CapabilityOracle.isProvablyIterable(n);
  }

  public boolean supportsIndexOfAndIncludes(Node n) {
    return CapabilityOracle.supportsIndexOfAndIncludes(n);
  }

  public @Nullable Double getNumericValue(Node n) {
    return CapabilityOracle.getNumericValue(n);
  }

  public boolean isKnownPromise(Node n) {
    return CapabilityOracle.isKnownPromise(n);
  }

  public boolean containsStringLiteral(Node n) {
    return CapabilityOracle.containsStringLiteral(n);
  }

  private void checkInUnit(Node n) {
    checkNotNull(n);
    checkArgument(NodeUtil.getRoot(n) == root, "%s does not belong to this unit", n);
  }
}
