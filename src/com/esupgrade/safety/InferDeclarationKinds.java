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
import com.google.common.collect.ImmutableMap;
import java.util.logging.Logger;

/**
 * Picks a replacement declaration token for every {@code var} declarator of a unit: {@code const}
 * when the declarator is immutable-safe, {@code let} otherwise.
 *
 * <p>Declarators of one statement are classified independently, so {@code var a = 1, b;} yields
 * CONST for {@code a} and LET for {@code b}; a caller that rewrites it has to split the
 * statement. The tree is not modified.
 */
public final class InferDeclarationKinds {

  private static final Logger logger = Logger.getLogger(InferDeclarationKinds.class.getName());

  private final AnalysisSession session;

  public InferDeclarationKinds(AnalysisSession session) {
    this.session = checkNotNull(session);
  }

  /** Returns the inferred token of each var declarator, in source order. */
  public ImmutableMap<Node, Token> process() {
    ImmutableMap.Builder<Node, Token> kinds = ImmutableMap.builder();
    int constCount = 0;
    int letCount = 0;
    for (Node n : NodeUtil.preOrderIterable(session.getRoot())) {
      if (!n.isVar()) {
        continue;
      }
      for (Node declarator : n.children()) {
        Token kind = session.classify(declarator).toDeclarationToken();
        kinds.put(declarator, kind);
        if (kind == Token.CONST) {
          constCount++;
        } else {
          letCount++;
        }
      }
    }
    logger.fine("Inferred " + constCount + " const and " + letCount + " let declarations");
    return kinds.buildOrThrow();
  }
}
