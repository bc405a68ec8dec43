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

package com.esupgrade.ast;

/**
 * The closed set of node shapes the safety analysis distinguishes.
 *
 * <p>Every {@link Token} maps to exactly one kind through {@link Token#kind()}. Analysis
 * predicates switch over this enum without a {@code default} branch so that a new kind has to be
 * handled everywhere before the code compiles again.
 */
public enum NodeKind {
  IDENTIFIER,
  LITERAL,
  TEMPLATE,
  COLLECTION,
  MEMBER_ACCESS,
  CALL,
  ASSIGNMENT,
  UPDATE,
  OPERATOR,
  DECLARATION,
  FUNCTION,
  PATTERN,
  STATEMENT,
  OTHER
}
