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
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * Predicates that prove a runtime capability of an expression from its syntax alone.
 *
 * <p>Each predicate recognizes a fixed list of shapes and answers false for everything else, in
 * particular for any bare identifier. Global names such as {@code Array} and {@code Promise} are
 * assumed to be the built-ins.
 */
public final class CapabilityOracle {

  /** String methods whose result is iterable when called on a string literal. */
  private static final ImmutableSet<String> ITERABLE_STRING_METHODS =
      ImmutableSet.of(
          "matchAll",
          "split",
          "slice",
          "substr",
          "substring",
          "toLowerCase",
          "toUpperCase",
          "trim",
          "trimStart",
          "trimEnd");

  private static final ImmutableSet<String> ARRAY_PRESERVING_METHODS =
      ImmutableSet.of(
          "slice", "concat", "map", "filter", "flat", "flatMap", "reverse", "sort", "splice");

  private static final ImmutableSet<String> STRING_PRESERVING_METHODS =
      ImmutableSet.of(
          "slice",
          "substr",
          "substring",
          "toLowerCase",
          "toUpperCase",
          "trim",
          "trimStart",
          "trimEnd",
          "trimLeft",
          "trimRight",
          "repeat",
          "padStart",
          "padEnd",
          "concat",
          "replace",
          "replaceAll");

  private static final ImmutableSet<String> ARRAY_FACTORY_METHODS = ImmutableSet.of("from", "of");

  private static final ImmutableSet<String> PROMISE_STATIC_METHODS =
      ImmutableSet.of("all", "race", "resolve", "reject", "allSettled", "any");

  private static final ImmutableSet<String> PROMISE_METHODS =
      ImmutableSet.of("then", "catch", "finally");

  /** What a chain of method calls is known to produce. */
  private enum Shape {
    ARRAY,
    STRING,
    UNKNOWN
  }

  private CapabilityOracle() {}

  /**
   * Whether {@code n} is guaranteed to evaluate to an iterable: an array literal, {@code
   * Array.from(...)}, {@code Array.of(...)}, {@code new Array(...)} or an iterable-returning
   * method called on a string literal.
   */
  public static boolean isProvablyIterable(Node n) {
    checkNotNull(n);
    return switch (n.getKind()) {
      case COLLECTION -> n.isArrayLit();
      case CALL -> isArrayConstruction(n) || isStringLiteralMethodCall(n, ITERABLE_STRING_METHODS);
      case IDENTIFIER,
          LITERAL,
          TEMPLATE,
          MEMBER_ACCESS,
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
  }

  /**
   * Whether {@code n} is guaranteed to be an array or a string, both of which support {@code
   * indexOf} and {@code includes}.
   *
   * <p>Recognized are array literals and constructions, string and template literals, and method
   * chains on such a base in which every call preserves array-ness or string-ness, e.g. {@code
   * [1, 2].concat(x).slice(1)} or {@code "a".trim().toLowerCase()}.
   */
  public static boolean supportsIndexOfAndIncludes(Node n) {
    checkNotNull(n);
    Deque<String> methods = new ArrayDeque<>();
    Node current = n;
    Shape shape = baseShape(current);
    while (shape == Shape.UNKNOWN) {
      String method = getCalledMethodName(current);
      if (method == null) {
        return false;
      }
      methods.push(method);
      current = current.getFirstChild().getFirstChild();
      shape = baseShape(current);
    }
    // Replay the chain from the base outward.
    while (!methods.isEmpty() && shape != Shape.UNKNOWN) {
      String method = methods.pop();
      shape =
          switch (shape) {
            case ARRAY -> ARRAY_PRESERVING_METHODS.contains(method) ? Shape.ARRAY : Shape.UNKNOWN;
            case STRING ->
                STRING_PRESERVING_METHODS.contains(method) ? Shape.STRING : Shape.UNKNOWN;
            case UNKNOWN -> Shape.UNKNOWN;
          };
    }
    return shape != Shape.UNKNOWN;
  }

  private static Shape baseShape(Node n) {
    return switch (n.getKind()) {
      case COLLECTION -> n.isArrayLit() ? Shape.ARRAY : Shape.UNKNOWN;
      case LITERAL -> n.isString() ? Shape.STRING : Shape.UNKNOWN;
      case TEMPLATE -> Shape.STRING;
      case CALL -> isArrayConstruction(n) ? Shape.ARRAY : Shape.UNKNOWN;
      case IDENTIFIER,
          MEMBER_ACCESS,
          ASSIGNMENT,
          UPDATE,
          OPERATOR,
          DECLARATION,
          FUNCTION,
          PATTERN,
          STATEMENT,
          OTHER ->
          Shape.UNKNOWN;
    };
  }

  /**
   * Returns the numeric value of a number literal or of a negated number literal, or null for
   * any other shape.
   */
  public static @Nullable Double getNumericValue(Node n) {
    checkNotNull(n);
    if (n.isNumber()) {
      return n.getDouble();
    }
    if (n.isNeg() && n.hasOneChild() && n.getFirstChild().isNumber()) {
      return -n.getFirstChild().getDouble();
    }
    return null;
  }

  /**
   * Whether {@code n} is known to produce a promise: {@code new Promise(...)}, {@code
   * fetch(...)}, a static {@code Promise} combinator, or a {@code then}, {@code catch} or {@code
   * finally} call.
   */
  public static boolean isKnownPromise(Node n) {
    checkNotNull(n);
    Node callee = n.getFirstChild();
    if (callee == null) {
      return false;
    }
    if (n.isNew()) {
      return callee.matchesName("Promise");
    }
    if (!n.isCall()) {
      return false;
    }
    if (callee.isName()) {
      return callee.getString().equals("fetch");
    }
    String method = getCalledMethodName(n);
    if (method == null) {
      return false;
    }
    if (callee.getFirstChild().matchesName("Promise")) {
      return PROMISE_STATIC_METHODS.contains(method);
    }
    return PROMISE_METHODS.contains(method);
  }

  /** Whether {@code n} is a string literal or a {@code +} chain with a string literal operand. */
  public static boolean containsStringLiteral(Node n) {
    checkNotNull(n);
    Deque<Node> work = new ArrayDeque<>();
    work.push(n);
    while (!work.isEmpty()) {
      Node current = work.pop();
      if (current.isString()) {
        return true;
      }
      if (current.isAddOp()) {
        for (Node operand : current.children()) {
          work.push(operand);
        }
      }
    }
    return false;
  }

  /** Whether {@code n} is {@code new Array(...)}, {@code Array.from(...)} or {@code Array.of()}. */
  private static boolean isArrayConstruction(Node n) {
    Node callee = n.getFirstChild();
    if (callee == null) {
      return false;
    }
    if (n.isNew()) {
      return callee.matchesName("Array");
    }
    String method = getCalledMethodName(n);
    return method != null
        && ARRAY_FACTORY_METHODS.contains(method)
        && callee.getFirstChild().matchesName("Array");
  }

  private static boolean isStringLiteralMethodCall(Node n, ImmutableSet<String> methodNames) {
    String method = getCalledMethodName(n);
    return method != null
        && methodNames.contains(method)
        && n.getFirstChild().getFirstChild().isString();
  }

  /** Returns {@code m} if {@code n} is a call of the form {@code obj.m(...)}, else null. */
  private static @Nullable String getCalledMethodName(Node n) {
    if (!n.isCall()) {
      return null;
    }
    Node callee = n.getFirstChild();
    if (callee == null || !callee.isGetProp()) {
      return null;
    }
    Node property = callee.getSecondChild();
    return property != null && property.isString() ? property.getString() : null;
  }
}
