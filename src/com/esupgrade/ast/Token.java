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

/** The tokens of the JavaScript syntax tree. */
public enum Token {
  SCRIPT, // top-level node for an analysis unit
  BLOCK, // statement block
  EXPR_RESULT, // expression statement
  EMPTY,

  RETURN,
  IF,
  FOR, // for(;;) statement
  FOR_IN,
  FOR_OF,
  WHILE,
  DO,
  THROW,
  TRY,
  CATCH,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  LABEL,
  LABEL_NAME,
  BREAK,
  CONTINUE,

  VAR,
  LET, // block scoped vars
  CONST,
  DESTRUCTURING_LHS, // The node inside a var/let/const with a destructuring LHS

  FUNCTION,
  PARAM_LIST,
  CLASS,
  CLASS_MEMBERS,
  MEMBER_FUNCTION_DEF,

  NAME,
  NUMBER,
  BIGINT,
  STRINGLIT,
  TRUE,
  FALSE,
  NULL,
  REGEXP,
  THIS,
  SUPER,

  TEMPLATELIT, // template literal, e.g: `bar`
  TEMPLATELIT_STRING, // template literal string
  TEMPLATELIT_SUB, // template literal substitution

  ARRAYLIT,
  OBJECTLIT,
  STRING_KEY, // object literal or object pattern key
  COMPUTED_PROP,
  ITER_SPREAD,
  OBJECT_SPREAD,

  GETPROP,
  GETELEM,
  CALL,
  NEW,

  ASSIGN, // simple assignment  (=)
  ASSIGN_ADD, // +=
  ASSIGN_SUB, // -=
  ASSIGN_MUL, // *=
  ASSIGN_DIV, // /=
  ASSIGN_MOD, // %=
  ASSIGN_EXPONENT, // **=
  ASSIGN_BITOR, // |=
  ASSIGN_BITAND, // &=
  ASSIGN_OR, // ||=
  ASSIGN_AND, // &&=
  ASSIGN_COALESCE, // ??=

  INC, // ++
  DEC, // --

  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  EXPONENT,
  EQ,
  NE,
  SHEQ, // ===
  SHNE, // !==
  LT,
  LE,
  GT,
  GE,
  AND,
  OR,
  COALESCE,
  IN,
  INSTANCEOF,
  HOOK, // conditional (?:)
  COMMA,
  NOT,
  NEG,
  POS,
  BITNOT,
  TYPEOF,
  VOID,
  DELPROP,
  AWAIT,
  YIELD,

  ARRAY_PATTERN, // destructuring patterns
  OBJECT_PATTERN,
  ITER_REST, // rest element of an array pattern or parameter list
  OBJECT_REST, // rest element of an object pattern
  DEFAULT_VALUE; // parameter or destructuring element with a default value

  /** Returns the analysis category of this token. */
  public NodeKind kind() {
    return switch (this) {
      case NAME -> NodeKind.IDENTIFIER;
      case NUMBER, BIGINT, STRINGLIT, TRUE, FALSE, NULL, REGEXP -> NodeKind.LITERAL;
      case TEMPLATELIT -> NodeKind.TEMPLATE;
      case ARRAYLIT, OBJECTLIT -> NodeKind.COLLECTION;
      case GETPROP, GETELEM -> NodeKind.MEMBER_ACCESS;
      case CALL, NEW -> NodeKind.CALL;
      case ASSIGN,
          ASSIGN_ADD,
          ASSIGN_SUB,
          ASSIGN_MUL,
          ASSIGN_DIV,
          ASSIGN_MOD,
          ASSIGN_EXPONENT,
          ASSIGN_BITOR,
          ASSIGN_BITAND,
          ASSIGN_OR,
          ASSIGN_AND,
          ASSIGN_COALESCE ->
          NodeKind.ASSIGNMENT;
      case INC, DEC -> NodeKind.UPDATE;
      case ADD,
          SUB,
          MUL,
          DIV,
          MOD,
          EXPONENT,
          EQ,
          NE,
          SHEQ,
          SHNE,
          LT,
          LE,
          GT,
          GE,
          AND,
          OR,
          COALESCE,
          IN,
          INSTANCEOF,
          HOOK,
          COMMA,
          NOT,
          NEG,
          POS,
          BITNOT,
          TYPEOF,
          VOID,
          DELPROP,
          AWAIT,
          YIELD ->
          NodeKind.OPERATOR;
      case VAR, LET, CONST, DESTRUCTURING_LHS -> NodeKind.DECLARATION;
      case FUNCTION -> NodeKind.FUNCTION;
      case ARRAY_PATTERN, OBJECT_PATTERN, ITER_REST, OBJECT_REST, DEFAULT_VALUE ->
          NodeKind.PATTERN;
      case SCRIPT,
          BLOCK,
          EXPR_RESULT,
          EMPTY,
          RETURN,
          IF,
          FOR,
          FOR_IN,
          FOR_OF,
          WHILE,
          DO,
          THROW,
          TRY,
          CATCH,
          SWITCH,
          CASE,
          DEFAULT_CASE,
          LABEL,
          BREAK,
          CONTINUE,
          CLASS ->
          NodeKind.STATEMENT;
      case LABEL_NAME,
          PARAM_LIST,
          CLASS_MEMBERS,
          MEMBER_FUNCTION_DEF,
          THIS,
          SUPER,
          TEMPLATELIT_STRING,
          TEMPLATELIT_SUB,
          STRING_KEY,
          COMPUTED_PROP,
          ITER_SPREAD,
          OBJECT_SPREAD ->
          NodeKind.OTHER;
    };
  }
}
