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

import com.esupgrade.ast.Token;

/** How far a declaration is visible, which decides where it can shadow another one. */
public enum DeclarationKind {
  /** {@code var}, function declarations and parameters, hoisted to the enclosing function. */
  FUNCTION_SCOPED,
  /** {@code let}, {@code const}, classes and catch parameters, visible in their block only. */
  BLOCK_SCOPED;

  /** Returns the kind of binding created by a declaring token. */
  public static DeclarationKind forDeclarationType(Token declarationType) {
    switch (declarationType) {
      case VAR:
      case FUNCTION:
      case PARAM_LIST:
        return FUNCTION_SCOPED;
      case LET:
      case CONST:
      case CLASS:
      case CATCH:
        return BLOCK_SCOPED;
      default:
        throw new IllegalArgumentException("Not a declaring token: " + declarationType);
    }
  }
}
