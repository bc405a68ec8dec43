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

/** Whether a declared binding may be declared immutably. */
public enum Mutability {
  /** No unshadowed write to the binding exists after its declaration. */
  IMMUTABLE_SAFE,
  /** The binding is written again, lacks an initializer, or could not be analyzed. */
  MUST_ALLOW_REASSIGNMENT;

  /** Returns the declaration token a binding with this mutability can be declared with. */
  public Token toDeclarationToken() {
    return switch (this) {
      case IMMUTABLE_SAFE -> Token.CONST;
      case MUST_ALLOW_REASSIGNMENT -> Token.LET;
    };
  }
}
