/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.fnlift.compiler;

import com.google.fnlift.ast.FunctionSymbol;

/** Strategies for naming functions moved to module scope by {@link LiftNestedFunctions}. */
public enum LiftedFunctionNamingPolicy {
  /** The lifted function keeps its declared name. Symbols, not names, identify functions. */
  KEEP_NAME,

  /**
   * The lifted function is named after its chain of enclosing functions, for example {@code
   * outer$inner}, so that names stay unique for backends that emit them.
   */
  QUALIFY_WITH_ENCLOSING;

  String getLiftedName(FunctionSymbol nested) {
    switch (this) {
      case KEEP_NAME:
        return nested.getName();
      case QUALIFY_WITH_ENCLOSING:
        return nested.getQualifiedName();
    }
    throw new AssertionError(this);
  }
}
