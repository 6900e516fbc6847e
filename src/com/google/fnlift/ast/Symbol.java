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

package com.google.fnlift.ast;

import static com.google.common.base.Preconditions.checkState;

/**
 * A declared entity of a module. Symbols are allocated by a {@link SymbolTable}, which assigns each
 * one a stable index; two symbols are the same entity iff they have the same index in the same
 * table. Symbols are never freed, so a symbol that has been replaced (for example a nested function
 * after it was lifted) stays valid as a map key.
 */
public abstract class Symbol {
  private final int index;
  private final String name;

  Symbol(int index, String name) {
    this.index = index;
    this.name = name;
  }

  /** The position of this symbol in its owning {@link SymbolTable}. */
  public final int getIndex() {
    return index;
  }

  public final String getName() {
    return name;
  }

  public abstract boolean isFunction();

  public final boolean isVariable() {
    return !isFunction();
  }

  public final FunctionSymbol toFunction() {
    checkState(isFunction(), "Not a function: %s", this);
    return (FunctionSymbol) this;
  }

  public final VarSymbol toVariable() {
    checkState(isVariable(), "Not a variable: %s", this);
    return (VarSymbol) this;
  }

  @Override
  public String toString() {
    return name + "#" + index;
  }
}
