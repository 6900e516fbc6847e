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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The arena holding every symbol of a module.
 *
 * <p>Symbols are appended and never removed, so {@link Symbol#getIndex()} is stable for the life of
 * the table. The table also answers the scope questions the lifting passes need: which function
 * encloses a function, where it is defined, and which function's frame holds a variable.
 */
public final class SymbolTable {
  private final List<Symbol> symbols = new ArrayList<>();

  public FunctionSymbol declareFunction(
      String name, String returnType, @Nullable FunctionSymbol enclosingFunction) {
    FunctionSymbol fn =
        new FunctionSymbol(symbols.size(), name, returnType, enclosingFunction, null);
    symbols.add(fn);
    return fn;
  }

  /** Declares the module-level function that will replace the nested function {@code original}. */
  public FunctionSymbol declareLiftedFunction(FunctionSymbol original, String name) {
    checkArgument(original.hasEnclosingFunction(), "%s is not nested", original);
    FunctionSymbol fn =
        new FunctionSymbol(symbols.size(), name, original.getReturnType(), null, original);
    symbols.add(fn);
    return fn;
  }

  /** Declares a local variable of {@code owner}, or a module-level variable if owner is null. */
  public VarSymbol declareVariable(String name, String type, @Nullable FunctionSymbol owner) {
    VarSymbol var =
        new VarSymbol(symbols.size(), name, type, Intent.IN, /* formal= */ false, owner);
    symbols.add(var);
    return var;
  }

  public VarSymbol declareFormal(String name, String type, Intent intent, FunctionSymbol owner) {
    VarSymbol var = new VarSymbol(symbols.size(), name, type, intent, /* formal= */ true, owner);
    symbols.add(var);
    return var;
  }

  public Symbol getSymbol(int index) {
    checkElementIndex(index, symbols.size());
    return symbols.get(index);
  }

  public int size() {
    return symbols.size();
  }

  public ImmutableList<FunctionSymbol> getFunctions() {
    ImmutableList.Builder<FunctionSymbol> result = ImmutableList.builder();
    for (Symbol symbol : symbols) {
      if (symbol.isFunction()) {
        result.add(symbol.toFunction());
      }
    }
    return result.build();
  }

  /** The formals and locals whose frame is {@code fn}, in declaration order. */
  public ImmutableList<VarSymbol> getVariablesOwnedBy(FunctionSymbol fn) {
    ImmutableList.Builder<VarSymbol> result = ImmutableList.builder();
    for (Symbol symbol : symbols) {
      if (symbol.isVariable() && symbol.toVariable().getOwner() == fn) {
        result.add(symbol.toVariable());
      }
    }
    return result.build();
  }

  /** Moves every variable owned by {@code from} into the frame of {@code to}. */
  public void transferVariables(FunctionSymbol from, FunctionSymbol to) {
    for (VarSymbol var : getVariablesOwnedBy(from)) {
      var.setOwner(to);
    }
  }

  public @Nullable FunctionSymbol getEnclosingFunction(FunctionSymbol fn) {
    return fn.getEnclosingFunction();
  }

  public boolean hasEnclosingFunction(FunctionSymbol fn) {
    return fn.hasEnclosingFunction();
  }

  /** The FUNCTION statement that declares {@code fn}. */
  public Node getDefiningStatement(FunctionSymbol fn) {
    return fn.getDefinition();
  }

  /**
   * Whether {@code var} lives in the frame of a function that strictly encloses {@code fn}, which is
   * exactly when a reference to it from {@code fn} is a capture.
   */
  public boolean isCapturableFrom(VarSymbol var, FunctionSymbol fn) {
    FunctionSymbol owner = var.getOwner();
    FunctionSymbol enclosing = fn.getEnclosingFunction();
    return owner != null && enclosing != null && owner.isAncestorOrSelfOf(enclosing);
  }
}
