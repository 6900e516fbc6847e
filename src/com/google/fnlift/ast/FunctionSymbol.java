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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A declared function.
 *
 * <p>A function declared inside the body of another function has an enclosing function and may
 * reference that function's variables. Once such a function has been moved to module scope, the
 * symbol records its replacement; the replacement in turn records where it was lifted from.
 */
public final class FunctionSymbol extends Symbol {
  private final String returnType;
  private final @Nullable FunctionSymbol enclosingFunction;
  private final @Nullable FunctionSymbol liftedFrom;

  /** The FUNCTION node declaring this symbol. */
  private @Nullable Node definition;

  private @Nullable FunctionSymbol liftedReplacement;

  FunctionSymbol(
      int index,
      String name,
      String returnType,
      @Nullable FunctionSymbol enclosingFunction,
      @Nullable FunctionSymbol liftedFrom) {
    super(index, name);
    this.returnType = returnType;
    this.enclosingFunction = enclosingFunction;
    this.liftedFrom = liftedFrom;
  }

  @Override
  public boolean isFunction() {
    return true;
  }

  public String getReturnType() {
    return returnType;
  }

  public boolean hasEnclosingFunction() {
    return enclosingFunction != null;
  }

  public @Nullable FunctionSymbol getEnclosingFunction() {
    return enclosingFunction;
  }

  /** Whether {@code other} is this function or lexically encloses it at any depth. */
  public boolean isAncestorOrSelfOf(FunctionSymbol other) {
    for (FunctionSymbol f = other; f != null; f = f.enclosingFunction) {
      if (f == this) {
        return true;
      }
    }
    return false;
  }

  /**
   * The name prefixed with the names of all enclosing functions, outermost first, joined with
   * {@code $}.
   */
  public String getQualifiedName() {
    return enclosingFunction == null
        ? getName()
        : enclosingFunction.getQualifiedName() + "$" + getName();
  }

  public boolean hasDefinition() {
    return definition != null;
  }

  public Node getDefinition() {
    checkState(definition != null, "No definition bound to %s", this);
    return definition;
  }

  public void setDefinition(Node function) {
    checkArgument(function.isFunction(), function);
    this.definition = function;
  }

  /** The formals of the current definition, in declaration order. */
  public ImmutableList<VarSymbol> getFormals() {
    ImmutableList.Builder<VarSymbol> formals = ImmutableList.builder();
    for (Node param = getDefinition().getSecondChild().getFirstChild();
        param != null;
        param = param.getNext()) {
      formals.add(param.getSymbol().toVariable());
    }
    return formals.build();
  }

  public boolean isLifted() {
    return liftedReplacement != null;
  }

  public @Nullable FunctionSymbol getLiftedReplacement() {
    return liftedReplacement;
  }

  /** Records the module-level function that replaces this one. Allowed once. */
  public void setLiftedReplacement(FunctionSymbol replacement) {
    checkNotNull(replacement);
    checkState(liftedReplacement == null, "%s already lifted to %s", this, liftedReplacement);
    checkArgument(replacement.liftedFrom == this, "%s was not lifted from %s", replacement, this);
    this.liftedReplacement = replacement;
  }

  /** The nested function this one was created from, or null if it was declared by the user. */
  public @Nullable FunctionSymbol getLiftedFrom() {
    return liftedFrom;
  }
}
