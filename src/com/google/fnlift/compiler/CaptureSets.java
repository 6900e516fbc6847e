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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.VarSymbol;
import org.jspecify.annotations.Nullable;

/**
 * The variables each nested function captures from its enclosing functions, as computed by {@link
 * CaptureAnalysis}.
 *
 * <p>The order of a capture list is the order of the formals added to the lifted function and of
 * the actuals added to each call of it.
 */
public final class CaptureSets {
  private final ImmutableMap<FunctionSymbol, ImmutableList<VarSymbol>> captures;
  private final int roundCount;

  CaptureSets(ImmutableMap<FunctionSymbol, ImmutableList<VarSymbol>> captures, int roundCount) {
    this.captures = captures;
    this.roundCount = roundCount;
  }

  /** Whether there were no nested functions to analyze. */
  public boolean isEmpty() {
    return captures.isEmpty();
  }

  /** The analyzed nested functions, in source order. */
  public ImmutableSet<FunctionSymbol> getNestedFunctions() {
    return captures.keySet();
  }

  public boolean hasCaptureSet(FunctionSymbol fn) {
    return captures.containsKey(fn);
  }

  /** The capture list of {@code fn}, or null if {@code fn} was not analyzed as a nested function. */
  public @Nullable ImmutableList<VarSymbol> get(FunctionSymbol fn) {
    return captures.get(fn);
  }

  public ImmutableList<VarSymbol> getCaptures(FunctionSymbol fn) {
    ImmutableList<VarSymbol> result = captures.get(fn);
    checkArgument(result != null, "No capture set for %s", fn);
    return result;
  }

  /** How many fixed-point rounds the analysis ran, including the final round with no change. */
  public int getRoundCount() {
    return roundCount;
  }

  @Override
  public String toString() {
    return captures.toString();
  }
}
