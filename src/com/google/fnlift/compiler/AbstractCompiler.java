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

import com.google.fnlift.ast.SymbolTable;
import org.jspecify.annotations.Nullable;

/**
 * An abstract compiler, to help remove the circular dependency of passes on {@link Compiler}.
 */
public abstract class AbstractCompiler {

  /** The symbols of the module being compiled. Passes may declare new symbols. */
  public abstract SymbolTable getSymbolTable();

  public abstract CompilerOptions getOptions();

  /** Passes should call this after any change to the tree. */
  public abstract void reportCodeChange();

  /** Records the lifts performed by {@link LiftNestedFunctions}. */
  abstract void setLiftedFunctionMap(LiftedFunctionMap map);

  public abstract LiftedFunctionMap getLiftedFunctionMap();

  /**
   * Report an internal error. Never returns normally; internal errors mean the compiler or its
   * input preconditions are broken, and are distinct from errors in user code.
   */
  abstract void throwInternalError(String message, @Nullable Throwable cause);
}
