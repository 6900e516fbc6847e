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

import org.jspecify.annotations.Nullable;

/** A local variable, formal parameter or module-level variable. */
public final class VarSymbol extends Symbol {
  private final String type;
  private final Intent intent;
  private final boolean formal;

  /** The function whose frame holds this variable, or null for module-level variables. */
  private @Nullable FunctionSymbol owner;

  VarSymbol(
      int index,
      String name,
      String type,
      Intent intent,
      boolean formal,
      @Nullable FunctionSymbol owner) {
    super(index, name);
    this.type = type;
    this.intent = intent;
    this.formal = formal;
    this.owner = owner;
  }

  @Override
  public boolean isFunction() {
    return false;
  }

  /** The declared type name. */
  public String getType() {
    return type;
  }

  /** The binding mode of a formal. Locals are always {@link Intent#IN}. */
  public Intent getIntent() {
    return intent;
  }

  public boolean isFormal() {
    return formal;
  }

  public @Nullable FunctionSymbol getOwner() {
    return owner;
  }

  public boolean isModuleLevel() {
    return owner == null;
  }

  void setOwner(FunctionSymbol owner) {
    this.owner = owner;
  }
}
