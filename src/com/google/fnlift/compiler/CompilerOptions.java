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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;

/** Compiler options. */
public class CompilerOptions {

  private LiftedFunctionNamingPolicy liftedFunctionNaming = LiftedFunctionNamingPolicy.KEEP_NAME;

  /** Runs {@link LiftedFormValidator} after lifting. */
  private boolean checkLiftedInvariants = true;

  /** Logs the module source after lifting. */
  private boolean printLiftedCode = false;

  public LiftedFunctionNamingPolicy getLiftedFunctionNaming() {
    return liftedFunctionNaming;
  }

  public void setLiftedFunctionNaming(LiftedFunctionNamingPolicy policy) {
    this.liftedFunctionNaming = checkNotNull(policy);
  }

  public boolean shouldCheckLiftedInvariants() {
    return checkLiftedInvariants;
  }

  public void setCheckLiftedInvariants(boolean checkLiftedInvariants) {
    this.checkLiftedInvariants = checkLiftedInvariants;
  }

  public boolean shouldPrintLiftedCode() {
    return printLiftedCode;
  }

  public void setPrintLiftedCode(boolean printLiftedCode) {
    this.printLiftedCode = printLiftedCode;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("liftedFunctionNaming", liftedFunctionNaming)
        .add("checkLiftedInvariants", checkLiftedInvariants)
        .add("printLiftedCode", printLiftedCode)
        .toString();
  }
}
