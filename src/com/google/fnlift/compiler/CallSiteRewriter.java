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

import com.google.common.collect.ImmutableList;
import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.IR;
import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.VarSymbol;

/**
 * Adds the captured variables of a nested function as actuals to a call of it, and points the call
 * at the lifted function once there is one.
 */
final class CallSiteRewriter {
  private final AbstractCompiler compiler;
  private final CaptureSets captureSets;
  private final PendingCallTargets pendingCallTargets;

  CallSiteRewriter(
      AbstractCompiler compiler, CaptureSets captureSets, PendingCallTargets pendingCallTargets) {
    this.compiler = compiler;
    this.captureSets = captureSets;
    this.pendingCallTargets = pendingCallTargets;
  }

  /** Rewrites {@code call}. Calls of functions that were never nested are left alone. */
  void rewrite(Node call) {
    FunctionSymbol target = NodeUtil.getCallTarget(call);
    ImmutableList<VarSymbol> captures = captureSets.get(target);
    if (captures == null) {
      if (target.hasEnclosingFunction()) {
        compiler.throwInternalError(
            "No capture set computed for called nested function " + target.getQualifiedName(),
            null);
      }
      return;
    }

    // The actuals name the captured variables themselves. If this call ends up inside a lifted
    // function, the lifter rebinds them to that function's formals.
    for (VarSymbol var : captures) {
      call.addChildToBack(IR.name(var));
    }

    FunctionSymbol lifted = target.getLiftedReplacement();
    if (lifted != null) {
      call.getFirstChild().replaceWith(IR.name(lifted));
    } else {
      pendingCallTargets.addPendingCall(target);
    }
    compiler.reportCodeChange();
  }
}
