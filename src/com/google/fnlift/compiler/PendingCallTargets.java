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

import com.google.common.annotations.VisibleForTesting;
import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.Node;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Ledger of nested functions replaced by lifted ones, and of calls whose target could not be
 * redirected when they were rewritten.
 *
 * <p>The rewrite traversal visits a call before the definition of its target when the call precedes
 * the definition in the source, or is inside the target itself. Such calls get their extra actuals
 * right away, since the capture list is already known, and their target is recorded here. Once the
 * traversal is over, {@link #resolve} rebinds all of those targets in one walk of the module.
 *
 * <p>Each nested function moves through {@link State#UNLIFTED}, then {@link
 * State#LIFTED_PENDING_SUBSTITUTION} if calls to it are still unresolved when it is lifted, and ends
 * in {@link State#RESOLVED}.
 */
final class PendingCallTargets {
  private static final Logger logger = Logger.getLogger(PendingCallTargets.class.getName());

  enum State {
    UNLIFTED,
    LIFTED_PENDING_SUBSTITUTION,
    RESOLVED
  }

  private final AbstractCompiler compiler;
  private final Map<FunctionSymbol, FunctionSymbol> liftedFunctions = new LinkedHashMap<>();
  private final Set<FunctionSymbol> worklist = new LinkedHashSet<>();

  PendingCallTargets(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  /** Records that a call to {@code nested} was rewritten before {@code nested} was lifted. */
  void addPendingCall(FunctionSymbol nested) {
    if (liftedFunctions.containsKey(nested)) {
      compiler.throwInternalError(
          "Call to " + nested + " left pending after it was lifted to "
              + liftedFunctions.get(nested),
          null);
    }
    worklist.add(nested);
  }

  /** Records that {@code lifted} replaces {@code nested}. */
  void recordLift(FunctionSymbol nested, FunctionSymbol lifted) {
    if (nested.isLifted() || liftedFunctions.containsKey(nested)) {
      compiler.throwInternalError(
          "Function " + nested + " lifted twice, to " + nested.getLiftedReplacement() + " and "
              + lifted,
          null);
    }
    nested.setLiftedReplacement(lifted);
    liftedFunctions.put(nested, lifted);
  }

  @VisibleForTesting
  State getState(FunctionSymbol nested) {
    if (!liftedFunctions.containsKey(nested)) {
      return State.UNLIFTED;
    }
    return worklist.contains(nested) ? State.LIFTED_PENDING_SUBSTITUTION : State.RESOLVED;
  }

  boolean hasPendingCalls() {
    return !worklist.isEmpty();
  }

  /**
   * Rebinds every call whose target is in the worklist to the lifted replacement of that target,
   * then empties the worklist. Every pending target must have been lifted by now.
   */
  void resolve(Node root) {
    Map<FunctionSymbol, FunctionSymbol> substitution = new LinkedHashMap<>();
    for (FunctionSymbol nested : worklist) {
      FunctionSymbol lifted = liftedFunctions.get(nested);
      if (lifted == null) {
        compiler.throwInternalError("Call target " + nested + " was never lifted", null);
      }
      substitution.put(nested, lifted);
    }
    int rebound = SymbolSubstitution.forCallTargets(substitution).apply(compiler, root);
    logger.fine("Rebound " + rebound + " pending call targets of " + worklist.size() + " functions");
    worklist.clear();
  }
}
