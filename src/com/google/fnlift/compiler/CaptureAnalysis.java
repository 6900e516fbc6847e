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
import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.Symbol;
import com.google.fnlift.ast.SymbolTable;
import com.google.fnlift.ast.VarSymbol;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes, for every nested function of a module, the variables of its enclosing functions that it
 * uses, either directly or by calling other nested functions that use them.
 *
 * <p>The result is the least fixed point of
 *
 * <pre>
 * captures(f) = direct(f) ∪ ⋃ { visible_f(captures(g)) | f calls nested g }
 * </pre>
 *
 * where {@code visible_f} keeps the variables owned by a function that strictly encloses {@code f}.
 * Each round recomputes every nested function's uses against the capture sets committed so far,
 * so a call to a function still being resolved in a cycle (including a recursive call) contributes
 * whatever that function has accumulated, and the next round picks up the rest. Capture sets only
 * grow, and are bounded by the variables in scope, so the iteration terminates.
 *
 * <p>The tree is not modified. The analysis must run to completion before any rewriting, since the
 * lifted formals and the actuals at every call are both derived from its result.
 */
final class CaptureAnalysis {
  private static final Logger logger = Logger.getLogger(CaptureAnalysis.class.getName());

  private final AbstractCompiler compiler;
  private final SymbolTable symbolTable;

  /**
   * The references of each nested function's own body, in source order: a {@link VarSymbol} for a
   * use of a variable it could capture, a {@link FunctionSymbol} for a call to a nested function.
   */
  private final Map<FunctionSymbol, ImmutableList<Symbol>> references = new LinkedHashMap<>();

  /** Capture sets committed so far. Insertion order is discovery order. */
  private final Map<FunctionSymbol, LinkedHashSet<VarSymbol>> captures = new LinkedHashMap<>();

  CaptureAnalysis(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.symbolTable = compiler.getSymbolTable();
  }

  CaptureSets analyze(Node root) {
    checkArgument(root.isModule(), root);

    for (Node function : NodeUtil.getFunctionDefinitions(root)) {
      FunctionSymbol fn = NodeUtil.getFunctionSymbol(function);
      if (symbolTable.hasEnclosingFunction(fn)) {
        captures.put(fn, new LinkedHashSet<>());
      }
    }
    for (FunctionSymbol fn : captures.keySet()) {
      references.put(fn, collectReferences(fn));
    }

    int maxRounds = captures.size() * symbolTable.size() + 1;
    int rounds = 0;
    boolean changed;
    do {
      rounds++;
      if (rounds > maxRounds) {
        compiler.throwInternalError(
            "Capture analysis did not reach a fixed point after " + maxRounds + " rounds", null);
      }
      changed = runRound();
    } while (changed);

    ImmutableMap.Builder<FunctionSymbol, ImmutableList<VarSymbol>> result =
        ImmutableMap.builder();
    for (Map.Entry<FunctionSymbol, LinkedHashSet<VarSymbol>> entry : captures.entrySet()) {
      result.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Captures of " + entry.getKey().getQualifiedName() + ": " + entry.getValue());
      }
    }
    logger.fine("Analyzed " + captures.size() + " nested functions in " + rounds + " rounds");
    return new CaptureSets(result.buildOrThrow(), rounds);
  }

  /** Recomputes every capture set once. Returns whether any set gained a member. */
  private boolean runRound() {
    boolean changed = false;
    for (Map.Entry<FunctionSymbol, LinkedHashSet<VarSymbol>> entry : captures.entrySet()) {
      FunctionSymbol fn = entry.getKey();
      Set<VarSymbol> uses = computeUses(fn);
      // Membership, not size, decides whether the round changed anything.
      if (entry.getValue().addAll(uses)) {
        changed = true;
      }
    }
    return changed;
  }

  private Set<VarSymbol> computeUses(FunctionSymbol fn) {
    Set<VarSymbol> uses = new LinkedHashSet<>();
    for (Symbol reference : references.get(fn)) {
      if (reference.isVariable()) {
        uses.add(reference.toVariable());
        continue;
      }
      for (VarSymbol var : captures.get(reference.toFunction())) {
        if (symbolTable.isCapturableFrom(var, fn)) {
          uses.add(var);
        }
      }
    }
    return uses;
  }

  private ImmutableList<Symbol> collectReferences(FunctionSymbol fn) {
    ImmutableList.Builder<Symbol> result = ImmutableList.builder();
    collectReferences(fn, NodeUtil.getFunctionBody(symbolTable.getDefiningStatement(fn)), result);
    return result.build();
  }

  private void collectReferences(FunctionSymbol fn, Node n, ImmutableList.Builder<Symbol> result) {
    switch (n.getToken()) {
      case FUNCTION:
        // A nested definition reaches fn's captures only through calls to it.
        return;
      case NAME:
        Symbol symbol = n.getSymbol();
        if (symbol.isVariable()) {
          if (symbolTable.isCapturableFrom(symbol.toVariable(), fn)) {
            result.add(symbol);
          }
        } else if (captures.containsKey(symbol.toFunction())) {
          result.add(symbol);
        }
        break;
      default:
        break;
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      collectReferences(fn, child, result);
    }
  }
}
