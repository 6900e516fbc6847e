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

import com.google.common.collect.ImmutableMap;
import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.Symbol;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Rebinds NAME nodes from one symbol to another throughout a subtree.
 *
 * <p>Used with a map from captured variables to the formals that replace them when a function
 * body is lifted, and with a map from nested functions to their lifted replacements to fix up call
 * targets.
 */
final class SymbolSubstitution extends NodeTraversal.AbstractPostOrderCallback {
  private final ImmutableMap<Symbol, Symbol> replacements;
  private final boolean callTargetsOnly;
  private int substitutionCount = 0;

  private SymbolSubstitution(Map<? extends Symbol, ? extends Symbol> replacements,
      boolean callTargetsOnly) {
    this.replacements = ImmutableMap.copyOf(replacements);
    this.callTargetsOnly = callTargetsOnly;
  }

  /** Substitutes every NAME whose symbol is a key of {@code replacements}. */
  static SymbolSubstitution forAllNames(Map<? extends Symbol, ? extends Symbol> replacements) {
    return new SymbolSubstitution(replacements, /* callTargetsOnly= */ false);
  }

  /** Substitutes only the NAMEs that are the target of a CALL. */
  static SymbolSubstitution forCallTargets(Map<? extends Symbol, ? extends Symbol> replacements) {
    return new SymbolSubstitution(replacements, /* callTargetsOnly= */ true);
  }

  /** Applies the substitution to {@code root} and returns the number of NAMEs rebound. */
  int apply(AbstractCompiler compiler, Node root) {
    int before = substitutionCount;
    if (!replacements.isEmpty()) {
      NodeTraversal.traverse(compiler, root, this);
    }
    return substitutionCount - before;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!n.isName() || (callTargetsOnly && !NodeUtil.isCallTarget(n))) {
      return;
    }
    Symbol replacement = replacements.get(n.getSymbol());
    if (replacement != null) {
      n.setSymbol(replacement);
      substitutionCount++;
      t.reportCodeChange();
    }
  }
}
