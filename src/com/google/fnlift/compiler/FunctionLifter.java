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
import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.Intent;
import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.SymbolTable;
import com.google.fnlift.ast.VarSymbol;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves one nested function definition to the end of the module, turning each variable it captures
 * into an extra by-reference parameter.
 */
final class FunctionLifter {
  private static final Logger logger = Logger.getLogger(FunctionLifter.class.getName());

  private final AbstractCompiler compiler;
  private final SymbolTable symbolTable;
  private final CaptureSets captureSets;
  private final PendingCallTargets pendingCallTargets;
  private final LiftedFunctionMap.Builder liftedFunctionMap;
  private final LiftedFunctionNamingPolicy namingPolicy;

  FunctionLifter(
      AbstractCompiler compiler,
      CaptureSets captureSets,
      PendingCallTargets pendingCallTargets,
      LiftedFunctionMap.Builder liftedFunctionMap) {
    this.compiler = compiler;
    this.symbolTable = compiler.getSymbolTable();
    this.captureSets = captureSets;
    this.pendingCallTargets = pendingCallTargets;
    this.liftedFunctionMap = liftedFunctionMap;
    this.namingPolicy = compiler.getOptions().getLiftedFunctionNaming();
  }

  /**
   * Lifts the nested function defined by {@code definition}, which must not contain nested
   * definitions of its own any more.
   *
   * @return the new module-level definition
   */
  Node lift(Node definition) {
    checkArgument(NodeUtil.isNestedFunctionDefinition(definition), definition);
    FunctionSymbol original = NodeUtil.getFunctionSymbol(definition);
    ImmutableList<VarSymbol> captures = captureSets.get(original);
    if (captures == null) {
      compiler.throwInternalError(
          "No capture set computed for nested function " + original.getQualifiedName(), null);
      return definition;
    }
    Node module = NodeUtil.getRoot(definition);
    checkArgument(module.isModule(), "Definition not attached to a module: %s", definition);

    Node copy = definition.cloneTree();
    FunctionSymbol lifted =
        symbolTable.declareLiftedFunction(original, namingPolicy.getLiftedName(original));
    copy.getFirstChild().setSymbol(lifted);
    lifted.setDefinition(copy);

    Map<VarSymbol, VarSymbol> capturedToFormal = new LinkedHashMap<>();
    Set<String> usedNames = new HashSet<>();
    for (VarSymbol var : symbolTable.getVariablesOwnedBy(original)) {
      usedNames.add(var.getName());
    }
    Node params = NodeUtil.getFunctionParameters(copy);
    for (VarSymbol var : captures) {
      String name = uniqueName(var.getName(), usedNames);
      VarSymbol formal = symbolTable.declareFormal(name, var.getType(), Intent.REF, lifted);
      params.addChildToBack(Node.newName(formal));
      capturedToFormal.put(var, formal);
    }
    if (!capturedToFormal.isEmpty()) {
      SymbolSubstitution.forAllNames(capturedToFormal)
          .apply(compiler, NodeUtil.getFunctionBody(copy));
    }

    // The original's formals and locals now live in the frame of the lifted function.
    symbolTable.transferVariables(original, lifted);

    module.addChildToBack(copy);
    pendingCallTargets.recordLift(original, lifted);
    definition.detach();
    liftedFunctionMap.add(original, lifted, captures);
    compiler.reportCodeChange();

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Lifted " + original.getQualifiedName() + " to " + lifted + " capturing " + captures);
    }
    return copy;
  }

  private static String uniqueName(String name, Set<String> usedNames) {
    String candidate = name;
    for (int suffix = 1; !usedNames.add(candidate); suffix++) {
      candidate = name + "$" + suffix;
    }
    return candidate;
  }
}
