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
import com.google.fnlift.ast.Intent;
import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.Symbol;
import com.google.fnlift.ast.VarSymbol;
import org.jspecify.annotations.Nullable;

/**
 * A compiler pass that verifies a module has no nested functions left, and that the calls and
 * variable references of the lifted functions are consistent with their new signatures.
 */
public final class LiftedFormValidator implements CompilerPass {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;
  private final AbstractCompiler compiler;

  public LiftedFormValidator(AbstractCompiler compiler, ViolationHandler handler) {
    this.compiler = compiler;
    this.violationHandler = handler;
  }

  public LiftedFormValidator(AbstractCompiler compiler) {
    this(
        compiler,
        (message, n) ->
            compiler.throwInternalError(
                message + ". Reference node:\n" + n.toStringTree(), null));
  }

  @Override
  public void process(Node root) {
    if (!root.isModule()) {
      violation("Expected MODULE but was " + root.getToken(), root);
      return;
    }
    NodeTraversal.traversePostOrder(compiler, root, (t, n, parent) -> validate(t, root, n));
  }

  private void validate(NodeTraversal t, Node root, Node n) {
    switch (n.getToken()) {
      case FUNCTION:
        validateFunction(t, n);
        break;
      case CALL:
        validateCall(root, n);
        break;
      case NAME:
        if (!NodeUtil.isCallTarget(n) && !n.getParent().isFunction()) {
          validateVariableReference(t, n);
        }
        break;
      default:
        break;
    }
  }

  private void validateFunction(NodeTraversal t, Node n) {
    FunctionSymbol fn = NodeUtil.getFunctionSymbol(n);
    if (t.getEnclosingFunction() != null) {
      violation("Function " + fn + " is still nested in " + t.getEnclosingFunctionSymbol(), n);
    } else if (fn.hasEnclosingFunction()) {
      violation("Function " + fn + " was declared nested but is defined at module level", n);
    } else if (fn.isLifted()) {
      violation("Function " + fn + " was replaced by " + fn.getLiftedReplacement(), n);
    } else if (!fn.hasDefinition() || fn.getDefinition() != n) {
      violation("Function " + fn + " is not bound to this definition", n);
    }
  }

  private void validateCall(Node root, Node call) {
    Symbol target = call.getFirstChild().getSymbol();
    if (target == null || !target.isFunction()) {
      violation("Unresolved call target", call);
      return;
    }
    FunctionSymbol fn = target.toFunction();
    if (fn.isLifted()) {
      violation("Call to " + fn + ", which was replaced by " + fn.getLiftedReplacement(), call);
      return;
    }
    if (!fn.hasDefinition() || fn.getDefinition().getParent() != root) {
      violation("Call to " + fn + ", which is not defined at module level", call);
      return;
    }

    ImmutableList<VarSymbol> formals = fn.getFormals();
    ImmutableList<Node> actuals = NodeUtil.getCallArguments(call);
    if (formals.size() != actuals.size()) {
      violation(
          "Call to " + fn + " passes " + actuals.size() + " arguments for " + formals.size()
              + " parameters",
          call);
      return;
    }
    for (int i = 0; i < formals.size(); i++) {
      Node actual = actuals.get(i);
      if (formals.get(i).getIntent() == Intent.REF
          && !(actual.isName() && actual.getSymbol().isVariable())) {
        violation("Argument for ref parameter " + formals.get(i) + " is not a variable", actual);
      }
    }
  }

  private void validateVariableReference(NodeTraversal t, Node name) {
    Symbol symbol = name.getSymbol();
    if (symbol == null || !symbol.isVariable()) {
      violation("Expected a variable", name);
      return;
    }
    VarSymbol var = symbol.toVariable();
    @Nullable FunctionSymbol function = t.getEnclosingFunctionSymbol();
    if (!var.isModuleLevel() && var.getOwner() != function) {
      violation(
          "Variable " + var + " of " + var.getOwner() + " is free in "
              + (function == null ? "module scope" : function),
          name);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }
}
