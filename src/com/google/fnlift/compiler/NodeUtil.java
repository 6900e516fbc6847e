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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.Symbol;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  public static FunctionSymbol getFunctionSymbol(Node function) {
    checkArgument(function.isFunction(), function);
    return function.getFirstChild().getSymbol().toFunction();
  }

  public static Node getFunctionParameters(Node function) {
    checkArgument(function.isFunction(), function);
    return function.getSecondChild();
  }

  public static Node getFunctionBody(Node function) {
    checkArgument(function.isFunction(), function);
    return function.getLastChild();
  }

  /** Whether {@code n} defines a function declared inside another function. */
  public static boolean isNestedFunctionDefinition(Node n) {
    return n.isFunction() && getFunctionSymbol(n).hasEnclosingFunction();
  }

  /** Returns the function a CALL statically resolves to. */
  public static FunctionSymbol getCallTarget(Node call) {
    checkArgument(call.isCall(), call);
    Symbol target = call.getFirstChild().getSymbol();
    checkState(target != null && target.isFunction(), "Unresolved call target: %s", call);
    return target.toFunction();
  }

  /** The actual arguments of a CALL, in order. */
  public static ImmutableList<Node> getCallArguments(Node call) {
    checkArgument(call.isCall(), call);
    ImmutableList.Builder<Node> args = ImmutableList.builder();
    for (Node arg = call.getSecondChild(); arg != null; arg = arg.getNext()) {
      args.add(arg);
    }
    return args.build();
  }

  /** Whether {@code n} is the NAME naming the function invoked by its parent CALL. */
  public static boolean isCallTarget(Node n) {
    Node parent = n.getParent();
    return n.isName() && parent != null && parent.isCall() && parent.getFirstChild() == n;
  }

  /** Gets the closest ancestor FUNCTION node, or null at module level. */
  public static @Nullable Node getEnclosingFunction(Node n) {
    for (Node ancestor = n.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
      if (ancestor.isFunction()) {
        return ancestor;
      }
    }
    return null;
  }

  /** Returns the root of the tree containing {@code n}. */
  public static Node getRoot(Node n) {
    Node root = n;
    while (root.getParent() != null) {
      root = root.getParent();
    }
    return root;
  }

  /** All FUNCTION nodes under {@code root}, in source order (outer before inner). */
  public static ImmutableList<Node> getFunctionDefinitions(Node root) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    collectFunctionDefinitions(root, result);
    return result.build();
  }

  private static void collectFunctionDefinitions(Node n, ImmutableList.Builder<Node> result) {
    if (n.isFunction()) {
      result.add(n);
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      collectFunctionDefinitions(child, result);
    }
  }
}
