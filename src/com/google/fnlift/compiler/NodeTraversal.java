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

import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes in the parse tree, and facilitates the
 * transformations on the parse tree.
 */
public class NodeTraversal {
  private final AbstractCompiler compiler;
  private final Callback callback;

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** The FUNCTION nodes enclosing the current node, innermost first. */
  private final Deque<Node> functionStack = new ArrayDeque<>();

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns true, the node will be visited by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder and its children will be visited by both {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} in preorder and by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder.
     *
     * <p>Siblings are always visited left-to-right.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children).
     *
     * <p>Implementations can have side-effects (e.g. modify the parse tree). Removing the current
     * node is legal, and nodes appended after the current node's siblings are visited when the
     * traversal reaches them. Removing or reordering nodes above the current node may cause nodes
     * to be visited twice or not at all.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal nodeTraversal, Node n, Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in postorder. */
  @FunctionalInterface
  public static interface AbstractPostOrderCallbackInterface {
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  private NodeTraversal(AbstractCompiler compiler, Callback callback) {
    this.compiler = checkNotNull(compiler);
    this.callback = checkNotNull(callback);
  }

  /** Traverses using the given callback starting at {@code root}, which is visited as well. */
  public static void traverse(AbstractCompiler compiler, Node root, Callback cb) {
    new NodeTraversal(compiler, cb).traverse(root);
  }

  public static void traversePostOrder(
      AbstractCompiler compiler, Node root, AbstractPostOrderCallbackInterface cb) {
    traverse(
        compiler,
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            cb.visit(t, n, parent);
          }
        });
  }

  private void traverse(Node root) {
    try {
      functionStack.clear();
      for (Node ancestor = root.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
        if (ancestor.isFunction()) {
          functionStack.addLast(ancestor);
        }
      }
      traverseBranch(root, root.getParent());
    } catch (Error | Exception unexpectedException) {
      throwUnexpectedException(unexpectedException);
    }
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    boolean isFunction = n.isFunction();
    if (isFunction) {
      functionStack.push(n);
    }

    for (Node child = n.getFirstChild(); child != null; ) {
      // child could be replaced or removed while it is visited, so get the next one first.
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }

    if (isFunction) {
      functionStack.pop();
    }

    currentNode = n;
    callback.visit(this, n, parent);
  }

  private void throwUnexpectedException(Throwable unexpectedException) {
    // If there's an unexpected exception, try to get the node that caused it.
    String message = unexpectedException.getMessage();
    if (currentNode != null) {
      message =
          message
              + "\n"
              + formatNodeContext("Node", currentNode)
              + formatNodeContext("Parent", currentNode.getParent());
    }
    compiler.throwInternalError(message, unexpectedException);
  }

  private static String formatNodeContext(String label, @Nullable Node n) {
    if (n == null) {
      return "  " + label + ": NULL\n";
    }
    return "  " + label + ": " + n + "\n";
  }

  public AbstractCompiler getCompiler() {
    return compiler;
  }

  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** The innermost FUNCTION node containing the current node, or null at module level. */
  public @Nullable Node getEnclosingFunction() {
    // A FUNCTION node is on the stack while its children are visited, not while it is.
    return functionStack.peek();
  }

  public @Nullable FunctionSymbol getEnclosingFunctionSymbol() {
    Node function = getEnclosingFunction();
    return function == null ? null : NodeUtil.getFunctionSymbol(function);
  }

  public void reportCodeChange() {
    compiler.reportCodeChange();
  }
}
