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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node of the abstract syntax tree.
 *
 * <p>The shape of the tree for each {@link Token}:
 *
 * <pre>
 * MODULE       statements...
 * FUNCTION     NAME(fn) PARAM_LIST BLOCK
 * PARAM_LIST   NAME(formal)...
 * BLOCK        statements...
 * VAR          NAME(var) [initializer as child of NAME]
 * EXPR_RESULT  expr
 * RETURN       [expr]
 * IF           cond BLOCK [BLOCK]
 * WHILE        cond BLOCK
 * CALL         NAME(fn) args...
 * ASSIGN       NAME(var) expr
 * </pre>
 *
 * NAME nodes carry a resolved {@link Symbol}; NUMBER nodes carry a value.
 */
public class Node {

  private final Token token;
  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node last;
  private @Nullable Node next;
  private @Nullable Node previous;

  private @Nullable Symbol symbol;
  private long number;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newNumber(long value) {
    Node n = new Node(Token.NUMBER);
    n.number = value;
    return n;
  }

  public static Node newName(Symbol symbol) {
    Node n = new Node(Token.NAME);
    n.symbol = checkNotNull(symbol);
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return last;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final int getChildCount() {
    int count = 0;
    for (Node n = first; n != null; n = n.next) {
      count++;
    }
    return count;
  }

  public final Node getChildAtIndex(int i) {
    checkArgument(i >= 0, "Negative index %s", i);
    Node n = first;
    while (i > 0) {
      checkState(n != null, "Index out of bounds");
      n = n.next;
      i--;
    }
    checkState(n != null, "Index out of bounds");
    return n;
  }

  /** Gets the index of a child, or -1 if {@code child} is not a child of this node. */
  public final int getIndexOfChild(Node child) {
    int i = 0;
    for (Node n = first; n != null; n = n.next) {
      if (n == child) {
        return i;
      }
      i++;
    }
    return -1;
  }

  /** Iterates over the children. The current child may be detached during iteration. */
  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node cursor = first;

          @Override
          public boolean hasNext() {
            return cursor != null;
          }

          @Override
          public Node next() {
            if (cursor == null) {
              throw new NoSuchElementException();
            }
            Node result = cursor;
            cursor = cursor.next;
            return result;
          }
        };
  }

  public final void addChildToFront(Node child) {
    checkDetached(child);
    child.parent = this;
    child.next = first;
    if (first == null) {
      last = child;
    } else {
      first.previous = child;
    }
    first = child;
  }

  public final void addChildToBack(Node child) {
    checkDetached(child);
    child.parent = this;
    child.previous = last;
    if (last == null) {
      first = child;
    } else {
      last.next = child;
    }
    last = child;
  }

  /** Inserts this detached node into {@code existing}'s parent, right after it. */
  public final void insertAfter(Node existing) {
    Node existingParent = existing.parent;
    checkState(existingParent != null, "Has no parent: %s", existing);
    checkDetached(this);
    this.parent = existingParent;
    this.previous = existing;
    this.next = existing.next;
    if (existing.next == null) {
      existingParent.last = this;
    } else {
      existing.next.previous = this;
    }
    existing.next = this;
  }

  /** Replaces this node with the detached node {@code replacement}. */
  public final void replaceWith(Node replacement) {
    Node existingParent = this.parent;
    checkState(existingParent != null, "Has no parent: %s", this);
    checkDetached(replacement);

    replacement.parent = existingParent;
    replacement.previous = this.previous;
    replacement.next = this.next;
    if (this.previous == null) {
      existingParent.first = replacement;
    } else {
      this.previous.next = replacement;
    }
    if (this.next == null) {
      existingParent.last = replacement;
    } else {
      this.next.previous = replacement;
    }
    this.parent = null;
    this.previous = null;
    this.next = null;
  }

  /** Removes this node from its parent, but retains its subtree. */
  public final Node detach() {
    Node existingParent = this.parent;
    checkState(existingParent != null, "Has no parent: %s", this);
    if (previous == null) {
      existingParent.first = next;
    } else {
      previous.next = next;
    }
    if (next == null) {
      existingParent.last = previous;
    } else {
      next.previous = previous;
    }
    parent = null;
    next = null;
    previous = null;
    return this;
  }

  private static void checkDetached(Node n) {
    checkArgument(n.parent == null, "Cannot add already-owned child node: %s", n);
    checkArgument(n.next == null && n.previous == null, "Node has siblings: %s", n);
  }

  public final @Nullable Symbol getSymbol() {
    return symbol;
  }

  public final void setSymbol(Symbol symbol) {
    checkState(token == Token.NAME, "Only NAME nodes carry symbols: %s", this);
    this.symbol = checkNotNull(symbol);
  }

  public final long getNumber() {
    checkState(token == Token.NUMBER, "Not a NUMBER: %s", this);
    return number;
  }

  /** Returns a detached clone of the Node, specifically excluding its children. */
  @CheckReturnValue
  public final Node cloneNode() {
    Node clone = new Node(token);
    clone.symbol = symbol;
    clone.number = number;
    return clone;
  }

  /**
   * Returns a detached clone of the Node and all its children. Symbols are shared with the
   * original, not copied.
   */
  @CheckReturnValue
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node child = first; child != null; child = child.next) {
      result.addChildToBack(child.cloneTree());
    }
    return result;
  }

  /** Whether this tree and {@code other} have the same shape, symbols and values. */
  public final boolean isEquivalentTo(Node other) {
    if (token != other.token || symbol != other.symbol || number != other.number) {
      return false;
    }
    Node a = first;
    Node b = other.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  public final boolean isModule() {
    return token == Token.MODULE;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isWhile() {
    return token == Token.WHILE;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (symbol != null) {
      sb.append(' ').append(symbol);
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    }
    return sb.toString();
  }

  @CheckReturnValue
  public final String toStringTree() {
    StringBuilder s = new StringBuilder();
    try {
      appendStringTree(s);
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
    return s.toString();
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
