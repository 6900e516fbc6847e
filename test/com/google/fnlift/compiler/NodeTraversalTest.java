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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.Token;
import com.google.fnlift.testing.ParsedModule;
import com.google.fnlift.testing.TestParser;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link NodeTraversal}. */
@RunWith(JUnit4.class)
public final class NodeTraversalTest {

  private static final String SOURCE =
      """
      fn f(): int {
        fn g(): int {
          return 1;
        }
        return g();
      }
      """;

  @Test
  public void testVisitOrder() {
    ParsedModule module = TestParser.parse("fn f() { g(); } fn g() {}");
    Compiler compiler = new Compiler(module.getSymbolTable());
    List<String> events = new ArrayList<>();

    NodeTraversal.traverse(
        compiler,
        module.getRoot(),
        new NodeTraversal.Callback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            events.add("pre " + n.getToken());
            return true;
          }

          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            events.add("post " + n.getToken());
          }
        });

    assertThat(events)
        .containsExactly(
            "pre MODULE",
            "pre FUNCTION",
            "pre NAME",
            "post NAME",
            "pre PARAM_LIST",
            "post PARAM_LIST",
            "pre BLOCK",
            "pre EXPR_RESULT",
            "pre CALL",
            "pre NAME",
            "post NAME",
            "post CALL",
            "post EXPR_RESULT",
            "post BLOCK",
            "post FUNCTION",
            "pre FUNCTION",
            "pre NAME",
            "post NAME",
            "pre PARAM_LIST",
            "post PARAM_LIST",
            "pre BLOCK",
            "post BLOCK",
            "post FUNCTION",
            "post MODULE")
        .inOrder();
  }

  @Test
  public void testShouldTraverseFalseSkipsSubtree() {
    ParsedModule module = TestParser.parse(SOURCE);
    Compiler compiler = new Compiler(module.getSymbolTable());
    List<Token> visited = new ArrayList<>();

    NodeTraversal.traverse(
        compiler,
        module.getRoot(),
        new NodeTraversal.Callback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            return !n.isFunction();
          }

          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            visited.add(n.getToken());
          }
        });

    assertThat(visited).containsExactly(Token.MODULE);
  }

  @Test
  public void testEnclosingFunction() {
    ParsedModule module = TestParser.parse(SOURCE);
    Compiler compiler = new Compiler(module.getSymbolTable());
    FunctionSymbol f = module.getFunction("f");
    FunctionSymbol g = module.getFunction("f$g");
    List<@Nullable FunctionSymbol> enclosingOfReturns = new ArrayList<>();
    List<@Nullable FunctionSymbol> enclosingOfFunctions = new ArrayList<>();

    NodeTraversal.traversePostOrder(
        compiler,
        module.getRoot(),
        (t, n, parent) -> {
          if (n.isReturn()) {
            enclosingOfReturns.add(t.getEnclosingFunctionSymbol());
          } else if (n.isFunction()) {
            enclosingOfFunctions.add(t.getEnclosingFunctionSymbol());
          }
        });

    assertThat(enclosingOfReturns).containsExactly(g, f).inOrder();
    assertThat(enclosingOfFunctions).containsExactly(f, null).inOrder();
  }

  @Test
  public void testEnclosingFunctionOfSubtreeRoot() {
    ParsedModule module = TestParser.parse(SOURCE);
    Compiler compiler = new Compiler(module.getSymbolTable());
    Node body = module.getFunction("f").getDefinition().getLastChild();
    List<@Nullable Node> enclosing = new ArrayList<>();

    NodeTraversal.traversePostOrder(
        compiler,
        body,
        (t, n, parent) -> {
          if (n == body) {
            enclosing.add(t.getEnclosingFunction());
          }
        });

    assertThat(enclosing).containsExactly(module.getFunction("f").getDefinition());
  }

  @Test
  public void testDetachingCurrentNodeContinuesWithSibling() {
    ParsedModule module = TestParser.parse("fn f() {} fn g() {} fn h() {}");
    Compiler compiler = new Compiler(module.getSymbolTable());
    List<String> visitedFunctions = new ArrayList<>();

    NodeTraversal.traversePostOrder(
        compiler,
        module.getRoot(),
        (t, n, parent) -> {
          if (n.isFunction()) {
            visitedFunctions.add(NodeUtil.getFunctionSymbol(n).getName());
            n.detach();
            t.reportCodeChange();
          }
        });

    assertThat(visitedFunctions).containsExactly("f", "g", "h").inOrder();
    assertThat(module.getRoot().hasChildren()).isFalse();
    assertThat(compiler.getChangeCount()).isEqualTo(3);
  }

  @Test
  public void testExceptionsBecomeInternalErrors() {
    ParsedModule module = TestParser.parse(SOURCE);
    Compiler compiler = new Compiler(module.getSymbolTable());
    IllegalStateException cause = new IllegalStateException("bad return");

    RuntimeException e =
        assertThrows(
            RuntimeException.class,
            () ->
                NodeTraversal.traversePostOrder(
                    compiler,
                    module.getRoot(),
                    (t, n, parent) -> {
                      if (n.isReturn()) {
                        throw cause;
                      }
                    }));

    assertThat(e).hasMessageThat().startsWith("INTERNAL COMPILER ERROR.");
    assertThat(e).hasMessageThat().contains("bad return\n  Node: RETURN");
    assertThat(e).hasMessageThat().contains("  Parent: BLOCK");
    assertThat(e).hasCauseThat().isSameInstanceAs(cause);
  }
}
