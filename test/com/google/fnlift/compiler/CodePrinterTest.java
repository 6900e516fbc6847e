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

import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.IR;
import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.SymbolTable;
import com.google.fnlift.ast.Token;
import com.google.fnlift.ast.VarSymbol;
import com.google.fnlift.testing.TestParser;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CodePrinter}. */
@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private VarSymbol x;
  private FunctionSymbol f;

  @Before
  public void setUp() {
    SymbolTable symbols = new SymbolTable();
    f = symbols.declareFunction("f", "int", null);
    x = symbols.declareVariable("x", "int", f);
  }

  private void assertPrintSame(String source) {
    assertThat(CodePrinter.print(TestParser.parse(source).getRoot())).isEqualTo(source);
  }

  private static Node num(long value) {
    return IR.number(value);
  }

  @Test
  public void testStatements() {
    assertPrintSame(
        """
        var total: int = 0;
        fn f(n: int, ref out: int): int {
          var i: int = 0;
          while (i < n) {
            i = i + 1;
          }
          if (i == n) {
            out = i;
          } else {
            return 0;
          }
          return out;
        }
        """);
  }

  @Test
  public void testVoidReturnTypeIsImplicit() {
    assertPrintSame(
        """
        fn f() {
          return;
        }
        """);
  }

  @Test
  public void testEmptyBlocks() {
    assertPrintSame(
        """
        fn f() {}
        fn g(): int {
          while (0) {}
          return 1;
        }
        """);
  }

  @Test
  public void testNestedFunctionsAreIndented() {
    assertPrintSame(
        """
        fn f() {
          fn g() {
            fn h() {}
            h();
          }
          g();
        }
        """);
  }

  @Test
  public void testLeftAssociativity() {
    Node leftNested = IR.binaryOp(Token.SUB, IR.binaryOp(Token.SUB, num(1), num(2)), num(3));
    Node rightNested = IR.binaryOp(Token.SUB, num(1), IR.binaryOp(Token.SUB, num(2), num(3)));

    assertThat(CodePrinter.print(leftNested)).isEqualTo("1 - 2 - 3");
    assertThat(CodePrinter.print(rightNested)).isEqualTo("1 - (2 - 3)");
  }

  @Test
  public void testPrecedence() {
    Node sumTimes = IR.binaryOp(Token.MUL, IR.binaryOp(Token.ADD, num(1), num(2)), num(3));
    Node plusProduct = IR.binaryOp(Token.ADD, num(1), IR.binaryOp(Token.MUL, num(2), num(3)));
    Node comparison =
        IR.binaryOp(
            Token.EQ,
            IR.binaryOp(Token.LT, IR.name(x), num(1)),
            IR.binaryOp(Token.DIV, num(4), num(2)));

    assertThat(CodePrinter.print(sumTimes)).isEqualTo("(1 + 2) * 3");
    assertThat(CodePrinter.print(plusProduct)).isEqualTo("1 + 2 * 3");
    assertThat(CodePrinter.print(comparison)).isEqualTo("x < 1 == 4 / 2");
  }

  @Test
  public void testUnaryOperators() {
    Node negatedSum = IR.unaryOp(Token.NEG, IR.binaryOp(Token.ADD, IR.name(x), num(1)));
    Node notNot = IR.unaryOp(Token.NOT, IR.unaryOp(Token.NOT, IR.name(x)));

    assertThat(CodePrinter.print(negatedSum)).isEqualTo("-(x + 1)");
    assertThat(CodePrinter.print(notNot)).isEqualTo("!!x");
  }

  @Test
  public void testAssignmentAndCall() {
    Node stmt =
        IR.exprResult(IR.assign(x, IR.call(f, IR.name(x), IR.binaryOp(Token.ADD, num(1), num(2)))));
    assertThat(CodePrinter.print(stmt)).isEqualTo("x = f(x, 1 + 2);\n");
  }
}
