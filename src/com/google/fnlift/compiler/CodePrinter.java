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

import com.google.fnlift.ast.FunctionSymbol;
import com.google.fnlift.ast.Intent;
import com.google.fnlift.ast.Node;
import com.google.fnlift.ast.Token;
import com.google.fnlift.ast.VarSymbol;

/**
 * Prints an AST as source text: one statement per line, two-space indentation, and only the
 * parentheses operator precedence requires.
 */
public final class CodePrinter {

  private static final String INDENT = "  ";

  /** The return type that is left implicit in printed function headers. */
  static final String VOID = "void";

  private final StringBuilder sb = new StringBuilder();
  private int indent = 0;

  private CodePrinter() {}

  public static String print(Node n) {
    CodePrinter printer = new CodePrinter();
    if (n.isModule()) {
      for (Node stmt = n.getFirstChild(); stmt != null; stmt = stmt.getNext()) {
        printer.printStatement(stmt);
      }
    } else if (n.getToken().isStatement()) {
      printer.printStatement(n);
    } else {
      printer.printExpression(n, 0);
    }
    return printer.sb.toString();
  }

  private void startLine() {
    for (int i = 0; i < indent; i++) {
      sb.append(INDENT);
    }
  }

  private void printStatement(Node n) {
    startLine();
    switch (n.getToken()) {
      case FUNCTION:
        printFunction(n);
        break;
      case BLOCK:
        printBlock(n);
        sb.append('\n');
        break;
      case VAR:
        printVar(n);
        break;
      case EXPR_RESULT:
        printExpression(n.getFirstChild(), 0);
        sb.append(";\n");
        break;
      case RETURN:
        sb.append("return");
        if (n.hasChildren()) {
          sb.append(' ');
          printExpression(n.getFirstChild(), 0);
        }
        sb.append(";\n");
        break;
      case IF:
        sb.append("if (");
        printExpression(n.getFirstChild(), 0);
        sb.append(") ");
        printBlock(n.getSecondChild());
        if (n.getChildCount() == 3) {
          sb.append(" else ");
          printBlock(n.getLastChild());
        }
        sb.append('\n');
        break;
      case WHILE:
        sb.append("while (");
        printExpression(n.getFirstChild(), 0);
        sb.append(") ");
        printBlock(n.getLastChild());
        sb.append('\n');
        break;
      default:
        throw new IllegalStateException("Not a statement: " + n);
    }
  }

  private void printFunction(Node n) {
    FunctionSymbol fn = NodeUtil.getFunctionSymbol(n);
    sb.append("fn ").append(fn.getName()).append('(');
    boolean first = true;
    for (Node param = NodeUtil.getFunctionParameters(n).getFirstChild();
        param != null;
        param = param.getNext()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      VarSymbol formal = param.getSymbol().toVariable();
      if (formal.getIntent() != Intent.IN) {
        sb.append(formal.getIntent().getKeyword()).append(' ');
      }
      sb.append(formal.getName()).append(": ").append(formal.getType());
    }
    sb.append(')');
    if (!fn.getReturnType().equals(VOID)) {
      sb.append(": ").append(fn.getReturnType());
    }
    sb.append(' ');
    printBlock(NodeUtil.getFunctionBody(n));
    sb.append('\n');
  }

  /** Prints a braced block starting at the current position, without a trailing newline. */
  private void printBlock(Node block) {
    if (!block.hasChildren()) {
      sb.append("{}");
      return;
    }
    sb.append("{\n");
    indent++;
    for (Node stmt = block.getFirstChild(); stmt != null; stmt = stmt.getNext()) {
      printStatement(stmt);
    }
    indent--;
    startLine();
    sb.append('}');
  }

  private void printVar(Node n) {
    Node name = n.getFirstChild();
    VarSymbol var = name.getSymbol().toVariable();
    sb.append("var ").append(var.getName()).append(": ").append(var.getType());
    if (name.hasChildren()) {
      sb.append(" = ");
      printExpression(name.getFirstChild(), 0);
    }
    sb.append(";\n");
  }

  private void printExpression(Node n, int minPrecedence) {
    int precedence = precedence(n.getToken());
    boolean parenthesize = precedence < minPrecedence;
    if (parenthesize) {
      sb.append('(');
    }
    switch (n.getToken()) {
      case NAME:
        sb.append(n.getSymbol().getName());
        break;
      case NUMBER:
        sb.append(n.getNumber());
        break;
      case CALL:
        sb.append(n.getFirstChild().getSymbol().getName()).append('(');
        for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
          printExpression(arg, 0);
          if (arg.getNext() != null) {
            sb.append(", ");
          }
        }
        sb.append(')');
        break;
      case ASSIGN:
        printExpression(n.getFirstChild(), precedence + 1);
        sb.append(" = ");
        // Right associative.
        printExpression(n.getLastChild(), precedence);
        break;
      case NOT:
      case NEG:
        sb.append(n.getToken() == Token.NOT ? "!" : "-");
        printExpression(n.getFirstChild(), precedence);
        break;
      default:
        if (!n.getToken().isBinaryOperator()) {
          throw new IllegalStateException("Not an expression: " + n);
        }
        // Left associative.
        printExpression(n.getFirstChild(), precedence);
        sb.append(' ').append(operator(n.getToken())).append(' ');
        printExpression(n.getLastChild(), precedence + 1);
        break;
    }
    if (parenthesize) {
      sb.append(')');
    }
  }

  private static int precedence(Token token) {
    switch (token) {
      case ASSIGN:
        return 1;
      case EQ:
      case NE:
        return 2;
      case LT:
      case GT:
        return 3;
      case ADD:
      case SUB:
        return 4;
      case MUL:
      case DIV:
        return 5;
      case NOT:
      case NEG:
        return 6;
      default:
        return 7;
    }
  }

  static String operator(Token token) {
    switch (token) {
      case ADD:
        return "+";
      case SUB:
        return "-";
      case MUL:
        return "*";
      case DIV:
        return "/";
      case LT:
        return "<";
      case GT:
        return ">";
      case EQ:
        return "==";
      case NE:
        return "!=";
      default:
        throw new IllegalArgumentException("Not a binary operator: " + token);
    }
  }
}
