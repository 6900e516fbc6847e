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
import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node module(Node... stmts) {
    Node module = new Node(Token.MODULE);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Module cannot contain %s", stmt.getToken());
      module.addChildToBack(stmt);
    }
    return module;
  }

  /** Creates a FUNCTION node and binds it as the definition of {@code fn}. */
  public static Node function(FunctionSymbol fn, Node params, Node body) {
    checkState(params.isParamList());
    checkState(body.isBlock());
    Node function = new Node(Token.FUNCTION, Node.newName(fn), params, body);
    fn.setDefinition(function);
    return function;
  }

  public static Node paramList(VarSymbol... formals) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (VarSymbol formal : formals) {
      checkArgument(formal.isFormal(), "Not a formal: %s", formal);
      paramList.addChildToBack(Node.newName(formal));
    }
    return paramList;
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  public static Node var(VarSymbol var) {
    checkArgument(!var.isFormal(), "Cannot declare formal %s with VAR", var);
    return new Node(Token.VAR, Node.newName(var));
  }

  public static Node var(VarSymbol var, Node value) {
    checkState(mayBeExpression(value));
    Node name = Node.newName(var);
    name.addChildToBack(value);
    checkArgument(!var.isFormal(), "Cannot declare formal %s with VAR", var);
    return new Node(Token.VAR, name);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond));
    checkState(body.isBlock());
    return new Node(Token.WHILE, cond, body);
  }

  public static Node name(Symbol symbol) {
    return Node.newName(symbol);
  }

  public static Node call(FunctionSymbol target, Node... args) {
    Node call = new Node(Token.CALL, Node.newName(target));
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node assign(VarSymbol target, Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.ASSIGN, Node.newName(target), expr);
  }

  public static Node number(long value) {
    return Node.newNumber(value);
  }

  public static Node binaryOp(Token op, Node left, Node right) {
    checkArgument(op.isBinaryOperator(), "Not a binary operator: %s", op);
    checkState(mayBeExpression(left));
    checkState(mayBeExpression(right));
    return new Node(op, left, right);
  }

  public static Node unaryOp(Token op, Node operand) {
    checkArgument(op.isUnaryOperator(), "Not a unary operator: %s", op);
    checkState(mayBeExpression(operand));
    return new Node(op, operand);
  }

  static boolean mayBeStatement(Node n) {
    return n.getToken().isStatement();
  }

  static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
      case CALL:
      case ASSIGN:
      case NUMBER:
        return true;
      default:
        return n.getToken().isBinaryOperator() || n.getToken().isUnaryOperator();
    }
  }
}
