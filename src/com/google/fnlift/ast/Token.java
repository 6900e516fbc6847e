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

/**
 * The kinds of {@link Node}. Every node carries exactly one token, and code that dispatches on node
 * kind switches over this enum.
 */
public enum Token {
  // Statements and structure.
  MODULE,
  FUNCTION,
  PARAM_LIST,
  BLOCK,
  VAR,
  EXPR_RESULT,
  RETURN,
  IF,
  WHILE,

  // Expressions.
  NAME,
  CALL,
  ASSIGN,
  NUMBER,
  ADD,
  SUB,
  MUL,
  DIV,
  LT,
  GT,
  EQ,
  NE,
  NOT,
  NEG;

  /** Whether nodes of this kind appear in statement position. */
  public boolean isStatement() {
    switch (this) {
      case FUNCTION:
      case BLOCK:
      case VAR:
      case EXPR_RESULT:
      case RETURN:
      case IF:
      case WHILE:
        return true;
      default:
        return false;
    }
  }

  /** Whether nodes of this kind are binary operators. */
  public boolean isBinaryOperator() {
    switch (this) {
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case LT:
      case GT:
      case EQ:
      case NE:
        return true;
      default:
        return false;
    }
  }

  /** Whether nodes of this kind are unary operators. */
  public boolean isUnaryOperator() {
    return this == NOT || this == NEG;
  }
}
