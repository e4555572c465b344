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

package com.google.markup.syntax;

/** A binary operator. */
public enum BinaryOp {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  AND("and"),
  OR("or"),
  EQ("=="),
  NEQ("!="),
  LT("<"),
  LEQ("<="),
  GT(">"),
  GEQ(">="),
  ASSIGN("="),
  ADD_ASSIGN("+="),
  SUB_ASSIGN("-="),
  MUL_ASSIGN("*="),
  DIV_ASSIGN("/=");

  private final String symbol;

  BinaryOp(String symbol) {
    this.symbol = symbol;
  }

  /** The operator as written in source. */
  public String getSymbol() {
    return symbol;
  }

  /** Whether this operator assigns to its left-hand side. */
  public boolean isAssignment() {
    switch (this) {
      case ASSIGN:
      case ADD_ASSIGN:
      case SUB_ASSIGN:
      case MUL_ASSIGN:
      case DIV_ASSIGN:
        return true;
      default:
        return false;
    }
  }
}
