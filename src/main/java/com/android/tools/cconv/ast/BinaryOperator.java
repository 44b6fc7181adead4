// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public enum BinaryOperator {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  REM("%"),
  SHL("<<"),
  SHR(">>"),
  LT("<"),
  GT(">"),
  LE("<="),
  GE(">="),
  EQ("=="),
  NE("!="),
  BIT_AND("&"),
  BIT_OR("|"),
  BIT_XOR("^"),
  LOGICAL_AND("&&"),
  LOGICAL_OR("||"),
  ASSIGN("="),
  ADD_ASSIGN("+="),
  SUB_ASSIGN("-="),
  MUL_ASSIGN("*="),
  DIV_ASSIGN("/="),
  COMMA(",");

  private final String symbol;

  BinaryOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isAssignment() {
    return this == ASSIGN || isCompoundAssignment();
  }

  public boolean isCompoundAssignment() {
    return this == ADD_ASSIGN || this == SUB_ASSIGN || this == MUL_ASSIGN || this == DIV_ASSIGN;
  }

  public boolean isAdditive() {
    return this == ADD || this == SUB;
  }

  public boolean isPointerArithmeticAssignment() {
    return this == ADD_ASSIGN || this == SUB_ASSIGN;
  }

  public boolean isEquality() {
    return this == EQ || this == NE;
  }

  public boolean isComparison() {
    return isEquality() || this == LT || this == GT || this == LE || this == GE;
  }

  public boolean isLogical() {
    return this == LOGICAL_AND || this == LOGICAL_OR;
  }
}
