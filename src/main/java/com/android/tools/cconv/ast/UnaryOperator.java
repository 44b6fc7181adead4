// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public enum UnaryOperator {
  ADDRESS_OF("&"),
  DEREFERENCE("*"),
  PRE_INCREMENT("++"),
  PRE_DECREMENT("--"),
  POST_INCREMENT("++"),
  POST_DECREMENT("--"),
  PLUS("+"),
  MINUS("-"),
  NOT("~"),
  LOGICAL_NOT("!");

  private final String symbol;

  UnaryOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isIncrementOrDecrement() {
    return this == PRE_INCREMENT
        || this == PRE_DECREMENT
        || this == POST_INCREMENT
        || this == POST_DECREMENT;
  }

  public boolean isPostfix() {
    return this == POST_INCREMENT || this == POST_DECREMENT;
  }
}
