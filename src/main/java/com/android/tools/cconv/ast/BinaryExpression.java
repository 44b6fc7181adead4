// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class BinaryExpression extends Expression {

  private final BinaryOperator operator;
  private final Expression left;
  private final Expression right;

  BinaryExpression(
      CType type,
      BinaryOperator operator,
      Expression left,
      Expression right,
      SourceLocation location) {
    super(type, location);
    this.operator = operator;
    this.left = left;
    this.right = right;
  }

  public BinaryOperator getOperator() {
    return operator;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.BINARY;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    consumer.accept(left);
    consumer.accept(right);
  }

  @Override
  public boolean isBinary() {
    return true;
  }

  @Override
  public BinaryExpression asBinary() {
    return this;
  }

  @Override
  public String toString() {
    return left + " " + operator.getSymbol() + " " + right;
  }
}
