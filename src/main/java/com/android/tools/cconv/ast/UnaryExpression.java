// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class UnaryExpression extends Expression {

  private final UnaryOperator operator;
  private final Expression operand;

  UnaryExpression(CType type, UnaryOperator operator, Expression operand, SourceLocation location) {
    super(type, location);
    this.operator = operator;
    this.operand = operand;
  }

  public UnaryOperator getOperator() {
    return operator;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.UNARY;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    consumer.accept(operand);
  }

  @Override
  public boolean isUnary() {
    return true;
  }

  @Override
  public UnaryExpression asUnary() {
    return this;
  }

  @Override
  public String toString() {
    return operator.isPostfix()
        ? operand + operator.getSymbol()
        : operator.getSymbol() + operand;
  }
}
