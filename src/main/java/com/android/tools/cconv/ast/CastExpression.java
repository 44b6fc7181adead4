// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class CastExpression extends Expression {

  private final Expression operand;
  private final boolean isImplicit;

  CastExpression(CType type, Expression operand, boolean isImplicit, SourceLocation location) {
    super(type, location);
    this.operand = operand;
    this.isImplicit = isImplicit;
  }

  public Expression getOperand() {
    return operand;
  }

  public boolean isImplicit() {
    return isImplicit;
  }

  @Override
  public ExpressionKind getKind() {
    return isImplicit ? ExpressionKind.IMPLICIT_CAST : ExpressionKind.EXPLICIT_CAST;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    consumer.accept(operand);
  }

  @Override
  public boolean isCast() {
    return true;
  }

  @Override
  public CastExpression asCast() {
    return this;
  }

  @Override
  public String toString() {
    return isImplicit ? operand.toString() : "(" + getType() + ") " + operand;
  }
}
