// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class ConditionalExpression extends Expression {

  private final Expression condition;
  private final Expression trueExpression;
  private final Expression falseExpression;

  ConditionalExpression(
      CType type,
      Expression condition,
      Expression trueExpression,
      Expression falseExpression,
      SourceLocation location) {
    super(type, location);
    this.condition = condition;
    this.trueExpression = trueExpression;
    this.falseExpression = falseExpression;
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getTrueExpression() {
    return trueExpression;
  }

  public Expression getFalseExpression() {
    return falseExpression;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.CONDITIONAL;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    consumer.accept(condition);
    consumer.accept(trueExpression);
    consumer.accept(falseExpression);
  }

  @Override
  public boolean isConditional() {
    return true;
  }

  @Override
  public ConditionalExpression asConditional() {
    return this;
  }
}
