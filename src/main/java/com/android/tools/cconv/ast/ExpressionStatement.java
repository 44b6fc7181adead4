// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public final class ExpressionStatement extends Statement {

  private final Expression expression;

  ExpressionStatement(Expression expression, SourceLocation location) {
    super(location);
    this.expression = expression;
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  public StatementKind getKind() {
    return StatementKind.EXPRESSION;
  }

  @Override
  public boolean isExpression() {
    return true;
  }

  @Override
  public ExpressionStatement asExpression() {
    return this;
  }
}
