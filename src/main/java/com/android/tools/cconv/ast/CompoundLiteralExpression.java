// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class CompoundLiteralExpression extends Expression {

  private final Expression initializer;

  CompoundLiteralExpression(CType type, Expression initializer, SourceLocation location) {
    super(type, location);
    this.initializer = initializer;
  }

  public Expression getInitializer() {
    return initializer;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.COMPOUND_LITERAL;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    consumer.accept(initializer);
  }

  @Override
  public boolean isCompoundLiteral() {
    return true;
  }

  @Override
  public CompoundLiteralExpression asCompoundLiteral() {
    return this;
  }
}
