// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class ArraySubscriptExpression extends Expression {

  private final Expression base;
  private final Expression index;

  ArraySubscriptExpression(CType type, Expression base, Expression index, SourceLocation location) {
    super(type, location);
    this.base = base;
    this.index = index;
  }

  public Expression getBase() {
    return base;
  }

  public Expression getIndex() {
    return index;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.ARRAY_SUBSCRIPT;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    consumer.accept(base);
    consumer.accept(index);
  }

  @Override
  public boolean isArraySubscript() {
    return true;
  }

  @Override
  public ArraySubscriptExpression asArraySubscript() {
    return this;
  }

  @Override
  public String toString() {
    return base + "[" + index + "]";
  }
}
