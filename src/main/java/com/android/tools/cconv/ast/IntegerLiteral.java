// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class IntegerLiteral extends Expression {

  private final long value;

  IntegerLiteral(long value, SourceLocation location) {
    super(CType.intType(), location);
    this.value = value;
  }

  public long getValue() {
    return value;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.INTEGER_LITERAL;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {}

  @Override
  public boolean isIntegerLiteral() {
    return true;
  }

  @Override
  public IntegerLiteral asIntegerLiteral() {
    return this;
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
