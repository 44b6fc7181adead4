// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class SizeOfExpression extends Expression {

  private final CType argumentType;

  SizeOfExpression(CType argumentType, SourceLocation location) {
    super(CType.sizeType(), location);
    this.argumentType = argumentType;
  }

  public CType getArgumentType() {
    return argumentType;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.SIZEOF;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {}

  @Override
  public boolean isSizeOf() {
    return true;
  }

  @Override
  public SizeOfExpression asSizeOf() {
    return this;
  }

  @Override
  public String toString() {
    return "sizeof(" + argumentType + ")";
  }
}
