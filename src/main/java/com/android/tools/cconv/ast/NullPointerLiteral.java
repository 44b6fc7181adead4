// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

/** The null pointer constant, {@code NULL} or {@code ((void *) 0)}. */
public final class NullPointerLiteral extends Expression {

  NullPointerLiteral(SourceLocation location) {
    super(CType.pointerTo(CType.voidType()), location);
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.NULL_POINTER;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {}

  @Override
  public boolean isNullPointer() {
    return true;
  }

  @Override
  public String toString() {
    return "NULL";
  }
}
