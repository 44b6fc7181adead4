// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public final class ReturnStatement extends Statement {

  private final Expression value;

  ReturnStatement(Expression value, SourceLocation location) {
    super(location);
    this.value = value;
  }

  public boolean hasValue() {
    return value != null;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public StatementKind getKind() {
    return StatementKind.RETURN;
  }

  @Override
  public boolean isReturn() {
    return true;
  }

  @Override
  public ReturnStatement asReturn() {
    return this;
  }
}
