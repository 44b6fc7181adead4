// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class DeclRefExpression extends Expression {

  private final Declaration declaration;

  DeclRefExpression(Declaration declaration, SourceLocation location) {
    super(declaration.getType(), location);
    this.declaration = declaration;
  }

  public Declaration getDeclaration() {
    return declaration;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.DECL_REF;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {}

  @Override
  public boolean isDeclRef() {
    return true;
  }

  @Override
  public DeclRefExpression asDeclRef() {
    return this;
  }

  @Override
  public String toString() {
    return declaration.getName();
  }
}
