// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

/** A field access, either {@code base.field} or {@code base->field}. */
public final class MemberExpression extends Expression {

  private final Expression base;
  private final FieldDeclaration field;
  private final boolean isArrow;

  MemberExpression(
      Expression base, FieldDeclaration field, boolean isArrow, SourceLocation location) {
    super(field.getType(), location);
    this.base = base;
    this.field = field;
    this.isArrow = isArrow;
  }

  public Expression getBase() {
    return base;
  }

  public FieldDeclaration getField() {
    return field;
  }

  public boolean isArrow() {
    return isArrow;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.MEMBER;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    consumer.accept(base);
  }

  @Override
  public boolean isMember() {
    return true;
  }

  @Override
  public MemberExpression asMember() {
    return this;
  }

  @Override
  public String toString() {
    return base + (isArrow ? "->" : ".") + field.getName();
  }
}
