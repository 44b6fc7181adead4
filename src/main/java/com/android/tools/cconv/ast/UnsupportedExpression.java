// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;
import java.util.function.Consumer;

/**
 * An expression form the analysis does not model, such as a statement expression or a GNU
 * extension. Its sub-expressions are still visited.
 */
public final class UnsupportedExpression extends Expression {

  private final String description;
  private final ImmutableList<Expression> children;

  UnsupportedExpression(
      CType type, String description, ImmutableList<Expression> children, SourceLocation location) {
    super(type, location);
    this.description = description;
    this.children = children;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.UNSUPPORTED;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    children.forEach(consumer);
  }

  @Override
  public boolean isUnsupported() {
    return true;
  }

  @Override
  public UnsupportedExpression asUnsupported() {
    return this;
  }
}
