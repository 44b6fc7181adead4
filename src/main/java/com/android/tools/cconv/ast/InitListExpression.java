// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;
import java.util.function.Consumer;

public final class InitListExpression extends Expression {

  private final ImmutableList<Expression> initializers;

  InitListExpression(CType type, ImmutableList<Expression> initializers, SourceLocation location) {
    super(type, location);
    this.initializers = initializers;
  }

  public ImmutableList<Expression> getInitializers() {
    return initializers;
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.INIT_LIST;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    initializers.forEach(consumer);
  }

  @Override
  public boolean isInitList() {
    return true;
  }

  @Override
  public InitListExpression asInitList() {
    return this;
  }
}
