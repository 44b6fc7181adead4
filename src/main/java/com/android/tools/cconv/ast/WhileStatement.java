// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class WhileStatement extends Statement {

  private final Expression condition;
  private final Statement body;

  WhileStatement(Expression condition, Statement body, SourceLocation location) {
    super(location);
    this.condition = condition;
    this.body = body;
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getBody() {
    return body;
  }

  @Override
  public StatementKind getKind() {
    return StatementKind.WHILE;
  }

  @Override
  public void forEachChildStatement(Consumer<Statement> consumer) {
    consumer.accept(body);
  }

  @Override
  public boolean isWhile() {
    return true;
  }

  @Override
  public WhileStatement asWhile() {
    return this;
  }
}
