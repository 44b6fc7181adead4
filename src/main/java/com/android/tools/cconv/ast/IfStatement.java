// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public final class IfStatement extends Statement {

  private final Expression condition;
  private final Statement thenStatement;
  private final Statement elseStatement;

  IfStatement(
      Expression condition,
      Statement thenStatement,
      Statement elseStatement,
      SourceLocation location) {
    super(location);
    this.condition = condition;
    this.thenStatement = thenStatement;
    this.elseStatement = elseStatement;
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getThenStatement() {
    return thenStatement;
  }

  public boolean hasElseStatement() {
    return elseStatement != null;
  }

  public Statement getElseStatement() {
    return elseStatement;
  }

  @Override
  public StatementKind getKind() {
    return StatementKind.IF;
  }

  @Override
  public void forEachChildStatement(Consumer<Statement> consumer) {
    consumer.accept(thenStatement);
    if (elseStatement != null) {
      consumer.accept(elseStatement);
    }
  }

  @Override
  public boolean isIf() {
    return true;
  }

  @Override
  public IfStatement asIf() {
    return this;
  }
}
