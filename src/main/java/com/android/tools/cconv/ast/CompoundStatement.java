// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;
import java.util.function.Consumer;

public final class CompoundStatement extends Statement {

  private final ImmutableList<Statement> statements;

  CompoundStatement(ImmutableList<Statement> statements, SourceLocation location) {
    super(location);
    this.statements = statements;
  }

  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  @Override
  public StatementKind getKind() {
    return StatementKind.COMPOUND;
  }

  @Override
  public void forEachChildStatement(Consumer<Statement> consumer) {
    statements.forEach(consumer);
  }

  @Override
  public boolean isCompound() {
    return true;
  }

  @Override
  public CompoundStatement asCompound() {
    return this;
  }
}
