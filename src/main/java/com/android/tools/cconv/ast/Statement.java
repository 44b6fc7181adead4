// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

public abstract class Statement {

  private final SourceLocation location;

  Statement(SourceLocation location) {
    this.location = location;
  }

  public abstract StatementKind getKind();

  public SourceLocation getLocation() {
    return location;
  }

  /** Visits the directly nested statements. */
  public void forEachChildStatement(Consumer<Statement> consumer) {}

  public boolean isCompound() {
    return false;
  }

  public CompoundStatement asCompound() {
    return null;
  }

  public boolean isDeclaration() {
    return false;
  }

  public DeclarationStatement asDeclaration() {
    return null;
  }

  public boolean isExpression() {
    return false;
  }

  public ExpressionStatement asExpression() {
    return null;
  }

  public boolean isReturn() {
    return false;
  }

  public ReturnStatement asReturn() {
    return null;
  }

  public boolean isIf() {
    return false;
  }

  public IfStatement asIf() {
    return null;
  }

  public boolean isSwitch() {
    return false;
  }

  public SwitchStatement asSwitch() {
    return null;
  }

  public boolean isWhile() {
    return false;
  }

  public WhileStatement asWhile() {
    return null;
  }
}
