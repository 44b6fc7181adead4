// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;

public final class DeclarationStatement extends Statement {

  private final ImmutableList<VariableDeclaration> declarations;

  DeclarationStatement(ImmutableList<VariableDeclaration> declarations, SourceLocation location) {
    super(location);
    this.declarations = declarations;
  }

  public ImmutableList<VariableDeclaration> getDeclarations() {
    return declarations;
  }

  @Override
  public StatementKind getKind() {
    return StatementKind.DECLARATION;
  }

  @Override
  public boolean isDeclaration() {
    return true;
  }

  @Override
  public DeclarationStatement asDeclaration() {
    return this;
  }
}
