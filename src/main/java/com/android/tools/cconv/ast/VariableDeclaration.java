// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

/** A local or global variable. */
public final class VariableDeclaration extends Declaration {

  private final Linkage linkage;
  private final boolean isGlobal;
  private final boolean isExtern;
  private final Expression initializer;
  private FunctionDeclaration enclosingFunction;

  VariableDeclaration(
      String name,
      CType type,
      SourceLocation location,
      boolean hasBoundsAnnotation,
      Linkage linkage,
      boolean isGlobal,
      boolean isExtern,
      Expression initializer) {
    super(name, type, location, hasBoundsAnnotation);
    this.linkage = linkage;
    this.isGlobal = isGlobal;
    this.isExtern = isExtern;
    this.initializer = initializer;
  }

  @Override
  public Linkage getLinkage() {
    return linkage;
  }

  public boolean isGlobal() {
    return isGlobal;
  }

  public boolean isLocal() {
    return !isGlobal;
  }

  /** True for an extern declaration that does not define storage. */
  public boolean isExtern() {
    return isExtern;
  }

  public boolean hasInitializer() {
    return initializer != null;
  }

  public Expression getInitializer() {
    return initializer;
  }

  /** The function whose body declares this local, or null for globals. */
  public FunctionDeclaration getEnclosingFunction() {
    return enclosingFunction;
  }

  void setEnclosingFunction(FunctionDeclaration enclosingFunction) {
    assert isLocal();
    assert this.enclosingFunction == null;
    this.enclosingFunction = enclosingFunction;
  }

  @Override
  public boolean isVariable() {
    return true;
  }

  @Override
  public VariableDeclaration asVariable() {
    return this;
  }
}
