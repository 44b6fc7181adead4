// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public final class ParameterDeclaration extends Declaration {

  private FunctionDeclaration function;
  private int index = -1;

  ParameterDeclaration(
      String name, CType type, SourceLocation location, boolean hasBoundsAnnotation) {
    super(name, type, location, hasBoundsAnnotation);
  }

  public FunctionDeclaration getFunction() {
    return function;
  }

  public int getIndex() {
    return index;
  }

  void setFunction(FunctionDeclaration function, int index) {
    assert this.function == null : "Parameter " + getName() + " already belongs to a function";
    this.function = function;
    this.index = index;
  }

  @Override
  public boolean isParameter() {
    return true;
  }

  @Override
  public ParameterDeclaration asParameter() {
    return this;
  }
}
