// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;

/** A function prototype or definition. */
public final class FunctionDeclaration extends Declaration {

  private final Linkage linkage;
  private final ImmutableList<ParameterDeclaration> parameters;
  private final CompoundStatement body;

  FunctionDeclaration(
      String name,
      FunctionType type,
      SourceLocation location,
      Linkage linkage,
      ImmutableList<ParameterDeclaration> parameters,
      CompoundStatement body) {
    super(name, type, location, false);
    assert linkage != Linkage.NONE;
    this.linkage = linkage;
    this.parameters = parameters;
    this.body = body;
    for (int i = 0; i < parameters.size(); i++) {
      parameters.get(i).setFunction(this, i);
    }
  }

  @Override
  public FunctionType getType() {
    return super.getType().asFunction();
  }

  @Override
  public Linkage getLinkage() {
    return linkage;
  }

  public boolean isStatic() {
    return linkage == Linkage.INTERNAL;
  }

  public CType getReturnType() {
    return getType().getReturnType();
  }

  public ImmutableList<ParameterDeclaration> getParameters() {
    return parameters;
  }

  public int getNumberOfParameters() {
    return parameters.size();
  }

  public ParameterDeclaration getParameter(int index) {
    return parameters.get(index);
  }

  public boolean hasBody() {
    return body != null;
  }

  public CompoundStatement getBody() {
    return body;
  }

  public boolean hasPrototype() {
    return getType().hasPrototype();
  }

  public boolean isVariadic() {
    return getType().isVariadic();
  }

  @Override
  public boolean isFunction() {
    return true;
  }

  @Override
  public FunctionDeclaration asFunction() {
    return this;
  }
}
