// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

public final class FunctionType extends CType {

  private final CType returnType;
  private final ImmutableList<CType> parameterTypes;
  private final boolean variadic;
  private final boolean hasPrototype;

  FunctionType(
      CType returnType,
      ImmutableList<CType> parameterTypes,
      boolean variadic,
      boolean hasPrototype) {
    this.returnType = returnType;
    this.parameterTypes = parameterTypes;
    this.variadic = variadic;
    this.hasPrototype = hasPrototype;
  }

  public CType getReturnType() {
    return returnType;
  }

  public ImmutableList<CType> getParameterTypes() {
    return parameterTypes;
  }

  public boolean isVariadic() {
    return variadic;
  }

  public boolean hasPrototype() {
    return hasPrototype;
  }

  @Override
  public boolean isFunction() {
    return true;
  }

  @Override
  public FunctionType asFunction() {
    return this;
  }

  @Override
  public String toSourceString() {
    StringBuilder builder = new StringBuilder(returnType.toSourceString()).append(" (");
    for (int i = 0; i < parameterTypes.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(parameterTypes.get(i).toSourceString());
    }
    if (variadic) {
      builder.append(parameterTypes.isEmpty() ? "..." : ", ...");
    }
    return builder.append(")").toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    FunctionType other = (FunctionType) obj;
    return variadic == other.variadic
        && hasPrototype == other.hasPrototype
        && returnType.equals(other.returnType)
        && parameterTypes.equals(other.parameterTypes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(returnType, parameterTypes, variadic, hasPrototype);
  }
}
