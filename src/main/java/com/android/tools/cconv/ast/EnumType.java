// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public final class EnumType extends CType {

  private final String name;

  EnumType(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean isEnum() {
    return true;
  }

  @Override
  public boolean isIntegerType() {
    return true;
  }

  @Override
  public boolean isScalar() {
    return true;
  }

  @Override
  public String toSourceString() {
    return "enum " + name;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return name.equals(((EnumType) obj).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
}
