// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.Objects;

public final class RecordType extends CType {

  private final String name;
  private final boolean isUnion;

  RecordType(String name, boolean isUnion) {
    this.name = name;
    this.isUnion = isUnion;
  }

  public String getName() {
    return name;
  }

  public boolean isUnion() {
    return isUnion;
  }

  @Override
  public boolean isRecord() {
    return true;
  }

  @Override
  public RecordType asRecord() {
    return this;
  }

  @Override
  public String toSourceString() {
    return (isUnion ? "union " : "struct ") + name;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    RecordType other = (RecordType) obj;
    return isUnion == other.isUnion && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, isUnion);
  }
}
