// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.Objects;

public final class ArrayType extends CType {

  public static final int INCOMPLETE = -1;

  private final CType elementType;
  private final int size;
  private final CheckedPointerKind checkedKind;

  ArrayType(CType elementType, int size, CheckedPointerKind checkedKind) {
    this.elementType = elementType;
    this.size = size;
    this.checkedKind = checkedKind;
  }

  public CType getElementType() {
    return elementType;
  }

  public int getSize() {
    return size;
  }

  public boolean isIncomplete() {
    return size == INCOMPLETE;
  }

  public CheckedPointerKind getCheckedKind() {
    return checkedKind;
  }

  public PointerType decay() {
    return new PointerType(elementType, CheckedPointerKind.UNCHECKED);
  }

  @Override
  public boolean isArray() {
    return true;
  }

  @Override
  public ArrayType asArray() {
    return this;
  }

  @Override
  public CType getReferencedType() {
    return elementType;
  }

  @Override
  public String toSourceString() {
    return elementType.toSourceString()
        + (checkedKind.isChecked() ? " _Checked[" : "[")
        + (isIncomplete() ? "" : Integer.toString(size))
        + "]";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ArrayType other = (ArrayType) obj;
    return size == other.size
        && checkedKind == other.checkedKind
        && elementType.equals(other.elementType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elementType, size, checkedKind);
  }
}
