// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.Objects;

public final class PointerType extends CType {

  private final CType pointeeType;
  private final CheckedPointerKind checkedKind;

  PointerType(CType pointeeType, CheckedPointerKind checkedKind) {
    this.pointeeType = pointeeType;
    this.checkedKind = checkedKind;
  }

  public CType getPointeeType() {
    return pointeeType;
  }

  public CheckedPointerKind getCheckedKind() {
    return checkedKind;
  }

  @Override
  public boolean isPointer() {
    return true;
  }

  @Override
  public PointerType asPointer() {
    return this;
  }

  @Override
  public boolean isScalar() {
    return true;
  }

  @Override
  public CType getReferencedType() {
    return pointeeType;
  }

  @Override
  public String toSourceString() {
    switch (checkedKind) {
      case PTR:
        return "_Ptr<" + pointeeType.toSourceString() + ">";
      case ARRAY:
        return "_Array_ptr<" + pointeeType.toSourceString() + ">";
      case NT_ARRAY:
        return "_Nt_array_ptr<" + pointeeType.toSourceString() + ">";
      default:
        return pointeeType.toSourceString() + " *";
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    PointerType other = (PointerType) obj;
    return checkedKind == other.checkedKind && pointeeType.equals(other.pointeeType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pointeeType, checkedKind);
  }
}
