// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

public final class ConstAtom extends Atom {

  public static final ConstAtom PTR = new ConstAtom(SafetyClass.PTR);
  public static final ConstAtom NT_ARRAY = new ConstAtom(SafetyClass.NT_ARRAY);
  public static final ConstAtom ARRAY = new ConstAtom(SafetyClass.ARRAY);
  public static final ConstAtom WILD = new ConstAtom(SafetyClass.WILD);

  private final SafetyClass safetyClass;

  private ConstAtom(SafetyClass safetyClass) {
    this.safetyClass = safetyClass;
  }

  public static ConstAtom get(SafetyClass safetyClass) {
    switch (safetyClass) {
      case PTR:
        return PTR;
      case NT_ARRAY:
        return NT_ARRAY;
      case ARRAY:
        return ARRAY;
      case WILD:
        return WILD;
      default:
        throw new IllegalArgumentException("Unexpected safety class: " + safetyClass);
    }
  }

  public SafetyClass getSafetyClass() {
    return safetyClass;
  }

  public boolean isWild() {
    return safetyClass.isWild();
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public ConstAtom asConstant() {
    return this;
  }

  @Override
  public String toString() {
    return safetyClass.name();
  }
}
