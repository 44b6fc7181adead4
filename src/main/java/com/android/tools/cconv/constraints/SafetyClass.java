// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

/**
 * The safety lattice of checked pointers, ordered from least to most safe.
 *
 * <p>{@code WILD < ARRAY < NT_ARRAY < PTR}. The solver starts every unknown at {@link #PTR} and
 * only ever moves it down.
 */
public enum SafetyClass {
  WILD("wild"),
  ARRAY("arr"),
  NT_ARRAY("ntarr"),
  PTR("ptr");

  private final String shortName;

  SafetyClass(String shortName) {
    this.shortName = shortName;
  }

  public String getShortName() {
    return shortName;
  }

  public boolean isWild() {
    return this == WILD;
  }

  public boolean isSaferThan(SafetyClass other) {
    return ordinal() > other.ordinal();
  }

  public SafetyClass meet(SafetyClass other) {
    return isSaferThan(other) ? other : this;
  }
}
