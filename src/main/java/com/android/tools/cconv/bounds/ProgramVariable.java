// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

/** The named entity behind a {@link BoundsKey}. */
public final class ProgramVariable {

  private final BoundsKey key;
  private final String name;
  private final BoundsScope scope;
  private final boolean constant;
  private final long constantValue;

  private ProgramVariable(
      BoundsKey key, String name, BoundsScope scope, boolean constant, long constantValue) {
    this.key = key;
    this.name = name;
    this.scope = scope;
    this.constant = constant;
    this.constantValue = constantValue;
  }

  static ProgramVariable create(BoundsKey key, String name, BoundsScope scope) {
    return new ProgramVariable(key, name, scope, false, 0);
  }

  static ProgramVariable createConstant(BoundsKey key, long value) {
    return new ProgramVariable(key, Long.toString(value), BoundsScope.global(), true, value);
  }

  public BoundsKey getKey() {
    return key;
  }

  public String getName() {
    return name;
  }

  public BoundsScope getScope() {
    return scope;
  }

  public boolean isConstant() {
    return constant;
  }

  public long getConstantValue() {
    assert constant;
    return constantValue;
  }

  /** True if this variable can be used as a bound of a pointer declared in {@code scope}. */
  public boolean isUsableIn(BoundsScope scope) {
    return constant || this.scope.isVisibleFrom(scope);
  }

  @Override
  public String toString() {
    return name + "@" + scope;
  }
}
