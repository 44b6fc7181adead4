// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

import java.util.Objects;

/** The region of the program in which a bounds variable is visible. */
public final class BoundsScope {

  public enum Kind {
    GLOBAL,
    FUNCTION,
    RECORD,
    CALL_CONTEXT
  }

  private static final BoundsScope GLOBAL = new BoundsScope(Kind.GLOBAL, "");

  private final Kind kind;
  private final String name;

  private BoundsScope(Kind kind, String name) {
    this.kind = kind;
    this.name = name;
  }

  public static BoundsScope global() {
    return GLOBAL;
  }

  public static BoundsScope function(String name) {
    return new BoundsScope(Kind.FUNCTION, name);
  }

  public static BoundsScope record(String name) {
    return new BoundsScope(Kind.RECORD, name);
  }

  public static BoundsScope callContext(String name) {
    return new BoundsScope(Kind.CALL_CONTEXT, name);
  }

  public Kind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public boolean isGlobal() {
    return kind == Kind.GLOBAL;
  }

  /** True if a variable of this scope can be named from code in {@code other}. */
  public boolean isVisibleFrom(BoundsScope other) {
    return isGlobal() || equals(other);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof BoundsScope)) {
      return false;
    }
    BoundsScope other = (BoundsScope) obj;
    return kind == other.kind && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, name);
  }

  @Override
  public String toString() {
    return isGlobal() ? "global" : kind.name().toLowerCase() + ":" + name;
  }
}
