// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

/** An inferred bound of an array pointer. */
public abstract class ArrayBounds {

  ArrayBounds() {}

  public static ElementCount elementCount(ProgramVariable variable) {
    return new ElementCount(variable);
  }

  public static ByteCount byteCount(ProgramVariable variable) {
    return new ByteCount(variable);
  }

  public static Unbounded unbounded() {
    return Unbounded.INSTANCE;
  }

  public boolean isElementCount() {
    return false;
  }

  public boolean isByteCount() {
    return false;
  }

  public boolean isUnbounded() {
    return false;
  }

  /** The variable that holds the length, or null if unbounded. */
  public ProgramVariable getLengthVariable() {
    return null;
  }

  public abstract String toSourceString();

  @Override
  public String toString() {
    return toSourceString();
  }

  abstract static class CountBounds extends ArrayBounds {

    private final ProgramVariable variable;

    CountBounds(ProgramVariable variable) {
      this.variable = variable;
    }

    @Override
    public ProgramVariable getLengthVariable() {
      return variable;
    }

    @Override
    public boolean equals(Object obj) {
      if (obj == null || obj.getClass() != getClass()) {
        return false;
      }
      return variable.getKey().equals(((CountBounds) obj).variable.getKey());
    }

    @Override
    public int hashCode() {
      return 31 * getClass().hashCode() + variable.getKey().hashCode();
    }
  }

  /** The number of elements is held by a variable or constant. */
  public static final class ElementCount extends CountBounds {

    ElementCount(ProgramVariable variable) {
      super(variable);
    }

    @Override
    public boolean isElementCount() {
      return true;
    }

    @Override
    public String toSourceString() {
      return "count(" + getLengthVariable().getName() + ")";
    }
  }

  /** The size in bytes is held by a variable or constant. */
  public static final class ByteCount extends CountBounds {

    ByteCount(ProgramVariable variable) {
      super(variable);
    }

    @Override
    public boolean isByteCount() {
      return true;
    }

    @Override
    public String toSourceString() {
      return "byte_count(" + getLengthVariable().getName() + ")";
    }
  }

  public static final class Unbounded extends ArrayBounds {

    private static final Unbounded INSTANCE = new Unbounded();

    private Unbounded() {}

    @Override
    public boolean isUnbounded() {
      return true;
    }

    @Override
    public String toSourceString() {
      return "unbounded";
    }
  }
}
