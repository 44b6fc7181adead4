// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

/** Identifies a program variable, or a constant, that may carry or provide array bounds. */
public final class BoundsKey implements Comparable<BoundsKey> {

  private final int id;

  BoundsKey(int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  @Override
  public int compareTo(BoundsKey other) {
    return Integer.compare(id, other.id);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof BoundsKey && ((BoundsKey) obj).id == id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "k" + id;
  }
}
