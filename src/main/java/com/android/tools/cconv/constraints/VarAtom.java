// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

import com.android.tools.cconv.ast.SourceLocation;

/** A solver unknown. Identity is the program-wide unique id. */
public final class VarAtom extends Atom {

  private final int id;
  private final String name;
  private final SourceLocation location;

  VarAtom(int id, String name, SourceLocation location) {
    this.id = id;
    this.name = name;
    this.location = location;
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public boolean isVariable() {
    return true;
  }

  @Override
  public VarAtom asVariable() {
    return this;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return id == ((VarAtom) obj).id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "q_" + id + (name != null ? "(" + name + ")" : "");
  }
}
