// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

import java.util.Objects;

/** Adds {@code conclusion} once the left side of {@code premise} has been forced to wild. */
public final class Implies extends Constraint {

  private final Geq premise;
  private final Geq conclusion;

  public Implies(Geq premise, Geq conclusion) {
    this.premise = premise;
    this.conclusion = conclusion;
  }

  public Geq getPremise() {
    return premise;
  }

  public Geq getConclusion() {
    return conclusion;
  }

  @Override
  public boolean isImplies() {
    return true;
  }

  @Override
  public Implies asImplies() {
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
    Implies other = (Implies) obj;
    return premise.equals(other.premise) && conclusion.equals(other.conclusion);
  }

  @Override
  public int hashCode() {
    return Objects.hash(premise, conclusion);
  }

  @Override
  public String toString() {
    return "(" + premise + ") => (" + conclusion + ")";
  }
}
