// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

import com.android.tools.cconv.ast.SourceLocation;
import java.util.Objects;

/**
 * The inequality {@code lhs >= rhs}: the left atom is at least as permissive as the right one.
 *
 * <p>Once solved, {@code class(lhs) <= class(rhs)} in the safety order. Equality only considers
 * the two atoms; the reason and location are provenance for diagnostics.
 */
public final class Geq extends Constraint {

  private final Atom lhs;
  private final Atom rhs;
  private final String reason;
  private final SourceLocation location;

  public Geq(Atom lhs, Atom rhs) {
    this(lhs, rhs, null, null);
  }

  public Geq(Atom lhs, Atom rhs, String reason, SourceLocation location) {
    assert lhs != null && rhs != null;
    this.lhs = lhs;
    this.rhs = rhs;
    this.reason = reason;
    this.location = location;
  }

  public Atom getLhs() {
    return lhs;
  }

  public Atom getRhs() {
    return rhs;
  }

  public boolean hasReason() {
    return reason != null;
  }

  public String getReason() {
    return reason;
  }

  public SourceLocation getLocation() {
    return location;
  }

  /** True if this edge forces its left side to be wild. */
  public boolean isWildForcing() {
    return rhs.isConstant() && rhs.asConstant().isWild();
  }

  @Override
  public boolean isGeq() {
    return true;
  }

  @Override
  public Geq asGeq() {
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
    Geq other = (Geq) obj;
    return lhs.equals(other.lhs) && rhs.equals(other.rhs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lhs, rhs);
  }

  @Override
  public String toString() {
    return lhs + " >= " + rhs + (reason != null ? " [" + reason + "]" : "");
  }
}
