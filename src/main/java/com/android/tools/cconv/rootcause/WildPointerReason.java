// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.rootcause;

import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.constraints.VarAtom;

/** Why an atom was directly forced wild. */
public final class WildPointerReason {

  static final String UNKNOWN_REASON = "Unknown reason";

  private final VarAtom atom;
  private final String reason;
  private final SourceLocation location;

  WildPointerReason(VarAtom atom, String reason, SourceLocation location) {
    this.atom = atom;
    this.reason = reason != null ? reason : UNKNOWN_REASON;
    this.location = location;
  }

  public VarAtom getAtom() {
    return atom;
  }

  public String getReason() {
    return reason;
  }

  /** Where the constraint was generated, or the declaration of the atom if that is unknown. */
  public SourceLocation getLocation() {
    return location != null ? location : atom.getLocation();
  }

  /** The declaration the atom belongs to. */
  public SourceLocation getDeclarationLocation() {
    return atom.getLocation();
  }

  @Override
  public String toString() {
    return atom.getName() + ": " + reason + " at " + getLocation();
  }
}
