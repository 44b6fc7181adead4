// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

/** One indirection level of a constraint variable: either a solver unknown or a constant. */
public abstract class Atom {

  Atom() {}

  public boolean isVariable() {
    return false;
  }

  public VarAtom asVariable() {
    return null;
  }

  public boolean isConstant() {
    return false;
  }

  public ConstAtom asConstant() {
    return null;
  }
}
