// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

public abstract class Constraint {

  Constraint() {}

  public boolean isGeq() {
    return false;
  }

  public Geq asGeq() {
    return null;
  }

  public boolean isImplies() {
    return false;
  }

  public Implies asImplies() {
    return null;
  }
}
