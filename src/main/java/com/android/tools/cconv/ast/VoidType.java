// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public final class VoidType extends CType {

  static final VoidType INSTANCE = new VoidType();

  private VoidType() {}

  @Override
  public boolean isVoid() {
    return true;
  }

  @Override
  public String toSourceString() {
    return "void";
  }
}
