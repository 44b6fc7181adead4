// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

/** The checked pointer annotation a pointer or array type was declared with, if any. */
public enum CheckedPointerKind {
  UNCHECKED,
  PTR,
  ARRAY,
  NT_ARRAY;

  public boolean isChecked() {
    return this != UNCHECKED;
  }
}
