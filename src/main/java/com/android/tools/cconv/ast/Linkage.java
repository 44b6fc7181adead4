// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public enum Linkage {
  // Visible to other translation units.
  EXTERNAL,
  // File static.
  INTERNAL,
  // Locals, parameters and fields.
  NONE
}
