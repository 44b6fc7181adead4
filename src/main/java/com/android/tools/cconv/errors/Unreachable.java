// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.errors;

/** Exception to signal that a supposedly unreachable code path has been reached. */
public class Unreachable extends InternalAnalysisError {

  public Unreachable() {
    super("Unreachable");
  }

  public Unreachable(String message) {
    super(message);
  }
}
