// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv;

/** Levels of diagnostics. */
public enum DiagnosticsLevel {
  ERROR,
  WARNING,
  INFO,
  NONE
}
