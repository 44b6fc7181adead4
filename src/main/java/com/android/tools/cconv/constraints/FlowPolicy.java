// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

/** How a value flow between two constraint variables is turned into inequalities. */
public enum FlowPolicy {
  // Both sides must resolve to the same class.
  SAME,
  // The left side is at least as permissive as the right side.
  SAFE_TO_WILD,
  // The right side is at least as permissive as the left side.
  WILD_TO_SAFE;

  public FlowPolicy invert() {
    switch (this) {
      case SAFE_TO_WILD:
        return WILD_TO_SAFE;
      case WILD_TO_SAFE:
        return SAFE_TO_WILD;
      default:
        return SAME;
    }
  }
}
