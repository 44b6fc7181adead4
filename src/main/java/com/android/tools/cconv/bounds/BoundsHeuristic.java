// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

/** The rule that produced a bound. */
public enum BoundsHeuristic {
  ALLOCATOR_MATCH("allocator"),
  NEIGHBOUR_PARAMETER("neighbour"),
  NAME_PREFIX("namePrefix"),
  LENGTH_KEYWORD("lengthKeyword"),
  COMMON_SUBSEQUENCE("commonSubsequence"),
  MAIN_FUNCTION("main"),
  PROPAGATED("propagated"),
  UNBOUNDED("unbounded");

  private final String statisticsName;

  BoundsHeuristic(String statisticsName) {
    this.statisticsName = statisticsName;
  }

  public String getStatisticsName() {
    return statisticsName;
  }
}
