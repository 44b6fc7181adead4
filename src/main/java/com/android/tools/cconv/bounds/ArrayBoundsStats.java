// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Records which heuristic bound each key. A later record for the same key replaces it. */
public class ArrayBoundsStats {

  private final Map<BoundsKey, BoundsHeuristic> heuristics = new LinkedHashMap<>();

  public void record(BoundsKey key, BoundsHeuristic heuristic) {
    heuristics.put(key, heuristic);
  }

  public BoundsHeuristic getHeuristic(BoundsKey key) {
    return heuristics.get(key);
  }

  public int count(BoundsHeuristic heuristic) {
    int count = 0;
    for (BoundsHeuristic value : heuristics.values()) {
      if (value == heuristic) {
        count++;
      }
    }
    return count;
  }

  public Map<BoundsHeuristic, Integer> getCounts() {
    Map<BoundsHeuristic, Integer> counts = new EnumMap<>(BoundsHeuristic.class);
    for (BoundsHeuristic heuristic : BoundsHeuristic.values()) {
      counts.put(heuristic, 0);
    }
    heuristics.values().forEach(heuristic -> counts.merge(heuristic, 1, Integer::sum));
    return counts;
  }

  public int size() {
    return heuristics.size();
  }
}
