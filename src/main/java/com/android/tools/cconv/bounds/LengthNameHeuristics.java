// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

import com.android.tools.cconv.ast.Declaration;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;

/** Name based matching of an array with the integer that holds its length. */
public class LengthNameHeuristics {

  private static final ImmutableList<String> LENGTH_PREFIXES =
      ImmutableList.of("len", "count", "size", "num", "siz");
  private static final String LENGTH_INFIX = "length";

  /** A candidate chosen for an array, with the rule that chose it. */
  public static final class Match {

    private final Declaration length;
    private final BoundsHeuristic heuristic;

    Match(Declaration length, BoundsHeuristic heuristic) {
      this.length = length;
      this.heuristic = heuristic;
    }

    public Declaration getLength() {
      return length;
    }

    public BoundsHeuristic getHeuristic() {
      return heuristic;
    }
  }

  private final int commonSubsequenceThresholdPercent;

  public LengthNameHeuristics(int commonSubsequenceThresholdPercent) {
    this.commonSubsequenceThresholdPercent = commonSubsequenceThresholdPercent;
  }

  public static boolean isLengthKeyword(String name) {
    String lowerCase = name.toLowerCase(Locale.ROOT);
    for (String prefix : LENGTH_PREFIXES) {
      if (lowerCase.startsWith(prefix)) {
        return true;
      }
    }
    return lowerCase.contains(LENGTH_INFIX);
  }

  public static boolean hasNamePrefix(String arrayName, String candidate) {
    return candidate.length() > arrayName.length()
        && candidate.toLowerCase(Locale.ROOT).startsWith(arrayName.toLowerCase(Locale.ROOT));
  }

  public static int longestCommonSubsequence(String first, String second) {
    String a = first.toLowerCase(Locale.ROOT);
    String b = second.toLowerCase(Locale.ROOT);
    int[][] lengths = new int[a.length() + 1][b.length() + 1];
    for (int i = 1; i <= a.length(); i++) {
      for (int j = 1; j <= b.length(); j++) {
        if (a.charAt(i - 1) == b.charAt(j - 1)) {
          lengths[i][j] = lengths[i - 1][j - 1] + 1;
        } else {
          lengths[i][j] = Math.max(lengths[i - 1][j], lengths[i][j - 1]);
        }
      }
    }
    return lengths[a.length()][b.length()];
  }

  public boolean isCommonSubsequenceMatch(String arrayName, String candidate) {
    if (arrayName.isEmpty()) {
      return false;
    }
    return longestCommonSubsequence(arrayName, candidate) * 100
        >= commonSubsequenceThresholdPercent * arrayName.length();
  }

  /**
   * Picks the length of {@code arrayName} among {@code candidates}.
   *
   * <p>A name starting with the array name wins, preferably one that is also a length keyword.
   * Otherwise the first length keyword wins, and otherwise the first name sharing a long enough
   * common subsequence with the array name.
   */
  public Match select(String arrayName, List<? extends Declaration> candidates) {
    Declaration prefixMatch = null;
    for (Declaration candidate : candidates) {
      if (hasNamePrefix(arrayName, candidate.getName())) {
        String suffix = candidate.getName().substring(arrayName.length());
        if (isLengthKeyword(suffix.replaceFirst("^_", ""))) {
          return new Match(candidate, BoundsHeuristic.NAME_PREFIX);
        }
        if (prefixMatch == null) {
          prefixMatch = candidate;
        }
      }
    }
    if (prefixMatch != null) {
      return new Match(prefixMatch, BoundsHeuristic.NAME_PREFIX);
    }
    for (Declaration candidate : candidates) {
      if (isLengthKeyword(candidate.getName())) {
        return new Match(candidate, BoundsHeuristic.LENGTH_KEYWORD);
      }
    }
    for (Declaration candidate : candidates) {
      if (isCommonSubsequenceMatch(arrayName, candidate.getName())) {
        return new Match(candidate, BoundsHeuristic.COMMON_SUBSEQUENCE);
      }
    }
    return null;
  }
}
