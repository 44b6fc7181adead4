// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.Test;

public class DisjointSetsTest {

  @Test
  public void testSingletons() {
    DisjointSets<String> sets = new DisjointSets<>();
    assertNull(sets.findSet("a"));
    assertTrue(sets.isRepresentativeOrNotPresent("a"));
    sets.makeSet("a");
    assertEquals("a", sets.findSet("a"));
    assertEquals("a", sets.findOrMakeSet("a"));
    assertEquals(1, sets.size());
  }

  @Test
  public void testUnion() {
    DisjointSets<String> sets = new DisjointSets<>();
    sets.unionWithMakeSet("a", "b");
    sets.unionWithMakeSet("c", "d");
    sets.findOrMakeSet("e");
    assertSame(sets.findSet("a"), sets.findSet("b"));
    assertFalse(sets.findSet("a").equals(sets.findSet("c")));

    sets.union("b", "d");
    assertSame(sets.findSet("a"), sets.findSet("c"));
    assertEquals(5, sets.size());

    Map<String, Set<String>> collected = sets.collectSets();
    assertEquals(2, collected.size());
    assertThat(collected.get(sets.findSet("a")), containsInAnyOrder("a", "b", "c", "d"));
    assertThat(collected.get("e"), containsInAnyOrder("e"));
  }

  @Test
  public void testRepeatedUnionIsStable() {
    DisjointSets<Integer> sets = new DisjointSets<>();
    for (int i = 1; i < 100; i++) {
      sets.unionWithMakeSet(i - 1, i);
    }
    Integer representative = sets.findSet(0);
    for (int i = 0; i < 100; i++) {
      assertEquals(representative, sets.findSet(i));
      assertEquals(representative, sets.union(i, 0));
    }
    assertTrue(sets.isRepresentativeOrNotPresent(representative));
  }
}
