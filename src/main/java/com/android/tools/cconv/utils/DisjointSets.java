// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Union-find structure over arbitrary elements.
 *
 * <p>Iteration over the collected sets follows the order in which elements were first added.
 */
public class DisjointSets<T> {

  private final Map<T, T> parent = new LinkedHashMap<>();
  private final Map<T, Integer> rank = new LinkedHashMap<>();

  public T makeSet(T element) {
    assert !parent.containsKey(element);
    parent.put(element, element);
    rank.put(element, 0);
    return element;
  }

  public T findOrMakeSet(T element) {
    if (!parent.containsKey(element)) {
      return makeSet(element);
    }
    return findSet(element);
  }

  public boolean contains(T element) {
    return parent.containsKey(element);
  }

  /** Returns the representative of the set containing the element, or null if absent. */
  public T findSet(T element) {
    T candidate = parent.get(element);
    if (candidate == null) {
      return null;
    }
    T representative = element;
    while (parent.get(representative) != representative) {
      representative = parent.get(representative);
    }
    // Path compression.
    T current = element;
    while (current != representative) {
      T next = parent.get(current);
      parent.put(current, representative);
      current = next;
    }
    return representative;
  }

  public boolean isRepresentativeOrNotPresent(T element) {
    T representative = findSet(element);
    return representative == null || representative.equals(element);
  }

  public T union(T element1, T element2) {
    T representative1 = findSet(element1);
    T representative2 = findSet(element2);
    assert representative1 != null && representative2 != null;
    if (representative1.equals(representative2)) {
      return representative1;
    }
    int rank1 = rank.get(representative1);
    int rank2 = rank.get(representative2);
    if (rank1 < rank2) {
      parent.put(representative1, representative2);
      return representative2;
    }
    parent.put(representative2, representative1);
    if (rank1 == rank2) {
      rank.put(representative1, rank1 + 1);
    }
    return representative1;
  }

  public T unionWithMakeSet(T element1, T element2) {
    findOrMakeSet(element1);
    findOrMakeSet(element2);
    return union(element1, element2);
  }

  public Map<T, Set<T>> collectSets() {
    Map<T, Set<T>> sets = new LinkedHashMap<>();
    List<T> elements = new ArrayList<>(parent.keySet());
    for (T element : elements) {
      T representative = findSet(element);
      sets.computeIfAbsent(representative, ignore -> new LinkedHashSet<>()).add(element);
    }
    return sets;
  }

  public Collection<T> elements() {
    return parent.keySet();
  }

  public int size() {
    return parent.size();
  }
}
