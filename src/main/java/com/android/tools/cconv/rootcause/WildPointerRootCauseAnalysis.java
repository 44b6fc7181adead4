// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.rootcause;

import com.android.tools.cconv.constraints.Atom;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.Geq;
import com.android.tools.cconv.constraints.Implies;
import com.android.tools.cconv.constraints.VarAtom;
import com.android.tools.cconv.utils.DisjointSets;
import com.google.common.collect.ImmutableSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Groups wild atoms by the edges along which wildness flowed, and elects one directly wild atom
 * per group as the root cause of the group.
 *
 * <p>The elected atom is the directly wild atom that comes first in the graph's atom order.
 */
public class WildPointerRootCauseAnalysis {

  private final ConstraintGraph graph;
  private final ConstraintSolution solution;
  private final DisjointSets<VarAtom> groups = new DisjointSets<>();
  private final Map<VarAtom, WildPointerReason> directWild = new LinkedHashMap<>();

  public WildPointerRootCauseAnalysis(ConstraintGraph graph) {
    this.graph = graph;
    this.solution = graph.getSolution();
  }

  public WildPointerReport run() {
    for (Geq geq : graph.getGeqs()) {
      addEdge(geq, null);
    }
    for (Implies implies : solution.getFiredImplications()) {
      addEdge(implies.getConclusion(), implies.getPremise().getLhs());
    }
    Set<VarAtom> indirectWild = new LinkedHashSet<>();
    Map<VarAtom, VarAtom> leaders = new LinkedHashMap<>();
    Map<VarAtom, ImmutableSet<VarAtom>> affected = new LinkedHashMap<>();
    Object2IntMap<VarAtom> positions = computePositions();
    for (Set<VarAtom> group : groups.collectSets().values()) {
      VarAtom leader = null;
      for (VarAtom atom : group) {
        if (directWild.containsKey(atom)
            && solution.isWild(atom)
            && (leader == null || positions.getInt(atom) < positions.getInt(leader))) {
          leader = atom;
        }
      }
      if (leader == null) {
        continue;
      }
      ImmutableSet.Builder<VarAtom> followers = ImmutableSet.builder();
      for (VarAtom atom : group) {
        if (!solution.isWild(atom)) {
          continue;
        }
        leaders.put(atom, leader);
        if (!directWild.containsKey(atom)) {
          indirectWild.add(atom);
          followers.add(atom);
        }
      }
      affected.put(leader, followers.build());
    }
    return new WildPointerReport(directWild, indirectWild, leaders, affected);
  }

  // Atom ids are handed out concurrently while units are built. The merged graph lists atoms in
  // input order, which does not depend on the number of threads.
  private Object2IntMap<VarAtom> computePositions() {
    Object2IntMap<VarAtom> positions = new Object2IntOpenHashMap<>();
    positions.defaultReturnValue(Integer.MAX_VALUE);
    for (VarAtom atom : graph.getVariables()) {
      positions.put(atom, positions.size());
    }
    return positions;
  }

  // An implied edge is attributed to the atom whose wildness fired the implication.
  private void addEdge(Geq geq, Atom premise) {
    Atom lhs = geq.getLhs();
    Atom rhs = geq.getRhs();
    if (!lhs.isVariable()) {
      return;
    }
    VarAtom target = lhs.asVariable();
    if (rhs.isConstant()) {
      if (!geq.isWildForcing()) {
        return;
      }
      if (premise != null && premise.isVariable()) {
        groups.unionWithMakeSet(target, premise.asVariable());
        return;
      }
      groups.findOrMakeSet(target);
      directWild.putIfAbsent(
          target, new WildPointerReason(target, geq.getReason(), geq.getLocation()));
      return;
    }
    VarAtom source = rhs.asVariable();
    if (solution.isWild(source)) {
      groups.unionWithMakeSet(target, source);
    }
  }
}
