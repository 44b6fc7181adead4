// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

import com.android.tools.cconv.utils.timing.Timing;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import it.unimi.dsi.fastutil.ints.Int2ReferenceOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the safest class of every atom that satisfies all edges of a graph.
 *
 * <p>Every unknown starts at {@link SafetyClass#PTR}. An edge {@code Geq(a, b)} whose left side is
 * safer than its right side lowers {@code a} to the class of {@code b}. Each atom can be lowered at
 * most three times, which bounds the work. When an atom is lowered, the edges that read it are
 * revisited through a worklist. An implication fires once the left side of its premise is wild;
 * its conclusion is recorded in the solution and the graph itself is not modified.
 *
 * <p>Every call to {@link #solve} starts from scratch, so solving an unchanged graph twice gives
 * the same result.
 */
public class ConstraintSolver {

  private final ConstraintGraph graph;

  private final Int2ReferenceMap<SafetyClass> assignment = new Int2ReferenceOpenHashMap<>();
  private final Int2ReferenceMap<Geq> causes = new Int2ReferenceOpenHashMap<>();
  private final Int2ReferenceMap<List<Geq>> edgesByRhs = new Int2ReferenceOpenHashMap<>();
  private final Int2ReferenceMap<List<Implies>> implicationsByPremise =
      new Int2ReferenceOpenHashMap<>();
  private final Set<Implies> fired = new LinkedHashSet<>();
  private final Set<Geq> conflicts = new LinkedHashSet<>();

  private final Deque<VarAtom> worklist = new ArrayDeque<>();
  private final IntSet inWorklist = new IntOpenHashSet();

  public ConstraintSolver(ConstraintGraph graph) {
    this.graph = graph;
  }

  public ConstraintSolution solve() {
    return solve(Timing.empty());
  }

  public ConstraintSolution solve(Timing timing) {
    timing.begin("Solve constraints");
    graph.freeze();
    reset();
    for (VarAtom atom : graph.getVariables()) {
      assignment.put(atom.getId(), SafetyClass.PTR);
    }
    for (Geq geq : graph.getGeqs()) {
      index(geq);
    }
    for (Implies implies : graph.getImplications()) {
      Atom premiseLhs = implies.getPremise().getLhs();
      if (premiseLhs.isVariable()) {
        int id = premiseLhs.asVariable().getId();
        List<Implies> implications = implicationsByPremise.get(id);
        if (implications == null) {
          implications = new ArrayList<>();
          implicationsByPremise.put(id, implications);
        }
        implications.add(implies);
      } else if (premiseLhs.asConstant().isWild()) {
        fire(implies);
      }
    }
    for (Geq geq : graph.getGeqs()) {
      apply(geq);
    }
    processWorklist();
    ConstraintSolution solution =
        new ConstraintSolution(
            new Int2ReferenceOpenHashMap<>(assignment),
            new Int2ReferenceOpenHashMap<>(causes),
            ImmutableList.copyOf(fired),
            ImmutableSet.copyOf(conflicts));
    graph.setSolution(solution);
    timing.end();
    return solution;
  }

  private void reset() {
    assignment.clear();
    causes.clear();
    edgesByRhs.clear();
    implicationsByPremise.clear();
    fired.clear();
    conflicts.clear();
    worklist.clear();
    inWorklist.clear();
  }

  private void index(Geq geq) {
    if (geq.getRhs().isVariable()) {
      int id = geq.getRhs().asVariable().getId();
      List<Geq> edges = edgesByRhs.get(id);
      if (edges == null) {
        edges = new ArrayList<>();
        edgesByRhs.put(id, edges);
      }
      edges.add(geq);
    }
  }

  private void processWorklist() {
    while (!worklist.isEmpty()) {
      VarAtom atom = worklist.removeLast();
      inWorklist.remove(atom.getId());
      for (Geq geq : edgesByRhs.getOrDefault(atom.getId(), Collections.emptyList())) {
        apply(geq);
      }
      if (assignment.get(atom.getId()).isWild()) {
        for (Implies implies :
            implicationsByPremise.getOrDefault(atom.getId(), Collections.emptyList())) {
          fire(implies);
        }
      }
    }
  }

  private void fire(Implies implies) {
    if (!fired.add(implies)) {
      return;
    }
    Geq conclusion = implies.getConclusion();
    index(conclusion);
    apply(conclusion);
  }

  private void apply(Geq geq) {
    SafetyClass bound = valueOf(geq.getRhs());
    Atom lhs = geq.getLhs();
    if (lhs.isConstant()) {
      if (lhs.asConstant().getSafetyClass().isSaferThan(bound)) {
        conflicts.add(geq);
      }
      return;
    }
    int id = lhs.asVariable().getId();
    SafetyClass current = assignment.get(id);
    SafetyClass lowered = current.meet(bound);
    if (lowered != current) {
      assignment.put(id, lowered);
      causes.put(id, geq);
      if (inWorklist.add(id)) {
        worklist.addLast(lhs.asVariable());
      }
    }
  }

  private SafetyClass valueOf(Atom atom) {
    if (atom.isConstant()) {
      return atom.asConstant().getSafetyClass();
    }
    return assignment.get(atom.asVariable().getId());
  }
}
