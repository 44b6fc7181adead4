// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

import com.android.tools.cconv.errors.InternalAnalysisError;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import java.util.EnumMap;
import java.util.Map;

/** The result of solving a {@link ConstraintGraph}. */
public class ConstraintSolution {

  private final Int2ReferenceMap<SafetyClass> assignment;
  private final Int2ReferenceMap<Geq> causes;
  private final ImmutableList<Implies> firedImplications;
  private final ImmutableSet<Geq> conflicts;

  ConstraintSolution(
      Int2ReferenceMap<SafetyClass> assignment,
      Int2ReferenceMap<Geq> causes,
      ImmutableList<Implies> firedImplications,
      ImmutableSet<Geq> conflicts) {
    this.assignment = assignment;
    this.causes = causes;
    this.firedImplications = firedImplications;
    this.conflicts = conflicts;
  }

  public SafetyClass getAssignment(Atom atom) {
    if (atom.isConstant()) {
      return atom.asConstant().getSafetyClass();
    }
    SafetyClass value = assignment.get(atom.asVariable().getId());
    if (value == null) {
      throw new InternalAnalysisError("No assignment for atom " + atom);
    }
    return value;
  }

  public boolean isWild(Atom atom) {
    return getAssignment(atom).isWild();
  }

  /** The edge that last lowered the atom, or null if the atom kept its initial class. */
  public Geq getCause(VarAtom atom) {
    return causes.get(atom.getId());
  }

  public ImmutableList<Implies> getFiredImplications() {
    return firedImplications;
  }

  /** Edges that would have required lowering a constant atom. */
  public ImmutableSet<Geq> getConflicts() {
    return conflicts;
  }

  public int size() {
    return assignment.size();
  }

  public Map<SafetyClass, Integer> computeHistogram() {
    Map<SafetyClass, Integer> histogram = new EnumMap<>(SafetyClass.class);
    for (SafetyClass safetyClass : SafetyClass.values()) {
      histogram.put(safetyClass, 0);
    }
    for (SafetyClass value : assignment.values()) {
      histogram.merge(value, 1, Integer::sum);
    }
    return histogram;
  }
}
