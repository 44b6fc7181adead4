// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.errors.InternalAnalysisError;
import it.unimi.dsi.fastutil.ints.Int2ReferenceLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Owns the atoms and edges of either one translation unit or the whole program.
 *
 * <p>Edges are kept in insertion order, so that solving is deterministic. Duplicate edges are
 * dropped and the first reason recorded for an edge is kept. Once {@link #freeze} has been called
 * the graph can no longer be modified.
 */
public class ConstraintGraph {

  private final AtomFactory atomFactory;
  private final Int2ReferenceMap<VarAtom> atoms = new Int2ReferenceLinkedOpenHashMap<>();
  private final Set<Geq> geqs = new LinkedHashSet<>();
  private final Set<Implies> implications = new LinkedHashSet<>();

  private boolean frozen = false;
  private ConstraintSolution solution;

  public ConstraintGraph() {
    this(new AtomFactory());
  }

  public ConstraintGraph(AtomFactory atomFactory) {
    this.atomFactory = atomFactory;
  }

  public AtomFactory getAtomFactory() {
    return atomFactory;
  }

  public VarAtom freshUnknown(String name, SourceLocation location) {
    ensureNotFrozen();
    VarAtom atom = atomFactory.createVarAtom(name, location);
    atoms.put(atom.getId(), atom);
    return atom;
  }

  public boolean addGeq(Atom lhs, Atom rhs) {
    return addGeq(new Geq(lhs, rhs));
  }

  public boolean addGeq(Atom lhs, Atom rhs, String reason, SourceLocation location) {
    return addGeq(new Geq(lhs, rhs, reason, location));
  }

  public boolean addGeq(Geq geq) {
    ensureNotFrozen();
    if (geq.getLhs().isConstant() && geq.getRhs().isConstant()) {
      // Nothing to solve between two constants.
      return false;
    }
    ensureKnown(geq.getLhs());
    ensureKnown(geq.getRhs());
    return geqs.add(geq);
  }

  public boolean addImplies(Geq premise, Geq conclusion) {
    ensureNotFrozen();
    ensureKnown(premise.getLhs());
    ensureKnown(premise.getRhs());
    ensureKnown(conclusion.getLhs());
    ensureKnown(conclusion.getRhs());
    return implications.add(new Implies(premise, conclusion));
  }

  /** Copies all atoms and edges of a translation unit graph into this graph. */
  public void mergeFrom(ConstraintGraph other) {
    ensureNotFrozen();
    if (other.atomFactory != atomFactory) {
      throw new InternalAnalysisError("Cannot merge graphs with different atom factories");
    }
    atoms.putAll(other.atoms);
    geqs.addAll(other.geqs);
    implications.addAll(other.implications);
  }

  /** Returns an unfrozen copy sharing the atoms of this graph. */
  public ConstraintGraph copy() {
    ConstraintGraph copy = new ConstraintGraph(atomFactory);
    copy.atoms.putAll(atoms);
    copy.geqs.addAll(geqs);
    copy.implications.addAll(implications);
    return copy;
  }

  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public boolean contains(VarAtom atom) {
    return atoms.containsKey(atom.getId());
  }

  public Collection<VarAtom> getVariables() {
    return Collections.unmodifiableCollection(atoms.values());
  }

  public Set<Geq> getGeqs() {
    return Collections.unmodifiableSet(geqs);
  }

  public Set<Implies> getImplications() {
    return Collections.unmodifiableSet(implications);
  }

  public int getNumberOfVariables() {
    return atoms.size();
  }

  public int getNumberOfConstraints() {
    return geqs.size() + implications.size();
  }

  void setSolution(ConstraintSolution solution) {
    assert frozen;
    this.solution = solution;
  }

  public boolean isSolved() {
    return solution != null;
  }

  public ConstraintSolution getSolution() {
    if (solution == null) {
      throw new InternalAnalysisError("Constraint graph has not been solved");
    }
    return solution;
  }

  public SafetyClass getAssignment(Atom atom) {
    return getSolution().getAssignment(atom);
  }

  private void ensureNotFrozen() {
    if (frozen) {
      throw new InternalAnalysisError("Constraint graph is frozen");
    }
  }

  private void ensureKnown(Atom atom) {
    if (atom.isVariable() && !atoms.containsKey(atom.asVariable().getId())) {
      throw new InternalAnalysisError("Atom " + atom + " does not belong to this graph");
    }
  }
}
