// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints.variables;

import com.android.tools.cconv.ast.CType;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.bounds.BoundsKey;
import com.android.tools.cconv.constraints.Atom;
import com.android.tools.cconv.constraints.ConstAtom;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.FlowPolicy;
import com.android.tools.cconv.constraints.Geq;
import com.android.tools.cconv.constraints.SafetyClass;
import com.android.tools.cconv.constraints.VarAtom;
import com.android.tools.cconv.errors.InternalAnalysisError;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A pointer-shaped constraint variable: one atom per level of indirection, outermost first.
 *
 * <p>A value without any indirection is represented by a pointer variable with no atoms and no
 * nested function, see {@link #isNonPointer}.
 */
public class PointerVariable extends ConstraintVariable {

  private final ImmutableList<Atom> atoms;
  private final CType type;
  private final FunctionVariable functionVariable;
  private final boolean arrayDeclared;
  private final boolean hasBoundsAnnotation;
  private final BoundsKey boundsKey;

  PointerVariable(
      String name,
      SourceLocation location,
      ImmutableList<Atom> atoms,
      CType type,
      FunctionVariable functionVariable,
      boolean arrayDeclared,
      boolean hasBoundsAnnotation,
      BoundsKey boundsKey) {
    super(name, location);
    this.atoms = atoms;
    this.type = type;
    this.functionVariable = functionVariable;
    this.arrayDeclared = arrayDeclared;
    this.hasBoundsAnnotation = hasBoundsAnnotation;
    this.boundsKey = boundsKey;
  }

  public static PointerVariable nonPointer(String name, CType type) {
    return new PointerVariable(name, null, ImmutableList.of(), type, null, false, false, null);
  }

  public ImmutableList<Atom> getAtoms() {
    return atoms;
  }

  public int getNumberOfAtoms() {
    return atoms.size();
  }

  public Atom getOuterAtom() {
    return atoms.isEmpty() ? null : atoms.get(0);
  }

  /** The declared type this variable was created from. */
  public CType getType() {
    return type;
  }

  public boolean isNonPointer() {
    return atoms.isEmpty() && functionVariable == null;
  }

  public boolean hasFunctionVariable() {
    return functionVariable != null;
  }

  public FunctionVariable getFunctionVariable() {
    return functionVariable;
  }

  /** True if the variable was declared with array syntax, {@code T a[]}. */
  public boolean isArrayDeclared() {
    return arrayDeclared;
  }

  public boolean hasBoundsAnnotation() {
    return hasBoundsAnnotation;
  }

  /** True if some level was already a checked pointer in the source. */
  public boolean isOriginallyChecked() {
    for (Atom atom : atoms) {
      if (atom.isConstant()) {
        return true;
      }
    }
    return false;
  }

  public boolean hasBoundsKey() {
    return boundsKey != null;
  }

  public BoundsKey getBoundsKey() {
    return boundsKey;
  }

  public PointerVariable withBoundsKey(BoundsKey boundsKey) {
    return new PointerVariable(
        getName(),
        getLocation(),
        atoms,
        type,
        functionVariable,
        arrayDeclared,
        hasBoundsAnnotation,
        boundsKey);
  }

  /** Drops the outermost level. The result has no atoms if this was a single pointer. */
  public PointerVariable dereference() {
    if (atoms.isEmpty()) {
      throw new InternalAnalysisError("Cannot dereference " + getName() + " without indirection");
    }
    return new PointerVariable(
        getName(),
        getLocation(),
        atoms.subList(1, atoms.size()),
        type != null ? type.getReferencedType() : null,
        functionVariable,
        false,
        false,
        null);
  }

  /**
   * Prepends a fresh level constrained to be at most as safe as {@code bound}.
   *
   * <p>If the new level is forced wild then the previously outermost level must be wild as well.
   */
  public PointerVariable addIndirection(ConstraintGraph graph, ConstAtom bound) {
    VarAtom atom = graph.freshUnknown("&" + getName(), getLocation());
    if (!bound.getSafetyClass().equals(SafetyClass.PTR)) {
      graph.addGeq(atom, bound);
    }
    Atom previous = getOuterAtom();
    if (previous != null && previous.isVariable()) {
      graph.addImplies(
          new Geq(atom, ConstAtom.WILD),
          new Geq(previous, ConstAtom.WILD, "Address of a wild pointer", getLocation()));
    }
    ImmutableList<Atom> newAtoms =
        ImmutableList.<Atom>builderWithExpectedSize(atoms.size() + 1)
            .add(atom)
            .addAll(atoms)
            .build();
    return new PointerVariable(
        getName(),
        getLocation(),
        newAtoms,
        type != null ? CType.pointerTo(type) : null,
        functionVariable,
        false,
        false,
        null);
  }

  /** Caps the outermost level at {@code bound}. Constant levels are left untouched. */
  public void constrainOuterTo(
      ConstraintGraph graph, ConstAtom bound, String reason, SourceLocation location) {
    Atom outer = getOuterAtom();
    if (outer != null && outer.isVariable() && bound != ConstAtom.PTR) {
      graph.addGeq(outer, bound, reason, location);
    }
  }

  @Override
  public void constrainToWild(ConstraintGraph graph, String reason, SourceLocation location) {
    for (Atom atom : atoms) {
      if (atom.isVariable()) {
        graph.addGeq(atom, ConstAtom.WILD, reason, location);
      }
    }
    if (functionVariable != null) {
      functionVariable.constrainToWild(graph, reason, location);
    }
  }

  @Override
  public PointerVariable copy(ConstraintGraph graph, FlowPolicy policy) {
    PointerVariable copy = freshCopy(graph);
    ConstraintVariables.constrainGeq(graph, copy, this, policy, null, null);
    return copy;
  }

  @Override
  public PointerVariable copy(ConstraintGraph graph) {
    return copy(graph, FlowPolicy.SAME);
  }

  @Override
  PointerVariable freshCopy(ConstraintGraph graph) {
    ImmutableList.Builder<Atom> newAtoms = ImmutableList.builderWithExpectedSize(atoms.size());
    for (Atom atom : atoms) {
      if (atom.isVariable()) {
        newAtoms.add(graph.freshUnknown(atom.asVariable().getName(), getLocation()));
      } else {
        newAtoms.add(atom);
      }
    }
    return new PointerVariable(
        getName(),
        getLocation(),
        newAtoms.build(),
        type,
        functionVariable != null ? functionVariable.freshCopy(graph) : null,
        arrayDeclared,
        hasBoundsAnnotation,
        boundsKey);
  }

  @Override
  public void forEachAtom(Consumer<Atom> consumer) {
    atoms.forEach(consumer);
    if (functionVariable != null) {
      functionVariable.forEachAtom(consumer);
    }
  }

  public List<SafetyClass> getSolvedClasses(ConstraintSolution solution) {
    List<SafetyClass> classes = new ArrayList<>(atoms.size());
    for (Atom atom : atoms) {
      classes.add(solution.getAssignment(atom));
    }
    return classes;
  }

  public SafetyClass getSolvedOuterClass(ConstraintSolution solution) {
    Atom outer = getOuterAtom();
    return outer != null ? solution.getAssignment(outer) : null;
  }

  @Override
  public boolean hasChanged(ConstraintSolution solution) {
    for (Atom atom : atoms) {
      if (atom.isVariable() && !solution.isWild(atom)) {
        return true;
      }
    }
    return functionVariable != null && functionVariable.hasChanged(solution);
  }

  @Override
  public String toString(ConstraintSolution solution) {
    StringBuilder builder = new StringBuilder(getName()).append(" : [");
    for (int i = 0; i < atoms.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(solution.getAssignment(atoms.get(i)).getShortName());
    }
    builder.append("]");
    if (functionVariable != null) {
      builder.append(" -> ").append(functionVariable.toString(solution));
    }
    return builder.toString();
  }

  @Override
  public boolean isPointerVariable() {
    return true;
  }

  @Override
  public PointerVariable asPointerVariable() {
    return this;
  }

  @Override
  public String toString() {
    return getName() + atoms;
  }
}
