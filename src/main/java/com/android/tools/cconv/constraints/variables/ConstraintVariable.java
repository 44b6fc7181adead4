// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints.variables;

import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.constraints.Atom;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.FlowPolicy;
import java.util.function.Consumer;

/**
 * The constraint-side view of a declaration or expression value.
 *
 * <p>Either pointer shaped ({@link PointerVariable}) or function shaped ({@link
 * FunctionVariable}).
 */
public abstract class ConstraintVariable {

  private final String name;
  private final SourceLocation location;

  ConstraintVariable(String name, SourceLocation location) {
    this.name = name;
    this.location = location;
  }

  public String getName() {
    return name;
  }

  public SourceLocation getLocation() {
    return location;
  }

  public boolean isPointerVariable() {
    return false;
  }

  public PointerVariable asPointerVariable() {
    return null;
  }

  public boolean isFunctionVariable() {
    return false;
  }

  public FunctionVariable asFunctionVariable() {
    return null;
  }

  /** Forces every unknown reachable from this variable to be wild. */
  public abstract void constrainToWild(
      ConstraintGraph graph, String reason, SourceLocation location);

  /** Creates an independent variable of the same shape linked to this one by the policy. */
  public abstract ConstraintVariable copy(ConstraintGraph graph, FlowPolicy policy);

  public ConstraintVariable copy(ConstraintGraph graph) {
    return copy(graph, FlowPolicy.SAME);
  }

  /** Creates a variable of the same shape with fresh unknowns that is not linked to this one. */
  abstract ConstraintVariable freshCopy(ConstraintGraph graph);

  /** Visits all atoms, including those of nested function variables. */
  public abstract void forEachAtom(Consumer<Atom> consumer);

  /** True if at least one unchecked level resolved to a checked class. */
  public abstract boolean hasChanged(ConstraintSolution solution);

  public abstract String toString(ConstraintSolution solution);

  @Override
  public String toString() {
    return name;
  }
}
