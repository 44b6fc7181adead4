// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints.variables;

import com.android.tools.cconv.ast.FunctionType;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.constraints.Atom;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.FlowPolicy;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.function.Consumer;

/**
 * A function-shaped constraint variable.
 *
 * <p>Holds the return variable and one variable set per parameter. A function declaration gets one
 * function variable; a pointer to a function nests one inside its {@link PointerVariable}.
 */
public class FunctionVariable extends ConstraintVariable {

  private final FunctionType type;
  private final PointerVariable returnVariable;
  private final ImmutableList<ImmutableSet<ConstraintVariable>> parameterVariables;
  private final boolean hasBody;

  FunctionVariable(
      String name,
      SourceLocation location,
      FunctionType type,
      PointerVariable returnVariable,
      ImmutableList<ImmutableSet<ConstraintVariable>> parameterVariables,
      boolean hasBody) {
    super(name, location);
    this.type = type;
    this.returnVariable = returnVariable;
    this.parameterVariables = parameterVariables;
    this.hasBody = hasBody;
  }

  public FunctionType getType() {
    return type;
  }

  public PointerVariable getReturnVariable() {
    return returnVariable;
  }

  public int getNumberOfParameters() {
    return parameterVariables.size();
  }

  public ImmutableSet<ConstraintVariable> getParameterVariables(int index) {
    return parameterVariables.get(index);
  }

  public ImmutableList<ImmutableSet<ConstraintVariable>> getAllParameterVariables() {
    return parameterVariables;
  }

  public boolean hasBody() {
    return hasBody;
  }

  public boolean hasPrototype() {
    return type.hasPrototype();
  }

  public boolean isVariadic() {
    return type.isVariadic();
  }

  @Override
  public void constrainToWild(ConstraintGraph graph, String reason, SourceLocation location) {
    returnVariable.constrainToWild(graph, reason, location);
    for (ImmutableSet<ConstraintVariable> parameter : parameterVariables) {
      for (ConstraintVariable variable : parameter) {
        variable.constrainToWild(graph, reason, location);
      }
    }
  }

  @Override
  public FunctionVariable copy(ConstraintGraph graph, FlowPolicy policy) {
    FunctionVariable copy = freshCopy(graph);
    ConstraintVariables.constrainGeq(graph, copy, this, policy, null, null);
    return copy;
  }

  @Override
  FunctionVariable freshCopy(ConstraintGraph graph) {
    ImmutableList.Builder<ImmutableSet<ConstraintVariable>> parameters = ImmutableList.builder();
    for (ImmutableSet<ConstraintVariable> parameter : parameterVariables) {
      ImmutableSet.Builder<ConstraintVariable> copies = ImmutableSet.builder();
      parameter.forEach(variable -> copies.add(variable.freshCopy(graph)));
      parameters.add(copies.build());
    }
    return new FunctionVariable(
        getName(),
        getLocation(),
        type,
        returnVariable.freshCopy(graph),
        parameters.build(),
        false);
  }

  @Override
  public void forEachAtom(Consumer<Atom> consumer) {
    returnVariable.forEachAtom(consumer);
    for (ImmutableSet<ConstraintVariable> parameter : parameterVariables) {
      parameter.forEach(variable -> variable.forEachAtom(consumer));
    }
  }

  @Override
  public boolean hasChanged(ConstraintSolution solution) {
    if (returnVariable.hasChanged(solution)) {
      return true;
    }
    for (ImmutableSet<ConstraintVariable> parameter : parameterVariables) {
      for (ConstraintVariable variable : parameter) {
        if (variable.hasChanged(solution)) {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public String toString(ConstraintSolution solution) {
    StringBuilder builder = new StringBuilder(getName()).append("(");
    for (int i = 0; i < parameterVariables.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      ImmutableSet<ConstraintVariable> parameter = parameterVariables.get(i);
      builder.append(
          parameter.isEmpty() ? "?" : parameter.iterator().next().toString(solution));
    }
    return builder.append(") returns ").append(returnVariable.toString(solution)).toString();
  }

  @Override
  public boolean isFunctionVariable() {
    return true;
  }

  @Override
  public FunctionVariable asFunctionVariable() {
    return this;
  }
}
