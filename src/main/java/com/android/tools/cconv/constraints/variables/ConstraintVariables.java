// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints.variables;

import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.constraints.Atom;
import com.android.tools.cconv.constraints.ConstAtom;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.FlowPolicy;
import com.android.tools.cconv.errors.InternalAnalysisError;
import java.util.Collection;

/** Helpers for emitting edges between sets of constraint variables. */
public class ConstraintVariables {

  private ConstraintVariables() {}

  public static void constrainGeq(
      ConstraintGraph graph,
      Collection<? extends ConstraintVariable> lhs,
      Collection<? extends ConstraintVariable> rhs,
      FlowPolicy policy,
      String reason,
      SourceLocation location) {
    for (ConstraintVariable left : lhs) {
      for (ConstraintVariable right : rhs) {
        constrainGeq(graph, left, right, policy, reason, location);
      }
    }
  }

  /**
   * Links two variables level by level.
   *
   * <p>The policy only applies to the outermost pair of atoms. Inner levels are always linked
   * {@link FlowPolicy#SAME}, since a pointer to a wild pointer cannot safely point to a checked
   * one. Function variables link their returns with the policy and their parameters with the
   * inverted policy.
   */
  public static void constrainGeq(
      ConstraintGraph graph,
      ConstraintVariable lhs,
      ConstraintVariable rhs,
      FlowPolicy policy,
      String reason,
      SourceLocation location) {
    if (lhs == rhs) {
      return;
    }
    if (lhs.isPointerVariable() && rhs.isPointerVariable()) {
      PointerVariable left = lhs.asPointerVariable();
      PointerVariable right = rhs.asPointerVariable();
      int levels = Math.min(left.getNumberOfAtoms(), right.getNumberOfAtoms());
      for (int i = 0; i < levels; i++) {
        constrainAtoms(
            graph,
            left.getAtoms().get(i),
            right.getAtoms().get(i),
            i == 0 ? policy : FlowPolicy.SAME,
            reason,
            location);
      }
      if (left.hasFunctionVariable() && right.hasFunctionVariable()) {
        constrainGeq(
            graph,
            left.getFunctionVariable(),
            right.getFunctionVariable(),
            FlowPolicy.SAME,
            reason,
            location);
      }
      return;
    }
    FunctionVariable left = asFunction(lhs);
    FunctionVariable right = asFunction(rhs);
    if (left == null || right == null) {
      // A pointer to a non-function meets a function: nothing to pair up.
      return;
    }
    constrainGeq(
        graph, left.getReturnVariable(), right.getReturnVariable(), policy, reason, location);
    int parameters = Math.min(left.getNumberOfParameters(), right.getNumberOfParameters());
    for (int i = 0; i < parameters; i++) {
      constrainGeq(
          graph,
          left.getParameterVariables(i),
          right.getParameterVariables(i),
          policy.invert(),
          reason,
          location);
    }
  }

  private static FunctionVariable asFunction(ConstraintVariable variable) {
    if (variable.isFunctionVariable()) {
      return variable.asFunctionVariable();
    }
    return variable.asPointerVariable().getFunctionVariable();
  }

  private static void constrainAtoms(
      ConstraintGraph graph,
      Atom lhs,
      Atom rhs,
      FlowPolicy policy,
      String reason,
      SourceLocation location) {
    switch (policy) {
      case SAME:
        graph.addGeq(lhs, rhs, reason, location);
        graph.addGeq(rhs, lhs, reason, location);
        break;
      case SAFE_TO_WILD:
        graph.addGeq(lhs, rhs, reason, location);
        break;
      case WILD_TO_SAFE:
        graph.addGeq(rhs, lhs, reason, location);
        break;
      default:
        throw new InternalAnalysisError("Unexpected flow policy: " + policy);
    }
  }

  public static void constrainAllToWild(
      ConstraintGraph graph,
      Collection<? extends ConstraintVariable> variables,
      String reason,
      SourceLocation location) {
    for (ConstraintVariable variable : variables) {
      variable.constrainToWild(graph, reason, location);
    }
  }

  public static void constrainOuterTo(
      ConstraintGraph graph,
      Collection<? extends ConstraintVariable> variables,
      ConstAtom bound,
      String reason,
      SourceLocation location) {
    for (ConstraintVariable variable : variables) {
      if (variable.isPointerVariable()) {
        variable.asPointerVariable().constrainOuterTo(graph, bound, reason, location);
      }
    }
  }
}
