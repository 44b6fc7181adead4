// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints.variables;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.cconv.ast.AstFactory;
import com.android.tools.cconv.ast.CType;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.bounds.ArrayBoundsInformation;
import com.android.tools.cconv.constraints.Atom;
import com.android.tools.cconv.constraints.ConstAtom;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.ConstraintSolver;
import com.android.tools.cconv.constraints.FlowPolicy;
import com.android.tools.cconv.constraints.SafetyClass;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class ConstraintVariablesTest {

  private static final SourceLocation LOCATION = SourceLocation.create("test.c", 1, 1);
  private static final CType INT_PTR_PTR = CType.pointerTo(CType.pointerTo(CType.intType()));

  private final ConstraintGraph graph = new ConstraintGraph();
  private final ConstraintVariableFactory factory =
      new ConstraintVariableFactory(graph, new ArrayBoundsInformation());

  private PointerVariable pointer(String name) {
    return factory.createPointerVariable(name, INT_PTR_PTR, LOCATION);
  }

  private static void makeWild(ConstraintGraph graph, Atom atom) {
    graph.addGeq(atom, ConstAtom.WILD, "test", LOCATION);
  }

  @Test
  public void testSafeToWildOnlyLowersTheLeftSide() {
    PointerVariable left = pointer("left");
    PointerVariable right = pointer("right");
    PointerVariable other = pointer("other");
    ConstraintVariables.constrainGeq(graph, left, right, FlowPolicy.SAFE_TO_WILD, null, null);
    ConstraintVariables.constrainGeq(graph, other, left, FlowPolicy.SAFE_TO_WILD, null, null);
    makeWild(graph, right.getOuterAtom());
    ConstraintSolution solution = new ConstraintSolver(graph).solve();
    assertTrue(solution.isWild(left.getOuterAtom()));
    assertTrue(solution.isWild(other.getOuterAtom()));
    assertFalse(solution.isWild(right.dereference().getOuterAtom()));
  }

  @Test
  public void testWildToSafeOnlyLowersTheRightSide() {
    PointerVariable left = pointer("left");
    PointerVariable right = pointer("right");
    ConstraintVariables.constrainGeq(graph, left, right, FlowPolicy.WILD_TO_SAFE, null, null);
    makeWild(graph, right.getOuterAtom());
    ConstraintSolution solution = new ConstraintSolver(graph).solve();
    assertFalse(solution.isWild(left.getOuterAtom()));
    assertTrue(solution.isWild(right.getOuterAtom()));
  }

  @Test
  public void testInnerLevelsAreAlwaysEqual() {
    PointerVariable left = pointer("left");
    PointerVariable right = pointer("right");
    ConstraintVariables.constrainGeq(graph, left, right, FlowPolicy.SAFE_TO_WILD, null, null);
    makeWild(graph, left.getAtoms().get(1));
    ConstraintSolution solution = new ConstraintSolver(graph).solve();
    assertTrue(solution.isWild(right.getAtoms().get(1)));
    assertFalse(solution.isWild(right.getOuterAtom()));
  }

  @Test
  public void testFunctionParametersUseTheInvertedPolicy() {
    AstFactory f = new AstFactory("test.c");
    CType intPtr = CType.pointerTo(CType.intType());
    FunctionDeclaration declaration = f.prototype("g", intPtr, f.parameter("p", intPtr));
    FunctionVariable left = factory.createFunctionVariable(declaration, false);
    FunctionVariable right = factory.createFunctionVariable(declaration, false);
    ConstraintVariables.constrainGeq(graph, left, right, FlowPolicy.SAFE_TO_WILD, null, null);
    makeWild(graph, right.getReturnVariable().getOuterAtom());
    PointerVariable leftParameter =
        left.getParameterVariables(0).iterator().next().asPointerVariable();
    PointerVariable rightParameter =
        right.getParameterVariables(0).iterator().next().asPointerVariable();
    makeWild(graph, leftParameter.getOuterAtom());
    ConstraintSolution solution = new ConstraintSolver(graph).solve();

    assertTrue(solution.isWild(left.getReturnVariable().getOuterAtom()));
    assertTrue(solution.isWild(rightParameter.getOuterAtom()));
  }

  @Test
  public void testOneWayPoliciesDoNotDependOnOrder() {
    List<SafetyClass> forward = solveChain(false);
    List<SafetyClass> backward = solveChain(true);
    assertEquals(forward, backward);
  }

  private static List<SafetyClass> solveChain(boolean reversed) {
    ConstraintGraph graph = new ConstraintGraph();
    ConstraintVariableFactory factory =
        new ConstraintVariableFactory(graph, new ArrayBoundsInformation());
    List<PointerVariable> variables = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      variables.add(factory.createPointerVariable("v" + i, INT_PTR_PTR, LOCATION));
    }
    List<Runnable> edges = new ArrayList<>();
    edges.add(
        () ->
            ConstraintVariables.constrainGeq(
                graph, variables.get(0), variables.get(1), FlowPolicy.SAFE_TO_WILD, null, null));
    edges.add(
        () ->
            ConstraintVariables.constrainGeq(
                graph, variables.get(2), variables.get(1), FlowPolicy.WILD_TO_SAFE, null, null));
    edges.add(
        () ->
            ConstraintVariables.constrainGeq(
                graph, variables.get(3), variables.get(2), FlowPolicy.SAFE_TO_WILD, null, null));
    edges.add(() -> makeWild(graph, variables.get(1).getOuterAtom()));
    edges.add(
        () ->
            variables.get(2).constrainOuterTo(graph, ConstAtom.ARRAY, "test", LOCATION));
    if (reversed) {
      for (int i = edges.size() - 1; i >= 0; i--) {
        edges.get(i).run();
      }
    } else {
      edges.forEach(Runnable::run);
    }
    ConstraintSolution solution = new ConstraintSolver(graph).solve();
    List<SafetyClass> classes = new ArrayList<>();
    for (PointerVariable variable : variables) {
      classes.addAll(variable.getSolvedClasses(solution));
    }
    return classes;
  }
}
