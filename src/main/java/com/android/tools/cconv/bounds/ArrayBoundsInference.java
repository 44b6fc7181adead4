// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

import com.android.tools.cconv.ast.BinaryOperator;
import com.android.tools.cconv.ast.CType;
import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.ast.Expression;
import com.android.tools.cconv.ast.FieldDeclaration;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.ParameterDeclaration;
import com.android.tools.cconv.ast.RecordDeclaration;
import com.android.tools.cconv.bounds.ArrayBoundsInformation.AllocationCandidate;
import com.android.tools.cconv.bounds.ArrayBoundsInformation.PointerFlow;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.SafetyClass;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.PointerVariable;
import com.android.tools.cconv.errors.UnboundedArrayDiagnostic;
import com.android.tools.cconv.program.ProgramInfo;
import com.android.tools.cconv.program.TranslationUnitInfo;
import com.android.tools.cconv.resolver.AllocatorFunction;
import com.android.tools.cconv.utils.AnalysisOptions;
import com.android.tools.cconv.utils.timing.Timing;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Infers the bounds of the pointers that solved to an array class.
 *
 * <p>Rules are applied from the most to the least reliable: allocation sites, neighbouring
 * parameters, the main function, names, and finally propagation along assignments. Whatever
 * remains without bounds is reported as unbounded.
 */
public class ArrayBoundsInference {

  private final ProgramInfo program;
  private final AnalysisOptions options;
  private final ArrayBoundsInformation boundsInformation;
  private final ConstraintSolution solution;
  private final LengthNameHeuristics nameHeuristics;
  private final ArrayBoundsStats stats = new ArrayBoundsStats();

  private final Map<BoundsKey, PointerVariable> keyedVariables = new LinkedHashMap<>();

  public ArrayBoundsInference(ProgramInfo program) {
    this.program = program;
    this.options = program.getOptions();
    this.boundsInformation = program.getBoundsInformation();
    this.solution = program.getSolution();
    this.nameHeuristics = new LengthNameHeuristics(options.commonSubsequenceThresholdPercent);
  }

  public ArrayBoundsStats run(Timing timing) {
    timing.begin("Infer array bounds");
    collectKeyedVariables();
    inferFromAllocations();
    for (TranslationUnitInfo unit : program.getUnits()) {
      unit.getUnit()
          .forEachFunction(
              function -> {
                if (function.hasBody()) {
                  inferForParameters(unit, function);
                }
              });
      unit.getUnit().forEachRecord(record -> inferForFields(unit, record));
    }
    propagate();
    reportUnbounded();
    timing.end();
    return stats;
  }

  private void collectKeyedVariables() {
    for (TranslationUnitInfo unit : program.getUnits()) {
      for (Set<ConstraintVariable> variables : unit.getDeclarationVariables().values()) {
        for (ConstraintVariable variable : variables) {
          PointerVariable pointer =
              variable.isPointerVariable()
                  ? variable.asPointerVariable()
                  : variable.asFunctionVariable().getReturnVariable();
          if (pointer.hasBoundsKey()) {
            keyedVariables.putIfAbsent(pointer.getBoundsKey(), pointer);
          }
        }
      }
    }
  }

  private boolean needsBounds(PointerVariable variable, boolean includeNullTerminated) {
    if (variable.getNumberOfAtoms() == 0
        || variable.isArrayDeclared()
        || variable.hasBoundsAnnotation()
        || !variable.hasBoundsKey()) {
      return false;
    }
    SafetyClass outer = variable.getSolvedOuterClass(solution);
    return outer == SafetyClass.ARRAY
        || (includeNullTerminated && outer == SafetyClass.NT_ARRAY);
  }

  private BoundsScope scopeOf(PointerVariable variable) {
    return boundsInformation.getProgramVariable(variable.getBoundsKey()).getScope();
  }

  private void inferFromAllocations() {
    for (AllocationCandidate candidate : boundsInformation.getAllocationCandidates()) {
      PointerVariable target = candidate.getTarget();
      if (!needsBounds(target, true)) {
        continue;
      }
      BoundsKey key = target.getBoundsKey();
      Expression source = candidate.getSource();
      if (source.isStringLiteral()) {
        BoundsKey length =
            boundsInformation.getConstantKey(source.asStringLiteral().getByteLength());
        if (boundsInformation.mergeBounds(
            key, ArrayBounds.byteCount(boundsInformation.getProgramVariable(length)))) {
          stats.record(key, BoundsHeuristic.ALLOCATOR_MATCH);
        }
        continue;
      }
      ArrayBounds bounds = matchAllocation(target, source);
      if (bounds != null) {
        boundsInformation.confirmAllocationMatch(key, bounds);
        stats.record(key, BoundsHeuristic.ALLOCATOR_MATCH);
      }
    }
  }

  private ArrayBounds matchAllocation(PointerVariable target, Expression source) {
    AllocatorFunction allocator = AllocatorFunction.forCall(source);
    if (allocator == null) {
      return null;
    }
    List<Expression> factors = new ArrayList<>();
    ImmutableList<Expression> sizes = allocator.getSizeArguments(source.asCall());
    if (sizes.isEmpty()) {
      return null;
    }
    if (allocator == AllocatorFunction.CALLOC) {
      factors.addAll(sizes);
    } else if (!collectFactors(sizes.get(0), factors)) {
      return null;
    }
    CType elementType = null;
    Expression count = null;
    for (Expression factor : factors) {
      if (factor.isSizeOf()) {
        if (elementType != null) {
          return null;
        }
        elementType = factor.asSizeOf().getArgumentType();
      } else if (factor.isIntegerLiteral() || isVariableReference(factor)) {
        if (count != null) {
          return null;
        }
        count = factor;
      } else {
        return null;
      }
    }
    if (count == null) {
      return null;
    }
    ProgramVariable length =
        boundsInformation.getProgramVariable(boundsInformation.getVariable(count));
    if (!length.isUsableIn(scopeOf(target))) {
      return null;
    }
    if (elementType != null && isPointerTo(target.getType(), elementType)) {
      return ArrayBounds.elementCount(length);
    }
    return ArrayBounds.byteCount(length);
  }

  // Checked and unchecked pointers to the same element type count elements alike.
  private static boolean isPointerTo(CType type, CType elementType) {
    return type.isPointer() && type.asPointer().getPointeeType().equals(elementType);
  }

  private static boolean collectFactors(Expression size, List<Expression> factors) {
    Expression stripped = size.stripCasts();
    if (stripped.isBinary()) {
      if (stripped.asBinary().getOperator() != BinaryOperator.MUL) {
        return false;
      }
      return collectFactors(stripped.asBinary().getLeft(), factors)
          && collectFactors(stripped.asBinary().getRight(), factors);
    }
    factors.add(stripped);
    return true;
  }

  private static boolean isVariableReference(Expression expression) {
    return (expression.isDeclRef() && !expression.asDeclRef().getDeclaration().isFunction())
        || expression.isMember();
  }

  private void inferForParameters(TranslationUnitInfo unit, FunctionDeclaration function) {
    List<ParameterDeclaration> parameters = function.getParameters();
    Set<ParameterDeclaration> excluded = NonLengthParameterCollector.collect(function);
    List<ParameterDeclaration> lengthCandidates = new ArrayList<>();
    for (ParameterDeclaration parameter : parameters) {
      if (parameter.getType().isIntegerType() && !excluded.contains(parameter)) {
        lengthCandidates.add(parameter);
      }
    }
    boolean isMain = function.getName().equals("main") && parameters.size() == 2;
    for (int i = 0; i < parameters.size(); i++) {
      PointerVariable variable = getPointerVariable(unit, parameters.get(i));
      if (variable == null) {
        continue;
      }
      if (isMain && i == 1) {
        if (needsBounds(variable, true)) {
          bind(variable, parameters.get(0), BoundsHeuristic.MAIN_FUNCTION);
        }
        continue;
      }
      ParameterDeclaration next = i + 1 < parameters.size() ? parameters.get(i + 1) : null;
      boolean hasLengthNeighbour = next != null && lengthCandidates.contains(next);
      if (needsBounds(variable, false)) {
        if (hasLengthNeighbour) {
          bind(variable, next, BoundsHeuristic.NEIGHBOUR_PARAMETER);
          continue;
        }
        LengthNameHeuristics.Match match =
            nameHeuristics.select(parameters.get(i).getName(), lengthCandidates);
        if (match != null) {
          bind(variable, match.getLength(), match.getHeuristic());
        }
      } else if (needsBounds(variable, true)
          && hasLengthNeighbour
          && LengthNameHeuristics.isLengthKeyword(next.getName())) {
        bind(variable, next, BoundsHeuristic.NEIGHBOUR_PARAMETER);
      }
    }
  }

  private void inferForFields(TranslationUnitInfo unit, RecordDeclaration record) {
    List<FieldDeclaration> lengthCandidates = new ArrayList<>();
    for (FieldDeclaration field : record.getFields()) {
      if (field.getType().isIntegerType() && !field.getType().isEnum()) {
        lengthCandidates.add(field);
      }
    }
    for (FieldDeclaration field : record.getFields()) {
      PointerVariable variable = getPointerVariable(unit, field);
      if (variable == null || !needsBounds(variable, false)) {
        continue;
      }
      LengthNameHeuristics.Match match = nameHeuristics.select(field.getName(), lengthCandidates);
      if (match != null) {
        bind(variable, match.getLength(), match.getHeuristic());
      }
    }
  }

  private static PointerVariable getPointerVariable(
      TranslationUnitInfo unit, Declaration declaration) {
    if (!unit.hasVariables(declaration)) {
      return null;
    }
    for (ConstraintVariable variable : unit.getVariables(declaration)) {
      if (variable.isPointerVariable()) {
        return variable.asPointerVariable();
      }
    }
    return null;
  }

  private void bind(PointerVariable variable, Declaration length, BoundsHeuristic heuristic) {
    ProgramVariable lengthVariable =
        boundsInformation.getProgramVariable(boundsInformation.getVariable(length));
    BoundsKey key = variable.getBoundsKey();
    if (boundsInformation.replaceBounds(key, ArrayBounds.elementCount(lengthVariable))) {
      stats.record(key, heuristic);
    }
  }

  private void propagate() {
    List<PointerFlow> flows = boundsInformation.getPointerFlows();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (PointerFlow flow : flows) {
        BoundsKey target = flow.getTarget();
        PointerVariable variable = keyedVariables.get(target);
        if (variable == null
            || boundsInformation.hasBounds(target)
            || !needsBounds(variable, true)) {
          continue;
        }
        ArrayBounds bounds = boundsInformation.getBounds(flow.getSource());
        if (bounds == null) {
          bounds = boundsInformation.getBounds(boundsInformation.getOriginKey(flow.getSource()));
        }
        if (bounds == null
            || bounds.isUnbounded()
            || !bounds.getLengthVariable().isUsableIn(scopeOf(variable))) {
          continue;
        }
        boundsInformation.mergeBounds(target, bounds);
        stats.record(target, BoundsHeuristic.PROPAGATED);
        changed = true;
      }
    }
  }

  private void reportUnbounded() {
    for (PointerVariable variable : keyedVariables.values()) {
      BoundsKey key = variable.getBoundsKey();
      if (!needsBounds(variable, false) || boundsInformation.hasBounds(key)) {
        continue;
      }
      boundsInformation.mergeBounds(key, ArrayBounds.unbounded());
      stats.record(key, BoundsHeuristic.UNBOUNDED);
      options
          .getReporter()
          .warning(new UnboundedArrayDiagnostic(variable.getName(), variable.getLocation()));
    }
  }
}
