// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.program;

import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.ast.TranslationUnit;
import com.android.tools.cconv.bounds.ArrayBoundsInformation;
import com.android.tools.cconv.constraints.AtomFactory;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.ConstraintSolver;
import com.android.tools.cconv.constraints.FlowPolicy;
import com.android.tools.cconv.constraints.Geq;
import com.android.tools.cconv.constraints.SafetyClass;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.ConstraintVariables;
import com.android.tools.cconv.constraints.variables.FunctionVariable;
import com.android.tools.cconv.constraints.variables.PointerVariable;
import com.android.tools.cconv.errors.ConflictingDeclarationsDiagnostic;
import com.android.tools.cconv.errors.ConstraintConflictDiagnostic;
import com.android.tools.cconv.utils.AnalysisOptions;
import com.android.tools.cconv.utils.timing.Timing;
import com.google.common.collect.ImmutableSet;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * The whole-program view: the merged constraint graph of all translation units and the links
 * between declarations of the same entity in different units.
 */
public class ProgramInfo {

  static final String INCOMPATIBLE_DECLARATIONS = "Incompatible declarations of function";

  private final AnalysisOptions options;
  private final AtomFactory atomFactory = new AtomFactory();
  private final ArrayBoundsInformation boundsInformation = new ArrayBoundsInformation();
  private final ConstraintGraph graph = new ConstraintGraph(atomFactory);
  private final List<TranslationUnitInfo> units = new ArrayList<>();

  private final Map<SourceLocation, List<ConstraintVariable>> variablesByLocation =
      new LinkedHashMap<>();
  private final Map<String, List<FunctionVariable>> externalFunctionDeclarations =
      new LinkedHashMap<>();
  private final Map<String, List<FunctionVariable>> externalFunctionDefinitions =
      new LinkedHashMap<>();
  private final Map<String, List<PointerVariable>> globalVariableSymbols = new LinkedHashMap<>();

  private ConstraintSolution solution;

  public ProgramInfo(AnalysisOptions options) {
    this.options = options;
  }

  public AnalysisOptions getOptions() {
    return options;
  }

  public ConstraintGraph getGraph() {
    return graph;
  }

  public ArrayBoundsInformation getBoundsInformation() {
    return boundsInformation;
  }

  public List<TranslationUnitInfo> getUnits() {
    return Collections.unmodifiableList(units);
  }

  public TranslationUnitInfo createUnitInfo(TranslationUnit unit) {
    return new TranslationUnitInfo(unit, atomFactory, boundsInformation, options);
  }

  /** Adds the graph and the symbol tables of a unit. Units must be merged in input order. */
  public void merge(TranslationUnitInfo unit) {
    graph.mergeFrom(unit.getGraph());
    units.add(unit);
    unit.getVariablesByLocation()
        .forEach(
            (location, variable) ->
                variablesByLocation
                    .computeIfAbsent(location, ignore -> new ArrayList<>())
                    .add(variable));
    unit.getExternalFunctionDeclarations()
        .forEach(
            (name, functions) ->
                externalFunctionDeclarations
                    .computeIfAbsent(name, ignore -> new ArrayList<>())
                    .addAll(functions));
    unit.getExternalFunctionDefinitions()
        .forEach(
            (name, function) ->
                externalFunctionDefinitions
                    .computeIfAbsent(name, ignore -> new ArrayList<>())
                    .add(function));
    unit.getGlobalVariableSymbols()
        .forEach(
            (name, variables) ->
                globalVariableSymbols
                    .computeIfAbsent(name, ignore -> new ArrayList<>())
                    .addAll(variables));
  }

  /** Links declarations of the same entity. Must be called after all units are merged. */
  public void link() {
    for (List<ConstraintVariable> variables : variablesByLocation.values()) {
      linkAll(variables);
    }
    for (List<PointerVariable> variables : globalVariableSymbols.values()) {
      linkAll(variables);
    }
    for (Entry<String, List<FunctionVariable>> entry : externalFunctionDeclarations.entrySet()) {
      linkDeclarations(entry.getKey(), entry.getValue());
    }
    for (Entry<String, List<FunctionVariable>> entry : externalFunctionDefinitions.entrySet()) {
      List<FunctionVariable> definitions = entry.getValue();
      linkDeclarations(entry.getKey(), definitions);
      FunctionVariable definition = definitions.get(0);
      for (FunctionVariable declaration :
          externalFunctionDeclarations.getOrDefault(entry.getKey(), Collections.emptyList())) {
        linkDefinition(entry.getKey(), declaration, definition);
      }
    }
    for (TranslationUnitInfo unit : units) {
      unit.getStaticFunctionDeclarations()
          .forEach(
              (name, declarations) -> {
                linkDeclarations(name, declarations);
                FunctionVariable definition = unit.getStaticFunctionDefinitions().get(name);
                for (FunctionVariable declaration : declarations) {
                  if (definition != null) {
                    linkDefinition(name, declaration, definition);
                  } else {
                    constrainExternalToWild(name, declaration);
                  }
                }
              });
    }
    for (Entry<String, List<FunctionVariable>> entry : externalFunctionDeclarations.entrySet()) {
      String name = entry.getKey();
      if (externalFunctionDefinitions.containsKey(name) || options.isExternOkay(name)) {
        continue;
      }
      options.verbose("No definition of external function " + name);
      for (FunctionVariable declaration : entry.getValue()) {
        constrainExternalToWild(name, declaration);
      }
    }
  }

  private void linkAll(List<? extends ConstraintVariable> variables) {
    for (int i = 1; i < variables.size(); i++) {
      ConstraintVariables.constrainGeq(
          graph, variables.get(0), variables.get(i), FlowPolicy.SAME, null, null);
    }
  }

  private void linkDeclarations(String name, List<FunctionVariable> declarations) {
    FunctionVariable first = declarations.get(0);
    for (int i = 1; i < declarations.size(); i++) {
      FunctionVariable other = declarations.get(i);
      if (checkCompatible(name, first, other)) {
        ConstraintVariables.constrainGeq(graph, first, other, FlowPolicy.SAME, null, null);
      }
    }
  }

  /**
   * Links a declaration to the definition it refers to.
   *
   * <p>Wildness of the definition's return flows to the declaration's return. Wildness of a
   * definition's parameter flows to the declaration's parameter.
   */
  private void linkDefinition(
      String name, FunctionVariable declaration, FunctionVariable definition) {
    if (!checkCompatible(name, declaration, definition)) {
      return;
    }
    ConstraintVariables.constrainGeq(
        graph,
        declaration.getReturnVariable(),
        definition.getReturnVariable(),
        FlowPolicy.SAFE_TO_WILD,
        null,
        null);
    int parameters =
        Math.min(declaration.getNumberOfParameters(), definition.getNumberOfParameters());
    for (int i = 0; i < parameters; i++) {
      ConstraintVariables.constrainGeq(
          graph,
          definition.getParameterVariables(i),
          declaration.getParameterVariables(i),
          FlowPolicy.WILD_TO_SAFE,
          null,
          null);
    }
  }

  // Prototypes that disagree on the number of parameters cannot be checked against each other.
  private boolean checkCompatible(String name, FunctionVariable first, FunctionVariable second) {
    if (first.getNumberOfParameters() == second.getNumberOfParameters()
        || !first.hasPrototype()
        || !second.hasPrototype()) {
      return true;
    }
    SourceLocation location = second.getLocation();
    first.constrainToWild(graph, INCOMPATIBLE_DECLARATIONS, first.getLocation());
    second.constrainToWild(graph, INCOMPATIBLE_DECLARATIONS, location);
    options
        .getReporter()
        .warning(new ConflictingDeclarationsDiagnostic(name, first.getLocation(), location));
    return false;
  }

  private void constrainExternalToWild(String name, FunctionVariable declaration) {
    declaration
        .getReturnVariable()
        .constrainToWild(
            graph, "Return value of an external function: " + name, declaration.getLocation());
    String reason = "Inner pointer of a parameter to external function: " + name;
    for (ImmutableSet<ConstraintVariable> parameter : declaration.getAllParameterVariables()) {
      for (ConstraintVariable variable : parameter) {
        if (variable.isPointerVariable() && variable.asPointerVariable().hasBoundsAnnotation()) {
          continue;
        }
        variable.constrainToWild(graph, reason, variable.getLocation());
      }
    }
  }

  public ConstraintSolution solve(Timing timing) {
    solution = new ConstraintSolver(graph).solve(timing);
    for (Geq conflict : solution.getConflicts()) {
      options.getReporter().warning(new ConstraintConflictDiagnostic(conflict));
    }
    return solution;
  }

  public boolean isSolved() {
    return solution != null;
  }

  public ConstraintSolution getSolution() {
    return graph.getSolution();
  }

  /** All variables of {@code declaration}, over every unit that declares it. */
  public List<ConstraintVariable> getVariables(Declaration declaration) {
    List<ConstraintVariable> result = new ArrayList<>();
    for (TranslationUnitInfo unit : units) {
      if (unit.hasVariables(declaration)) {
        result.addAll(unit.getVariables(declaration));
      }
    }
    return result;
  }

  /** Counts the solved classes of the declared pointers of each file. */
  public Map<String, Map<SafetyClass, Integer>> computeFileStatistics() {
    ConstraintSolution solved = getSolution();
    Map<String, Map<SafetyClass, Integer>> statistics = new LinkedHashMap<>();
    for (TranslationUnitInfo unit : units) {
      Map<SafetyClass, Integer> counts =
          statistics.computeIfAbsent(unit.getFileName(), ignore -> emptyCounts());
      IntSet seen = new IntOpenHashSet();
      for (ImmutableSet<ConstraintVariable> variables :
          unit.getDeclarationVariables().values()) {
        for (ConstraintVariable variable : variables) {
          variable.forEachAtom(
              atom -> {
                if (atom.isVariable() && seen.add(atom.asVariable().getId())) {
                  counts.merge(solved.getAssignment(atom), 1, Integer::sum);
                }
              });
        }
      }
    }
    return statistics;
  }

  private static Map<SafetyClass, Integer> emptyCounts() {
    Map<SafetyClass, Integer> counts = new EnumMap<>(SafetyClass.class);
    for (SafetyClass safetyClass : SafetyClass.values()) {
      counts.put(safetyClass, 0);
    }
    return counts;
  }
}
