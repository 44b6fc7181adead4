// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.program;

import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.Linkage;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.ast.TranslationUnit;
import com.android.tools.cconv.ast.VariableDeclaration;
import com.android.tools.cconv.bounds.ArrayBoundsInformation;
import com.android.tools.cconv.constraints.AtomFactory;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.ConstraintVariableFactory;
import com.android.tools.cconv.constraints.variables.FunctionVariable;
import com.android.tools.cconv.constraints.variables.PointerVariable;
import com.android.tools.cconv.errors.InternalAnalysisError;
import com.android.tools.cconv.resolver.ExpressionConstraintResolver;
import com.android.tools.cconv.utils.AnalysisOptions;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The constraint variables and constraint graph of a single translation unit.
 *
 * <p>Each unit owns its graph so that units can be processed concurrently. All graphs share one
 * {@link AtomFactory}, which makes atom ids unique across the program and the graphs mergeable.
 */
public class TranslationUnitInfo {

  private final TranslationUnit unit;
  private final AnalysisOptions options;
  private final ConstraintGraph graph;
  private final ArrayBoundsInformation boundsInformation;
  private final ConstraintVariableFactory variableFactory;
  private final ExpressionConstraintResolver resolver;

  // Declarations are compared by identity.
  private final Map<Declaration, ImmutableSet<ConstraintVariable>> declarationVariables =
      new LinkedHashMap<>();
  private final Map<SourceLocation, ConstraintVariable> variablesByLocation =
      new LinkedHashMap<>();
  private final Map<FunctionDeclaration, FunctionVariable> functionVariables =
      new IdentityHashMap<>();
  private final Map<String, List<FunctionVariable>> externalFunctionDeclarations =
      new LinkedHashMap<>();
  private final Map<String, FunctionVariable> externalFunctionDefinitions = new LinkedHashMap<>();
  private final Map<String, List<FunctionVariable>> staticFunctionDeclarations =
      new LinkedHashMap<>();
  private final Map<String, FunctionVariable> staticFunctionDefinitions = new LinkedHashMap<>();
  private final Map<String, List<PointerVariable>> globalVariableSymbols = new LinkedHashMap<>();

  public TranslationUnitInfo(
      TranslationUnit unit,
      AtomFactory atomFactory,
      ArrayBoundsInformation boundsInformation,
      AnalysisOptions options) {
    this.unit = unit;
    this.options = options;
    this.graph = new ConstraintGraph(atomFactory);
    this.boundsInformation = boundsInformation;
    this.variableFactory = new ConstraintVariableFactory(graph, boundsInformation);
    this.resolver = new ExpressionConstraintResolver(this);
  }

  public TranslationUnit getUnit() {
    return unit;
  }

  public String getFileName() {
    return unit.getFileName();
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

  public ConstraintVariableFactory getVariableFactory() {
    return variableFactory;
  }

  public ExpressionConstraintResolver getResolver() {
    return resolver;
  }

  /** Creates and registers the variable of a variable, parameter-less global or field. */
  public PointerVariable addVariable(Declaration declaration) {
    assert !declaration.isFunction() && !declaration.isParameter();
    PointerVariable variable = variableFactory.createPointerVariable(declaration);
    register(declaration, ImmutableSet.of(variable));
    if (declaration.isVariable()) {
      VariableDeclaration global = declaration.asVariable();
      // Internal globals of different units are distinct even when they share a name.
      if (global.isGlobal() && global.getLinkage() != Linkage.INTERNAL) {
        globalVariableSymbols
            .computeIfAbsent(global.getName(), ignore -> new ArrayList<>())
            .add(variable);
      }
    }
    return variable;
  }

  /** Creates and registers the variable of a function and of its parameters. */
  public FunctionVariable addFunction(FunctionDeclaration function) {
    FunctionVariable existing = functionVariables.get(function);
    if (existing != null) {
      return existing;
    }
    FunctionVariable variable = createFunctionVariable(function);
    register(function, ImmutableSet.of(variable));
    for (int i = 0; i < function.getNumberOfParameters(); i++) {
      register(function.getParameter(i), variable.getParameterVariables(i));
    }
    return variable;
  }

  private FunctionVariable createFunctionVariable(FunctionDeclaration function) {
    FunctionVariable variable =
        variableFactory.createFunctionVariable(function, function.hasBody());
    functionVariables.put(function, variable);
    String name = function.getName();
    if (function.isStatic()) {
      if (function.hasBody()) {
        staticFunctionDefinitions.putIfAbsent(name, variable);
      } else {
        staticFunctionDeclarations.computeIfAbsent(name, ignore -> new ArrayList<>()).add(variable);
      }
    } else {
      if (function.hasBody()) {
        externalFunctionDefinitions.putIfAbsent(name, variable);
      } else {
        externalFunctionDeclarations
            .computeIfAbsent(name, ignore -> new ArrayList<>())
            .add(variable);
      }
    }
    return variable;
  }

  private void register(Declaration declaration, ImmutableSet<ConstraintVariable> variables) {
    declarationVariables.put(declaration, variables);
    if (variables.size() == 1) {
      variablesByLocation.putIfAbsent(declaration.getLocation(), variables.iterator().next());
    }
  }

  public boolean hasVariables(Declaration declaration) {
    return declarationVariables.containsKey(declaration);
  }

  public ImmutableSet<ConstraintVariable> getVariables(Declaration declaration) {
    ImmutableSet<ConstraintVariable> variables = declarationVariables.get(declaration);
    if (variables == null) {
      throw new InternalAnalysisError(
          "No constraint variable for "
              + declaration.getName()
              + " at "
              + declaration.getLocation());
    }
    return variables;
  }

  /**
   * The variable of a function declaration.
   *
   * <p>Functions that are referenced but not declared in this unit get a variable on demand. Such
   * a variable takes part in linking but has no source location of its own in this unit.
   */
  public FunctionVariable getFunctionVariable(FunctionDeclaration function) {
    FunctionVariable variable = functionVariables.get(function);
    if (variable == null) {
      variable = createFunctionVariable(function);
      declarationVariables.put(function, ImmutableSet.of(variable));
      for (int i = 0; i < function.getNumberOfParameters(); i++) {
        declarationVariables.put(function.getParameter(i), variable.getParameterVariables(i));
      }
    }
    return variable;
  }

  public Map<Declaration, ImmutableSet<ConstraintVariable>> getDeclarationVariables() {
    return Collections.unmodifiableMap(declarationVariables);
  }

  public Map<SourceLocation, ConstraintVariable> getVariablesByLocation() {
    return Collections.unmodifiableMap(variablesByLocation);
  }

  public Map<String, List<FunctionVariable>> getExternalFunctionDeclarations() {
    return Collections.unmodifiableMap(externalFunctionDeclarations);
  }

  public Map<String, FunctionVariable> getExternalFunctionDefinitions() {
    return Collections.unmodifiableMap(externalFunctionDefinitions);
  }

  public Map<String, List<FunctionVariable>> getStaticFunctionDeclarations() {
    return Collections.unmodifiableMap(staticFunctionDeclarations);
  }

  public Map<String, FunctionVariable> getStaticFunctionDefinitions() {
    return Collections.unmodifiableMap(staticFunctionDefinitions);
  }

  public Map<String, List<PointerVariable>> getGlobalVariableSymbols() {
    return Collections.unmodifiableMap(globalVariableSymbols);
  }

  public Set<FunctionDeclaration> getFunctionDeclarations() {
    return Collections.unmodifiableSet(functionVariables.keySet());
  }

  @Override
  public String toString() {
    return unit.getFileName();
  }
}
