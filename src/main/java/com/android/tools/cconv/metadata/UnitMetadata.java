// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.metadata;

import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.bounds.ArrayBoundsInformation;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.FunctionVariable;
import com.android.tools.cconv.constraints.variables.PointerVariable;
import com.android.tools.cconv.program.TranslationUnitInfo;
import com.google.common.collect.ImmutableSet;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/** The solved state of the declarations of one translation unit. */
public class UnitMetadata {

  @Expose
  @SerializedName("file")
  private final String fileName;

  @Expose
  @SerializedName("variables")
  private final List<VariableMetadata> variables;

  @Expose
  @SerializedName("externalFunctions")
  private final Map<String, List<FunctionMetadata>> externalFunctions;

  @Expose
  @SerializedName("staticFunctions")
  private final Map<String, List<FunctionMetadata>> staticFunctions;

  private UnitMetadata(
      String fileName,
      List<VariableMetadata> variables,
      Map<String, List<FunctionMetadata>> externalFunctions,
      Map<String, List<FunctionMetadata>> staticFunctions) {
    this.fileName = fileName;
    this.variables = variables;
    this.externalFunctions = externalFunctions;
    this.staticFunctions = staticFunctions;
  }

  public static UnitMetadata create(TranslationUnitInfo unit, ConstraintSolution solution) {
    ArrayBoundsInformation boundsInformation = unit.getBoundsInformation();
    List<VariableMetadata> variables = new ArrayList<>();
    for (Entry<Declaration, ImmutableSet<ConstraintVariable>> entry :
        unit.getDeclarationVariables().entrySet()) {
      Declaration declaration = entry.getKey();
      if (declaration.isFunction() || declaration.isParameter()) {
        continue;
      }
      for (ConstraintVariable variable : entry.getValue()) {
        PointerVariable pointer = variable.asPointerVariable();
        variables.add(
            VariableMetadata.create(
                pointer,
                solution,
                pointer.hasBoundsKey()
                    ? boundsInformation.getBounds(pointer.getBoundsKey())
                    : null));
      }
    }
    Map<String, List<FunctionMetadata>> externalFunctions = new LinkedHashMap<>();
    unit.getExternalFunctionDefinitions()
        .forEach((name, function) -> add(externalFunctions, name, function, solution, unit));
    unit.getExternalFunctionDeclarations()
        .forEach(
            (name, functions) ->
                functions.forEach(
                    function -> add(externalFunctions, name, function, solution, unit)));
    Map<String, List<FunctionMetadata>> staticFunctions = new LinkedHashMap<>();
    unit.getStaticFunctionDefinitions()
        .forEach((name, function) -> add(staticFunctions, name, function, solution, unit));
    unit.getStaticFunctionDeclarations()
        .forEach(
            (name, functions) ->
                functions.forEach(
                    function -> add(staticFunctions, name, function, solution, unit)));
    return new UnitMetadata(unit.getFileName(), variables, externalFunctions, staticFunctions);
  }

  private static void add(
      Map<String, List<FunctionMetadata>> functions,
      String name,
      FunctionVariable function,
      ConstraintSolution solution,
      TranslationUnitInfo unit) {
    functions
        .computeIfAbsent(name, ignore -> new ArrayList<>())
        .add(FunctionMetadata.create(function, solution, unit.getBoundsInformation()));
  }

  public String getFileName() {
    return fileName;
  }

  public List<VariableMetadata> getVariables() {
    return variables;
  }

  public Map<String, List<FunctionMetadata>> getExternalFunctions() {
    return externalFunctions;
  }

  public Map<String, List<FunctionMetadata>> getStaticFunctions() {
    return staticFunctions;
  }
}
