// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.metadata;

import com.android.tools.cconv.bounds.ArrayBoundsInformation;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.FunctionVariable;
import com.android.tools.cconv.constraints.variables.PointerVariable;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.List;

/** The solved state of a function declaration or definition. */
public class FunctionMetadata {

  @Expose
  @SerializedName("name")
  private final String name;

  @Expose
  @SerializedName("hasBody")
  private final boolean hasBody;

  @Expose
  @SerializedName("return")
  private final VariableMetadata returnVariable;

  @Expose
  @SerializedName("parameters")
  private final List<VariableMetadata> parameters;

  private FunctionMetadata(
      String name,
      boolean hasBody,
      VariableMetadata returnVariable,
      List<VariableMetadata> parameters) {
    this.name = name;
    this.hasBody = hasBody;
    this.returnVariable = returnVariable;
    this.parameters = parameters;
  }

  public static FunctionMetadata create(
      FunctionVariable function,
      ConstraintSolution solution,
      ArrayBoundsInformation boundsInformation) {
    List<VariableMetadata> parameters = new ArrayList<>();
    for (int i = 0; i < function.getNumberOfParameters(); i++) {
      for (ConstraintVariable parameter : function.getParameterVariables(i)) {
        if (parameter.isPointerVariable()) {
          parameters.add(create(parameter.asPointerVariable(), solution, boundsInformation));
        }
      }
    }
    return new FunctionMetadata(
        function.getName(),
        function.hasBody(),
        create(function.getReturnVariable(), solution, boundsInformation),
        parameters);
  }

  private static VariableMetadata create(
      PointerVariable variable,
      ConstraintSolution solution,
      ArrayBoundsInformation boundsInformation) {
    return VariableMetadata.create(
        variable,
        solution,
        variable.hasBoundsKey() ? boundsInformation.getBounds(variable.getBoundsKey()) : null);
  }

  public String getName() {
    return name;
  }

  public boolean hasBody() {
    return hasBody;
  }

  public VariableMetadata getReturnVariable() {
    return returnVariable;
  }

  public List<VariableMetadata> getParameters() {
    return parameters;
  }
}
