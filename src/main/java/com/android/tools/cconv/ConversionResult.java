// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv;

import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.bounds.ArrayBounds;
import com.android.tools.cconv.bounds.ArrayBoundsInformation;
import com.android.tools.cconv.bounds.ArrayBoundsStats;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.SafetyClass;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.PointerVariable;
import com.android.tools.cconv.errors.InternalAnalysisError;
import com.android.tools.cconv.metadata.ConversionMetadata;
import com.android.tools.cconv.metadata.ConversionStatsMetadata;
import com.android.tools.cconv.program.ProgramInfo;
import com.android.tools.cconv.rootcause.WildPointerReport;
import com.android.tools.cconv.utils.Reporter;
import java.util.List;

/** The solved state of a {@link CConv} run. */
public class ConversionResult {

  private final ProgramInfo program;
  private final WildPointerReport wildPointerReport;
  private final ArrayBoundsStats boundsStats;
  private final ConversionStatsMetadata stats;
  private final Reporter reporter;

  ConversionResult(
      ProgramInfo program,
      WildPointerReport wildPointerReport,
      ArrayBoundsStats boundsStats,
      ConversionStatsMetadata stats,
      Reporter reporter) {
    this.program = program;
    this.wildPointerReport = wildPointerReport;
    this.boundsStats = boundsStats;
    this.stats = stats;
    this.reporter = reporter;
  }

  public ProgramInfo getProgram() {
    return program;
  }

  public ConstraintSolution getSolution() {
    return program.getSolution();
  }

  /** The variables of {@code declaration} in every unit that declares it. */
  public List<ConstraintVariable> getVariables(Declaration declaration) {
    List<ConstraintVariable> variables = program.getVariables(declaration);
    if (variables.isEmpty()) {
      throw new InternalAnalysisError("No constraint variables for " + declaration);
    }
    return variables;
  }

  public PointerVariable getPointerVariable(Declaration declaration) {
    for (ConstraintVariable variable : getVariables(declaration)) {
      if (variable.isPointerVariable()) {
        return variable.asPointerVariable();
      }
    }
    throw new InternalAnalysisError("No pointer variable for " + declaration);
  }

  /** The solved class of each pointer level of {@code declaration}, outermost first. */
  public List<SafetyClass> getSafetyClasses(Declaration declaration) {
    return getPointerVariable(declaration).getSolvedClasses(getSolution());
  }

  public boolean hasChanged(Declaration declaration) {
    ConstraintSolution solution = getSolution();
    for (ConstraintVariable variable : getVariables(declaration)) {
      if (variable.hasChanged(solution)) {
        return true;
      }
    }
    return false;
  }

  /** The inferred bounds of {@code declaration}, or null if none were inferred. */
  public ArrayBounds getBounds(Declaration declaration) {
    ArrayBoundsInformation boundsInformation = program.getBoundsInformation();
    PointerVariable variable = getPointerVariable(declaration);
    if (!variable.hasBoundsKey() || !boundsInformation.hasBounds(variable.getBoundsKey())) {
      return null;
    }
    return boundsInformation.getBounds(variable.getBoundsKey());
  }

  public WildPointerReport getWildPointerReport() {
    return wildPointerReport;
  }

  public ArrayBoundsStats getBoundsStats() {
    return boundsStats;
  }

  public ConversionStatsMetadata getStats() {
    return stats;
  }

  public List<Diagnostic> getErrors() {
    return reporter.getErrors();
  }

  public List<Diagnostic> getWarnings() {
    return reporter.getWarnings();
  }

  public List<Diagnostic> getInfos() {
    return reporter.getInfos();
  }

  /** The solved constraint variables and the statistics as pretty printed JSON. */
  public String dumpJson() {
    return ConversionMetadata.create(program, stats).toJson();
  }
}
