// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv;

import com.android.tools.cconv.ast.TranslationUnit;
import com.android.tools.cconv.bounds.ArrayBoundsInference;
import com.android.tools.cconv.bounds.ArrayBoundsStats;
import com.android.tools.cconv.constraints.VarAtom;
import com.android.tools.cconv.errors.WildPointerDiagnostic;
import com.android.tools.cconv.metadata.ConversionStatsMetadata;
import com.android.tools.cconv.program.ProgramInfo;
import com.android.tools.cconv.program.TranslationUnitInfo;
import com.android.tools.cconv.resolver.ConstraintBuilder;
import com.android.tools.cconv.rootcause.WildPointerReason;
import com.android.tools.cconv.rootcause.WildPointerReport;
import com.android.tools.cconv.rootcause.WildPointerRootCauseAnalysis;
import com.android.tools.cconv.utils.AnalysisOptions;
import com.android.tools.cconv.utils.ExceptionUtils;
import com.android.tools.cconv.utils.ThreadUtils;
import com.android.tools.cconv.utils.timing.Timing;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * The CConv pointer-safety analysis.
 *
 * <p>CConv infers, for every pointer of a C program, the safest checked pointer kind that is
 * consistent with how the pointer is used, together with the bounds of the pointers that turn
 * out to be arrays. The analysis proceeds in the following steps:
 *
 * <ol>
 *   <li>constraints are generated for each translation unit, possibly in parallel;
 *   <li>the unit graphs are merged and declarations of the same entity are linked;
 *   <li>the merged graph is solved;
 *   <li>array bounds are inferred and wild pointers are grouped by their root cause.
 * </ol>
 */
public final class CConv {

  private CConv() {}

  /**
   * Main API entry for the analysis.
   *
   * @param command analysis command.
   * @return the solved state of the program.
   */
  public static ConversionResult run(CConvCommand command) throws AnalysisFailedException {
    AnalysisOptions options = command.getInternalOptions();
    ExecutorService executor = ThreadUtils.getExecutorService(options);
    try {
      return runForTesting(command.getTranslationUnits(), options, executor);
    } finally {
      if (executor != null) {
        executor.shutdown();
      }
    }
  }

  /**
   * Main API entry for the analysis using a client provided executor.
   *
   * @param command analysis command.
   * @param executor executor service used for constraint generation, not shut down by the run.
   * @return the solved state of the program.
   */
  public static ConversionResult run(CConvCommand command, ExecutorService executor)
      throws AnalysisFailedException {
    return runForTesting(command.getTranslationUnits(), command.getInternalOptions(), executor);
  }

  static ConversionResult runForTesting(
      List<TranslationUnit> units, AnalysisOptions options, ExecutorService executor)
      throws AnalysisFailedException {
    return ExceptionUtils.withAnalysisHandler(
        options.getReporter(), () -> runInternal(units, options, executor));
  }

  private static ConversionResult runInternal(
      List<TranslationUnit> units, AnalysisOptions options, ExecutorService executor)
      throws ExecutionException {
    Timing timing = Timing.create("CConv", options);
    ProgramInfo program = new ProgramInfo(options);

    List<TranslationUnitInfo> unitInfos = new ArrayList<>(units.size());
    for (TranslationUnit unit : units) {
      unitInfos.add(program.createUnitInfo(unit));
    }
    timing.time(
        "Build constraints",
        () -> {
          ThreadUtils.processItems(
              unitInfos,
              unitInfo -> {
                options.verbose("Building constraints for " + unitInfo.getFileName());
                new ConstraintBuilder(unitInfo).build();
              },
              executor);
        });

    timing.time(
        "Link",
        () -> {
          // Merge in input order so that atom ownership and link order are deterministic.
          for (TranslationUnitInfo unitInfo : unitInfos) {
            program.merge(unitInfo);
          }
          program.link();
        });
    options.verbose(
        "Solving "
            + program.getGraph().getNumberOfConstraints()
            + " constraints over "
            + program.getGraph().getNumberOfVariables()
            + " variables");

    program.solve(timing);

    ArrayBoundsStats boundsStats = new ArrayBoundsInference(program).run(timing);

    timing.begin("Wild pointer root causes");
    WildPointerReport report = new WildPointerRootCauseAnalysis(program.getGraph()).run();
    timing.end();
    if (options.reportWildPointers) {
      reportWildPointers(report, options);
    }

    ConversionStatsMetadata stats =
        ConversionStatsMetadata.create(
            program.computeFileStatistics(),
            program.getGraph().getNumberOfVariables(),
            program.getGraph().getNumberOfConstraints(),
            boundsStats);
    if (options.statsConsumer != null) {
      options.statsConsumer.accept(stats.toJson());
    }
    timing.end();
    timing.report();
    return new ConversionResult(program, report, boundsStats, stats, options.getReporter());
  }

  private static void reportWildPointers(WildPointerReport report, AnalysisOptions options) {
    for (VarAtom leader : report.getLeaders()) {
      WildPointerReason reason = report.getRootCause(leader);
      options
          .getReporter()
          .info(
              new WildPointerDiagnostic(
                  leader.getName(),
                  reason.getReason(),
                  reason.getLocation(),
                  report.getAffected(leader).size()));
    }
  }
}
