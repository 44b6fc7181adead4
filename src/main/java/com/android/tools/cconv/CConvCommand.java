// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv;

import com.android.tools.cconv.ast.TranslationUnit;
import com.android.tools.cconv.utils.AnalysisOptions;
import com.android.tools.cconv.utils.Reporter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Immutable command structure for an invocation of the {@link CConv} analysis.
 *
 * <p>To build a command use the {@link CConvCommand.Builder} class. For example:
 *
 * <pre>
 *   CConvCommand command = CConvCommand.builder()
 *     .addTranslationUnits(units)
 *     .setHandleVarargs(true)
 *     .build();
 * </pre>
 */
public final class CConvCommand {

  private final ImmutableList<TranslationUnit> translationUnits;
  private final Reporter reporter;
  private final boolean verbose;
  private final boolean printTimes;
  private final boolean handleVarargs;
  private final boolean reportWildPointers;
  private final int threadCount;
  private final ImmutableSet<String> externOkayFunctions;
  private final Consumer<String> statsConsumer;

  private CConvCommand(Builder builder) {
    this.translationUnits = builder.translationUnits.build();
    this.reporter = new Reporter(builder.diagnosticsHandler);
    this.verbose = builder.verbose;
    this.printTimes = builder.printTimes;
    this.handleVarargs = builder.handleVarargs;
    this.reportWildPointers = builder.reportWildPointers;
    this.threadCount = builder.threadCount;
    this.externOkayFunctions = ImmutableSet.copyOf(builder.externOkayFunctions);
    this.statsConsumer = builder.statsConsumer;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableList<TranslationUnit> getTranslationUnits() {
    return translationUnits;
  }

  public Reporter getReporter() {
    return reporter;
  }

  AnalysisOptions getInternalOptions() {
    AnalysisOptions options = new AnalysisOptions(reporter);
    options.verbose = verbose || options.verbose;
    options.printTimes = printTimes || options.printTimes;
    options.handleVarargs = handleVarargs || options.handleVarargs;
    options.reportWildPointers = reportWildPointers;
    if (threadCount != Builder.THREAD_COUNT_NOT_SET) {
      options.threadCount = threadCount;
    }
    options.externOkayFunctions = externOkayFunctions;
    options.statsConsumer = statsConsumer;
    return options;
  }

  /** Builder for constructing a {@link CConvCommand}. */
  public static class Builder {

    private static final int THREAD_COUNT_NOT_SET = -2;

    private final ImmutableList.Builder<TranslationUnit> translationUnits =
        ImmutableList.builder();
    private final Set<String> externOkayFunctions =
        new LinkedHashSet<>(new AnalysisOptions().externOkayFunctions);
    private DiagnosticsHandler diagnosticsHandler = new DiagnosticsHandler() {};
    private boolean verbose = false;
    private boolean printTimes = false;
    private boolean handleVarargs = false;
    private boolean reportWildPointers = true;
    private int threadCount = THREAD_COUNT_NOT_SET;
    private Consumer<String> statsConsumer = null;

    private Builder() {}

    public Builder addTranslationUnit(TranslationUnit unit) {
      translationUnits.add(unit);
      return this;
    }

    public Builder addTranslationUnits(TranslationUnit... units) {
      return addTranslationUnits(Arrays.asList(units));
    }

    public Builder addTranslationUnits(Collection<TranslationUnit> units) {
      translationUnits.addAll(units);
      return this;
    }

    public Builder setDiagnosticsHandler(DiagnosticsHandler diagnosticsHandler) {
      this.diagnosticsHandler = diagnosticsHandler;
      return this;
    }

    public Builder setVerbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public Builder setPrintTimes(boolean printTimes) {
      this.printTimes = printTimes;
      return this;
    }

    /** Constrain the arguments passed in the variadic part of a call to be wild. */
    public Builder setHandleVarargs(boolean handleVarargs) {
      this.handleVarargs = handleVarargs;
      return this;
    }

    public Builder setReportWildPointers(boolean reportWildPointers) {
      this.reportWildPointers = reportWildPointers;
      return this;
    }

    /**
     * Add a function whose pointer parameters stay unconstrained when no definition is found.
     */
    public Builder addExternOkayFunction(String name) {
      externOkayFunctions.add(name);
      return this;
    }

    public Builder setStatsConsumer(Consumer<String> statsConsumer) {
      this.statsConsumer = statsConsumer;
      return this;
    }

    /** Number of threads used to build constraints. One or less runs on the calling thread. */
    public Builder setThreadCount(int threadCount) {
      this.threadCount = threadCount;
      return this;
    }

    public CConvCommand build() {
      return new CConvCommand(this);
    }
  }
}
