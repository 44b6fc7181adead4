// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import java.io.PrintStream;
import java.util.function.Consumer;

public class AnalysisOptions {

  private static final String PROPERTY_PREFIX = "com.android.tools.cconv.";

  private final Reporter reporter;

  public AnalysisOptions() {
    this(new Reporter());
  }

  public AnalysisOptions(Reporter reporter) {
    this.reporter = reporter;
  }

  public Reporter getReporter() {
    return reporter;
  }

  // Print a trace of the constraint generation and linking steps to verboseOutput.
  public boolean verbose = SystemPropertyUtils.parseSystemPropertyOrDefault(
      PROPERTY_PREFIX + "verbose", false);

  public PrintStream verboseOutput = System.out;

  public boolean printTimes = SystemPropertyUtils.parseSystemPropertyOrDefault(
      PROPERTY_PREFIX + "printtimes", false);

  // Constrain the extra arguments of calls to variadic functions to be wild.
  public boolean handleVarargs = SystemPropertyUtils.parseSystemPropertyOrDefault(
      PROPERTY_PREFIX + "handlevarargs", false);

  // Report every directly wild pointer as an info diagnostic.
  public boolean reportWildPointers = SystemPropertyUtils.parseSystemPropertyOrDefault(
      PROPERTY_PREFIX + "reportwildpointers", true);

  public int threadCount = SystemPropertyUtils.parseSystemPropertyOrDefault(
      PROPERTY_PREFIX + "threads", ThreadUtils.NOT_SPECIFIED);

  // Minimum length of a common subsequence between an array name and a length name, in percent of
  // the array name length.
  public int commonSubsequenceThresholdPercent = SystemPropertyUtils.parseSystemPropertyOrDefault(
      PROPERTY_PREFIX + "lcsthreshold", 80);

  // Library functions that are known to be safe and whose pointer parameters are therefore not
  // constrained to be wild when no definition is found. More can be listed, comma separated, in
  // the externokay property.
  public ImmutableSet<String> externOkayFunctions =
      ImmutableSet.<String>builder()
          .add("malloc", "calloc", "realloc", "free")
          .addAll(
              Splitter.on(',')
                  .trimResults()
                  .omitEmptyStrings()
                  .split(
                      SystemPropertyUtils.getSystemPropertyOrDefault(
                          PROPERTY_PREFIX + "externokay", "")))
          .build();

  // Receives the statistics of the run as JSON, if set.
  public Consumer<String> statsConsumer = null;

  public boolean isExternOkay(String functionName) {
    return externOkayFunctions.contains(functionName);
  }

  public void verbose(String message) {
    if (verbose) {
      verboseOutput.println(message);
    }
  }
}
