// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.metadata;

import com.android.tools.cconv.bounds.ArrayBoundsStats;
import com.android.tools.cconv.bounds.BoundsHeuristic;
import com.android.tools.cconv.constraints.SafetyClass;
import com.google.common.collect.ImmutableList;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Summary of a run: per file pointer counts, their totals and the bounds heuristics used. */
public class ConversionStatsMetadata {

  @Expose
  @SerializedName("files")
  private final List<FileStatsMetadata> files;

  @Expose
  @SerializedName("summary")
  private final FileStatsMetadata summary;

  @Expose
  @SerializedName("constraintVariables")
  private final int numberOfConstraintVariables;

  @Expose
  @SerializedName("constraints")
  private final int numberOfConstraints;

  @Expose
  @SerializedName("arrayBounds")
  private final Map<String, Integer> arrayBounds;

  private ConversionStatsMetadata(
      List<FileStatsMetadata> files,
      FileStatsMetadata summary,
      int numberOfConstraintVariables,
      int numberOfConstraints,
      Map<String, Integer> arrayBounds) {
    this.files = files;
    this.summary = summary;
    this.numberOfConstraintVariables = numberOfConstraintVariables;
    this.numberOfConstraints = numberOfConstraints;
    this.arrayBounds = arrayBounds;
  }

  public static ConversionStatsMetadata create(
      Map<String, Map<SafetyClass, Integer>> fileStatistics,
      int numberOfConstraintVariables,
      int numberOfConstraints,
      ArrayBoundsStats boundsStats) {
    ImmutableList.Builder<FileStatsMetadata> files = ImmutableList.builder();
    Map<SafetyClass, Integer> totals = new EnumMap<>(SafetyClass.class);
    fileStatistics.forEach(
        (fileName, counts) -> {
          files.add(new FileStatsMetadata(fileName, counts));
          counts.forEach((safetyClass, count) -> totals.merge(safetyClass, count, Integer::sum));
        });
    Map<String, Integer> arrayBounds = new LinkedHashMap<>();
    boundsStats
        .getCounts()
        .forEach(
            (heuristic, count) -> arrayBounds.put(heuristic.getStatisticsName(), count));
    return new ConversionStatsMetadata(
        files.build(),
        new FileStatsMetadata("<all>", totals),
        numberOfConstraintVariables,
        numberOfConstraints,
        arrayBounds);
  }

  public List<FileStatsMetadata> getFiles() {
    return files;
  }

  public FileStatsMetadata getSummary() {
    return summary;
  }

  public int getNumberOfConstraintVariables() {
    return numberOfConstraintVariables;
  }

  public int getNumberOfConstraints() {
    return numberOfConstraints;
  }

  public int getArrayBoundsCount(BoundsHeuristic heuristic) {
    return arrayBounds.getOrDefault(heuristic.getStatisticsName(), 0);
  }

  public String toJson() {
    return new GsonBuilder().excludeFieldsWithoutExposeAnnotation().create().toJson(this);
  }
}
