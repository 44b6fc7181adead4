// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.metadata;

import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.program.ProgramInfo;
import com.android.tools.cconv.program.TranslationUnitInfo;
import com.google.common.collect.ImmutableList;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.List;

/** The solved state of the whole program, dumped as JSON. */
public class ConversionMetadata {

  @Expose
  @SerializedName("stats")
  private final ConversionStatsMetadata stats;

  @Expose
  @SerializedName("units")
  private final List<UnitMetadata> units;

  private ConversionMetadata(ConversionStatsMetadata stats, List<UnitMetadata> units) {
    this.stats = stats;
    this.units = units;
  }

  public static ConversionMetadata create(ProgramInfo program, ConversionStatsMetadata stats) {
    ConstraintSolution solution = program.getSolution();
    ImmutableList.Builder<UnitMetadata> units = ImmutableList.builder();
    for (TranslationUnitInfo unit : program.getUnits()) {
      units.add(UnitMetadata.create(unit, solution));
    }
    return new ConversionMetadata(stats, units.build());
  }

  public ConversionStatsMetadata getStats() {
    return stats;
  }

  public List<UnitMetadata> getUnits() {
    return units;
  }

  public String toJson() {
    return new GsonBuilder()
        .excludeFieldsWithoutExposeAnnotation()
        .setPrettyPrinting()
        .create()
        .toJson(this);
  }
}
