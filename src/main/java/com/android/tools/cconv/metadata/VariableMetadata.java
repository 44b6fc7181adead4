// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.metadata;

import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.bounds.ArrayBounds;
import com.android.tools.cconv.constraints.ConstraintSolution;
import com.android.tools.cconv.constraints.SafetyClass;
import com.android.tools.cconv.constraints.variables.PointerVariable;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.List;

/** The solved state of one pointer variable. */
public class VariableMetadata {

  @Expose
  @SerializedName("name")
  private final String name;

  @Expose
  @SerializedName("location")
  private final String location;

  @Expose
  @SerializedName("classes")
  private final List<String> classes;

  @Expose
  @SerializedName("changed")
  private final boolean changed;

  @Expose
  @SerializedName("bounds")
  private final String bounds;

  private VariableMetadata(
      String name, String location, List<String> classes, boolean changed, String bounds) {
    this.name = name;
    this.location = location;
    this.classes = classes;
    this.changed = changed;
    this.bounds = bounds;
  }

  public static VariableMetadata create(
      PointerVariable variable, ConstraintSolution solution, ArrayBounds bounds) {
    List<String> classes = new ArrayList<>();
    for (SafetyClass safetyClass : variable.getSolvedClasses(solution)) {
      classes.add(safetyClass.getShortName());
    }
    SourceLocation location = variable.getLocation();
    return new VariableMetadata(
        variable.getName(),
        location != null ? location.toString() : null,
        classes,
        variable.hasChanged(solution),
        bounds != null ? bounds.toSourceString() : null);
  }

  public String getName() {
    return name;
  }

  public List<String> getClasses() {
    return classes;
  }

  public boolean isChanged() {
    return changed;
  }

  public String getBounds() {
    return bounds;
  }
}
