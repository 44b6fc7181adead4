// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.metadata;

import com.android.tools.cconv.constraints.SafetyClass;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.Map;

/** The number of pointer levels of each class declared in one file. */
public class FileStatsMetadata {

  @Expose
  @SerializedName("file")
  private final String fileName;

  @Expose
  @SerializedName("ptr")
  private final int ptr;

  @Expose
  @SerializedName("ntarr")
  private final int ntArray;

  @Expose
  @SerializedName("arr")
  private final int array;

  @Expose
  @SerializedName("wild")
  private final int wild;

  public FileStatsMetadata(String fileName, Map<SafetyClass, Integer> counts) {
    this.fileName = fileName;
    this.ptr = counts.getOrDefault(SafetyClass.PTR, 0);
    this.ntArray = counts.getOrDefault(SafetyClass.NT_ARRAY, 0);
    this.array = counts.getOrDefault(SafetyClass.ARRAY, 0);
    this.wild = counts.getOrDefault(SafetyClass.WILD, 0);
  }

  public String getFileName() {
    return fileName;
  }

  public int getPtr() {
    return ptr;
  }

  public int getNtArray() {
    return ntArray;
  }

  public int getArray() {
    return array;
  }

  public int getWild() {
    return wild;
  }

  public int getTotal() {
    return ptr + ntArray + array + wild;
  }
}
