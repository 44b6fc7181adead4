// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ComparisonChain;
import java.util.Objects;

/**
 * A source position that is stable across translation units.
 *
 * <p>Two declarations that come from the same header included by several translation units have
 * equal locations. The linker uses this to unify their constraint variables.
 */
public final class SourceLocation implements Comparable<SourceLocation> {

  private final String fileName;
  private final int line;
  private final int column;
  private final boolean inMacroExpansion;

  private SourceLocation(String fileName, int line, int column, boolean inMacroExpansion) {
    this.fileName = fileName;
    this.line = line;
    this.column = column;
    this.inMacroExpansion = inMacroExpansion;
  }

  public static SourceLocation create(String fileName, int line, int column) {
    return new SourceLocation(fileName, line, column, false);
  }

  public static SourceLocation createInMacroExpansion(String fileName, int line, int column) {
    return new SourceLocation(fileName, line, column, true);
  }

  public String getFileName() {
    return fileName;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public boolean isInMacroExpansion() {
    return inMacroExpansion;
  }

  @Override
  public int compareTo(SourceLocation other) {
    return ComparisonChain.start()
        .compare(fileName, other.fileName)
        .compare(line, other.line)
        .compare(column, other.column)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    SourceLocation other = (SourceLocation) obj;
    return line == other.line && column == other.column && fileName.equals(other.fileName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fileName, line, column);
  }

  @Override
  public String toString() {
    return fileName + ":" + line + ":" + column;
  }
}
