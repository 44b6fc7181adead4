// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv;

import com.android.tools.cconv.ast.SourceLocation;

/**
 * A DiagnosticsHandler can be provided to customize handling of diagnostics information.
 *
 * <p>During the analysis the diagnostics handler will be called with the diagnostics produced by
 * the constraint builder, the linker and the post-solve passes.
 */
public interface DiagnosticsHandler {

  /**
   * Handle error diagnostics.
   *
   * @param error Diagnostic containing error information.
   */
  default void error(Diagnostic error) {
    report("Error", error);
  }

  /**
   * Handle warning diagnostics.
   *
   * @param warning Diagnostic containing warning information.
   */
  default void warning(Diagnostic warning) {
    report("Warning", warning);
  }

  /**
   * Handle info diagnostics.
   *
   * @param info Diagnostic containing the information.
   */
  default void info(Diagnostic info) {
    report("Info", info);
  }

  /**
   * Modify the level of a diagnostic.
   *
   * <p>This modification is allowed only for non-fatal diagnostics. Returning {@link
   * DiagnosticsLevel#NONE} drops the diagnostic.
   *
   * @param level the level of the diagnostic.
   * @param diagnostic the diagnostic.
   * @return the level to use.
   */
  default DiagnosticsLevel modifyDiagnosticsLevel(DiagnosticsLevel level, Diagnostic diagnostic) {
    return level;
  }

  private static void report(String kind, Diagnostic diagnostic) {
    StringBuilder builder = new StringBuilder(kind).append(": ");
    SourceLocation location = diagnostic.getLocation();
    if (location != null) {
      builder.append(location).append(": ");
    }
    builder.append(diagnostic.getDiagnosticMessage());
    System.err.println(builder);
  }
}
