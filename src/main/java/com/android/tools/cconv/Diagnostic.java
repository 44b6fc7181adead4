// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv;

import com.android.tools.cconv.ast.SourceLocation;

/** Interface for all diagnostic messages produced by the analysis. */
public interface Diagnostic {

  /**
   * Source location the diagnostic refers to.
   *
   * @return the location, or null if the diagnostic is not tied to a single place in the program.
   */
  SourceLocation getLocation();

  /**
   * Diagnostic message as a human readable string.
   *
   * @return the message.
   */
  String getDiagnosticMessage();
}
