// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.errors;

/**
 * Exception regarding internal inconsistencies of the analysis.
 *
 * <p>Thrown when a contract of the constraint model is violated. This is never caused by the
 * analyzed program and always aborts the run.
 */
public class InternalAnalysisError extends IllegalStateException {

  public InternalAnalysisError(String message) {
    super(message);
  }

  public InternalAnalysisError(String message, Throwable cause) {
    super(message, cause);
  }
}
