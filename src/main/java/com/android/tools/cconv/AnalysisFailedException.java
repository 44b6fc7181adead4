// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv;

/** Exception thrown when the analysis of a program is aborted. */
public class AnalysisFailedException extends Exception {

  public AnalysisFailedException(String message) {
    super(message);
  }

  public AnalysisFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
