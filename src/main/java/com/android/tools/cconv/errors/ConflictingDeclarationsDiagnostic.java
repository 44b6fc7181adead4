// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.errors;

import com.android.tools.cconv.Diagnostic;
import com.android.tools.cconv.ast.SourceLocation;

/** Two prototypes of one external function disagree on the number of parameters. */
public class ConflictingDeclarationsDiagnostic implements Diagnostic {

  private final String functionName;
  private final SourceLocation first;
  private final SourceLocation second;

  public ConflictingDeclarationsDiagnostic(
      String functionName, SourceLocation first, SourceLocation second) {
    this.functionName = functionName;
    this.first = first;
    this.second = second;
  }

  public String getFunctionName() {
    return functionName;
  }

  @Override
  public SourceLocation getLocation() {
    return second;
  }

  @Override
  public String getDiagnosticMessage() {
    return "Incompatible declarations of function `"
        + functionName
        + "` at "
        + first
        + " and "
        + second
        + ", all pointers of both are made wild";
  }
}
