// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.errors;

import com.android.tools.cconv.Diagnostic;
import com.android.tools.cconv.ast.SourceLocation;

public class UnsupportedExpressionDiagnostic implements Diagnostic {

  private final String description;
  private final SourceLocation location;

  public UnsupportedExpressionDiagnostic(String description, SourceLocation location) {
    this.description = description;
    this.location = location;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public String getDiagnosticMessage() {
    return "Unsupported expression `"
        + description
        + "` at "
        + location
        + ", no constraints generated";
  }
}
