// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.errors;

import com.android.tools.cconv.Diagnostic;
import com.android.tools.cconv.ast.SourceLocation;

/** Reported for an array pointer for which no bounds could be inferred. */
public class UnboundedArrayDiagnostic implements Diagnostic {

  private final String name;
  private final SourceLocation location;

  public UnboundedArrayDiagnostic(String name, SourceLocation location) {
    this.name = name;
    this.location = location;
  }

  public String getName() {
    return name;
  }

  @Override
  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public String getDiagnosticMessage() {
    return "Unable to infer bounds of array `" + name + "` declared at " + location;
  }
}
