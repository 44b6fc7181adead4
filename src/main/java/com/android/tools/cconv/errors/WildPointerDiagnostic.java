// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.errors;

import com.android.tools.cconv.Diagnostic;
import com.android.tools.cconv.ast.SourceLocation;

/** Explains why a pointer was made wild. */
public class WildPointerDiagnostic implements Diagnostic {

  private final String name;
  private final String reason;
  private final SourceLocation location;
  private final int affectedPointers;

  public WildPointerDiagnostic(
      String name, String reason, SourceLocation location, int affectedPointers) {
    this.name = name;
    this.reason = reason;
    this.location = location;
    this.affectedPointers = affectedPointers;
  }

  public String getName() {
    return name;
  }

  public String getReason() {
    return reason;
  }

  public int getAffectedPointers() {
    return affectedPointers;
  }

  @Override
  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public String getDiagnosticMessage() {
    return "Pointer `"
        + name
        + "` is wild: "
        + reason
        + (affectedPointers > 0 ? " (makes " + affectedPointers + " more pointers wild)" : "");
  }
}
