// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.errors;

import com.android.tools.cconv.Diagnostic;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.constraints.Geq;

/** An edge required an already checked pointer to become less safe. */
public class ConstraintConflictDiagnostic implements Diagnostic {

  private final Geq edge;

  public ConstraintConflictDiagnostic(Geq edge) {
    this.edge = edge;
  }

  public Geq getEdge() {
    return edge;
  }

  @Override
  public SourceLocation getLocation() {
    return edge.getLocation();
  }

  @Override
  public String getDiagnosticMessage() {
    StringBuilder builder =
        new StringBuilder("Checked pointer ")
            .append(edge.getLhs())
            .append(" cannot hold ")
            .append(edge.getRhs());
    if (edge.hasReason()) {
      builder.append(": ").append(edge.getReason());
    }
    return builder.toString();
  }
}
