// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints;

import com.android.tools.cconv.ast.SourceLocation;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Allocates program-wide unique atom ids.
 *
 * <p>One factory is shared by all translation unit graphs of a program, so units can be processed
 * concurrently and merged without renumbering.
 */
public class AtomFactory {

  private final AtomicInteger nextId = new AtomicInteger();

  VarAtom createVarAtom(String name, SourceLocation location) {
    return new VarAtom(nextId.getAndIncrement(), name, location);
  }

  public int getNumberOfAtoms() {
    return nextId.get();
  }
}
