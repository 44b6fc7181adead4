// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils.timing;

import com.android.tools.cconv.utils.AnalysisOptions;
import com.android.tools.cconv.utils.ThrowingAction;
import com.android.tools.cconv.utils.ThrowingSupplier;

public abstract class Timing implements AutoCloseable {

  public static Timing empty() {
    return TimingEmpty.getEmpty();
  }

  public static Timing create(String title, AnalysisOptions options) {
    return options.printTimes ? new TimingImpl(title) : Timing.empty();
  }

  public abstract Timing begin(String title);

  public abstract Timing end();

  public boolean isEmpty() {
    return false;
  }

  public abstract <E extends Exception> void time(String title, ThrowingAction<E> action) throws E;

  public abstract <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier)
      throws E;

  public abstract void report();

  // Remove throws from close() in AutoClosable to allow try with resources without explicit catch.
  @Override
  public final void close() {
    end();
  }
}
