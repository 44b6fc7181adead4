// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils;

import com.android.tools.cconv.AnalysisFailedException;
import com.android.tools.cconv.errors.InternalAnalysisError;
import java.util.concurrent.ExecutionException;

public class ExceptionUtils {

  private ExceptionUtils() {}

  /**
   * Runs the analysis and turns every way in which it can be aborted into an {@link
   * AnalysisFailedException}.
   */
  public static <T> T withAnalysisHandler(
      Reporter reporter, ThrowingSupplier<T, ExecutionException> action)
      throws AnalysisFailedException {
    try {
      T result = action.get();
      reporter.failIfPendingErrors();
      return result;
    } catch (ExecutionException e) {
      throw failWithCause(unwrapExecutionException(e));
    } catch (AbortException | InternalAnalysisError e) {
      throw failWithCause(e);
    }
  }

  private static AnalysisFailedException failWithCause(Throwable cause) {
    if (cause instanceof AnalysisFailedException) {
      return (AnalysisFailedException) cause;
    }
    String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
    return new AnalysisFailedException("Analysis failed: " + message, cause);
  }

  private static Throwable unwrapExecutionException(ExecutionException e) {
    Throwable current = e;
    while (current instanceof ExecutionException && current.getCause() != null) {
      current = current.getCause();
    }
    if (current instanceof RuntimeException
        && !(current instanceof AbortException)
        && !(current instanceof InternalAnalysisError)) {
      throw (RuntimeException) current;
    }
    return current;
  }
}
