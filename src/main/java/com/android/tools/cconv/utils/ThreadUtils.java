// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

public class ThreadUtils {

  public static final int NOT_SPECIFIED = -1;

  // Fan out only when there is more than one item to process.
  private static final int THRESHOLD = 2;

  private static final int MAX_THREADS = 16;

  /** Returns an executor for the configured number of threads, or null to run sequentially. */
  public static ExecutorService getExecutorService(AnalysisOptions options) {
    int threads = options.threadCount;
    if (threads == NOT_SPECIFIED) {
      threads = Math.min(Runtime.getRuntime().availableProcessors(), MAX_THREADS);
    }
    return threads <= 1 ? null : Executors.newFixedThreadPool(threads);
  }

  public static <T> void processItems(
      Collection<T> items, Consumer<T> consumer, ExecutorService executorService)
      throws ExecutionException {
    if (executorService == null || items.size() < THRESHOLD) {
      items.forEach(consumer);
      return;
    }
    List<Future<?>> futures = new ArrayList<>(items.size());
    for (T item : items) {
      futures.add(executorService.submit(() -> consumer.accept(item)));
    }
    awaitFutures(futures);
  }

  public static void awaitFutures(Iterable<? extends Future<?>> futures)
      throws ExecutionException {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ExecutionException("Interrupted while waiting for future", e);
      }
    }
  }
}
