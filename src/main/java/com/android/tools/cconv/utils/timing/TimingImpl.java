// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils.timing;

import com.android.tools.cconv.utils.SystemPropertyUtils;
import com.android.tools.cconv.utils.ThrowingAction;
import com.android.tools.cconv.utils.ThrowingSupplier;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

public class TimingImpl extends Timing {

  private static final int MINIMUM_REPORT_MS =
      SystemPropertyUtils.parseSystemPropertyOrDefault(
          "com.android.tools.cconv.printtimes.minvalue_ms", 0);

  private final Node top;
  private final Deque<Node> stack;

  TimingImpl(String title) {
    stack = new ArrayDeque<>();
    top = new Node(title);
    stack.push(top);
  }

  static class Node {
    final String title;

    final Map<String, Node> children = new LinkedHashMap<>();
    long duration = 0;
    long startTime;

    Node(String title) {
      this.title = title;
      this.startTime = System.nanoTime();
    }

    void restart() {
      assert startTime == -1;
      startTime = System.nanoTime();
    }

    void end() {
      duration += System.nanoTime() - startTime;
      startTime = -1;
      assert duration >= 0;
    }

    @Override
    public String toString() {
      return title + ": " + prettyTime(duration);
    }

    public String toString(Node top) {
      if (this == top) {
        return toString();
      }
      return "(" + prettyPercentage(duration, top.duration) + ") " + toString();
    }

    public void report(int depth, Node top) {
      if (durationInMs(duration) < MINIMUM_REPORT_MS) {
        return;
      }
      printPrefix(depth);
      System.out.println(toString(top));
      if (children.isEmpty()) {
        return;
      }
      Collection<Node> childNodes = children.values();
      long childTime = 0;
      for (Node childNode : childNodes) {
        childTime += childNode.duration;
      }
      if (childTime < duration) {
        long unaccounted = duration - childTime;
        if (durationInMs(unaccounted) >= MINIMUM_REPORT_MS) {
          printPrefix(depth + 1);
          System.out.println(
              "(" + prettyPercentage(unaccounted, top.duration) + ") Unaccounted: "
                  + prettyTime(unaccounted));
        }
      }
      childNodes.forEach(p -> p.report(depth + 1, top));
    }

    void printPrefix(int depth) {
      if (depth > 0) {
        System.out.print("  ".repeat(depth));
        System.out.print("- ");
      }
    }
  }

  private static long durationInMs(long value) {
    return value / 1_000_000;
  }

  private static String prettyPercentage(long part, long total) {
    return (total == 0 ? 0 : part * 100 / total) + "%";
  }

  private static String prettyTime(long value) {
    long seconds = value / 1_000_000_000;
    if (seconds > 0) {
      return String.format("%sms (%ss)", durationInMs(value), seconds);
    }
    return String.format("%sms", durationInMs(value));
  }

  @Override
  public Timing begin(String title) {
    Node parent = stack.peek();
    Node child;
    if (parent.children.containsKey(title)) {
      child = parent.children.get(title);
      child.restart();
    } else {
      child = new Node(title);
      parent.children.put(title, child);
    }
    stack.push(child);
    return this;
  }

  @Override
  public <E extends Exception> void time(String title, ThrowingAction<E> action) throws E {
    begin(title);
    try {
      action.execute();
    } finally {
      end();
    }
  }

  @Override
  public <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier) throws E {
    begin(title);
    try {
      return supplier.get();
    } finally {
      end();
    }
  }

  @Override
  public Timing end() {
    stack.peek().end(); // record time.
    stack.pop();
    return this;
  }

  @Override
  public void report() {
    assert stack.isEmpty() : "Expected all timing nodes to have ended";
    top.report(0, top);
  }
}
