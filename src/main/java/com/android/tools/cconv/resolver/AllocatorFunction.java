// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.resolver;

import com.android.tools.cconv.ast.CallExpression;
import com.android.tools.cconv.ast.Expression;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.google.common.collect.ImmutableList;

/** The library allocators whose size argument is inspected. */
public enum AllocatorFunction {
  MALLOC("malloc", 0),
  CALLOC("calloc", 0, 1),
  REALLOC("realloc", 1);

  private final String name;
  private final ImmutableList<Integer> sizeArgumentIndices;

  AllocatorFunction(String name, Integer... sizeArgumentIndices) {
    this.name = name;
    this.sizeArgumentIndices = ImmutableList.copyOf(sizeArgumentIndices);
  }

  public String getName() {
    return name;
  }

  /** The arguments that make up the allocation size, or an empty list if absent. */
  public ImmutableList<Expression> getSizeArguments(CallExpression call) {
    ImmutableList.Builder<Expression> builder = ImmutableList.builder();
    for (int index : sizeArgumentIndices) {
      if (index >= call.getNumberOfArguments()) {
        return ImmutableList.of();
      }
      builder.add(call.getArgument(index).stripCasts());
    }
    return builder.build();
  }

  public static AllocatorFunction forName(String name) {
    for (AllocatorFunction allocator : values()) {
      if (allocator.name.equals(name)) {
        return allocator;
      }
    }
    return null;
  }

  /** Returns the allocator called directly by {@code expression}, or null. */
  public static AllocatorFunction forCall(Expression expression) {
    if (!expression.isCall()) {
      return null;
    }
    FunctionDeclaration callee = expression.asCall().getDirectCallee();
    return callee != null ? forName(callee.getName()) : null;
  }
}
