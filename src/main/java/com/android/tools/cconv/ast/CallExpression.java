// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;
import java.util.function.Consumer;

public final class CallExpression extends Expression {

  private final Expression callee;
  private final ImmutableList<Expression> arguments;

  CallExpression(
      CType type, Expression callee, ImmutableList<Expression> arguments, SourceLocation location) {
    super(type, location);
    this.callee = callee;
    this.arguments = arguments;
  }

  public Expression getCallee() {
    return callee;
  }

  /**
   * The called function if the callee names a function directly, or null for calls through
   * function pointers.
   */
  public FunctionDeclaration getDirectCallee() {
    Expression stripped = callee.stripCasts();
    if (stripped.isDeclRef() && stripped.asDeclRef().getDeclaration().isFunction()) {
      return stripped.asDeclRef().getDeclaration().asFunction();
    }
    return null;
  }

  public ImmutableList<Expression> getArguments() {
    return arguments;
  }

  public int getNumberOfArguments() {
    return arguments.size();
  }

  public Expression getArgument(int index) {
    return arguments.get(index);
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.CALL;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {
    consumer.accept(callee);
    arguments.forEach(consumer);
  }

  @Override
  public boolean isCall() {
    return true;
  }

  @Override
  public CallExpression asCall() {
    return this;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(callee.toString()).append("(");
    for (int i = 0; i < arguments.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(arguments.get(i));
    }
    return builder.append(")").toString();
  }
}
