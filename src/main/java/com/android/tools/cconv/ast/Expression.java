// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.util.function.Consumer;

/**
 * Base class of all expression nodes.
 *
 * <p>Expression nodes have identity semantics. Analyses key their per-expression caches on the
 * node object.
 */
public abstract class Expression {

  private final CType type;
  private final SourceLocation location;

  Expression(CType type, SourceLocation location) {
    this.type = type;
    this.location = location;
  }

  public abstract ExpressionKind getKind();

  public CType getType() {
    return type;
  }

  public SourceLocation getLocation() {
    return location;
  }

  /** Visits the direct sub-expressions in evaluation order. */
  public abstract void forEachChild(Consumer<Expression> consumer);

  /** Skips any chain of implicit and explicit casts. */
  public Expression stripCasts() {
    Expression current = this;
    while (current.isCast()) {
      current = current.asCast().getOperand();
    }
    return current;
  }

  /** True for the null pointer constant, possibly converted by casts. */
  public boolean isNullPointerConstant() {
    Expression stripped = stripCasts();
    if (stripped.isNullPointer()) {
      return true;
    }
    return stripped != this
        && stripped.isIntegerLiteral()
        && stripped.asIntegerLiteral().getValue() == 0;
  }

  public boolean isDeclRef() {
    return false;
  }

  public DeclRefExpression asDeclRef() {
    return null;
  }

  public boolean isMember() {
    return false;
  }

  public MemberExpression asMember() {
    return null;
  }

  public boolean isCast() {
    return false;
  }

  public CastExpression asCast() {
    return null;
  }

  public boolean isBinary() {
    return false;
  }

  public BinaryExpression asBinary() {
    return null;
  }

  public boolean isUnary() {
    return false;
  }

  public UnaryExpression asUnary() {
    return null;
  }

  public boolean isArraySubscript() {
    return false;
  }

  public ArraySubscriptExpression asArraySubscript() {
    return null;
  }

  public boolean isCall() {
    return false;
  }

  public CallExpression asCall() {
    return null;
  }

  public boolean isConditional() {
    return false;
  }

  public ConditionalExpression asConditional() {
    return null;
  }

  public boolean isInitList() {
    return false;
  }

  public InitListExpression asInitList() {
    return null;
  }

  public boolean isCompoundLiteral() {
    return false;
  }

  public CompoundLiteralExpression asCompoundLiteral() {
    return null;
  }

  public boolean isStringLiteral() {
    return false;
  }

  public StringLiteral asStringLiteral() {
    return null;
  }

  public boolean isIntegerLiteral() {
    return false;
  }

  public IntegerLiteral asIntegerLiteral() {
    return null;
  }

  public boolean isNullPointer() {
    return false;
  }

  public boolean isSizeOf() {
    return false;
  }

  public SizeOfExpression asSizeOf() {
    return null;
  }

  public boolean isUnsupported() {
    return false;
  }

  public UnsupportedExpression asUnsupported() {
    return null;
  }

  @Override
  public String toString() {
    return getKind() + "@" + location;
  }
}
