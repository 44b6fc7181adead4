// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

public final class StringLiteral extends Expression {

  private final String value;

  StringLiteral(String value, SourceLocation location) {
    super(CType.arrayOf(CType.charType(), byteLength(value)), location);
    this.value = value;
  }

  private static int byteLength(String value) {
    return value.getBytes(StandardCharsets.UTF_8).length + 1;
  }

  public String getValue() {
    return value;
  }

  /** The size of the literal in bytes, including the terminating null character. */
  public int getByteLength() {
    return byteLength(value);
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.STRING_LITERAL;
  }

  @Override
  public void forEachChild(Consumer<Expression> consumer) {}

  @Override
  public boolean isStringLiteral() {
    return true;
  }

  @Override
  public StringLiteral asStringLiteral() {
    return this;
  }

  @Override
  public String toString() {
    return "\"" + value + "\"";
  }
}
