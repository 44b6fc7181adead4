// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public enum ExpressionKind {
  DECL_REF,
  MEMBER,
  IMPLICIT_CAST,
  EXPLICIT_CAST,
  BINARY,
  UNARY,
  ARRAY_SUBSCRIPT,
  CALL,
  CONDITIONAL,
  INIT_LIST,
  COMPOUND_LITERAL,
  STRING_LITERAL,
  INTEGER_LITERAL,
  NULL_POINTER,
  SIZEOF,
  UNSUPPORTED
}
