// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.resolver;

import com.android.tools.cconv.ast.CType;

/** Decides whether a cast between two types preserves pointer safety. */
public class CastSafety {

  private CastSafety() {}

  public static boolean isSafe(CType source, CType target) {
    if (!target.isPointer()) {
      return true;
    }
    if (!source.isPointerOrArray()) {
      return false;
    }
    return isSafeInner(decay(source), target);
  }

  private static boolean isSafeInner(CType source, CType target) {
    if (source.equals(target)) {
      return true;
    }
    boolean sourceIsPointer = source.isPointerOrArray();
    boolean targetIsPointer = target.isPointerOrArray();
    if (sourceIsPointer && targetIsPointer) {
      CType sourcePointee = source.getReferencedType();
      CType targetPointee = target.getReferencedType();
      if (sourcePointee.isVoid() || targetPointee.isVoid()) {
        return true;
      }
      return isSafeInner(sourcePointee, targetPointee);
    }
    if (sourceIsPointer || targetIsPointer) {
      return false;
    }
    if (!source.isScalar() || !target.isScalar()) {
      return false;
    }
    return scalarCategory(source) == scalarCategory(target);
  }

  private static CType decay(CType type) {
    return type.isArray() ? type.asArray().decay() : type;
  }

  // Characters, other integers (including enums) and floating point numbers.
  private static int scalarCategory(CType type) {
    if (type.isArithmetic()) {
      switch (type.asArithmetic().getCategory()) {
        case CHAR:
          return 0;
        case INTEGER:
          return 1;
        case FLOATING:
          return 2;
        default:
          break;
      }
    }
    return type.isEnum() ? 1 : 3;
  }
}
