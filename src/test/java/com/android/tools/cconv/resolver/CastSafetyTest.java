// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.resolver;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.cconv.ast.CType;
import org.junit.Test;

public class CastSafetyTest {

  private static final CType INT = CType.intType();
  private static final CType CHAR = CType.charType();

  private static CType ptr(CType type) {
    return CType.pointerTo(type);
  }

  @Test
  public void testNonPointerTargetIsAlwaysSafe() {
    assertTrue(CastSafety.isSafe(ptr(INT), INT));
    assertTrue(CastSafety.isSafe(CType.doubleType(), INT));
  }

  @Test
  public void testIntegerToPointerIsUnsafe() {
    assertFalse(CastSafety.isSafe(INT, ptr(INT)));
  }

  @Test
  public void testVoidPointeeIsCompatibleWithAnything() {
    assertTrue(CastSafety.isSafe(ptr(INT), ptr(CType.voidType())));
    assertTrue(CastSafety.isSafe(ptr(CType.voidType()), ptr(CHAR)));
    assertTrue(CastSafety.isSafe(ptr(ptr(INT)), ptr(ptr(CType.voidType()))));
  }

  @Test
  public void testPointeeCategoriesMustMatch() {
    assertTrue(CastSafety.isSafe(ptr(INT), ptr(CType.longType())));
    assertTrue(CastSafety.isSafe(ptr(INT), ptr(CType.enumType("color"))));
    assertFalse(CastSafety.isSafe(ptr(INT), ptr(CHAR)));
    assertFalse(CastSafety.isSafe(ptr(INT), ptr(CType.doubleType())));
    assertFalse(CastSafety.isSafe(ptr(ptr(INT)), ptr(ptr(CHAR))));
  }

  @Test
  public void testPointerDepthMustMatch() {
    assertFalse(CastSafety.isSafe(ptr(ptr(INT)), ptr(INT)));
    assertFalse(CastSafety.isSafe(ptr(INT), ptr(ptr(INT))));
  }

  @Test
  public void testArraysDecay() {
    assertTrue(CastSafety.isSafe(CType.arrayOf(INT, 4), ptr(INT)));
    assertFalse(CastSafety.isSafe(CType.arrayOf(CHAR, 4), ptr(INT)));
  }

  @Test
  public void testDistinctRecordsAreUnsafe() {
    assertTrue(CastSafety.isSafe(ptr(CType.structType("a")), ptr(CType.structType("a"))));
    assertFalse(CastSafety.isSafe(ptr(CType.structType("a")), ptr(CType.structType("b"))));
  }
}
