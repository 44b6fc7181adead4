// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A C type as seen by the analysis.
 *
 * <p>Qualifiers and typedefs are resolved away by the front end. Types are compared structurally.
 */
public abstract class CType {

  CType() {}

  public static ArithmeticType charType() {
    return ArithmeticType.CHAR;
  }

  public static ArithmeticType intType() {
    return ArithmeticType.INT;
  }

  public static ArithmeticType longType() {
    return ArithmeticType.LONG;
  }

  public static ArithmeticType sizeType() {
    return ArithmeticType.UNSIGNED_LONG;
  }

  public static ArithmeticType doubleType() {
    return ArithmeticType.DOUBLE;
  }

  public static VoidType voidType() {
    return VoidType.INSTANCE;
  }

  public static EnumType enumType(String name) {
    return new EnumType(name);
  }

  public static RecordType structType(String name) {
    return new RecordType(name, false);
  }

  public static RecordType unionType(String name) {
    return new RecordType(name, true);
  }

  public static PointerType pointerTo(CType pointee) {
    return new PointerType(pointee, CheckedPointerKind.UNCHECKED);
  }

  public static PointerType checkedPointerTo(CType pointee, CheckedPointerKind kind) {
    return new PointerType(pointee, kind);
  }

  public static ArrayType arrayOf(CType elementType, int size) {
    return new ArrayType(elementType, size, CheckedPointerKind.UNCHECKED);
  }

  public static ArrayType arrayOf(CType elementType) {
    return new ArrayType(elementType, ArrayType.INCOMPLETE, CheckedPointerKind.UNCHECKED);
  }

  public static ArrayType checkedArrayOf(CType elementType, int size, CheckedPointerKind kind) {
    return new ArrayType(elementType, size, kind);
  }

  public static FunctionType functionType(CType returnType, CType... parameterTypes) {
    return new FunctionType(returnType, ImmutableList.copyOf(parameterTypes), false, true);
  }

  public static FunctionType functionType(
      CType returnType, List<CType> parameterTypes, boolean variadic) {
    return new FunctionType(returnType, ImmutableList.copyOf(parameterTypes), variadic, true);
  }

  public static FunctionType functionTypeWithoutPrototype(CType returnType) {
    return new FunctionType(returnType, ImmutableList.of(), false, false);
  }

  public boolean isArithmetic() {
    return false;
  }

  public ArithmeticType asArithmetic() {
    return null;
  }

  public boolean isEnum() {
    return false;
  }

  public boolean isVoid() {
    return false;
  }

  public boolean isRecord() {
    return false;
  }

  public RecordType asRecord() {
    return null;
  }

  public boolean isPointer() {
    return false;
  }

  public PointerType asPointer() {
    return null;
  }

  public boolean isArray() {
    return false;
  }

  public ArrayType asArray() {
    return null;
  }

  public boolean isFunction() {
    return false;
  }

  public FunctionType asFunction() {
    return null;
  }

  public boolean isPointerOrArray() {
    return isPointer() || isArray();
  }

  public boolean isVoidPointer() {
    return isPointer() && asPointer().getPointeeType().isVoid();
  }

  public boolean isFunctionPointer() {
    return isPointer() && asPointer().getPointeeType().isFunction();
  }

  /** True for types that C integer promotions apply to, including char and enums. */
  public boolean isIntegerType() {
    return false;
  }

  public boolean isScalar() {
    return false;
  }

  /** The pointee of a pointer or the element of an array. */
  public CType getReferencedType() {
    return null;
  }

  public abstract String toSourceString();

  @Override
  public String toString() {
    return toSourceString();
  }
}
