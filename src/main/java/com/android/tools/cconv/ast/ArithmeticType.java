// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public final class ArithmeticType extends CType {

  public enum Category {
    CHAR,
    INTEGER,
    FLOATING
  }

  static final ArithmeticType CHAR = new ArithmeticType("char", Category.CHAR);
  static final ArithmeticType INT = new ArithmeticType("int", Category.INTEGER);
  static final ArithmeticType LONG = new ArithmeticType("long", Category.INTEGER);
  static final ArithmeticType UNSIGNED_LONG = new ArithmeticType("unsigned long", Category.INTEGER);
  static final ArithmeticType DOUBLE = new ArithmeticType("double", Category.FLOATING);

  private final String name;
  private final Category category;

  private ArithmeticType(String name, Category category) {
    this.name = name;
    this.category = category;
  }

  public static ArithmeticType create(String name, Category category) {
    return new ArithmeticType(name, category);
  }

  public String getName() {
    return name;
  }

  public Category getCategory() {
    return category;
  }

  public boolean isCharType() {
    return category == Category.CHAR;
  }

  public boolean isFloatingType() {
    return category == Category.FLOATING;
  }

  @Override
  public boolean isArithmetic() {
    return true;
  }

  @Override
  public ArithmeticType asArithmetic() {
    return this;
  }

  @Override
  public boolean isIntegerType() {
    return category != Category.FLOATING;
  }

  @Override
  public boolean isScalar() {
    return true;
  }

  @Override
  public String toSourceString() {
    return name;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    ArithmeticType other = (ArithmeticType) obj;
    return name.equals(other.name) && category == other.category;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
}
