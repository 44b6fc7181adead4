// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

/**
 * A named declaration of the analyzed program.
 *
 * <p>Declarations have identity semantics: two declaration objects are the same declaration only
 * if they are the same object. Redeclarations across translation units are related through their
 * name, linkage and {@link SourceLocation}.
 */
public abstract class Declaration {

  private final String name;
  private final CType type;
  private final SourceLocation location;
  private final boolean hasBoundsAnnotation;

  Declaration(String name, CType type, SourceLocation location, boolean hasBoundsAnnotation) {
    this.name = name;
    this.type = type;
    this.location = location;
    this.hasBoundsAnnotation = hasBoundsAnnotation;
  }

  public String getName() {
    return name;
  }

  public CType getType() {
    return type;
  }

  public SourceLocation getLocation() {
    return location;
  }

  /** True if the declaration already carries an explicit bounds annotation in the source. */
  public boolean hasBoundsAnnotation() {
    return hasBoundsAnnotation;
  }

  public Linkage getLinkage() {
    return Linkage.NONE;
  }

  public boolean isVariable() {
    return false;
  }

  public VariableDeclaration asVariable() {
    return null;
  }

  public boolean isParameter() {
    return false;
  }

  public ParameterDeclaration asParameter() {
    return null;
  }

  public boolean isField() {
    return false;
  }

  public FieldDeclaration asField() {
    return null;
  }

  public boolean isFunction() {
    return false;
  }

  public FunctionDeclaration asFunction() {
    return null;
  }

  public boolean isRecord() {
    return false;
  }

  public RecordDeclaration asRecord() {
    return null;
  }

  @Override
  public String toString() {
    return name + "@" + location;
  }
}
