// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

public final class FieldDeclaration extends Declaration {

  private RecordDeclaration record;

  FieldDeclaration(String name, CType type, SourceLocation location, boolean hasBoundsAnnotation) {
    super(name, type, location, hasBoundsAnnotation);
  }

  public RecordDeclaration getRecord() {
    return record;
  }

  void setRecord(RecordDeclaration record) {
    assert this.record == null;
    this.record = record;
  }

  @Override
  public boolean isField() {
    return true;
  }

  @Override
  public FieldDeclaration asField() {
    return this;
  }
}
