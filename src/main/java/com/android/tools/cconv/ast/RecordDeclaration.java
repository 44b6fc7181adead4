// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;

/** A struct or union definition. */
public final class RecordDeclaration extends Declaration {

  private final ImmutableList<FieldDeclaration> fields;

  RecordDeclaration(
      String name,
      RecordType type,
      SourceLocation location,
      ImmutableList<FieldDeclaration> fields) {
    super(name, type, location, false);
    this.fields = fields;
    fields.forEach(field -> field.setRecord(this));
  }

  public ImmutableList<FieldDeclaration> getFields() {
    return fields;
  }

  @Override
  public RecordType getType() {
    return super.getType().asRecord();
  }

  @Override
  public boolean isRecord() {
    return true;
  }

  @Override
  public RecordDeclaration asRecord() {
    return this;
  }
}
