// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/** The top-level declarations of one source file after preprocessing. */
public final class TranslationUnit {

  private final String fileName;
  private final ImmutableList<Declaration> declarations;

  public TranslationUnit(String fileName, List<? extends Declaration> declarations) {
    this.fileName = fileName;
    this.declarations = ImmutableList.copyOf(declarations);
  }

  public String getFileName() {
    return fileName;
  }

  public ImmutableList<Declaration> getDeclarations() {
    return declarations;
  }

  public void forEachFunction(Consumer<FunctionDeclaration> consumer) {
    for (Declaration declaration : declarations) {
      if (declaration.isFunction()) {
        consumer.accept(declaration.asFunction());
      }
    }
  }

  public void forEachRecord(Consumer<RecordDeclaration> consumer) {
    for (Declaration declaration : declarations) {
      if (declaration.isRecord()) {
        consumer.accept(declaration.asRecord());
      }
    }
  }

  @Override
  public String toString() {
    return fileName;
  }
}
