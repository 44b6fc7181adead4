// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils;

/**
 * Exception thrown to interrupt processing after a fatal error. The exception doesn't carry
 * directly information about the failure but the caller is expected to have reported it to the
 * {@link Reporter} before throwing.
 */
public class AbortException extends RuntimeException {

  public AbortException() {
    super("Analysis aborted due to reported errors");
  }

  public AbortException(String message) {
    super(message);
  }
}
