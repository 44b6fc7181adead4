// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils;

import com.android.tools.cconv.Diagnostic;
import com.android.tools.cconv.DiagnosticsHandler;
import com.android.tools.cconv.DiagnosticsLevel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Forwards diagnostics to the client handler after applying its level mapping.
 *
 * <p>The reporter also remembers every diagnostic that was delivered so that results can expose
 * the diagnostic stream after the run.
 */
public class Reporter implements DiagnosticsHandler {

  private final DiagnosticsHandler clientHandler;
  private final List<Diagnostic> errors = new ArrayList<>();
  private final List<Diagnostic> warnings = new ArrayList<>();
  private final List<Diagnostic> infos = new ArrayList<>();

  public Reporter() {
    this(new DiagnosticsHandler() {});
  }

  public Reporter(DiagnosticsHandler clientHandler) {
    this.clientHandler = clientHandler;
  }

  public DiagnosticsHandler getClientHandler() {
    return clientHandler;
  }

  private void handleDiagnostic(DiagnosticsLevel level, Diagnostic diagnostic) {
    DiagnosticsLevel modifiedLevel = clientHandler.modifyDiagnosticsLevel(level, diagnostic);
    switch (modifiedLevel) {
      case ERROR:
        synchronized (this) {
          errors.add(diagnostic);
        }
        clientHandler.error(diagnostic);
        break;
      case WARNING:
        synchronized (this) {
          warnings.add(diagnostic);
        }
        clientHandler.warning(diagnostic);
        break;
      case INFO:
        synchronized (this) {
          infos.add(diagnostic);
        }
        clientHandler.info(diagnostic);
        break;
      case NONE:
        break;
      default:
        throw new IllegalArgumentException("Unexpected diagnostics level: " + modifiedLevel);
    }
  }

  @Override
  public void error(Diagnostic error) {
    handleDiagnostic(DiagnosticsLevel.ERROR, error);
  }

  @Override
  public void warning(Diagnostic warning) {
    handleDiagnostic(DiagnosticsLevel.WARNING, warning);
  }

  @Override
  public void info(Diagnostic info) {
    handleDiagnostic(DiagnosticsLevel.INFO, info);
  }

  /** Reports the error and aborts the analysis. */
  public RuntimeException fatalError(Diagnostic error) {
    error(error);
    throw new AbortException(error.getDiagnosticMessage());
  }

  public synchronized boolean hasErrors() {
    return !errors.isEmpty();
  }

  public synchronized void failIfPendingErrors() {
    if (!errors.isEmpty()) {
      throw new AbortException();
    }
  }

  public synchronized List<Diagnostic> getErrors() {
    return Collections.unmodifiableList(new ArrayList<>(errors));
  }

  public synchronized List<Diagnostic> getWarnings() {
    return Collections.unmodifiableList(new ArrayList<>(warnings));
  }

  public synchronized List<Diagnostic> getInfos() {
    return Collections.unmodifiableList(new ArrayList<>(infos));
  }
}
