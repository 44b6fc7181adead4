// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.android.tools.cconv.AnalysisFailedException;
import com.android.tools.cconv.Diagnostic;
import com.android.tools.cconv.DiagnosticsHandler;
import com.android.tools.cconv.DiagnosticsLevel;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.errors.InternalAnalysisError;
import com.android.tools.cconv.errors.UnsupportedExpressionDiagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import org.junit.Test;

public class ReporterTest {

  private static final Diagnostic DIAGNOSTIC =
      new UnsupportedExpressionDiagnostic("asm", SourceLocation.create("test.c", 1, 1));

  private static class RecordingHandler implements DiagnosticsHandler {

    private final DiagnosticsLevel override;
    private final List<String> seen = new ArrayList<>();

    RecordingHandler(DiagnosticsLevel override) {
      this.override = override;
    }

    @Override
    public void error(Diagnostic error) {
      seen.add("error");
    }

    @Override
    public void warning(Diagnostic warning) {
      seen.add("warning");
    }

    @Override
    public void info(Diagnostic info) {
      seen.add("info");
    }

    @Override
    public DiagnosticsLevel modifyDiagnosticsLevel(DiagnosticsLevel level, Diagnostic diagnostic) {
      return override != null ? override : level;
    }
  }

  @Test
  public void testDiagnosticsAreRecordedAndForwarded() {
    RecordingHandler handler = new RecordingHandler(null);
    Reporter reporter = new Reporter(handler);
    reporter.warning(DIAGNOSTIC);
    reporter.info(DIAGNOSTIC);
    assertThat(handler.seen, contains("warning", "info"));
    assertThat(reporter.getWarnings(), contains(DIAGNOSTIC));
    assertThat(reporter.getInfos(), contains(DIAGNOSTIC));
    assertFalse(reporter.hasErrors());
    reporter.failIfPendingErrors();
  }

  @Test
  public void testLevelMapping() {
    RecordingHandler handler = new RecordingHandler(DiagnosticsLevel.ERROR);
    Reporter reporter = new Reporter(handler);
    reporter.info(DIAGNOSTIC);
    assertThat(handler.seen, contains("error"));
    assertTrue(reporter.hasErrors());
    assertThrows(AbortException.class, reporter::failIfPendingErrors);
  }

  @Test
  public void testDroppedDiagnostics() {
    RecordingHandler handler = new RecordingHandler(DiagnosticsLevel.NONE);
    Reporter reporter = new Reporter(handler);
    reporter.warning(DIAGNOSTIC);
    assertThat(handler.seen, empty());
    assertThat(reporter.getWarnings(), empty());
  }

  @Test
  public void testFatalErrorAborts() {
    Reporter reporter = new Reporter(new RecordingHandler(null));
    AbortException abort =
        assertThrows(AbortException.class, () -> reporter.fatalError(DIAGNOSTIC));
    assertEquals(DIAGNOSTIC.getDiagnosticMessage(), abort.getMessage());
  }

  @Test
  public void testHandlerTurnsFailuresIntoAnalysisFailures() throws Exception {
    Reporter reporter = new Reporter(new RecordingHandler(null));
    assertEquals("ok", ExceptionUtils.withAnalysisHandler(reporter, () -> "ok"));

    InternalAnalysisError internal = new InternalAnalysisError("broken");
    AnalysisFailedException failure =
        assertThrows(
            AnalysisFailedException.class,
            () ->
                ExceptionUtils.withAnalysisHandler(
                    reporter,
                    () -> {
                      throw new ExecutionException(internal);
                    }));
    assertSame(internal, failure.getCause());
    assertEquals("Analysis failed: broken", failure.getMessage());

    reporter.error(DIAGNOSTIC);
    assertThrows(
        AnalysisFailedException.class, () -> ExceptionUtils.withAnalysisHandler(reporter, () -> 1));
  }

  @Test
  public void testUnexpectedRuntimeExceptionsPropagate() {
    Reporter reporter = new Reporter(new RecordingHandler(null));
    IllegalStateException bug = new IllegalStateException("bug");
    IllegalStateException thrown =
        assertThrows(
            IllegalStateException.class,
            () ->
                ExceptionUtils.withAnalysisHandler(
                    reporter,
                    () -> {
                      throw new ExecutionException(bug);
                    }));
    assertSame(bug, thrown);
  }
}
