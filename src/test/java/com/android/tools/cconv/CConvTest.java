// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.android.tools.cconv.ast.AstFactory;
import com.android.tools.cconv.ast.CType;
import com.android.tools.cconv.ast.CheckedPointerKind;
import com.android.tools.cconv.ast.FieldDeclaration;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.ParameterDeclaration;
import com.android.tools.cconv.ast.RecordDeclaration;
import com.android.tools.cconv.ast.TranslationUnit;
import com.android.tools.cconv.ast.VariableDeclaration;
import com.android.tools.cconv.bounds.BoundsHeuristic;
import com.android.tools.cconv.constraints.SafetyClass;
import com.android.tools.cconv.constraints.VarAtom;
import com.android.tools.cconv.errors.UnboundedArrayDiagnostic;
import com.android.tools.cconv.errors.WildPointerDiagnostic;
import com.android.tools.cconv.rootcause.WildPointerReport;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class CConvTest extends CConvTestBase {

  @Test
  public void testCallToExternalFunctionMakesArgumentWild() throws Exception {
    AstFactory f = new AstFactory("strcpy.c");
    ParameterDeclaration dst = f.parameter("dst", CHAR_PTR);
    ParameterDeclaration src = f.parameter("src", CHAR_PTR);
    FunctionDeclaration strcpy = f.prototype("strcpy", CHAR_PTR, dst, src);
    ParameterDeclaration p = f.parameter("p", CHAR_PTR);
    FunctionDeclaration function =
        f.definition(
            "f",
            VOID,
            ImmutableList.of(p),
            f.statement(f.call(strcpy, f.ref(p), f.string("hi"))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(strcpy, function)));

    assertTrue(inspector.isWild(dst));
    assertTrue(inspector.isWild(src));
    assertTrue(inspector.isWild(p));
    assertEquals("Argument to function 'strcpy'", inspector.cause(p).getReason());

    WildPointerReport report = inspector.wildPointerReport();
    VarAtom pAtom = inspector.outerAtom(p);
    VarAtom dstAtom = inspector.outerAtom(dst);
    assertTrue(report.isDirectWild(dstAtom));
    assertTrue(report.isIndirectWild(pAtom));
    assertEquals(dstAtom, report.getLeader(pAtom));
    assertEquals(
        "Inner pointer of a parameter to external function: strcpy",
        report.getRootCause(pAtom).getReason());
    assertThat(report.getAffected(dstAtom), hasItem(pAtom));

    List<String> wildNames = new ArrayList<>();
    for (WildPointerDiagnostic diagnostic : inspector.infosOfType(WildPointerDiagnostic.class)) {
      wildNames.add(diagnostic.getName());
    }
    assertThat(wildNames, hasItem("dst"));
  }

  @Test
  public void testExternOkayFunctionDoesNotConstrainArguments() throws Exception {
    AstFactory f = new AstFactory("strcpy.c");
    ParameterDeclaration dst = f.parameter("dst", CHAR_PTR);
    ParameterDeclaration src = f.parameter("src", CHAR_PTR);
    FunctionDeclaration strcpy = f.prototype("strcpy", CHAR_PTR, dst, src);
    ParameterDeclaration p = f.parameter("p", CHAR_PTR);
    FunctionDeclaration function =
        f.definition(
            "f",
            VOID,
            ImmutableList.of(p),
            f.statement(f.call(strcpy, f.ref(p), f.string("hi"))));
    ConversionResultInspector inspector =
        inspect(
            runCConv(
                builder -> builder.addExternOkayFunction("strcpy"),
                f.translationUnit(strcpy, function)));

    assertEquals(SafetyClass.PTR, inspector.outerClass(p));
    assertEquals(SafetyClass.PTR, inspector.outerClass(dst));
  }

  @Test
  public void testMainArgumentVectorIsBoundByArgumentCount() throws Exception {
    AstFactory f = new AstFactory("main.c");
    ParameterDeclaration count = f.parameter("n", INT);
    ParameterDeclaration args = f.parameter("args", CType.pointerTo(CHAR_PTR));
    VariableDeclaration first = f.local("first", CHAR_PTR, f.subscript(f.ref(args), f.integer(0)));
    FunctionDeclaration main =
        f.definition(
            "main",
            INT,
            ImmutableList.of(count, args),
            f.declare(first),
            f.returnValue(f.integer(0)));
    ConversionResult result = runCConv(f.translationUnit(main));
    ConversionResultInspector inspector = inspect(result);

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(args));
    assertEquals("count(n)", inspector.bounds(args));
    assertEquals(
        1,
        result
            .getBoundsStats()
            .count(BoundsHeuristic.MAIN_FUNCTION));
  }

  @Test
  public void testAllocationSizeBindsElementCount() throws Exception {
    AstFactory f = new AstFactory("alloc.c");
    FunctionDeclaration malloc = mallocPrototype(f);
    VariableDeclaration n = f.local("n", INT, f.integer(10));
    VariableDeclaration p =
        f.local("p", INT_PTR, f.call(malloc, f.mul(f.ref(n), f.sizeOf(INT))));
    FunctionDeclaration function =
        f.definition("f", VOID, ImmutableList.of(), f.declare(n), f.declare(p));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(malloc, function)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(p));
    assertEquals("count(n)", inspector.bounds(p));
  }

  @Test
  public void testAllocationOfOtherElementTypeBindsByteCount() throws Exception {
    AstFactory f = new AstFactory("alloc.c");
    FunctionDeclaration malloc = mallocPrototype(f);
    VariableDeclaration n = f.local("n", INT, f.integer(10));
    VariableDeclaration p =
        f.local(
            "p",
            CType.pointerTo(CType.longType()),
            f.call(malloc, f.mul(f.ref(n), f.sizeOf(INT))));
    FunctionDeclaration function =
        f.definition("f", VOID, ImmutableList.of(), f.declare(n), f.declare(p));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(malloc, function)));

    assertEquals("byte_count(n)", inspector.bounds(p));
  }

  @Test
  public void testSingleElementAllocationIsPointer() throws Exception {
    AstFactory f = new AstFactory("alloc.c");
    FunctionDeclaration malloc = mallocPrototype(f);
    VariableDeclaration p = f.local("p", INT_PTR, f.call(malloc, f.sizeOf(INT)));
    FunctionDeclaration function = f.definition("f", VOID, ImmutableList.of(), f.declare(p));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(malloc, function)));

    assertEquals(SafetyClass.PTR, inspector.outerClass(p));
    assertNull(inspector.bounds(p));
  }

  @Test
  public void testUnclassifiedAllocationIsWild() throws Exception {
    AstFactory f = new AstFactory("alloc.c");
    FunctionDeclaration malloc = mallocPrototype(f);
    ParameterDeclaration size = f.parameter("size", INT);
    VariableDeclaration p = f.local("p", INT_PTR, f.call(malloc, f.ref(size)));
    FunctionDeclaration function = f.definition("f", VOID, ImmutableList.of(size), f.declare(p));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(malloc, function)));

    assertTrue(inspector.isWild(p));
  }

  @Test
  public void testStringLiteralIsNullTerminatedWithByteCount() throws Exception {
    AstFactory f = new AstFactory("string.c");
    VariableDeclaration s = f.local("s", CHAR_PTR, f.string("hi"));
    FunctionDeclaration function = f.definition("f", VOID, ImmutableList.of(), f.declare(s));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(function)));

    assertEquals(SafetyClass.NT_ARRAY, inspector.outerClass(s));
    assertThat(inspector.bounds(s), startsWith("byte_count("));
  }

  @Test
  public void testPointerArithmeticMakesArray() throws Exception {
    AstFactory f = new AstFactory("arith.c");
    ParameterDeclaration a = f.parameter("a", INT_PTR);
    VariableDeclaration q = f.local("q", INT_PTR, f.ref(a));
    FunctionDeclaration function =
        f.definition(
            "g",
            INT_PTR,
            ImmutableList.of(a),
            f.declare(q),
            f.returnValue(f.add(f.ref(q), f.integer(1))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(function)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(q));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(a));
    assertEquals("unbounded", inspector.bounds(a));
    List<String> unbounded = new ArrayList<>();
    for (UnboundedArrayDiagnostic diagnostic :
        inspector.warningsOfType(UnboundedArrayDiagnostic.class)) {
      unbounded.add(diagnostic.getName());
    }
    assertThat(unbounded, hasItem("a"));
  }

  @Test
  public void testNeighbouringLengthParameter() throws Exception {
    AstFactory f = new AstFactory("fill.c");
    ParameterDeclaration buffer = f.parameter("buf", INT_PTR);
    ParameterDeclaration n = f.parameter("n", INT);
    FunctionDeclaration function =
        f.definition(
            "fill",
            VOID,
            ImmutableList.of(buffer, n),
            f.statement(f.assign(f.subscript(f.ref(buffer), f.integer(0)), f.integer(1))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(function)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(buffer));
    assertEquals("count(n)", inspector.bounds(buffer));
  }

  @Test
  public void testComparedParameterIsNotALength() throws Exception {
    AstFactory f = new AstFactory("mode.c");
    ParameterDeclaration buffer = f.parameter("buf", INT_PTR);
    ParameterDeclaration mode = f.parameter("mode", INT);
    FunctionDeclaration function =
        f.definition(
            "fill",
            VOID,
            ImmutableList.of(buffer, mode),
            f.ifThen(f.eq(f.ref(mode), f.integer(1)), f.returnVoid()),
            f.statement(f.subscript(f.ref(buffer), f.integer(0))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(function)));

    assertEquals("unbounded", inspector.bounds(buffer));
    assertEquals(1, inspector.warningsOfType(UnboundedArrayDiagnostic.class).size());
  }

  @Test
  public void testUnsafeImplicitCastMakesSourceWild() throws Exception {
    AstFactory f = new AstFactory("cast.c");
    VariableDeclaration c = f.global("c", CHAR_PTR);
    VariableDeclaration p = f.global("p", INT_PTR);
    FunctionDeclaration function =
        f.definition(
            "f", VOID, ImmutableList.of(), f.statement(f.assign(f.ref(c), f.ref(p))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(c, p, function)));

    assertTrue(inspector.isWild(p));
    assertTrue(inspector.isWild(c));
    assertThat(inspector.cause(p).getReason(), startsWith("Cast from "));
  }

  @Test
  public void testUnsafeExplicitCastOnlyMakesResultWild() throws Exception {
    AstFactory f = new AstFactory("cast.c");
    ParameterDeclaration p = f.parameter("p", INT_PTR);
    VariableDeclaration c = f.local("c", CHAR_PTR, f.cast(CHAR_PTR, f.ref(p)));
    FunctionDeclaration function = f.definition("f", VOID, ImmutableList.of(p), f.declare(c));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(function)));

    assertTrue(inspector.isWild(c));
    assertEquals(SafetyClass.PTR, inspector.outerClass(p));
  }

  @Test
  public void testCastToVoidPointerIsWild() throws Exception {
    AstFactory f = new AstFactory("cast.c");
    ParameterDeclaration p = f.parameter("p", INT_PTR);
    VariableDeclaration v = f.local("v", VOID_PTR, f.cast(VOID_PTR, f.ref(p)));
    FunctionDeclaration function = f.definition("f", VOID, ImmutableList.of(p), f.declare(v));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(function)));

    assertTrue(inspector.isWild(v));
    assertTrue(inspector.isWild(p));
  }

  @Test
  public void testVariadicArguments() throws Exception {
    for (boolean handleVarargs : new boolean[] {false, true}) {
      AstFactory f = new AstFactory("printf.c");
      FunctionDeclaration printf =
          f.variadicPrototype("printf", INT, f.parameter("format", CHAR_PTR));
      ParameterDeclaration p = f.parameter("p", INT_PTR);
      FunctionDeclaration function =
          f.definition(
              "f",
              VOID,
              ImmutableList.of(p),
              f.statement(f.call(printf, f.string("%p"), f.ref(p))));
      ConversionResultInspector inspector =
          inspect(
              runCConv(
                  builder -> builder.setHandleVarargs(handleVarargs),
                  f.translationUnit(printf, function)));
      assertEquals(handleVarargs, inspector.isWild(p));
      if (handleVarargs) {
        assertEquals(
            "Passing argument to a variadic function", inspector.cause(p).getReason());
      }
    }
  }

  @Test
  public void testHasChanged() throws Exception {
    AstFactory f = new AstFactory("changed.c");
    VariableDeclaration safe = f.global("safe", INT_PTR);
    VariableDeclaration wild = f.global("wild", VOID_PTR);
    ConversionResult result = runCConv(f.translationUnit(safe, wild));

    assertTrue(result.hasChanged(safe));
    assertFalse(result.hasChanged(wild));
    assertThat(result.getSafetyClasses(safe), contains(SafetyClass.PTR));
  }

  @Test
  public void testStatisticsConsumer() throws Exception {
    List<String> received = new ArrayList<>();
    AstFactory first = new AstFactory("first.c");
    AstFactory second = new AstFactory("second.c");
    TranslationUnit firstUnit = first.translationUnit(first.global("p", INT_PTR));
    TranslationUnit secondUnit = second.translationUnit(second.global("q", VOID_PTR));
    runCConv(builder -> builder.setStatsConsumer(received::add), firstUnit, secondUnit);

    assertEquals(1, received.size());
    JsonObject stats = JsonParser.parseString(received.get(0)).getAsJsonObject();
    assertEquals(2, stats.getAsJsonArray("files").size());
    JsonObject summary = stats.getAsJsonObject("summary");
    assertEquals(1, summary.get("ptr").getAsInt());
    assertEquals(1, summary.get("wild").getAsInt());
  }

  @Test
  public void testJsonDumpIsWellFormed() throws Exception {
    AstFactory f = new AstFactory("dump.c");
    ParameterDeclaration buffer = f.parameter("buf", INT_PTR);
    ParameterDeclaration n = f.parameter("n", INT);
    FunctionDeclaration function =
        f.definition(
            "fill",
            VOID,
            ImmutableList.of(buffer, n),
            f.statement(f.subscript(f.ref(buffer), f.integer(0))));
    ConversionResult result = runCConv(f.translationUnit(function));

    JsonObject dump = JsonParser.parseString(result.dumpJson()).getAsJsonObject();
    assertNotNull(dump.getAsJsonObject("stats"));
    assertEquals(1, dump.getAsJsonArray("units").size());
    JsonObject unit = dump.getAsJsonArray("units").get(0).getAsJsonObject();
    assertEquals("dump.c", unit.get("file").getAsString());
    assertTrue(unit.getAsJsonObject("externalFunctions").has("fill"));
  }

  @Test
  public void testCountFieldBindsDataOverCommonSubsequence() throws Exception {
    AstFactory f = new AstFactory("buffer.c");
    FieldDeclaration data = f.field("data", INT_PTR);
    FieldDeclaration xdata = f.field("xdata", INT);
    FieldDeclaration count = f.field("count", INT);
    RecordDeclaration buffer = f.struct("buffer", data, xdata, count);
    ParameterDeclaration b = f.parameter("b", CType.pointerTo(CType.structType("buffer")));
    FunctionDeclaration get =
        f.definition(
            "get",
            INT,
            ImmutableList.of(b),
            f.returnValue(f.subscript(f.arrow(f.ref(b), data), f.integer(1))));
    ConversionResult result = runCConv(f.translationUnit(buffer, get));
    ConversionResultInspector inspector = inspect(result);

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(data));
    assertEquals("count(count)", inspector.bounds(data));
    assertEquals(1, result.getBoundsStats().count(BoundsHeuristic.LENGTH_KEYWORD));
    assertEquals(0, result.getBoundsStats().count(BoundsHeuristic.COMMON_SUBSEQUENCE));
  }

  @Test
  public void testEnumFieldIsNeverALength() throws Exception {
    AstFactory f = new AstFactory("mode.c");
    FieldDeclaration data = f.field("data", INT_PTR);
    FieldDeclaration size = f.field("size", CType.enumType("mode"));
    RecordDeclaration record = f.struct("s", data, size);
    ParameterDeclaration n = f.parameter("n", CType.pointerTo(CType.structType("s")));
    FunctionDeclaration first =
        f.definition(
            "first",
            INT,
            ImmutableList.of(n),
            f.returnValue(f.subscript(f.arrow(f.ref(n), data), f.integer(0))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(record, first)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(data));
    assertNull(inspector.bounds(data));
  }

  @Test
  public void testCheckedArrayAllocationBindsElementCount() throws Exception {
    AstFactory f = new AstFactory("checked.c");
    FunctionDeclaration malloc = mallocPrototype(f);
    VariableDeclaration n = f.local("n", INT, f.integer(10));
    VariableDeclaration p =
        f.local(
            "p",
            CType.checkedPointerTo(INT, CheckedPointerKind.ARRAY),
            f.call(malloc, f.mul(f.ref(n), f.sizeOf(INT))));
    FunctionDeclaration function =
        f.definition("f", VOID, ImmutableList.of(), f.declare(n), f.declare(p));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(malloc, function)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(p));
    assertEquals("count(n)", inspector.bounds(p));
  }
}
