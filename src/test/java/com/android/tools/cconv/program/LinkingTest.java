// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.program;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.android.tools.cconv.CConvTestBase;
import com.android.tools.cconv.ConversionResultInspector;
import com.android.tools.cconv.ast.AstFactory;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.ParameterDeclaration;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.ast.VariableDeclaration;
import com.android.tools.cconv.constraints.SafetyClass;
import com.android.tools.cconv.errors.ConflictingDeclarationsDiagnostic;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;

public class LinkingTest extends CConvTestBase {

  private static final SourceLocation HEADER_LOCATION = SourceLocation.create("shared.h", 5, 1);

  @Test
  public void testHeaderDeclarationsAreUnified() throws Exception {
    AstFactory first = new AstFactory("first.c");
    VariableDeclaration firstCache = first.at(HEADER_LOCATION).staticGlobal("cache", INT_PTR, null);
    FunctionDeclaration advance =
        first.definition(
            "advance",
            VOID,
            ImmutableList.of(),
            first.statement(first.postIncrement(first.ref(firstCache))));

    AstFactory second = new AstFactory("second.c");
    VariableDeclaration secondCache =
        second.at(HEADER_LOCATION).staticGlobal("cache", INT_PTR, null);
    ParameterDeclaration q = second.parameter("q", INT_PTR);
    FunctionDeclaration store =
        second.definition(
            "store",
            VOID,
            ImmutableList.of(q),
            second.statement(second.assign(second.ref(secondCache), second.ref(q))));

    ConversionResultInspector inspector =
        inspect(
            runCConv(
                first.translationUnit(firstCache, advance),
                second.translationUnit(secondCache, store)));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(firstCache));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(secondCache));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(q));
  }

  @Test
  public void testStaticGlobalsOfDifferentFilesAreDistinct() throws Exception {
    AstFactory first = new AstFactory("first.c");
    VariableDeclaration firstCounter = first.staticGlobal("counter", INT_PTR, null);
    FunctionDeclaration advance =
        first.definition(
            "advance",
            VOID,
            ImmutableList.of(),
            first.statement(first.postIncrement(first.ref(firstCounter))));
    AstFactory second = new AstFactory("second.c");
    VariableDeclaration secondCounter = second.staticGlobal("counter", INT_PTR, null);

    ConversionResultInspector inspector =
        inspect(
            runCConv(
                first.translationUnit(firstCounter, advance),
                second.translationUnit(secondCounter)));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(firstCounter));
    assertEquals(SafetyClass.PTR, inspector.outerClass(secondCounter));
  }

  @Test
  public void testExternalGlobalsAreLinkedByName() throws Exception {
    AstFactory first = new AstFactory("first.c");
    VariableDeclaration definition = first.global("table", INT_PTR);
    FunctionDeclaration advance =
        first.definition(
            "advance",
            VOID,
            ImmutableList.of(),
            first.statement(first.postIncrement(first.ref(definition))));
    AstFactory second = new AstFactory("second.c");
    VariableDeclaration declaration = second.externGlobal("table", INT_PTR);

    ConversionResultInspector inspector =
        inspect(
            runCConv(
                first.translationUnit(definition, advance),
                second.translationUnit(declaration)));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(declaration));
  }

  @Test
  public void testDefinitionInOtherUnitConstrainsCallers() throws Exception {
    AstFactory first = new AstFactory("caller.c");
    ParameterDeclaration declaredBuffer = first.parameter("buf", INT_PTR);
    FunctionDeclaration prototype =
        first.prototype("fill", VOID, declaredBuffer, first.parameter("n", INT));
    ParameterDeclaration data = first.parameter("data", INT_PTR);
    FunctionDeclaration caller =
        first.definition(
            "caller",
            VOID,
            ImmutableList.of(data),
            first.statement(first.call(prototype, first.ref(data), first.integer(4))));

    AstFactory second = new AstFactory("fill.c");
    ParameterDeclaration definedBuffer = second.parameter("buf", INT_PTR);
    ParameterDeclaration n = second.parameter("n", INT);
    FunctionDeclaration definition =
        second.definition(
            "fill",
            VOID,
            ImmutableList.of(definedBuffer, n),
            second.statement(second.subscript(second.ref(definedBuffer), second.integer(0))));

    ConversionResultInspector inspector =
        inspect(
            runCConv(
                first.translationUnit(prototype, caller), second.translationUnit(definition)));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(definedBuffer));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(declaredBuffer));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(data));
    assertEquals("count(n)", inspector.bounds(definedBuffer));
  }

  @Test
  public void testStaticFunctionsArePairedWithinTheirFile() throws Exception {
    AstFactory first = new AstFactory("first.c");
    ParameterDeclaration declared = first.parameter("p", INT_PTR);
    FunctionDeclaration prototype = first.staticPrototype("helper", VOID, declared);
    ParameterDeclaration defined = first.parameter("p", INT_PTR);
    FunctionDeclaration definition =
        first.staticDefinition(
            "helper",
            VOID,
            ImmutableList.of(defined),
            first.statement(first.postIncrement(first.ref(defined))));

    AstFactory second = new AstFactory("second.c");
    ParameterDeclaration other = second.parameter("p", INT_PTR);
    FunctionDeclaration otherPrototype = second.staticPrototype("helper", VOID, other);

    ConversionResultInspector inspector =
        inspect(
            runCConv(
                first.translationUnit(prototype, definition),
                second.translationUnit(otherPrototype)));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(defined));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(declared));
    assertTrue(inspector.isWild(other));
  }

  @Test
  public void testIncompatiblePrototypesAreWild() throws Exception {
    AstFactory first = new AstFactory("first.c");
    ParameterDeclaration a = first.parameter("a", INT_PTR);
    FunctionDeclaration oneParameter = first.prototype("h", VOID, a);
    AstFactory second = new AstFactory("second.c");
    ParameterDeclaration b = second.parameter("a", INT_PTR);
    FunctionDeclaration twoParameters =
        second.prototype("h", VOID, b, second.parameter("b", INT_PTR));

    ConversionResultInspector inspector =
        inspect(
            runCConv(
                builder -> builder.addExternOkayFunction("h"),
                first.translationUnit(oneParameter),
                second.translationUnit(twoParameters)));
    assertTrue(inspector.isWild(a));
    assertTrue(inspector.isWild(b));
    assertEquals(ProgramInfo.INCOMPATIBLE_DECLARATIONS, inspector.cause(a).getReason());
    List<ConflictingDeclarationsDiagnostic> warnings =
        inspector.warningsOfType(ConflictingDeclarationsDiagnostic.class);
    assertEquals(1, warnings.size());
    assertEquals("h", warnings.get(0).getFunctionName());
  }

  @Test
  public void testCompatiblePrototypesAreUnified() throws Exception {
    AstFactory first = new AstFactory("first.c");
    ParameterDeclaration a = first.parameter("a", INT_PTR);
    FunctionDeclaration prototype = first.prototype("h", VOID, a);
    AstFactory second = new AstFactory("second.c");
    ParameterDeclaration b = second.parameter("a", INT_PTR);
    FunctionDeclaration samePrototype = second.prototype("h", VOID, b);
    FunctionDeclaration withoutPrototype = second.prototypeWithoutParameters("h", VOID);

    ConversionResultInspector inspector =
        inspect(
            runCConv(
                builder -> builder.addExternOkayFunction("h"),
                first.translationUnit(prototype),
                second.translationUnit(samePrototype, withoutPrototype)));
    assertEquals(SafetyClass.PTR, inspector.outerClass(a));
    assertEquals(SafetyClass.PTR, inspector.outerClass(b));
    assertTrue(inspector.warningsOfType(ConflictingDeclarationsDiagnostic.class).isEmpty());
  }
}
