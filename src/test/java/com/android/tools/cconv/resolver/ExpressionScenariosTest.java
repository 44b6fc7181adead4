// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.resolver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.android.tools.cconv.CConvTestBase;
import com.android.tools.cconv.ConversionResult;
import com.android.tools.cconv.ConversionResultInspector;
import com.android.tools.cconv.ast.AstFactory;
import com.android.tools.cconv.ast.CType;
import com.android.tools.cconv.ast.Expression;
import com.android.tools.cconv.ast.FieldDeclaration;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.ParameterDeclaration;
import com.android.tools.cconv.ast.RecordDeclaration;
import com.android.tools.cconv.ast.VariableDeclaration;
import com.android.tools.cconv.constraints.SafetyClass;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.FunctionVariable;
import com.android.tools.cconv.errors.UnsupportedExpressionDiagnostic;
import com.android.tools.cconv.program.ProgramInfo;
import com.android.tools.cconv.program.TranslationUnitInfo;
import com.android.tools.cconv.utils.AnalysisOptions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

public class ExpressionScenariosTest extends CConvTestBase {

  @Test
  public void testFieldIndexedThroughArrowIsBoundBySiblingField() throws Exception {
    AstFactory f = new AstFactory("node.c");
    FieldDeclaration data = f.field("data", INT_PTR);
    FieldDeclaration len = f.field("len", INT);
    RecordDeclaration node = f.struct("node", data, len);
    ParameterDeclaration n = f.parameter("n", CType.pointerTo(CType.structType("node")));
    FunctionDeclaration first =
        f.definition(
            "first",
            INT,
            ImmutableList.of(n),
            f.returnValue(f.subscript(f.arrow(f.ref(n), data), f.integer(0))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(node, first)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(data));
    assertEquals("count(len)", inspector.bounds(data));
    assertEquals(SafetyClass.PTR, inspector.outerClass(n));
  }

  @Test
  public void testCallThroughFunctionPointer() throws Exception {
    AstFactory f = new AstFactory("callback.c");
    ParameterDeclaration callback =
        f.parameter("callback", CType.pointerTo(CType.functionType(INT_PTR, INT_PTR)));
    ParameterDeclaration q = f.parameter("q", INT_PTR);
    VariableDeclaration r = f.local("r", INT_PTR, f.callThrough(f.ref(callback), f.ref(q)));
    FunctionDeclaration apply =
        f.definition(
            "apply",
            VOID,
            ImmutableList.of(callback, q),
            f.declare(r),
            f.statement(f.postIncrement(f.ref(q))),
            f.statement(f.preIncrement(f.ref(r))));
    ConversionResult result = runCConv(f.translationUnit(apply));
    ConversionResultInspector inspector = inspect(result);

    FunctionVariable function = inspector.variable(callback).getFunctionVariable();
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(r));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(q));
    assertEquals(
        SafetyClass.PTR, function.getReturnVariable().getSolvedOuterClass(result.getSolution()));
    assertEquals(
        SafetyClass.ARRAY,
        function
            .getParameterVariables(0)
            .iterator()
            .next()
            .asPointerVariable()
            .getSolvedOuterClass(result.getSolution()));
  }

  @Test
  public void testLoopsAndBranchesAreVisited() throws Exception {
    AstFactory f = new AstFactory("scan.c");
    ParameterDeclaration s = f.parameter("s", CHAR_PTR);
    ParameterDeclaration p = f.parameter("p", INT_PTR);
    ParameterDeclaration q = f.parameter("q", INT_PTR);
    FunctionDeclaration scan =
        f.definition(
            "scan",
            VOID,
            ImmutableList.of(s, p, q),
            f.whileLoop(
                f.deref(f.ref(s)), f.block(f.statement(f.postIncrement(f.ref(s))))),
            f.ifThenElse(
                f.ne(f.ref(p), f.nullPointer()),
                f.statement(f.deref(f.ref(p))),
                f.statement(f.postDecrement(f.ref(q)))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(scan)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(s));
    assertEquals(SafetyClass.PTR, inspector.outerClass(p));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(q));
  }

  @Test
  public void testArrayInitializerLinksElements() throws Exception {
    AstFactory f = new AstFactory("table.c");
    ParameterDeclaration a = f.parameter("a", INT_PTR);
    ParameterDeclaration b = f.parameter("b", INT_PTR);
    CType tableType = CType.arrayOf(INT_PTR, 2);
    VariableDeclaration table =
        f.local("table", tableType, f.initList(tableType, f.ref(a), f.ref(b)));
    FunctionDeclaration fill =
        f.definition(
            "fill",
            VOID,
            ImmutableList.of(a, b),
            f.declare(table),
            f.statement(f.postIncrement(f.subscript(f.ref(table), f.integer(0)))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(fill)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(table));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(a));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(b));
    assertNull(inspector.bounds(table));
  }

  @Test
  public void testNullAndUnsupportedInitializersConstrainNothing() throws Exception {
    AstFactory f = new AstFactory("init.c");
    VariableDeclaration empty = f.local("empty", INT_PTR, f.nullPointer());
    VariableDeclaration opaque =
        f.local("opaque", INT_PTR, f.unsupported(INT_PTR, "__builtin_frame_address(0)"));
    FunctionDeclaration init =
        f.definition("init", VOID, ImmutableList.of(), f.declare(empty, opaque));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(init)));

    assertEquals(SafetyClass.PTR, inspector.outerClass(empty));
    assertEquals(SafetyClass.PTR, inspector.outerClass(opaque));
    assertEquals(1, inspector.infosOfType(UnsupportedExpressionDiagnostic.class).size());
  }

  @Test
  public void testReallocPassesWildnessBackToTheOldPointerOnly() throws Exception {
    AstFactory f = new AstFactory("grow.c");
    FunctionDeclaration realloc =
        f.prototype(
            "realloc",
            VOID_PTR,
            f.parameter("ptr", VOID_PTR),
            f.parameter("size", CType.sizeType()));
    FunctionDeclaration sink = f.prototype("sink", VOID, f.parameter("x", INT_PTR));
    ParameterDeclaration p = f.parameter("p", INT_PTR);
    ParameterDeclaration old = f.parameter("old", INT_PTR);
    ParameterDeclaration n = f.parameter("n", INT);
    VariableDeclaration q =
        f.local("q", INT_PTR, f.call(realloc, f.ref(p), f.mul(f.ref(n), f.sizeOf(INT))));
    VariableDeclaration r =
        f.local("r", INT_PTR, f.call(realloc, f.ref(old), f.mul(f.ref(n), f.sizeOf(INT))));
    FunctionDeclaration grow =
        f.definition(
            "grow",
            VOID,
            ImmutableList.of(p, old, n),
            f.declare(q),
            f.statement(f.call(sink, f.ref(q))),
            f.statement(f.call(sink, f.ref(old))),
            f.declare(r),
            f.statement(f.subscript(f.ref(r), f.integer(1))));
    ConversionResultInspector inspector =
        inspect(runCConv(f.translationUnit(realloc, sink, grow)));

    assertTrue(inspector.isWild(q));
    assertTrue(inspector.isWild(p));
    assertTrue(inspector.isWild(old));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(r));
  }

  @Test
  public void testCallocCountAndElementSizeBindBounds() throws Exception {
    AstFactory f = new AstFactory("zero.c");
    FunctionDeclaration calloc =
        f.prototype(
            "calloc",
            VOID_PTR,
            f.parameter("count", CType.sizeType()),
            f.parameter("size", CType.sizeType()));
    VariableDeclaration n = f.local("n", INT, f.integer(16));
    VariableDeclaration many =
        f.local("many", INT_PTR, f.call(calloc, f.ref(n), f.sizeOf(INT)));
    VariableDeclaration one =
        f.local("one", INT_PTR, f.call(calloc, f.integer(1), f.sizeOf(INT)));
    FunctionDeclaration zero =
        f.definition("zero", VOID, ImmutableList.of(), f.declare(n), f.declare(many, one));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(calloc, zero)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(many));
    assertEquals("count(n)", inspector.bounds(many));
    assertEquals(SafetyClass.PTR, inspector.outerClass(one));
    assertNull(inspector.bounds(one));
  }

  @Test
  public void testConditionalMergesBothBranches() throws Exception {
    AstFactory f = new AstFactory("choose.c");
    ParameterDeclaration c = f.parameter("c", INT);
    ParameterDeclaration a = f.parameter("a", INT_PTR);
    ParameterDeclaration b = f.parameter("b", INT_PTR);
    ParameterDeclaration other = f.parameter("other", INT_PTR);
    VariableDeclaration r = f.local("r", INT_PTR, f.conditional(f.ref(c), f.ref(a), f.ref(b)));
    FunctionDeclaration choose =
        f.definition(
            "choose",
            VOID,
            ImmutableList.of(c, a, b, other),
            f.declare(r),
            f.statement(f.postIncrement(f.ref(r))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(choose)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(r));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(a));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(b));
    assertEquals(SafetyClass.PTR, inspector.outerClass(other));
  }

  @Test
  public void testCompoundLiteralLinksItsInitializer() throws Exception {
    AstFactory f = new AstFactory("literal.c");
    ParameterDeclaration q = f.parameter("q", INT_PTR);
    VariableDeclaration p =
        f.local("p", INT_PTR, f.compoundLiteral(INT_PTR, f.initList(INT_PTR, f.ref(q))));
    FunctionDeclaration step =
        f.definition(
            "step",
            VOID,
            ImmutableList.of(q),
            f.declare(p),
            f.statement(f.postIncrement(f.ref(p))));
    ConversionResultInspector inspector = inspect(runCConv(f.translationUnit(step)));

    assertEquals(SafetyClass.ARRAY, inspector.outerClass(p));
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(q));
  }

  @Test
  public void testResolvingAnExpressionTwiceAddsNothing() {
    AstFactory f = new AstFactory("cache.c");
    ParameterDeclaration p = f.parameter("p", INT_PTR);
    FunctionDeclaration use =
        f.definition("use", VOID, ImmutableList.of(p), f.statement(f.deref(f.ref(p))));
    TranslationUnitInfo unit =
        new ProgramInfo(new AnalysisOptions()).createUnitInfo(f.translationUnit(use));
    new ConstraintBuilder(unit).build();
    ExpressionConstraintResolver resolver = unit.getResolver();
    Expression cast = f.cast(CHAR_PTR, f.ref(p));

    int variablesBefore = unit.getGraph().getNumberOfVariables();
    ImmutableSet<ConstraintVariable> first = resolver.getExprConstraintVars(cast);
    int variables = unit.getGraph().getNumberOfVariables();
    int constraints = unit.getGraph().getNumberOfConstraints();
    ImmutableSet<ConstraintVariable> second = resolver.getExprConstraintVars(cast);

    assertTrue(variables > variablesBefore);
    assertSame(first, second);
    assertEquals(variables, unit.getGraph().getNumberOfVariables());
    assertEquals(constraints, unit.getGraph().getNumberOfConstraints());
  }

  @Test
  public void testCallThroughDereferencedFunction() throws Exception {
    AstFactory f = new AstFactory("deref.c");
    ParameterDeclaration x = f.parameter("x", INT_PTR);
    FunctionDeclaration id =
        f.definition("id", INT_PTR, ImmutableList.of(x), f.returnValue(f.ref(x)));
    ParameterDeclaration fp =
        f.parameter("fp", CType.pointerTo(CType.functionType(INT_PTR, INT_PTR)));
    ParameterDeclaration q = f.parameter("q", INT_PTR);
    VariableDeclaration a = f.local("a", INT_PTR, f.callThrough(f.deref(f.ref(fp)), f.ref(q)));
    VariableDeclaration b =
        f.local("b", INT_PTR, f.callThrough(f.deref(f.deref(f.ref(fp))), f.ref(q)));
    VariableDeclaration c = f.local("c", INT_PTR, f.callThrough(f.deref(f.ref(id)), f.ref(q)));
    FunctionDeclaration run =
        f.definition(
            "run",
            VOID,
            ImmutableList.of(fp, q),
            f.declare(a, b, c),
            f.statement(f.postIncrement(f.ref(a))));
    ConversionResult result = runCConv(f.translationUnit(id, run));
    ConversionResultInspector inspector = inspect(result);

    FunctionVariable function = inspector.variable(fp).getFunctionVariable();
    assertEquals(SafetyClass.ARRAY, inspector.outerClass(a));
    assertEquals(SafetyClass.PTR, inspector.outerClass(b));
    assertEquals(SafetyClass.PTR, inspector.outerClass(c));
    assertEquals(SafetyClass.PTR, inspector.outerClass(q));
    assertEquals(
        SafetyClass.PTR, function.getReturnVariable().getSolvedOuterClass(result.getSolution()));
  }
}
