// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;

import com.android.tools.cconv.ast.AstFactory;
import com.android.tools.cconv.ast.BinaryOperator;
import com.android.tools.cconv.ast.CType;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.ParameterDeclaration;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class NonLengthParameterCollectorTest {

  private static final CType INT = CType.intType();

  private final AstFactory f = new AstFactory("test.c");

  @Test
  public void testEqualityOperandsInConditionsAreExcluded() {
    ParameterDeclaration a = f.parameter("a", INT);
    ParameterDeclaration b = f.parameter("b", INT);
    ParameterDeclaration n = f.parameter("n", INT);
    ParameterDeclaration m = f.parameter("m", INT);
    FunctionDeclaration function =
        f.definition(
            "check",
            INT,
            ImmutableList.of(a, b, n, m),
            f.ifThen(
                f.binary(
                    BinaryOperator.LOGICAL_AND,
                    f.eq(f.ref(a), f.ref(b)),
                    f.binary(BinaryOperator.LT, f.ref(n), f.ref(m))),
                f.returnValue(f.integer(0))),
            f.returnValue(f.ref(n)));
    assertThat(NonLengthParameterCollector.collect(function), containsInAnyOrder(a, b));
  }

  @Test
  public void testSwitchAndConditionalOperandsAreExcluded() {
    ParameterDeclaration kind = f.parameter("kind", INT);
    ParameterDeclaration flag = f.parameter("flag", INT);
    ParameterDeclaration n = f.parameter("n", INT);
    FunctionDeclaration function =
        f.definition(
            "pick",
            INT,
            ImmutableList.of(kind, flag, n),
            f.switchOn(f.ref(kind), f.block(f.returnValue(f.ref(n)))),
            f.returnValue(f.conditional(f.ref(flag), f.ref(n), f.integer(0))));
    assertThat(NonLengthParameterCollector.collect(function), containsInAnyOrder(kind, flag));
  }

  @Test
  public void testEnumParametersAreExcluded() {
    ParameterDeclaration mode = f.parameter("mode", CType.enumType("mode_t"));
    ParameterDeclaration n = f.parameter("n", INT);
    FunctionDeclaration prototype = f.prototype("run", INT, mode, n);
    assertThat(NonLengthParameterCollector.collect(prototype), containsInAnyOrder(mode));
  }

  @Test
  public void testPlainUsesAreKept() {
    ParameterDeclaration n = f.parameter("n", INT);
    FunctionDeclaration function =
        f.definition(
            "twice", INT, ImmutableList.of(n), f.returnValue(f.add(f.ref(n), f.ref(n))));
    assertThat(NonLengthParameterCollector.collect(function), empty());
  }
}
