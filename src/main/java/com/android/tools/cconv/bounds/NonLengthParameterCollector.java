// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.ast.Expression;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.ParameterDeclaration;
import com.android.tools.cconv.ast.Statement;
import com.android.tools.cconv.ast.VariableDeclaration;
import com.google.common.collect.Sets;
import java.util.Set;

/**
 * Finds the integer parameters of a function that are used in a way that suggests they are not
 * the length of an array: enums, values compared for equality in an if condition, switch
 * discriminants and ternary conditions.
 */
public class NonLengthParameterCollector {

  private final FunctionDeclaration function;
  private final Set<ParameterDeclaration> excluded = Sets.newIdentityHashSet();

  private NonLengthParameterCollector(FunctionDeclaration function) {
    this.function = function;
  }

  public static Set<ParameterDeclaration> collect(FunctionDeclaration function) {
    NonLengthParameterCollector collector = new NonLengthParameterCollector(function);
    for (ParameterDeclaration parameter : function.getParameters()) {
      if (parameter.getType().isEnum()) {
        collector.excluded.add(parameter);
      }
    }
    if (function.hasBody()) {
      collector.visitStatement(function.getBody());
    }
    return collector.excluded;
  }

  private void visitStatement(Statement statement) {
    switch (statement.getKind()) {
      case DECLARATION:
        for (VariableDeclaration local : statement.asDeclaration().getDeclarations()) {
          if (local.hasInitializer()) {
            visitExpression(local.getInitializer());
          }
        }
        break;
      case EXPRESSION:
        visitExpression(statement.asExpression().getExpression());
        break;
      case RETURN:
        if (statement.asReturn().hasValue()) {
          visitExpression(statement.asReturn().getValue());
        }
        break;
      case IF:
        excludeEqualityOperands(statement.asIf().getCondition());
        visitExpression(statement.asIf().getCondition());
        break;
      case SWITCH:
        exclude(statement.asSwitch().getCondition());
        visitExpression(statement.asSwitch().getCondition());
        break;
      case WHILE:
        visitExpression(statement.asWhile().getCondition());
        break;
      default:
        break;
    }
    statement.forEachChildStatement(this::visitStatement);
  }

  private void visitExpression(Expression expression) {
    if (expression.isConditional()) {
      exclude(expression.asConditional().getCondition());
    }
    expression.forEachChild(this::visitExpression);
  }

  private void excludeEqualityOperands(Expression condition) {
    if (condition.isBinary()) {
      if (condition.asBinary().getOperator().isEquality()) {
        exclude(condition.asBinary().getLeft());
        exclude(condition.asBinary().getRight());
        return;
      }
      if (condition.asBinary().getOperator().isLogical()) {
        excludeEqualityOperands(condition.asBinary().getLeft());
        excludeEqualityOperands(condition.asBinary().getRight());
      }
    }
  }

  private void exclude(Expression expression) {
    Expression stripped = expression.stripCasts();
    if (!stripped.isDeclRef()) {
      return;
    }
    Declaration declaration = stripped.asDeclRef().getDeclaration();
    if (declaration.isParameter() && declaration.asParameter().getFunction() == function) {
      excluded.add(declaration.asParameter());
    }
  }
}
