// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.resolver;

import com.android.tools.cconv.ast.BinaryExpression;
import com.android.tools.cconv.ast.CallExpression;
import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.ast.Expression;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.RecordDeclaration;
import com.android.tools.cconv.ast.Statement;
import com.android.tools.cconv.ast.VariableDeclaration;
import com.android.tools.cconv.constraints.ConstAtom;
import com.android.tools.cconv.constraints.FlowPolicy;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.ConstraintVariables;
import com.android.tools.cconv.constraints.variables.FunctionVariable;
import com.android.tools.cconv.errors.Unreachable;
import com.android.tools.cconv.program.TranslationUnitInfo;
import com.android.tools.cconv.utils.AnalysisOptions;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates the constraints of one translation unit.
 *
 * <p>All declarations are registered before any body is visited, so that uses can refer to
 * declarations that appear later in the unit.
 */
public class ConstraintBuilder {

  static final String POINTER_ARITHMETIC = "Pointer arithmetic";
  static final String ARRAY_SUBSCRIPT = "Array subscript";
  static final String VARIADIC_ARGUMENT = "Passing argument to a variadic function";
  static final String NOT_A_FUNCTION = "Argument to a call through a value that is not a function";

  private final TranslationUnitInfo info;
  private final AnalysisOptions options;
  private final ExpressionConstraintResolver resolver;

  public ConstraintBuilder(TranslationUnitInfo info) {
    this.info = info;
    this.options = info.getOptions();
    this.resolver = info.getResolver();
  }

  public void build() {
    List<FunctionDeclaration> definitions = new ArrayList<>();
    List<VariableDeclaration> globals = new ArrayList<>();
    for (Declaration declaration : info.getUnit().getDeclarations()) {
      if (declaration.isRecord()) {
        RecordDeclaration record = declaration.asRecord();
        record.getFields().forEach(info::addVariable);
      } else if (declaration.isVariable()) {
        info.addVariable(declaration);
        globals.add(declaration.asVariable());
      } else if (declaration.isFunction()) {
        FunctionDeclaration function = declaration.asFunction();
        info.addFunction(function);
        if (function.hasBody()) {
          registerLocals(function.getBody());
          definitions.add(function);
        }
      }
    }
    for (VariableDeclaration global : globals) {
      if (global.hasInitializer()) {
        visitExpression(global.getInitializer());
        resolver.constrainLocalAssign(
            global, global.getInitializer(), FlowPolicy.SAME, global.getLocation());
      }
    }
    for (FunctionDeclaration definition : definitions) {
      options.verbose("Generating constraints for " + definition.getName());
      FunctionVariable function = info.getFunctionVariable(definition);
      visitStatement(definition.getBody(), function);
    }
  }

  private void registerLocals(Statement statement) {
    if (statement.isDeclaration()) {
      statement.asDeclaration().getDeclarations().forEach(info::addVariable);
    }
    statement.forEachChildStatement(this::registerLocals);
  }

  private void visitStatement(Statement statement, FunctionVariable function) {
    switch (statement.getKind()) {
      case COMPOUND:
        break;
      case DECLARATION:
        for (VariableDeclaration local : statement.asDeclaration().getDeclarations()) {
          if (local.hasInitializer()) {
            visitExpression(local.getInitializer());
            resolver.constrainLocalAssign(
                local, local.getInitializer(), FlowPolicy.SAME, local.getLocation());
          }
        }
        break;
      case EXPRESSION:
        visitExpression(statement.asExpression().getExpression());
        break;
      case RETURN:
        if (statement.asReturn().hasValue()) {
          Expression value = statement.asReturn().getValue();
          visitExpression(value);
          resolver.constrainLocalAssign(
              ImmutableSet.of(function.getReturnVariable()),
              value,
              FlowPolicy.SAME,
              statement.getLocation());
        }
        break;
      case IF:
        visitExpression(statement.asIf().getCondition());
        break;
      case SWITCH:
        visitExpression(statement.asSwitch().getCondition());
        break;
      case WHILE:
        visitExpression(statement.asWhile().getCondition());
        break;
      default:
        throw new Unreachable(
            "Unexpected statement kind: " + statement.getKind());
    }
    statement.forEachChildStatement(child -> visitStatement(child, function));
  }

  private void visitExpression(Expression expression) {
    expression.forEachChild(this::visitExpression);
    switch (expression.getKind()) {
      case BINARY:
        visitBinary(expression.asBinary());
        break;
      case UNARY:
        if (expression.asUnary().getOperator().isIncrementOrDecrement()
            && expression.asUnary().getOperand().getType().isPointer()) {
          constrainArray(expression.asUnary().getOperand(), POINTER_ARITHMETIC, expression);
        }
        break;
      case ARRAY_SUBSCRIPT:
        constrainArray(expression.asArraySubscript().getBase(), ARRAY_SUBSCRIPT, expression);
        break;
      case CALL:
        visitCall(expression.asCall());
        break;
      default:
        break;
    }
    resolver.getExprConstraintVars(expression);
  }

  private void visitBinary(BinaryExpression binary) {
    switch (binary.getOperator()) {
      case ASSIGN:
        resolver.constrainLocalAssign(
            binary.getLeft(), binary.getRight(), FlowPolicy.SAME, binary.getLocation());
        break;
      case ADD:
      case SUB:
        if (binary.getLeft().getType().isPointer()) {
          constrainArray(binary.getLeft(), POINTER_ARITHMETIC, binary);
        }
        if (binary.getRight().getType().isPointer()) {
          constrainArray(binary.getRight(), POINTER_ARITHMETIC, binary);
        }
        break;
      default:
        if (binary.getOperator().isPointerArithmeticAssignment()
            && binary.getLeft().getType().isPointer()) {
          constrainArray(binary.getLeft(), POINTER_ARITHMETIC, binary);
        }
        break;
    }
  }

  private void constrainArray(Expression pointer, String reason, Expression use) {
    ConstraintVariables.constrainOuterTo(
        info.getGraph(),
        resolver.getExprConstraintVars(pointer),
        ConstAtom.ARRAY,
        reason,
        use.getLocation());
  }

  private void visitCall(CallExpression call) {
    FunctionDeclaration callee = call.getDirectCallee();
    if (callee != null && options.isExternOkay(callee.getName())) {
      return;
    }
    List<FunctionVariable> functions = new ArrayList<>();
    if (callee != null) {
      functions.add(info.getFunctionVariable(callee));
    } else {
      for (ConstraintVariable variable : resolver.getExprConstraintVars(call.getCallee())) {
        FunctionVariable function = ExpressionConstraintResolver.getFunctionVariable(variable);
        if (function != null) {
          functions.add(function);
        }
      }
    }
    if (functions.isEmpty()) {
      for (Expression argument : call.getArguments()) {
        ConstraintVariables.constrainAllToWild(
            info.getGraph(),
            resolver.getExprConstraintVars(argument),
            NOT_A_FUNCTION,
            call.getLocation());
      }
      return;
    }
    for (FunctionVariable function : functions) {
      String reason = "Argument to function '" + function.getName() + "'";
      for (int i = 0; i < call.getNumberOfArguments(); i++) {
        Expression argument = call.getArgument(i);
        if (i < function.getNumberOfParameters()) {
          resolver.constrainLocalAssign(
              function.getParameterVariables(i),
              argument,
              FlowPolicy.SAME,
              reason,
              call.getLocation());
        } else if (function.isVariadic() && options.handleVarargs) {
          ConstraintVariables.constrainAllToWild(
              info.getGraph(),
              resolver.getExprConstraintVars(argument),
              VARIADIC_ARGUMENT,
              call.getLocation());
        }
      }
    }
  }
}
