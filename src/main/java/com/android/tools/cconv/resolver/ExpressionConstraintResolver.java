// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.resolver;

import com.android.tools.cconv.ast.BinaryExpression;
import com.android.tools.cconv.ast.BinaryOperator;
import com.android.tools.cconv.ast.CType;
import com.android.tools.cconv.ast.CallExpression;
import com.android.tools.cconv.ast.CastExpression;
import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.ast.Expression;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.ast.UnaryExpression;
import com.android.tools.cconv.ast.UnaryOperator;
import com.android.tools.cconv.bounds.ArrayBoundsInformation;
import com.android.tools.cconv.constraints.ConstAtom;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.FlowPolicy;
import com.android.tools.cconv.constraints.SafetyClass;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.ConstraintVariableFactory;
import com.android.tools.cconv.constraints.variables.ConstraintVariables;
import com.android.tools.cconv.constraints.variables.FunctionVariable;
import com.android.tools.cconv.constraints.variables.PointerVariable;
import com.android.tools.cconv.errors.Unreachable;
import com.android.tools.cconv.errors.UnsupportedExpressionDiagnostic;
import com.android.tools.cconv.program.TranslationUnitInfo;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Computes the constraint variables of the value of an expression, adding the edges that the
 * expression itself implies.
 *
 * <p>Results are memoised per expression node, so resolving the same node twice adds no new
 * atoms or edges. References to declarations are not memoised since they are plain lookups.
 */
public class ExpressionConstraintResolver {

  private static final String UNCLASSIFIED_ALLOCATION = "Unclassified allocator call";
  private static final String NO_FUNCTION_VARIABLE = "Call through a value that is not a function";

  private final TranslationUnitInfo info;
  private final Map<Expression, ImmutableSet<ConstraintVariable>> cache = new IdentityHashMap<>();

  public ExpressionConstraintResolver(TranslationUnitInfo info) {
    this.info = info;
  }

  private ConstraintGraph graph() {
    return info.getGraph();
  }

  private ConstraintVariableFactory factory() {
    return info.getVariableFactory();
  }

  public ImmutableSet<ConstraintVariable> getExprConstraintVars(Expression expression) {
    switch (expression.getKind()) {
      case DECL_REF:
        return resolveDeclaration(expression.asDeclRef().getDeclaration());
      case MEMBER:
        return info.getVariables(expression.asMember().getField());
      default:
        break;
    }
    ImmutableSet<ConstraintVariable> result = cache.get(expression);
    if (result == null) {
      result = compute(expression);
      cache.put(expression, result);
    }
    return result;
  }

  private ImmutableSet<ConstraintVariable> resolveDeclaration(Declaration declaration) {
    if (declaration.isFunction()) {
      return ImmutableSet.of(info.getFunctionVariable(declaration.asFunction()));
    }
    return info.getVariables(declaration);
  }

  private ImmutableSet<ConstraintVariable> compute(Expression expression) {
    switch (expression.getKind()) {
      case IMPLICIT_CAST:
        return resolveImplicitCast(expression.asCast());
      case EXPLICIT_CAST:
        return resolveExplicitCast(expression.asCast());
      case BINARY:
        return resolveBinary(expression.asBinary());
      case UNARY:
        return resolveUnary(expression.asUnary());
      case ARRAY_SUBSCRIPT:
        return dereference(getExprConstraintVars(expression.asArraySubscript().getBase()));
      case CALL:
        return resolveCall(expression.asCall());
      case CONDITIONAL:
        return ImmutableSet.<ConstraintVariable>builder()
            .addAll(getExprConstraintVars(expression.asConditional().getTrueExpression()))
            .addAll(getExprConstraintVars(expression.asConditional().getFalseExpression()))
            .build();
      case INIT_LIST:
        return resolveInitList(expression);
      case COMPOUND_LITERAL:
        {
          PointerVariable literal =
              factory()
                  .createPointerVariable(
                      "compound literal", expression.getType(), expression.getLocation());
          ConstraintVariables.constrainGeq(
              graph(),
              ImmutableSet.of(literal),
              getExprConstraintVars(expression.asCompoundLiteral().getInitializer()),
              FlowPolicy.SAME,
              null,
              expression.getLocation());
          return ImmutableSet.of(literal);
        }
      case STRING_LITERAL:
        {
          PointerVariable literal =
              factory()
                  .createPointerVariable(
                      "string literal",
                      CType.pointerTo(CType.charType()),
                      expression.getLocation());
          literal.constrainOuterTo(
              graph(), ConstAtom.NT_ARRAY, "String literal", expression.getLocation());
          return ImmutableSet.of(literal);
        }
      case INTEGER_LITERAL:
      case SIZEOF:
        return scalar(expression);
      case NULL_POINTER:
        return ImmutableSet.of();
      case UNSUPPORTED:
        info.getOptions()
            .getReporter()
            .info(
                new UnsupportedExpressionDiagnostic(
                    expression.asUnsupported().getDescription(), expression.getLocation()));
        return ImmutableSet.of();
      default:
        throw new Unreachable("Unexpected expression kind: " + expression.getKind());
    }
  }

  private ImmutableSet<ConstraintVariable> resolveImplicitCast(CastExpression cast) {
    if (cast.isNullPointerConstant()) {
      return ImmutableSet.of();
    }
    Expression operand = cast.getOperand();
    ImmutableSet<ConstraintVariable> operandVariables = getExprConstraintVars(operand);
    CType source = operand.getType();
    CType target = cast.getType();
    if (target.isPointer()
        && !source.isFunction()
        && !source.isArray()
        && !source.isVoidPointer()
        && !CastSafety.isSafe(source, target)) {
      String reason = castReason(source, target);
      ConstraintVariables.constrainAllToWild(
          graph(), operandVariables, reason, cast.getLocation());
      return ImmutableSet.of(
          factory().createWildPointerVariable("cast", target, cast.getLocation(), reason));
    }
    return operandVariables;
  }

  private ImmutableSet<ConstraintVariable> resolveExplicitCast(CastExpression cast) {
    if (cast.isNullPointerConstant()) {
      return ImmutableSet.of();
    }
    CType source = cast.getOperand().getType();
    CType target = cast.getType();
    if (!CastSafety.isSafe(source, target)) {
      return ImmutableSet.of(
          factory()
              .createWildPointerVariable(
                  "cast", target, cast.getLocation(), castReason(source, target)));
    }
    PointerVariable result = factory().createPointerVariable("cast", target, cast.getLocation());
    ConstraintVariables.constrainGeq(
        graph(),
        ImmutableSet.of(result),
        getExprConstraintVars(cast.getOperand()),
        FlowPolicy.SAME,
        null,
        cast.getLocation());
    return ImmutableSet.of(result);
  }

  private static String castReason(CType source, CType target) {
    return "Cast from " + source.toSourceString() + " to " + target.toSourceString();
  }

  private ImmutableSet<ConstraintVariable> resolveBinary(BinaryExpression binary) {
    if (binary.getOperator().isAssignment()) {
      return getExprConstraintVars(binary.getLeft());
    }
    switch (binary.getOperator()) {
      case COMMA:
        return getExprConstraintVars(binary.getRight());
      case ADD:
      case SUB:
        if (binary.getLeft().getType().isPointerOrArray()) {
          return getExprConstraintVars(binary.getLeft());
        }
        if (binary.getRight().getType().isPointerOrArray()) {
          return getExprConstraintVars(binary.getRight());
        }
        return scalar(binary);
      default:
        return scalar(binary);
    }
  }

  private ImmutableSet<ConstraintVariable> resolveUnary(UnaryExpression unary) {
    Expression operand = unary.getOperand();
    switch (unary.getOperator()) {
      case ADDRESS_OF:
        return resolveAddressOf(operand);
      case DEREFERENCE:
        return dereference(getExprConstraintVars(operand));
      case PRE_INCREMENT:
      case PRE_DECREMENT:
      case POST_INCREMENT:
      case POST_DECREMENT:
        return getExprConstraintVars(operand);
      default:
        return scalar(unary);
    }
  }

  private ImmutableSet<ConstraintVariable> resolveAddressOf(Expression operand) {
    if (operand.isUnary() && operand.asUnary().getOperator() == UnaryOperator.DEREFERENCE) {
      // &*e is e.
      return getExprConstraintVars(operand.asUnary().getOperand());
    }
    if (operand.isArraySubscript()) {
      // &e[i] is e + i.
      return getExprConstraintVars(operand.asArraySubscript().getBase());
    }
    return addIndirection(getExprConstraintVars(operand), ConstAtom.PTR);
  }

  private ImmutableSet<ConstraintVariable> addIndirection(
      Set<ConstraintVariable> variables, ConstAtom bound) {
    ImmutableSet.Builder<ConstraintVariable> builder = ImmutableSet.builder();
    for (ConstraintVariable variable : variables) {
      if (variable.isFunctionVariable()) {
        builder.add(variable);
      } else {
        builder.add(variable.asPointerVariable().addIndirection(graph(), bound));
      }
    }
    return builder.build();
  }

  private static ImmutableSet<ConstraintVariable> dereference(Set<ConstraintVariable> variables) {
    ImmutableSet.Builder<ConstraintVariable> builder = ImmutableSet.builder();
    for (ConstraintVariable variable : variables) {
      // *f and **fp denote the function itself.
      if (isFunctionDesignator(variable)) {
        builder.add(variable);
      } else {
        builder.add(variable.asPointerVariable().dereference());
      }
    }
    return builder.build();
  }

  private static boolean isFunctionDesignator(ConstraintVariable variable) {
    if (variable.isFunctionVariable()) {
      return true;
    }
    PointerVariable pointer = variable.asPointerVariable();
    return pointer.getNumberOfAtoms() == 0 && pointer.getFunctionVariable() != null;
  }

  private ImmutableSet<ConstraintVariable> resolveInitList(Expression expression) {
    ImmutableSet.Builder<ConstraintVariable> builder = ImmutableSet.builder();
    for (Expression initializer : expression.asInitList().getInitializers()) {
      builder.addAll(getExprConstraintVars(initializer));
    }
    ImmutableSet<ConstraintVariable> elements = builder.build();
    if (expression.getType().isArray()) {
      return addIndirection(elements, ConstAtom.ARRAY);
    }
    return elements;
  }

  private ImmutableSet<ConstraintVariable> resolveCall(CallExpression call) {
    AllocatorFunction allocator = AllocatorFunction.forCall(call);
    if (allocator != null) {
      return resolveAllocatorCall(call, allocator);
    }
    ImmutableSet.Builder<PointerVariable> returns = ImmutableSet.builder();
    FunctionDeclaration callee = call.getDirectCallee();
    if (callee != null) {
      returns.add(info.getFunctionVariable(callee).getReturnVariable());
    } else {
      for (ConstraintVariable variable : getExprConstraintVars(call.getCallee())) {
        FunctionVariable function = getFunctionVariable(variable);
        if (function != null) {
          returns.add(function.getReturnVariable());
        }
      }
    }
    ImmutableSet<PointerVariable> returnVariables = returns.build();
    if (returnVariables.isEmpty()) {
      return ImmutableSet.of(
          factory()
              .createWildPointerVariable(
                  "call", call.getType(), call.getLocation(), NO_FUNCTION_VARIABLE));
    }
    ImmutableSet.Builder<ConstraintVariable> results = ImmutableSet.builder();
    for (PointerVariable returnVariable : returnVariables) {
      results.add(copyCallResult(call, returnVariable));
    }
    return results.build();
  }

  /** The function variable behind a callee value, or null if it does not denote a function. */
  public static FunctionVariable getFunctionVariable(ConstraintVariable variable) {
    if (variable.isFunctionVariable()) {
      return variable.asFunctionVariable();
    }
    return variable.asPointerVariable().getFunctionVariable();
  }

  private ConstraintVariable copyCallResult(CallExpression call, PointerVariable returnVariable) {
    if (returnVariable.isNonPointer()) {
      return returnVariable;
    }
    // Each call site gets its own copy, so that using one result unsafely does not affect the
    // function or the other call sites.
    PointerVariable copy = returnVariable.copy(graph(), FlowPolicy.SAFE_TO_WILD);
    if (returnVariable.hasBoundsKey()) {
      ArrayBoundsInformation boundsInformation = info.getBoundsInformation();
      copy =
          copy.withBoundsKey(
              boundsInformation.getContextSensitiveKey(call, returnVariable.getBoundsKey()));
    }
    return copy;
  }

  private ImmutableSet<ConstraintVariable> resolveAllocatorCall(
      CallExpression call, AllocatorFunction allocator) {
    SourceLocation location = call.getLocation();
    ImmutableList<Expression> sizes = allocator.getSizeArguments(call);
    CType elementType = null;
    SafetyClass safetyClass = null;
    if (allocator == AllocatorFunction.CALLOC) {
      if (sizes.size() == 2 && sizes.get(1).isSizeOf()) {
        elementType = sizes.get(1).asSizeOf().getArgumentType();
        Expression count = sizes.get(0);
        safetyClass =
            count.isIntegerLiteral() && count.asIntegerLiteral().getValue() == 1
                ? SafetyClass.PTR
                : SafetyClass.ARRAY;
      }
    } else if (sizes.size() == 1) {
      Expression size = sizes.get(0);
      if (size.isSizeOf()) {
        elementType = size.asSizeOf().getArgumentType();
        safetyClass = SafetyClass.PTR;
      } else {
        Expression factor = getSizeOfFactor(size);
        if (factor != null) {
          elementType = factor.asSizeOf().getArgumentType();
          safetyClass = SafetyClass.ARRAY;
        }
      }
    }
    PointerVariable result;
    if (elementType == null) {
      result =
          factory()
              .createWildPointerVariable(
                  allocator.getName(), call.getType(), location, UNCLASSIFIED_ALLOCATION);
    } else {
      result =
          factory()
              .createPointerVariable(
                  allocator.getName(), CType.pointerTo(elementType), location);
      result.constrainOuterTo(
          graph(), ConstAtom.get(safetyClass), "Allocation of multiple elements", location);
    }
    if (allocator == AllocatorFunction.REALLOC && call.getNumberOfArguments() > 0) {
      ConstraintVariables.constrainGeq(
          graph(),
          ImmutableSet.of(result),
          getExprConstraintVars(call.getArgument(0)),
          FlowPolicy.WILD_TO_SAFE,
          null,
          location);
    }
    return ImmutableSet.of(result);
  }

  /** Returns the sizeof operand of {@code e * sizeof(T)} or {@code sizeof(T) * e}, or null. */
  static Expression getSizeOfFactor(Expression size) {
    if (!size.isBinary() || size.asBinary().getOperator() != BinaryOperator.MUL) {
      return null;
    }
    Expression left = size.asBinary().getLeft().stripCasts();
    Expression right = size.asBinary().getRight().stripCasts();
    if (right.isSizeOf()) {
      return right;
    }
    return left.isSizeOf() ? left : null;
  }

  private static ImmutableSet<ConstraintVariable> scalar(Expression expression) {
    return ImmutableSet.of(PointerVariable.nonPointer(expression.toString(), expression.getType()));
  }

  /** Links the value of {@code source} into {@code target}. */
  public void constrainLocalAssign(
      Expression target, Expression source, FlowPolicy policy, SourceLocation location) {
    constrainLocalAssign(getExprConstraintVars(target), source, policy, location);
  }

  /** Links the value of {@code source} into the variable declared by {@code target}. */
  public void constrainLocalAssign(
      Declaration target, Expression source, FlowPolicy policy, SourceLocation location) {
    constrainLocalAssign(info.getVariables(target), source, policy, location);
  }

  public void constrainLocalAssign(
      Set<ConstraintVariable> targets,
      Expression source,
      FlowPolicy policy,
      SourceLocation location) {
    constrainLocalAssign(targets, source, policy, null, location);
  }

  public void constrainLocalAssign(
      Set<ConstraintVariable> targets,
      Expression source,
      FlowPolicy policy,
      String reason,
      SourceLocation location) {
    ImmutableSet<ConstraintVariable> sources = getExprConstraintVars(source);
    ConstraintVariables.constrainGeq(graph(), targets, sources, policy, reason, location);
    info.getBoundsInformation().recordAssignment(targets, sources, source);
  }
}
