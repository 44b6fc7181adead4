// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/**
 * Creates the nodes of one translation unit.
 *
 * <p>Every node gets a fresh source location in the factory's file unless a location was requested
 * with {@link #at}. Expressions are created with the implicit conversions a C front end would
 * insert: array-to-pointer and function-to-pointer decay, conversion of assigned values, call
 * arguments and initializers to the target type.
 */
public class AstFactory {

  private final String fileName;
  private int nextLine = 1;
  private SourceLocation pendingLocation;

  public AstFactory(String fileName) {
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }

  /** Use the given location for the next created node. */
  public AstFactory at(SourceLocation location) {
    pendingLocation = location;
    return this;
  }

  /** Mark the next created node as coming from a macro expansion. */
  public AstFactory inMacro() {
    pendingLocation = SourceLocation.createInMacroExpansion(fileName, nextLine++, 1);
    return this;
  }

  public SourceLocation nextLocation() {
    if (pendingLocation != null) {
      SourceLocation location = pendingLocation;
      pendingLocation = null;
      return location;
    }
    return SourceLocation.create(fileName, nextLine++, 1);
  }

  public TranslationUnit translationUnit(Declaration... declarations) {
    return new TranslationUnit(fileName, Arrays.asList(declarations));
  }

  // Declarations.

  public VariableDeclaration local(String name, CType type) {
    return local(name, type, null);
  }

  public VariableDeclaration local(String name, CType type, Expression initializer) {
    return new VariableDeclaration(
        name,
        type,
        nextLocation(),
        false,
        Linkage.NONE,
        false,
        false,
        convertInitializer(initializer, type));
  }

  public VariableDeclaration annotatedLocal(String name, CType type, Expression initializer) {
    return new VariableDeclaration(
        name,
        type,
        nextLocation(),
        true,
        Linkage.NONE,
        false,
        false,
        convertInitializer(initializer, type));
  }

  public VariableDeclaration global(String name, CType type) {
    return global(name, type, null);
  }

  public VariableDeclaration global(String name, CType type, Expression initializer) {
    return new VariableDeclaration(
        name,
        type,
        nextLocation(),
        false,
        Linkage.EXTERNAL,
        true,
        false,
        convertInitializer(initializer, type));
  }

  public VariableDeclaration staticGlobal(String name, CType type, Expression initializer) {
    return new VariableDeclaration(
        name,
        type,
        nextLocation(),
        false,
        Linkage.INTERNAL,
        true,
        false,
        convertInitializer(initializer, type));
  }

  public VariableDeclaration externGlobal(String name, CType type) {
    return new VariableDeclaration(
        name, type, nextLocation(), false, Linkage.EXTERNAL, true, true, null);
  }

  public ParameterDeclaration parameter(String name, CType type) {
    return new ParameterDeclaration(name, type, nextLocation(), false);
  }

  public ParameterDeclaration annotatedParameter(String name, CType type) {
    return new ParameterDeclaration(name, type, nextLocation(), true);
  }

  public FieldDeclaration field(String name, CType type) {
    return new FieldDeclaration(name, type, nextLocation(), false);
  }

  public FieldDeclaration annotatedField(String name, CType type) {
    return new FieldDeclaration(name, type, nextLocation(), true);
  }

  public RecordDeclaration struct(String name, FieldDeclaration... fields) {
    return new RecordDeclaration(
        name, CType.structType(name), nextLocation(), ImmutableList.copyOf(fields));
  }

  public FunctionDeclaration prototype(
      String name, CType returnType, ParameterDeclaration... parameters) {
    return function(name, returnType, Arrays.asList(parameters), false, Linkage.EXTERNAL, null);
  }

  public FunctionDeclaration variadicPrototype(
      String name, CType returnType, ParameterDeclaration... parameters) {
    return function(name, returnType, Arrays.asList(parameters), true, Linkage.EXTERNAL, null);
  }

  public FunctionDeclaration staticPrototype(
      String name, CType returnType, ParameterDeclaration... parameters) {
    return function(name, returnType, Arrays.asList(parameters), false, Linkage.INTERNAL, null);
  }

  /** A K&R style declaration {@code int f();} that does not specify its parameters. */
  public FunctionDeclaration prototypeWithoutParameters(String name, CType returnType) {
    return new FunctionDeclaration(
        name,
        CType.functionTypeWithoutPrototype(returnType),
        nextLocation(),
        Linkage.EXTERNAL,
        ImmutableList.of(),
        null);
  }

  public FunctionDeclaration definition(
      String name, CType returnType, List<ParameterDeclaration> parameters, Statement... body) {
    return function(name, returnType, parameters, false, Linkage.EXTERNAL, block(body));
  }

  public FunctionDeclaration staticDefinition(
      String name, CType returnType, List<ParameterDeclaration> parameters, Statement... body) {
    return function(name, returnType, parameters, false, Linkage.INTERNAL, block(body));
  }

  private FunctionDeclaration function(
      String name,
      CType returnType,
      List<ParameterDeclaration> parameters,
      boolean variadic,
      Linkage linkage,
      CompoundStatement body) {
    ImmutableList.Builder<CType> parameterTypes = ImmutableList.builder();
    parameters.forEach(parameter -> parameterTypes.add(parameter.getType()));
    FunctionDeclaration function =
        new FunctionDeclaration(
            name,
            CType.functionType(returnType, parameterTypes.build(), variadic),
            nextLocation(),
            linkage,
            ImmutableList.copyOf(parameters),
            body);
    if (body != null) {
      setEnclosingFunction(body, function);
    }
    return function;
  }

  private static void setEnclosingFunction(Statement statement, FunctionDeclaration function) {
    if (statement.isDeclaration()) {
      statement
          .asDeclaration()
          .getDeclarations()
          .forEach(declaration -> declaration.setEnclosingFunction(function));
    }
    statement.forEachChildStatement(child -> setEnclosingFunction(child, function));
  }

  // Statements.

  public CompoundStatement block(Statement... statements) {
    return new CompoundStatement(ImmutableList.copyOf(statements), nextLocation());
  }

  public DeclarationStatement declare(VariableDeclaration... declarations) {
    return new DeclarationStatement(ImmutableList.copyOf(declarations), nextLocation());
  }

  public ExpressionStatement statement(Expression expression) {
    return new ExpressionStatement(expression, nextLocation());
  }

  public ReturnStatement returnValue(Expression value) {
    return new ReturnStatement(value, nextLocation());
  }

  public ReturnStatement returnVoid() {
    return new ReturnStatement(null, nextLocation());
  }

  public IfStatement ifThen(Expression condition, Statement thenStatement) {
    return new IfStatement(condition, thenStatement, null, nextLocation());
  }

  public IfStatement ifThenElse(
      Expression condition, Statement thenStatement, Statement elseStatement) {
    return new IfStatement(condition, thenStatement, elseStatement, nextLocation());
  }

  public SwitchStatement switchOn(Expression condition, Statement body) {
    return new SwitchStatement(condition, body, nextLocation());
  }

  public WhileStatement whileLoop(Expression condition, Statement body) {
    return new WhileStatement(condition, body, nextLocation());
  }

  // Expressions.

  public DeclRefExpression ref(Declaration declaration) {
    return new DeclRefExpression(declaration, nextLocation());
  }

  public MemberExpression member(Expression base, FieldDeclaration field) {
    return new MemberExpression(base, field, false, nextLocation());
  }

  public MemberExpression arrow(Expression base, FieldDeclaration field) {
    return new MemberExpression(decay(base), field, true, nextLocation());
  }

  public BinaryExpression assign(Expression target, Expression value) {
    return binary(BinaryOperator.ASSIGN, target, value);
  }

  public BinaryExpression add(Expression left, Expression right) {
    return binary(BinaryOperator.ADD, left, right);
  }

  public BinaryExpression sub(Expression left, Expression right) {
    return binary(BinaryOperator.SUB, left, right);
  }

  public BinaryExpression mul(Expression left, Expression right) {
    return binary(BinaryOperator.MUL, left, right);
  }

  public BinaryExpression eq(Expression left, Expression right) {
    return binary(BinaryOperator.EQ, left, right);
  }

  public BinaryExpression ne(Expression left, Expression right) {
    return binary(BinaryOperator.NE, left, right);
  }

  public BinaryExpression binary(BinaryOperator operator, Expression left, Expression right) {
    if (operator.isAssignment()) {
      Expression value = operator == BinaryOperator.ASSIGN ? convert(right, left.getType()) : right;
      return new BinaryExpression(left.getType(), operator, left, value, nextLocation());
    }
    Expression decayedLeft = decay(left);
    Expression decayedRight = decay(right);
    CType leftType = decayedLeft.getType();
    CType rightType = decayedRight.getType();
    CType type;
    if (operator == BinaryOperator.COMMA) {
      type = rightType;
    } else if (operator.isComparison() || operator.isLogical()) {
      type = CType.intType();
    } else if (operator.isAdditive() && leftType.isPointer()) {
      type = rightType.isPointer() ? CType.longType() : leftType;
    } else if (operator.isAdditive() && rightType.isPointer()) {
      type = rightType;
    } else {
      type = leftType;
    }
    return new BinaryExpression(type, operator, decayedLeft, decayedRight, nextLocation());
  }

  public UnaryExpression addressOf(Expression operand) {
    return new UnaryExpression(
        CType.pointerTo(operand.getType()), UnaryOperator.ADDRESS_OF, operand, nextLocation());
  }

  public UnaryExpression deref(Expression operand) {
    Expression decayed = decay(operand);
    return new UnaryExpression(
        decayed.getType().getReferencedType(), UnaryOperator.DEREFERENCE, decayed, nextLocation());
  }

  public UnaryExpression preIncrement(Expression operand) {
    return unary(UnaryOperator.PRE_INCREMENT, operand);
  }

  public UnaryExpression postIncrement(Expression operand) {
    return unary(UnaryOperator.POST_INCREMENT, operand);
  }

  public UnaryExpression postDecrement(Expression operand) {
    return unary(UnaryOperator.POST_DECREMENT, operand);
  }

  public UnaryExpression unary(UnaryOperator operator, Expression operand) {
    switch (operator) {
      case ADDRESS_OF:
        return addressOf(operand);
      case DEREFERENCE:
        return deref(operand);
      case LOGICAL_NOT:
        return new UnaryExpression(CType.intType(), operator, decay(operand), nextLocation());
      default:
        return new UnaryExpression(operand.getType(), operator, operand, nextLocation());
    }
  }

  public ArraySubscriptExpression subscript(Expression base, Expression index) {
    Expression decayed = decay(base);
    return new ArraySubscriptExpression(
        decayed.getType().getReferencedType(), decayed, index, nextLocation());
  }

  public CallExpression call(FunctionDeclaration function, Expression... arguments) {
    Expression callee =
        implicitCast(CType.pointerTo(function.getType()), ref(function));
    return new CallExpression(
        function.getReturnType(),
        callee,
        convertArguments(function.getType(), arguments),
        nextLocation());
  }

  public CallExpression callThrough(Expression callee, Expression... arguments) {
    Expression decayed = decay(callee);
    CType calleeType = decayed.getType();
    if (!calleeType.isFunctionPointer()) {
      throw new IllegalArgumentException("Callee is not a function pointer: " + calleeType);
    }
    FunctionType functionType = calleeType.asPointer().getPointeeType().asFunction();
    return new CallExpression(
        functionType.getReturnType(),
        decayed,
        convertArguments(functionType, arguments),
        nextLocation());
  }

  private ImmutableList<Expression> convertArguments(
      FunctionType functionType, Expression[] arguments) {
    ImmutableList.Builder<Expression> converted = ImmutableList.builder();
    List<CType> parameterTypes = functionType.getParameterTypes();
    for (int i = 0; i < arguments.length; i++) {
      if (functionType.hasPrototype() && i < parameterTypes.size()) {
        converted.add(convert(arguments[i], parameterTypes.get(i)));
      } else {
        converted.add(decay(arguments[i]));
      }
    }
    return converted.build();
  }

  public ConditionalExpression conditional(
      Expression condition, Expression trueExpression, Expression falseExpression) {
    Expression decayedTrue = decay(trueExpression);
    Expression decayedFalse = decay(falseExpression);
    CType type =
        decayedTrue.isNullPointerConstant() ? decayedFalse.getType() : decayedTrue.getType();
    return new ConditionalExpression(
        type,
        decay(condition),
        convert(decayedTrue, type),
        convert(decayedFalse, type),
        nextLocation());
  }

  public InitListExpression initList(CType type, Expression... initializers) {
    return new InitListExpression(type, ImmutableList.copyOf(initializers), nextLocation());
  }

  public CompoundLiteralExpression compoundLiteral(CType type, InitListExpression initializer) {
    return new CompoundLiteralExpression(type, initializer, nextLocation());
  }

  public StringLiteral string(String value) {
    return new StringLiteral(value, nextLocation());
  }

  public IntegerLiteral integer(long value) {
    return new IntegerLiteral(value, nextLocation());
  }

  public NullPointerLiteral nullPointer() {
    return new NullPointerLiteral(nextLocation());
  }

  public SizeOfExpression sizeOf(CType type) {
    return new SizeOfExpression(type, nextLocation());
  }

  public CastExpression cast(CType type, Expression operand) {
    return new CastExpression(type, decay(operand), false, nextLocation());
  }

  public CastExpression implicitCast(CType type, Expression operand) {
    return new CastExpression(type, operand, true, nextLocation());
  }

  public UnsupportedExpression unsupported(
      CType type, String description, Expression... children) {
    return new UnsupportedExpression(
        type, description, ImmutableList.copyOf(children), nextLocation());
  }

  /** Applies array and function decay followed by an implicit conversion to the target type. */
  public Expression convert(Expression expression, CType target) {
    Expression decayed = decay(expression);
    if (target == null || decayed.getType().equals(target)) {
      return decayed;
    }
    return implicitCast(target, decayed);
  }

  private Expression convertInitializer(Expression initializer, CType type) {
    if (initializer == null || type.isArray() || type.isRecord()) {
      return initializer;
    }
    return convert(initializer, type);
  }

  private Expression decay(Expression expression) {
    CType type = expression.getType();
    if (type.isArray()) {
      return implicitCast(type.asArray().decay(), expression);
    }
    if (type.isFunction()) {
      return implicitCast(CType.pointerTo(type), expression);
    }
    return expression;
  }
}
