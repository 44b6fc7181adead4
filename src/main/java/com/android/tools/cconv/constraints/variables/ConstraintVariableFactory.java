// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.constraints.variables;

import com.android.tools.cconv.ast.CType;
import com.android.tools.cconv.ast.CheckedPointerKind;
import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.FunctionType;
import com.android.tools.cconv.ast.ParameterDeclaration;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.bounds.ArrayBoundsInformation;
import com.android.tools.cconv.bounds.BoundsKey;
import com.android.tools.cconv.constraints.Atom;
import com.android.tools.cconv.constraints.ConstAtom;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.VarAtom;
import com.android.tools.cconv.errors.Unreachable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** Creates constraint variables for declarations and types, allocating atoms in one graph. */
public class ConstraintVariableFactory {

  public static final String VOID_POINTER_REASON = "Default void* type";
  public static final String MACRO_REASON = "Pointer in macro declaration";
  public static final String DECLARED_ARRAY_REASON = "Declared array";

  private final ConstraintGraph graph;
  private final ArrayBoundsInformation boundsInformation;

  public ConstraintVariableFactory(
      ConstraintGraph graph, ArrayBoundsInformation boundsInformation) {
    this.graph = graph;
    this.boundsInformation = boundsInformation;
  }

  public ConstraintGraph getGraph() {
    return graph;
  }

  public PointerVariable createPointerVariable(Declaration declaration) {
    assert !declaration.isFunction();
    return createPointerVariable(
        declaration.getName(),
        declaration.getType(),
        declaration.getLocation(),
        declaration.hasBoundsAnnotation(),
        boundsInformation.getVariable(declaration),
        null);
  }

  /** Creates a variable for an intermediate value of the given type. */
  public PointerVariable createPointerVariable(
      String name, CType type, SourceLocation location) {
    return createPointerVariable(name, type, location, false, null, null);
  }

  /** Creates a variable whose unknowns are all forced wild. */
  public PointerVariable createWildPointerVariable(
      String name, CType type, SourceLocation location, String reason) {
    return createPointerVariable(name, type, location, false, null, reason);
  }

  private PointerVariable createPointerVariable(
      String name,
      CType type,
      SourceLocation location,
      boolean hasBoundsAnnotation,
      BoundsKey boundsKey,
      String wildReason) {
    ImmutableList.Builder<Atom> atoms = ImmutableList.builder();
    boolean hasVariableAtoms = false;
    CType current = type;
    while (current.isPointerOrArray()) {
      CheckedPointerKind kind =
          current.isPointer()
              ? current.asPointer().getCheckedKind()
              : current.asArray().getCheckedKind();
      if (kind != CheckedPointerKind.UNCHECKED) {
        atoms.add(constantFor(kind));
      } else {
        VarAtom atom = graph.freshUnknown(name, location);
        if (current.isArray()) {
          graph.addGeq(atom, ConstAtom.ARRAY, DECLARED_ARRAY_REASON, location);
        }
        atoms.add(atom);
        hasVariableAtoms = true;
      }
      current = current.getReferencedType();
    }
    FunctionVariable functionVariable = null;
    if (current.isFunction()) {
      functionVariable = createFunctionVariable(name, current.asFunction(), location);
    }
    PointerVariable variable =
        new PointerVariable(
            name,
            location,
            atoms.build(),
            type,
            functionVariable,
            type.isArray(),
            hasBoundsAnnotation,
            boundsKey);
    if (wildReason != null) {
      variable.constrainToWild(graph, wildReason, location);
    }
    if (hasVariableAtoms && current.isVoid()) {
      variable.constrainToWild(graph, VOID_POINTER_REASON, location);
    }
    if (location != null && location.isInMacroExpansion() && !variable.isNonPointer()) {
      variable.constrainToWild(graph, MACRO_REASON, location);
    }
    return variable;
  }

  /** Creates the variable of a function declaration or definition. */
  public FunctionVariable createFunctionVariable(FunctionDeclaration function, boolean hasBody) {
    PointerVariable returnVariable =
        createPointerVariable(
            function.getName(),
            function.getReturnType(),
            function.getLocation(),
            false,
            boundsInformation.getVariable(function),
            null);
    ImmutableList.Builder<ImmutableSet<ConstraintVariable>> parameters = ImmutableList.builder();
    for (ParameterDeclaration parameter : function.getParameters()) {
      parameters.add(ImmutableSet.of(createParameterVariable(parameter)));
    }
    return new FunctionVariable(
        function.getName(),
        function.getLocation(),
        function.getType(),
        returnVariable,
        parameters.build(),
        hasBody);
  }

  private ConstraintVariable createParameterVariable(ParameterDeclaration parameter) {
    CType type = parameter.getType();
    if (type.isFunction()) {
      // A parameter of function type is adjusted to a pointer to function.
      type = CType.pointerTo(type);
    }
    return createPointerVariable(
        parameter.getName(),
        type,
        parameter.getLocation(),
        parameter.hasBoundsAnnotation(),
        boundsInformation.getVariable(parameter),
        null);
  }

  private FunctionVariable createFunctionVariable(
      String name, FunctionType type, SourceLocation location) {
    PointerVariable returnVariable =
        createPointerVariable(name + "#return", type.getReturnType(), location);
    ImmutableList.Builder<ImmutableSet<ConstraintVariable>> parameters = ImmutableList.builder();
    ImmutableList<CType> parameterTypes = type.getParameterTypes();
    for (int i = 0; i < parameterTypes.size(); i++) {
      parameters.add(
          ImmutableSet.of(
              createPointerVariable(name + "#param" + i, parameterTypes.get(i), location)));
    }
    return new FunctionVariable(name, location, type, returnVariable, parameters.build(), false);
  }

  private static ConstAtom constantFor(CheckedPointerKind kind) {
    switch (kind) {
      case PTR:
        return ConstAtom.PTR;
      case ARRAY:
        return ConstAtom.ARRAY;
      case NT_ARRAY:
        return ConstAtom.NT_ARRAY;
      default:
        throw new Unreachable("Unexpected checked pointer kind: " + kind);
    }
  }
}
