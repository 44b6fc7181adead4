// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.bounds;

import com.android.tools.cconv.ast.CallExpression;
import com.android.tools.cconv.ast.Declaration;
import com.android.tools.cconv.ast.Expression;
import com.android.tools.cconv.ast.FunctionDeclaration;
import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.ast.VariableDeclaration;
import com.android.tools.cconv.constraints.variables.ConstraintVariable;
import com.android.tools.cconv.constraints.variables.PointerVariable;
import com.android.tools.cconv.errors.InternalAnalysisError;
import com.android.tools.cconv.resolver.AllocatorFunction;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Program-wide storage of bounds keys, inferred bounds and the assignments that feed the bounds
 * heuristics.
 *
 * <p>Keys are allocated while translation units are processed concurrently, so all mutators are
 * synchronized.
 */
public class ArrayBoundsInformation {

  /** An assignment of an allocator call or a string literal to a pointer. */
  public static final class AllocationCandidate {

    private final PointerVariable target;
    private final Expression source;

    AllocationCandidate(PointerVariable target, Expression source) {
      this.target = target;
      this.source = source;
    }

    public PointerVariable getTarget() {
      return target;
    }

    public Expression getSource() {
      return source;
    }
  }

  /** A pointer value flowing from one key into another. */
  public static final class PointerFlow {

    private final BoundsKey target;
    private final BoundsKey source;

    PointerFlow(BoundsKey target, BoundsKey source) {
      this.target = target;
      this.source = source;
    }

    public BoundsKey getTarget() {
      return target;
    }

    public BoundsKey getSource() {
      return source;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof PointerFlow)) {
        return false;
      }
      PointerFlow other = (PointerFlow) obj;
      return target.equals(other.target) && source.equals(other.source);
    }

    @Override
    public int hashCode() {
      return 31 * target.hashCode() + source.hashCode();
    }
  }

  private int nextKeyId = 0;

  private final Map<Declaration, BoundsKey> declarationKeys = new IdentityHashMap<>();
  private final Map<BoundsKey, Declaration> keyDeclarations = new HashMap<>();
  private final Map<BoundsKey, ProgramVariable> programVariables = new HashMap<>();
  private final Map<Long, BoundsKey> constantKeys = new HashMap<>();
  private final Map<CallExpression, Map<BoundsKey, BoundsKey>> contextSensitiveKeys =
      new IdentityHashMap<>();
  private final Map<BoundsKey, BoundsKey> originKeys = new HashMap<>();

  private final Map<BoundsKey, ArrayBounds> bounds = new LinkedHashMap<>();
  private final Set<BoundsKey> confirmedAllocationMatches = new HashSet<>();

  private final List<AllocationCandidate> allocationCandidates = new ArrayList<>();
  private final Set<PointerFlow> pointerFlows = new LinkedHashSet<>();

  private BoundsKey newKey() {
    return new BoundsKey(nextKeyId++);
  }

  public synchronized BoundsKey getVariable(Declaration declaration) {
    BoundsKey key = declarationKeys.get(declaration);
    if (key == null) {
      key = newKey();
      declarationKeys.put(declaration, key);
      keyDeclarations.put(key, declaration);
      programVariables.put(
          key, ProgramVariable.create(key, declaration.getName(), scopeOf(declaration)));
    }
    return key;
  }

  /** The key of the value named by {@code expression}, or null if it does not name one. */
  public BoundsKey getVariable(Expression expression) {
    Expression stripped = expression.stripCasts();
    if (stripped.isDeclRef()) {
      Declaration declaration = stripped.asDeclRef().getDeclaration();
      return declaration.isFunction() ? null : getVariable(declaration);
    }
    if (stripped.isMember()) {
      return getVariable(stripped.asMember().getField());
    }
    if (stripped.isIntegerLiteral()) {
      return getConstantKey(stripped.asIntegerLiteral().getValue());
    }
    return null;
  }

  public synchronized BoundsKey getConstantKey(long value) {
    BoundsKey key = constantKeys.get(value);
    if (key == null) {
      key = newKey();
      constantKeys.put(value, key);
      programVariables.put(key, ProgramVariable.createConstant(key, value));
    }
    return key;
  }

  /** Returns a key private to one call site for the result of {@code call}. */
  public synchronized BoundsKey getContextSensitiveKey(CallExpression call, BoundsKey key) {
    Map<BoundsKey, BoundsKey> keys =
        contextSensitiveKeys.computeIfAbsent(call, ignore -> new HashMap<>());
    BoundsKey contextKey = keys.get(key);
    if (contextKey == null) {
      contextKey = newKey();
      keys.put(key, contextKey);
      originKeys.put(contextKey, key);
      ProgramVariable origin = getProgramVariable(key);
      SourceLocation location = call.getLocation();
      programVariables.put(
          contextKey,
          ProgramVariable.create(
              contextKey,
              origin.getName(),
              BoundsScope.callContext(origin.getName() + "@" + location)));
    }
    return contextKey;
  }

  /** The declaration key a context-sensitive key was made from, or the key itself. */
  public synchronized BoundsKey getOriginKey(BoundsKey key) {
    return originKeys.getOrDefault(key, key);
  }

  public synchronized ProgramVariable getProgramVariable(BoundsKey key) {
    ProgramVariable variable = programVariables.get(key);
    if (variable == null) {
      throw new InternalAnalysisError("Unknown bounds key " + key);
    }
    return variable;
  }

  public synchronized Declaration getDeclaration(BoundsKey key) {
    return keyDeclarations.get(key);
  }

  /** Records bounds for {@code key} unless some are already known. */
  public synchronized boolean mergeBounds(BoundsKey key, ArrayBounds newBounds) {
    if (bounds.containsKey(key)) {
      return false;
    }
    bounds.put(key, newBounds);
    return true;
  }

  /** Records bounds for {@code key} unless they came from a matching allocation site. */
  public synchronized boolean replaceBounds(BoundsKey key, ArrayBounds newBounds) {
    if (confirmedAllocationMatches.contains(key)) {
      return false;
    }
    bounds.put(key, newBounds);
    return true;
  }

  public synchronized void confirmAllocationMatch(BoundsKey key, ArrayBounds newBounds) {
    bounds.put(key, newBounds);
    confirmedAllocationMatches.add(key);
  }

  public synchronized boolean hasBounds(BoundsKey key) {
    return bounds.containsKey(key);
  }

  public synchronized ArrayBounds getBounds(BoundsKey key) {
    return bounds.get(key);
  }

  public synchronized Map<BoundsKey, ArrayBounds> getAllBounds() {
    return new LinkedHashMap<>(bounds);
  }

  /**
   * Records that the values of {@code sources} are stored into {@code targets}.
   *
   * <p>Allocator calls and string literals become allocation candidates. Every pair of keyed
   * pointers becomes a pointer flow.
   */
  public synchronized void recordAssignment(
      Collection<? extends ConstraintVariable> targets,
      Collection<? extends ConstraintVariable> sources,
      Expression source) {
    Expression stripped = source.stripCasts();
    boolean isAllocation =
        AllocatorFunction.forCall(stripped) != null || stripped.isStringLiteral();
    for (ConstraintVariable target : targets) {
      if (!target.isPointerVariable() || !target.asPointerVariable().hasBoundsKey()) {
        continue;
      }
      PointerVariable targetPointer = target.asPointerVariable();
      if (isAllocation) {
        allocationCandidates.add(new AllocationCandidate(targetPointer, stripped));
      }
      for (ConstraintVariable sourceVariable : sources) {
        if (sourceVariable.isPointerVariable()
            && sourceVariable.asPointerVariable().hasBoundsKey()) {
          BoundsKey sourceKey = sourceVariable.asPointerVariable().getBoundsKey();
          if (!sourceKey.equals(targetPointer.getBoundsKey())) {
            pointerFlows.add(new PointerFlow(targetPointer.getBoundsKey(), sourceKey));
          }
        }
      }
    }
  }

  public synchronized List<AllocationCandidate> getAllocationCandidates() {
    return ImmutableList.copyOf(allocationCandidates);
  }

  public synchronized List<PointerFlow> getPointerFlows() {
    return ImmutableList.copyOf(pointerFlows);
  }

  private static BoundsScope scopeOf(Declaration declaration) {
    if (declaration.isParameter()) {
      return BoundsScope.function(declaration.asParameter().getFunction().getName());
    }
    if (declaration.isField()) {
      return BoundsScope.record(declaration.asField().getRecord().getName());
    }
    if (declaration.isFunction()) {
      return BoundsScope.function(declaration.getName());
    }
    if (declaration.isVariable()) {
      VariableDeclaration variable = declaration.asVariable();
      FunctionDeclaration function = variable.getEnclosingFunction();
      if (variable.isLocal() && function != null) {
        return BoundsScope.function(function.getName());
      }
    }
    return BoundsScope.global();
  }
}
