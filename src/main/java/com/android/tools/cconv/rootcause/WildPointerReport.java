// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.rootcause;

import com.android.tools.cconv.constraints.VarAtom;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Set;

/** The result of {@link WildPointerRootCauseAnalysis}. */
public class WildPointerReport {

  private final ImmutableMap<VarAtom, WildPointerReason> directWild;
  private final ImmutableSet<VarAtom> indirectWild;
  private final ImmutableMap<VarAtom, VarAtom> leaders;
  private final ImmutableMap<VarAtom, ImmutableSet<VarAtom>> affected;

  WildPointerReport(
      Map<VarAtom, WildPointerReason> directWild,
      Set<VarAtom> indirectWild,
      Map<VarAtom, VarAtom> leaders,
      Map<VarAtom, ImmutableSet<VarAtom>> affected) {
    this.directWild = ImmutableMap.copyOf(directWild);
    this.indirectWild = ImmutableSet.copyOf(indirectWild);
    this.leaders = ImmutableMap.copyOf(leaders);
    this.affected = ImmutableMap.copyOf(affected);
  }

  public ImmutableMap<VarAtom, WildPointerReason> getDirectWild() {
    return directWild;
  }

  public ImmutableSet<VarAtom> getIndirectWild() {
    return indirectWild;
  }

  public boolean isDirectWild(VarAtom atom) {
    return directWild.containsKey(atom);
  }

  public boolean isIndirectWild(VarAtom atom) {
    return indirectWild.contains(atom);
  }

  /** The directly wild atom that leads the group of {@code atom}, or null if it is not wild. */
  public VarAtom getLeader(VarAtom atom) {
    return leaders.get(atom);
  }

  public ImmutableSet<VarAtom> getLeaders() {
    return affected.keySet();
  }

  /** The indirectly wild atoms led by {@code leader}. */
  public ImmutableSet<VarAtom> getAffected(VarAtom leader) {
    return affected.getOrDefault(leader, ImmutableSet.of());
  }

  public WildPointerReason getRootCause(VarAtom atom) {
    VarAtom leader = leaders.get(atom);
    return leader != null ? directWild.get(leader) : null;
  }
}
