// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.cconv.rootcause;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.android.tools.cconv.ast.SourceLocation;
import com.android.tools.cconv.constraints.AtomFactory;
import com.android.tools.cconv.constraints.ConstAtom;
import com.android.tools.cconv.constraints.ConstraintGraph;
import com.android.tools.cconv.constraints.ConstraintSolver;
import com.android.tools.cconv.constraints.Geq;
import com.android.tools.cconv.constraints.VarAtom;
import org.junit.Test;

public class WildPointerRootCauseAnalysisTest {

  private static final SourceLocation LOCATION = SourceLocation.create("test.c", 3, 5);

  private final ConstraintGraph graph = new ConstraintGraph();

  private VarAtom atom(String name) {
    return graph.freshUnknown(name, LOCATION);
  }

  private WildPointerReport analyze() {
    new ConstraintSolver(graph).solve();
    return new WildPointerRootCauseAnalysis(graph).run();
  }

  @Test
  public void testChainIsLedByItsSource() {
    VarAtom a = atom("a");
    VarAtom b = atom("b");
    VarAtom c = atom("c");
    VarAtom safe = atom("safe");
    graph.addGeq(a, ConstAtom.WILD, "root", LOCATION);
    graph.addGeq(b, a);
    graph.addGeq(c, b);
    graph.addGeq(a, safe);
    WildPointerReport report = analyze();

    assertThat(report.getLeaders(), contains(a));
    assertThat(report.getAffected(a), containsInAnyOrder(b, c));
    assertTrue(report.isDirectWild(a));
    assertTrue(report.isIndirectWild(c));
    assertSame(a, report.getLeader(c));
    assertEquals("root", report.getRootCause(c).getReason());
    assertEquals(LOCATION, report.getRootCause(c).getLocation());
    assertNull(report.getLeader(safe));
    assertFalse(report.isIndirectWild(safe));
  }

  @Test
  public void testFirstDirectAtomInGraphOrderLeadsAMergedGroup() {
    VarAtom x = atom("x");
    VarAtom y = atom("y");
    VarAtom z = atom("z");
    graph.addGeq(y, ConstAtom.WILD, "second", LOCATION);
    graph.addGeq(x, ConstAtom.WILD, "first", LOCATION);
    graph.addGeq(z, x);
    graph.addGeq(z, y);
    WildPointerReport report = analyze();

    assertThat(report.getLeaders(), contains(x));
    assertThat(report.getAffected(x), contains(z));
    assertSame(x, report.getLeader(y));
    assertTrue(report.isDirectWild(y));
    assertEquals("first", report.getRootCause(y).getReason());
  }

  @Test
  public void testIndependentRootsStaySeparate() {
    VarAtom p = atom("p");
    VarAtom q = atom("q");
    graph.addGeq(p, ConstAtom.WILD, "p", LOCATION);
    graph.addGeq(q, ConstAtom.WILD, "q", LOCATION);
    WildPointerReport report = analyze();
    assertThat(report.getLeaders(), containsInAnyOrder(p, q));
    assertTrue(report.getAffected(p).isEmpty());
  }

  @Test
  public void testFiredImplicationJoinsThePremiseGroup() {
    VarAtom premise = atom("premise");
    VarAtom conclusion = atom("conclusion");
    graph.addImplies(
        new Geq(premise, ConstAtom.WILD),
        new Geq(conclusion, ConstAtom.WILD, "implied", LOCATION));
    graph.addGeq(premise, ConstAtom.WILD, "root", LOCATION);
    WildPointerReport report = analyze();

    assertThat(report.getLeaders(), contains(premise));
    assertTrue(report.isIndirectWild(conclusion));
    assertEquals("root", report.getRootCause(conclusion).getReason());
  }

  @Test
  public void testLeaderFollowsMergeOrderRatherThanAtomIds() {
    AtomFactory atomFactory = new AtomFactory();
    ConstraintGraph first = new ConstraintGraph(atomFactory);
    ConstraintGraph second = new ConstraintGraph(atomFactory);
    // The second unit happens to allocate its atom before the first one.
    VarAtom late = second.freshUnknown("q", SourceLocation.create("small.c", 1, 1));
    VarAtom early = first.freshUnknown("q", SourceLocation.create("big.c", 40, 1));
    first.addGeq(early, ConstAtom.WILD, "big", early.getLocation());
    second.addGeq(late, ConstAtom.WILD, "small", late.getLocation());

    ConstraintGraph program = new ConstraintGraph(atomFactory);
    program.mergeFrom(first);
    program.mergeFrom(second);
    program.addGeq(early, late);
    program.addGeq(late, early);
    new ConstraintSolver(program).solve();
    WildPointerReport report = new WildPointerRootCauseAnalysis(program).run();

    assertThat(report.getLeaders(), contains(early));
    assertSame(early, report.getLeader(late));
    assertEquals("big", report.getRootCause(late).getReason());
  }

  @Test
  public void testEveryIndirectAtomHasALeader() {
    VarAtom root = atom("root");
    VarAtom premise = atom("premise");
    VarAtom conclusion = atom("conclusion");
    VarAtom follower = atom("follower");
    VarAtom safe = atom("safe");
    VarAtom alsoSafe = atom("alsoSafe");
    graph.addGeq(root, ConstAtom.WILD, "root", LOCATION);
    graph.addGeq(premise, root);
    graph.addImplies(
        new Geq(premise, ConstAtom.WILD),
        new Geq(conclusion, ConstAtom.WILD, "implied", LOCATION));
    graph.addGeq(follower, conclusion);
    graph.addGeq(safe, alsoSafe);
    graph.addGeq(alsoSafe, safe);
    WildPointerReport report = analyze();

    assertThat(report.getIndirectWild(), containsInAnyOrder(premise, conclusion, follower));
    for (VarAtom atom : report.getIndirectWild()) {
      assertSame(root, report.getLeader(atom));
    }
    assertThat(report.getAffected(root), containsInAnyOrder(premise, conclusion, follower));
    assertFalse(report.isIndirectWild(safe));
    assertNull(report.getLeader(alsoSafe));
  }
}
