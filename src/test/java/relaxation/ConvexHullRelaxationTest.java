/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package relaxation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import constraints.Constraint;
import constraints.ConstraintData;
import problem.Block;
import problem.Disjunct;
import problem.DisjunctData;
import problem.Disjunction;
import problem.Index;
import problem.Objective;
import relaxation.GDPException.Kind;
import relaxation.HullOptions.Mode;
import relaxation.hull.ModelWalker;
import variables.Domain;
import variables.Variable;

final class ConvexHullRelaxationTest {

    private static final double TOL = 1e-6;

    private Block m;

    private Variable x;

    private DisjunctData d1, d2;

    private Disjunction disj;

    /**
     * [0 <= x <= 2] v [8 <= x <= 10], with x in [0,10]
     */
    @BeforeEach
    void twoIntervals() {
        m = new Block("m");
        x = m.addVariable("x", 0.0, 10.0);
        d1 = m.addDisjunct("d1");
        d1.addConstraint("c", 0.0, x, 2.0);
        d2 = m.addDisjunct("d2");
        d2.addConstraint("c", 8.0, x, 10.0);
        disj = m.addDisjunction("disj", d1, d2);
    }

    private static boolean satisfied(Block model) {
        return new ModelWalker().constraints(model).stream().allMatch(cd -> cd.isSatisfied(TOL));
    }

    private static Constraint constraint(Block block, String name) {
        return (Constraint) block.component(name);
    }

    @Test
    void disjunctionIsReplacedByExclusivityAndDisaggregation() {
        RelaxationResult r = new ConvexHullRelaxation().apply(m);

        Block scope = r.scope().orElseThrow();
        assertSame(m.component("_gdp_chull_relaxation"), scope);
        assertEquals(2, r.relaxationBlocks().size());
        assertEquals(1, r.nRelaxedDisjunctions);
        assertEquals(2, r.nRelaxedDisjuncts);
        assertEquals(2, r.nRelaxedConstraints);

        assertFalse(disj.isActive());
        assertFalse(d1.isActive());
        assertFalse(d2.isActive());
        assertFalse(constraint(d1, "c").isActive(), "original constraints are deactivated");
        assertEquals(Domain.REALS, d1.indicator().domain());

        ConstraintData xor = r.exclusivityConstraint(disj).single();
        assertSame(m, r.exclusivityConstraint(disj).parent());
        assertTrue(xor.isEquality());
        assertEquals(1.0, xor.lower);
        assertEquals(Set.of(d1.indicator(), d2.indicator()), xor.body.variables());

        Variable x1 = r.disaggregatedVariable(d1, x), x2 = r.disaggregatedVariable(d2, x);
        assertSame(r.relaxationBlock(d1), x1.parent());
        assertSame(x, r.sourceVariable(x1));
        assertSame(d2, r.sourceDisjunct(r.relaxationBlock(d2)));
        assertEquals(0.0, x1.lb());
        assertEquals(10.0, x1.ub());
        ConstraintData sum = r.disaggregationConstraint(disj).get(0);
        assertTrue(sum.isEquality());
        assertEquals(Set.of(x, x1, x2), sum.body.variables());
        assertNotNull(r.boundConstraint(d1, x).get("lb"));
        assertNotNull(r.boundConstraint(d1, x).get("ub"));
        assertSame(x, r.ledger().boundConstraintSource(r.boundConstraint(d1, x)));
        assertTrue(r.ledger().disjunct(d1).isRelaxed());

        Constraint relaxed = r.relaxedConstraint(constraint(d1, "c"));
        assertSame(r.relaxationBlock(d1), relaxed.parent());
        assertSame(constraint(d1, "c"), r.sourceConstraint(relaxed));
        assertEquals(Set.of(Index.of("lb"), Index.of("ub")), relaxed.indexes());
    }

    @Test
    void relaxedModelIsTheConvexHull() {
        RelaxationResult r = new ConvexHullRelaxation().apply(m);
        Variable y1 = d1.indicator(), y2 = d2.indicator();
        Variable x1 = r.disaggregatedVariable(d1, x), x2 = r.disaggregatedVariable(d2, x);

        // first disjunct selected
        y1.setValue(1);
        y2.setValue(0);
        x.setValue(1);
        x1.setValue(1);
        x2.setValue(0);
        assertTrue(satisfied(m));
        x.setValue(5);
        x1.setValue(5);
        assertFalse(satisfied(m), "5 is not in [0,2]");

        // midpoint of the two intervals at their extreme points
        y1.setValue(0.5);
        y2.setValue(0.5);
        x1.setValue(1);
        x2.setValue(4);
        assertTrue(satisfied(m));
        x2.setValue(3.9);
        x.setValue(4.9);
        assertFalse(satisfied(m), "4.9 is below the hull");
    }

    @Test
    void boundsCollapseWithTheIndicator() {
        RelaxationResult r = new ConvexHullRelaxation().apply(m);
        Variable y2 = d2.indicator(), x2 = r.disaggregatedVariable(d2, x);
        Constraint bounds = r.boundConstraint(d2, x);
        y2.setValue(0);
        x2.setValue(0.5);
        assertFalse(bounds.get("ub").isSatisfied(TOL), "the copy is 0 when the disjunct is not selected");
        x2.setValue(0);
        assertTrue(bounds.get("lb").isSatisfied(TOL) && bounds.get("ub").isSatisfied(TOL));
        y2.setValue(1);
        x2.setValue(10);
        assertTrue(bounds.get("ub").isSatisfied(TOL));
    }

    @Test
    void copiesAreDeclaredOnARangeContainingZero() {
        Block model = new Block("m");
        Variable z = model.addVariable("z", 2.0, 5.0);
        DisjunctData a = model.addDisjunct("a");
        a.addConstraint("c", null, z, 3.0);
        DisjunctData b = model.addDisjunct("b");
        b.addConstraint("c", 4.0, z, null);
        model.addDisjunction("disj", a, b);
        RelaxationResult r = new ConvexHullRelaxation().apply(model);

        Variable v = r.disaggregatedVariable(a, z);
        assertEquals(0.0, v.lb());
        assertEquals(5.0, v.ub());
        assertEquals(Domain.REALS, v.domain());
    }

    @Test
    void secondRunDoesNothing() {
        ConvexHullRelaxation chull = new ConvexHullRelaxation();
        chull.apply(m);
        int n = m.components().size();
        RelaxationResult again = chull.apply(m);
        assertTrue(again.scope().isEmpty());
        assertEquals(0, again.nRelaxedConstraints);
        assertEquals(n, m.components().size(), "no new relaxation scope");

        RelaxationResult fresh = new ConvexHullRelaxation().apply(m);
        assertTrue(fresh.scope().isEmpty());
    }

    @Test
    void indicatorsCanStayBinary() {
        new ConvexHullRelaxation().apply(m, new HullOptions().relaxIndicators(false));
        assertEquals(Domain.BINARY, d1.indicator().domain());
    }

    @Test
    void disaggregatedVariablesMustBeBounded() {
        Block model = new Block("m");
        Variable z = model.addVariable("z", 0.0, null);
        DisjunctData a = model.addDisjunct("a");
        a.addConstraint("c", null, z, 3.0);
        DisjunctData b = model.addDisjunct("b");
        b.addConstraint("c", 5.0, z, null);
        model.addDisjunction("disj", a, b);
        ConvexHullRelaxation chull = new ConvexHullRelaxation();
        GDPException e = assertThrows(GDPException.class, () -> chull.apply(model));
        assertEquals(Kind.UNBOUNDED_DISAGGREGATION_VARIABLE, e.kind);
        assertEquals("z", e.entity);
        assertNull(model.component("_gdp_chull_relaxation"), "nothing created before the check");
        assertTrue(a.isActive());

        z.setBounds(0.0, 10.0);
        RelaxationResult r = chull.apply(model);
        assertEquals(2, r.nRelaxedDisjuncts, "the run can be resumed once the model is fixed");
        assertFalse(a.isActive());
    }

    @Test
    void affineConstraintsUseTheValueAtTheOrigin() {
        Block model = new Block("m");
        Variable w = model.addVariable("w", -10.0, 10.0);
        DisjunctData a = model.addDisjunct("a");
        a.addConstraint("c", 5.0, w.times(2).plus(3), null); // 2w+3 >= 5
        DisjunctData b = model.addDisjunct("b");
        b.addConstraint("c", null, w, -5.0);
        model.addDisjunction("disj", a, b);
        RelaxationResult r = new ConvexHullRelaxation().apply(model);

        Constraint relaxed = r.relaxedConstraint(constraint(a, "c"));
        assertNull(relaxed.get("ub"), "no upper side for a one-sided constraint");
        ConstraintData lb = relaxed.get("lb");
        Variable y = a.indicator(), v = r.disaggregatedVariable(a, w);

        y.setValue(1);
        v.setValue(1);
        assertTrue(lb.isSatisfied(TOL));
        v.setValue(0.9);
        assertFalse(lb.isSatisfied(TOL));
        y.setValue(0);
        v.setValue(0);
        assertTrue(lb.isSatisfied(TOL), "2*0 + 3 - 3 >= 0");
        y.setValue(0.5);
        v.setValue(0.5);
        assertTrue(lb.isSatisfied(TOL));
        v.setValue(0.4);
        assertFalse(lb.isSatisfied(TOL));
    }

    @Test
    void affineLowerBoundIsTightAlongTheIndicator() {
        Block model = new Block("m");
        Variable z = model.addVariable("z", 0.0, 10.0);
        DisjunctData a = model.addDisjunct("a");
        a.addConstraint("c", 5.0, z.times(2).plus(3), null); // 2z+3 >= 5
        DisjunctData b = model.addDisjunct("b");
        b.addConstraint("c", null, z, 0.5);
        model.addDisjunction("disj", a, b);
        RelaxationResult r = new ConvexHullRelaxation().apply(model);

        ConstraintData lb = r.relaxedConstraint(constraint(a, "c")).get("lb");
        Variable y = a.indicator(), v = r.disaggregatedVariable(a, z);
        y.setValue(0.3);
        v.setValue(0.3);
        assertEquals(0, lb.body.evaluate(), 1e-12, "2v + 3 - 3(1-y) - 5y");
        v.setValue(0.29);
        assertFalse(lb.isSatisfied(TOL));
        y.setValue(1);
        v.setValue(10);
        assertTrue(lb.isSatisfied(TOL));
    }

    @Test
    void squareIsBoundedThroughItsPerspective() {
        double[] expected = new double[Mode.values().length];
        expected[Mode.CLASSICAL.ordinal()] = 0;
        expected[Mode.REGULARIZED.ordinal()] = 1 / (0.5 + HullOptions.DEFAULT_EPS) - 2;
        expected[Mode.ROBUST.ordinal()] = 1 / ((1 - HullOptions.DEFAULT_EPS) * 0.5 + HullOptions.DEFAULT_EPS) - 2;
        for (Mode mode : Mode.values()) {
            Block model = new Block("m");
            Variable z = model.addVariable("z", 0.0, 2.0);
            DisjunctData a = model.addDisjunct("a");
            a.addConstraint("c", null, z.pow(2), 4.0); // z^2 <= 4
            DisjunctData b = model.addDisjunct("b");
            b.addConstraint("c", 1.0, z, null);
            model.addDisjunction("disj", a, b);
            RelaxationResult r = new ConvexHullRelaxation().apply(model, new HullOptions().mode(mode));

            ConstraintData ub = r.relaxedConstraint(constraint(a, "c")).get("ub");
            Variable y = a.indicator(), v = r.disaggregatedVariable(a, z);
            y.setValue(0.5);
            v.setValue(1);
            assertEquals(expected[mode.ordinal()], ub.body.evaluate(), 1e-9, mode.toString());
            y.setValue(1);
            v.setValue(2);
            double atOne = mode == Mode.REGULARIZED ? 4 / (1 + HullOptions.DEFAULT_EPS) - 4 : 0;
            assertEquals(atOne, ub.body.evaluate(), 1e-9, mode + " at y = 1");
            if (mode == Mode.ROBUST) {
                y.setValue(0);
                v.setValue(0);
                assertEquals(0, ub.body.evaluate(), 1e-12);
            }
        }
    }

    private static Block nonlinearModel() {
        Block model = new Block("m");
        Variable w = model.addVariable("w", -3.0, 3.0);
        DisjunctData a = model.addDisjunct("a");
        a.addConstraint("c", null, w.minus(1).pow(2), 4.0); // (w-1)^2 <= 4
        DisjunctData b = model.addDisjunct("b");
        b.addConstraint("c", 2.5, w, null);
        model.addDisjunction("disj", a, b);
        return model;
    }

    @Test
    void robustPerspectiveIsExactAtZero() {
        Block model = nonlinearModel();
        DisjunctData a = (DisjunctData) model.find("a");
        RelaxationResult r = new ConvexHullRelaxation().apply(model, new HullOptions().mode(Mode.ROBUST));
        ConstraintData ub = r.relaxedConstraint((Constraint) model.find("a.c")).get("ub");
        Variable y = a.indicator(), v = r.disaggregatedVariable(a, (Variable) model.find("w"));

        y.setValue(0);
        v.setValue(0);
        assertEquals(0, ub.body.evaluate(), 1e-12, "h(0) is removed when the disjunct is not selected");
        y.setValue(1);
        v.setValue(3);
        assertTrue(ub.isSatisfied(TOL));
        v.setValue(3.1);
        assertFalse(ub.isSatisfied(TOL));
        v.setValue(-1);
        assertTrue(ub.isSatisfied(TOL));
    }

    @Test
    void formulationModesGiveDifferentPerspectives() {
        String[] bodies = new String[Mode.values().length];
        double[] values = new double[Mode.values().length];
        for (Mode mode : Mode.values()) {
            Block model = nonlinearModel();
            DisjunctData a = (DisjunctData) model.find("a");
            RelaxationResult r = new ConvexHullRelaxation().apply(model, new HullOptions().mode(mode));
            ConstraintData ub = r.relaxedConstraint((Constraint) model.find("a.c")).get("ub");
            a.indicator().setValue(1);
            r.disaggregatedVariable(a, (Variable) model.find("w")).setValue(3);
            bodies[mode.ordinal()] = ub.body.toString();
            values[mode.ordinal()] = ub.body.evaluate();
        }
        assertNotEquals(bodies[0], bodies[1]);
        assertNotEquals(bodies[1], bodies[2]);
        assertNotEquals(bodies[0], bodies[2]);
        assertEquals(0, values[Mode.CLASSICAL.ordinal()], 1e-9, "y*h(v/y) - 4y at y=1 is h(v) - 4");
        assertEquals(0, values[Mode.ROBUST.ordinal()], 1e-9);
        assertEquals(0, values[Mode.REGULARIZED.ordinal()], 0.1, "off by a term of order eps");
    }

    @Test
    void onlyExclusiveDisjunctionsAreRelaxed() {
        DisjunctData d3 = m.addDisjunct("d3");
        d3.addConstraint("c", 4.0, x, 6.0);
        m.addDisjunction("or", false, d1, d3);
        GDPException e = assertThrows(GDPException.class, () -> new ConvexHullRelaxation().apply(m, new HullOptions().targets("or")));
        assertEquals(Kind.NON_EXCLUSIVE_DISJUNCTION, e.kind);
        assertEquals("or", e.entity);
    }

    @Test
    void deactivatedDisjunctsAreExcluded() {
        DisjunctData d3 = m.addDisjunct("d3");
        d3.addConstraint("c", 4.0, x, 6.0);
        Disjunction three = m.addDisjunction("three", d1, d2, d3);
        disj.deactivate();
        d3.deactivate();

        RelaxationResult r = new ConvexHullRelaxation().apply(m);
        assertTrue(d3.indicator().isFixed());
        assertEquals(0.0, d3.indicator().value());
        assertNull(r.relaxationBlock(d3));
        assertNull(r.disaggregatedVariable(d3, x));
        assertEquals(2, r.nRelaxedDisjuncts);
        assertEquals(Set.of(x, r.disaggregatedVariable(d1, x), r.disaggregatedVariable(d2, x)),
                r.disaggregationConstraint(three).get(0).body.variables());
        assertTrue(r.exclusivityConstraint(three).single().body.variables().contains(d1.indicator()));
    }

    @Test
    void disjunctsRelaxedByAnotherStrategyAreSkipped() {
        TransformationLedger ledger = new TransformationLedger();
        ledger.markRelaxed(d2, "bigm");
        d2.deactivate();
        RelaxationResult r = new ConvexHullRelaxation(ledger).apply(m);
        assertSame(ledger, r.ledger());
        assertEquals(1, r.nRelaxedDisjuncts);
        assertNull(r.relaxationBlock(d2));
        assertTrue(ledger.disjunct(d2).isRelaxed());
        assertEquals("bigm", ledger.disjunct(d2).strategy);
        assertFalse(d2.indicator().isFixed(), "not treated as excluded");
        assertEquals(Set.of(x, r.disaggregatedVariable(d1, x)), r.disaggregationConstraint(disj).get(0).body.variables());
    }

    private Disjunct indexedDisjuncts(Block model, Variable z) {
        Disjunct d = model.addIndexedDisjunct("d");
        for (int i = 1; i <= 3; i++)
            d.add(i).addConstraint("c", (double) i, z, (double) i);
        return d;
    }

    @Test
    void indexedContainersAreDeactivatedOnceEmpty() {
        Disjunct d = indexedDisjuncts(m, x);
        Disjunction all = m.addIndexedDisjunction("all");
        all.add(Index.of(1), true, d.get(1), d.get(2), d.get(3));
        RelaxationResult r = new ConvexHullRelaxation().apply(m, new HullOptions().targets(all));
        assertFalse(d.isActive());
        assertFalse(all.isActive());
        assertEquals(1, r.nDeactivatedContainers);
        assertTrue(disj.isActive(), "not a target");
        assertNotNull(r.exclusivityConstraint(all).get(1));
    }

    @Test
    void indexedContainersWithActiveItemsStayActive() {
        Disjunct d = indexedDisjuncts(m, x);
        Disjunction some = m.addIndexedDisjunction("some");
        some.add(Index.of("p"), true, d.get(1), d.get(2));
        RelaxationResult r = new ConvexHullRelaxation().apply(m, new HullOptions().targets(some));
        assertTrue(d.isActive());
        assertTrue(d.get(3).isActive());
        assertFalse(d.get(1).isActive());
        assertEquals(0, r.nDeactivatedContainers);
    }

    @Test
    void targetsAreResolvedByPath() {
        Block b = m.addBlock("b");
        DisjunctData e1 = b.addDisjunct("e1");
        e1.addConstraint("c", null, x, 1.0);
        DisjunctData e2 = b.addDisjunct("e2");
        e2.addConstraint("c", 9.0, x, null);
        Disjunction inner = b.addDisjunction("disj", e1, e2);

        RelaxationResult r = new ConvexHullRelaxation().apply(m, HullOptions.from(Map.of("targets", "b.disj")));
        assertFalse(inner.isActive());
        assertTrue(disj.isActive());
        assertSame(b, r.exclusivityConstraint(inner).parent());
        assertEquals("_gdp_chull_relaxation_disj_xor", r.exclusivityConstraint(inner).name());
    }

    @Test
    void targetsMustBelongToTheModel() {
        GDPException e = assertThrows(GDPException.class, () -> new ConvexHullRelaxation().apply(m, new HullOptions().targets("nope")));
        assertEquals(Kind.TARGET_NOT_FOUND, e.kind);
        assertEquals("nope", e.entity);

        Block other = new Block("other");
        Disjunction foreign = other.addDisjunction("disj", other.addDisjunct("a"), other.addDisjunct("b"));
        e = assertThrows(GDPException.class, () -> new ConvexHullRelaxation().apply(m, new HullOptions().targets(foreign)));
        assertEquals(Kind.TARGET_NOT_FOUND, e.kind);

        e = assertThrows(GDPException.class, () -> new ConvexHullRelaxation().apply(m, new HullOptions().targets(x)));
        assertEquals(Kind.UNSUPPORTED_TARGET_KIND, e.kind);
        assertTrue(disj.isActive());
    }

    @Test
    void disjunctTargetsRelaxTheDisjunctionsTheyContain() {
        DisjunctData a = d1.addDisjunct("a");
        a.addConstraint("c", null, x, 1.0);
        DisjunctData b = d1.addDisjunct("b");
        b.addConstraint("c", 1.5, x, null);
        Disjunction inner = d1.addDisjunction("inner", a, b);

        new ConvexHullRelaxation().apply(m, new HullOptions().targets("d1"));
        assertFalse(inner.isActive());
        assertTrue(d1.isActive(), "the disjunct itself is not relaxed");
        assertTrue(disj.isActive());
    }

    @Test
    void targetPathsGoThroughScalarDisjuncts() {
        DisjunctData a = d1.addDisjunct("a");
        a.addConstraint("c", null, x, 1.0);
        DisjunctData b = d1.addDisjunct("b");
        b.addConstraint("c", 1.5, x, null);
        Disjunction inner = d1.addDisjunction("inner", a, b);

        RelaxationResult r = new ConvexHullRelaxation().apply(m, new HullOptions().targets("d1.inner"));
        assertEquals(1, r.nRelaxedDisjunctions);
        assertFalse(inner.isActive());
        assertNotNull(r.relaxationBlock(a));
        assertTrue(disj.isActive());
    }

    @Test
    void nestedDisjunctionsMustBeRelaxedFirst() {
        DisjunctData a = d1.addDisjunct("a");
        a.addConstraint("c", null, x, 1.0);
        DisjunctData b = d1.addDisjunct("b");
        b.addConstraint("c", 1.5, x, null);
        d1.addDisjunction("inner", a, b);

        GDPException e = assertThrows(GDPException.class, () -> new ConvexHullRelaxation().apply(m, new HullOptions().targets(disj)));
        assertEquals(Kind.ORDERING_VIOLATION, e.kind);
        assertEquals("d1.a", e.entity);
    }

    @Test
    void nestedDisjunctionsAreRelaxedInnermostFirst() {
        DisjunctData a = d1.addDisjunct("a");
        a.addConstraint("c", null, x, 1.0);
        DisjunctData b = d1.addDisjunct("b");
        b.addConstraint("c", 1.5, x, null);
        Disjunction inner = d1.addDisjunction("inner", a, b);

        RelaxationResult r = new ConvexHullRelaxation().apply(m);
        assertEquals(2, r.nRelaxedDisjunctions);
        assertEquals(4, r.nRelaxedDisjuncts);
        assertFalse(a.isActive());
        assertFalse(d1.isActive());

        Constraint innerXor = r.exclusivityConstraint(inner);
        assertSame(d1, innerXor.parent());
        assertFalse(innerXor.isActive(), "relaxed again with the outer disjunct");
        assertSame(r.relaxationBlock(d1), r.relaxedConstraint(innerXor).parent());
        assertTrue(r.disaggregationConstraint(inner).items().stream().noneMatch(ConstraintData::isActive));
        assertNotNull(r.disaggregatedVariable(d1, a.indicator()), "inner indicators are disaggregated by the outer disjunct");
    }

    @Test
    void blocksInsideDisjunctsAreRelaxed() {
        Block sub = d1.addBlock("sub");
        Constraint k = sub.addConstraint("k", null, x, 1.5);
        d1.addParameter("p", 2);
        RelaxationResult r = new ConvexHullRelaxation().apply(m);
        assertEquals(3, r.nRelaxedConstraints);
        assertFalse(k.isActive());
        assertSame(r.relaxationBlock(d1), r.relaxedConstraint(k).parent());
        assertEquals(1, r.relaxationBlock(d1).components().stream().filter(c -> c instanceof Variable).count(), "x is disaggregated once");
    }

    @Test
    void objectivesInsideDisjunctsAreRejected() {
        d1.addObjective("o", x, Objective.Sense.MINIMIZE);
        GDPException e = assertThrows(GDPException.class, () -> new ConvexHullRelaxation().apply(m));
        assertEquals(Kind.UNSUPPORTED_ENTITY_KIND, e.kind);
        assertEquals("d1.o", e.entity);
    }
}
