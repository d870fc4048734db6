/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package relaxation.hull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import constraints.Constraint;
import constraints.ConstraintData;
import constraints.Relation;
import expressions.Constant;
import expressions.Expression;
import expressions.Expressions;
import problem.Block;
import problem.DisjunctData;
import problem.Disjunction;
import problem.DisjunctionData;
import relaxation.GDPException;
import relaxation.GDPException.Kind;
import relaxation.TransformationLedger.DisjunctRecord;
import relaxation.TransformationLedger.DisjunctionRecord;
import utility.Kit;
import variables.Variable;

/**
 * Relaxes disjunctions. For each disjunction, the exclusivity constraint {@code sum(y_k) = 1} and, for each variable x
 * appearing in its disjuncts, the disaggregation constraint {@code x = sum(v_k)} are put on the block where the
 * disjunction is declared. Each disjunct is then relaxed by a {@link DisjunctRelaxer}.
 */
public class DisjunctionRelaxer {

    private final HullContext ctx;

    private final DisjunctRelaxer disjunctRelaxer;

    public DisjunctionRelaxer(HullContext ctx) {
        this.ctx = ctx;
        this.disjunctRelaxer = new DisjunctRelaxer(ctx);
    }

    /**
     * Relaxes all active items of the specified disjunction, and then deactivates it
     */
    public void relax(Disjunction disjunction) {
        for (DisjunctionData item : disjunction.items())
            if (ctx.walker().isActive(item))
                relax(item);
        disjunction.deactivate();
    }

    public void relax(DisjunctionData item) {
        if (!item.xor)
            throw new GDPException(Kind.NON_EXCLUSIVE_DISJUNCTION, item.fullName(),
                    "Cannot do convex hull transformation for disjunction " + item.fullName() + " with or constraint. Must be an xor!");
        Disjunction disjunction = item.owner();
        ctx.watch(disjunction);
        DisjunctionRecord record = constraintsOf(disjunction);

        List<Variable> variables = variablesToDisaggregate(item);

        List<Expression> indicators = new ArrayList<>();
        for (DisjunctData disjunct : item.disjuncts()) {
            indicators.add(disjunct.indicator());
            disjunctRelaxer.relax(disjunct, variables);
        }
        record.exclusivity.add(item.index(), Relation.equal(Expressions.sum(indicators), Constant.ONE));

        for (int i = 0; i < variables.size(); i++) {
            Variable x = variables.get(i);
            List<Expression> copies = new ArrayList<>();
            for (DisjunctData disjunct : item.disjuncts()) {
                // disjuncts excluded by the user have no copy (the copy would be 0)
                DisjunctRecord dr = ctx.ledger().disjunct(disjunct);
                Variable copy = dr == null ? null : dr.disaggregatedVariables().get(x);
                if (copy != null)
                    copies.add(copy);
            }
            record.disaggregation.add(item.index().append(i), Relation.equal(x, Expressions.sum(copies)));
        }
        item.deactivate();
        ctx.countDisjunction();
        Kit.log.fine(() -> "GDP(CHull): relaxed " + item.fullName() + " (" + item.disjuncts().size() + " disjuncts, " + variables.size()
                + " disaggregated variables)");
    }

    /**
     * Returns the exclusivity and disaggregation constraints of the specified disjunction, creating them on its parent
     * block the first time
     */
    private DisjunctionRecord constraintsOf(Disjunction disjunction) {
        DisjunctionRecord record = ctx.ledger().disjunction(disjunction);
        if (record != null)
            return record;
        Block parent = disjunction.parent();
        String prefix = HullContext.SCOPE_NAME + "_" + disjunction.name();
        Constraint exclusivity = parent.add(new Constraint(parent.uniqueName(prefix + "_xor"), disjunction.isIndexed()));
        Constraint disaggregation = parent.add(new Constraint(parent.uniqueName(prefix + "_disaggregation"), true));
        return ctx.ledger().addDisjunction(disjunction, exclusivity, disaggregation);
    }

    /**
     * Returns the non-fixed variables of the active constraints of the active disjuncts of the specified disjunction,
     * in the order they are first found
     */
    private List<Variable> variablesToDisaggregate(DisjunctionData item) {
        Set<Variable> set = new LinkedHashSet<>();
        for (DisjunctData disjunct : item.disjuncts()) {
            if (!ctx.walker().isActive(disjunct))
                continue;
            for (ConstraintData cd : ctx.walker().constraints(disjunct))
                cd.body.collectVariables(set, false);
        }
        return new ArrayList<>(set);
    }
}
