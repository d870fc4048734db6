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

import java.util.LinkedHashMap;
import java.util.Map;

import constraints.Constraint;
import constraints.ConstraintData;
import constraints.Relation;
import expressions.Constant;
import expressions.Expression;
import problem.Block;
import problem.DisjunctData;
import relaxation.HullOptions.Mode;
import utility.Kit;
import variables.Variable;

/**
 * Rewrites the constraints of a disjunct through the perspective function of their body.
 *
 * For an affine body h, the constraint L <= h(x) <= U becomes
 * <pre>
 *   L*y <= h(v) - (1-y)*h(0) <= U*y
 * </pre>
 * where v are the disaggregated copies of x and y the indicator of the disjunct. For other bodies, h(v) is replaced by
 * one of three perspective functions P (see {@link Mode}), and the constraint becomes {@code L*y <= P <= U*y}.
 *
 * Each bound gives a separate constraint, indexed by the index of the original item followed by "lb" or "ub".
 */
public class ConstraintRelaxer {

    public static final String LB = "lb", UB = "ub";

    private final HullContext ctx;

    public ConstraintRelaxer(HullContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Relaxes every active item of the specified constraint, which is found inside the specified disjunct
     *
     * @param c
     *            the constraint to relax
     * @param disjunct
     *            the disjunct whose indicator variable scales the constraint
     * @param relaxationBlock
     *            the block where the new constraint is put
     * @param varMap
     *            the map from disaggregated variables to their copies
     * @param zeroMap
     *            the map from disaggregated variables to 0
     */
    public void relax(Constraint c, DisjunctData disjunct, Block relaxationBlock, Map<Variable, Variable> varMap, Map<Variable, Constant> zeroMap) {
        Constraint relaxed = ctx.ledger().relaxedConstraint(c);
        if (relaxed == null) {
            relaxed = relaxationBlock.add(new Constraint(relaxationBlock.uniqueName(c.name()), true));
            ctx.ledger().addRelaxedConstraint(c, relaxed);
        }
        Mode mode = ctx.options().mode();
        double eps = ctx.options().eps();
        Variable y = disjunct.indicator();

        for (ConstraintData cd : c.items()) {
            if (!ctx.walker().isActive(cd))
                continue;
            cd.deactivate();

            int degree = cd.body.polynomialDegree();
            boolean nonlinear = degree != 0 && degree != 1;

            // the body at the origin must be computed before substituting the disaggregated variables
            Expression h0 = !nonlinear || mode == Mode.ROBUST ? cd.body.substitute(zeroMap) : null;

            Expression expr;
            if (!nonlinear)
                expr = cd.body.substitute(varMap);
            else {
                Expression scale = mode == Mode.CLASSICAL ? y : mode == Mode.REGULARIZED ? y.plus(eps) : new Constant(1 - eps).times(y).plus(eps);
                Map<Variable, Expression> scaledMap = new LinkedHashMap<>();
                for (Map.Entry<Variable, Variable> entry : varMap.entrySet())
                    scaledMap.put(entry.getKey(), entry.getValue().dividedBy(scale));
                Expression sub = cd.body.substitute(scaledMap);
                if (mode == Mode.CLASSICAL)
                    expr = sub.times(y);
                else if (mode == Mode.REGULARIZED)
                    expr = scale.times(sub);
                else
                    expr = scale.times(sub).minus(new Constant(eps).times(h0).times(Constant.ONE.minus(y)));
            }
            if (!nonlinear)
                expr = expr.minus(Constant.ONE.minus(y).times(h0));

            if (cd.lower != null) {
                Kit.log.fine(() -> "GDP(CHull): relaxing lower bound of " + cd.fullName());
                relaxed.add(cd.index().append(LB), Relation.atLeast(expr, new Constant(cd.lower).times(y)));
            }
            if (cd.upper != null) {
                Kit.log.fine(() -> "GDP(CHull): relaxing upper bound of " + cd.fullName());
                relaxed.add(cd.index().append(UB), Relation.atMost(expr, new Constant(cd.upper).times(y)));
            }
            ctx.countConstraint();
        }
    }
}
