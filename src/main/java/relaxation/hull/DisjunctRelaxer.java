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
import java.util.List;
import java.util.Map;

import constraints.Constraint;
import constraints.Relation;
import expressions.Constant;
import problem.Block;
import problem.ComponentVisitor;
import problem.Disjunct;
import problem.DisjunctData;
import problem.Disjunction;
import problem.DisjunctionData;
import problem.Index;
import problem.Objective;
import problem.Parameter;
import relaxation.GDPException;
import relaxation.GDPException.Kind;
import relaxation.TransformationLedger.DisjunctRecord;
import utility.Kit;
import variables.Domain;
import variables.Variable;

/**
 * Relaxes one disjunct: creates the disaggregated copies of the variables and their bound constraints
 * {@code y*lb <= v <= y*ub}, then rewrites every constraint found in the disjunct (and its nested blocks).
 *
 * Copies are declared on {@code [min(0,lb), max(0,ub)]} rather than left unbounded: when the disjunct is nested in
 * another one, its copies are variables of the outer disjunct and get disaggregated in turn, which requires bounds.
 */
public class DisjunctRelaxer {

    private final HullContext ctx;

    private final ConstraintRelaxer constraintRelaxer;

    public DisjunctRelaxer(HullContext ctx) {
        this.ctx = ctx;
        this.constraintRelaxer = new ConstraintRelaxer(ctx);
    }

    /**
     * Relaxes the specified disjunct
     *
     * @param disjunct
     *            the disjunct to relax
     * @param variables
     *            the variables to disaggregate, in the order their copies must be created
     */
    public void relax(DisjunctData disjunct, List<Variable> variables) {
        DisjunctRecord record = ctx.ledger().disjunct(disjunct);
        if (!ctx.walker().isActive(disjunct) && record == null) {
            // deactivated by the user: the disjunct cannot be selected
            disjunct.indicator().fix(0);
            return;
        }
        if (record != null) {
            if (!record.strategy.equals(HullContext.STRATEGY))
                Kit.log.warning("GDP(CHull): " + disjunct.fullName() + " was relaxed by " + record.strategy + "; skipped");
            return;
        }

        for (Variable x : variables)
            if (!x.hasBothBounds())
                throw new GDPException(Kind.UNBOUNDED_DISAGGREGATION_VARIABLE, x.fullName(),
                        "Variables that appear in disjuncts must be bounded in order to use the chull transformation! Missing bound for "
                                + x.fullName() + ".");

        Block relaxationBlock = ctx.newRelaxationBlock();
        record = ctx.ledger().open(disjunct, HullContext.STRATEGY, relaxationBlock);
        ctx.watch(disjunct.owner());

        Variable y = disjunct.indicator();
        Map<Variable, Variable> varMap = new LinkedHashMap<>();
        Map<Variable, Constant> zeroMap = new LinkedHashMap<>();
        for (Variable x : variables) {
            double lb = x.lb(), ub = x.ub();
            // names may collide since variables come from different blocks
            Variable copy = relaxationBlock.add(new Variable(relaxationBlock.uniqueName(x.name()), Domain.REALS, Math.min(0, lb), Math.max(0, ub)));
            Constraint bounds = relaxationBlock.add(new Constraint(relaxationBlock.uniqueName(copy.name() + "_bounds"), true));
            bounds.add(Index.of(ConstraintRelaxer.LB), Relation.atMost(y.times(lb), copy));
            bounds.add(Index.of(ConstraintRelaxer.UB), Relation.atMost(copy, y.times(ub)));
            ctx.ledger().addDisaggregatedVariable(record, x, copy, bounds);
            varMap.put(x, copy);
            zeroMap.put(x, Constant.ZERO);
        }

        ctx.walker().walk(disjunct, new Handler(disjunct, relaxationBlock, varMap, zeroMap));

        disjunct.deactivate();
        if (ctx.options().relaxIndicators())
            y.relax();
        ctx.ledger().markRelaxed(record);
        Kit.log.fine(() -> "GDP(CHull): relaxed " + disjunct.fullName() + " with " + variables.size() + " disaggregated variables");
    }

    /**
     * Decides what to do with each component found inside the disjunct being relaxed
     */
    private class Handler implements ComponentVisitor<Void> {

        private final DisjunctData disjunct;

        private final Block relaxationBlock;

        private final Map<Variable, Variable> varMap;

        private final Map<Variable, Constant> zeroMap;

        Handler(DisjunctData disjunct, Block relaxationBlock, Map<Variable, Variable> varMap, Map<Variable, Constant> zeroMap) {
            this.disjunct = disjunct;
            this.relaxationBlock = relaxationBlock;
            this.varMap = varMap;
            this.zeroMap = zeroMap;
        }

        @Override
        public Void visitConstraint(Constraint constraint) {
            constraintRelaxer.relax(constraint, disjunct, relaxationBlock, varMap, zeroMap);
            return null;
        }

        /**
         * A block inside a disjunct is handled as if its components were on the disjunct
         */
        @Override
        public Void visitBlock(Block block) {
            ctx.walker().walk(block, this);
            return null;
        }

        @Override
        public Void visitVariable(Variable variable) {
            return null;
        }

        @Override
        public Void visitParameter(Parameter parameter) {
            return null;
        }

        @Override
        public Void visitObjective(Objective objective) {
            throw new GDPException(Kind.UNSUPPORTED_ENTITY_KIND, objective.fullName(),
                    "No chull transformation handler for objective " + objective.fullName() + " found in disjunct " + disjunct.fullName());
        }

        /**
         * An active disjunction here has not been transformed before the disjunct that contains it
         */
        @Override
        public Void visitDisjunction(Disjunction disjunction) {
            DisjunctionData untransformed = disjunction.items().stream().filter(ctx.walker()::isActive).findFirst().orElse(null);
            if (untransformed == null) {
                disjunction.deactivateContainer();
                return null;
            }
            throw new GDPException(Kind.ORDERING_VIOLATION, untransformed.fullName(), "Found untransformed disjunction " + untransformed.fullName()
                    + " in disjunct " + disjunct.fullName() + "! The disjunction must be transformed before the disjunct. "
                    + "If you are using targets, put the disjunction before the disjunct in the list.");
        }

        @Override
        public Void visitDisjunct(Disjunct inner) {
            DisjunctData untransformed = inner.items().stream().filter(ctx.walker()::isActive).findFirst().orElse(null);
            if (untransformed == null) {
                inner.deactivateContainer();
                return null;
            }
            throw new GDPException(Kind.ORDERING_VIOLATION, untransformed.fullName(),
                    "Found active disjunct " + untransformed.fullName() + " in disjunct " + disjunct.fullName() + "! Either " + untransformed.fullName()
                            + " is not in a disjunction or the disjunction it is in has not been transformed. " + untransformed.fullName()
                            + " needs to be deactivated or its disjunction transformed before " + disjunct.fullName() + " can be transformed.");
        }
    }
}
