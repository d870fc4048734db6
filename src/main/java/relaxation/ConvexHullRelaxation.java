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

import java.util.List;

import problem.Activatable;
import problem.Block;
import problem.Component;
import problem.ComponentData;
import problem.Disjunct;
import problem.DisjunctData;
import problem.Disjunction;
import problem.DisjunctionData;
import relaxation.GDPException.Kind;
import relaxation.hull.ContainerChecker;
import relaxation.hull.DisjunctionRelaxer;
import relaxation.hull.HullContext;
import utility.Kit;

/**
 * Convex hull relaxation of a generalized disjunctive program. Each disjunction is replaced by the exclusivity
 * constraint on the indicator variables of its disjuncts, and each variable of a disjunct is disaggregated into one
 * copy per disjunct; constraints of disjuncts are rewritten over the copies through perspective functions.
 *
 * The model is modified in place. Original disjunctions, disjuncts and constraints are deactivated, never removed.
 * A run stops on the first {@link GDPException}, leaving the model partially transformed: callers that need
 * atomicity must keep a copy of their model.
 *
 * The same object can be applied several times: components relaxed by a previous run are recognized through the
 * ledger and left untouched.
 */
public class ConvexHullRelaxation {

    private final TransformationLedger ledger;

    public ConvexHullRelaxation() {
        this(new TransformationLedger());
    }

    /**
     * Builds a relaxation recording (and looking up) what is transformed in the specified ledger
     */
    public ConvexHullRelaxation(TransformationLedger ledger) {
        this.ledger = ledger;
    }

    public TransformationLedger ledger() {
        return ledger;
    }

    public RelaxationResult apply(Block instance) {
        return apply(instance, new HullOptions());
    }

    /**
     * Relaxes the targets of the specified options (the whole model by default)
     *
     * @param instance
     *            the root block of the model
     * @param options
     *            the options of the run
     * @return what was generated
     */
    public RelaxationResult apply(Block instance, HullOptions options) {
        Kit.log.config("GDP(CHull): " + options);
        HullContext ctx = new HullContext(instance, options, ledger);
        DisjunctionRelaxer relaxer = new DisjunctionRelaxer(ctx);

        List<Object> targets = options.targets() == null ? List.of(instance) : options.targets();
        for (Object target : targets) {
            Object t = resolve(instance, target);
            if (!ctx.walker().isActive((Activatable) t))
                continue;
            if (t instanceof Disjunction)
                relaxer.relax((Disjunction) t);
            else if (t instanceof DisjunctionData)
                relaxer.relax((DisjunctionData) t);
            else if (t instanceof Disjunct) {
                for (DisjunctData d : ((Disjunct) t).items())
                    if (ctx.walker().isActive(d))
                        relaxBlock(ctx, relaxer, d);
            } else if (t instanceof Block)
                relaxBlock(ctx, relaxer, (Block) t);
            else
                throw new GDPException(Kind.UNSUPPORTED_TARGET_KIND, String.valueOf(t), "Target " + t
                        + " was not a Block, Disjunct, or Disjunction. It was of type " + t.getClass().getSimpleName() + " and can't be transformed");
        }

        int nDeactivated = new ContainerChecker(ctx).check();
        RelaxationResult result = new RelaxationResult(ctx.scope(), ctx.relaxationBlocks(), ledger, ctx.nRelaxedDisjunctions(), ctx.nRelaxedConstraints(),
                nDeactivated);
        Kit.log.config("GDP(CHull): " + result.nRelaxedDisjunctions + " disjunctions, " + result.nRelaxedDisjuncts + " disjuncts, "
                + result.nRelaxedConstraints + " constraints relaxed");
        return result;
    }

    private void relaxBlock(HullContext ctx, DisjunctionRelaxer relaxer, Block block) {
        for (Disjunction disjunction : ctx.walker().disjunctions(block))
            relaxer.relax(disjunction);
    }

    /**
     * Returns the component or item designated by the specified target, checking that it belongs to the specified model
     */
    private Object resolve(Block instance, Object target) {
        if (target instanceof String) {
            Object t = instance.find((String) target);
            if (t == null)
                throw new GDPException(Kind.TARGET_NOT_FOUND, (String) target, "Target " + target + " is not a component on the instance!");
            return t;
        }
        Block root;
        if (target instanceof Block)
            root = ((Block) target).root();
        else if (target instanceof Component)
            root = ((Component) target).parent() == null ? null : ((Component) target).parent().root();
        else if (target instanceof ComponentData)
            root = ((ComponentData) target).owner().parent() == null ? null : ((ComponentData) target).owner().parent().root();
        else
            throw new GDPException(Kind.UNSUPPORTED_TARGET_KIND, String.valueOf(target), "Target " + target + " is not a model component");
        if (root != instance)
            throw new GDPException(Kind.TARGET_NOT_FOUND, String.valueOf(target), "Target " + target + " is not a component on the instance!");
        return target;
    }
}
