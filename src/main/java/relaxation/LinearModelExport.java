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

import java.util.LinkedHashMap;
import java.util.Map;

import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;

import constraints.Constraint;
import constraints.ConstraintData;
import expressions.LinearRepresentation;
import problem.Block;
import problem.Component;
import problem.Disjunct;
import problem.Objective;
import utility.Kit;
import variables.Domain;
import variables.Variable;

/**
 * Export of the active part of a model to an ojalgo model. Only affine constraints and objectives are exported; the
 * other ones are relaxed away (ignored). Active disjuncts are not exported: a model should be relaxed first.
 *
 * Variables are created the first time they are met in an exported expression. Fixed variables are folded into
 * constants.
 */
public class LinearModelExport {

    private final ExpressionsBasedModel model = new ExpressionsBasedModel();

    private final Map<Variable, org.ojalgo.optimisation.Variable> lpVars = new LinkedHashMap<>();

    private Objective objective;

    private int nLinear, nNonLinear;

    /**
     * Builds the ojalgo model corresponding to the active part of the specified model
     */
    public LinearModelExport(Block instance) {
        export(instance);
        Kit.log.config("LP model: " + nLinear + " linear constraints, " + nNonLinear + " non-linear (relaxed)");
    }

    private void export(Block block) {
        for (Component c : block.components()) {
            if (!c.isActive())
                continue;
            if (c instanceof Block)
                export((Block) c);
            else if (c instanceof Constraint) {
                for (ConstraintData cd : ((Constraint) c).items())
                    if (cd.isActive())
                        exportConstraint(cd);
            } else if (c instanceof Disjunct) {
                if (((Disjunct) c).items().stream().anyMatch(d -> d.isActive()))
                    Kit.log.warning("LP model: active disjunct " + c.fullName() + " not exported");
            } else if (c instanceof Objective) {
                if (objective != null)
                    Kit.log.warning("LP model: objective " + c.fullName() + " ignored (" + objective.fullName() + " already set)");
                else
                    exportObjective((Objective) c);
            }
        }
    }

    private org.ojalgo.optimisation.Variable lpVar(Variable x) {
        return lpVars.computeIfAbsent(x, k -> {
            org.ojalgo.optimisation.Variable v = org.ojalgo.optimisation.Variable.make(k.fullName());
            if (k.lb() != null)
                v.lower(k.lb());
            if (k.ub() != null)
                v.upper(k.ub());
            if (k.domain() == Domain.BINARY)
                v.binary();
            model.addVariable(v);
            return v;
        });
    }

    private void exportConstraint(ConstraintData cd) {
        LinearRepresentation repn = LinearRepresentation.of(cd.body);
        if (repn == null) {
            nNonLinear++;
            return;
        }
        nLinear++;
        if (repn.coefficients().isEmpty()) {
            double v = repn.constant();
            if ((cd.lower != null && v < cd.lower - 1e-9) || (cd.upper != null && v > cd.upper + 1e-9))
                Kit.log.warning("LP model: constant constraint " + cd.fullName() + " is violated");
            return;
        }
        Expression expr = model.addExpression(cd.fullName());
        repn.coefficients().forEach((x, coeff) -> expr.set(lpVar(x), coeff));
        if (cd.lower != null)
            expr.lower(cd.lower - repn.constant());
        if (cd.upper != null)
            expr.upper(cd.upper - repn.constant());
    }

    private void exportObjective(Objective o) {
        LinearRepresentation repn = LinearRepresentation.of(o.expression);
        if (repn == null) {
            Kit.log.warning("LP model: objective " + o.fullName() + " is not linear and is ignored");
            return;
        }
        objective = o;
        Expression expr = model.addExpression(o.fullName());
        repn.coefficients().forEach((x, coeff) -> expr.set(lpVar(x), coeff));
        expr.weight(1);
    }

    public ExpressionsBasedModel model() {
        return model;
    }

    public int nLinearConstraints() {
        return nLinear;
    }

    public int nNonLinearConstraints() {
        return nNonLinear;
    }

    /**
     * Returns the ojalgo variable of the specified variable, or null if it does not appear in the exported model
     */
    public org.ojalgo.optimisation.Variable lpVariable(Variable x) {
        return lpVars.get(x);
    }

    /**
     * Makes all exported variables continuous, keeping their bounds
     */
    public LinearModelExport relaxIntegrality() {
        lpVars.values().forEach(v -> v.integer(false));
        return this;
    }

    /**
     * Optimizes the exported model according to the sense of the exported objective (minimization by default)
     */
    public Optimisation.Result optimise() {
        Optimisation.Result result = objective != null && objective.sense == Objective.Sense.MAXIMIZE ? model.maximise() : model.minimise();
        Kit.log.config("LP solve state: " + result.getState() + (result.getState().isOptimal() ? ", value: " + result.getValue() : ""));
        return result;
    }

    /**
     * Returns the value of the specified variable in the specified result, or null if it is not in the exported model
     */
    public Double value(Optimisation.Result result, Variable x) {
        org.ojalgo.optimisation.Variable v = lpVars.get(x);
        return v == null ? null : result.doubleValue(model.indexOf(v));
    }
}
