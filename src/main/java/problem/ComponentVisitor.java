/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import constraints.Constraint;
import variables.Variable;

/**
 * One method per kind of component. Adding a kind of component means adding a method here, so that every visitor has
 * to decide what to do with it.
 *
 * @param <R>
 *            the type of the values returned by the visitor
 */
public interface ComponentVisitor<R> {

    R visitBlock(Block block);

    R visitDisjunct(Disjunct disjunct);

    R visitDisjunction(Disjunction disjunction);

    R visitConstraint(Constraint constraint);

    R visitVariable(Variable variable);

    R visitParameter(Parameter parameter);

    R visitObjective(Objective objective);
}
