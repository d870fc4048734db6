/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package constraints;

import expressions.Expression;
import problem.ComponentVisitor;
import problem.Index;
import problem.IndexedComponent;

/**
 * A (possibly indexed) algebraic constraint component.
 */
public final class Constraint extends IndexedComponent<ConstraintData> {

    public Constraint(String name, boolean indexed) {
        super(name, indexed);
    }

    /**
     * Adds the constraint {@code lower <= body <= upper} at the specified index; a null bound is absent
     */
    public ConstraintData add(Index index, Double lower, Expression body, Double upper) {
        if (lower == null && upper == null)
            throw new IllegalArgumentException("A constraint needs at least one bound: " + name() + index);
        if (lower != null && upper != null && lower > upper)
            throw new IllegalArgumentException("Inconsistent bounds for " + name() + index);
        return put(index, new ConstraintData(this, index, lower, body, upper));
    }

    public ConstraintData add(Index index, Relation relation) {
        return add(index, relation.lower, relation.body, relation.upper);
    }

    @Override
    public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitConstraint(this);
    }
}
