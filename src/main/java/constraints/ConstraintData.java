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
import problem.ComponentData;
import problem.Index;
import utility.Kit;

/**
 * A single constraint {@code lower <= body <= upper}. An equality has both bounds equal.
 */
public final class ConstraintData implements ComponentData {

    private final Constraint owner;

    private final Index index;

    /**
     * The lower bound, or null if absent
     */
    public final Double lower;

    public final Expression body;

    /**
     * The upper bound, or null if absent
     */
    public final Double upper;

    private boolean active = true;

    ConstraintData(Constraint owner, Index index, Double lower, Expression body, Double upper) {
        this.owner = owner;
        this.index = index;
        this.lower = lower;
        this.body = body;
        this.upper = upper;
    }

    @Override
    public Constraint owner() {
        return owner;
    }

    @Override
    public Index index() {
        return index;
    }

    @Override
    public String name() {
        return owner.name() + index;
    }

    public boolean isEquality() {
        return lower != null && lower.equals(upper);
    }

    /**
     * Returns true if the current values of the variables satisfy this constraint, up to the specified tolerance
     */
    public boolean isSatisfied(double tolerance) {
        double v = body.evaluate();
        return (lower == null || v >= lower - tolerance) && (upper == null || v <= upper + tolerance);
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void deactivate() {
        active = false;
        owner.itemDeactivated(this);
    }

    @Override
    public String toString() {
        if (isEquality())
            return body + " == " + Kit.format(lower);
        return (lower == null ? "" : Kit.format(lower) + " <= ") + body + (upper == null ? "" : " <= " + Kit.format(upper));
    }
}
