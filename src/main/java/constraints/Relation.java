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

import expressions.Constant;
import expressions.Expression;

/**
 * A comparison between two expressions, normalized as {@code lower <= body <= upper}. When the right-hand side is a
 * constant, it becomes the bound; otherwise the body is {@code lhs - rhs} compared with 0.
 */
public final class Relation {

    public static Relation atLeast(Expression lhs, Expression rhs) {
        if (rhs instanceof Constant)
            return new Relation(((Constant) rhs).value, lhs, null);
        return new Relation(0.0, lhs.minus(rhs), null);
    }

    public static Relation atMost(Expression lhs, Expression rhs) {
        if (rhs instanceof Constant)
            return new Relation(null, lhs, ((Constant) rhs).value);
        return new Relation(null, lhs.minus(rhs), 0.0);
    }

    public static Relation equal(Expression lhs, Expression rhs) {
        if (rhs instanceof Constant)
            return new Relation(((Constant) rhs).value, lhs, ((Constant) rhs).value);
        return new Relation(0.0, lhs.minus(rhs), 0.0);
    }

    public final Double lower;

    public final Expression body;

    public final Double upper;

    private Relation(Double lower, Expression body, Double upper) {
        this.lower = lower;
        this.body = body;
        this.upper = upper;
    }
}
