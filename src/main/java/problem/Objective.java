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

import expressions.Expression;

/**
 * An objective to be minimized or maximized.
 */
public final class Objective extends Component {

    public static enum Sense {
        MINIMIZE, MAXIMIZE;
    }

    public final Expression expression;

    public final Sense sense;

    public Objective(String name, Expression expression, Sense sense) {
        super(name);
        this.expression = expression;
        this.sense = sense;
    }

    @Override
    public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitObjective(this);
    }
}
