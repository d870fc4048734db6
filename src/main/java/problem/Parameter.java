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

import expressions.Constant;

/**
 * A named numeric value. Expressions refer to it through {@link #asConstant()}.
 */
public final class Parameter extends Component {

    private final double value;

    public Parameter(String name, double value) {
        super(name);
        this.value = value;
    }

    public double value() {
        return value;
    }

    public Constant asConstant() {
        return new Constant(value);
    }

    @Override
    public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }
}
