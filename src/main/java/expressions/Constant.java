/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import java.util.Map;
import java.util.Set;

import utility.Kit;
import variables.Variable;

public final class Constant implements Expression {

    public static final Constant ZERO = new Constant(0);

    public static final Constant ONE = new Constant(1);

    public final double value;

    public Constant(double value) {
        this.value = value;
    }

    @Override
    public void collectVariables(Set<Variable> into, boolean includeFixed) {
    }

    @Override
    public int polynomialDegree() {
        return 0;
    }

    @Override
    public Expression substitute(Map<Variable, ? extends Expression> substitutions) {
        return this;
    }

    @Override
    public double evaluate() {
        return value;
    }

    @Override
    public boolean isAtomic() {
        return value >= 0;
    }

    @Override
    public String toString() {
        return Kit.format(value);
    }
}
