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

/**
 * A base raised to a constant exponent.
 */
public final class Power implements Expression {

    public final Expression base;

    public final double exponent;

    public Power(Expression base, double exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    @Override
    public void collectVariables(Set<Variable> into, boolean includeFixed) {
        base.collectVariables(into, includeFixed);
    }

    @Override
    public int polynomialDegree() {
        int d = base.polynomialDegree();
        if (d == 0 || exponent == 0)
            return 0;
        if (d == NONPOLYNOMIAL || exponent < 0 || exponent != Math.rint(exponent))
            return NONPOLYNOMIAL;
        return d * (int) exponent;
    }

    @Override
    public Expression substitute(Map<Variable, ? extends Expression> substitutions) {
        return new Power(base.substitute(substitutions), exponent);
    }

    @Override
    public double evaluate() {
        return Math.pow(base.evaluate(), exponent);
    }

    @Override
    public String toString() {
        return Expressions.wrap(base, !base.isAtomic()) + "^" + Kit.format(exponent);
    }
}
