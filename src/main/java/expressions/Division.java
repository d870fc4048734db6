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

import variables.Variable;

public final class Division implements Expression {

    public final Expression numerator, denominator;

    public Division(Expression numerator, Expression denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    @Override
    public void collectVariables(Set<Variable> into, boolean includeFixed) {
        numerator.collectVariables(into, includeFixed);
        denominator.collectVariables(into, includeFixed);
    }

    /**
     * A quotient is a polynomial only when its denominator is constant
     */
    @Override
    public int polynomialDegree() {
        return denominator.polynomialDegree() == 0 ? numerator.polynomialDegree() : NONPOLYNOMIAL;
    }

    @Override
    public Expression substitute(Map<Variable, ? extends Expression> substitutions) {
        return new Division(numerator.substitute(substitutions), denominator.substitute(substitutions));
    }

    @Override
    public double evaluate() {
        return numerator.evaluate() / denominator.evaluate();
    }

    @Override
    public String toString() {
        return Expressions.wrap(numerator, numerator instanceof Sum) + "/" + Expressions.wrap(denominator, !denominator.isAtomic());
    }
}
