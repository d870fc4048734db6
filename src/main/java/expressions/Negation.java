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

public final class Negation implements Expression {

    public final Expression argument;

    public Negation(Expression argument) {
        this.argument = argument;
    }

    @Override
    public void collectVariables(Set<Variable> into, boolean includeFixed) {
        argument.collectVariables(into, includeFixed);
    }

    @Override
    public int polynomialDegree() {
        return argument.polynomialDegree();
    }

    @Override
    public Expression substitute(Map<Variable, ? extends Expression> substitutions) {
        return new Negation(argument.substitute(substitutions));
    }

    @Override
    public double evaluate() {
        return -argument.evaluate();
    }

    @Override
    public String toString() {
        return "-" + Expressions.wrap(argument, !argument.isAtomic());
    }
}
