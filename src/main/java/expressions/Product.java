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

public final class Product implements Expression {

    public final Expression left, right;

    public Product(Expression left, Expression right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public void collectVariables(Set<Variable> into, boolean includeFixed) {
        left.collectVariables(into, includeFixed);
        right.collectVariables(into, includeFixed);
    }

    @Override
    public int polynomialDegree() {
        int d1 = left.polynomialDegree(), d2 = right.polynomialDegree();
        return d1 == NONPOLYNOMIAL || d2 == NONPOLYNOMIAL ? NONPOLYNOMIAL : d1 + d2;
    }

    @Override
    public Expression substitute(Map<Variable, ? extends Expression> substitutions) {
        return new Product(left.substitute(substitutions), right.substitute(substitutions));
    }

    @Override
    public double evaluate() {
        return left.evaluate() * right.evaluate();
    }

    @Override
    public String toString() {
        return Expressions.wrap(left, left instanceof Sum) + "*" + Expressions.wrap(right, !right.isAtomic() && !(right instanceof Product));
    }
}
