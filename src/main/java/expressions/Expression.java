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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import variables.Variable;

/**
 * An immutable expression tree over variables and constants. Composition methods never simplify: they build exactly
 * the tree that is asked for.
 */
public interface Expression {

    /**
     * The value returned by {@link #polynomialDegree()} for expressions that are not polynomials
     */
    int NONPOLYNOMIAL = -1;

    /**
     * Adds to the specified set the variables occurring in this expression, in the order of a left-to-right traversal
     *
     * @param into
     *            the set where variables are collected
     * @param includeFixed
     *            if false, fixed variables are ignored
     */
    void collectVariables(Set<Variable> into, boolean includeFixed);

    /**
     * Returns the degree of this expression seen as a polynomial over its non-fixed variables, or NONPOLYNOMIAL
     */
    int polynomialDegree();

    /**
     * Returns a copy of this expression where each variable that is a key of the specified map is replaced by the
     * associated expression. This expression is left untouched.
     */
    Expression substitute(Map<Variable, ? extends Expression> substitutions);

    /**
     * Returns the value of this expression, computed from the current values of its variables
     *
     * @throws IllegalStateException
     *             if a variable has no value
     */
    double evaluate();

    /**
     * Returns true if this expression never needs parentheses when printed
     */
    default boolean isAtomic() {
        return false;
    }

    /**
     * Returns the non-fixed variables of this expression, in first-seen order
     */
    default Set<Variable> variables() {
        Set<Variable> set = new LinkedHashSet<>();
        collectVariables(set, false);
        return set;
    }

    default Expression plus(Expression other) {
        return new Sum(List.of(this, other));
    }

    default Expression plus(double value) {
        return plus(new Constant(value));
    }

    default Expression minus(Expression other) {
        return new Sum(List.of(this, other.negate()));
    }

    default Expression minus(double value) {
        return minus(new Constant(value));
    }

    default Expression negate() {
        return new Negation(this);
    }

    default Expression times(Expression other) {
        return new Product(this, other);
    }

    default Expression times(double value) {
        return times(new Constant(value));
    }

    default Expression dividedBy(Expression other) {
        return new Division(this, other);
    }

    default Expression dividedBy(double value) {
        return dividedBy(new Constant(value));
    }

    default Expression pow(double exponent) {
        return new Power(this, exponent);
    }
}
