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

import java.util.List;

import expressions.UnaryFunction.Function;

/**
 * Static factories for building expressions.
 */
public final class Expressions {

    private Expressions() {
    }

    public static Constant constant(double value) {
        return new Constant(value);
    }

    /**
     * Returns the sum of the specified expressions; the sum of no expression is the constant 0
     */
    public static Expression sum(List<? extends Expression> terms) {
        return terms.isEmpty() ? Constant.ZERO : terms.size() == 1 ? terms.get(0) : new Sum(terms);
    }

    public static Expression sum(Expression... terms) {
        return sum(List.of(terms));
    }

    public static Expression exp(Expression argument) {
        return new UnaryFunction(Function.EXP, argument);
    }

    public static Expression log(Expression argument) {
        return new UnaryFunction(Function.LOG, argument);
    }

    public static Expression sqrt(Expression argument) {
        return new UnaryFunction(Function.SQRT, argument);
    }

    static String wrap(Expression e, boolean parentheses) {
        return parentheses ? "(" + e + ")" : e.toString();
    }
}
