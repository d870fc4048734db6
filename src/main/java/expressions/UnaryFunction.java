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
import java.util.function.DoubleUnaryOperator;

import variables.Variable;

/**
 * A transcendental function applied to an expression.
 */
public final class UnaryFunction implements Expression {

    public static enum Function {
        EXP(Math::exp), LOG(Math::log), SQRT(Math::sqrt), SIN(Math::sin), COS(Math::cos);

        private final DoubleUnaryOperator operator;

        Function(DoubleUnaryOperator operator) {
            this.operator = operator;
        }
    }

    public final Function function;

    public final Expression argument;

    public UnaryFunction(Function function, Expression argument) {
        this.function = function;
        this.argument = argument;
    }

    @Override
    public void collectVariables(Set<Variable> into, boolean includeFixed) {
        argument.collectVariables(into, includeFixed);
    }

    @Override
    public int polynomialDegree() {
        return argument.polynomialDegree() == 0 ? 0 : NONPOLYNOMIAL;
    }

    @Override
    public Expression substitute(Map<Variable, ? extends Expression> substitutions) {
        return new UnaryFunction(function, argument.substitute(substitutions));
    }

    @Override
    public double evaluate() {
        return function.operator.applyAsDouble(argument.evaluate());
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public String toString() {
        return function.name().toLowerCase() + "(" + argument + ")";
    }
}
