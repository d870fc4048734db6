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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import variables.Variable;

/**
 * The affine form {@code constant + sum(coeff_i * x_i)} of an expression of degree at most 1. Fixed variables are
 * folded into the constant. Terms appear in first-seen order, and terms whose coefficients cancel out are dropped.
 */
public final class LinearRepresentation {

    /**
     * Returns the affine form of the specified expression, or null if the expression is not of degree 0 or 1
     */
    public static LinearRepresentation of(Expression e) {
        int degree = e.polynomialDegree();
        if (degree != 0 && degree != 1)
            return null;
        LinearRepresentation repn = new LinearRepresentation();
        repn.accumulate(e, 1);
        repn.coefficients.values().removeIf(c -> c == 0);
        return repn;
    }

    private double constant;

    private final Map<Variable, Double> coefficients = new LinkedHashMap<>();

    private LinearRepresentation() {
    }

    private void accumulate(Expression e, double factor) {
        if (e instanceof Power && ((Power) e).exponent == 0) {
            constant += factor;
        } else if (e.polynomialDegree() == 0) {
            constant += factor * e.evaluate();
        } else if (e instanceof Variable) {
            coefficients.merge((Variable) e, factor, Double::sum);
        } else if (e instanceof Sum) {
            for (Expression term : ((Sum) e).terms())
                accumulate(term, factor);
        } else if (e instanceof Negation) {
            accumulate(((Negation) e).argument, -factor);
        } else if (e instanceof Product) {
            Product p = (Product) e;
            // the degree is 1, so one side is constant
            if (p.left.polynomialDegree() == 0)
                accumulate(p.right, factor * p.left.evaluate());
            else
                accumulate(p.left, factor * p.right.evaluate());
        } else if (e instanceof Division) {
            Division d = (Division) e;
            accumulate(d.numerator, factor / d.denominator.evaluate());
        } else if (e instanceof Power) {
            accumulate(((Power) e).base, factor); // exponent 1
        } else
            throw new IllegalStateException("Unexpected affine expression " + e);
    }

    public double constant() {
        return constant;
    }

    /**
     * Returns the coefficients of the variables, in first-seen order
     */
    public Map<Variable, Double> coefficients() {
        return Collections.unmodifiableMap(coefficients);
    }

    public double coefficient(Variable x) {
        return coefficients.getOrDefault(x, 0.0);
    }
}
