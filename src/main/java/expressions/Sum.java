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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import variables.Variable;

/**
 * An n-ary sum. Nested sums are flattened at construction; the order of terms is kept.
 */
public final class Sum implements Expression {

    private final List<Expression> terms;

    public Sum(List<? extends Expression> terms) {
        List<Expression> list = new ArrayList<>();
        for (Expression term : terms) {
            if (term instanceof Sum)
                list.addAll(((Sum) term).terms);
            else
                list.add(term);
        }
        this.terms = Collections.unmodifiableList(list);
    }

    public List<Expression> terms() {
        return terms;
    }

    @Override
    public void collectVariables(Set<Variable> into, boolean includeFixed) {
        for (Expression term : terms)
            term.collectVariables(into, includeFixed);
    }

    @Override
    public int polynomialDegree() {
        int degree = 0;
        for (Expression term : terms) {
            int d = term.polynomialDegree();
            if (d == NONPOLYNOMIAL)
                return NONPOLYNOMIAL;
            degree = Math.max(degree, d);
        }
        return degree;
    }

    @Override
    public Expression substitute(Map<Variable, ? extends Expression> substitutions) {
        List<Expression> list = new ArrayList<>(terms.size());
        for (Expression term : terms)
            list.add(term.substitute(substitutions));
        return new Sum(list);
    }

    @Override
    public double evaluate() {
        double sum = 0;
        for (Expression term : terms)
            sum += term.evaluate();
        return sum;
    }

    @Override
    public String toString() {
        if (terms.isEmpty())
            return "0";
        StringBuilder sb = new StringBuilder(terms.get(0).toString());
        for (Expression term : terms.subList(1, terms.size())) {
            if (term instanceof Negation)
                sb.append(" - ").append(Expressions.wrap(((Negation) term).argument, ((Negation) term).argument instanceof Sum));
            else
                sb.append(" + ").append(term);
        }
        return sb.toString();
    }
}
