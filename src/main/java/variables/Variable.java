/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package variables;

import java.util.Map;
import java.util.Set;

import expressions.Expression;
import problem.Component;
import problem.ComponentVisitor;

/**
 * A decision variable. A variable is also the simplest expression: a leaf of expression trees.
 */
public final class Variable extends Component implements Expression {

    private Domain domain;

    /**
     * The lower bound of the variable, or null if absent
     */
    private Double lb;

    /**
     * The upper bound of the variable, or null if absent
     */
    private Double ub;

    private boolean fixed;

    /**
     * The current value of the variable (the fixed value when the variable is fixed), or null
     */
    private Double value;

    public Variable(String name, Domain domain, Double lb, Double ub) {
        super(name);
        if (lb != null && ub != null && lb > ub)
            throw new IllegalArgumentException("Empty domain for " + name + ": [" + lb + "," + ub + "]");
        this.domain = domain;
        this.lb = lb;
        this.ub = ub;
    }

    public Domain domain() {
        return domain;
    }

    public Double lb() {
        return lb;
    }

    public Double ub() {
        return ub;
    }

    public boolean hasBothBounds() {
        return lb != null && ub != null;
    }

    public Variable setBounds(Double lb, Double ub) {
        this.lb = lb;
        this.ub = ub;
        return this;
    }

    /**
     * Relaxes a binary variable into a continuous one over [0,1]
     */
    public void relax() {
        if (domain == Domain.BINARY) {
            domain = Domain.REALS;
            lb = lb == null ? 0.0 : Math.max(lb, 0.0);
            ub = ub == null ? 1.0 : Math.min(ub, 1.0);
        }
    }

    public boolean isFixed() {
        return fixed;
    }

    public void fix(double v) {
        fixed = true;
        value = v;
    }

    public void unfix() {
        fixed = false;
    }

    public Double value() {
        return value;
    }

    public Variable setValue(double v) {
        if (fixed)
            throw new IllegalStateException(fullName() + " is fixed");
        value = v;
        return this;
    }

    @Override
    public void collectVariables(Set<Variable> into, boolean includeFixed) {
        if (includeFixed || !fixed)
            into.add(this);
    }

    @Override
    public int polynomialDegree() {
        return fixed ? 0 : 1;
    }

    @Override
    public Expression substitute(Map<Variable, ? extends Expression> substitutions) {
        Expression e = substitutions.get(this);
        return e == null ? this : e;
    }

    @Override
    public double evaluate() {
        if (value == null)
            throw new IllegalStateException("No value for " + fullName());
        return value;
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return fullName();
    }
}
