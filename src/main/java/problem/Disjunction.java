/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

/**
 * A (possibly indexed) component whose items are disjunctions, i.e., logical choices among disjuncts.
 */
public final class Disjunction extends IndexedComponent<DisjunctionData> {

    public Disjunction(String name, boolean indexed) {
        super(name, indexed);
    }

    /**
     * Adds a disjunction over the specified disjuncts at the specified index
     *
     * @param index
     *            the index of the new item
     * @param xor
     *            true if exactly one disjunct must be selected, false if at least one
     * @param disjuncts
     *            the disjuncts of the disjunction
     * @return the new item
     */
    public DisjunctionData add(Index index, boolean xor, DisjunctData... disjuncts) {
        if (disjuncts.length == 0)
            throw new IllegalArgumentException("A disjunction needs at least one disjunct");
        return put(index, new DisjunctionData(this, index, xor, disjuncts));
    }

    @Override
    public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitDisjunction(this);
    }
}
