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

import java.util.List;

public final class DisjunctionData implements ComponentData {

    private final Disjunction owner;

    private final Index index;

    /**
     * true if exactly one disjunct must be selected (exclusive or), false if at least one
     */
    public final boolean xor;

    private final List<DisjunctData> disjuncts;

    private boolean active = true;

    DisjunctionData(Disjunction owner, Index index, boolean xor, DisjunctData[] disjuncts) {
        this.owner = owner;
        this.index = index;
        this.xor = xor;
        this.disjuncts = List.of(disjuncts);
    }

    @Override
    public Disjunction owner() {
        return owner;
    }

    @Override
    public Index index() {
        return index;
    }

    @Override
    public String name() {
        return owner.name() + index;
    }

    /**
     * Returns the disjuncts of this disjunction, in declaration order
     */
    public List<DisjunctData> disjuncts() {
        return disjuncts;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void deactivate() {
        active = false;
        owner.itemDeactivated(this);
    }

    @Override
    public String toString() {
        return fullName();
    }
}
