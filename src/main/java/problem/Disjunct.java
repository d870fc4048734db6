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
 * A (possibly indexed) component whose items are disjuncts, i.e., blocks that are only enforced when selected.
 */
public final class Disjunct extends IndexedComponent<DisjunctData> {

    public Disjunct(String name, boolean indexed) {
        super(name, indexed);
    }

    /**
     * Adds a new disjunct at the specified index, and returns it
     */
    public DisjunctData add(Index index) {
        return put(index, new DisjunctData(this, index));
    }

    public DisjunctData add(Object... parts) {
        return add(Index.of(parts));
    }

    @Override
    public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitDisjunct(this);
    }
}
