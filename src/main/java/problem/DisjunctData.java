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

import variables.Domain;
import variables.Variable;

/**
 * A disjunct: a block of components that must hold when the disjunct is selected, together with its binary indicator
 * variable (equal to 1 iff the disjunct is selected).
 */
public final class DisjunctData extends Block implements ComponentData {

    /**
     * The local name of the indicator variable declared on every disjunct
     */
    public static final String INDICATOR = "indicator_var";

    private final Disjunct owner;

    private final Index index;

    private final Variable indicator;

    DisjunctData(Disjunct owner, Index index) {
        super(owner.name() + index);
        this.owner = owner;
        this.index = index;
        this.indicator = add(new Variable(INDICATOR, Domain.BINARY, 0.0, 1.0));
    }

    @Override
    public Disjunct owner() {
        return owner;
    }

    @Override
    public Index index() {
        return index;
    }

    @Override
    public Block parent() {
        return owner.parent();
    }

    public Variable indicator() {
        return indicator;
    }

    @Override
    public void deactivate() {
        super.deactivate();
        owner.itemDeactivated(this);
    }
}
