/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package relaxation.hull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import problem.Block;
import problem.IndexedComponent;
import relaxation.HullOptions;
import relaxation.TransformationLedger;

/**
 * Context object shared by the relaxers during one run. It gives access to the options and the ledger, and owns the
 * relaxation block of the run, which is only created when a first disjunct is relaxed.
 */
public class HullContext {

    /**
     * The name under which the relaxation blocks of disjuncts are recorded by the ledger
     */
    public static final String STRATEGY = "chull";

    /**
     * The base name of the block created on the root for holding all generated components of a run
     */
    public static final String SCOPE_NAME = "_gdp_chull_relaxation";

    private final Block instance;

    private final HullOptions options;

    private final TransformationLedger ledger;

    private final ModelWalker walker;

    private Block scope;

    private final List<Block> relaxationBlocks = new ArrayList<>();

    private final Set<IndexedComponent<?>> containers = new LinkedHashSet<>();

    private int nRelaxedDisjunctions, nRelaxedConstraints;

    public HullContext(Block instance, HullOptions options, TransformationLedger ledger) {
        this.instance = instance;
        this.options = options;
        this.ledger = ledger;
        this.walker = new ModelWalker();
    }

    public Block instance() {
        return instance;
    }

    public HullOptions options() {
        return options;
    }

    public TransformationLedger ledger() {
        return ledger;
    }

    public ModelWalker walker() {
        return walker;
    }

    /**
     * Returns the relaxation block of this run, or null if nothing has been relaxed so far
     */
    public Block scope() {
        return scope;
    }

    /**
     * Creates and returns a new block, under the relaxation block of the run, for the components generated for one
     * disjunct
     */
    public Block newRelaxationBlock() {
        if (scope == null)
            scope = instance.add(new Block(instance.uniqueName(SCOPE_NAME)));
        Block block = scope.add(new Block(scope.uniqueName("relaxedDisjunct_" + relaxationBlocks.size())));
        relaxationBlocks.add(block);
        return block;
    }

    public List<Block> relaxationBlocks() {
        return Collections.unmodifiableList(relaxationBlocks);
    }

    /**
     * Remembers an indexed container whose activity must be checked at the end of the run
     */
    public void watch(IndexedComponent<?> container) {
        if (container.isIndexed())
            containers.add(container);
    }

    public Set<IndexedComponent<?>> watchedContainers() {
        return Collections.unmodifiableSet(containers);
    }

    void countDisjunction() {
        nRelaxedDisjunctions++;
    }

    void countConstraint() {
        nRelaxedConstraints++;
    }

    public int nRelaxedDisjunctions() {
        return nRelaxedDisjunctions;
    }

    public int nRelaxedConstraints() {
        return nRelaxedConstraints;
    }
}
