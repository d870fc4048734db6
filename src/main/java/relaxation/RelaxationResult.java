/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package relaxation;

import java.util.List;
import java.util.Optional;

import constraints.Constraint;
import problem.Block;
import problem.DisjunctData;
import problem.Disjunction;
import relaxation.TransformationLedger.DisjunctRecord;
import relaxation.TransformationLedger.DisjunctionRecord;
import variables.Variable;

/**
 * What a run produced. The model itself is modified in place; this object gives access to the generated components.
 */
public class RelaxationResult {

    private final Block scope;

    private final List<Block> relaxationBlocks;

    private final TransformationLedger ledger;

    public final int nRelaxedDisjunctions, nRelaxedDisjuncts, nRelaxedConstraints, nDeactivatedContainers;

    RelaxationResult(Block scope, List<Block> relaxationBlocks, TransformationLedger ledger, int nRelaxedDisjunctions, int nRelaxedConstraints,
            int nDeactivatedContainers) {
        this.scope = scope;
        this.relaxationBlocks = List.copyOf(relaxationBlocks);
        this.ledger = ledger;
        this.nRelaxedDisjunctions = nRelaxedDisjunctions;
        this.nRelaxedDisjuncts = relaxationBlocks.size();
        this.nRelaxedConstraints = nRelaxedConstraints;
        this.nDeactivatedContainers = nDeactivatedContainers;
    }

    /**
     * Returns the block holding everything generated for the disjuncts relaxed by the run, if any disjunct was relaxed
     */
    public Optional<Block> scope() {
        return Optional.ofNullable(scope);
    }

    /**
     * Returns the blocks created for the relaxed disjuncts, in relaxation order
     */
    public List<Block> relaxationBlocks() {
        return relaxationBlocks;
    }

    public TransformationLedger ledger() {
        return ledger;
    }

    /**
     * Returns the block created for the specified disjunct, or null if it was not relaxed by a hull relaxation
     */
    public Block relaxationBlock(DisjunctData disjunct) {
        DisjunctRecord record = ledger.disjunct(disjunct);
        return record == null ? null : record.relaxationBlock;
    }

    /**
     * Returns the disjunct from which the specified relaxation block was generated, or null
     */
    public DisjunctData sourceDisjunct(Block relaxationBlock) {
        DisjunctRecord record = ledger.relaxationBlock(relaxationBlock);
        return record == null ? null : record.source;
    }

    /**
     * Returns the copy of the specified variable for the specified disjunct, or null
     */
    public Variable disaggregatedVariable(DisjunctData disjunct, Variable x) {
        DisjunctRecord record = ledger.disjunct(disjunct);
        return record == null ? null : record.disaggregatedVariables().get(x);
    }

    public Variable sourceVariable(Variable copy) {
        return ledger.sourceVariable(copy);
    }

    /**
     * Returns the constraint bounding the copy of the specified variable for the specified disjunct, or null
     */
    public Constraint boundConstraint(DisjunctData disjunct, Variable x) {
        DisjunctRecord record = ledger.disjunct(disjunct);
        return record == null ? null : record.boundConstraints().get(x);
    }

    public Constraint relaxedConstraint(Constraint original) {
        return ledger.relaxedConstraint(original);
    }

    public Constraint sourceConstraint(Constraint relaxed) {
        return ledger.sourceConstraint(relaxed);
    }

    public Constraint exclusivityConstraint(Disjunction disjunction) {
        DisjunctionRecord record = ledger.disjunction(disjunction);
        return record == null ? null : record.exclusivity;
    }

    public Constraint disaggregationConstraint(Disjunction disjunction) {
        DisjunctionRecord record = ledger.disjunction(disjunction);
        return record == null ? null : record.disaggregation;
    }
}
