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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static utility.Kit.control;

import constraints.Constraint;
import problem.Block;
import problem.Disjunction;
import problem.DisjunctData;
import variables.Variable;

/**
 * Records what has been transformed and what was generated from what. The ledger is kept aside from the model: nothing
 * is stored on model components. All maps are keyed by identity (components do not redefine equals) and keep insertion
 * order.
 *
 * A ledger may be shared by several transformations; each disjunct record names the strategy that relaxed it.
 */
public class TransformationLedger {

    /**
     * What is known about a disjunct handled by a transformation
     */
    public static final class DisjunctRecord {

        public final DisjunctData source;

        /**
         * The name of the transformation that owns this disjunct
         */
        public final String strategy;

        /**
         * The block holding the components generated for this disjunct, or null if the disjunct was relaxed elsewhere
         */
        public final Block relaxationBlock;

        private final Map<Variable, Variable> disaggregatedVariables = new LinkedHashMap<>();

        private final Map<Variable, Constraint> boundConstraints = new LinkedHashMap<>();

        private boolean relaxed;

        DisjunctRecord(DisjunctData source, String strategy, Block relaxationBlock) {
            this.source = source;
            this.strategy = strategy;
            this.relaxationBlock = relaxationBlock;
        }

        /**
         * Returns the map from original variables to their disaggregated copies, in disaggregation order
         */
        public Map<Variable, Variable> disaggregatedVariables() {
            return Collections.unmodifiableMap(disaggregatedVariables);
        }

        /**
         * Returns the map from original variables to the constraints bounding their copies
         */
        public Map<Variable, Constraint> boundConstraints() {
            return Collections.unmodifiableMap(boundConstraints);
        }

        public boolean isRelaxed() {
            return relaxed;
        }
    }

    /**
     * The constraints generated on the parent block of a disjunction
     */
    public static final class DisjunctionRecord {

        public final Constraint exclusivity;

        public final Constraint disaggregation;

        DisjunctionRecord(Constraint exclusivity, Constraint disaggregation) {
            this.exclusivity = exclusivity;
            this.disaggregation = disaggregation;
        }
    }

    private final Map<DisjunctData, DisjunctRecord> disjuncts = new LinkedHashMap<>();

    private final Map<Block, DisjunctRecord> relaxationBlocks = new LinkedHashMap<>();

    private final Map<Disjunction, DisjunctionRecord> disjunctions = new LinkedHashMap<>();

    private final Map<Variable, Variable> sourceVariables = new LinkedHashMap<>();

    private final Map<Constraint, Variable> boundConstraintSources = new LinkedHashMap<>();

    private final Map<Constraint, Constraint> relaxedConstraints = new LinkedHashMap<>();

    private final Map<Constraint, Constraint> sourceConstraints = new LinkedHashMap<>();

    /**
     * Opens a record for the specified disjunct, whose generated components will be put on the specified block
     */
    public DisjunctRecord open(DisjunctData disjunct, String strategy, Block relaxationBlock) {
        control(!disjuncts.containsKey(disjunct), () -> disjunct.fullName() + " already has a record");
        DisjunctRecord record = new DisjunctRecord(disjunct, strategy, relaxationBlock);
        disjuncts.put(disjunct, record);
        if (relaxationBlock != null)
            relaxationBlocks.put(relaxationBlock, record);
        return record;
    }

    /**
     * Records that the specified disjunct has been relaxed by the specified strategy, outside of any hull relaxation
     */
    public DisjunctRecord markRelaxed(DisjunctData disjunct, String strategy) {
        DisjunctRecord record = open(disjunct, strategy, null);
        record.relaxed = true;
        return record;
    }

    public void markRelaxed(DisjunctRecord record) {
        record.relaxed = true;
    }

    /**
     * Returns the record of the specified disjunct, or null
     */
    public DisjunctRecord disjunct(DisjunctData disjunct) {
        return disjuncts.get(disjunct);
    }

    /**
     * Returns the record of the disjunct whose generated components are on the specified block, or null
     */
    public DisjunctRecord relaxationBlock(Block block) {
        return relaxationBlocks.get(block);
    }

    public void addDisaggregatedVariable(DisjunctRecord record, Variable original, Variable copy, Constraint bounds) {
        record.disaggregatedVariables.put(original, copy);
        record.boundConstraints.put(original, bounds);
        sourceVariables.put(copy, original);
        boundConstraintSources.put(bounds, original);
    }

    /**
     * Returns the original variable of the specified disaggregated copy, or null
     */
    public Variable sourceVariable(Variable copy) {
        return sourceVariables.get(copy);
    }

    /**
     * Returns the original variable bounded by the specified bound constraint, or null
     */
    public Variable boundConstraintSource(Constraint bounds) {
        return boundConstraintSources.get(bounds);
    }

    public DisjunctionRecord disjunction(Disjunction disjunction) {
        return disjunctions.get(disjunction);
    }

    public DisjunctionRecord addDisjunction(Disjunction disjunction, Constraint exclusivity, Constraint disaggregation) {
        DisjunctionRecord record = new DisjunctionRecord(exclusivity, disaggregation);
        disjunctions.put(disjunction, record);
        return record;
    }

    public void addRelaxedConstraint(Constraint original, Constraint relaxed) {
        relaxedConstraints.put(original, relaxed);
        sourceConstraints.put(relaxed, original);
    }

    /**
     * Returns the constraint generated from the specified original constraint, or null
     */
    public Constraint relaxedConstraint(Constraint original) {
        return relaxedConstraints.get(original);
    }

    /**
     * Returns the original constraint of the specified generated constraint, or null
     */
    public Constraint sourceConstraint(Constraint relaxed) {
        return sourceConstraints.get(relaxed);
    }

    public Map<Constraint, Constraint> relaxedConstraints() {
        return Collections.unmodifiableMap(relaxedConstraints);
    }

    public Map<Variable, Variable> sourceVariables() {
        return Collections.unmodifiableMap(sourceVariables);
    }
}
