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

/**
 * Raised when a disjunctive model cannot be relaxed. These are modeling errors: the transformation stops at once, and
 * the model is left as it is at that point (possibly partially transformed).
 */
public class GDPException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static enum Kind {
        /** a target does not resolve against the model */
        TARGET_NOT_FOUND,
        /** a target is not a block, a disjunct or a disjunction */
        UNSUPPORTED_TARGET_KIND,
        /** a disjunction is not an exclusive or */
        NON_EXCLUSIVE_DISJUNCTION,
        /** a variable to be disaggregated misses a bound */
        UNBOUNDED_DISAGGREGATION_VARIABLE,
        /** a component inside a disjunct cannot be relaxed */
        UNSUPPORTED_ENTITY_KIND,
        /** an untransformed disjunction or an active disjunct is found inside a disjunct being relaxed */
        ORDERING_VIOLATION,
        /** an invalid formulation mode is asked for */
        UNKNOWN_FORMULATION_MODE;
    }

    public final Kind kind;

    /**
     * The name of the offending entity (or option value)
     */
    public final String entity;

    public GDPException(Kind kind, String entity, String message) {
        super(message);
        this.kind = kind;
        this.entity = entity;
    }
}
