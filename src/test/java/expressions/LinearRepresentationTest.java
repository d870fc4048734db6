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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import problem.Block;
import variables.Variable;

final class LinearRepresentationTest {

    private final Block m = new Block("m");

    private final Variable x = m.addVariable("x", 0.0, 10.0);

    private final Variable y = m.addVariable("y", 0.0, 10.0);

    @Test
    void affineFormIsCollected() {
        // 3 - 2*(x - 4*y) + x/2
        Expression e = new Constant(3).minus(new Constant(2).times(x.minus(y.times(4)))).plus(x.dividedBy(2));
        LinearRepresentation repn = LinearRepresentation.of(e);
        assertEquals(3, repn.constant(), 1e-12);
        assertEquals(-1.5, repn.coefficient(x), 1e-12);
        assertEquals(8, repn.coefficient(y), 1e-12);
        assertEquals(List.of(x, y), List.copyOf(repn.coefficients().keySet()), "first-seen order");
    }

    @Test
    void fixedVariablesAreFolded() {
        y.fix(5);
        LinearRepresentation repn = LinearRepresentation.of(x.times(y).plus(y));
        assertEquals(5, repn.constant(), 1e-12);
        assertEquals(5, repn.coefficient(x), 1e-12);
        assertEquals(1, repn.coefficients().size());
    }

    @Test
    void cancelledTermsAreDropped() {
        LinearRepresentation repn = LinearRepresentation.of(x.minus(x).plus(2));
        assertTrue(repn.coefficients().isEmpty());
        assertEquals(2, repn.constant(), 1e-12);
    }

    @Test
    void nonAffineExpressionsHaveNoRepresentation() {
        assertNull(LinearRepresentation.of(x.times(y)));
        assertNull(LinearRepresentation.of(Expressions.log(x)));
        assertEquals(1, LinearRepresentation.of(x.pow(0)).constant(), 1e-12);
    }
}
