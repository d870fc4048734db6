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

import problem.IndexedComponent;

/**
 * Deactivates, at the end of a run, the indexed disjunctions and disjuncts whose items are all inactive. Only the
 * containers are touched: indicator variables are left as they are.
 */
public class ContainerChecker {

    private final HullContext ctx;

    public ContainerChecker(HullContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Returns the number of containers deactivated
     */
    public int check() {
        int cnt = 0;
        for (IndexedComponent<?> container : ctx.watchedContainers()) {
            if (!ctx.walker().isActive(container))
                continue;
            if (container.items().stream().noneMatch(ctx.walker()::isActive)) {
                container.deactivateContainer();
                cnt++;
            }
        }
        return cnt;
    }
}
