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
 * An item of an indexed component. The single item of a non-indexed component has index {@link Index#NONE}.
 */
public interface ComponentData extends Activatable {

    IndexedComponent<?> owner();

    Index index();

    /**
     * Returns the name of this item on its block, e.g. c[1] for an indexed component, or c otherwise
     */
    String name();

    default String fullName() {
        return owner().fullName() + index();
    }

    void deactivate();
}
