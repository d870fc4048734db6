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
 * Anything of a model that can be switched off: components and the items of indexed components.
 */
public interface Activatable {

    boolean isActive();
}
