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
import java.util.List;
import java.util.function.Predicate;

import constraints.Constraint;
import constraints.ConstraintData;
import problem.Activatable;
import problem.Block;
import problem.Component;
import problem.ComponentVisitor;
import problem.Disjunct;
import problem.DisjunctData;
import problem.Disjunction;

/**
 * Deterministic traversals of blocks. Components are visited in declaration order, and items of indexed components in
 * increasing order of their indexes. Inactive components and items are never visited; what is active is decided by the
 * predicate given at construction.
 */
public class ModelWalker {

    private final Predicate<Activatable> active;

    public ModelWalker() {
        this(Activatable::isActive);
    }

    public ModelWalker(Predicate<Activatable> active) {
        this.active = active;
    }

    public boolean isActive(Activatable a) {
        return active.test(a);
    }

    /**
     * Returns the active disjunctions found in the specified block, in post-order: those of nested blocks and active
     * disjuncts come before those declared directly on a block.
     */
    public List<Disjunction> disjunctions(Block block) {
        List<Disjunction> list = new ArrayList<>();
        collectDisjunctions(block, list);
        return list;
    }

    private void collectDisjunctions(Block block, List<Disjunction> list) {
        List<Component> components = block.components();
        for (Component c : components) {
            if (!active.test(c))
                continue;
            if (c instanceof Block)
                collectDisjunctions((Block) c, list);
            else if (c instanceof Disjunct)
                for (DisjunctData d : ((Disjunct) c).items())
                    if (active.test(d))
                        collectDisjunctions(d, list);
        }
        for (Component c : components)
            if (c instanceof Disjunction && active.test(c))
                list.add((Disjunction) c);
    }

    /**
     * Returns the active constraint items found in the specified block and its nested blocks (but not in nested
     * disjuncts)
     */
    public List<ConstraintData> constraints(Block block) {
        List<ConstraintData> list = new ArrayList<>();
        for (Component c : block.components()) {
            if (!active.test(c))
                continue;
            if (c instanceof Constraint) {
                for (ConstraintData cd : ((Constraint) c).items())
                    if (active.test(cd))
                        list.add(cd);
            } else if (c instanceof Block)
                list.addAll(constraints((Block) c));
        }
        return list;
    }

    /**
     * Dispatches every active component of the specified block to the specified visitor. The list of components is
     * taken before any visit, so components added meanwhile are not visited.
     */
    public void walk(Block block, ComponentVisitor<?> visitor) {
        for (Component c : block.components())
            if (active.test(c))
                c.accept(visitor);
    }
}
