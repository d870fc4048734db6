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
 * A named element declared on a block. Components are identified by reference: two distinct objects are two distinct
 * components, even when they carry the same name.
 */
public abstract class Component implements Activatable {

    private final String name;

    private Block parent;

    private boolean active = true;

    protected Component(String name) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("A component must have a name");
        this.name = name;
    }

    /**
     * Returns the local name of this component (i.e., its name on its parent block)
     */
    public String name() {
        return name;
    }

    /**
     * Returns the dotted name of this component from the root block (excluded)
     */
    public String fullName() {
        Block p = parent();
        return p == null || p.parent() == null ? name() : p.fullName() + "." + name();
    }

    /**
     * Returns the block on which this component is declared, or null if this component is not attached (yet)
     */
    public Block parent() {
        return parent;
    }

    final void attach(Block block) {
        if (parent != null)
            throw new IllegalStateException(name + " is already declared on " + parent.name());
        parent = block;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    /**
     * Deactivates this component. Deactivation is definitive.
     */
    public void deactivate() {
        active = false;
    }

    /**
     * Deactivates this component only, not the items it may contain
     */
    protected final void deactivateSelf() {
        active = false;
    }

    /**
     * Dispatches to the visitor method corresponding to the kind of this component
     */
    public abstract <R> R accept(ComponentVisitor<R> visitor);

    @Override
    public String toString() {
        return fullName();
    }
}
