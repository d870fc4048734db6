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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import constraints.Constraint;
import expressions.Expression;
import variables.Domain;
import variables.Variable;

/**
 * A named container of components. Components are kept in declaration order, which is the order used by all traversals.
 * A block without parent is the root of a model.
 */
public class Block extends Component {

    private final Map<String, Component> components = new LinkedHashMap<>();

    public Block(String name) {
        super(name);
    }

    /**
     * Declares the specified component on this block and returns it
     *
     * @param component
     *            a component not declared anywhere yet
     * @return the specified component
     */
    public <C extends Component> C add(C component) {
        if (components.containsKey(component.name()))
            throw new IllegalArgumentException("A component named " + component.name() + " already exists on " + this);
        component.attach(this);
        components.put(component.name(), component);
        return component;
    }

    /**
     * Returns the component with the specified local name, or null
     */
    public Component component(String name) {
        return components.get(name);
    }

    /**
     * Returns a snapshot of the components of this block, in declaration order
     */
    public List<Component> components() {
        return new ArrayList<>(components.values());
    }

    /**
     * Returns a name, built from the specified one, that is not used yet on this block
     */
    public String uniqueName(String base) {
        if (!components.containsKey(base))
            return base;
        for (int i = 1;; i++) {
            String candidate = base + "_" + i;
            if (!components.containsKey(candidate))
                return candidate;
        }
    }

    /**
     * Returns the root block of the model this block belongs to
     */
    public Block root() {
        Block b = this;
        while (b.parent() != null)
            b = b.parent();
        return b;
    }

    /**
     * Resolves a dotted path such as {@code outer.d[1].inner} from this block. Each segment is the local name of a
     * component, possibly followed by a bracketed index selecting one item of an indexed component. A non-indexed
     * disjunct is resolved to its single item, so that paths can go through it.
     *
     * @param path
     *            the path to resolve
     * @return the component or item found, or null if the path does not resolve
     */
    public Object find(String path) {
        Object current = this;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Block))
                return null;
            String name = segment;
            Index index = null;
            int bracket = segment.indexOf('[');
            if (bracket >= 0) {
                if (!segment.endsWith("]"))
                    return null;
                name = segment.substring(0, bracket);
                index = Index.parse(segment.substring(bracket + 1, segment.length() - 1));
            }
            Component c = ((Block) current).component(name);
            if (c == null)
                return null;
            if (index == null)
                current = c instanceof Disjunct && !((Disjunct) c).isIndexed() && ((Disjunct) c).size() == 1 ? ((Disjunct) c).single() : c;
            else if (c instanceof IndexedComponent)
                current = ((IndexedComponent<?>) c).get(index);
            else
                return null;
            if (current == null)
                return null;
        }
        return current;
    }

    public Variable addVariable(String name, Double lb, Double ub) {
        return add(new Variable(name, Domain.REALS, lb, ub));
    }

    public Variable addBinary(String name) {
        return add(new Variable(name, Domain.BINARY, 0.0, 1.0));
    }

    public Parameter addParameter(String name, double value) {
        return add(new Parameter(name, value));
    }

    /**
     * Declares a non-indexed constraint {@code lower <= body <= upper}; a null bound is absent.
     */
    public Constraint addConstraint(String name, Double lower, Expression body, Double upper) {
        Constraint c = add(new Constraint(name, false));
        c.add(Index.NONE, lower, body, upper);
        return c;
    }

    public Constraint addIndexedConstraint(String name) {
        return add(new Constraint(name, true));
    }

    public Block addBlock(String name) {
        return add(new Block(name));
    }

    /**
     * Declares a non-indexed disjunct and returns its single item
     */
    public DisjunctData addDisjunct(String name) {
        return add(new Disjunct(name, false)).add(Index.NONE);
    }

    public Disjunct addIndexedDisjunct(String name) {
        return add(new Disjunct(name, true));
    }

    /**
     * Declares a non-indexed disjunction requiring exactly one of the specified disjuncts to be selected
     */
    public Disjunction addDisjunction(String name, DisjunctData... disjuncts) {
        return addDisjunction(name, true, disjuncts);
    }

    public Disjunction addDisjunction(String name, boolean xor, DisjunctData... disjuncts) {
        Disjunction d = add(new Disjunction(name, false));
        d.add(Index.NONE, xor, disjuncts);
        return d;
    }

    public Disjunction addIndexedDisjunction(String name) {
        return add(new Disjunction(name, true));
    }

    public Objective addObjective(String name, Expression expression, Objective.Sense sense) {
        return add(new Objective(name, expression, sense));
    }

    @Override
    public <R> R accept(ComponentVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
