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
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * A component holding items by index. A non-indexed component holds (at most) one item, at index NONE; in that case,
 * the component and its item are activated and deactivated together.
 *
 * @param <T>
 *            the type of the items
 */
public abstract class IndexedComponent<T extends ComponentData> extends Component {

    private final boolean indexed;

    private final TreeMap<Index, T> items = new TreeMap<>();

    protected IndexedComponent(String name, boolean indexed) {
        super(name);
        this.indexed = indexed;
    }

    public final boolean isIndexed() {
        return indexed;
    }

    protected final T put(Index index, T item) {
        if (!indexed && !index.isEmpty())
            throw new IllegalArgumentException(name() + " is not indexed, so no item can be added at " + index);
        if (indexed && index.isEmpty())
            throw new IllegalArgumentException(name() + " is indexed, so items must be added with an index");
        if (items.containsKey(index))
            throw new IllegalArgumentException("An item already exists at " + name() + index);
        items.put(index, item);
        return item;
    }

    /**
     * Returns the item at the specified index, or null
     */
    public T get(Index index) {
        return items.get(index);
    }

    public T get(Object... parts) {
        return items.get(Index.of(parts));
    }

    /**
     * Returns the items of this component, in increasing order of their indexes
     */
    public List<T> items() {
        return new ArrayList<>(items.values());
    }

    public Set<Index> indexes() {
        return items.navigableKeySet();
    }

    public int size() {
        return items.size();
    }

    /**
     * Returns the single item of this non-indexed component
     */
    public T single() {
        if (indexed || items.isEmpty())
            throw new IllegalStateException(name() + " has no single item");
        return items.firstEntry().getValue();
    }

    /**
     * Deactivates this component and all its items
     */
    @Override
    public void deactivate() {
        deactivateSelf();
        for (T item : items.values())
            if (item.isActive())
                item.deactivate();
    }

    /**
     * Deactivates this component without touching its items. Used when all items are known to be inactive.
     */
    public void deactivateContainer() {
        deactivateSelf();
    }

    /**
     * Called by an item when it has just been deactivated
     */
    public void itemDeactivated(T item) {
        if (!indexed && isActive())
            deactivateSelf();
    }
}
