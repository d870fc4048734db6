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
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The key of an item in an indexed component: a (possibly empty) tuple of integers and strings. Indexes are totally
 * ordered so that items are always visited in the same order: element by element, integers before strings, and a
 * prefix before any longer tuple.
 */
public final class Index implements Comparable<Index> {

    /**
     * The index of the single item of a non-indexed component
     */
    public static final Index NONE = new Index(Collections.emptyList());

    /**
     * Builds an index from the specified parts. Each part must be an Integer, a String or an Index (which is then
     * flattened).
     */
    public static Index of(Object... parts) {
        List<Object> list = new ArrayList<>();
        for (Object part : parts)
            addPart(list, part);
        return list.isEmpty() ? NONE : new Index(list);
    }

    /**
     * Parses a comma-separated list of parts; parts that are integers become integers, others stay strings.
     */
    public static Index parse(String text) {
        List<Object> list = new ArrayList<>();
        for (String token : text.split(",")) {
            String s = token.trim();
            if (s.length() >= 2 && (s.startsWith("'") && s.endsWith("'") || s.startsWith("\"") && s.endsWith("\"")))
                list.add(s.substring(1, s.length() - 1));
            else if (!s.isEmpty()) {
                try {
                    list.add(Integer.valueOf(s));
                } catch (NumberFormatException e) {
                    list.add(s);
                }
            }
        }
        return list.isEmpty() ? NONE : new Index(list);
    }

    private static void addPart(List<Object> list, Object part) {
        if (part instanceof Index)
            list.addAll(((Index) part).parts);
        else if (part instanceof Integer || part instanceof String)
            list.add(part);
        else
            throw new IllegalArgumentException("An index part must be an integer or a string, not " + part);
    }

    private final List<Object> parts;

    private Index(List<Object> parts) {
        this.parts = Collections.unmodifiableList(parts);
    }

    /**
     * Returns a new index made of the parts of this index followed by the specified part
     */
    public Index append(Object part) {
        List<Object> list = new ArrayList<>(parts);
        addPart(list, part);
        return new Index(list);
    }

    public int size() {
        return parts.size();
    }

    public Object get(int i) {
        return parts.get(i);
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    @Override
    public int compareTo(Index other) {
        for (int i = 0; i < Math.min(parts.size(), other.parts.size()); i++) {
            Object a = parts.get(i), b = other.parts.get(i);
            int cmp;
            if (a instanceof Integer && b instanceof Integer)
                cmp = Integer.compare((Integer) a, (Integer) b);
            else if (a instanceof String && b instanceof String)
                cmp = ((String) a).compareTo((String) b);
            else
                cmp = a instanceof Integer ? -1 : 1;
            if (cmp != 0)
                return cmp;
        }
        return Integer.compare(parts.size(), other.parts.size());
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Index && parts.equals(((Index) obj).parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    /**
     * Returns the bracketed form of this index, e.g. [1,lb], or the empty string for NONE
     */
    @Override
    public String toString() {
        return isEmpty() ? "" : parts.stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
    }
}
