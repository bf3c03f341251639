package com.e2eq.amper.util;

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

public class CommonUtils {

    private CommonUtils() {}

    /**
     * Removes duplicates from a list keeping the first occurrence of each element, so
     * ["b", "a", "b"] becomes ["b", "a"].
     *
     * @param items the list to de-duplicate, may be null
     * @param <T> the element type
     * @return a new mutable list, empty when {@code items} is null
     */
    public static <T> List<T> distinct(List<T> items) {
        if (items == null || items.isEmpty()) {
            return Lists.newArrayList();
        }
        return Lists.newArrayList(new LinkedHashSet<>(items));
    }

    /**
     * Returns the distinct members of a collection of strings in lexicographic order.
     * Used wherever the order of emitted identifiers must not depend on hash iteration order.
     *
     * @param items the strings, may be null
     * @return a new mutable sorted list
     */
    public static List<String> sortedDistinct(Collection<String> items) {
        if (items == null || items.isEmpty()) {
            return Lists.newArrayList();
        }
        return Lists.newArrayList(Ordering.<String>natural().sortedCopy(new LinkedHashSet<>(items)));
    }

    /**
     * Unmodifiable view of a possibly null list.
     */
    public static <T> List<T> nullSafe(List<T> items) {
        return items == null ? Collections.emptyList() : Collections.unmodifiableList(items);
    }
}
