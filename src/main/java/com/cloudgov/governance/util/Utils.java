/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.util;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class Utils {

    private Utils() {
    }

    /**
     * Returns true if the string is either null or empty.
     *
     * @param s the String to check
     * @return true if the string is either null or empty
     */
    public static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    public static boolean isNotEmpty(String s) {
        return !isEmpty(s);
    }

    public static boolean isEmpty(Collection<?> s) {
        return s == null || s.isEmpty();
    }

    public static boolean isEmpty(Map<?, ?> m) {
        return m == null || m.isEmpty();
    }

    public static <K, V> Map<K, V> nullEmpty(Map<K, V> m) {
        return m == null ? Collections.emptyMap() : m;
    }

    /**
     * Deep-copy a multi-valued map into an unmodifiable map of unmodifiable sets, keeping the iteration order of both
     * the keys and the values. Null value lists become empty sets.
     *
     * @param source map to copy, may be null
     * @param <K> key type
     * @param <V> value type
     * @return unmodifiable copy, never null
     */
    public static <K, V> Map<K, Set<V>> immutableMultimap(Map<K, ? extends Collection<V>> source) {
        if (isEmpty(source)) {
            return Collections.emptyMap();
        }
        Map<K, Set<V>> copy = new LinkedHashMap<>();
        source.forEach((k, values) -> copy.put(k, values == null ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(values))));
        return Collections.unmodifiableMap(copy);
    }

    public static <T> List<T> nullEmpty(List<T> l) {
        return l == null ? Collections.emptyList() : l;
    }
}
