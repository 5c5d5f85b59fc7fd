package com.supplyplanner.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only copies for result values. Iteration order is kept; null becomes empty.
 */
final class ResultCollections {

    private ResultCollections() {
    }

    static <K, V> Map<K, V> map(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static <K, I, V> Map<K, Map<I, V>> nestedMap(Map<K, Map<I, V>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<K, Map<I, V>> copy = new LinkedHashMap<>();
        source.forEach((key, inner) -> copy.put(key, map(inner)));
        return Collections.unmodifiableMap(copy);
    }

    static <K, V> Map<K, List<V>> listMap(Map<K, List<V>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<K, List<V>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, list(values)));
        return Collections.unmodifiableMap(copy);
    }

    static <T> List<T> list(List<T> source) {
        return source == null ? List.of() : List.copyOf(source);
    }
}
