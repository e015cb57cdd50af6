package com.partshortage.support;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Keyed quantities where an absent key reads as zero, never null. Rows sharing a key
 * are summed when the lookup is built.
 */
public final class ZeroDefaultLookup<K> {

    private static final ZeroDefaultLookup<?> EMPTY = new ZeroDefaultLookup<>(Map.of());

    private final Map<K, Double> values;

    private ZeroDefaultLookup(Map<K, Double> values) {
        this.values = values;
    }

    public static <T, K> ZeroDefaultLookup<K> summing(Collection<T> rows,
                                                      Function<? super T, ? extends K> keyFn,
                                                      ToDoubleFunction<? super T> valueFn) {
        if (rows == null || rows.isEmpty()) {
            return empty();
        }
        Map<K, Double> sums = new HashMap<>();
        for (T row : rows) {
            K key = keyFn.apply(row);
            if (key == null) {
                continue;
            }
            sums.merge(key, valueFn.applyAsDouble(row), Double::sum);
        }
        return new ZeroDefaultLookup<>(sums);
    }

    @SuppressWarnings("unchecked")
    public static <K> ZeroDefaultLookup<K> empty() {
        return (ZeroDefaultLookup<K>) EMPTY;
    }

    public double get(K key) {
        Double v = values.get(key);
        return v != null ? v : 0.0;
    }

    public boolean contains(K key) {
        return values.containsKey(key);
    }

    public Set<K> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }
}
