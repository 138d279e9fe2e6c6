package com.example.threadcache.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * An option value for batch calls: one value shared by all keys, one value per position, or one
 * value per key. Keys the option does not cover resolve to the cache default.
 */
public abstract class KeyedOption<T> {

    private KeyedOption() {
    }

    public static <T> KeyedOption<T> shared(T value) {
        return new Shared<>(value);
    }

    /** The i-th value applies to the i-th key of the call. */
    public static <T> KeyedOption<T> ordered(List<? extends T> values) {
        return new Ordered<>(values);
    }

    public static <T> KeyedOption<T> byKey(Map<String, ? extends T> values) {
        return new ByKey<>(values);
    }

    /**
     * Binds this option to the keys of one call.
     *
     * @param keys     the keys of the call, in call order
     * @param fallback value for keys the option does not cover
     */
    abstract Function<String, T> bind(List<String> keys, T fallback);

    private static final class Shared<T> extends KeyedOption<T> {
        private final T value;

        Shared(T value) {
            this.value = value;
        }

        @Override
        Function<String, T> bind(List<String> keys, T fallback) {
            return key -> value;
        }

        @Override
        public String toString() {
            return "shared(" + value + ")";
        }
    }

    private static final class Ordered<T> extends KeyedOption<T> {
        private final List<T> values;

        Ordered(List<? extends T> values) {
            // may hold nulls, so no List.copyOf
            this.values = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(values, "values")));
        }

        @Override
        Function<String, T> bind(List<String> keys, T fallback) {
            Map<String, T> byKey = new HashMap<>();
            int n = Math.min(keys.size(), values.size());
            for (int i = 0; i < n; i++) {
                byKey.put(keys.get(i), values.get(i));
            }
            return key -> byKey.containsKey(key) ? byKey.get(key) : fallback;
        }

        @Override
        public String toString() {
            return "ordered(" + values + ")";
        }
    }

    private static final class ByKey<T> extends KeyedOption<T> {
        private final Map<String, T> values;

        ByKey(Map<String, ? extends T> values) {
            this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
        }

        @Override
        Function<String, T> bind(List<String> keys, T fallback) {
            return key -> values.containsKey(key) ? values.get(key) : fallback;
        }

        @Override
        public String toString() {
            return "byKey(" + values + ")";
        }
    }
}
