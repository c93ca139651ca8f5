package com.metricwatch.anomaly.repository;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Correct only while a single engine instance owns the state.
 */
public class InMemoryStateStore<K, V> implements KeyedStateStore<K, V> {

    private final ConcurrentHashMap<K, V> values = new ConcurrentHashMap<>();

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void put(K key, V value) {
        values.put(key, Objects.requireNonNull(value, "Value must not be null"));
    }

    @Override
    public boolean compareAndSwap(K key, V expected, V replacement) {
        Objects.requireNonNull(replacement, "Replacement must not be null");
        if (expected == null) {
            return values.putIfAbsent(key, replacement) == null;
        }
        return values.replace(key, expected, replacement);
    }

    @Override
    public void remove(K key) {
        values.remove(key);
    }

    public int size() {
        return values.size();
    }

    public Map<K, V> snapshot() {
        return Map.copyOf(values);
    }
}
