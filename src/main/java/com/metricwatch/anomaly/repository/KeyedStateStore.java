package com.metricwatch.anomaly.repository;

import java.util.Optional;

/**
 * Keyed state with optimistic concurrency.
 *
 * The in-memory implementation serves a single engine instance; an external implementation
 * lets several instances share guardrail state without duplicate or missed alerts.
 *
 * @param <K> key type
 * @param <V> value type; compared by value in {@link #compareAndSwap}
 */
public interface KeyedStateStore<K, V> {

    Optional<V> get(K key);

    /**
     * Unconditional write.
     */
    void put(K key, V value);

    /**
     * Replace the value for {@code key} only if the stored value is still {@code expected}.
     *
     * @param expected the value previously read, or {@code null} to require that the key is absent
     * @return true if the replacement was written
     */
    boolean compareAndSwap(K key, V expected, V replacement);

    void remove(K key);
}
