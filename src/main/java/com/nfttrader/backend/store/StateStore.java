package com.nfttrader.backend.store;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Function;

/**
 * Keyed in-memory state with an explicit lifecycle. Entries never expire on their own;
 * they leave the store only through {@link #delete} or {@link #clear}.
 */
public interface StateStore<K, V> {

    Optional<V> get(K key);

    void set(K key, V value);

    /**
     * Atomically returns the existing value or stores the one produced by {@code factory}.
     */
    V getOrCreate(K key, Function<? super K, ? extends V> factory);

    boolean delete(K key);

    void clear();

    long size();

    Collection<V> values();

    String getName();
}
