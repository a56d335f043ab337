package com.nfttrader.backend.store;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link StateStore} over a Spring {@link CaffeineCache} without size bound or expiry.
 * Null values are not stored.
 */
public class CaffeineStateStore<K, V> implements StateStore<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(CaffeineStateStore.class);

    private final CaffeineCache cache;

    public CaffeineStateStore(String name) {
        this(new CaffeineCache(name, Caffeine.newBuilder().initialCapacity(64).build(), false));
    }

    public CaffeineStateStore(CaffeineCache cache) {
        this.cache = cache;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<V> get(K key) {
        Cache.ValueWrapper wrapper = cache.get(key);
        return wrapper == null ? Optional.empty() : Optional.ofNullable((V) wrapper.get());
    }

    @Override
    public void set(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public V getOrCreate(K key, Function<? super K, ? extends V> factory) {
        return cache.get(key, () -> factory.apply(key));
    }

    @Override
    public boolean delete(K key) {
        return cache.evictIfPresent(key);
    }

    @Override
    public void clear() {
        long before = size();
        cache.clear();
        logger.debug("Cleared store {} ({} entries)", getName(), before);
    }

    @Override
    public long size() {
        return cache.getNativeCache().asMap().size();
    }

    @Override
    @SuppressWarnings("unchecked")
    public Collection<V> values() {
        return new ArrayList<>((Collection<V>) cache.getNativeCache().asMap().values());
    }

    @Override
    public String getName() {
        return cache.getName();
    }
}
