package com.dixonrepair.vinsearch.cache;

import com.dixonrepair.vinsearch.model.CacheType;

import java.util.Optional;

/**
 * Type-keyed cache with a fixed time-to-live per {@link CacheType}.
 *
 * <p>Every component consults this cache before making a network call. It is
 * injected, never reached through static or global state, so tests can run
 * against a fresh instance.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>{@code put} stamps the entry with the current time and the TTL of its type</li>
 *   <li>{@code get} is a miss once more than the TTL has elapsed since the put</li>
 *   <li>operations on one key are linearizable; unrelated keys never block each other</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface SearchCacheManager {

    /**
     * Looks up a fresh value.
     *
     * @param key       cache key; normalized by the implementation
     * @param type      namespace and TTL of the entry
     * @param valueType expected value class
     * @return the stored value, or empty on a miss, an expired entry or a type mismatch
     */
    <V> Optional<V> get(String key, CacheType type, Class<V> valueType);

    /**
     * Stores a value, replacing any previous entry for the same key and type.
     */
    <V> void put(String key, CacheType type, V value);

    void invalidate(String key, CacheType type);

    /**
     * Drops expired entries eagerly. Optional; {@link #get} never returns
     * stale values either way.
     */
    void evictExpired();

    /**
     * Number of entries currently held for a type, expired ones included until evicted.
     */
    long size(CacheType type);
}
