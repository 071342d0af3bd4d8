package com.dixonrepair.vinsearch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Value stored by the cache manager together with its freshness stamp.
 * Only the cache manager holds references to entries.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class CacheEntry {

    String key;
    Object value;
    Instant storedAt;
    long ttlSeconds;
    CacheType type;

    /**
     * An entry is stale once strictly more than {@code ttlSeconds} have
     * passed since it was stored.
     */
    public boolean isExpired(Instant now) {
        return Duration.between(storedAt, now).compareTo(Duration.ofSeconds(ttlSeconds)) > 0;
    }

    /**
     * Key qualified with its namespace, e.g. {@code parts_pricing:2021 honda civic brake pads}.
     */
    public String namespacedKey() {
        return type.getNamespace() + ":" + key;
    }
}
