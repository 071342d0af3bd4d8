package com.dixonrepair.vinsearch.cache.impl;

import com.dixonrepair.vinsearch.cache.SearchCacheManager;
import com.dixonrepair.vinsearch.config.CacheProperties;
import com.dixonrepair.vinsearch.model.CacheEntry;
import com.dixonrepair.vinsearch.model.CacheType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory cache manager backed by one Caffeine cache per {@link CacheType}.
 *
 * <p>Caffeine's concurrent map gives per-key atomicity without a global lock.
 * Freshness is checked explicitly against {@link CacheEntry#isExpired} on
 * every read; Caffeine's own write expiry (driven by the same clock) only
 * reclaims memory.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class CaffeineSearchCacheManager implements SearchCacheManager {

    /**
     * Caffeine expires at exactly the TTL while reads treat the boundary as
     * fresh, so the physical expiry trails by one second.
     */
    private static final Duration EXPIRY_GRACE = Duration.ofSeconds(1);

    private final Clock clock;
    private final Map<CacheType, Cache<String, CacheEntry>> caches = new EnumMap<>(CacheType.class);

    public CaffeineSearchCacheManager(Clock clock, CacheProperties props) {
        this.clock = clock;
        Ticker ticker = () -> clock.millis() * 1_000_000L;
        for (CacheType type : CacheType.values()) {
            Caffeine<Object, Object> builder = Caffeine.newBuilder()
                    .ticker(ticker)
                    .maximumSize(props.getMaximumSize())
                    .expireAfterWrite(Duration.ofSeconds(type.getTtlSeconds()).plus(EXPIRY_GRACE));
            if (props.isRecordStats()) {
                builder.recordStats();
            }
            caches.put(type, builder.build());
        }
        log.info("✅ Search cache ready: {} namespaces, max {} entries each", caches.size(), props.getMaximumSize());
    }

    @Override
    public <V> Optional<V> get(String key, CacheType type, Class<V> valueType) {
        Preconditions.checkNotNull(type, "Cache type cannot be null");
        Preconditions.checkNotNull(valueType, "Value type cannot be null");
        String normalized = normalizeKey(key);

        Cache<String, CacheEntry> cache = caches.get(type);
        CacheEntry entry = cache.getIfPresent(normalized);
        if (entry == null) {
            log.debug("Cache miss {}:{}", type.getNamespace(), normalized);
            return Optional.empty();
        }

        if (entry.isExpired(clock.instant())) {
            // Conditional remove so a concurrent fresh put is never dropped
            cache.asMap().remove(normalized, entry);
            log.debug("Cache expired {}", entry.namespacedKey());
            return Optional.empty();
        }

        if (!valueType.isInstance(entry.getValue())) {
            log.warn("Cache type mismatch for {}: expected {}, found {}",
                    entry.namespacedKey(), valueType.getSimpleName(), entry.getValue().getClass().getSimpleName());
            return Optional.empty();
        }

        log.debug("Cache hit {}", entry.namespacedKey());
        return Optional.of(valueType.cast(entry.getValue()));
    }

    @Override
    public <V> void put(String key, CacheType type, V value) {
        Preconditions.checkNotNull(type, "Cache type cannot be null");
        Preconditions.checkNotNull(value, "Cached value cannot be null");
        String normalized = normalizeKey(key);

        CacheEntry entry = CacheEntry.builder()
                .key(normalized)
                .value(value)
                .storedAt(clock.instant())
                .ttlSeconds(type.getTtlSeconds())
                .type(type)
                .build();

        caches.get(type).put(normalized, entry);
        log.debug("Cache put {} (ttl {}s)", entry.namespacedKey(), entry.getTtlSeconds());
    }

    @Override
    public void invalidate(String key, CacheType type) {
        caches.get(type).invalidate(normalizeKey(key));
    }

    @Override
    public void evictExpired() {
        Instant now = clock.instant();
        caches.values().forEach(cache -> {
            cache.asMap().entrySet().removeIf(e -> e.getValue().isExpired(now));
            cache.cleanUp();
        });
    }

    @Override
    public long size(CacheType type) {
        return caches.get(type).estimatedSize();
    }

    /**
     * Trims, lower-cases and collapses whitespace so trivially different
     * spellings of the same request share an entry.
     */
    static String normalizeKey(String key) {
        Preconditions.checkArgument(key != null && !key.isBlank(), "Cache key cannot be empty");
        return key.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
