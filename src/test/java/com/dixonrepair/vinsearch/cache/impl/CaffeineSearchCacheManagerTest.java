package com.dixonrepair.vinsearch.cache.impl;

import com.dixonrepair.vinsearch.config.CacheProperties;
import com.dixonrepair.vinsearch.model.CacheType;
import com.dixonrepair.vinsearch.model.VehicleProfile;
import com.dixonrepair.vinsearch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Caffeine search cache")
class CaffeineSearchCacheManagerTest {

    private MutableClock clock;
    private CaffeineSearchCacheManager cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        cache = new CaffeineSearchCacheManager(clock, new CacheProperties());
    }

    @Test
    @DisplayName("Value put is returned until its TTL has passed")
    void roundTripThenExpiry() {
        // Given
        cache.put("2021 honda civic brake pads", CacheType.PARTS_PRICING, "estimate");

        // When: exactly at the TTL boundary
        clock.advance(Duration.ofSeconds(CacheType.PARTS_PRICING.getTtlSeconds()));

        // Then
        assertThat(cache.get("2021 honda civic brake pads", CacheType.PARTS_PRICING, String.class)).contains("estimate");

        // When: one second past the TTL
        clock.advance(Duration.ofSeconds(1));

        // Then
        assertThat(cache.get("2021 honda civic brake pads", CacheType.PARTS_PRICING, String.class)).isEmpty();
    }

    @Test
    @DisplayName("Each type keeps its own TTL")
    void ttlPerType() {
        VehicleProfile civic = VehicleProfile.builder().year("2021").make("Honda").model("Civic").build();
        cache.put("1HGBH41JXMN109186", CacheType.VEHICLE_DECODE, civic);
        cache.put("brake pads", CacheType.PARTS_PRICING, "estimate");

        clock.advance(Duration.ofHours(1));

        assertThat(cache.get("1HGBH41JXMN109186", CacheType.VEHICLE_DECODE, VehicleProfile.class)).contains(civic);
        assertThat(cache.get("brake pads", CacheType.PARTS_PRICING, String.class)).isEmpty();
    }

    @Test
    @DisplayName("Keys are normalized and namespaces are separate")
    void keyNormalizationAndNamespaces() {
        cache.put("  2021 Honda   Civic  ", CacheType.LABOR_ESTIMATES, 45);

        assertThat(cache.get("2021 honda civic", CacheType.LABOR_ESTIMATES, Integer.class)).contains(45);
        assertThat(cache.get("2021 honda civic", CacheType.PARTS_PRICING, Integer.class)).isEmpty();
    }

    @Test
    @DisplayName("Type mismatch is a miss, not an exception")
    void typeMismatch() {
        cache.put("key", CacheType.PARTS_PRICING, "text");

        assertThat(cache.get("key", CacheType.PARTS_PRICING, Integer.class)).isEmpty();
    }

    @Test
    void invalidateAndEvict() {
        cache.put("a", CacheType.PARTS_PRICING, "1");
        cache.put("b", CacheType.PARTS_PRICING, "2");

        cache.invalidate("a", CacheType.PARTS_PRICING);
        assertThat(cache.get("a", CacheType.PARTS_PRICING, String.class)).isEmpty();

        clock.advance(Duration.ofSeconds(CacheType.PARTS_PRICING.getTtlSeconds() + 1));
        cache.evictExpired();
        assertThat(cache.size(CacheType.PARTS_PRICING)).isZero();
    }

    @Test
    @DisplayName("Concurrent writers on different keys all land")
    void concurrentPuts() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int n = i;
                futures.add(pool.submit(() -> cache.put("key-" + n, CacheType.LABOR_ESTIMATES, n)));
            }
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < 200; i++) {
            assertThat(cache.get("key-" + i, CacheType.LABOR_ESTIMATES, Integer.class)).contains(i);
        }
    }
}
