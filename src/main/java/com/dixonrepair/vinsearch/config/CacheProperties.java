package com.dixonrepair.vinsearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * In-memory cache sizing, loaded from {@code app.cache}. TTLs are fixed per
 * cache type and not configurable here.
 */
@ConfigurationProperties(prefix = "app.cache")
@Data
public class CacheProperties {

    /**
     * Maximum entries held per cache type.
     */
    private long maximumSize = 10_000;

    private boolean recordStats = true;
}
