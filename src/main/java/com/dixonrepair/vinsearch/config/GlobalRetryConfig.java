package com.dixonrepair.vinsearch.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Global retry configuration for transient provider failures.
 *
 * <p>Every search provider call goes through the same retry policy built
 * from these settings (see {@code RetryPolicy}). Properties are loaded from
 * the {@code app.retry} namespace in application.yml:
 * <pre>
 * app:
 *   retry:
 *     max-retries: 3
 *     backoff-ms: 1000
 *     multiplier: 2.0
 *     max-jitter-ms: 250
 *     max-backoff-ms: 10000
 * </pre>
 *
 * <p><b>Exponential Backoff Calculation:</b>
 * For retry N (starting at 0), the delay is:
 * <pre>
 *   delay = min(backoff-ms * (multiplier ^ N), max-backoff-ms) + random(0, max-jitter-ms)
 * </pre>
 * Example with defaults: 1s, 2s, 4s, each plus up to 250ms of jitter.
 *
 * <p><b>Thread Safety:</b> Spring manages a single instance and all fields are
 * effectively immutable after binding.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.retry")
@Validated
@Data
public class GlobalRetryConfig {

    /**
     * Retries after the initial attempt. Total attempts = 1 + maxRetries.
     * Default: 3
     */
    @Min(0)
    private int maxRetries = 3;

    /**
     * Delay before the first retry in milliseconds.
     * Default: 1000 (1 second)
     */
    @Min(0)
    private long backoffMs = 1000;

    /**
     * Exponential multiplier applied per retry.
     * Default: 2.0
     */
    @DecimalMin("1.0")
    private double multiplier = 2.0;

    /**
     * Upper bound of the random jitter added to every delay, in milliseconds.
     * Default: 250
     */
    @Min(0)
    private long maxJitterMs = 250;

    /**
     * Cap on the exponential part of the delay, in milliseconds.
     * Default: 10000 (10 seconds)
     */
    private long maxBackoffMs = 10_000;
}
