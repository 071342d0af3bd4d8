package com.dixonrepair.vinsearch.search;

import com.dixonrepair.vinsearch.config.GlobalRetryConfig;
import com.dixonrepair.vinsearch.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.TimeoutException;

/**
 * Exponential backoff with jitter for transient provider failures.
 *
 * <p>Retry N (0-based) waits {@code min(backoff * multiplier^N, maxBackoff)}
 * plus a random jitter of up to {@code maxJitterMs}. Only transient failures
 * are retried: timeouts, connection errors, 5xx and 429. Everything else
 * propagates on the first attempt.
 *
 * @see GlobalRetryConfig
 */
@Slf4j
@Component
public class RetryPolicy {

    private final GlobalRetryConfig config;
    private final Random random;

    @Autowired
    public RetryPolicy(GlobalRetryConfig config) {
        this(config, new Random());
    }

    public RetryPolicy(GlobalRetryConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    public int getMaxRetries() {
        return config.getMaxRetries();
    }

    /**
     * Delay before retry number {@code retryIndex} (0 for the first retry).
     */
    public Duration delayForRetry(long retryIndex) {
        double exponential = config.getBackoffMs() * Math.pow(config.getMultiplier(), retryIndex);
        long capped = (long) Math.min(exponential, (double) config.getMaxBackoffMs());
        long jitter = config.getMaxJitterMs() > 0 ? (long) (random.nextDouble() * config.getMaxJitterMs()) : 0L;
        return Duration.ofMillis(capped + jitter);
    }

    public boolean isRetryable(Throwable error) {
        if (error instanceof ProviderException) {
            return ((ProviderException) error).isTransientFailure();
        }
        return error instanceof TimeoutException;
    }

    /**
     * Reactor retry spec applying this policy. The last failure propagates
     * unchanged once retries are exhausted.
     *
     * @param label used in log lines, e.g. "tavily: 2021 honda civic brake pads"
     */
    public Retry toRetrySpec(String label) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long retryIndex = signal.totalRetries();
            if (!isRetryable(failure) || retryIndex >= config.getMaxRetries()) {
                return Mono.error(failure);
            }
            Duration delay = delayForRetry(retryIndex);
            log.debug("🔄 Retry {}/{} for {} in {}ms: {}",
                    retryIndex + 1, config.getMaxRetries(), label, delay.toMillis(), failure.getMessage());
            return Mono.delay(delay);
        }));
    }
}
