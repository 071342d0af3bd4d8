package com.dixonrepair.vinsearch.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Context for tracking an external service call with logging support.
 *
 * Provides request/response logging with timing, a short call id and
 * consistent formatting across all external services.
 *
 * @see com.dixonrepair.vinsearch.util.ExternalCallLogger
 * @see ServiceType
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary) {
        logger.info("{} {} → {} [{}]",
                service.getEmoji(),
                service.getName(),
                operation,
                callId);

        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Request: {}", summary);
        }
    }

    public void logResponse(String summary) {
        logger.info("{} {} ← {} [{}] ({}ms)",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs());

        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Response: {}", summary);
        }
    }

    /**
     * Failures of single provider calls are expected and absorbed upstream,
     * so they are logged at WARN rather than ERROR.
     */
    public void logError(String errorMessage, Throwable ex) {
        logger.warn("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                errorMessage);

        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
