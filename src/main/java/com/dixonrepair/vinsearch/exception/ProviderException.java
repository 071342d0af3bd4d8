package com.dixonrepair.vinsearch.exception;

import lombok.Getter;

/**
 * Failure of a single call to an external search provider.
 *
 * <p>{@code transientFailure} decides whether the retry policy tries again:
 * timeouts, 5xx and rate-limit responses are transient, other 4xx are not.
 */
@Getter
public class ProviderException extends RuntimeException {

    private static final int TOO_MANY_REQUESTS = 429;

    private final String provider;
    private final int statusCode;
    private final boolean transientFailure;

    public ProviderException(String provider, String message, int statusCode, boolean transientFailure) {
        super(message);
        this.provider = provider;
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public ProviderException(String provider, String message, int statusCode, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public static ProviderException fromStatus(String provider, int statusCode, Throwable cause) {
        return new ProviderException(provider,
                provider + " returned HTTP " + statusCode,
                statusCode,
                isTransientStatus(statusCode),
                cause);
    }

    public static boolean isTransientStatus(int statusCode) {
        return statusCode >= 500 || statusCode == TOO_MANY_REQUESTS;
    }
}
