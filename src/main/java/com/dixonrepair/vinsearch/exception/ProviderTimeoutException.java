package com.dixonrepair.vinsearch.exception;

/**
 * Provider call exceeded its per-call timeout. Always transient.
 */
public class ProviderTimeoutException extends ProviderException {

    public ProviderTimeoutException(String provider, long timeoutMs, Throwable cause) {
        super(provider, provider + " timed out after " + timeoutMs + "ms", 0, true, cause);
    }
}
