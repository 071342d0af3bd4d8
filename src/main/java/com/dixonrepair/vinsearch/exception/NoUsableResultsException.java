package com.dixonrepair.vinsearch.exception;

import lombok.Getter;

/**
 * Every tier was searched and nothing usable came back. Terminal for the
 * request; the caller should not retry immediately.
 */
@Getter
public class NoUsableResultsException extends RuntimeException {

    private final String query;

    public NoUsableResultsException(String query, String message) {
        super(message);
        this.query = query;
    }
}
