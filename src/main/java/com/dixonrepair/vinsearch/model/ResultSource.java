package com.dixonrepair.vinsearch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an {@link EngineResult} came from.
 */
public enum ResultSource {

    CACHE("cache"),
    LIVE("live"),
    FALLBACK("fallback");

    private final String value;

    ResultSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
