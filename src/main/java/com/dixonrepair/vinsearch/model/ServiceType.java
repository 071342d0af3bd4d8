package com.dixonrepair.vinsearch.model;

/**
 * Enumeration of external service types for unified logging.
 *
 * Used by ExternalCallLogger to categorize and log calls to
 * different external services with consistent formatting.
 *
 * @see com.dixonrepair.vinsearch.util.ExternalCallLogger
 */
public enum ServiceType {
    TAVILY("🔎", "Tavily"),
    SERPER("🟣", "Serper"),
    NHTSA("🚗", "NHTSA");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
