package com.dixonrepair.vinsearch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Unscored hit returned by a search provider. Discarded after scoring.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class RawResult {

    String sourceUrl;
    String title;
    String snippet;
    Instant retrievedAt;

    /**
     * Name of the provider that returned this hit.
     */
    String provider;

    /**
     * Title and snippet joined, the text all extractors work on.
     */
    public String text() {
        String t = title == null ? "" : title;
        String s = snippet == null ? "" : snippet;
        return (t + " " + s).trim();
    }
}
