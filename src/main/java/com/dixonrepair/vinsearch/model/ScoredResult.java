package com.dixonrepair.vinsearch.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A raw result with the signals extracted from it and its quality score.
 *
 * <p>Never mutated after creation. Flagging a result as an anomaly produces a
 * new instance via {@link #withAnomaly(boolean)}.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ScoredResult {

    RawResult raw;

    /**
     * Tier of the query that produced this result.
     */
    QueryTier tier;

    /**
     * Extracted price in USD, null when none could be extracted.
     */
    Double extractedPrice;

    /**
     * Extracted labor time, null when none could be extracted or the request
     * is a price request.
     */
    LaborFigure laborFigure;

    PageType pageType;

    @Builder.Default
    Availability availability = Availability.UNKNOWN;

    /**
     * Weighted quality score, 0-100.
     */
    int qualityScore;

    /**
     * Trust in the source domain, 0-100.
     */
    int retailerTrust;

    /**
     * True when cross-source validation flagged the price as inconsistent
     * with its peers.
     */
    @With
    boolean anomaly;

    public boolean hasPrice() {
        return extractedPrice != null;
    }

    public boolean hasLaborFigure() {
        return laborFigure != null;
    }

    /**
     * Whether this result carries the figure the request kind needs.
     */
    public boolean isUsableFor(QueryKind kind) {
        return kind == QueryKind.PRICE ? hasPrice() : hasLaborFigure();
    }

    public String getSourceUrl() {
        return raw.getSourceUrl();
    }
}
