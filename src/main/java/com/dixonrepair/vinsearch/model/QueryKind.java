package com.dixonrepair.vinsearch.model;

/**
 * What a request is estimating. Always passed explicitly, never inferred
 * from the description text.
 */
public enum QueryKind {

    PRICE("price", "parts"),
    LABOR_TIME("labor time", "labor");

    private final String querySuffix;
    private final String sourceHint;

    QueryKind(String querySuffix, String sourceHint) {
        this.querySuffix = querySuffix;
        this.sourceHint = sourceHint;
    }

    /**
     * Suffix appended to generic (tier 3) queries.
     */
    public String getQuerySuffix() {
        return querySuffix;
    }

    /**
     * Hint passed to providers so they can narrow the domains they search.
     */
    public String getSourceHint() {
        return sourceHint;
    }

    public CacheType cacheType() {
        return this == PRICE ? CacheType.PARTS_PRICING : CacheType.LABOR_ESTIMATES;
    }
}
