package com.dixonrepair.vinsearch.model;

/**
 * Specificity level of a search query. Ordered from most to least specific;
 * escalation only ever moves forward through this order.
 */
public enum QueryTier {

    VIN_SPECIFIC(1),
    MAKE_MODEL_YEAR(2),
    GENERIC(3);

    private final int number;

    QueryTier(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public boolean isMoreSpecificThan(QueryTier other) {
        return number < other.number;
    }
}
