package com.dixonrepair.vinsearch.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Price range assembled from the non-anomalous sources of one request.
 *
 * <p>Anomalous sources are excluded from {@code low}, {@code high} and
 * {@code median} but kept in {@link #anomalies} so callers can show them.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class PriceEstimate {

    double low;
    double high;
    double median;

    @Builder.Default
    String currency = "USD";

    @Builder.Default
    List<ScoredResult> anomalies = List.of();

    /**
     * Confidence in the estimate, 0-100.
     */
    int confidence;

    /**
     * Number of non-anomalous sources that contributed a price.
     */
    int sourceCount;

    /**
     * Whether at least one contributing source came from a VIN-specific query.
     */
    boolean vinTierContributed;

    /**
     * Short human-readable advice about the spread of prices.
     */
    String recommendation;
}
