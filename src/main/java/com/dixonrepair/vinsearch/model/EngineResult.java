package com.dixonrepair.vinsearch.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The only object the engine returns across its boundary.
 *
 * <p>Always carries an explicit confidence. On failure the confidence is 0
 * and {@link #reason} explains what went wrong in words the calling layer
 * can pass on to a user.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class EngineResult {

    /**
     * Part or repair description as the caller supplied it.
     */
    String query;

    QueryKind kind;

    VehicleProfile vehicleProfile;

    PriceEstimate priceEstimate;

    LaborEstimate laborEstimate;

    /**
     * Overall confidence, 0-100.
     */
    int overallConfidence;

    ResultSource source;

    /**
     * Human-readable failure reason. Null on success.
     */
    String reason;

    EngineState finalState;

    /**
     * Tiers that were actually searched, in order.
     */
    @Builder.Default
    List<QueryTier> tiersAttempted = List.of();

    /**
     * Non-fatal notes collected along the way (skipped resolution, failed
     * providers, deadline expiry).
     */
    @Builder.Default
    List<String> diagnostics = List.of();

    public boolean isSuccessful() {
        return !finalState.isFailure() && overallConfidence > 0;
    }

    /**
     * Copy of this result marked as served from cache.
     */
    public EngineResult asCached() {
        return toBuilder().source(ResultSource.CACHE).build();
    }

    public static EngineResult failure(String query, QueryKind kind, VehicleProfile profile,
                                       EngineState state, String reason, List<String> diagnostics) {
        return EngineResult.builder()
                .query(query)
                .kind(kind)
                .vehicleProfile(profile)
                .overallConfidence(0)
                .source(ResultSource.FALLBACK)
                .reason(reason)
                .finalState(state)
                .diagnostics(List.copyOf(diagnostics))
                .build();
    }
}
