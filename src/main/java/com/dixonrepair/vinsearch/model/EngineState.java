package com.dixonrepair.vinsearch.model;

/**
 * Stages a search request moves through in the engine facade.
 *
 * <p>{@link #VEHICLE_RESOLUTION_SKIPPED} is non-fatal: the request carries on
 * with tier 2/3 queries. {@link #NO_USABLE_RESULTS} ends the request.
 */
public enum EngineState {
    INIT,
    RESOLVING_VEHICLE,
    VEHICLE_RESOLUTION_SKIPPED,
    BUILDING_QUERIES,
    SEARCHING,
    VALIDATING,
    AGGREGATING,
    CACHE_WRITE,
    DONE,
    NO_USABLE_RESULTS;

    public boolean isFailure() {
        return this == NO_USABLE_RESULTS;
    }
}
