package com.dixonrepair.vinsearch.model;

/**
 * Cache namespaces and their fixed time-to-live.
 */
public enum CacheType {

    VEHICLE_DECODE("vehicle_decode", 86_400),
    PARTS_PRICING("parts_pricing", 900),
    LABOR_ESTIMATES("labor_estimates", 3_600),
    REPAIR_PROCEDURES("repair_procedures", 14_400),
    NHTSA_LOOKUP("nhtsa_lookup", 7_200);

    private final String namespace;
    private final long ttlSeconds;

    CacheType(String namespace, long ttlSeconds) {
        this.namespace = namespace;
        this.ttlSeconds = ttlSeconds;
    }

    public String getNamespace() {
        return namespace;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }
}
