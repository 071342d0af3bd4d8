package com.dixonrepair.vinsearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Confidence constants and request defaults for the engine facade.
 *
 * <p>The tier bases are the confidence a request can reach when its best
 * evidence comes from that tier. Everything here is tunable; none of the
 * coefficients is load-bearing for control flow.
 * <pre>
 * app:
 *   engine:
 *     tier1-confidence-base: 95
 *     tier2-confidence-base: 80
 *     tier3-confidence-base: 65
 * </pre>
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.engine")
@Data
public class EngineProperties {

    /**
     * TIER1_CONFIDENCE_BASE: best evidence came from a VIN-specific query.
     */
    private int tier1ConfidenceBase = 95;

    /**
     * TIER2_CONFIDENCE_BASE: best evidence came from a year/make/model query.
     */
    private int tier2ConfidenceBase = 80;

    /**
     * TIER3_CONFIDENCE_BASE: only generic queries produced evidence.
     */
    private int tier3ConfidenceBase = 65;

    /**
     * Flat bonus on the price estimate confidence when VIN-tier results contributed.
     */
    private int vinTierBonus = 10;

    /**
     * Source count past which more sources stop raising confidence.
     */
    private int sourceSaturation = 5;

    /**
     * Share of the tier base granted regardless of evidence strength.
     */
    private double evidenceFloor = 0.5;

    /**
     * Multiplier applied when the deadline expired before all tiers finished.
     */
    private double incompleteDiscount = 0.8;

    /**
     * Deadline used when the caller does not supply one.
     */
    private long defaultDeadlineMs = 20_000;
}
