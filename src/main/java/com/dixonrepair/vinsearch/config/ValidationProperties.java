package com.dixonrepair.vinsearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Scoring and sanity bounds used when validating search results.
 *
 * <p>Loaded from {@code app.validation}. The trusted domain lists themselves
 * live in {@link SearchProperties} so that the domains providers search and
 * the domains the scorer trusts never drift apart.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.validation")
@Data
public class ValidationProperties {

    /**
     * Trust assigned to allowlisted retailers and labor sources.
     */
    private int trustedScore = 85;

    /**
     * Trust assigned to every other domain.
     */
    private int unknownScore = 50;

    /**
     * Prices outside [minPrice, maxPrice] are extraction noise, not anomalies.
     */
    private double minPrice = 0.01;

    private double maxPrice = 50_000;

    /**
     * Labor figures outside [minLaborMinutes, maxLaborMinutes] are ignored.
     */
    private double minLaborMinutes = 1;

    private double maxLaborMinutes = 2_400;

    /**
     * Prices needed before cross-source anomaly detection runs.
     */
    private int minPricesForAnomalyDetection = 3;

    /**
     * IQR multiplier for the anomaly fence around the median.
     */
    private double iqrMultiplier = 1.5;
}
