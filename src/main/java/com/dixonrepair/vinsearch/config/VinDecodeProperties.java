package com.dixonrepair.vinsearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * NHTSA vPIC decode service settings, loaded from {@code app.vin}.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.vin")
@Data
public class VinDecodeProperties {

    private String baseUrl = "https://vpic.nhtsa.dot.gov";

    private long timeoutMs = 10_000;

    /**
     * Reject VINs whose position-9 check digit does not match. Off by default
     * because many non-North-American VINs do not carry a valid check digit.
     */
    private boolean enforceCheckDigit = false;
}
