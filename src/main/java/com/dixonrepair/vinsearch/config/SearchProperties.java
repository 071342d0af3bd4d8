package com.dixonrepair.vinsearch.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the tiered search executor and the external search providers.
 *
 * <p>Properties are loaded from the {@code app.search} namespace:
 * <pre>
 * app:
 *   search:
 *     provider-timeout-ms: 8000
 *     min-usable-results: 3
 *     max-results-per-query: 5
 *     tavily:
 *       enabled: true
 *       api-key: ${TAVILY_API_KEY:}
 *     serper:
 *       enabled: false
 *       api-key: ${SERPER_API_KEY:}
 * </pre>
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.search")
@Validated
@Data
public class SearchProperties {

    /**
     * Independent timeout for every provider call (each attempt), in milliseconds.
     */
    @Min(1)
    private long providerTimeoutMs = 8_000;

    /**
     * Usable results (with an extracted price or labor time) a tier must yield
     * before escalation stops.
     */
    @Min(1)
    private int minUsableResults = 3;

    @Min(1)
    private int maxResultsPerQuery = 5;

    /**
     * Pass the known parts/labor domains to providers that can restrict by domain.
     */
    private boolean restrictToKnownDomains = true;

    private ProviderSettings tavily = new ProviderSettings("https://api.tavily.com");

    private ProviderSettings serper = new ProviderSettings("https://google.serper.dev");

    /**
     * Automotive parts retailers. Also the trust allowlist for price results.
     */
    private List<String> partsDomains = new ArrayList<>(List.of(
            "autozone.com", "amazon.com", "advanceautoparts.com", "rockauto.com",
            "partsgeek.com", "carparts.com", "1aauto.com", "oreillyauto.com"));

    /**
     * Labor time and repair cost sources. Also the trust allowlist for labor results.
     */
    private List<String> laborDomains = new ArrayList<>(List.of(
            "repairpal.com", "yourmechanic.com", "firestonecompleteautocare.com", "valvoline.com"));

    public List<String> domainsFor(String sourceHint) {
        if ("labor".equals(sourceHint)) {
            return laborDomains;
        }
        if ("parts".equals(sourceHint)) {
            return partsDomains;
        }
        return List.of();
    }

    /**
     * Connection settings for one search provider.
     */
    @Data
    public static class ProviderSettings {

        private boolean enabled = true;

        private String baseUrl;

        /**
         * API key. A provider without a key is treated as disabled.
         */
        private String apiKey;

        public ProviderSettings() {
        }

        public ProviderSettings(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public boolean isUsable() {
            return enabled && apiKey != null && !apiKey.isBlank();
        }
    }
}
