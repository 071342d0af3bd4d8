package com.dixonrepair.vinsearch.validation;

import com.dixonrepair.vinsearch.config.SearchProperties;
import com.dixonrepair.vinsearch.config.ValidationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Trust score for the domain a result came from. Allowlisted parts
 * retailers and labor sources get the trusted score, everything else the
 * unknown score. Subdomains of an allowlisted domain count as allowlisted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetailerTrustScorer {

    private final SearchProperties searchProperties;
    private final ValidationProperties validationProperties;

    public int score(String url) {
        String host = host(url);
        if (host == null) {
            return validationProperties.getUnknownScore();
        }
        boolean trusted = Stream.concat(searchProperties.getPartsDomains().stream(), searchProperties.getLaborDomains().stream())
                .map(d -> d.toLowerCase(Locale.ROOT))
                .anyMatch(d -> host.equals(d) || host.endsWith("." + d));
        return trusted ? validationProperties.getTrustedScore() : validationProperties.getUnknownScore();
    }

    static String host(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = URI.create(url.trim()).getHost();
            if (host == null) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable URL '{}': {}", url, e.getMessage());
            return null;
        }
    }
}
