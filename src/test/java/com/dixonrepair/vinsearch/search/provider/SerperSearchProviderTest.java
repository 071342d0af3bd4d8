package com.dixonrepair.vinsearch.search.provider;

import com.dixonrepair.vinsearch.config.SearchProperties;
import com.dixonrepair.vinsearch.exception.ProviderException;
import com.dixonrepair.vinsearch.model.QueryKind;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.RawResult;
import com.dixonrepair.vinsearch.model.SearchQuery;
import com.dixonrepair.vinsearch.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Serper search provider")
class SerperSearchProviderTest {

    private static final SearchQuery LABOR_QUERY = SearchQuery.builder()
            .text("brake pad replacement labor time")
            .tier(QueryTier.GENERIC)
            .kind(QueryKind.LABOR_TIME)
            .sourceHint(QueryKind.LABOR_TIME.getSourceHint())
            .build();

    private SerperSearchProvider providerReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
        return new SerperSearchProvider(webClient, new SearchProperties(), MutableClock.startingAt("2024-05-01T12:00:00Z"));
    }

    @Test
    @DisplayName("Organic results are mapped")
    void parsesOrganicResults() {
        String body = "{\"organic\":[{\"link\":\"https://repairpal.com/brake-pad-replacement\","
                + "\"title\":\"Brake Pad Replacement Cost\",\"snippet\":\"Takes 1-2 hours\"}],"
                + "\"knowledgeGraph\":{\"title\":\"ignored\"}}";

        StepVerifier.create(providerReturning(HttpStatus.OK, body).search(LABOR_QUERY, 5))
                .assertNext(results -> assertThat(results)
                        .singleElement()
                        .extracting(RawResult::getSnippet)
                        .isEqualTo("Takes 1-2 hours"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Missing organic block means no results, not an error")
    void noOrganicResults() {
        StepVerifier.create(providerReturning(HttpStatus.OK, "{\"searchParameters\":{}}").search(LABOR_QUERY, 5))
                .assertNext(results -> assertThat(results).isEmpty())
                .verifyComplete();
    }

    @Test
    @DisplayName("Rate limiting is transient")
    void rateLimited() {
        StepVerifier.create(providerReturning(HttpStatus.TOO_MANY_REQUESTS, "{}").search(LABOR_QUERY, 5))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ProviderException.class);
                    assertThat(((ProviderException) e).isTransientFailure()).isTrue();
                    assertThat(e.getMessage()).isEqualTo("serper returned HTTP 429");
                })
                .verify();
    }

    @Test
    void disabledByDefault() {
        assertThat(providerReturning(HttpStatus.OK, "{}").isEnabled()).isFalse();
    }
}
