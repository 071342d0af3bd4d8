package com.dixonrepair.vinsearch.search.provider;

import com.dixonrepair.vinsearch.config.SearchProperties;
import com.dixonrepair.vinsearch.exception.ProviderException;
import com.dixonrepair.vinsearch.model.QueryKind;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.RawResult;
import com.dixonrepair.vinsearch.model.SearchQuery;
import com.dixonrepair.vinsearch.support.MutableClock;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Tavily search provider")
class TavilySearchProviderTest {

    private static final SearchQuery PRICE_QUERY = SearchQuery.builder()
            .text("2021 Honda Civic EX brake pads")
            .tier(QueryTier.VIN_SPECIFIC)
            .kind(QueryKind.PRICE)
            .sourceHint(QueryKind.PRICE.getSourceHint())
            .build();

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
    private SearchProperties props;

    @BeforeEach
    void setUp() {
        props = new SearchProperties();
        props.getTavily().setApiKey("tvly-test");
    }

    private TavilySearchProvider providerReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
        return new TavilySearchProvider(webClient, props, clock);
    }

    @Test
    @DisplayName("Results are mapped and entries without a URL are skipped")
    void parsesResults() {
        String body = "{\"results\":["
                + "{\"url\":\"https://www.autozone.com/p/brake-pads-1001\",\"title\":\"Brake Pads\",\"content\":\"$45.99\"},"
                + "{\"title\":\"No link\",\"content\":\"ignored\"}]}";

        StepVerifier.create(providerReturning(HttpStatus.OK, body).search(PRICE_QUERY, 5))
                .assertNext(results -> {
                    assertThat(results).hasSize(1);
                    RawResult hit = results.get(0);
                    assertThat(hit.getSourceUrl()).isEqualTo("https://www.autozone.com/p/brake-pads-1001");
                    assertThat(hit.getSnippet()).isEqualTo("$45.99");
                    assertThat(hit.getProvider()).isEqualTo("tavily");
                    assertThat(hit.getRetrievedAt()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Server errors become transient provider exceptions")
    void serverErrorIsTransient() {
        StepVerifier.create(providerReturning(HttpStatus.SERVICE_UNAVAILABLE, "{}").search(PRICE_QUERY, 5))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ProviderException.class);
                    assertThat(((ProviderException) e).getStatusCode()).isEqualTo(503);
                    assertThat(((ProviderException) e).isTransientFailure()).isTrue();
                })
                .verify();
    }

    @Test
    @DisplayName("Bad API key is not transient")
    void unauthorizedIsPermanent() {
        StepVerifier.create(providerReturning(HttpStatus.UNAUTHORIZED, "{}").search(PRICE_QUERY, 5))
                .expectErrorSatisfies(e -> assertThat(((ProviderException) e).isTransientFailure()).isFalse())
                .verify();
    }

    @Test
    @DisplayName("Price queries are restricted to the parts retailer allowlist")
    void requestRestrictsDomains() {
        Map<String, Object> request = providerReturning(HttpStatus.OK, "{}").buildRequest(PRICE_QUERY, 5);

        assertThat(request).containsEntry("query", "2021 Honda Civic EX brake pads")
                .containsEntry("max_results", 5)
                .containsEntry("api_key", "tvly-test");
        assertThat(request.get("include_domains"))
                .asInstanceOf(InstanceOfAssertFactories.list(String.class))
                .contains("autozone.com", "rockauto.com");

        props.setRestrictToKnownDomains(false);
        assertThat(providerReturning(HttpStatus.OK, "{}").buildRequest(PRICE_QUERY, 5)).doesNotContainKey("include_domains");
    }

    @Test
    void enabledOnlyWithApiKey() {
        assertThat(providerReturning(HttpStatus.OK, "{}").isEnabled()).isTrue();

        props.getTavily().setApiKey(" ");
        assertThat(providerReturning(HttpStatus.OK, "{}").isEnabled()).isFalse();
    }
}
