package com.dixonrepair.vinsearch.search.provider;

import com.dixonrepair.vinsearch.config.SearchProperties;
import com.dixonrepair.vinsearch.model.RawResult;
import com.dixonrepair.vinsearch.model.SearchQuery;
import com.dixonrepair.vinsearch.model.ServiceType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google results through Serper. The API key travels in the
 * {@code X-API-KEY} default header of the injected client.
 */
@Slf4j
@Service
public class SerperSearchProvider extends AbstractWebSearchProvider {

    private final WebClient webClient;
    private final SearchProperties props;

    public SerperSearchProvider(@Qualifier("serperWebClient") WebClient webClient,
                                SearchProperties props,
                                Clock clock) {
        super(clock);
        this.webClient = webClient;
        this.props = props;
    }

    @Override
    public String getName() {
        return "serper";
    }

    @Override
    public boolean isEnabled() {
        return props.getSerper().isUsable();
    }

    @Override
    protected ServiceType serviceType() {
        return ServiceType.SERPER;
    }

    @Override
    protected Logger logger() {
        return log;
    }

    @Override
    protected Mono<JsonNode> call(SearchQuery query, int maxResults) {
        return webClient.post()
                .uri("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("q", query.getText(), "num", maxResults))
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    @Override
    protected List<RawResult> parse(JsonNode root) {
        List<RawResult> results = new ArrayList<>();
        Instant now = clock.instant();
        for (JsonNode hit : root.path("organic")) {
            String url = text(hit, "link");
            if (url == null || url.isBlank()) {
                continue;
            }
            results.add(RawResult.builder()
                    .sourceUrl(url)
                    .title(text(hit, "title"))
                    .snippet(text(hit, "snippet"))
                    .retrievedAt(now)
                    .provider(getName())
                    .build());
        }
        return results;
    }
}
