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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Web search using the Tavily API.
 *
 * <p>When domain restriction is on, the parts or labor domain list matching
 * the query's source hint is sent as {@code include_domains}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class TavilySearchProvider extends AbstractWebSearchProvider {

    private final WebClient webClient;
    private final SearchProperties props;

    public TavilySearchProvider(@Qualifier("tavilyWebClient") WebClient webClient,
                                SearchProperties props,
                                Clock clock) {
        super(clock);
        this.webClient = webClient;
        this.props = props;
    }

    @Override
    public String getName() {
        return "tavily";
    }

    @Override
    public boolean isEnabled() {
        return props.getTavily().isUsable();
    }

    @Override
    protected ServiceType serviceType() {
        return ServiceType.TAVILY;
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
                .bodyValue(buildRequest(query, maxResults))
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    Map<String, Object> buildRequest(SearchQuery query, int maxResults) {
        Map<String, Object> body = new HashMap<>();
        body.put("api_key", props.getTavily().getApiKey());
        body.put("query", query.getText());
        body.put("search_depth", "basic");
        body.put("include_answer", false);
        body.put("max_results", maxResults);
        List<String> domains = props.domainsFor(query.getSourceHint());
        if (props.isRestrictToKnownDomains() && !domains.isEmpty()) {
            body.put("include_domains", domains);
        }
        return body;
    }

    @Override
    protected List<RawResult> parse(JsonNode root) {
        List<RawResult> results = new ArrayList<>();
        Instant now = clock.instant();
        for (JsonNode hit : root.path("results")) {
            String url = text(hit, "url");
            if (url == null || url.isBlank()) {
                continue;
            }
            results.add(RawResult.builder()
                    .sourceUrl(url)
                    .title(text(hit, "title"))
                    .snippet(text(hit, "content"))
                    .retrievedAt(now)
                    .provider(getName())
                    .build());
        }
        return results;
    }
}
