package com.dixonrepair.vinsearch.search.provider;

import com.dixonrepair.vinsearch.exception.ProviderException;
import com.dixonrepair.vinsearch.model.CallContext;
import com.dixonrepair.vinsearch.model.RawResult;
import com.dixonrepair.vinsearch.model.SearchQuery;
import com.dixonrepair.vinsearch.model.ServiceType;
import com.dixonrepair.vinsearch.search.SearchProvider;
import com.dixonrepair.vinsearch.util.ExternalCallLogger;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Shared plumbing for JSON search APIs called through WebClient: call
 * logging and translation of transport errors into {@link ProviderException}.
 */
public abstract class AbstractWebSearchProvider implements SearchProvider {

    protected final Clock clock;

    protected AbstractWebSearchProvider(Clock clock) {
        this.clock = clock;
    }

    protected abstract ServiceType serviceType();

    protected abstract Logger logger();

    /**
     * The raw JSON call. Errors are translated by {@link #search}.
     */
    protected abstract Mono<JsonNode> call(SearchQuery query, int maxResults);

    protected abstract List<RawResult> parse(JsonNode root);

    @Override
    public Mono<List<RawResult>> search(SearchQuery query, int maxResults) {
        Preconditions.checkNotNull(query, "Query cannot be null");
        Preconditions.checkArgument(maxResults > 0, "maxResults must be positive");

        return Mono.defer(() -> {
            CallContext ctx = ExternalCallLogger.startCall(serviceType(), "search", logger());
            ctx.logRequest(ExternalCallLogger.truncate(query.getText(), 120));
            return call(query, maxResults)
                    .map(this::parse)
                    .defaultIfEmpty(List.of())
                    .doOnNext(results -> ctx.logResponse(results.size() + " results"))
                    .onErrorMap(this::translate)
                    .doOnError(e -> ctx.logError(e.getMessage(), e));
        });
    }

    private Throwable translate(Throwable e) {
        if (e instanceof ProviderException) {
            return e;
        }
        if (e instanceof WebClientResponseException) {
            return ProviderException.fromStatus(getName(), ((WebClientResponseException) e).getStatusCode().value(), e);
        }
        if (e instanceof WebClientRequestException) {
            return new ProviderException(getName(), getName() + " connection failed: " + e.getMessage(), 0, true, e);
        }
        return new ProviderException(getName(), getName() + " failed: " + e.getMessage(), 0, false, e);
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
