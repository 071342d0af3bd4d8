package com.dixonrepair.vinsearch.search;

import com.dixonrepair.vinsearch.exception.ProviderException;
import com.dixonrepair.vinsearch.model.RawResult;
import com.dixonrepair.vinsearch.model.SearchQuery;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A web search backend.
 *
 * <p>Implementations issue exactly one remote call per subscription and
 * signal failures as {@link ProviderException} so the executor can decide
 * whether to retry. Timeouts and retries are applied by the executor, not
 * by providers.
 *
 * @since 1.0.0
 */
public interface SearchProvider {

    /**
     * Short stable name used in logs and diagnostics, e.g. "tavily".
     */
    String getName();

    /**
     * Disabled providers are skipped entirely.
     */
    boolean isEnabled();

    /**
     * @param query      query text plus source hint
     * @param maxResults upper bound on returned hits
     * @return hits in provider ranking order; possibly empty
     */
    Mono<List<RawResult>> search(SearchQuery query, int maxResults);
}
