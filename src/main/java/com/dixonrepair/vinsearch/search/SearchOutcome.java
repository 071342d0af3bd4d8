package com.dixonrepair.vinsearch.search;

import com.dixonrepair.vinsearch.model.QueryKind;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.ScoredResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the tiered search produced, deduplicated by URL.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class SearchOutcome {

    @Builder.Default
    List<ScoredResult> results = List.of();

    @Builder.Default
    List<QueryTier> tiersAttempted = List.of();

    /**
     * The deadline ran out before the search finished; results are partial.
     */
    boolean deadlineExpired;

    /**
     * Every provider failed on every tier. Never set when at least one call
     * succeeded, even with zero hits.
     */
    boolean allProvidersFailed;

    @Builder.Default
    List<String> diagnostics = List.of();

    public List<ScoredResult> usableResults(QueryKind kind) {
        return results.stream().filter(r -> r.isUsableFor(kind)).toList();
    }
}
