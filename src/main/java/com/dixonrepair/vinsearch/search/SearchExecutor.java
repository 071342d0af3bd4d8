package com.dixonrepair.vinsearch.search;

import com.dixonrepair.vinsearch.config.SearchProperties;
import com.dixonrepair.vinsearch.exception.ProviderTimeoutException;
import com.dixonrepair.vinsearch.model.QueryKind;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.RawResult;
import com.dixonrepair.vinsearch.model.ScoredResult;
import com.dixonrepair.vinsearch.model.SearchQuery;
import com.dixonrepair.vinsearch.validation.ResultScorer;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs tiered queries against every enabled provider.
 *
 * <p>Within a tier all (query, provider) calls run concurrently on the
 * provider scheduler, each with its own timeout and retry policy. Single
 * call failures are recorded as diagnostics and never abort the search.
 * The next tier runs only while fewer than {@code minUsableResults}
 * usable results have been collected. Results are deduplicated by URL; the
 * first (most specific) tier to return a URL keeps it.
 *
 * <p>The deadline bounds each tier's merged stream by the time left. Every
 * tier but the last gets an equal share of the remaining time as its call
 * budget: a call still retrying when its budget runs out ends as a timeout
 * failure, so a hanging provider cannot starve the later tiers. When the
 * deadline itself fires, in-flight calls are cancelled and whatever arrived
 * is returned with {@link SearchOutcome#isDeadlineExpired()} set.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class SearchExecutor {

    private final List<SearchProvider> providers;
    private final RetryPolicy retryPolicy;
    private final ResultScorer scorer;
    private final SearchProperties props;
    private final Scheduler scheduler;
    private final Clock clock;

    public SearchExecutor(List<SearchProvider> providers,
                          RetryPolicy retryPolicy,
                          ResultScorer scorer,
                          SearchProperties props,
                          @Qualifier("providerScheduler") Scheduler scheduler,
                          Clock clock) {
        this.providers = providers;
        this.retryPolicy = retryPolicy;
        this.scorer = scorer;
        this.props = props;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public SearchOutcome execute(Map<QueryTier, List<SearchQuery>> tiers, QueryKind kind, Duration deadline) {
        Preconditions.checkNotNull(tiers, "Tiers cannot be null");
        Preconditions.checkNotNull(kind, "Query kind cannot be null");
        Preconditions.checkArgument(deadline != null && !deadline.isNegative(), "Deadline must be non-negative");

        List<String> diagnostics = new ArrayList<>();
        List<SearchProvider> active = providers.stream().filter(SearchProvider::isEnabled).collect(Collectors.toList());
        if (active.isEmpty()) {
            log.warn("No search providers enabled");
            diagnostics.add("No search providers are enabled");
            return SearchOutcome.builder()
                    .allProvidersFailed(true)
                    .diagnostics(diagnostics)
                    .build();
        }

        Instant deadlineAt = clock.instant().plus(deadline);
        Map<String, ScoredResult> byUrl = new LinkedHashMap<>();
        List<QueryTier> attempted = new ArrayList<>();
        boolean anyCallSucceeded = false;
        boolean deadlineExpired = false;

        List<Map.Entry<QueryTier, List<SearchQuery>>> pending = tiers.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .collect(Collectors.toList());

        for (int i = 0; i < pending.size(); i++) {
            QueryTier tier = pending.get(i).getKey();
            List<SearchQuery> queries = pending.get(i).getValue();

            Duration remaining = Duration.between(clock.instant(), deadlineAt);
            if (remaining.isZero() || remaining.isNegative()) {
                deadlineExpired = true;
                diagnostics.add("Deadline reached before tier " + tier.getNumber());
                break;
            }

            // Earlier tiers get an equal share so later tiers still run; the last tier may use all that is left
            int tiersLeft = pending.size() - i;
            Duration callBudget = tiersLeft > 1 ? remaining.dividedBy(tiersLeft) : null;

            attempted.add(tier);
            int expectedCalls = queries.size() * active.size();
            log.info("🔍 Tier {}: {} queries x {} providers, budget {}ms", tier.getNumber(), queries.size(), active.size(),
                    (callBudget == null ? remaining : callBudget).toMillis());

            List<CallOutcome> outcomes = runTier(queries, active, remaining, callBudget);

            boolean tierHadSuccess = false;
            for (CallOutcome outcome : outcomes) {
                if (outcome.failure != null) {
                    diagnostics.add(outcome.providerName + " failed for '" + outcome.query.getText() + "': "
                            + outcome.failure.getMessage());
                    continue;
                }
                tierHadSuccess = true;
                for (RawResult raw : outcome.results) {
                    String key = urlKey(raw.getSourceUrl());
                    if (key != null && !byUrl.containsKey(key)) {
                        byUrl.put(key, scorer.score(raw, tier, kind));
                    }
                }
            }
            anyCallSucceeded |= tierHadSuccess;

            if (!tierHadSuccess && outcomes.size() == expectedCalls) {
                log.warn("Tier {}: all providers failed, escalating", tier.getNumber());
                diagnostics.add("Tier " + tier.getNumber() + ": all providers failed");
            }

            if (outcomes.size() < expectedCalls) {
                deadlineExpired = true;
                log.warn("⏱️ Deadline reached during tier {} ({}/{} calls finished)",
                        tier.getNumber(), outcomes.size(), expectedCalls);
                diagnostics.add("Deadline reached during tier " + tier.getNumber() + ", results are partial");
                break;
            }

            long usable = byUrl.values().stream().filter(r -> r.isUsableFor(kind)).count();
            if (usable >= props.getMinUsableResults()) {
                log.info("✅ Tier {} yielded {} usable results, stopping", tier.getNumber(), usable);
                break;
            }
            log.info("Tier {}: {} usable results (< {}), escalating", tier.getNumber(), usable, props.getMinUsableResults());
        }

        boolean exhausted = !deadlineExpired && attempted.size() == pending.size();
        return SearchOutcome.builder()
                .results(List.copyOf(byUrl.values()))
                .tiersAttempted(List.copyOf(attempted))
                .deadlineExpired(deadlineExpired)
                .allProvidersFailed(exhausted && !anyCallSucceeded)
                .diagnostics(List.copyOf(diagnostics))
                .build();
    }

    private List<CallOutcome> runTier(List<SearchQuery> queries, List<SearchProvider> active,
                                      Duration remaining, Duration callBudget) {
        List<Mono<CallOutcome>> calls = new ArrayList<>();
        for (SearchQuery query : queries) {
            for (SearchProvider provider : active) {
                calls.add(call(provider, query, callBudget == null ? remaining : callBudget, callBudget != null));
            }
        }
        List<CallOutcome> outcomes = Flux.merge(calls)
                .take(remaining)
                .collectList()
                .block();
        return outcomes == null ? List.of() : outcomes;
    }

    /**
     * One (provider, query) call with per-attempt timeout and retries.
     *
     * @param budget  time the call may spend across all attempts; also caps the per-attempt timeout
     * @param bounded when true, running out of budget ends the call as a failure instead of
     *                leaving it to the tier deadline
     */
    Mono<CallOutcome> call(SearchProvider provider, SearchQuery query, Duration budget, boolean bounded) {
        long timeoutMs = Math.max(1L, Math.min(props.getProviderTimeoutMs(), budget.toMillis()));
        int maxResults = props.getMaxResultsPerQuery();
        String label = provider.getName() + ": " + query.getText();

        Mono<List<RawResult>> attempts = Mono.defer(() -> provider.search(query, maxResults))
                .timeout(Duration.ofMillis(timeoutMs))
                .onErrorMap(TimeoutException.class, e -> new ProviderTimeoutException(provider.getName(), timeoutMs, e))
                .retryWhen(retryPolicy.toRetrySpec(label));
        if (bounded) {
            attempts = attempts.timeout(budget, Mono.error(() -> new ProviderTimeoutException(
                    provider.getName(), budget.toMillis(), null)));
        }

        return attempts
                .map(results -> CallOutcome.success(provider.getName(), query,
                        results.size() > maxResults ? results.subList(0, maxResults) : results))
                .onErrorResume(e -> {
                    log.warn("Provider {} gave up on '{}': {}", provider.getName(), query.getText(), e.getMessage());
                    return Mono.just(CallOutcome.failure(provider.getName(), query, e));
                })
                .subscribeOn(scheduler);
    }

    static String urlKey(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String key = url.trim().toLowerCase(Locale.ROOT);
        return key.endsWith("/") ? key.substring(0, key.length() - 1) : key;
    }

    static final class CallOutcome {
        final String providerName;
        final SearchQuery query;
        final List<RawResult> results;
        final Throwable failure;

        private CallOutcome(String providerName, SearchQuery query, List<RawResult> results, Throwable failure) {
            this.providerName = providerName;
            this.query = query;
            this.results = results;
            this.failure = failure;
        }

        static CallOutcome success(String providerName, SearchQuery query, List<RawResult> results) {
            return new CallOutcome(providerName, query, results, null);
        }

        static CallOutcome failure(String providerName, SearchQuery query, Throwable failure) {
            return new CallOutcome(providerName, query, List.of(), failure);
        }
    }
}
