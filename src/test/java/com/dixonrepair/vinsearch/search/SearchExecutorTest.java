package com.dixonrepair.vinsearch.search;

import com.dixonrepair.vinsearch.config.SearchProperties;
import com.dixonrepair.vinsearch.model.QueryKind;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.RawResult;
import com.dixonrepair.vinsearch.model.ScoredResult;
import com.dixonrepair.vinsearch.model.SearchQuery;
import com.dixonrepair.vinsearch.query.QueryTierBuilder;
import com.dixonrepair.vinsearch.support.FakeSearchProvider;
import com.dixonrepair.vinsearch.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Search executor")
class SearchExecutorTest {

    private static final Duration GENEROUS_DEADLINE = Duration.ofSeconds(10);

    private final QueryTierBuilder queryTierBuilder = new QueryTierBuilder();
    private SearchProperties props;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        props = new SearchProperties();
        props.setProviderTimeoutMs(1_000);
        scheduler = Schedulers.newBoundedElastic(8, 100, "test-provider");
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private SearchExecutor executor(int maxRetries, SearchProvider... providers) {
        return new SearchExecutor(List.of(providers), TestFixtures.fastRetryPolicy(maxRetries),
                TestFixtures.resultScorer(), props, scheduler, Clock.systemUTC());
    }

    private Map<QueryTier, List<SearchQuery>> civicPriceTiers() {
        return queryTierBuilder.build("brake pads", QueryKind.PRICE, TestFixtures.civic());
    }

    @Test
    @DisplayName("Enough usable tier-1 results stop escalation")
    void stopsAtFirstSufficientTier() {
        // Given
        FakeSearchProvider provider = FakeSearchProvider.returning("fake",
                q -> TestFixtures.pricedProductPages("brake pads", 44.99, 45.99, 46.99));

        // When
        SearchOutcome outcome = executor(0, provider).execute(civicPriceTiers(), QueryKind.PRICE, GENEROUS_DEADLINE);

        // Then: both tier-1 queries ran, tiers 2 and 3 did not
        assertThat(outcome.getTiersAttempted()).containsExactly(QueryTier.VIN_SPECIFIC);
        assertThat(provider.getCalls()).isEqualTo(2);
        assertThat(outcome.getResults()).hasSize(3).allMatch(r -> r.getTier() == QueryTier.VIN_SPECIFIC);
        assertThat(outcome.isDeadlineExpired()).isFalse();
        assertThat(outcome.isAllProvidersFailed()).isFalse();
    }

    @Test
    @DisplayName("Too few usable results escalate; duplicates keep the most specific tier")
    void escalatesAndDeduplicates() {
        // Given: tier 1 finds one page, tier 2 finds the same page plus two new ones
        List<RawResult> tier1 = TestFixtures.pricedProductPages("brake pads", 45.00);
        List<RawResult> tier2 = TestFixtures.pricedProductPages("brake pads", 45.00, 46.00, 47.00);
        FakeSearchProvider provider = FakeSearchProvider.returning("fake", q -> {
            if (q.getTier() == QueryTier.VIN_SPECIFIC) {
                return tier1;
            }
            return q.getTier() == QueryTier.MAKE_MODEL_YEAR ? tier2 : List.of();
        });

        // When
        SearchOutcome outcome = executor(0, provider).execute(civicPriceTiers(), QueryKind.PRICE, GENEROUS_DEADLINE);

        // Then
        assertThat(outcome.getTiersAttempted()).containsExactly(QueryTier.VIN_SPECIFIC, QueryTier.MAKE_MODEL_YEAR);
        assertThat(outcome.getResults()).hasSize(3);
        ScoredResult shared = outcome.getResults().stream()
                .filter(r -> r.getSourceUrl().equals(tier1.get(0).getSourceUrl()))
                .findFirst()
                .orElseThrow();
        assertThat(shared.getTier()).isEqualTo(QueryTier.VIN_SPECIFIC);
    }

    @Test
    @DisplayName("Results without a price do not count toward the threshold")
    void unusableResultsEscalate() {
        FakeSearchProvider provider = FakeSearchProvider.returning("fake", q -> List.of(
                FakeSearchProvider.hit("https://example.com/forum/" + q.getTier().getNumber(), "Brake talk", "No prices here")));

        SearchOutcome outcome = executor(0, provider).execute(civicPriceTiers(), QueryKind.PRICE, GENEROUS_DEADLINE);

        assertThat(outcome.getTiersAttempted())
                .containsExactly(QueryTier.VIN_SPECIFIC, QueryTier.MAKE_MODEL_YEAR, QueryTier.GENERIC);
        assertThat(outcome.usableResults(QueryKind.PRICE)).isEmpty();
        assertThat(outcome.getResults()).hasSize(3);
        assertThat(outcome.isAllProvidersFailed()).isFalse();
    }

    @Test
    @DisplayName("Provider that fails twice then succeeds is retried transparently")
    void retriesTransientFailures() {
        FakeSearchProvider provider = FakeSearchProvider.failingTimes("flaky", 2,
                TestFixtures.pricedProductPages("brake pads", 44.99, 45.99, 46.99));

        SearchOutcome outcome = executor(3, provider)
                .execute(queryTierBuilder.build("brake pads", QueryKind.PRICE, null), QueryKind.PRICE, GENEROUS_DEADLINE);

        assertThat(outcome.usableResults(QueryKind.PRICE)).hasSize(3);
        assertThat(outcome.getDiagnostics()).isEmpty();
        assertThat(provider.getCalls()).isEqualTo(3);
    }

    @Test
    @DisplayName("Always-failing provider escalates through every tier without throwing")
    void alwaysFailingProvider() {
        // Given
        FakeSearchProvider provider = FakeSearchProvider.failingWithStatus("down", 503);

        // When
        SearchOutcome outcome = executor(2, provider).execute(civicPriceTiers(), QueryKind.PRICE, GENEROUS_DEADLINE);

        // Then: 4 queries, each tried 1 + 2 times
        assertThat(outcome.getTiersAttempted())
                .containsExactly(QueryTier.VIN_SPECIFIC, QueryTier.MAKE_MODEL_YEAR, QueryTier.GENERIC);
        assertThat(provider.getCalls()).isEqualTo(12);
        assertThat(outcome.isAllProvidersFailed()).isTrue();
        assertThat(outcome.getResults()).isEmpty();
        assertThat(outcome.getDiagnostics()).anyMatch(d -> d.contains("all providers failed"));
    }

    @Test
    @DisplayName("One healthy provider is enough; the failing one is only a diagnostic")
    void partialProviderFailure() {
        FakeSearchProvider broken = FakeSearchProvider.failingWithStatus("broken", 401);
        FakeSearchProvider healthy = FakeSearchProvider.returning("healthy",
                q -> TestFixtures.pricedProductPages("brake pads", 44.99, 45.99, 46.99));

        SearchOutcome outcome = executor(3, broken, healthy)
                .execute(queryTierBuilder.build("brake pads", QueryKind.PRICE, null), QueryKind.PRICE, GENEROUS_DEADLINE);

        assertThat(outcome.usableResults(QueryKind.PRICE)).hasSize(3);
        assertThat(outcome.isAllProvidersFailed()).isFalse();
        // 401 is not retried
        assertThat(broken.getCalls()).isEqualTo(1);
        assertThat(outcome.getDiagnostics()).anyMatch(d -> d.startsWith("broken failed"));
    }

    @Test
    @DisplayName("Disabled providers are never called")
    void disabledProviderSkipped() {
        FakeSearchProvider disabled = FakeSearchProvider.returning("off", q -> List.of()).disabled();

        SearchOutcome outcome = executor(0, disabled)
                .execute(queryTierBuilder.build("brake pads", QueryKind.PRICE, null), QueryKind.PRICE, GENEROUS_DEADLINE);

        assertThat(disabled.getCalls()).isZero();
        assertThat(outcome.isAllProvidersFailed()).isTrue();
        assertThat(outcome.getTiersAttempted()).isEmpty();
    }

    @Test
    @DisplayName("Call that never answers times out and is reported")
    void perCallTimeout() {
        props.setProviderTimeoutMs(100);
        FakeSearchProvider silent = new FakeSearchProvider("silent", q -> Mono.never());

        SearchOutcome outcome = executor(0, silent)
                .execute(queryTierBuilder.build("brake pads", QueryKind.PRICE, null), QueryKind.PRICE, GENEROUS_DEADLINE);

        assertThat(outcome.isAllProvidersFailed()).isTrue();
        assertThat(outcome.getDiagnostics()).anyMatch(d -> d.contains("timed out after 100ms"));
    }

    @Test
    @DisplayName("Deadline cancels slow calls in the last tier and returns partial results")
    void deadlineReturnsPartialResults() {
        // Given: one fast provider and one that takes far longer than the deadline
        props.setProviderTimeoutMs(5_000);
        FakeSearchProvider fast = FakeSearchProvider.returning("fast",
                q -> TestFixtures.pricedProductPages("brake pads", 45.99));
        FakeSearchProvider slow = new FakeSearchProvider("slow",
                q -> Mono.delay(Duration.ofSeconds(3)).thenReturn(TestFixtures.pricedProductPages("rotor", 80.0)));

        // When
        long start = System.nanoTime();
        SearchOutcome outcome = executor(0, fast, slow).execute(civicPriceTiers(), QueryKind.PRICE, Duration.ofMillis(300));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        // Then: tiers 1 and 2 end on their budget, tier 3 is cut by the deadline
        assertThat(outcome.isDeadlineExpired()).isTrue();
        assertThat(outcome.getTiersAttempted())
                .containsExactly(QueryTier.VIN_SPECIFIC, QueryTier.MAKE_MODEL_YEAR, QueryTier.GENERIC);
        assertThat(outcome.getResults()).extracting(ScoredResult::getExtractedPrice).containsExactly(45.99);
        assertThat(outcome.isAllProvidersFailed()).isFalse();
        assertThat(outcome.getDiagnostics()).anyMatch(d -> d.startsWith("slow failed"));
        assertThat(elapsedMs).isLessThan(2_000);
    }

    @Test
    @DisplayName("Hanging provider with retries cannot keep later tiers from running")
    void hangingProviderStillEscalates() {
        // Given: the full retry chain of the hanging provider is longer than the deadline
        props.setProviderTimeoutMs(800);
        FakeSearchProvider hanging = new FakeSearchProvider("hanging", q -> Mono.never());
        FakeSearchProvider genericOnly = FakeSearchProvider.returning("generic-only",
                q -> q.getTier() == QueryTier.GENERIC
                        ? TestFixtures.pricedProductPages("brake pads", 44.99, 45.99, 46.99)
                        : List.of());

        // When
        SearchOutcome outcome = executor(3, hanging, genericOnly)
                .execute(civicPriceTiers(), QueryKind.PRICE, Duration.ofMillis(2_000));

        // Then
        assertThat(outcome.getTiersAttempted())
                .containsExactly(QueryTier.VIN_SPECIFIC, QueryTier.MAKE_MODEL_YEAR, QueryTier.GENERIC);
        assertThat(outcome.usableResults(QueryKind.PRICE)).hasSize(3)
                .allMatch(r -> r.getTier() == QueryTier.GENERIC);
        assertThat(outcome.getDiagnostics()).anyMatch(d -> d.startsWith("hanging failed") && d.contains("timed out"));
        assertThat(outcome.isAllProvidersFailed()).isFalse();
    }
}
