package com.dixonrepair.vinsearch.engine.impl;

import com.dixonrepair.vinsearch.cache.SearchCacheManager;
import com.dixonrepair.vinsearch.config.EngineProperties;
import com.dixonrepair.vinsearch.engine.ConfidenceCalculator;
import com.dixonrepair.vinsearch.engine.RepairSearchEngine;
import com.dixonrepair.vinsearch.exception.NoUsableResultsException;
import com.dixonrepair.vinsearch.exception.VehicleResolutionException;
import com.dixonrepair.vinsearch.labor.LaborTimeAggregator;
import com.dixonrepair.vinsearch.model.EngineResult;
import com.dixonrepair.vinsearch.model.EngineState;
import com.dixonrepair.vinsearch.model.LaborEstimate;
import com.dixonrepair.vinsearch.model.LaborFigure;
import com.dixonrepair.vinsearch.model.PriceEstimate;
import com.dixonrepair.vinsearch.model.QueryKind;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.ResultSource;
import com.dixonrepair.vinsearch.model.ScoredResult;
import com.dixonrepair.vinsearch.model.SearchQuery;
import com.dixonrepair.vinsearch.model.VehicleProfile;
import com.dixonrepair.vinsearch.query.QueryTierBuilder;
import com.dixonrepair.vinsearch.search.SearchExecutor;
import com.dixonrepair.vinsearch.search.SearchOutcome;
import com.dixonrepair.vinsearch.util.ExternalCallLogger;
import com.dixonrepair.vinsearch.validation.PriceEstimator;
import com.dixonrepair.vinsearch.vehicle.VehicleProfileResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Default engine: resolve, build queries, search tier by tier, validate,
 * aggregate, cache.
 *
 * <p>State flow:
 * <pre>
 * INIT → RESOLVING_VEHICLE (VIN variants only) → BUILDING_QUERIES → SEARCHING ⇄ VALIDATING
 *      → AGGREGATING → CACHE_WRITE → DONE
 * </pre>
 * A failed resolution is recorded as {@code VEHICLE_RESOLUTION_SKIPPED} and the
 * request continues without a vehicle. A search that yields nothing usable
 * ends in {@code NO_USABLE_RESULTS}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepairSearchEngineImpl implements RepairSearchEngine {

    private final VehicleProfileResolver resolver;
    private final QueryTierBuilder queryTierBuilder;
    private final SearchExecutor searchExecutor;
    private final PriceEstimator priceEstimator;
    private final LaborTimeAggregator laborAggregator;
    private final ConfidenceCalculator confidenceCalculator;
    private final SearchCacheManager cache;
    private final EngineProperties props;
    private final Clock clock;

    @Override
    public VehicleProfile resolveVehicle(String vin) {
        return resolver.resolve(vin);
    }

    @Override
    public EngineResult searchPartPrice(String description, VehicleProfile profile) {
        return searchPartPrice(description, profile, defaultDeadline());
    }

    @Override
    public EngineResult searchPartPrice(String description, VehicleProfile profile, Duration deadline) {
        return run(description, QueryKind.PRICE, profile, deadline, new ArrayList<>());
    }

    @Override
    public EngineResult searchLaborTime(String description, VehicleProfile profile) {
        return searchLaborTime(description, profile, defaultDeadline());
    }

    @Override
    public EngineResult searchLaborTime(String description, VehicleProfile profile, Duration deadline) {
        return run(description, QueryKind.LABOR_TIME, profile, deadline, new ArrayList<>());
    }

    @Override
    public EngineResult searchPartPriceForVin(String vin, String description) {
        return searchPartPriceForVin(vin, description, defaultDeadline());
    }

    @Override
    public EngineResult searchPartPriceForVin(String vin, String description, Duration deadline) {
        return runForVin(vin, description, QueryKind.PRICE, deadline);
    }

    @Override
    public EngineResult searchLaborTimeForVin(String vin, String description) {
        return searchLaborTimeForVin(vin, description, defaultDeadline());
    }

    @Override
    public EngineResult searchLaborTimeForVin(String vin, String description, Duration deadline) {
        return runForVin(vin, description, QueryKind.LABOR_TIME, deadline);
    }

    private EngineResult runForVin(String vin, String description, QueryKind kind, Duration deadline) {
        Duration total = effectiveDeadline(deadline);
        Instant start = clock.instant();
        List<String> diagnostics = new ArrayList<>();
        VehicleProfile profile = resolveOrSkip(vin, diagnostics);

        Duration searchDeadline = total.minus(Duration.between(start, clock.instant()));
        if (searchDeadline.isNegative()) {
            searchDeadline = Duration.ZERO;
        }
        return run(description, kind, profile, searchDeadline, diagnostics);
    }

    private VehicleProfile resolveOrSkip(String vin, List<String> diagnostics) {
        log.debug("State {} for {}", EngineState.RESOLVING_VEHICLE, ExternalCallLogger.maskVin(vin));
        try {
            return resolver.resolve(vin);
        } catch (VehicleResolutionException e) {
            log.info("Vehicle resolution skipped for {}: {}", ExternalCallLogger.maskVin(vin), e.getMessage());
            diagnostics.add(EngineState.VEHICLE_RESOLUTION_SKIPPED + ": " + e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.warn("Unexpected error resolving {}", ExternalCallLogger.maskVin(vin), e);
            diagnostics.add(EngineState.VEHICLE_RESOLUTION_SKIPPED + ": " + e.getMessage());
            return null;
        }
    }

    private EngineResult run(String description, QueryKind kind, VehicleProfile profile,
                             Duration deadline, List<String> diagnostics) {
        if (description == null || description.isBlank()) {
            return EngineResult.failure(description, kind, profile, EngineState.INIT,
                    "A part or repair description is required", diagnostics);
        }
        Duration effectiveDeadline = effectiveDeadline(deadline);

        EngineState state = EngineState.INIT;
        SearchOutcome outcome = SearchOutcome.builder().build();
        try {
            String cacheKey = cacheKey(kind, profile, description);
            Optional<EngineResult> cached = cache.get(cacheKey, kind.cacheType(), EngineResult.class);
            if (cached.isPresent()) {
                log.info("⚡ {} for '{}' served from cache", kind, description);
                return cached.get().asCached();
            }

            state = EngineState.BUILDING_QUERIES;
            Map<QueryTier, List<SearchQuery>> tiers = queryTierBuilder.build(description, kind, profile);

            state = EngineState.SEARCHING;
            outcome = searchExecutor.execute(tiers, kind, effectiveDeadline);
            diagnostics.addAll(outcome.getDiagnostics());

            state = EngineState.VALIDATING;
            List<ScoredResult> usable = outcome.usableResults(kind);
            if (usable.isEmpty()) {
                throw new NoUsableResultsException(description, "No usable results after " + outcome.getTiersAttempted());
            }

            state = EngineState.AGGREGATING;
            EngineResult result = kind == QueryKind.PRICE
                    ? aggregatePrice(description, profile, usable, outcome, diagnostics)
                    : aggregateLabor(description, profile, usable, outcome, diagnostics);

            state = EngineState.CACHE_WRITE;
            if (outcome.isDeadlineExpired()) {
                log.info("Partial {} result for '{}' not cached", kind, description);
            } else {
                cache.put(cacheKey, kind.cacheType(), result);
            }

            log.info("✅ {} for '{}': confidence {} (tiers {})",
                    kind, description, result.getOverallConfidence(), outcome.getTiersAttempted());
            return result;

        } catch (NoUsableResultsException e) {
            return noUsableResults(description, kind, profile, outcome, diagnostics);
        } catch (RuntimeException e) {
            log.error("❌ {} search for '{}' failed in state {}", kind, description, state, e);
            return EngineResult.failure(description, kind, profile, state,
                    "The search could not be completed: " + e.getMessage(), diagnostics);
        }
    }

    private EngineResult aggregatePrice(String description, VehicleProfile profile, List<ScoredResult> usable,
                                        SearchOutcome outcome, List<String> diagnostics) {
        Optional<PriceEstimate> estimate = priceEstimator.estimate(usable);
        if (estimate.isEmpty()) {
            throw new NoUsableResultsException(description, "Every price was flagged as an anomaly");
        }

        Set<String> anomalyUrls = estimate.get().getAnomalies().stream()
                .map(ScoredResult::getSourceUrl)
                .collect(Collectors.toSet());
        List<ScoredResult> contributing = usable.stream()
                .filter(r -> !anomalyUrls.contains(r.getSourceUrl()))
                .collect(Collectors.toList());

        QueryTier bestTier = bestTier(contributing);
        double avgQuality = contributing.stream().mapToInt(ScoredResult::getQualityScore).average().orElse(0.0);
        double evidence = confidenceCalculator.priceEvidence(contributing.size(), avgQuality);
        int overall = confidenceCalculator.overall(bestTier, evidence, outcome.isDeadlineExpired());

        return success(description, QueryKind.PRICE, profile, outcome, diagnostics, overall)
                .priceEstimate(estimate.get())
                .build();
    }

    private EngineResult aggregateLabor(String description, VehicleProfile profile, List<ScoredResult> usable,
                                        SearchOutcome outcome, List<String> diagnostics) {
        List<LaborFigure> figures = usable.stream()
                .map(ScoredResult::getLaborFigure)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        Optional<LaborEstimate> estimate = laborAggregator.aggregate(figures);
        if (estimate.isEmpty()) {
            throw new NoUsableResultsException(description, "No labor figures to aggregate");
        }

        QueryTier bestTier = bestTier(usable);
        double evidence = confidenceCalculator.laborEvidence(estimate.get().getConfidence());
        int overall = confidenceCalculator.overall(bestTier, evidence, outcome.isDeadlineExpired());

        return success(description, QueryKind.LABOR_TIME, profile, outcome, diagnostics, overall)
                .laborEstimate(estimate.get())
                .build();
    }

    private EngineResult.EngineResultBuilder success(String description, QueryKind kind, VehicleProfile profile,
                                                     SearchOutcome outcome, List<String> diagnostics, int overall) {
        return EngineResult.builder()
                .query(description)
                .kind(kind)
                .vehicleProfile(profile)
                .overallConfidence(overall)
                .source(ResultSource.LIVE)
                .finalState(EngineState.DONE)
                .tiersAttempted(outcome.getTiersAttempted())
                .diagnostics(List.copyOf(diagnostics));
    }

    private EngineResult noUsableResults(String description, QueryKind kind, VehicleProfile profile,
                                         SearchOutcome outcome, List<String> diagnostics) {
        String reason;
        if (outcome.isAllProvidersFailed()) {
            reason = "All search providers failed; try again later";
        } else if (outcome.isDeadlineExpired()) {
            reason = "The search ran out of time before usable results were found";
        } else if (kind == QueryKind.PRICE) {
            reason = "No reliable price information found for '" + description + "'";
        } else {
            reason = "No labor time information found for '" + description + "'";
        }
        log.warn("{} for '{}': {}", EngineState.NO_USABLE_RESULTS, description, reason);
        return EngineResult.failure(description, kind, profile, EngineState.NO_USABLE_RESULTS, reason, diagnostics)
                .toBuilder()
                .tiersAttempted(outcome.getTiersAttempted())
                .build();
    }

    private static QueryTier bestTier(List<ScoredResult> results) {
        return results.stream()
                .map(ScoredResult::getTier)
                .min(Enum::compareTo)
                .orElse(QueryTier.GENERIC);
    }

    /**
     * Vehicle identity (label, trim, engine, whether a VIN backed it) plus the
     * description, so VIN-specific and generic results never share an entry.
     */
    static String cacheKey(QueryKind kind, VehicleProfile profile, String description) {
        String vehicle = profile == null ? "any" : Stream.of(
                        profile.label(),
                        profile.getTrim(),
                        profile.getEngine(),
                        profile.isVinResolved() ? "vin" : null)
                .filter(Objects::nonNull)
                .filter(s -> !s.isBlank())
                .collect(Collectors.joining(" "));
        return kind.name() + " | " + vehicle + " | " + description;
    }

    private Duration effectiveDeadline(Duration deadline) {
        return deadline == null || deadline.isNegative() ? defaultDeadline() : deadline;
    }

    private Duration defaultDeadline() {
        return Duration.ofMillis(props.getDefaultDeadlineMs());
    }
}
