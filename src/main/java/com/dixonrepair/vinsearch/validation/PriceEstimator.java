package com.dixonrepair.vinsearch.validation;

import com.dixonrepair.vinsearch.config.EngineProperties;
import com.dixonrepair.vinsearch.model.PriceEstimate;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.ScoredResult;
import com.dixonrepair.vinsearch.util.Stats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link PriceEstimate} from priced results.
 *
 * <p>Confidence = {@code min(n, 5)/5 * 50 + avgQuality * 0.4 + vinBonus},
 * clamped to 0-100, over the non-anomalous sources.
 */
@Component
@RequiredArgsConstructor
public class PriceEstimator {

    private static final double SOURCE_COUNT_POINTS = 50.0;
    private static final double QUALITY_FACTOR = 0.4;
    private static final double CONSISTENT_SPREAD = 0.3;
    private static final double MODERATE_SPREAD = 0.6;

    private final PriceAnomalyDetector anomalyDetector;
    private final EngineProperties engineProperties;

    /**
     * @return empty when no non-anomalous price remains
     */
    public Optional<PriceEstimate> estimate(List<ScoredResult> results) {
        List<ScoredResult> priced = results.stream()
                .filter(ScoredResult::hasPrice)
                .sorted(Comparator.comparing(ScoredResult::getSourceUrl, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
        if (priced.isEmpty()) {
            return Optional.empty();
        }

        List<ScoredResult> flagged = anomalyDetector.flag(priced);
        List<ScoredResult> kept = flagged.stream().filter(r -> !r.isAnomaly()).collect(Collectors.toList());
        List<ScoredResult> anomalies = flagged.stream().filter(ScoredResult::isAnomaly).collect(Collectors.toList());
        if (kept.isEmpty()) {
            return Optional.empty();
        }

        List<Double> prices = kept.stream().map(ScoredResult::getExtractedPrice).collect(Collectors.toList());
        double low = prices.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double high = prices.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double median = Stats.median(prices);
        double avgQuality = kept.stream().mapToInt(ScoredResult::getQualityScore).average().orElse(0.0);
        boolean vinTier = kept.stream().anyMatch(r -> r.getTier() == QueryTier.VIN_SPECIFIC);

        int saturation = engineProperties.getSourceSaturation();
        double confidence = Math.min(kept.size(), saturation) / (double) saturation * SOURCE_COUNT_POINTS
                + avgQuality * QUALITY_FACTOR
                + (vinTier ? engineProperties.getVinTierBonus() : 0);

        return Optional.of(PriceEstimate.builder()
                .low(low)
                .high(high)
                .median(median)
                .anomalies(List.copyOf(anomalies))
                .confidence(Stats.clamp(confidence, 0, 100))
                .sourceCount(kept.size())
                .vinTierContributed(vinTier)
                .recommendation(recommend(low, high, prices, !anomalies.isEmpty()))
                .build());
    }

    static String recommend(double low, double high, List<Double> prices, boolean hasAnomalies) {
        String range = String.format("$%.2f - $%.2f", low, high);
        double mean = Stats.mean(prices);
        double spread = mean > 0 ? (high - low) / mean : 0.0;
        if (spread < CONSISTENT_SPREAD) {
            return "Consistent pricing across sources (" + range + ")";
        }
        if (spread < MODERATE_SPREAD) {
            return "Moderate price variation, compare options (" + range + ")";
        }
        if (hasAnomalies) {
            return "Significant price variation detected, verify with multiple sources";
        }
        return "Limited price agreement, recommend additional price research";
    }
}
