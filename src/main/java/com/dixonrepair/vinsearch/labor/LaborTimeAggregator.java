package com.dixonrepair.vinsearch.labor;

import com.dixonrepair.vinsearch.config.EngineProperties;
import com.dixonrepair.vinsearch.model.LaborEstimate;
import com.dixonrepair.vinsearch.model.LaborFigure;
import com.dixonrepair.vinsearch.util.Stats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Combines per-source labor figures into one estimate.
 *
 * <p>The point estimate is the mean of the figure midpoints, after dropping
 * the single highest and lowest once there are at least
 * {@value #MIN_SAMPLES_TO_TRIM} figures. The interval half-width is the
 * larger of the average quoted half-spread and the standard deviation of the
 * kept midpoints.
 *
 * <p>Confidence blends sample count (60%) and agreement between sources
 * (40%), where agreement is {@code 1 - min(cv, 1)}. A single source has no
 * measurable agreement and scores a neutral 0.5 on that part.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LaborTimeAggregator {

    static final int MIN_SAMPLES_TO_TRIM = 5;
    private static final double COUNT_WEIGHT = 0.6;
    private static final double AGREEMENT_WEIGHT = 0.4;
    private static final double SINGLE_SAMPLE_AGREEMENT = 0.5;

    private final EngineProperties engineProperties;

    public Optional<LaborEstimate> aggregate(List<LaborFigure> figures) {
        if (figures == null || figures.isEmpty()) {
            return Optional.empty();
        }

        List<Double> midpoints = figures.stream()
                .map(LaborFigure::midpoint)
                .sorted()
                .collect(Collectors.toList());
        List<Double> kept = midpoints.size() >= MIN_SAMPLES_TO_TRIM
                ? new ArrayList<>(midpoints.subList(1, midpoints.size() - 1))
                : midpoints;

        double point = Stats.trimmedMean(midpoints, MIN_SAMPLES_TO_TRIM);
        double spread = Stats.standardDeviation(kept);
        double quotedHalfSpread = figures.stream().mapToDouble(LaborFigure::halfSpread).average().orElse(0.0);
        double halfWidth = Math.max(quotedHalfSpread, spread);

        int n = figures.size();
        double agreement = n < 2 || point <= 0
                ? SINGLE_SAMPLE_AGREEMENT
                : 1.0 - Math.min(spread / point, 1.0);
        double countFactor = Math.min(n, engineProperties.getSourceSaturation()) / (double) engineProperties.getSourceSaturation();
        int confidence = Stats.clamp(100 * (COUNT_WEIGHT * countFactor + AGREEMENT_WEIGHT * agreement), 0, 100);

        LaborEstimate estimate = LaborEstimate.builder()
                .minutesPoint(point)
                .minutesLow(Math.max(0.0, point - halfWidth))
                .minutesHigh(point + halfWidth)
                .confidence(confidence)
                .sampleCount(n)
                .build();

        log.debug("Labor estimate from {} figures: {} min ({}-{}), confidence {}",
                n, Math.round(point), Math.round(estimate.getMinutesLow()), Math.round(estimate.getMinutesHigh()), confidence);
        return Optional.of(estimate);
    }
}
