package com.dixonrepair.vinsearch.validation;

import com.dixonrepair.vinsearch.config.ValidationProperties;
import com.dixonrepair.vinsearch.model.ScoredResult;
import com.dixonrepair.vinsearch.util.Stats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Cross-source price check.
 *
 * <p>With at least {@code minPricesForAnomalyDetection} prices, a price
 * outside {@code median ± iqrMultiplier * IQR} is flagged. With fewer prices
 * nothing is flagged. The flags depend only on the set of prices, so running
 * the detector on its own output changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceAnomalyDetector {

    private final ValidationProperties props;

    /**
     * @param results results that carry a price
     * @return the same results, in the same order, with anomaly flags recomputed
     */
    public List<ScoredResult> flag(List<ScoredResult> results) {
        List<Double> prices = results.stream()
                .filter(ScoredResult::hasPrice)
                .map(ScoredResult::getExtractedPrice)
                .collect(Collectors.toList());

        if (prices.size() < props.getMinPricesForAnomalyDetection()) {
            return results.stream().map(r -> r.withAnomaly(false)).collect(Collectors.toList());
        }

        double median = Stats.median(prices);
        double fence = props.getIqrMultiplier() * Stats.interquartileRange(prices);
        double lower = median - fence;
        double upper = median + fence;

        List<ScoredResult> flagged = results.stream()
                .map(r -> r.withAnomaly(r.hasPrice() && (r.getExtractedPrice() < lower || r.getExtractedPrice() > upper)))
                .collect(Collectors.toList());

        long anomalies = flagged.stream().filter(ScoredResult::isAnomaly).count();
        if (anomalies > 0) {
            log.info("⚠️ {} of {} prices outside [{}, {}]", anomalies, prices.size(),
                    String.format("%.2f", lower), String.format("%.2f", upper));
        }
        return flagged;
    }
}
