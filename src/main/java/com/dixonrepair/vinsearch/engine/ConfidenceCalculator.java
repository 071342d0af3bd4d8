package com.dixonrepair.vinsearch.engine;

import com.dixonrepair.vinsearch.config.EngineProperties;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.util.Stats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Overall confidence of an engine result.
 *
 * <pre>
 *   overall = tierBase(bestTier) * (floor + (1 - floor) * evidence)
 * </pre>
 * With the same evidence a more specific tier always scores at least as
 * high as a less specific one. Partial (deadline-cut) results are
 * multiplied by the incomplete discount.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceCalculator {

    private final EngineProperties props;

    public int overall(QueryTier bestTier, double evidence, boolean incomplete) {
        double clampedEvidence = Math.max(0.0, Math.min(1.0, evidence));
        double floor = props.getEvidenceFloor();
        double value = tierBase(bestTier) * (floor + (1.0 - floor) * clampedEvidence);
        if (incomplete) {
            value *= props.getIncompleteDiscount();
        }
        return Stats.clamp(value, 0, 100);
    }

    public int tierBase(QueryTier tier) {
        switch (tier) {
            case VIN_SPECIFIC:
                return props.getTier1ConfidenceBase();
            case MAKE_MODEL_YEAR:
                return props.getTier2ConfidenceBase();
            default:
                return props.getTier3ConfidenceBase();
        }
    }

    /**
     * Price evidence: half source saturation, half average quality.
     *
     * @param avgQuality average quality score (0-100) of the contributing sources
     */
    public double priceEvidence(int sourceCount, double avgQuality) {
        int saturation = props.getSourceSaturation();
        return 0.5 * Math.min(sourceCount, saturation) / saturation + 0.5 * (avgQuality / 100.0);
    }

    public double laborEvidence(int laborConfidence) {
        return laborConfidence / 100.0;
    }
}
