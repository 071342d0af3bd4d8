package com.dixonrepair.vinsearch.validation;

import com.dixonrepair.vinsearch.labor.LaborTimeParser;
import com.dixonrepair.vinsearch.model.LaborFigure;
import com.dixonrepair.vinsearch.model.PageType;
import com.dixonrepair.vinsearch.model.QueryKind;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.RawResult;
import com.dixonrepair.vinsearch.model.ScoredResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a raw hit into a {@link ScoredResult}.
 *
 * <p>Quality = {@code (trust/100)*0.4 + pageWeight*0.3 + extracted*0.3},
 * scaled to 0-100, where {@code extracted} is 1 when the figure the request
 * kind needs (price or labor time) was found.
 */
@Component
@RequiredArgsConstructor
public class ResultScorer {

    static final double TRUST_WEIGHT = 0.4;
    static final double PAGE_WEIGHT = 0.3;
    static final double EXTRACTION_WEIGHT = 0.3;

    private final PriceExtractor priceExtractor;
    private final LaborTimeParser laborTimeParser;
    private final PageTypeClassifier pageTypeClassifier;
    private final AvailabilityDetector availabilityDetector;
    private final RetailerTrustScorer trustScorer;

    public ScoredResult score(RawResult raw, QueryTier tier, QueryKind kind) {
        String text = raw.text();
        Double price = kind == QueryKind.PRICE ? priceExtractor.extract(text).orElse(null) : null;
        LaborFigure labor = kind == QueryKind.LABOR_TIME ? laborTimeParser.parse(text).orElse(null) : null;
        PageType pageType = pageTypeClassifier.classify(raw.getSourceUrl());
        int trust = trustScorer.score(raw.getSourceUrl());
        boolean extracted = price != null || labor != null;

        return ScoredResult.builder()
                .raw(raw)
                .tier(tier)
                .extractedPrice(price)
                .laborFigure(labor)
                .pageType(pageType)
                .availability(availabilityDetector.detect(text))
                .retailerTrust(trust)
                .qualityScore(quality(trust, pageType, extracted))
                .build();
    }

    static int quality(int trust, PageType pageType, boolean extracted) {
        double score = (trust / 100.0) * TRUST_WEIGHT
                + pageType.getWeight() * PAGE_WEIGHT
                + (extracted ? 1.0 : 0.0) * EXTRACTION_WEIGHT;
        return (int) Math.round(Math.max(0.0, Math.min(1.0, score)) * 100);
    }
}
