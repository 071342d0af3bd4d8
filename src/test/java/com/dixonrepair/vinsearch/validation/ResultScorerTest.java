package com.dixonrepair.vinsearch.validation;

import com.dixonrepair.vinsearch.model.Availability;
import com.dixonrepair.vinsearch.model.PageType;
import com.dixonrepair.vinsearch.model.QueryKind;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.ScoredResult;
import com.dixonrepair.vinsearch.support.FakeSearchProvider;
import com.dixonrepair.vinsearch.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Result scoring")
class ResultScorerTest {

    private final ResultScorer scorer = TestFixtures.resultScorer();

    @Test
    @DisplayName("Trusted product page with a price scores 94")
    void trustedProductPage() {
        ScoredResult result = scorer.score(FakeSearchProvider.hit(
                        "https://www.autozone.com/p/duralast-brake-pads-mkd1089",
                        "Duralast Gold Brake Pads",
                        "Price: $45.99. In stock at your local store."),
                QueryTier.VIN_SPECIFIC, QueryKind.PRICE);

        assertThat(result.getExtractedPrice()).isEqualTo(45.99);
        assertThat(result.getPageType()).isEqualTo(PageType.PRODUCT);
        assertThat(result.getAvailability()).isEqualTo(Availability.IN_STOCK);
        assertThat(result.getRetailerTrust()).isEqualTo(85);
        assertThat(result.getQualityScore()).isEqualTo(94);
        assertThat(result.isUsableFor(QueryKind.PRICE)).isTrue();
        assertThat(result.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Unknown category page without a price still gets a quality score")
    void unknownCategoryWithoutPrice() {
        ScoredResult result = scorer.score(FakeSearchProvider.hit(
                        "https://blog.example.org/brakes", "All about brakes", "Discontinued models and more"),
                QueryTier.GENERIC, QueryKind.PRICE);

        // 0.5 * 0.4 + 0.5 * 0.3 + 0 = 0.35
        assertThat(result.getQualityScore()).isEqualTo(35);
        assertThat(result.hasPrice()).isFalse();
        assertThat(result.isUsableFor(QueryKind.PRICE)).isFalse();
        assertThat(result.getAvailability()).isEqualTo(Availability.OUT_OF_STOCK);
    }

    @Test
    @DisplayName("Labor requests extract labor time, not prices")
    void laborKind() {
        ScoredResult result = scorer.score(FakeSearchProvider.hit(
                        "https://repairpal.com/estimator/honda/civic/brake-pad-replacement-cost",
                        "Brake pad replacement $150",
                        "Labor typically takes 1-2 hours"),
                QueryTier.MAKE_MODEL_YEAR, QueryKind.LABOR_TIME);

        assertThat(result.hasPrice()).isFalse();
        assertThat(result.getLaborFigure().getLowMinutes()).isEqualTo(60.0);
        assertThat(result.getLaborFigure().getHighMinutes()).isEqualTo(120.0);
        assertThat(result.getRetailerTrust()).isEqualTo(85);
        assertThat(result.isUsableFor(QueryKind.LABOR_TIME)).isTrue();
    }
}
