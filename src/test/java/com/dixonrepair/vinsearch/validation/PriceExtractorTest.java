package com.dixonrepair.vinsearch.validation;

import com.dixonrepair.vinsearch.config.ValidationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Price extraction")
class PriceExtractorTest {

    private final PriceExtractor extractor = new PriceExtractor(new ValidationProperties());

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "Duralast Gold Brake Pads $45.99 at AutoZone | 45.99",
            "Our price: $1,249.00 for the full kit | 1249.00",
            "USD 89.50 free shipping | 89.50",
            "Replacement sensor for 35 dollars | 35",
    })
    void extractsCommonFormats(String text, double expected) {
        assertThat(extractor.extract(text)).contains(expected);
    }

    @Test
    @DisplayName("Keyword-adjacent price wins over an earlier bare amount")
    void keywordAdjacentFirst() {
        assertThat(extractor.extract("Save $10 today! Price: $54.99 with core return")).contains(54.99);
    }

    @Test
    @DisplayName("Out-of-range tokens are skipped as noise")
    void outOfRangeSkipped() {
        assertThat(extractor.extract("Win $100,000 in our sweepstakes or buy now for $39.99")).contains(39.99);
        assertThat(extractor.extract("Only $0.00 down")).isEmpty();
    }

    @Test
    @DisplayName("Text without a price yields nothing")
    void noPrice() {
        assertThat(extractor.extract("2021 Honda Civic EX brake pad replacement guide")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
