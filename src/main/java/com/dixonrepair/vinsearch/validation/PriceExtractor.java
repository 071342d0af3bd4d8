package com.dixonrepair.vinsearch.validation;

import com.dixonrepair.vinsearch.config.ValidationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a single USD price out of search result text.
 *
 * <p>Patterns are tried in order of reliability: keyword-adjacent amounts
 * ("Price: $45.99"), then any currency-prefixed amount ("$45.99", "USD 45"),
 * then suffixed amounts ("45 dollars"). The first amount inside the sane
 * range wins. Amounts outside the range are extraction noise and skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceExtractor {

    private static final String AMOUNT = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)";

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(?i)\\b(?:price|priced at|cost|costs|our price|sale)\\s*(?:is|of|:|-)?\\s*(?:\\$|usd\\s?)\\s*" + AMOUNT),
            Pattern.compile("(?i)(?:\\$|\\busd\\s?)\\s*" + AMOUNT),
            Pattern.compile("(?i)" + AMOUNT + "\\s*(?:dollars|usd)\\b"));

    private final ValidationProperties props;

    public Optional<Double> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                OptionalDouble amount = parse(matcher.group(1));
                if (amount.isPresent() && inRange(amount.getAsDouble())) {
                    return Optional.of(amount.getAsDouble());
                }
            }
        }
        log.debug("No in-range price in: {}", text.length() > 80 ? text.substring(0, 80) + "..." : text);
        return Optional.empty();
    }

    public boolean inRange(double price) {
        return price >= props.getMinPrice() && price <= props.getMaxPrice();
    }

    private static OptionalDouble parse(String token) {
        try {
            return OptionalDouble.of(Double.parseDouble(token.replace(",", "")));
        } catch (NumberFormatException e) {
            log.debug("Unparseable amount '{}'", token);
            return OptionalDouble.empty();
        }
    }
}
