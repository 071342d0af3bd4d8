package com.dixonrepair.vinsearch.validation;

import com.dixonrepair.vinsearch.model.Availability;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Reads stock status from result text. Negative phrases are checked first
 * because "not in stock" also contains "in stock".
 */
@Component
public class AvailabilityDetector {

    private static final List<String> OUT_OF_STOCK = List.of(
            "out of stock", "not in stock", "sold out", "discontinued", "backorder", "back-order",
            "back order", "currently unavailable");

    private static final List<String> IN_STOCK = List.of(
            "in stock", "add to cart", "ships today", "ships in", "free shipping", "available now", "pickup today");

    public Availability detect(String text) {
        if (text == null || text.isBlank()) {
            return Availability.UNKNOWN;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (OUT_OF_STOCK.stream().anyMatch(lower::contains)) {
            return Availability.OUT_OF_STOCK;
        }
        if (IN_STOCK.stream().anyMatch(lower::contains)) {
            return Availability.IN_STOCK;
        }
        return Availability.UNKNOWN;
    }
}
