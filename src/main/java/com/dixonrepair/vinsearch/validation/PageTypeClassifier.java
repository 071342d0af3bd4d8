package com.dixonrepair.vinsearch.validation;

import com.dixonrepair.vinsearch.model.PageType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Guesses from a URL whether it points at a single product or a listing.
 *
 * <p>Product and category signals are counted separately; the larger count
 * wins and a tie is {@link PageType#UNKNOWN}.
 */
@Slf4j
@Component
public class PageTypeClassifier {

    private static final List<String> PRODUCT_PATHS = List.of("/p/", "/product/", "/dp/", "/item/", "/part/", "/sku/");
    private static final List<String> CATEGORY_PATHS = List.of("/search", "/category/", "/browse/", "/c/", "/dept/", "/results");
    private static final List<String> SEARCH_PARAMS = List.of("q=", "query=", "search=", "keyword=", "searchterm=", "searchtext=");

    private static final Pattern PRODUCT_ID_SUFFIX = Pattern.compile(".*-p\\d+.*");
    private static final Pattern SKU_TOKEN = Pattern.compile(".*(\\d{4,}|[a-z]+\\d+[a-z0-9]*).*");

    public PageType classify(String url) {
        if (url == null || url.isBlank()) {
            return PageType.UNKNOWN;
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable URL '{}': {}", url, e.getMessage());
            return PageType.UNKNOWN;
        }

        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        String query = uri.getQuery() == null ? "" : uri.getQuery().toLowerCase(Locale.ROOT);
        String pathWithSlash = path.endsWith("/") ? path : path + "/";
        List<String> segments = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toList();
        String last = segments.isEmpty() ? "" : segments.get(segments.size() - 1);

        int product = 0;
        int category = 0;

        if (PRODUCT_PATHS.stream().anyMatch(pathWithSlash::contains)) {
            product++;
        }
        if (PRODUCT_ID_SUFFIX.matcher(path).matches()) {
            product++;
        }
        if (!last.isEmpty() && SKU_TOKEN.matcher(last).matches()) {
            product++;
        }
        if (segments.size() >= 3) {
            product++;
        }

        if (CATEGORY_PATHS.stream().anyMatch(pathWithSlash::contains)) {
            category++;
        }
        if (SEARCH_PARAMS.stream().anyMatch(query::contains)) {
            category++;
        }
        if (last.endsWith("s") && last.chars().noneMatch(Character::isDigit)) {
            category++;
        }
        if (segments.size() <= 1) {
            category++;
        }

        if (product > category) {
            return PageType.PRODUCT;
        }
        if (category > product) {
            return PageType.CATEGORY;
        }
        return PageType.UNKNOWN;
    }
}
