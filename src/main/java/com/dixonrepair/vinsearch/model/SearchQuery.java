package com.dixonrepair.vinsearch.model;

import lombok.Builder;
import lombok.Value;

/**
 * One search query text at a given tier.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class SearchQuery {

    String text;
    QueryTier tier;
    QueryKind kind;

    /**
     * Optional hint ("parts", "labor") that providers may use to restrict domains.
     */
    String sourceHint;
}
