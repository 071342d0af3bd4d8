package com.dixonrepair.vinsearch.query;

import com.dixonrepair.vinsearch.model.QueryKind;
import com.dixonrepair.vinsearch.model.QueryTier;
import com.dixonrepair.vinsearch.model.SearchQuery;
import com.dixonrepair.vinsearch.model.VehicleProfile;
import com.google.common.base.Preconditions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the tiered query set for one request.
 *
 * <ul>
 *   <li>Tier 1: only for VIN-resolved profiles; year, make, model and trim
 *       (plus an engine variant when the engine is known)</li>
 *   <li>Tier 2: whenever year, make and model are known</li>
 *   <li>Tier 3: always; the bare description with a kind suffix</li>
 * </ul>
 *
 * Query texts are unique across tiers; the first (most specific) occurrence wins.
 */
@Component
public class QueryTierBuilder {

    /**
     * @param profile may be null
     * @return queries grouped by tier, in tier order; only non-empty tiers are present
     */
    public Map<QueryTier, List<SearchQuery>> build(String description, QueryKind kind, VehicleProfile profile) {
        Preconditions.checkArgument(description != null && !description.isBlank(), "Description cannot be empty");
        Preconditions.checkNotNull(kind, "Query kind cannot be null");

        String desc = description.trim();
        Set<String> seen = new LinkedHashSet<>();
        Map<QueryTier, List<SearchQuery>> tiers = new EnumMap<>(QueryTier.class);

        if (profile != null && profile.isVinResolved()) {
            add(tiers, seen, kind, QueryTier.VIN_SPECIFIC,
                    join(profile.getYear(), profile.getMake(), profile.getModel(), profile.getTrim(), desc));
            if (profile.hasEngine()) {
                add(tiers, seen, kind, QueryTier.VIN_SPECIFIC,
                        join(profile.getYear(), profile.getMake(), profile.getModel(), profile.getEngine(), desc));
            }
        }

        if (profile != null && profile.hasYearMakeModel()) {
            add(tiers, seen, kind, QueryTier.MAKE_MODEL_YEAR,
                    join(profile.getYear(), profile.getMake(), profile.getModel(), desc));
        }

        // Tier 3 always gets its query, even if an identical text already exists above
        String generic = join(desc, kind.getQuerySuffix());
        if (!add(tiers, seen, kind, QueryTier.GENERIC, generic)) {
            tiers.computeIfAbsent(QueryTier.GENERIC, t -> new ArrayList<>()).add(query(generic, QueryTier.GENERIC, kind));
        }
        return tiers;
    }

    /**
     * Flattened view of {@link #build}, most specific first.
     */
    public List<SearchQuery> buildFlat(String description, QueryKind kind, VehicleProfile profile) {
        return build(description, kind, profile).values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
    }

    private boolean add(Map<QueryTier, List<SearchQuery>> tiers, Set<String> seen,
                        QueryKind kind, QueryTier tier, String text) {
        if (!seen.add(text.toLowerCase(Locale.ROOT))) {
            return false;
        }
        tiers.computeIfAbsent(tier, t -> new ArrayList<>()).add(query(text, tier, kind));
        return true;
    }

    private static SearchQuery query(String text, QueryTier tier, QueryKind kind) {
        return SearchQuery.builder()
                .text(text)
                .tier(tier)
                .kind(kind)
                .sourceHint(kind.getSourceHint())
                .build();
    }

    private static String join(String... parts) {
        return Stream.of(parts)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" "));
    }
}
