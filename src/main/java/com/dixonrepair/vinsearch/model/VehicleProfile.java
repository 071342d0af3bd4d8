package com.dixonrepair.vinsearch.model;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Decoded vehicle identity.
 *
 * <p>Created by the resolver (or supplied by the caller) and consumed
 * read-only by every downstream component. Immutable and thread-safe.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class VehicleProfile {

    String year;
    String make;
    String model;

    /**
     * Trim level, e.g. "EX". May be null.
     */
    String trim;

    /**
     * Engine code or description, e.g. "K20C2". May be null.
     */
    String engine;

    /**
     * Normalized VIN this profile was decoded from. Null for profiles the
     * caller assembled by hand.
     */
    String vin;

    /**
     * True when the decode service returned only partial data for the VIN.
     */
    boolean partialDecode;

    /**
     * Whether this profile came from a successful VIN decode.
     */
    public boolean isVinResolved() {
        return vin != null && !vin.isBlank() && hasYearMakeModel();
    }

    public boolean hasYearMakeModel() {
        return notBlank(year) && notBlank(make) && notBlank(model);
    }

    public boolean hasEngine() {
        return notBlank(engine);
    }

    public boolean hasTrim() {
        return notBlank(trim);
    }

    /**
     * Short label like "2021 Honda Civic", used in queries and cache keys.
     */
    public String label() {
        return Stream.of(year, make, model)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" "));
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
