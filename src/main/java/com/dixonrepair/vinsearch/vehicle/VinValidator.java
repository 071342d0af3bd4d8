package com.dixonrepair.vinsearch.vehicle;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * VIN format checks. Pure functions, no network access.
 *
 * <p>A VIN is 17 characters from {@code A-Z0-9} excluding I, O and Q.
 * Position 9 is a check digit computed with the ISO 3779 weights.
 */
public final class VinValidator {

    public static final int VIN_LENGTH = 17;

    private static final Pattern VIN_FORMAT = Pattern.compile("^[A-HJ-NPR-Z0-9]{17}$");
    private static final Pattern VIN_IN_TEXT = Pattern.compile("\\b[A-HJ-NPR-Z0-9]{17}\\b");

    private static final int[] WEIGHTS = {8, 7, 6, 5, 4, 3, 2, 10, 0, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int CHECK_DIGIT_POSITION = 8;

    private VinValidator() {
    }

    /**
     * Upper-cases and trims. Null stays null.
     */
    public static String normalize(String vin) {
        return vin == null ? null : vin.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isValidFormat(String vin) {
        String normalized = normalize(vin);
        return normalized != null && VIN_FORMAT.matcher(normalized).matches();
    }

    /**
     * Whether the check digit at position 9 matches the weighted sum of the
     * other characters. Only meaningful for VINs that pass {@link #isValidFormat}.
     */
    public static boolean hasValidCheckDigit(String vin) {
        String normalized = normalize(vin);
        if (!isValidFormat(normalized)) {
            return false;
        }
        int sum = 0;
        for (int i = 0; i < VIN_LENGTH; i++) {
            sum += transliterate(normalized.charAt(i)) * WEIGHTS[i];
        }
        int remainder = sum % 11;
        char expected = remainder == 10 ? 'X' : (char) ('0' + remainder);
        return normalized.charAt(CHECK_DIGIT_POSITION) == expected;
    }

    /**
     * Finds the first VIN-shaped token in free text, e.g. a chat message.
     */
    public static Optional<String> extractVin(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = VIN_IN_TEXT.matcher(text.toUpperCase(Locale.ROOT));
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    /**
     * Describes why a VIN failed format validation.
     */
    public static String describeProblem(String vin) {
        String normalized = normalize(vin);
        if (normalized == null || normalized.isEmpty()) {
            return "VIN is empty";
        }
        if (normalized.length() != VIN_LENGTH) {
            return "VIN must be exactly 17 characters (got " + normalized.length() + ")";
        }
        if (normalized.chars().anyMatch(c -> c == 'I' || c == 'O' || c == 'Q')) {
            return "VIN cannot contain the letters I, O or Q";
        }
        if (!VIN_FORMAT.matcher(normalized).matches()) {
            return "VIN may only contain letters and digits";
        }
        return "VIN check digit does not match";
    }

    private static int transliterate(char c) {
        if (Character.isDigit(c)) {
            return c - '0';
        }
        switch (c) {
            case 'A': case 'J': return 1;
            case 'B': case 'K': case 'S': return 2;
            case 'C': case 'L': case 'T': return 3;
            case 'D': case 'M': case 'U': return 4;
            case 'E': case 'N': case 'V': return 5;
            case 'F': case 'W': return 6;
            case 'G': case 'P': case 'X': return 7;
            case 'H': case 'Y': return 8;
            case 'R': case 'Z': return 9;
            default: return 0;
        }
    }
}
