package com.dixonrepair.vinsearch.util;

import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.List;

/**
 * Small descriptive statistics helpers shared by the price and labor aggregators.
 *
 * <p>All methods copy and sort their input, so results never depend on the
 * order values arrived in.
 */
public final class Stats {

    private Stats() {
    }

    public static double median(List<Double> values) {
        return quantile(values, 0.5);
    }

    /**
     * Quantile using linear interpolation between closest ranks
     * (the same definition spreadsheet PERCENTILE and NumPy use by default).
     */
    public static double quantile(List<Double> values, double q) {
        Preconditions.checkArgument(values != null && !values.isEmpty(), "values cannot be empty");
        Preconditions.checkArgument(q >= 0.0 && q <= 1.0, "quantile must be in [0,1]");

        double[] sorted = sorted(values);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public static double interquartileRange(List<Double> values) {
        return quantile(values, 0.75) - quantile(values, 0.25);
    }

    public static double mean(List<Double> values) {
        Preconditions.checkArgument(values != null && !values.isEmpty(), "values cannot be empty");
        return Arrays.stream(sorted(values)).average().orElse(0.0);
    }

    /**
     * Population standard deviation. Zero for a single value.
     */
    public static double standardDeviation(List<Double> values) {
        double mean = mean(values);
        double sumSquares = 0.0;
        for (double v : sorted(values)) {
            sumSquares += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquares / values.size());
    }

    /**
     * Mean after dropping the single highest and lowest value, when at least
     * {@code minSizeToTrim} values are present. Straight mean otherwise.
     */
    public static double trimmedMean(List<Double> values, int minSizeToTrim) {
        Preconditions.checkArgument(values != null && !values.isEmpty(), "values cannot be empty");
        double[] sorted = sorted(values);
        if (sorted.length < minSizeToTrim) {
            return Arrays.stream(sorted).average().orElse(0.0);
        }
        return Arrays.stream(sorted, 1, sorted.length - 1).average().orElse(0.0);
    }

    public static int clamp(double value, int min, int max) {
        return (int) Math.max(min, Math.min(max, Math.round(value)));
    }

    private static double[] sorted(List<Double> values) {
        double[] array = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(array);
        return array;
    }
}
