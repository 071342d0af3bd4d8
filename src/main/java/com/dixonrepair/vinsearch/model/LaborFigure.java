package com.dixonrepair.vinsearch.model;

import lombok.Value;

/**
 * Labor time quoted by a single source, in minutes. A single figure such as
 * "45 minutes" has equal low and high bounds.
 */
@Value
public class LaborFigure {

    double lowMinutes;
    double highMinutes;

    public static LaborFigure of(double minutes) {
        return new LaborFigure(minutes, minutes);
    }

    public static LaborFigure range(double a, double b) {
        return new LaborFigure(Math.min(a, b), Math.max(a, b));
    }

    public double midpoint() {
        return (lowMinutes + highMinutes) / 2.0;
    }

    public double halfSpread() {
        return (highMinutes - lowMinutes) / 2.0;
    }
}
