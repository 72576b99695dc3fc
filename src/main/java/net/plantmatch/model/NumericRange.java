package net.plantmatch.model;

import java.util.Locale;

/**
 * Closed numeric interval used for plant dimensions and soil pH.
 *
 * @param min lower bound, inclusive
 * @param max upper bound, inclusive; never below {@code min}
 */
public record NumericRange(double min, double max) {

    public NumericRange {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("Range bounds must be finite: " + min + ".." + max);
        }
        if (min > max) {
            throw new IllegalArgumentException("Range min " + min + " exceeds max " + max);
        }
    }

    public static NumericRange of(double min, double max) {
        return new NumericRange(min, max);
    }

    /**
     * Creates a degenerate range holding a single value, e.g. a measured site pH.
     */
    public static NumericRange point(double value) {
        return new NumericRange(value, value);
    }

    public double width() {
        return max - min;
    }

    /**
     * Length of the shared portion of both ranges, zero when they only touch or are disjoint.
     */
    public double overlapWith(NumericRange other) {
        return Math.max(0.0, Math.min(max, other.max) - Math.max(min, other.min));
    }

    public boolean intersects(NumericRange other) {
        return min <= other.max && other.min <= max;
    }

    /**
     * Gap between two disjoint ranges; zero when they intersect.
     */
    public double distanceTo(NumericRange other) {
        if (intersects(other)) {
            return 0.0;
        }
        return other.min > max ? other.min - max : min - other.max;
    }

    @Override
    public String toString() {
        if (min == max) {
            return format(min);
        }
        return format(min) + "-" + format(max);
    }

    private static String format(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
