package org.carball.pulse.model.range;

/**
 * A [min, max] band for one environmental factor.
 *
 * @param min        lower bound, inclusive
 * @param max        upper bound, inclusive
 * @param confidence how trustworthy the band is, 0..1
 */
public record OptimalRange(double min, double max, double confidence) {

    public OptimalRange {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("Range bounds must be numbers");
        }
        if (min > max) {
            throw new IllegalArgumentException("Range min (" + min + ") must not exceed max (" + max + ")");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Range confidence must be within [0, 1]: " + confidence);
        }
    }

    public static OptimalRange of(double min, double max) {
        return new OptimalRange(min, max, 1.0);
    }

    /**
     * Band centred on a target value, never extending below zero.
     */
    public static OptimalRange around(double target, double tolerance) {
        return of(Math.max(0, target - tolerance), target + tolerance);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    public double width() {
        return max - min;
    }

    @Override
    public String toString() {
        return String.format("%.1f-%.1f", min, max);
    }
}
