package org.carball.pulse.dwell;

import java.util.OptionalDouble;

public enum DwellTimeCategory {
    EXCELLENT(60),
    GOOD(45),
    FAIR(30),
    POOR(0),
    UNKNOWN(Double.NaN);

    private final double minimumMinutes;

    DwellTimeCategory(double minimumMinutes) {
        this.minimumMinutes = minimumMinutes;
    }

    public double getMinimumMinutes() {
        return minimumMinutes;
    }

    public static DwellTimeCategory fromMinutes(OptionalDouble minutes) {
        if (minutes.isEmpty()) {
            return UNKNOWN;
        }
        double value = minutes.getAsDouble();
        if (value >= EXCELLENT.minimumMinutes) return EXCELLENT;
        if (value >= GOOD.minimumMinutes) return GOOD;
        if (value >= FAIR.minimumMinutes) return FAIR;
        return POOR;
    }

    /**
     * Formats as "1h 23m", "2h" or "45m"; "--" when unknown.
     */
    public static String format(OptionalDouble minutes) {
        if (minutes.isEmpty()) {
            return "--";
        }
        long total = Math.round(minutes.getAsDouble());
        if (total < 60) {
            return total + "m";
        }
        long hours = total / 60;
        long rest = total % 60;
        return rest > 0 ? hours + "h " + rest + "m" : hours + "h";
    }
}
