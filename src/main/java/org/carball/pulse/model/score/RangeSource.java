package org.carball.pulse.model.score;

/**
 * Where the ranges used for a score came from, in selection priority order.
 */
public enum RangeSource {
    BEST_NIGHT("Your best night", true),
    LEARNED("Learned from your history", true),
    CALIBRATION("Manual calibration", false),
    DEFAULT("Time-slot defaults", false);

    private final String description;
    private final boolean historical;

    RangeSource(String description, boolean historical) {
        this.description = description;
        this.historical = historical;
    }

    public String getDescription() {
        return description;
    }

    /**
     * True when the ranges reflect this venue's own outcomes.
     */
    public boolean isHistorical() {
        return historical;
    }
}
