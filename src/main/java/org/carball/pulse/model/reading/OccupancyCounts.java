package org.carball.pulse.model.reading;

/**
 * Door-counter snapshot. {@code entries} and {@code exits} are cumulative within the day.
 *
 * @param capacity configured capacity reported by the device, or {@code null}
 */
public record OccupancyCounts(int current, int entries, int exits, Integer capacity) {

    public OccupancyCounts(int current, int entries, int exits) {
        this(current, entries, exits, null);
    }
}
