package org.carball.pulse.slot;

import lombok.Getter;
import org.carball.pulse.model.range.OptimalRange;

import java.util.List;

/**
 * Contextual buckets of the week, each with its own notion of good conditions.
 */
@Getter
public enum TimeSlot {

    DAYTIME("daytime", "daytime",
            OptimalRange.of(60, 72), OptimalRange.of(200, 600),
            List.of("pop", "jazz", "r&b"), OptimalRange.of(15, 45)),

    WEEKDAY_HAPPY_HOUR("weekday_happy_hour", "happy hour",
            OptimalRange.of(65, 76), OptimalRange.of(100, 400),
            List.of("pop", "r&b", "rock"), OptimalRange.of(30, 60)),

    WEEKDAY_NIGHT("weekday_night", "weeknights",
            OptimalRange.of(70, 82), OptimalRange.of(50, 350),
            List.of("hip-hop", "pop", "rock"), OptimalRange.of(35, 65)),

    FRIDAY_EARLY("friday_early", "Friday evenings",
            OptimalRange.of(70, 80), OptimalRange.of(75, 300),
            List.of("pop", "hip-hop", "r&b"), OptimalRange.of(40, 70)),

    FRIDAY_PEAK("friday_peak", "Friday nights",
            OptimalRange.of(76, 88), OptimalRange.of(20, 150),
            List.of("hip-hop", "edm", "dance", "latin"), OptimalRange.of(65, 95)),

    SATURDAY_EARLY("saturday_early", "Saturday evenings",
            OptimalRange.of(70, 80), OptimalRange.of(75, 300),
            List.of("pop", "hip-hop", "country"), OptimalRange.of(45, 75)),

    SATURDAY_PEAK("saturday_peak", "Saturday nights",
            OptimalRange.of(78, 90), OptimalRange.of(20, 150),
            List.of("hip-hop", "edm", "dance", "latin"), OptimalRange.of(70, 95)),

    SUNDAY_FUNDAY("sunday_funday", "Sundays",
            OptimalRange.of(68, 80), OptimalRange.of(100, 400),
            List.of("pop", "country", "r&b", "latin"), OptimalRange.of(35, 65));

    private final String key;
    private final String label;
    private final OptimalRange defaultSound;
    private final OptimalRange defaultLight;
    private final List<String> expectedGenres;
    /** Optimal occupancy as percent of capacity. */
    private final OptimalRange optimalCrowd;

    TimeSlot(String key, String label, OptimalRange defaultSound, OptimalRange defaultLight,
             List<String> expectedGenres, OptimalRange optimalCrowd) {
        this.key = key;
        this.label = label;
        this.defaultSound = defaultSound;
        this.defaultLight = defaultLight;
        this.expectedGenres = expectedGenres;
        this.optimalCrowd = optimalCrowd;
    }

    public static TimeSlot fromKey(String key) {
        for (TimeSlot slot : values()) {
            if (slot.key.equalsIgnoreCase(key)) {
                return slot;
            }
        }
        throw new IllegalArgumentException("Unknown time slot: " + key);
    }
}
