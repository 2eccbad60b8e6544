package org.carball.pulse.model.venue;

import org.carball.pulse.config.VenueTypePreset;
import org.carball.pulse.model.range.OptimalRange;

import java.time.LocalDateTime;

/**
 * Operator-supplied range override for a venue. A {@code null} range falls back to the time-slot default.
 *
 * @param preset preset the ranges came from, or {@code null} for custom values
 */
public record ManualCalibration(
        String venueId,
        OptimalRange sound,
        OptimalRange light,
        VenueTypePreset preset,
        LocalDateTime updatedAt
) {

    public static ManualCalibration custom(String venueId, OptimalRange sound, OptimalRange light,
                                           LocalDateTime updatedAt) {
        return new ManualCalibration(venueId, sound, light, null, updatedAt);
    }

    public static ManualCalibration fromPreset(String venueId, VenueTypePreset preset, LocalDateTime updatedAt) {
        return new ManualCalibration(venueId, preset.getSound(), preset.getLight(), preset, updatedAt);
    }
}
