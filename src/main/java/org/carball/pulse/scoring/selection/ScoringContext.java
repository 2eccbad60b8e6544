package org.carball.pulse.scoring.selection;

import org.carball.pulse.model.learning.VenueLearningRecord;
import org.carball.pulse.model.venue.ManualCalibration;
import org.carball.pulse.slot.TimeSlot;

import java.util.Optional;

/**
 * What range selection may draw on for one scoring call.
 *
 * @param venueId     {@code null} for anonymous scoring
 * @param learning    latest learning run for the venue, or {@code null}
 * @param calibration operator override, or {@code null}
 */
public record ScoringContext(
        String venueId,
        TimeSlot slot,
        VenueLearningRecord learning,
        ManualCalibration calibration
) {

    public static ScoringContext anonymous(TimeSlot slot) {
        return new ScoringContext(null, slot, null, null);
    }

    public Optional<VenueLearningRecord> learningRecord() {
        return Optional.ofNullable(learning);
    }

    public Optional<ManualCalibration> manualCalibration() {
        return Optional.ofNullable(calibration);
    }
}
