package org.carball.pulse.model.learning;

import org.carball.pulse.slot.TimeSlot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one learning run produces for a venue. Stores replace this record as a whole.
 *
 * @param optimalRanges learned ranges, or {@code null} when no hour had a usable outcome
 */
public record VenueLearningRecord(
        String venueId,
        VenueOptimalRanges optimalRanges,
        Map<TimeSlot, BestNightProfile> bestNights
) {

    public VenueLearningRecord {
        if (venueId == null || venueId.isBlank()) {
            throw new IllegalArgumentException("Learning record requires a venue id");
        }
        bestNights = bestNights == null || bestNights.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(bestNights));
    }

    public Optional<BestNightProfile> bestNight(TimeSlot slot) {
        return Optional.ofNullable(bestNights.get(slot));
    }

    public Optional<VenueOptimalRanges> ranges() {
        return Optional.ofNullable(optimalRanges);
    }
}
