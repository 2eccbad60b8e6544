package org.carball.pulse.model.venue;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class VenueSettings {
    private String venueId;
    /** Configured capacity; {@code null} means estimate it from history. */
    private Integer capacity;
    private ManualCalibration calibration;
}
