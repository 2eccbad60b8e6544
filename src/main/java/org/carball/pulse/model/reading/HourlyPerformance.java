package org.carball.pulse.model.reading;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One hour of venue history: environmental averages plus the outcome observed in that hour.
 * Environmental values are {@code null} when the sensor reported nothing during the hour.
 */
@Data
@Builder
public class HourlyPerformance {
    private String venueId;
    private LocalDateTime hourStart;

    private Double temperature;
    private Double light;
    private Double sound;
    private Double humidity;

    private double avgDwellTimeMinutes;
    private double avgOccupancy;
    private int peakOccupancy;
    private int entryCount;
    private int exitCount;
    private Double revenue;
}
