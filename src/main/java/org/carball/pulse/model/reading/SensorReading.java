package org.carball.pulse.model.reading;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One timestamped environmental snapshot from a venue. The timestamp is venue-local.
 * A decibel or lux value of zero means the sensor is absent, not that silence or darkness was measured.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorReading {
    private LocalDateTime timestamp;
    private Double decibels;
    private Double lux;
    private Double indoorTemp;
    private Double humidity;
    private OccupancyCounts occupancy;
    private String song;
    private String artist;

    public boolean hasSound() {
        return decibels != null && decibels != 0;
    }

    public boolean hasLight() {
        return lux != null && lux > 0;
    }

    public boolean hasOccupancy() {
        return occupancy != null;
    }

    public boolean hasMusic() {
        return isPresent(song) || isPresent(artist);
    }

    private static boolean isPresent(String text) {
        return text != null && !text.isBlank();
    }
}
