package org.carball.pulse.model.learning;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.pulse.slot.TimeSlot;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Conditions during the single best historical night for a venue and time slot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BestNightProfile {
    private LocalDate date;
    private DayOfWeek dayOfWeek;
    private TimeSlot timeSlot;

    private int totalGuests;
    private int peakOccupancy;
    private double avgDwellMinutes;

    /** Zero when the sound sensor reported nothing that night. */
    private double avgSound;
    /** Zero when the light sensor reported nothing that night. */
    private double avgLight;
    private Double avgTemp;

    @Builder.Default
    private List<String> topArtists = new ArrayList<>();
    @Builder.Default
    private List<String> detectedGenres = new ArrayList<>();
    private int songCount;

    private Integer peakHour;
    private Double peakHourSound;
    private Double peakHourLight;

    private int dataPointsFromNight;
    /** 0..100 */
    private int confidence;
}
