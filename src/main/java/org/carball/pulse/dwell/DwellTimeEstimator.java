package org.carball.pulse.dwell;

import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.config.LearningConfig;
import org.carball.pulse.model.reading.SensorReading;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Average time a guest stays, inferred with Little's Law (W = L / λ) from occupancy and door counters.
 * Returns an empty result instead of failing whenever the inputs cannot support a sensible estimate.
 */
@Slf4j
public class DwellTimeEstimator {

    private static final double MINUTES_PER_HOUR = 60.0;
    private static final double SECONDS_PER_HOUR = 3600.0;

    private final LearningConfig config;

    public DwellTimeEstimator() {
        this(LearningConfig.defaults());
    }

    public DwellTimeEstimator(LearningConfig config) {
        this.config = config;
    }

    /**
     * @param avgOccupancy average number of guests inside over the window (L)
     * @param entries      new entries during the window (E)
     * @param windowHours  window length in hours (H)
     * @return dwell time in minutes, or empty when unknown
     */
    public OptionalDouble estimate(double avgOccupancy, int entries, double windowHours) {
        if (entries <= 0 || avgOccupancy <= 0) {
            return OptionalDouble.empty();
        }
        if (windowHours < config.getMinDwellWindowHours()) {
            log.debug("Dwell window of {}h is too short to estimate from", windowHours);
            return OptionalDouble.empty();
        }

        double arrivalsPerHour = entries / windowHours;
        double minutes = (avgOccupancy / arrivalsPerHour) * MINUTES_PER_HOUR;

        if (minutes < config.getMinDwellMinutes() || minutes > config.getMaxDwellMinutes()) {
            log.warn("Rejected dwell time estimate of {} minutes (L={}, E={}, H={})",
                    Math.round(minutes), avgOccupancy, entries, windowHours);
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(minutes);
    }

    /**
     * Estimates over the {@code hoursBack} hours leading up to the latest reading.
     */
    public OptionalDouble estimateFromReadings(List<SensorReading> readings, double hoursBack) {
        return readings.stream()
                .map(SensorReading::getTimestamp)
                .filter(t -> t != null)
                .max(Comparator.naturalOrder())
                .map(latest -> estimateFromReadings(readings, hoursBack, latest))
                .orElse(OptionalDouble.empty());
    }

    /**
     * Estimates over the {@code hoursBack} hours up to {@code asOf}. A lookback reaching past the earliest
     * representable time covers all readings; a lookback that is not a positive number is unknown.
     */
    public OptionalDouble estimateFromReadings(List<SensorReading> readings, double hoursBack, LocalDateTime asOf) {
        if (Double.isNaN(hoursBack) || hoursBack <= 0) {
            log.debug("Dwell lookback of {}h is not a positive number of hours", hoursBack);
            return OptionalDouble.empty();
        }
        LocalDateTime windowStart = windowStart(asOf, hoursBack);

        List<SensorReading> window = readings.stream()
                .filter(r -> r.getTimestamp() != null && r.hasOccupancy())
                .filter(r -> !r.getTimestamp().isBefore(windowStart) && !r.getTimestamp().isAfter(asOf))
                .sorted(Comparator.comparing(SensorReading::getTimestamp))
                .toList();

        if (window.size() < 2) {
            return OptionalDouble.empty();
        }

        SensorReading earliest = window.get(0);
        SensorReading latest = window.get(window.size() - 1);

        // Counters are cumulative, so only the difference across the window counts
        int rawDelta = latest.getOccupancy().entries() - earliest.getOccupancy().entries();
        if (rawDelta < 0) {
            log.warn("Entry counter went backwards ({} -> {}), likely a reset; dwell time unknown",
                    earliest.getOccupancy().entries(), latest.getOccupancy().entries());
        }
        int entries = Math.max(0, rawDelta);

        double avgOccupancy = window.stream()
                .mapToInt(r -> r.getOccupancy().current())
                .average()
                .orElse(0);
        double spanHours = Duration.between(earliest.getTimestamp(), latest.getTimestamp()).getSeconds() / SECONDS_PER_HOUR;

        return estimate(avgOccupancy, entries, spanHours);
    }

    private static LocalDateTime windowStart(LocalDateTime asOf, double hoursBack) {
        double lookbackSeconds = hoursBack * SECONDS_PER_HOUR;
        long maxLookbackSeconds = Duration.between(LocalDateTime.MIN, asOf).getSeconds();
        if (lookbackSeconds >= maxLookbackSeconds) {
            return LocalDateTime.MIN;
        }
        return asOf.minusSeconds(Math.round(lookbackSeconds));
    }
}
