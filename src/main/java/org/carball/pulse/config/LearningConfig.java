package org.carball.pulse.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Parameters of the batch learner. The values are empirical and meant to be tuned per deployment.
 */
@Data
public class LearningConfig {

    // Optimal-range learning
    @JsonProperty("top_performance_percentile")
    private double topPerformancePercentile = 0.20;

    @JsonProperty("range_std_dev_multiplier")
    private double rangeStdDevMultiplier = 0.75;

    @JsonProperty("min_range_confidence")
    private double minRangeConfidence = 0.5;

    // Learning confidence
    @JsonProperty("points_for_full_confidence")
    private int pointsForFullConfidence = 1250;

    @JsonProperty("max_points_confidence")
    private double maxPointsConfidence = 0.80;

    @JsonProperty("days_for_full_bonus")
    private int daysForFullBonus = 100;

    @JsonProperty("max_days_bonus")
    private double maxDaysBonus = 0.15;

    @JsonProperty("confidence_floor")
    private double confidenceFloor = 0.30;

    @JsonProperty("learning_cap")
    private double learningCap = 0.95;

    @JsonProperty("fallback_confidence")
    private double fallbackConfidence = 0.50;

    @JsonProperty("history_window_days")
    private int historyWindowDays = 90;

    // Best-night detection
    @JsonProperty("min_readings_per_slot")
    private int minReadingsPerSlot = 5;

    @JsonProperty("min_readings_per_night")
    private int minReadingsPerNight = 3;

    @JsonProperty("min_guests_for_best_night")
    private int minGuestsForBestNight = 5;

    @JsonProperty("best_night_guest_target")
    private int bestNightGuestTarget = 200;

    @JsonProperty("best_night_dwell_target_minutes")
    private double bestNightDwellTargetMinutes = 90.0;

    @JsonProperty("best_night_guest_share")
    private double bestNightGuestShare = 0.6;

    @JsonProperty("max_top_artists")
    private int maxTopArtists = 10;

    // Dwell-time sanity band
    @JsonProperty("min_dwell_window_hours")
    private double minDwellWindowHours = 0.25;

    @JsonProperty("min_dwell_minutes")
    private double minDwellMinutes = 1.0;

    @JsonProperty("max_dwell_minutes")
    private double maxDwellMinutes = 1440.0;

    public static LearningConfig defaults() {
        return new LearningConfig();
    }

    @JsonIgnore
    public String getDescription() {
        return String.format(
            "Learning: topPercentile=%.2f, sigma=%.2f, fullConfidencePoints=%d, fullBonusDays=%d, " +
            "floor=%.2f, cap=%.2f, fallback=%.2f, window=%dd, dwellBand=%.0f-%.0fmin",
            topPerformancePercentile,
            rangeStdDevMultiplier,
            pointsForFullConfidence,
            daysForFullBonus,
            confidenceFloor,
            learningCap,
            fallbackConfidence,
            historyWindowDays,
            minDwellMinutes,
            maxDwellMinutes
        );
    }
}
