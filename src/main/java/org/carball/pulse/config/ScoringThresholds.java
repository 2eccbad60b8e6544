package org.carball.pulse.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.model.range.FactorWeights;

@Data
@Builder(toBuilder = true)
@Slf4j
public class ScoringThresholds {

    // Status thresholds
    @Builder.Default
    private int optimalThreshold = 85;

    @Builder.Default
    private int goodThreshold = 60;

    // Range selection gates, 0..100
    @Builder.Default
    private int bestNightConfidenceThreshold = 30;

    @Builder.Default
    private int learnedConfidenceThreshold = 30;

    // Best-night target bands
    @Builder.Default
    private double bestNightSoundTolerance = 5.0;

    @Builder.Default
    private double bestNightLightTolerance = 50.0;

    // Range falloff, as a fraction of the range width
    @Builder.Default
    private double rangeToleranceFraction = 0.5;

    // Crowd scoring
    @Builder.Default
    private double crowdDeficitPenalty = 2.0;

    @Builder.Default
    private double crowdExcessPenalty = 1.5;

    @Builder.Default
    private int crowdExcessFloor = 20;

    @Builder.Default
    private double capacityHeadroom = 1.2;

    @Builder.Default
    private int minimumEstimatedCapacity = 50;

    // Music scoring
    @Builder.Default
    private int neutralMusicScore = 80;

    @Builder.Default
    private int bestNightGenreMatchScore = 100;

    @Builder.Default
    private int slotGenreMatchScore = 90;

    @Builder.Default
    private int genreMismatchScore = 70;

    @Builder.Default
    private FactorWeights baselineWeights = FactorWeights.BASELINE;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default venue scoring thresholds";

    public static ScoringThresholds defaults() {
        return ScoringThresholds.builder()
                .profileName("default")
                .profileDescription("Default venue scoring thresholds")
                .build();
    }

    /**
     * Validates the configuration and logs warnings for potentially problematic values.
     */
    public void validate() {
        if (optimalThreshold <= goodThreshold) {
            log.warn("Optimal threshold ({}) should be greater than good threshold ({})",
                    optimalThreshold, goodThreshold);
        }

        if (optimalThreshold > 100 || goodThreshold < 0) {
            log.warn("Status thresholds ({} / {}) should lie within 0..100", optimalThreshold, goodThreshold);
        }

        if (rangeToleranceFraction <= 0) {
            log.warn("Range tolerance fraction ({}) should be positive", rangeToleranceFraction);
        }

        if (crowdDeficitPenalty < crowdExcessPenalty) {
            log.warn("Crowd deficit penalty ({}) is below excess penalty ({}); empty rooms will score better than packed ones",
                    crowdDeficitPenalty, crowdExcessPenalty);
        }

        if (crowdExcessFloor < 0 || crowdExcessFloor > 100) {
            log.warn("Crowd excess floor ({}) should lie within 0..100", crowdExcessFloor);
        }

        if (minimumEstimatedCapacity <= 0) {
            log.warn("Minimum estimated capacity ({}) should be positive", minimumEstimatedCapacity);
        }

        if (genreMismatchScore > neutralMusicScore) {
            log.warn("Genre mismatch score ({}) should not exceed the neutral music score ({})",
                    genreMismatchScore, neutralMusicScore);
        }

        log.debug("Using scoring thresholds - Optimal: {}, Good: {}, Gates: {}/{}, Profile: {}",
                optimalThreshold, goodThreshold, bestNightConfidenceThreshold, learnedConfidenceThreshold, profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Optimal: %d | Good: %d | Best-night gate: %d | Learned gate: %d",
                profileName, optimalThreshold, goodThreshold,
                bestNightConfidenceThreshold, learnedConfidenceThreshold);
    }
}
