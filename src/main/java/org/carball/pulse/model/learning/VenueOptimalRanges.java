package org.carball.pulse.model.learning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.pulse.model.range.EnvironmentalRanges;
import org.carball.pulse.model.range.EnvironmentalWeights;

import java.time.LocalDateTime;

/**
 * Ranges and weights learned for one venue by a single learning run. Replaced wholesale by the next run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VenueOptimalRanges {
    private String venueId;
    private LocalDateTime lastCalculated;
    private int dataPointsAnalyzed;
    /** 0..1, how far learned ranges are trusted over defaults. */
    private double learningConfidence;
    private EnvironmentalRanges optimalRanges;
    private EnvironmentalWeights weights;
    private Benchmarks benchmarks;

    @JsonIgnore
    public int getConfidencePercent() {
        return (int) Math.round(learningConfidence * 100);
    }

    @JsonIgnore
    public LearningStatus getLearningStatus() {
        return LearningStatus.fromConfidence(learningConfidence);
    }
}
