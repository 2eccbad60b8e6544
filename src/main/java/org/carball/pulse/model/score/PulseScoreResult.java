package org.carball.pulse.model.score;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.range.Factor;
import org.carball.pulse.model.range.FactorWeights;
import org.carball.pulse.slot.TimeSlot;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class PulseScoreResult {
    /** 0..100; zero when {@link #status} is {@link ScoreStatus#NO_DATA}. */
    int score;
    ScoreStatus status;
    String statusLabel;
    TimeSlot timeSlot;
    @Singular
    Map<Factor, FactorScore> factors;
    RangeSource rangeSource;
    /** Weights after redistribution over present factors; {@code null} when nothing was present. */
    FactorWeights appliedWeights;
    BestNightProfile bestNight;
    /** 0..100 closeness to the best night's sound and light, only when scoring against a best night. */
    Integer proximityToBest;
    List<String> detectedGenres;
    List<String> bestNightGenres;

    public FactorScore factor(Factor factor) {
        return factors.get(factor);
    }

    public boolean hasData() {
        return status != ScoreStatus.NO_DATA;
    }

    public boolean isUsingHistoricalData() {
        return rangeSource != null && rangeSource.isHistorical();
    }
}
