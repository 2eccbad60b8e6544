package org.carball.pulse.scoring;

import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.range.OptimalRange;

/**
 * Scores a measured value against a target band. Full marks inside the band, then a linear
 * falloff over a tolerance proportional to the band width.
 */
public class RangeScorer {

    private final double toleranceFraction;

    public RangeScorer() {
        this(ScoringThresholds.defaults());
    }

    public RangeScorer(ScoringThresholds thresholds) {
        this.toleranceFraction = thresholds.getRangeToleranceFraction();
    }

    /**
     * @return 0..100; 0 for a {@code null} value
     */
    public int score(Double value, OptimalRange range) {
        if (value == null || value.isNaN()) {
            return 0;
        }
        if (range.contains(value)) {
            return 100;
        }

        double tolerance = range.width() * toleranceFraction;
        if (tolerance <= 0) {
            return 0;
        }

        double deviation = value < range.min() ? range.min() - value : value - range.max();
        double penalty = (deviation / tolerance) * 100;
        return (int) Math.max(0, Math.round(100 - penalty));
    }
}
