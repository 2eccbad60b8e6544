package org.carball.pulse.scoring.selection;

import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.score.ActiveRanges;
import org.carball.pulse.model.score.RangeSource;

/**
 * The time slot's built-in ranges. Always applicable.
 */
public class DefaultRangeStrategy implements RangeStrategy {

    private final ScoringThresholds thresholds;

    public DefaultRangeStrategy(ScoringThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public RangeSource source() {
        return RangeSource.DEFAULT;
    }

    @Override
    public boolean isApplicable(ScoringContext context) {
        return true;
    }

    @Override
    public ActiveRanges resolve(ScoringContext context) {
        return new ActiveRanges(context.slot().getDefaultSound(), context.slot().getDefaultLight(),
                thresholds.getBaselineWeights(), source(), null);
    }
}
