package org.carball.pulse.scoring.selection;

import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.range.OptimalRange;
import org.carball.pulse.model.score.ActiveRanges;
import org.carball.pulse.model.score.RangeSource;
import org.carball.pulse.slot.TimeSlot;

import java.util.Optional;

/**
 * Narrow bands around the averages of the venue's best night in this slot.
 */
public class BestNightRangeStrategy implements RangeStrategy {

    private final ScoringThresholds thresholds;

    public BestNightRangeStrategy(ScoringThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public RangeSource source() {
        return RangeSource.BEST_NIGHT;
    }

    @Override
    public boolean isApplicable(ScoringContext context) {
        return profile(context)
                .filter(p -> p.getConfidence() >= thresholds.getBestNightConfidenceThreshold())
                .isPresent();
    }

    @Override
    public ActiveRanges resolve(ScoringContext context) {
        BestNightProfile profile = profile(context).orElseThrow();
        TimeSlot slot = context.slot();

        // A sensor that was dark all night leaves nothing to centre on
        OptimalRange sound = profile.getAvgSound() > 0
                ? OptimalRange.around(profile.getAvgSound(), thresholds.getBestNightSoundTolerance())
                : slot.getDefaultSound();
        OptimalRange light = profile.getAvgLight() > 0
                ? OptimalRange.around(profile.getAvgLight(), thresholds.getBestNightLightTolerance())
                : slot.getDefaultLight();

        return new ActiveRanges(sound, light, thresholds.getBaselineWeights(), source(), profile);
    }

    private static Optional<BestNightProfile> profile(ScoringContext context) {
        return context.learningRecord().flatMap(record -> record.bestNight(context.slot()));
    }
}
