package org.carball.pulse.scoring.selection;

import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.learning.VenueOptimalRanges;
import org.carball.pulse.model.range.EnvironmentalRanges;
import org.carball.pulse.model.range.EnvironmentalWeights;
import org.carball.pulse.model.range.FactorWeights;
import org.carball.pulse.model.range.OptimalRange;
import org.carball.pulse.model.score.ActiveRanges;
import org.carball.pulse.model.score.RangeSource;
import org.carball.pulse.slot.TimeSlot;

import java.util.Optional;

/**
 * Ranges and weights derived from the venue's top-performing hours. Steps aside when neither a sound nor a
 * light range was learned.
 */
public class LearnedRangeStrategy implements RangeStrategy {

    private final ScoringThresholds thresholds;

    public LearnedRangeStrategy(ScoringThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public RangeSource source() {
        return RangeSource.LEARNED;
    }

    @Override
    public boolean isApplicable(ScoringContext context) {
        return learned(context)
                .filter(r -> r.getLearningConfidence() * 100 >= thresholds.getLearnedConfidenceThreshold())
                .filter(LearnedRangeStrategy::hasSoundOrLight)
                .isPresent();
    }

    @Override
    public ActiveRanges resolve(ScoringContext context) {
        VenueOptimalRanges learned = learned(context).orElseThrow();
        TimeSlot slot = context.slot();
        EnvironmentalRanges ranges = learned.getOptimalRanges();

        OptimalRange sound = ranges != null && ranges.sound() != null ? ranges.sound() : slot.getDefaultSound();
        OptimalRange light = ranges != null && ranges.light() != null ? ranges.light() : slot.getDefaultLight();

        return new ActiveRanges(sound, light,
                scoringWeights(learned.getWeights(), thresholds.getBaselineWeights()), source(), null);
    }

    /**
     * Splits the baseline sound and light share in proportion to the learned sound and light weights.
     * Crowd and music are not learned and keep their baseline weights.
     */
    static FactorWeights scoringWeights(EnvironmentalWeights learned, FactorWeights baseline) {
        if (learned == null) {
            return baseline;
        }
        double learnedTotal = learned.sound() + learned.light();
        if (learnedTotal <= 0) {
            return baseline;
        }
        double share = baseline.sound() + baseline.light();
        double sound = share * learned.sound() / learnedTotal;
        return new FactorWeights(sound, share - sound, baseline.crowd(), baseline.music());
    }

    private static boolean hasSoundOrLight(VenueOptimalRanges learned) {
        EnvironmentalRanges ranges = learned.getOptimalRanges();
        return ranges != null && (ranges.sound() != null || ranges.light() != null);
    }

    private static Optional<VenueOptimalRanges> learned(ScoringContext context) {
        return context.learningRecord().flatMap(record -> record.ranges());
    }
}
