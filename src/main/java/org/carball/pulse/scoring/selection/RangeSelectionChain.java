package org.carball.pulse.scoring.selection;

import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.score.ActiveRanges;

import java.util.List;

/**
 * Tries each strategy in order and takes the first that applies. The last strategy must always apply.
 */
@Slf4j
public class RangeSelectionChain {

    private final List<RangeStrategy> strategies;
    private final RangeStrategy fallback;

    public RangeSelectionChain(List<RangeStrategy> strategies, RangeStrategy fallback) {
        this.strategies = List.copyOf(strategies);
        this.fallback = fallback;
    }

    /**
     * Best night, then learned ranges, then manual calibration, then time-slot defaults.
     */
    public static RangeSelectionChain standard(ScoringThresholds thresholds) {
        return new RangeSelectionChain(
                List.of(new BestNightRangeStrategy(thresholds),
                        new LearnedRangeStrategy(thresholds),
                        new CalibrationRangeStrategy(thresholds)),
                new DefaultRangeStrategy(thresholds));
    }

    public ActiveRanges select(ScoringContext context) {
        for (RangeStrategy strategy : strategies) {
            if (strategy.isApplicable(context)) {
                ActiveRanges ranges = strategy.resolve(context);
                log.debug("Venue {} slot {}: using {} ranges (sound {}, light {})",
                        context.venueId(), context.slot().getKey(), strategy.source(),
                        ranges.sound(), ranges.light());
                return ranges;
            }
        }
        log.debug("Venue {} slot {}: falling back to {} ranges",
                context.venueId(), context.slot().getKey(), fallback.source());
        return fallback.resolve(context);
    }

    public List<RangeStrategy> getStrategies() {
        return strategies;
    }
}
