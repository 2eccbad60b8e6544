package org.carball.pulse.scoring.selection;

import org.carball.pulse.model.score.ActiveRanges;
import org.carball.pulse.model.score.RangeSource;

/**
 * One source of scoring targets. {@link #resolve} is only called after {@link #isApplicable} accepted
 * the same context.
 */
public interface RangeStrategy {

    RangeSource source();

    boolean isApplicable(ScoringContext context);

    ActiveRanges resolve(ScoringContext context);
}
