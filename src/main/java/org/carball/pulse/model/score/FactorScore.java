package org.carball.pulse.model.score;

import org.carball.pulse.model.range.Factor;
import org.carball.pulse.model.range.OptimalRange;

/**
 * Fitness of one factor.
 *
 * @param present      whether the signal was available; absent factors carry no weight
 * @param displayValue measured value as shown to operators, {@code null} when absent
 * @param target       band the value was compared against, {@code null} for music
 * @param weight       weight actually applied in the final score
 */
public record FactorScore(
        Factor factor,
        int score,
        boolean present,
        String displayValue,
        OptimalRange target,
        boolean inRange,
        double weight,
        String message
) {}
