package org.carball.pulse.model.score;

import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.range.FactorWeights;
import org.carball.pulse.model.range.OptimalRange;

import java.util.List;

/**
 * Output of range selection: targets and weights for one scoring call, tagged with their source.
 *
 * @param bestNight the profile the ranges were derived from, only set for {@link RangeSource#BEST_NIGHT}
 */
public record ActiveRanges(
        OptimalRange sound,
        OptimalRange light,
        FactorWeights weights,
        RangeSource source,
        BestNightProfile bestNight
) {

    public List<String> bestNightGenres() {
        return bestNight == null || bestNight.getDetectedGenres() == null
                ? List.of()
                : bestNight.getDetectedGenres();
    }
}
