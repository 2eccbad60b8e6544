package org.carball.pulse.scoring.selection;

import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.range.OptimalRange;
import org.carball.pulse.model.score.ActiveRanges;
import org.carball.pulse.model.score.RangeSource;
import org.carball.pulse.model.venue.ManualCalibration;

public class CalibrationRangeStrategy implements RangeStrategy {

    private final ScoringThresholds thresholds;

    public CalibrationRangeStrategy(ScoringThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public RangeSource source() {
        return RangeSource.CALIBRATION;
    }

    @Override
    public boolean isApplicable(ScoringContext context) {
        return context.manualCalibration()
                .filter(c -> c.sound() != null || c.light() != null)
                .isPresent();
    }

    @Override
    public ActiveRanges resolve(ScoringContext context) {
        ManualCalibration calibration = context.manualCalibration().orElseThrow();
        OptimalRange sound = calibration.sound() != null ? calibration.sound() : context.slot().getDefaultSound();
        OptimalRange light = calibration.light() != null ? calibration.light() : context.slot().getDefaultLight();
        return new ActiveRanges(sound, light, thresholds.getBaselineWeights(), source(), null);
    }
}
