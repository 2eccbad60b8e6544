package org.carball.pulse.learning;

import org.carball.pulse.config.LearningConfig;
import org.carball.pulse.model.reading.SensorReading;

import java.util.List;
import java.util.Objects;

/**
 * How far learned targets can be trusted over generic defaults, from the volume and spread of history.
 * Outcome quality plays no part. The result is 0..1 and never exceeds the learning cap.
 */
public class LearningConfidenceCalculator {

    private final LearningConfig config;

    public LearningConfidenceCalculator(LearningConfig config) {
        this.config = config;
    }

    public double calculate(int dataPoints, int uniqueDays) {
        if (dataPoints <= 0) {
            return config.getConfidenceFloor();
        }

        double pointsConfidence = Math.min(config.getMaxPointsConfidence(),
                (double) dataPoints / config.getPointsForFullConfidence());
        double daysBonus = Math.min(config.getMaxDaysBonus(),
                (double) Math.max(0, uniqueDays) / config.getDaysForFullBonus());

        return Math.max(config.getConfidenceFloor(),
                Math.min(config.getLearningCap(), pointsConfidence + daysBonus));
    }

    public double calculate(List<SensorReading> readings) {
        int uniqueDays = (int) readings.stream()
                .map(SensorReading::getTimestamp)
                .filter(Objects::nonNull)
                .map(t -> t.toLocalDate())
                .distinct()
                .count();
        return calculate(readings.size(), uniqueDays);
    }
}
