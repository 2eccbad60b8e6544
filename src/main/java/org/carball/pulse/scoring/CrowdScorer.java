package org.carball.pulse.scoring;

import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.range.OptimalRange;
import org.carball.pulse.slot.TimeSlot;

/**
 * Scores occupancy against the time slot's optimal band. An empty room is penalised harder than a packed one.
 */
public class CrowdScorer {

    private final ScoringThresholds thresholds;

    public CrowdScorer() {
        this(ScoringThresholds.defaults());
    }

    public CrowdScorer(ScoringThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public int score(int currentOccupancy, int estimatedCapacity, TimeSlot slot) {
        if (estimatedCapacity <= 0) {
            throw new IllegalArgumentException("Estimated capacity must be positive: " + estimatedCapacity);
        }

        double occupancyPercent = occupancyPercent(currentOccupancy, estimatedCapacity);
        OptimalRange optimal = slot.getOptimalCrowd();

        if (optimal.contains(occupancyPercent)) {
            return 100;
        }

        if (occupancyPercent < optimal.min()) {
            double deficit = optimal.min() - occupancyPercent;
            return (int) Math.max(0, Math.round(100 - deficit * thresholds.getCrowdDeficitPenalty()));
        }

        double excess = occupancyPercent - optimal.max();
        return (int) Math.max(thresholds.getCrowdExcessFloor(),
                Math.round(100 - excess * thresholds.getCrowdExcessPenalty()));
    }

    /**
     * Capacity to score against: the configured value when there is one, otherwise headroom over the
     * busiest hour seen, never below the configured minimum.
     */
    public int estimateCapacity(Integer configuredCapacity, Integer historicalPeakOccupancy) {
        if (configuredCapacity != null && configuredCapacity > 0) {
            return configuredCapacity;
        }
        int peak = historicalPeakOccupancy == null ? 0 : historicalPeakOccupancy;
        return (int) Math.max(Math.round(peak * thresholds.getCapacityHeadroom()),
                thresholds.getMinimumEstimatedCapacity());
    }

    public static double occupancyPercent(int currentOccupancy, int capacity) {
        return (currentOccupancy * 100.0) / capacity;
    }
}
