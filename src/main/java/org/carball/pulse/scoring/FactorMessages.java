package org.carball.pulse.scoring;

import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.range.OptimalRange;

/**
 * Operator-facing one-liners for the factor breakdown.
 */
final class FactorMessages {

    private static final int SOUND_MATCH_DB = 2;
    private static final int LIGHT_MATCH_LUX = 20;

    private FactorMessages() {
    }

    static String sound(Double value, int score, OptimalRange target, BestNightProfile bestNight) {
        if (value == null) {
            return "No sound data";
        }
        if (bestNight != null && bestNight.getAvgSound() > 0) {
            long diff = Math.round(value - bestNight.getAvgSound());
            if (Math.abs(diff) <= SOUND_MATCH_DB) {
                return String.format("Matching your best (%.0fdB)", bestNight.getAvgSound());
            }
            return diff > 0
                    ? diff + "dB louder than your best"
                    : Math.abs(diff) + "dB quieter than your best";
        }
        if (score >= 85) return "Perfect energy";
        if (score >= 60) return "Good vibe";
        return value < target.min() ? "Too quiet for now" : "Too loud for now";
    }

    static String light(Double value, int score, OptimalRange target, BestNightProfile bestNight) {
        if (value == null) {
            return "No light data";
        }
        if (bestNight != null && bestNight.getAvgLight() > 0) {
            long diff = Math.round(value - bestNight.getAvgLight());
            if (Math.abs(diff) <= LIGHT_MATCH_LUX) {
                return String.format("Matching your best (%.0f lux)", bestNight.getAvgLight());
            }
            return diff > 0
                    ? diff + " lux brighter than your best"
                    : Math.abs(diff) + " lux dimmer than your best";
        }
        if (score >= 85) return "Perfect ambiance";
        if (score >= 60) return "Good mood";
        return value < target.min() ? "Could be brighter" : "Could dim a bit";
    }

    static String crowd(Integer occupancy, double percent, int score, OptimalRange optimal) {
        if (occupancy == null) {
            return "No crowd data";
        }
        long shown = Math.round(percent);
        if (score >= 85) {
            return "Perfect crowd (" + shown + "% full)";
        }
        if (score >= 60) {
            return percent < optimal.min()
                    ? "Building up (" + shown + "% full)"
                    : "Packed house (" + shown + "% full)";
        }
        return percent < optimal.min()
                ? "Quiet night (" + shown + "% full)"
                : "Very packed (" + shown + "% full)";
    }
}
