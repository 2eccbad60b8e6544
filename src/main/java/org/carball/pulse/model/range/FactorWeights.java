package org.carball.pulse.model.range;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-factor weights of the Pulse Score. Always sums to 1.0.
 */
public record FactorWeights(double sound, double light, double crowd, double music) {

    public static final double SUM_TOLERANCE = 1e-6;

    public static final FactorWeights BASELINE = new FactorWeights(0.40, 0.25, 0.20, 0.15);

    public FactorWeights {
        if (sound < 0 || light < 0 || crowd < 0 || music < 0) {
            throw new IllegalArgumentException(String.format(
                    "Factor weights must not be negative: sound=%.3f light=%.3f crowd=%.3f music=%.3f",
                    sound, light, crowd, music));
        }
        double sum = sound + light + crowd + music;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Factor weights must sum to 1.0 but sum to " + sum);
        }
    }

    public static FactorWeights fromMap(Map<Factor, Double> weights) {
        return new FactorWeights(
                weights.getOrDefault(Factor.SOUND, 0.0),
                weights.getOrDefault(Factor.LIGHT, 0.0),
                weights.getOrDefault(Factor.CROWD, 0.0),
                weights.getOrDefault(Factor.MUSIC, 0.0));
    }

    public double weightOf(Factor factor) {
        return switch (factor) {
            case SOUND -> sound;
            case LIGHT -> light;
            case CROWD -> crowd;
            case MUSIC -> music;
        };
    }

    public Map<Factor, Double> asMap() {
        Map<Factor, Double> map = new EnumMap<>(Factor.class);
        for (Factor factor : Factor.values()) {
            map.put(factor, weightOf(factor));
        }
        return map;
    }
}
