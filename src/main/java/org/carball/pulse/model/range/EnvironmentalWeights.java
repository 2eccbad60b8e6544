package org.carball.pulse.model.range;

/**
 * Learned importance of each environmental factor. Sums to 1.0.
 */
public record EnvironmentalWeights(double temperature, double light, double sound, double humidity) {

    public static final EnvironmentalWeights EQUAL = new EnvironmentalWeights(0.25, 0.25, 0.25, 0.25);

    public EnvironmentalWeights {
        double sum = temperature + light + sound + humidity;
        if (Math.abs(sum - 1.0) > FactorWeights.SUM_TOLERANCE) {
            throw new IllegalArgumentException("Environmental weights must sum to 1.0 but sum to " + sum);
        }
    }
}
