package org.carball.pulse.scoring;

import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.model.range.Factor;
import org.carball.pulse.model.range.FactorWeights;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Zeroes the weight of absent factors and rescales the rest so they sum to 1.0 again. Present factors
 * that all carry zero weight share it evenly.
 */
@Slf4j
public class WeightRedistributor {

    /**
     * @return rescaled weights, or empty when no factor is present
     */
    public Optional<FactorWeights> redistribute(FactorWeights base, Set<Factor> presentFactors) {
        if (presentFactors.isEmpty()) {
            log.debug("No factor present, nothing to weigh");
            return Optional.empty();
        }

        double remaining = 0.0;
        for (Factor factor : presentFactors) {
            remaining += base.weightOf(factor);
        }

        if (remaining <= 0) {
            log.warn("Present factors {} carry no weight, sharing it evenly", presentFactors);
            return Optional.of(evenly(presentFactors));
        }

        if (presentFactors.size() == Factor.values().length) {
            return Optional.of(base);
        }

        Map<Factor, Double> rescaled = new EnumMap<>(Factor.class);
        for (Factor factor : Factor.values()) {
            rescaled.put(factor, presentFactors.contains(factor) ? base.weightOf(factor) / remaining : 0.0);
        }
        FactorWeights weights = FactorWeights.fromMap(rescaled);
        log.debug("Redistributed weights over {}: {}", presentFactors, weights);
        return Optional.of(weights);
    }

    private static FactorWeights evenly(Set<Factor> presentFactors) {
        Map<Factor, Double> shares = new EnumMap<>(Factor.class);
        for (Factor factor : Factor.values()) {
            shares.put(factor, presentFactors.contains(factor) ? 1.0 / presentFactors.size() : 0.0);
        }
        return FactorWeights.fromMap(shares);
    }
}
