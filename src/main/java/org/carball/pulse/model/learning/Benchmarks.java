package org.carball.pulse.model.learning;

/**
 * Outcome averages over the top-performing hours.
 *
 * @param avgRevenueTop20         {@code null} unless revenue was reported for at least one top hour
 * @param historicalPeakOccupancy highest occupancy seen across all analysed hours
 */
public record Benchmarks(
        double avgDwellTimeTop20,
        double avgOccupancyTop20,
        Double avgRevenueTop20,
        int historicalPeakOccupancy
) {}
