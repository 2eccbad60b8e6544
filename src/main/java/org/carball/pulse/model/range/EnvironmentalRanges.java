package org.carball.pulse.model.range;

/**
 * Learned bands for the four environmental factors. A factor with no usable
 * history among top performers is {@code null}.
 */
public record EnvironmentalRanges(
        OptimalRange temperature,
        OptimalRange light,
        OptimalRange sound,
        OptimalRange humidity
) {}
