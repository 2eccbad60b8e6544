package org.carball.pulse.learning;

import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.config.LearningConfig;
import org.carball.pulse.model.learning.Benchmarks;
import org.carball.pulse.model.learning.VenueOptimalRanges;
import org.carball.pulse.model.range.EnvironmentalRanges;
import org.carball.pulse.model.range.EnvironmentalWeights;
import org.carball.pulse.model.range.OptimalRange;
import org.carball.pulse.model.reading.HourlyPerformance;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Derives per-venue ranges and weights from the conditions during its best hours.
 *
 * <p>Hours are ranked by average dwell time. Over the top slice, each factor's range is its mean plus or
 * minus a multiple of the standard deviation, and each factor's weight is its share of the total variance.
 * Every run starts from scratch.</p>
 */
@Slf4j
public class OptimalRangeLearner {

    private static final int MIN_RANGE_SAMPLES = 2;

    private final LearningConfig config;

    public OptimalRangeLearner(LearningConfig config) {
        this.config = config;
    }

    public Optional<VenueOptimalRanges> learn(String venueId, List<HourlyPerformance> hours,
                                              double learningConfidence, LocalDateTime calculatedAt) {
        if (hours.isEmpty()) {
            log.info("No hourly performance for venue {}, nothing to learn", venueId);
            return Optional.empty();
        }

        List<HourlyPerformance> top = topPerformers(hours);
        log.debug("Venue {}: learning from top {} of {} hours", venueId, top.size(), hours.size());

        FactorStats temperature = FactorStats.of(top, HourlyPerformance::getTemperature);
        FactorStats light = FactorStats.of(top, HourlyPerformance::getLight);
        FactorStats sound = FactorStats.of(top, HourlyPerformance::getSound);
        FactorStats humidity = FactorStats.of(top, HourlyPerformance::getHumidity);

        EnvironmentalRanges ranges = new EnvironmentalRanges(
                range(temperature), range(light), range(sound), range(humidity));
        if (ranges.sound() == null && ranges.light() == null) {
            log.warn("Venue {}: top {} hours give no usable sound or light range, slot defaults stay in effect",
                    venueId, top.size());
        }

        return Optional.of(VenueOptimalRanges.builder()
                .venueId(venueId)
                .lastCalculated(calculatedAt)
                .dataPointsAnalyzed(hours.size())
                .learningConfidence(learningConfidence)
                .optimalRanges(ranges)
                .weights(weights(venueId, temperature, light, sound, humidity))
                .benchmarks(benchmarks(top, hours))
                .build());
    }

    List<HourlyPerformance> topPerformers(List<HourlyPerformance> hours) {
        int topCount = Math.max(1, (int) Math.ceil(hours.size() * config.getTopPerformancePercentile()));
        return hours.stream()
                .sorted(Comparator.comparingDouble(HourlyPerformance::getAvgDwellTimeMinutes).reversed())
                .limit(topCount)
                .toList();
    }

    /**
     * Band for one factor, or {@code null} when the top hours cannot support one: fewer than two samples,
     * or no spread at all. A zero-width band would fail every reading that is not an exact match.
     */
    private OptimalRange range(FactorStats stats) {
        if (stats.count() < MIN_RANGE_SAMPLES || stats.stdDev() == 0) {
            return null;
        }
        double spread = stats.stdDev() * config.getRangeStdDevMultiplier();
        return new OptimalRange(
                roundToTenth(stats.mean() - spread),
                roundToTenth(stats.mean() + spread),
                rangeConfidence(stats));
    }

    /**
     * Tighter clustering among winners means a more trustworthy band.
     */
    double rangeConfidence(FactorStats stats) {
        if (stats.mean() == 0) {
            return stats.stdDev() == 0 ? 1.0 : config.getMinRangeConfidence();
        }
        double coefficientOfVariation = stats.stdDev() / Math.abs(stats.mean());
        return Math.max(config.getMinRangeConfidence(), Math.min(1.0, 1 - coefficientOfVariation));
    }

    private EnvironmentalWeights weights(String venueId, FactorStats temperature, FactorStats light,
                                         FactorStats sound, FactorStats humidity) {
        double total = temperature.variance() + light.variance() + sound.variance() + humidity.variance();
        if (total == 0) {
            log.warn("Venue {}: no variance among top hours, using equal factor weights", venueId);
            return EnvironmentalWeights.EQUAL;
        }

        double temperatureWeight = temperature.variance() / total;
        double lightWeight = light.variance() / total;
        double soundWeight = sound.variance() / total;
        // Remainder absorbs rounding so the weights stay within the sum tolerance
        double humidityWeight = 1.0 - temperatureWeight - lightWeight - soundWeight;
        return new EnvironmentalWeights(temperatureWeight, lightWeight, soundWeight, Math.max(0, humidityWeight));
    }

    private static Benchmarks benchmarks(List<HourlyPerformance> top, List<HourlyPerformance> all) {
        double avgDwell = top.stream().mapToDouble(HourlyPerformance::getAvgDwellTimeMinutes).average().orElse(0);
        double avgOccupancy = top.stream().mapToDouble(HourlyPerformance::getAvgOccupancy).average().orElse(0);

        boolean hasRevenue = top.stream().anyMatch(h -> h.getRevenue() != null);
        Double avgRevenue = hasRevenue
                ? top.stream().mapToDouble(h -> h.getRevenue() == null ? 0 : h.getRevenue()).average().orElse(0)
                : null;

        int peak = all.stream().mapToInt(HourlyPerformance::getPeakOccupancy).max().orElse(0);
        return new Benchmarks(avgDwell, avgOccupancy, avgRevenue, peak);
    }

    private static double roundToTenth(double value) {
        return Math.round(value * 10) / 10.0;
    }

    /**
     * Population statistics of one factor over the hours that reported it.
     */
    record FactorStats(int count, double mean, double variance) {

        static FactorStats of(List<HourlyPerformance> hours, Function<HourlyPerformance, Double> extractor) {
            double[] values = hours.stream()
                    .map(extractor)
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .toArray();
            if (values.length == 0) {
                return new FactorStats(0, 0, 0);
            }

            double mean = 0;
            for (double v : values) {
                mean += v;
            }
            mean /= values.length;

            double variance = 0;
            for (double v : values) {
                variance += (v - mean) * (v - mean);
            }
            variance /= values.length;

            return new FactorStats(values.length, mean, variance);
        }

        double stdDev() {
            return Math.sqrt(variance);
        }
    }
}
