package org.carball.pulse.learning;

import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.dwell.DwellTimeEstimator;
import org.carball.pulse.model.reading.HourlyPerformance;
import org.carball.pulse.model.reading.SensorReading;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Rolls raw readings up into clock hours. Hours without a usable dwell-time estimate have no outcome to
 * learn from and are left out.
 */
@Slf4j
public class HourlyPerformanceAggregator {

    private final DwellTimeEstimator dwellTimeEstimator;

    public HourlyPerformanceAggregator(DwellTimeEstimator dwellTimeEstimator) {
        this.dwellTimeEstimator = dwellTimeEstimator;
    }

    public List<HourlyPerformance> aggregate(String venueId, List<SensorReading> readings) {
        Map<LocalDateTime, List<SensorReading>> byHour = readings.stream()
                .filter(r -> r.getTimestamp() != null)
                .collect(Collectors.groupingBy(
                        r -> r.getTimestamp().truncatedTo(ChronoUnit.HOURS),
                        TreeMap::new,
                        Collectors.toList()));

        List<HourlyPerformance> hours = new ArrayList<>();
        int skipped = 0;
        for (Map.Entry<LocalDateTime, List<SensorReading>> entry : byHour.entrySet()) {
            List<SensorReading> hourReadings = new ArrayList<>(entry.getValue());
            hourReadings.sort(Comparator.comparing(SensorReading::getTimestamp));

            OptionalDouble dwell = dwellTimeEstimator.estimateFromReadings(hourReadings, 1.0);
            if (dwell.isEmpty()) {
                skipped++;
                continue;
            }
            hours.add(toHour(venueId, entry.getKey(), hourReadings, dwell.getAsDouble()));
        }

        log.debug("Venue {}: aggregated {} readings into {} hours ({} without dwell time)",
                venueId, readings.size(), hours.size(), skipped);
        return hours;
    }

    private static HourlyPerformance toHour(String venueId, LocalDateTime hourStart,
                                            List<SensorReading> readings, double dwellMinutes) {
        List<SensorReading> counted = readings.stream().filter(SensorReading::hasOccupancy).toList();

        return HourlyPerformance.builder()
                .venueId(venueId)
                .hourStart(hourStart)
                .temperature(average(readings, r -> r.getIndoorTemp() != null, SensorReading::getIndoorTemp))
                .light(average(readings, SensorReading::hasLight, SensorReading::getLux))
                .sound(average(readings, SensorReading::hasSound, SensorReading::getDecibels))
                .humidity(average(readings, r -> r.getHumidity() != null, SensorReading::getHumidity))
                .avgDwellTimeMinutes(dwellMinutes)
                .avgOccupancy(counted.stream().mapToInt(r -> r.getOccupancy().current()).average().orElse(0))
                .peakOccupancy(counted.stream().mapToInt(r -> r.getOccupancy().current()).max().orElse(0))
                .entryCount(counterDelta(counted, r -> r.getOccupancy().entries()))
                .exitCount(counterDelta(counted, r -> r.getOccupancy().exits()))
                .build();
    }

    private static Double average(List<SensorReading> readings, Predicate<SensorReading> present,
                                  Function<SensorReading, Double> value) {
        OptionalDouble avg = readings.stream()
                .filter(present)
                .map(value)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        return avg.isPresent() ? avg.getAsDouble() : null;
    }

    private static int counterDelta(List<SensorReading> sortedReadings, Function<SensorReading, Integer> counter) {
        if (sortedReadings.size() < 2) {
            return 0;
        }
        int earliest = counter.apply(sortedReadings.get(0));
        int latest = counter.apply(sortedReadings.get(sortedReadings.size() - 1));
        return Math.max(0, latest - earliest);
    }
}
