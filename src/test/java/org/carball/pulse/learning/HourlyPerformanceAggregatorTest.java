package org.carball.pulse.learning;

import org.carball.pulse.dwell.DwellTimeEstimator;
import org.carball.pulse.model.reading.HourlyPerformance;
import org.carball.pulse.model.reading.OccupancyCounts;
import org.carball.pulse.model.reading.SensorReading;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class HourlyPerformanceAggregatorTest {

    private final HourlyPerformanceAggregator aggregator = new HourlyPerformanceAggregator(new DwellTimeEstimator());

    @Test
    void shouldRollReadingsUpIntoHours() {
        // When
        List<HourlyPerformance> hours = aggregator.aggregate("venue-1", NightFixtures.twoFridays());

        // Then
        assertThat(hours).hasSize(4);
        HourlyPerformance first = hours.get(0);
        assertThat(first.getVenueId()).isEqualTo("venue-1");
        assertThat(first.getHourStart()).isEqualTo(LocalDateTime.of(2024, 3, 8, 21, 0));
        // L=45, 40 entries in half an hour
        assertThat(first.getAvgDwellTimeMinutes()).isCloseTo(33.75, within(1e-9));
        assertThat(first.getAvgOccupancy()).isEqualTo(45.0);
        assertThat(first.getPeakOccupancy()).isEqualTo(60);
        assertThat(first.getEntryCount()).isEqualTo(40);
        assertThat(first.getSound()).isEqualTo(80.0);
        assertThat(first.getLight()).isEqualTo(60.0);
        assertThat(first.getTemperature()).isNull();
        assertThat(first.getRevenue()).isNull();
    }

    @Test
    void shouldKeepHoursInChronologicalOrder() {
        List<SensorReading> readings = new ArrayList<>(NightFixtures.twoFridays());
        Collections.reverse(readings);

        List<HourlyPerformance> hours = aggregator.aggregate("venue-1", readings);

        assertThat(hours).extracting(HourlyPerformance::getHourStart).isSorted();
    }

    @Test
    void shouldLeaveOutHoursWithoutDwellTime() {
        // Given - one reading in the hour, and an hour with no entries
        LocalDateTime hour = LocalDateTime.of(2024, 3, 5, 20, 0);
        List<SensorReading> readings = List.of(
                reading(hour.plusMinutes(5), 10, 5),
                reading(hour.plusHours(1), 10, 5),
                reading(hour.plusHours(1).plusMinutes(30), 10, 5));

        // When / Then
        assertThat(aggregator.aggregate("venue-1", readings)).isEmpty();
    }

    private static SensorReading reading(LocalDateTime at, int current, int entries) {
        return SensorReading.builder()
                .timestamp(at)
                .decibels(72.0)
                .occupancy(new OccupancyCounts(current, entries, 0))
                .build();
    }
}
