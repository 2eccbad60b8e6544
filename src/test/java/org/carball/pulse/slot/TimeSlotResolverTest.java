package org.carball.pulse.slot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TimeSlotResolverTest {

    @ParameterizedTest
    @CsvSource({
            "MONDAY, 10, DAYTIME",
            "MONDAY, 15, DAYTIME",
            "MONDAY, 16, WEEKDAY_HAPPY_HOUR",
            "THURSDAY, 18, WEEKDAY_HAPPY_HOUR",
            "THURSDAY, 19, WEEKDAY_NIGHT",
            "TUESDAY, 23, WEEKDAY_NIGHT",
            "FRIDAY, 12, DAYTIME",
            "FRIDAY, 16, FRIDAY_EARLY",
            "FRIDAY, 20, FRIDAY_EARLY",
            "FRIDAY, 21, FRIDAY_PEAK",
            "SATURDAY, 2, DAYTIME",
            "SATURDAY, 17, SATURDAY_EARLY",
            "SATURDAY, 22, SATURDAY_PEAK",
            "SUNDAY, 0, SUNDAY_FUNDAY",
            "SUNDAY, 22, SUNDAY_FUNDAY"
    })
    void shouldResolveSlotFromDayAndHour(DayOfWeek day, int hour, TimeSlot expected) {
        assertThat(TimeSlotResolver.resolve(day, hour)).isEqualTo(expected);
    }

    @Test
    void shouldCoverEveryHourOfTheWeekWithAllEightSlots() {
        // Given
        Set<TimeSlot> seen = EnumSet.noneOf(TimeSlot.class);
        int resolved = 0;

        // When
        for (DayOfWeek day : DayOfWeek.values()) {
            for (int hour = 0; hour < 24; hour++) {
                seen.add(TimeSlotResolver.resolve(day, hour));
                resolved++;
            }
        }

        // Then
        assertThat(resolved).isEqualTo(168);
        assertThat(seen).containsExactlyInAnyOrder(TimeSlot.values());
    }

    @Test
    void shouldResolveFromHistoricalTimestamp() {
        // 2024-03-08 was a Friday
        LocalDateTime fridayNight = LocalDateTime.of(2024, 3, 8, 22, 30);

        assertThat(TimeSlotResolver.resolve(fridayNight)).isEqualTo(TimeSlot.FRIDAY_PEAK);
    }

    @Test
    void shouldRejectInvalidHour() {
        assertThatThrownBy(() -> TimeSlotResolver.resolve(DayOfWeek.MONDAY, 24))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Hour must be within 0..23");
    }

    @Test
    void shouldLookUpSlotByKey() {
        assertThat(TimeSlot.fromKey("friday_peak")).isEqualTo(TimeSlot.FRIDAY_PEAK);
        assertThatThrownBy(() -> TimeSlot.fromKey("brunch"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
