package org.carball.pulse.slot;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

/**
 * Maps a weekday and hour to its {@link TimeSlot}. Every hour of the week resolves to exactly one slot.
 */
public final class TimeSlotResolver {

    private static final int EVENING_START = 16;
    private static final int WEEKEND_PEAK_START = 21;
    private static final int WEEKDAY_NIGHT_START = 19;

    private TimeSlotResolver() {
    }

    public static TimeSlot resolve(LocalDateTime timestamp) {
        return resolve(timestamp.getDayOfWeek(), timestamp.getHour());
    }

    public static TimeSlot resolve(DayOfWeek day, int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Hour must be within 0..23: " + hour);
        }

        if (day == DayOfWeek.SUNDAY) {
            return TimeSlot.SUNDAY_FUNDAY;
        }
        if (hour < EVENING_START) {
            return TimeSlot.DAYTIME;
        }

        return switch (day) {
            case SATURDAY -> hour < WEEKEND_PEAK_START ? TimeSlot.SATURDAY_EARLY : TimeSlot.SATURDAY_PEAK;
            case FRIDAY -> hour < WEEKEND_PEAK_START ? TimeSlot.FRIDAY_EARLY : TimeSlot.FRIDAY_PEAK;
            default -> hour < WEEKDAY_NIGHT_START ? TimeSlot.WEEKDAY_HAPPY_HOUR : TimeSlot.WEEKDAY_NIGHT;
        };
    }
}
