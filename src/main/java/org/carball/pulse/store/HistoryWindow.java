package org.carball.pulse.store;

import java.time.LocalDateTime;

/**
 * Half-open interval {@code [from, to)} of venue-local time.
 */
public record HistoryWindow(LocalDateTime from, LocalDateTime to) {

    public HistoryWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("History window needs both bounds");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("History window starts (" + from + ") after it ends (" + to + ")");
        }
    }

    public static HistoryWindow lastDays(LocalDateTime asOf, int days) {
        return new HistoryWindow(asOf.minusDays(days), asOf);
    }

    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(from) && timestamp.isBefore(to);
    }
}
