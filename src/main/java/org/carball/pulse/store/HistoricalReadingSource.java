package org.carball.pulse.store;

import org.carball.pulse.model.reading.SensorReading;

import java.io.IOException;
import java.util.List;

/**
 * Supplies a venue's raw sensor history. Caching, retries and timeouts belong to the implementation.
 */
public interface HistoricalReadingSource {

    /**
     * @return readings inside the window ordered by timestamp; empty when the venue has no history
     */
    List<SensorReading> fetch(String venueId, HistoryWindow window) throws IOException;
}
