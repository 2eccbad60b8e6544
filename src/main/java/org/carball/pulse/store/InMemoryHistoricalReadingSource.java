package org.carball.pulse.store;

import org.carball.pulse.model.reading.SensorReading;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Reading source backed by lists handed to it up front. Useful for replaying exported history. Readings may be
 * added while other threads fetch.
 */
public class InMemoryHistoricalReadingSource implements HistoricalReadingSource {

    private final Map<String, List<SensorReading>> readingsByVenue = new ConcurrentHashMap<>();

    public void add(String venueId, List<SensorReading> readings) {
        readingsByVenue.computeIfAbsent(venueId, id -> new CopyOnWriteArrayList<>()).addAll(readings);
    }

    @Override
    public List<SensorReading> fetch(String venueId, HistoryWindow window) {
        return readingsByVenue.getOrDefault(venueId, List.of()).stream()
                .filter(r -> r.getTimestamp() != null && window.contains(r.getTimestamp()))
                .sorted(Comparator.comparing(SensorReading::getTimestamp))
                .toList();
    }
}
