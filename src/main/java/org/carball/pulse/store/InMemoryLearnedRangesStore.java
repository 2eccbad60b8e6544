package org.carball.pulse.store;

import org.carball.pulse.model.learning.VenueLearningRecord;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLearnedRangesStore implements LearnedRangesStore {

    private final Map<String, VenueLearningRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<VenueLearningRecord> find(String venueId) {
        return Optional.ofNullable(records.get(venueId));
    }

    @Override
    public void replace(VenueLearningRecord record) {
        records.put(record.venueId(), record);
    }
}
