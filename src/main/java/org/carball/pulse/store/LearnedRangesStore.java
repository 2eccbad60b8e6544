package org.carball.pulse.store;

import org.carball.pulse.model.learning.VenueLearningRecord;

import java.io.IOException;
import java.util.Optional;

/**
 * Keeps the latest learning run per venue. A record is only ever replaced as a whole, and a reader sees
 * either the previous record or the new one, never a mix.
 */
public interface LearnedRangesStore {

    Optional<VenueLearningRecord> find(String venueId) throws IOException;

    void replace(VenueLearningRecord record) throws IOException;
}
