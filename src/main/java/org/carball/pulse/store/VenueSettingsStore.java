package org.carball.pulse.store;

import org.carball.pulse.model.venue.VenueSettings;

import java.io.IOException;
import java.util.Optional;

public interface VenueSettingsStore {

    Optional<VenueSettings> find(String venueId) throws IOException;

    void save(VenueSettings settings) throws IOException;
}
