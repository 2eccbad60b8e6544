package org.carball.pulse.store;

import org.carball.pulse.model.venue.VenueSettings;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryVenueSettingsStore implements VenueSettingsStore {

    private final Map<String, VenueSettings> settings = new ConcurrentHashMap<>();

    @Override
    public Optional<VenueSettings> find(String venueId) {
        return Optional.ofNullable(settings.get(venueId));
    }

    @Override
    public void save(VenueSettings venueSettings) {
        if (venueSettings.getVenueId() == null || venueSettings.getVenueId().isBlank()) {
            throw new IllegalArgumentException("Venue settings require a venue id");
        }
        settings.put(venueSettings.getVenueId(), venueSettings);
    }
}
