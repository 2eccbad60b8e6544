package org.carball.pulse.model.score;

import java.util.List;

/**
 * @param musicPresent false when no song or artist was playing
 */
public record GenreMatch(int score, List<String> detectedGenres, boolean musicPresent, String message) {

    public GenreMatch {
        detectedGenres = detectedGenres == null ? List.of() : List.copyOf(detectedGenres);
    }
}
