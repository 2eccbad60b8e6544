package org.carball.pulse.scoring;

import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.score.GenreMatch;
import org.carball.pulse.slot.TimeSlot;

import java.util.List;

/**
 * Scores the music currently playing against what worked on the venue's best night, or against the
 * genres expected for the time slot when there is no best night to compare with.
 */
public class GenreMatcher {

    private final GenreClassifier classifier;
    private final ScoringThresholds thresholds;

    public GenreMatcher(GenreClassifier classifier) {
        this(classifier, ScoringThresholds.defaults());
    }

    public GenreMatcher(GenreClassifier classifier, ScoringThresholds thresholds) {
        this.classifier = classifier;
        this.thresholds = thresholds;
    }

    public GenreMatch match(String song, String artist, TimeSlot slot, List<String> bestNightGenres) {
        if (isBlank(song) && isBlank(artist)) {
            return new GenreMatch(thresholds.getNeutralMusicScore(), List.of(), false, "No music detected");
        }

        List<String> detected = classifier.detect(song, artist);
        if (detected.isEmpty()) {
            return new GenreMatch(thresholds.getNeutralMusicScore(), List.of(), true, "Genre not detected");
        }

        String lead = detected.get(0);
        if (bestNightGenres != null && !bestNightGenres.isEmpty()) {
            if (intersects(detected, bestNightGenres)) {
                return new GenreMatch(thresholds.getBestNightGenreMatchScore(), detected, true,
                        lead + " - matching your best nights!");
            }
            return new GenreMatch(thresholds.getGenreMismatchScore(), detected, true,
                    lead + " - different from your usual");
        }

        if (intersects(detected, slot.getExpectedGenres())) {
            return new GenreMatch(thresholds.getSlotGenreMatchScore(), detected, true, lead + " fits this time");
        }
        return new GenreMatch(thresholds.getGenreMismatchScore(), detected, true, lead);
    }

    /**
     * Genres are compatible when either name contains the other, so "hip-hop" matches "hip-hop/rap".
     */
    static boolean intersects(List<String> detected, List<String> reference) {
        for (String genre : detected) {
            for (String candidate : reference) {
                if (genre.contains(candidate) || candidate.contains(genre)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
