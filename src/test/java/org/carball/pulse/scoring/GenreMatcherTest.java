package org.carball.pulse.scoring;

import org.carball.pulse.model.score.GenreMatch;
import org.carball.pulse.slot.TimeSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class GenreMatcherTest {

    private GenreMatcher matcher;

    @BeforeEach
    void setUp() {
        Map<String, List<String>> vocabulary = new LinkedHashMap<>();
        vocabulary.put("hip-hop", List.of("drake", "rap"));
        vocabulary.put("country", List.of("country", "morgan wallen"));
        vocabulary.put("jazz", List.of("jazz"));
        matcher = new GenreMatcher(new KeywordGenreClassifier(vocabulary));
    }

    @Test
    void shouldScoreSilenceAsNeutral() {
        GenreMatch match = matcher.match(null, null, TimeSlot.WEEKDAY_NIGHT, List.of("hip-hop"));

        assertThat(match.score()).isEqualTo(80);
        assertThat(match.musicPresent()).isFalse();
        assertThat(match.message()).isEqualTo("No music detected");
    }

    @Test
    void shouldScoreUnrecognisedTrackAsNeutral() {
        GenreMatch match = matcher.match("Untitled", "Somebody", TimeSlot.WEEKDAY_NIGHT, List.of("hip-hop"));

        assertThat(match.score()).isEqualTo(80);
        assertThat(match.musicPresent()).isTrue();
        assertThat(match.detectedGenres()).isEmpty();
        assertThat(match.message()).isEqualTo("Genre not detected");
    }

    @Test
    void shouldRewardBestNightGenre() {
        GenreMatch match = matcher.match("God's Plan", "Drake", TimeSlot.WEEKDAY_NIGHT, List.of("hip-hop"));

        assertThat(match.score()).isEqualTo(100);
        assertThat(match.detectedGenres()).containsExactly("hip-hop");
        assertThat(match.message()).isEqualTo("hip-hop - matching your best nights!");
    }

    @Test
    void shouldTreatContainedGenreNamesAsCompatible() {
        GenreMatch match = matcher.match("God's Plan", "Drake", TimeSlot.WEEKDAY_NIGHT, List.of("hip-hop/rap"));

        assertThat(match.score()).isEqualTo(100);
    }

    @Test
    void shouldMarkDownDepartureFromBestNight() {
        GenreMatch match = matcher.match("Last Night", "Morgan Wallen", TimeSlot.WEEKDAY_NIGHT, List.of("hip-hop"));

        assertThat(match.score()).isEqualTo(70);
        assertThat(match.message()).isEqualTo("country - different from your usual");
    }

    @Test
    void shouldFallBackToSlotGenresWithoutBestNight() {
        GenreMatch fits = matcher.match("God's Plan", "Drake", TimeSlot.WEEKDAY_NIGHT, List.of());
        GenreMatch misfit = matcher.match("So What", "Miles Davis jazz", TimeSlot.WEEKDAY_NIGHT, null);

        assertThat(fits.score()).isEqualTo(90);
        assertThat(fits.message()).isEqualTo("hip-hop fits this time");
        assertThat(misfit.score()).isEqualTo(70);
        assertThat(misfit.message()).isEqualTo("jazz");
    }

    @Test
    void shouldNeverScoreMissingSignalBelowActiveMismatch() {
        int silence = matcher.match(null, null, TimeSlot.FRIDAY_PEAK, List.of("country")).score();
        int mismatch = matcher.match("Drake", null, TimeSlot.FRIDAY_PEAK, List.of("country")).score();

        assertThat(silence).isGreaterThan(mismatch);
    }
}
