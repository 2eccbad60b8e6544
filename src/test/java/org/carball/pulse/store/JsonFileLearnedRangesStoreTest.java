package org.carball.pulse.store;

import org.carball.pulse.model.learning.Benchmarks;
import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.learning.VenueLearningRecord;
import org.carball.pulse.model.learning.VenueOptimalRanges;
import org.carball.pulse.model.range.EnvironmentalRanges;
import org.carball.pulse.model.range.EnvironmentalWeights;
import org.carball.pulse.model.range.OptimalRange;
import org.carball.pulse.slot.TimeSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsonFileLearnedRangesStoreTest {

    @TempDir
    Path tempDir;

    private JsonFileLearnedRangesStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = new JsonFileLearnedRangesStore(tempDir.resolve("learning"));
    }

    @Test
    void shouldReadBackStoredRecord() throws IOException {
        // Given
        VenueLearningRecord record = record("venue-1", 0.62);

        // When
        store.replace(record);

        // Then
        assertThat(store.find("venue-1")).contains(record);
    }

    @Test
    void shouldReplaceWholeRecord() throws IOException {
        // Given
        store.replace(record("venue-1", 0.62));
        VenueLearningRecord newer = new VenueLearningRecord("venue-1", ranges("venue-1", 0.81), Map.of());

        // When
        store.replace(newer);

        // Then
        VenueLearningRecord found = store.find("venue-1").orElseThrow();
        assertThat(found.optimalRanges().getLearningConfidence()).isEqualTo(0.81);
        assertThat(found.bestNights()).isEmpty();
    }

    @Test
    void shouldReturnEmptyForUnknownVenue() throws IOException {
        assertThat(store.find("nobody")).isEmpty();
    }

    @Test
    void shouldLeaveNoTemporaryFilesBehind() throws IOException {
        // When
        store.replace(record("venue-1", 0.62));
        store.replace(record("venue-2", 0.40));

        // Then
        try (Stream<Path> files = Files.list(tempDir.resolve("learning"))) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactlyInAnyOrder("venue-1.json", "venue-2.json");
        }
    }

    @Test
    void shouldSanitizeVenueIdIntoFileName() {
        assertThat(store.fileFor("bar/../the pub").getFileName().toString()).isEqualTo("bar_.._the_pub.json");
        assertThatThrownBy(() -> store.fileFor(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static VenueLearningRecord record(String venueId, double confidence) {
        BestNightProfile bestNight = BestNightProfile.builder()
                .date(LocalDate.of(2024, 3, 8))
                .dayOfWeek(DayOfWeek.FRIDAY)
                .timeSlot(TimeSlot.FRIDAY_PEAK)
                .totalGuests(120)
                .peakOccupancy(80)
                .avgDwellMinutes(45)
                .avgSound(80)
                .avgLight(60)
                .topArtists(List.of("Drake"))
                .detectedGenres(List.of("hip-hop"))
                .peakHour(22)
                .dataPointsFromNight(4)
                .confidence(40)
                .build();
        return new VenueLearningRecord(venueId, ranges(venueId, confidence), Map.of(TimeSlot.FRIDAY_PEAK, bestNight));
    }

    private static VenueOptimalRanges ranges(String venueId, double confidence) {
        return VenueOptimalRanges.builder()
                .venueId(venueId)
                .lastCalculated(LocalDateTime.of(2024, 3, 20, 4, 0))
                .dataPointsAnalyzed(240)
                .learningConfidence(confidence)
                .optimalRanges(new EnvironmentalRanges(null, OptimalRange.of(40, 120),
                        new OptimalRange(76.5, 79.5, 0.97), null))
                .weights(new EnvironmentalWeights(0, 0.25, 0.75, 0))
                .benchmarks(new Benchmarks(95, 60, null, 150))
                .build();
    }
}
