package org.carball.pulse.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.range.FactorWeights;
import org.carball.pulse.model.range.OptimalRange;
import org.carball.pulse.model.reading.SensorReading;
import org.carball.pulse.model.score.ActiveRanges;
import org.carball.pulse.model.score.PulseScoreResult;
import org.carball.pulse.model.score.RangeSource;
import org.carball.pulse.scoring.KeywordGenreClassifier;
import org.carball.pulse.scoring.PulseScoreCalculator;
import org.carball.pulse.slot.TimeSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PulseScoreReportTest {

    private static final LocalDateTime GENERATED_AT = LocalDateTime.of(2024, 3, 5, 21, 0);
    private static final TimeSlot SLOT = TimeSlot.WEEKDAY_NIGHT;

    private PulseScoreCalculator calculator;
    private ActiveRanges defaults;

    @BeforeEach
    void setUp() {
        calculator = new PulseScoreCalculator(ScoringThresholds.defaults(),
                new KeywordGenreClassifier(Map.of("hip-hop", List.of("drake"))));
        defaults = new ActiveRanges(SLOT.getDefaultSound(), SLOT.getDefaultLight(),
                FactorWeights.BASELINE, RangeSource.DEFAULT, null);
    }

    @Test
    void shouldExplainScoreAsJson() throws Exception {
        // Given
        PulseScoreResult result = calculator.calculate(
                SensorReading.builder().decibels(76.0).lux(200.0).build(), SLOT, defaults, 100);
        PulseScoreReport report = new PulseScoreReport(result, "venue-1", GENERATED_AT);

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(json.get("venueId").asText()).isEqualTo("venue-1");
        assertThat(json.get("generatedAt").asText()).startsWith("2024-03-05T21:00");
        assertThat(json.get("score").asInt()).isEqualTo(100);
        assertThat(json.get("status").asText()).isEqualTo("OPTIMAL");
        assertThat(json.get("timeSlot").asText()).isEqualTo("weekday_night");
        assertThat(json.get("rangeSource").asText()).isEqualTo("DEFAULT");
        assertThat(json.get("usingHistoricalData").asBoolean()).isFalse();
        assertThat(json.get("appliedWeights").get("sound").asDouble()).isCloseTo(0.40 / 0.65, within(1e-9));
        assertThat(json.get("appliedWeights").get("crowd").asDouble()).isZero();

        JsonNode factors = json.get("factors");
        assertThat(factors.size()).isEqualTo(4);
        assertThat(factors.get(0).get("factor").asText()).isEqualTo("sound");
        assertThat(factors.get(0).get("value").asText()).isEqualTo("76.0 dB");
        assertThat(factors.get(0).get("targetMin").asDouble()).isEqualTo(70.0);
        assertThat(factors.get(2).get("present").asBoolean()).isFalse();
    }

    @Test
    void shouldKeepJsonKeysIndependentOfDefaultLocale() throws Exception {
        // Given
        PulseScoreResult result = calculator.calculate(
                SensorReading.builder().decibels(76.0).lux(200.0).build(), SLOT, defaults, 100);
        Locale original = Locale.getDefault();

        // When
        JsonNode json;
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            json = new ObjectMapper().readTree(new PulseScoreReport(result, "venue-1", GENERATED_AT).toJson());
        } finally {
            Locale.setDefault(original);
        }

        // Then
        assertThat(json.get("appliedWeights").has("light")).isTrue();
        assertThat(json.get("factors").get(1).get("factor").asText()).isEqualTo("light");
    }

    @Test
    void shouldRenderFactorTableAsMarkdown() {
        // Given
        PulseScoreResult result = calculator.calculate(
                SensorReading.builder().decibels(76.0).lux(200.0).build(), SLOT, defaults, 100);

        // When
        String markdown = new PulseScoreReport(result, "venue-1", GENERATED_AT).toMarkdown();

        // Then
        assertThat(markdown)
                .startsWith("# Pulse Score Report")
                .contains("**Venue:** venue-1")
                .contains("**Generated:** 2024-03-05T21:00:00")
                .contains("**Time Slot:** weeknights")
                .contains("**100/100** - Optimal")
                .contains("Targets: Time-slot defaults")
                .contains("| Sound | 100 | 76.0 dB | 70.0-82.0 dB | 62% |")
                .contains("| Crowd | - | - |")
                .doesNotContain("## Best Night");
    }

    @Test
    void shouldMarkReadingWithoutSignalsAsNoData() {
        // Given
        PulseScoreResult result = calculator.calculate(SensorReading.builder().build(), SLOT, defaults, 100);

        // When
        String markdown = new PulseScoreReport(result, null, GENERATED_AT).toMarkdown();

        // Then
        assertThat(markdown).contains("**No Data**").doesNotContain("**Venue:**");
    }

    @Test
    void shouldDescribeBestNightTargets() throws Exception {
        // Given
        BestNightProfile bestNight = BestNightProfile.builder()
                .date(LocalDate.of(2024, 3, 8))
                .dayOfWeek(DayOfWeek.FRIDAY)
                .timeSlot(TimeSlot.FRIDAY_PEAK)
                .totalGuests(120)
                .peakOccupancy(80)
                .avgSound(80)
                .avgLight(60)
                .detectedGenres(List.of("hip-hop"))
                .confidence(40)
                .build();
        ActiveRanges ranges = new ActiveRanges(OptimalRange.around(80, 5), OptimalRange.around(60, 50),
                FactorWeights.BASELINE, RangeSource.BEST_NIGHT, bestNight);
        PulseScoreResult result = calculator.calculate(
                SensorReading.builder().decibels(80.0).lux(60.0).build(), TimeSlot.FRIDAY_PEAK, ranges, 100);
        PulseScoreReport report = new PulseScoreReport(result, "venue-1", GENERATED_AT);

        // When
        String markdown = report.toMarkdown();
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(markdown)
                .contains("**100/100** - Peak Performance")
                .contains("Targets: Your best night")
                .contains("## Best Night")
                .contains("- **Date:** 2024-03-08 (FRIDAY)")
                .contains("- **Genres:** hip-hop")
                .contains("- **Proximity:** 100%");
        assertThat(json.get("usingHistoricalData").asBoolean()).isTrue();
        assertThat(json.get("proximityToBest").asInt()).isEqualTo(100);
        assertThat(json.get("bestNightDate").asText()).isEqualTo("2024-03-08");
        assertThat(json.get("bestNightGenres").get(0).asText()).isEqualTo("hip-hop");
    }
}
