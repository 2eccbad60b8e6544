package org.carball.pulse.scoring;

import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.range.Factor;
import org.carball.pulse.model.range.FactorWeights;
import org.carball.pulse.model.range.OptimalRange;
import org.carball.pulse.model.reading.OccupancyCounts;
import org.carball.pulse.model.reading.SensorReading;
import org.carball.pulse.model.score.ActiveRanges;
import org.carball.pulse.model.score.PulseScoreResult;
import org.carball.pulse.model.score.RangeSource;
import org.carball.pulse.model.score.ScoreStatus;
import org.carball.pulse.slot.TimeSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PulseScoreCalculatorTest {

    // Tuesday evening
    private static final LocalDateTime TUESDAY_NIGHT = LocalDateTime.of(2024, 3, 5, 20, 0);
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
    void shouldScorePerfectSoundAndLightAsHundredWithoutCrowdOrMusic() {
        // Given
        SensorReading reading = SensorReading.builder()
                .timestamp(TUESDAY_NIGHT)
                .decibels(76.0)
                .lux(200.0)
                .build();

        // When
        PulseScoreResult result = calculator.calculate(reading, SLOT, defaults, 100);

        // Then
        assertThat(result.getScore()).isEqualTo(100);
        assertThat(result.getStatus()).isEqualTo(ScoreStatus.OPTIMAL);
        assertThat(result.getStatusLabel()).isEqualTo("Optimal");
        assertThat(result.getRangeSource()).isEqualTo(RangeSource.DEFAULT);
        assertThat(result.factor(Factor.SOUND).score()).isEqualTo(100);
        assertThat(result.factor(Factor.LIGHT).score()).isEqualTo(100);
        assertThat(result.getAppliedWeights().crowd()).isZero();
        assertThat(result.getAppliedWeights().music()).isZero();
        assertThat(result.getAppliedWeights().sound() + result.getAppliedWeights().light())
                .isCloseTo(1.0, within(1e-6));
    }

    @Test
    void shouldJudgeCrowdBandOnExactOccupancy() {
        // Given - 34.9% full shows as 35% but sits just under the 35-65% weeknight band
        SensorReading justUnder = SensorReading.builder()
                .timestamp(TUESDAY_NIGHT)
                .occupancy(new OccupancyCounts(349, 400, 51))
                .build();
        SensorReading onEdge = SensorReading.builder()
                .timestamp(TUESDAY_NIGHT)
                .occupancy(new OccupancyCounts(350, 400, 50))
                .build();

        // When
        PulseScoreResult under = calculator.calculate(justUnder, SLOT, defaults, 1000);
        PulseScoreResult edge = calculator.calculate(onEdge, SLOT, defaults, 1000);

        // Then
        assertThat(under.factor(Factor.CROWD).displayValue()).isEqualTo("349 guests (35%)");
        assertThat(under.factor(Factor.CROWD).inRange()).isFalse();
        assertThat(edge.factor(Factor.CROWD).inRange()).isTrue();
        assertThat(edge.factor(Factor.CROWD).score()).isEqualTo(100);
    }

    @Test
    void shouldReportNoDataWhenEverySignalIsAbsent() {
        // Given - zero readings mean the sensor is missing
        SensorReading reading = SensorReading.builder()
                .timestamp(TUESDAY_NIGHT)
                .decibels(0.0)
                .lux(0.0)
                .build();

        // When
        PulseScoreResult result = calculator.calculate(reading, SLOT, defaults, 100);

        // Then
        assertThat(result.getStatus()).isEqualTo(ScoreStatus.NO_DATA);
        assertThat(result.hasData()).isFalse();
        assertThat(result.getScore()).isZero();
        assertThat(result.getStatusLabel()).isEqualTo("No Data");
        assertThat(result.getAppliedWeights()).isNull();
        assertThat(result.getFactors().values()).noneMatch(f -> f.present());
    }

    @Test
    void shouldWeighCrowdWhenOccupancyIsKnown() {
        // Given - 25% full on a weeknight scores 80 for crowd
        SensorReading reading = SensorReading.builder()
                .timestamp(TUESDAY_NIGHT)
                .decibels(76.0)
                .lux(200.0)
                .occupancy(new OccupancyCounts(25, 140, 115))
                .build();

        // When
        PulseScoreResult result = calculator.calculate(reading, SLOT, defaults, 100);

        // Then
        assertThat(result.factor(Factor.CROWD).score()).isEqualTo(80);
        assertThat(result.factor(Factor.CROWD).message()).isEqualTo("Building up (25% full)");
        assertThat(result.getScore()).isEqualTo(95);
    }

    @Test
    void shouldFlagLoudRoomAsPoor() {
        // Given
        SensorReading reading = SensorReading.builder()
                .timestamp(TUESDAY_NIGHT)
                .decibels(100.0)
                .lux(200.0)
                .build();

        // When
        PulseScoreResult result = calculator.calculate(reading, SLOT, defaults, 100);

        // Then
        assertThat(result.factor(Factor.SOUND).score()).isZero();
        assertThat(result.factor(Factor.SOUND).inRange()).isFalse();
        assertThat(result.factor(Factor.SOUND).message()).isEqualTo("Too loud for now");
        assertThat(result.getScore()).isEqualTo(38);
        assertThat(result.getStatus()).isEqualTo(ScoreStatus.POOR);
        assertThat(result.getStatusLabel()).isEqualTo("Adjust");
    }

    @Test
    void shouldScoreOnMusicAloneWhenNothingElseReports() {
        // Given
        SensorReading reading = SensorReading.builder()
                .timestamp(TUESDAY_NIGHT)
                .song("God's Plan")
                .artist("Drake")
                .build();

        // When
        PulseScoreResult result = calculator.calculate(reading, SLOT, defaults, 100);

        // Then
        assertThat(result.getScore()).isEqualTo(90);
        assertThat(result.getAppliedWeights().music()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getDetectedGenres()).containsExactly("hip-hop");
        assertThat(result.factor(Factor.MUSIC).displayValue()).isEqualTo("God's Plan - Drake");
    }

    @Test
    void shouldFrameBestNightScoreAsBusinessOutcome() {
        // Given
        BestNightProfile bestNight = BestNightProfile.builder()
                .avgSound(80)
                .avgLight(100)
                .detectedGenres(List.of("hip-hop"))
                .confidence(60)
                .build();
        ActiveRanges ranges = new ActiveRanges(OptimalRange.around(80, 5), OptimalRange.around(100, 50),
                FactorWeights.BASELINE, RangeSource.BEST_NIGHT, bestNight);
        SensorReading reading = SensorReading.builder()
                .timestamp(TUESDAY_NIGHT)
                .decibels(83.0)
                .lux(100.0)
                .artist("Drake")
                .build();

        // When
        PulseScoreResult result = calculator.calculate(reading, SLOT, ranges, 100);

        // Then
        assertThat(result.getScore()).isEqualTo(100);
        assertThat(result.getStatusLabel()).isEqualTo("Peak Performance");
        assertThat(result.isUsingHistoricalData()).isTrue();
        assertThat(result.getProximityToBest()).isEqualTo(84);
        assertThat(result.getBestNightGenres()).containsExactly("hip-hop");
        assertThat(result.factor(Factor.SOUND).message()).isEqualTo("3dB louder than your best");
        assertThat(result.factor(Factor.LIGHT).message()).isEqualTo("Matching your best (100 lux)");
        assertThat(result.factor(Factor.MUSIC).score()).isEqualTo(100);
    }

    @Test
    void shouldCountMissingSideAsHalfwayForProximity() {
        BestNightProfile bestNight = BestNightProfile.builder().avgSound(80).avgLight(0).build();

        assertThat(PulseScoreCalculator.proximityToBest(80.0, 150.0, bestNight)).isEqualTo(78);
        assertThat(PulseScoreCalculator.proximityToBest(null, null, bestNight)).isEqualTo(50);
        assertThat(PulseScoreCalculator.proximityToBest(95.0, null, bestNight)).isEqualTo(23);
    }

    @Test
    void shouldKeepEveryFactorScoreWithinBounds() {
        SensorReading reading = SensorReading.builder()
                .timestamp(TUESDAY_NIGHT)
                .decibels(30.0)
                .lux(5000.0)
                .occupancy(new OccupancyCounts(900, 1000, 100))
                .song("Unknown")
                .build();

        PulseScoreResult result = calculator.calculate(reading, SLOT, defaults, 100);

        assertThat(result.getFactors().values()).allSatisfy(f -> assertThat(f.score()).isBetween(0, 100));
        assertThat(result.getScore()).isBetween(0, 100);
    }
}
