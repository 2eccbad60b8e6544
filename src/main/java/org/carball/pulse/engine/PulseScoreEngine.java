package org.carball.pulse.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.config.ConfigurationLoader;
import org.carball.pulse.config.LearningConfig;
import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.dwell.DwellTimeEstimator;
import org.carball.pulse.learning.VenueLearningService;
import org.carball.pulse.model.learning.VenueLearningRecord;
import org.carball.pulse.model.learning.VenueOptimalRanges;
import org.carball.pulse.model.reading.SensorReading;
import org.carball.pulse.model.score.ActiveRanges;
import org.carball.pulse.model.score.PulseScoreResult;
import org.carball.pulse.model.venue.VenueSettings;
import org.carball.pulse.scoring.CrowdScorer;
import org.carball.pulse.scoring.GenreClassifier;
import org.carball.pulse.scoring.KeywordGenreClassifier;
import org.carball.pulse.scoring.PulseScoreCalculator;
import org.carball.pulse.scoring.selection.RangeSelectionChain;
import org.carball.pulse.scoring.selection.ScoringContext;
import org.carball.pulse.slot.TimeSlot;
import org.carball.pulse.slot.TimeSlotResolver;
import org.carball.pulse.store.HistoricalReadingSource;
import org.carball.pulse.store.LearnedRangesStore;
import org.carball.pulse.store.VenueSettingsStore;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Entry point for callers: live scoring, dwell-time estimation and the batch learning run.
 *
 * <p>Scoring never fails because venue data is missing or unreadable; it falls back to time-slot
 * defaults instead.</p>
 */
@Slf4j
public class PulseScoreEngine {

    private final ScoringThresholds thresholds;
    private final LearnedRangesStore rangesStore;
    private final VenueSettingsStore settingsStore;
    private final Clock clock;

    private final PulseScoreCalculator calculator;
    private final RangeSelectionChain selectionChain;
    private final CrowdScorer crowdScorer;
    private final DwellTimeEstimator dwellTimeEstimator;
    private final VenueLearningService learningService;

    public PulseScoreEngine(ScoringThresholds thresholds, LearningConfig learningConfig,
                            GenreClassifier genreClassifier, HistoricalReadingSource readingSource,
                            LearnedRangesStore rangesStore, VenueSettingsStore settingsStore, Clock clock) {
        this.thresholds = thresholds;
        this.rangesStore = rangesStore;
        this.settingsStore = settingsStore;
        this.clock = clock;

        this.calculator = new PulseScoreCalculator(thresholds, genreClassifier);
        this.selectionChain = RangeSelectionChain.standard(thresholds);
        this.crowdScorer = new CrowdScorer(thresholds);
        this.dwellTimeEstimator = new DwellTimeEstimator(learningConfig);
        this.learningService = new VenueLearningService(readingSource, rangesStore, learningConfig, genreClassifier);

        log.info("Pulse score engine ready ({})", thresholds.getConfigurationSummary());
    }

    /**
     * Engine configured from defaults, {@code PULSE_*} environment variables and {@code --scoring.*}
     * arguments, with the bundled learning parameters and genre vocabulary.
     */
    public static PulseScoreEngine fromConfiguration(String[] args, HistoricalReadingSource readingSource,
                                                     LearnedRangesStore rangesStore,
                                                     VenueSettingsStore settingsStore) {
        ConfigurationLoader loader = new ConfigurationLoader();
        return new PulseScoreEngine(
                loader.loadThresholds(args),
                loader.loadLearningConfig(),
                KeywordGenreClassifier.withDefaultVocabulary(),
                readingSource, rangesStore, settingsStore,
                Clock.systemDefaultZone());
    }

    /**
     * Scores a reading against time-slot defaults, at the reading's own timestamp.
     */
    public PulseScoreResult computeScore(SensorReading reading) {
        return computeScore(reading, null, null);
    }

    /**
     * @param reading   the snapshot to score; {@code null} scores as a reading without signals
     * @param venueId   venue whose learning and calibration apply, or {@code null} for defaults only
     * @param timestamp when the reading was taken; falls back to the reading's timestamp, then the clock
     */
    public PulseScoreResult computeScore(SensorReading reading, String venueId, LocalDateTime timestamp) {
        if (reading == null) {
            log.debug("No reading for venue {}, scoring it as a reading without signals", venueId);
            reading = new SensorReading();
        }
        LocalDateTime at = timestamp != null ? timestamp
                : reading.getTimestamp() != null ? reading.getTimestamp()
                : LocalDateTime.now(clock);
        TimeSlot slot = TimeSlotResolver.resolve(at);

        VenueLearningRecord learning = null;
        VenueSettings settings = null;
        if (venueId != null) {
            learning = loadLearning(venueId).orElse(null);
            settings = loadSettings(venueId).orElse(null);
        }

        ScoringContext context = new ScoringContext(venueId, slot, learning,
                settings == null ? null : settings.getCalibration());
        ActiveRanges ranges = selectionChain.select(context);

        int capacity = crowdScorer.estimateCapacity(configuredCapacity(settings, reading), historicalPeak(learning));
        return calculator.calculate(reading, slot, ranges, capacity);
    }

    /**
     * Average guest stay in minutes over the {@code hoursBack} hours up to the latest reading, or empty
     * when it cannot be estimated.
     */
    public OptionalDouble estimateDwellTime(List<SensorReading> readings, double hoursBack) {
        return dwellTimeEstimator.estimateFromReadings(readings, hoursBack);
    }

    public Optional<VenueOptimalRanges> runLearningCycle(String venueId) {
        return learningService.runLearningCycle(venueId, LocalDateTime.now(clock));
    }

    public double learningConfidence(String venueId) {
        return learningService.learningConfidence(venueId, LocalDateTime.now(clock));
    }

    public ScoringThresholds getThresholds() {
        return thresholds;
    }

    private Optional<VenueLearningRecord> loadLearning(String venueId) {
        try {
            return rangesStore.find(venueId);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not load learned ranges for venue {}, scoring without them: {}", venueId, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<VenueSettings> loadSettings(String venueId) {
        try {
            return settingsStore.find(venueId);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not load settings for venue {}, scoring without them: {}", venueId, e.getMessage());
            return Optional.empty();
        }
    }

    private static Integer configuredCapacity(VenueSettings settings, SensorReading reading) {
        if (settings != null && settings.getCapacity() != null) {
            return settings.getCapacity();
        }
        return reading.hasOccupancy() ? reading.getOccupancy().capacity() : null;
    }

    private static Integer historicalPeak(VenueLearningRecord learning) {
        if (learning == null || learning.optimalRanges() == null
                || learning.optimalRanges().getBenchmarks() == null) {
            return null;
        }
        return learning.optimalRanges().getBenchmarks().historicalPeakOccupancy();
    }
}
