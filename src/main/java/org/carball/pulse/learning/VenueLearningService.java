package org.carball.pulse.learning;

import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.config.LearningConfig;
import org.carball.pulse.dwell.DwellTimeEstimator;
import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.learning.VenueLearningRecord;
import org.carball.pulse.model.learning.VenueOptimalRanges;
import org.carball.pulse.model.reading.HourlyPerformance;
import org.carball.pulse.model.reading.SensorReading;
import org.carball.pulse.scoring.GenreClassifier;
import org.carball.pulse.slot.TimeSlot;
import org.carball.pulse.store.HistoricalReadingSource;
import org.carball.pulse.store.HistoryWindow;
import org.carball.pulse.store.LearnedRangesStore;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Batch side of the engine: turns a venue's history into learned ranges and best-night profiles and
 * replaces the stored record. Meant to be triggered on a schedule, not from the scoring path.
 */
@Slf4j
public class VenueLearningService {

    private final HistoricalReadingSource readingSource;
    private final LearnedRangesStore rangesStore;
    private final LearningConfig config;
    private final LearningConfidenceCalculator confidenceCalculator;
    private final HourlyPerformanceAggregator aggregator;
    private final OptimalRangeLearner learner;
    private final BestNightAnalyzer bestNightAnalyzer;

    public VenueLearningService(HistoricalReadingSource readingSource, LearnedRangesStore rangesStore,
                                LearningConfig config, GenreClassifier genreClassifier) {
        this.readingSource = readingSource;
        this.rangesStore = rangesStore;
        this.config = config;

        DwellTimeEstimator dwellTimeEstimator = new DwellTimeEstimator(config);
        this.confidenceCalculator = new LearningConfidenceCalculator(config);
        this.aggregator = new HourlyPerformanceAggregator(dwellTimeEstimator);
        this.learner = new OptimalRangeLearner(config);
        this.bestNightAnalyzer = new BestNightAnalyzer(config, dwellTimeEstimator, genreClassifier);
    }

    /**
     * Recomputes everything for the venue from the history window ending at {@code asOf}. When there is
     * nothing to learn from, or the history cannot be read or the result cannot be stored, the previously
     * stored record is left in place.
     *
     * @return the newly learned ranges, or empty when none were produced
     */
    public Optional<VenueOptimalRanges> runLearningCycle(String venueId, LocalDateTime asOf) {
        log.info("Starting learning cycle for venue {}", venueId);

        List<SensorReading> readings;
        try {
            readings = readingSource.fetch(venueId, HistoryWindow.lastDays(asOf, config.getHistoryWindowDays()));
        } catch (IOException | RuntimeException e) {
            log.warn("Could not fetch history for venue {}, keeping previous learning: {}", venueId, e.getMessage());
            return Optional.empty();
        }

        if (readings.isEmpty()) {
            log.info("No history for venue {} in the last {} days", venueId, config.getHistoryWindowDays());
            return Optional.empty();
        }

        double confidence = confidenceCalculator.calculate(readings);
        List<HourlyPerformance> hours = aggregator.aggregate(venueId, readings);
        Optional<VenueOptimalRanges> ranges = learner.learn(venueId, hours, confidence, asOf);
        Map<TimeSlot, BestNightProfile> bestNights = bestNightAnalyzer.analyze(readings);

        if (ranges.isEmpty() && bestNights.isEmpty()) {
            log.info("Venue {}: {} readings but nothing usable to learn from", venueId, readings.size());
            return Optional.empty();
        }

        try {
            rangesStore.replace(new VenueLearningRecord(venueId, ranges.orElse(null), bestNights));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to store learning record for venue {}", venueId, e);
            return Optional.empty();
        }

        log.info("Learning cycle for venue {} complete: {} readings, {} hours, {} best nights, confidence {}%",
                venueId, readings.size(), hours.size(), bestNights.size(), Math.round(confidence * 100));
        return ranges;
    }

    /**
     * Current learning confidence from the venue's history, 0..1. Falls back to a fixed baseline when the
     * history cannot be read.
     */
    public double learningConfidence(String venueId, LocalDateTime asOf) {
        try {
            List<SensorReading> readings =
                    readingSource.fetch(venueId, HistoryWindow.lastDays(asOf, config.getHistoryWindowDays()));
            double confidence = confidenceCalculator.calculate(readings);
            log.debug("Venue {}: {} data points give {}% learning confidence",
                    venueId, readings.size(), Math.round(confidence * 100));
            return confidence;
        } catch (IOException | RuntimeException e) {
            log.warn("Could not fetch history for venue {}, using baseline confidence {}: {}",
                    venueId, config.getFallbackConfidence(), e.getMessage());
            return config.getFallbackConfidence();
        }
    }
}
