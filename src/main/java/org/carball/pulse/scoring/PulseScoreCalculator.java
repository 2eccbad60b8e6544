package org.carball.pulse.scoring;

import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.config.ScoringThresholds;
import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.range.Factor;
import org.carball.pulse.model.range.FactorWeights;
import org.carball.pulse.model.range.OptimalRange;
import org.carball.pulse.model.reading.SensorReading;
import org.carball.pulse.model.score.ActiveRanges;
import org.carball.pulse.model.score.FactorScore;
import org.carball.pulse.model.score.GenreMatch;
import org.carball.pulse.model.score.PulseScoreResult;
import org.carball.pulse.model.score.RangeSource;
import org.carball.pulse.model.score.ScoreStatus;
import org.carball.pulse.slot.TimeSlot;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Composes the factor scorers into a single Pulse Score for one reading. Pure: everything it needs
 * arrives as arguments, nothing is looked up.
 */
@Slf4j
public class PulseScoreCalculator {

    private static final double PROXIMITY_SOUND_TOLERANCE = 10.0;
    private static final double PROXIMITY_LIGHT_TOLERANCE = 100.0;
    private static final double PROXIMITY_SOUND_SHARE = 0.55;
    private static final double PROXIMITY_LIGHT_SHARE = 0.45;
    private static final int PROXIMITY_UNKNOWN = 50;

    private final ScoringThresholds thresholds;
    private final RangeScorer rangeScorer;
    private final CrowdScorer crowdScorer;
    private final GenreMatcher genreMatcher;
    private final WeightRedistributor redistributor;

    public PulseScoreCalculator(ScoringThresholds thresholds, GenreClassifier classifier) {
        this.thresholds = thresholds;
        this.rangeScorer = new RangeScorer(thresholds);
        this.crowdScorer = new CrowdScorer(thresholds);
        this.genreMatcher = new GenreMatcher(classifier, thresholds);
        this.redistributor = new WeightRedistributor();
    }

    public PulseScoreResult calculate(SensorReading reading, TimeSlot slot, ActiveRanges ranges,
                                      int estimatedCapacity) {
        BestNightProfile bestNight = ranges.source() == RangeSource.BEST_NIGHT ? ranges.bestNight() : null;
        List<String> bestNightGenres = ranges.bestNightGenres();

        Set<Factor> present = EnumSet.noneOf(Factor.class);
        Map<Factor, Integer> scores = new EnumMap<>(Factor.class);

        Double decibels = reading.hasSound() ? reading.getDecibels() : null;
        if (decibels != null) {
            present.add(Factor.SOUND);
        }
        scores.put(Factor.SOUND, rangeScorer.score(decibels, ranges.sound()));

        Double lux = reading.hasLight() ? reading.getLux() : null;
        if (lux != null) {
            present.add(Factor.LIGHT);
        }
        scores.put(Factor.LIGHT, rangeScorer.score(lux, ranges.light()));

        Integer occupancy = reading.hasOccupancy() ? reading.getOccupancy().current() : null;
        double occupancyPercent = 0;
        if (occupancy != null) {
            present.add(Factor.CROWD);
            scores.put(Factor.CROWD, crowdScorer.score(occupancy, estimatedCapacity, slot));
            occupancyPercent = CrowdScorer.occupancyPercent(occupancy, estimatedCapacity);
        } else {
            scores.put(Factor.CROWD, 0);
        }

        GenreMatch music = genreMatcher.match(reading.getSong(), reading.getArtist(), slot, bestNightGenres);
        if (music.musicPresent()) {
            present.add(Factor.MUSIC);
        }
        scores.put(Factor.MUSIC, music.score());

        Optional<FactorWeights> applied = redistributor.redistribute(ranges.weights(), present);

        Map<Factor, FactorScore> breakdown = new EnumMap<>(Factor.class);
        double weightedSum = 0.0;
        for (Factor factor : Factor.values()) {
            double weight = applied.map(w -> w.weightOf(factor)).orElse(0.0);
            weightedSum += scores.get(factor) * weight;
        }

        breakdown.put(Factor.SOUND, new FactorScore(Factor.SOUND, scores.get(Factor.SOUND),
                decibels != null,
                decibels == null ? null : String.format("%.1f dB", decibels),
                ranges.sound(),
                decibels != null && ranges.sound().contains(decibels),
                weightOf(applied, Factor.SOUND),
                FactorMessages.sound(decibels, scores.get(Factor.SOUND), ranges.sound(), bestNight)));

        breakdown.put(Factor.LIGHT, new FactorScore(Factor.LIGHT, scores.get(Factor.LIGHT),
                lux != null,
                lux == null ? null : String.format("%.0f lux", lux),
                ranges.light(),
                lux != null && ranges.light().contains(lux),
                weightOf(applied, Factor.LIGHT),
                FactorMessages.light(lux, scores.get(Factor.LIGHT), ranges.light(), bestNight)));

        breakdown.put(Factor.CROWD, new FactorScore(Factor.CROWD, scores.get(Factor.CROWD),
                occupancy != null,
                occupancy == null ? null : occupancy + " guests (" + Math.round(occupancyPercent) + "%)",
                slot.getOptimalCrowd(),
                occupancy != null && slot.getOptimalCrowd().contains(occupancyPercent),
                weightOf(applied, Factor.CROWD),
                FactorMessages.crowd(occupancy, occupancyPercent, scores.get(Factor.CROWD),
                        slot.getOptimalCrowd())));

        breakdown.put(Factor.MUSIC, new FactorScore(Factor.MUSIC, music.score(),
                music.musicPresent(),
                music.musicPresent() ? describeTrack(reading) : null,
                null,
                music.musicPresent() && music.score() >= thresholds.getNeutralMusicScore(),
                weightOf(applied, Factor.MUSIC),
                music.message()));

        PulseScoreResult.PulseScoreResultBuilder result = PulseScoreResult.builder()
                .timeSlot(slot)
                .factors(breakdown)
                .rangeSource(ranges.source())
                .bestNight(bestNight)
                .detectedGenres(music.detectedGenres())
                .bestNightGenres(bestNightGenres);

        if (applied.isEmpty()) {
            log.debug("No signals in reading for slot {}, reporting no data", slot.getKey());
            return result
                    .score(0)
                    .status(ScoreStatus.NO_DATA)
                    .statusLabel(ScoreStatus.NO_DATA.label(ranges.source()))
                    .build();
        }

        int score = (int) Math.round(weightedSum);
        ScoreStatus status = ScoreStatus.fromScore(score, thresholds.getOptimalThreshold(),
                thresholds.getGoodThreshold());
        Integer proximity = bestNight == null ? null : proximityToBest(decibels, lux, bestNight);

        log.debug("Pulse score {} ({}) for slot {} using {} ranges, present factors {}",
                score, status, slot.getKey(), ranges.source(), present);

        return result
                .score(score)
                .status(status)
                .statusLabel(status.label(ranges.source()))
                .appliedWeights(applied.get())
                .proximityToBest(proximity)
                .build();
    }

    /**
     * Closeness of current sound and light to the best night's averages, 0..100. A side with no reading
     * or no best-night value counts as halfway.
     */
    static int proximityToBest(Double decibels, Double lux, BestNightProfile bestNight) {
        int soundProximity = PROXIMITY_UNKNOWN;
        int lightProximity = PROXIMITY_UNKNOWN;

        if (decibels != null && bestNight.getAvgSound() > 0) {
            soundProximity = proximity(Math.abs(decibels - bestNight.getAvgSound()), PROXIMITY_SOUND_TOLERANCE);
        }
        if (lux != null && bestNight.getAvgLight() > 0) {
            lightProximity = proximity(Math.abs(lux - bestNight.getAvgLight()), PROXIMITY_LIGHT_TOLERANCE);
        }

        return (int) Math.round(soundProximity * PROXIMITY_SOUND_SHARE + lightProximity * PROXIMITY_LIGHT_SHARE);
    }

    private static int proximity(double diff, double tolerance) {
        if (diff >= tolerance) {
            return 0;
        }
        return (int) Math.round(100 * (1 - diff / tolerance));
    }

    private static double weightOf(Optional<FactorWeights> weights, Factor factor) {
        return weights.map(w -> w.weightOf(factor)).orElse(0.0);
    }

    private static String describeTrack(SensorReading reading) {
        String song = reading.getSong();
        String artist = reading.getArtist();
        if (song == null || song.isBlank()) {
            return artist;
        }
        if (artist == null || artist.isBlank()) {
            return song;
        }
        return song + " - " + artist;
    }
}
