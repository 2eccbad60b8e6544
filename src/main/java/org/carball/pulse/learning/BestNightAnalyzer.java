package org.carball.pulse.learning;

import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.config.LearningConfig;
import org.carball.pulse.dwell.DwellTimeEstimator;
import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.reading.SensorReading;
import org.carball.pulse.scoring.GenreClassifier;
import org.carball.pulse.slot.TimeSlot;
import org.carball.pulse.slot.TimeSlotResolver;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Picks, per time slot, the single night with the most guests and longest stays, and records the conditions
 * during it.
 */
@Slf4j
public class BestNightAnalyzer {

    private static final int NIGHT_DWELL_WINDOW_HOURS = 24;

    private final LearningConfig config;
    private final DwellTimeEstimator dwellTimeEstimator;
    private final GenreClassifier genreClassifier;

    public BestNightAnalyzer(LearningConfig config, DwellTimeEstimator dwellTimeEstimator,
                             GenreClassifier genreClassifier) {
        this.config = config;
        this.dwellTimeEstimator = dwellTimeEstimator;
        this.genreClassifier = genreClassifier;
    }

    public Map<TimeSlot, BestNightProfile> analyze(List<SensorReading> readings) {
        Map<TimeSlot, List<SensorReading>> bySlot = readings.stream()
                .filter(r -> r.getTimestamp() != null)
                .collect(Collectors.groupingBy(
                        r -> TimeSlotResolver.resolve(r.getTimestamp()),
                        () -> new EnumMap<>(TimeSlot.class),
                        Collectors.toList()));

        Map<TimeSlot, BestNightProfile> bestNights = new EnumMap<>(TimeSlot.class);
        for (Map.Entry<TimeSlot, List<SensorReading>> entry : bySlot.entrySet()) {
            if (entry.getValue().size() < config.getMinReadingsPerSlot()) {
                continue;
            }
            findBestNight(entry.getKey(), entry.getValue()).ifPresent(p -> bestNights.put(entry.getKey(), p));
        }

        log.info("Found best nights for {} time slots", bestNights.size());
        return bestNights;
    }

    private Optional<BestNightProfile> findBestNight(TimeSlot slot, List<SensorReading> slotReadings) {
        Map<LocalDate, List<SensorReading>> byNight = slotReadings.stream()
                .collect(Collectors.groupingBy(r -> r.getTimestamp().toLocalDate(), TreeMap::new,
                        Collectors.toList()));

        NightMetrics best = null;
        for (Map.Entry<LocalDate, List<SensorReading>> night : byNight.entrySet()) {
            if (night.getValue().size() < config.getMinReadingsPerNight()) {
                continue;
            }
            NightMetrics metrics = measure(night.getKey(), night.getValue());
            // Nights are visited oldest first, so ties go to the most recent night
            if (best == null || metrics.rank() >= best.rank()) {
                best = metrics;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        if (best.totalGuests() < config.getMinGuestsForBestNight()
                && best.peakOccupancy() < config.getMinGuestsForBestNight()) {
            log.debug("Best {} night {} is too quiet to learn from", slot.getKey(), best.date());
            return Optional.empty();
        }

        return Optional.of(toProfile(slot, best));
    }

    private NightMetrics measure(LocalDate date, List<SensorReading> nightReadings) {
        List<SensorReading> sorted = nightReadings.stream()
                .sorted(Comparator.comparing(SensorReading::getTimestamp))
                .toList();
        List<SensorReading> counted = sorted.stream().filter(SensorReading::hasOccupancy).toList();

        int totalGuests = counted.size() < 2 ? 0 : Math.max(0,
                counted.get(counted.size() - 1).getOccupancy().entries() - counted.get(0).getOccupancy().entries());
        int peak = counted.stream().mapToInt(r -> r.getOccupancy().current()).max().orElse(0);
        double dwell = dwellTimeEstimator.estimateFromReadings(sorted, NIGHT_DWELL_WINDOW_HOURS).orElse(0);

        double guestScore = Math.min(100, (double) totalGuests / config.getBestNightGuestTarget() * 100);
        double dwellScore = Math.min(100, dwell / config.getBestNightDwellTargetMinutes() * 100);
        double guestShare = config.getBestNightGuestShare();
        double rank = guestScore * guestShare + dwellScore * (1 - guestShare);

        return new NightMetrics(date, sorted, totalGuests, peak, dwell, rank);
    }

    private BestNightProfile toProfile(TimeSlot slot, NightMetrics night) {
        List<SensorReading> readings = night.readings();

        Set<String> artists = new LinkedHashSet<>();
        Set<String> songs = new LinkedHashSet<>();
        for (SensorReading r : readings) {
            if (r.getArtist() != null && !r.getArtist().isBlank()) {
                artists.add(r.getArtist());
            }
            if (r.getSong() != null && !r.getSong().isBlank()) {
                songs.add(r.getSong());
            }
        }
        List<String> genres = genreClassifier.detect(String.join(" ", songs), String.join(" ", artists));

        OptionalDouble temp = average(readings, r -> r.getIndoorTemp() != null, SensorReading::getIndoorTemp);
        PeakHour peakHour = peakHour(readings);

        return BestNightProfile.builder()
                .date(night.date())
                .dayOfWeek(night.date().getDayOfWeek())
                .timeSlot(slot)
                .totalGuests(night.totalGuests())
                .peakOccupancy(night.peakOccupancy())
                .avgDwellMinutes(Math.round(night.avgDwellMinutes()))
                .avgSound(Math.round(average(readings, SensorReading::hasSound, SensorReading::getDecibels).orElse(0)))
                .avgLight(Math.round(average(readings, SensorReading::hasLight, SensorReading::getLux).orElse(0)))
                .avgTemp(temp.isPresent() ? temp.getAsDouble() : null)
                .topArtists(artists.stream().limit(config.getMaxTopArtists()).collect(Collectors.toList()))
                .detectedGenres(new ArrayList<>(genres))
                .songCount(songs.size())
                .peakHour(peakHour == null ? null : peakHour.hour())
                .peakHourSound(peakHour == null ? null : peakHour.sound())
                .peakHourLight(peakHour == null ? null : peakHour.light())
                .dataPointsFromNight(readings.size())
                .confidence(Math.min(100, readings.size() * 10))
                .build();
    }

    /**
     * Hour of the night with the highest average occupancy, or {@code null} when nobody was counted.
     */
    private static PeakHour peakHour(List<SensorReading> readings) {
        Map<Integer, List<SensorReading>> byHour = readings.stream()
                .collect(Collectors.groupingBy(r -> r.getTimestamp().getHour(), TreeMap::new, Collectors.toList()));

        PeakHour peak = null;
        double peakOccupancy = 0;
        for (Map.Entry<Integer, List<SensorReading>> hour : byHour.entrySet()) {
            double occupancy = hour.getValue().stream()
                    .mapToInt(r -> r.hasOccupancy() ? r.getOccupancy().current() : 0)
                    .average()
                    .orElse(0);
            if (occupancy > peakOccupancy) {
                peakOccupancy = occupancy;
                OptionalDouble sound = average(hour.getValue(), SensorReading::hasSound, SensorReading::getDecibels);
                OptionalDouble light = average(hour.getValue(), SensorReading::hasLight, SensorReading::getLux);
                peak = new PeakHour(hour.getKey(),
                        sound.isPresent() ? (double) Math.round(sound.getAsDouble()) : null,
                        light.isPresent() ? (double) Math.round(light.getAsDouble()) : null);
            }
        }
        return peak;
    }

    private static OptionalDouble average(List<SensorReading> readings, Predicate<SensorReading> present,
                                          ToDoubleFunction<SensorReading> value) {
        return readings.stream().filter(present).mapToDouble(value).average();
    }

    private record NightMetrics(LocalDate date, List<SensorReading> readings, int totalGuests,
                                int peakOccupancy, double avgDwellMinutes, double rank) {}

    private record PeakHour(int hour, Double sound, Double light) {}
}
