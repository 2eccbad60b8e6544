package org.carball.pulse.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.model.learning.BestNightProfile;
import org.carball.pulse.model.range.Factor;
import org.carball.pulse.model.score.FactorScore;
import org.carball.pulse.model.score.PulseScoreResult;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Explains one score: where its targets came from, how each factor fared and what each weighed.
 */
@Slf4j
public class PulseScoreReport {

    private final PulseScoreResult result;
    private final String venueId;
    private final LocalDateTime generatedAt;
    private final ObjectMapper objectMapper;

    public PulseScoreReport(PulseScoreResult result, String venueId, LocalDateTime generatedAt) {
        this.result = result;
        this.venueId = venueId;
        this.generatedAt = generatedAt;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Pulse Score Report\n\n");
        if (venueId != null) {
            md.append("**Venue:** ").append(venueId).append("  \n");
        }
        md.append("**Generated:** ").append(generatedAt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Time Slot:** ").append(result.getTimeSlot().getLabel()).append("  \n\n");

        md.append("## Score\n\n");
        if (!result.hasData()) {
            md.append("**No Data** - no sensor, occupancy or music signal was available.\n\n");
        } else {
            md.append("**").append(result.getScore()).append("/100** - ").append(result.getStatusLabel()).append("\n\n");
        }
        md.append("Targets: ").append(result.getRangeSource().getDescription()).append("\n\n");

        md.append("## Factors\n\n");
        md.append("| Factor | Score | Value | Target | Weight | Note |\n");
        md.append("|--------|-------|-------|--------|--------|------|\n");
        for (Factor factor : Factor.values()) {
            FactorScore fs = result.factor(factor);
            if (fs == null) {
                continue;
            }
            md.append("| ").append(factor.getDisplayName())
                    .append(" | ").append(fs.present() ? String.valueOf(fs.score()) : "-")
                    .append(" | ").append(fs.displayValue() == null ? "-" : fs.displayValue())
                    .append(" | ").append(fs.target() == null ? "-" : fs.target() + " " + factor.getUnit())
                    .append(" | ").append(String.format("%.0f%%", fs.weight() * 100))
                    .append(" | ").append(fs.message())
                    .append(" |\n");
        }
        md.append("\n");

        BestNightProfile bestNight = result.getBestNight();
        if (bestNight != null) {
            md.append("## Best Night\n\n");
            md.append("- **Date:** ").append(bestNight.getDate()).append(" (").append(bestNight.getDayOfWeek()).append(")\n");
            md.append("- **Guests:** ").append(bestNight.getTotalGuests())
                    .append(", peak ").append(bestNight.getPeakOccupancy()).append("\n");
            md.append("- **Sound / Light:** ").append(String.format("%.0f dB / %.0f lux",
                    bestNight.getAvgSound(), bestNight.getAvgLight())).append("\n");
            if (!bestNight.getDetectedGenres().isEmpty()) {
                md.append("- **Genres:** ").append(String.join(", ", bestNight.getDetectedGenres())).append("\n");
            }
            if (result.getProximityToBest() != null) {
                md.append("- **Proximity:** ").append(result.getProximityToBest()).append("%\n");
            }
            md.append("\n");
        }

        return md.toString();
    }

    private Map<String, Object> buildReportData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("venueId", venueId);
        data.put("generatedAt", generatedAt);
        data.put("score", result.getScore());
        data.put("status", result.getStatus());
        data.put("statusLabel", result.getStatusLabel());
        data.put("timeSlot", result.getTimeSlot().getKey());
        data.put("rangeSource", result.getRangeSource());
        data.put("usingHistoricalData", result.isUsingHistoricalData());

        if (result.getAppliedWeights() != null) {
            Map<String, Double> weights = new LinkedHashMap<>();
            result.getAppliedWeights().asMap().forEach((factor, weight) -> weights.put(key(factor), weight));
            data.put("appliedWeights", weights);
        }

        List<Map<String, Object>> factors = new ArrayList<>();
        for (Factor factor : Factor.values()) {
            FactorScore fs = result.factor(factor);
            if (fs == null) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("factor", key(factor));
            entry.put("score", fs.score());
            entry.put("present", fs.present());
            entry.put("value", fs.displayValue());
            if (fs.target() != null) {
                entry.put("targetMin", fs.target().min());
                entry.put("targetMax", fs.target().max());
            }
            entry.put("inRange", fs.inRange());
            entry.put("weight", fs.weight());
            entry.put("message", fs.message());
            factors.add(entry);
        }
        data.put("factors", factors);

        data.put("proximityToBest", result.getProximityToBest());
        data.put("detectedGenres", result.getDetectedGenres());
        data.put("bestNightGenres", result.getBestNightGenres());
        if (result.getBestNight() != null) {
            data.put("bestNightDate", result.getBestNight().getDate());
        }
        return data;
    }

    private static String key(Factor factor) {
        return factor.name().toLowerCase(Locale.ROOT);
    }
}
