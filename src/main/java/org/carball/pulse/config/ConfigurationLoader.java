package org.carball.pulse.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    public static final String DEFAULT_LEARNING_RESOURCE = "pulse-learning.yml";

    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads scoring thresholds using the hierarchy: CLI args > env vars > defaults
     */
    public ScoringThresholds loadThresholds(String[] args) {
        return loadThresholds(args, System.getenv());
    }

    ScoringThresholds loadThresholds(String[] args, Map<String, String> env) {
        log.debug("Loading scoring configuration");

        ScoringThresholds.ScoringThresholdsBuilder builder = ScoringThresholds.builder();

        applyEnvironmentVariables(builder, env);
        applyCLIArguments(builder, args);

        ScoringThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Scoring configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Loads learning parameters from the bundled {@value #DEFAULT_LEARNING_RESOURCE}, or defaults when absent.
     */
    public LearningConfig loadLearningConfig() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULT_LEARNING_RESOURCE)) {
            if (in == null) {
                log.warn("No {} on classpath, using built-in learning defaults", DEFAULT_LEARNING_RESOURCE);
                return LearningConfig.defaults();
            }
            LearningConfig config = yamlMapper.readValue(in, LearningConfig.class);
            log.info("Learning configuration loaded from classpath: {}", config.getDescription());
            return config;
        } catch (IOException e) {
            log.warn("Could not read {} ({}), using built-in learning defaults",
                    DEFAULT_LEARNING_RESOURCE, e.getMessage());
            return LearningConfig.defaults();
        }
    }

    /**
     * Loads learning parameters from a YAML file. Keys missing from the file keep their defaults.
     */
    public LearningConfig loadLearningConfig(Path yamlFile) throws IOException {
        if (!Files.exists(yamlFile)) {
            throw new IOException("Learning configuration file not found: " + yamlFile);
        }
        LearningConfig config = yamlMapper.readValue(yamlFile.toFile(), LearningConfig.class);
        log.info("Learning configuration loaded from {}: {}", yamlFile, config.getDescription());
        return config;
    }

    private void applyEnvironmentVariables(ScoringThresholds.ScoringThresholdsBuilder builder,
                                           Map<String, String> env) {
        for (Map.Entry<String, String> entry : env.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            try {
                switch (key) {
                    case "PULSE_OPTIMAL_THRESHOLD" -> builder.optimalThreshold(Integer.parseInt(value));
                    case "PULSE_GOOD_THRESHOLD" -> builder.goodThreshold(Integer.parseInt(value));
                    case "PULSE_BEST_NIGHT_CONFIDENCE" -> builder.bestNightConfidenceThreshold(Integer.parseInt(value));
                    case "PULSE_LEARNED_CONFIDENCE" -> builder.learnedConfidenceThreshold(Integer.parseInt(value));
                    case "PULSE_SOUND_TOLERANCE" -> builder.bestNightSoundTolerance(Double.parseDouble(value));
                    case "PULSE_LIGHT_TOLERANCE" -> builder.bestNightLightTolerance(Double.parseDouble(value));
                    case "PULSE_RANGE_TOLERANCE" -> builder.rangeToleranceFraction(Double.parseDouble(value));
                    case "PULSE_MIN_CAPACITY" -> builder.minimumEstimatedCapacity(Integer.parseInt(value));
                    case "PULSE_PROFILE" -> builder.profileName(value);
                    default -> {
                    }
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", key, value);
            }
        }
    }

    private void applyCLIArguments(ScoringThresholds.ScoringThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--scoring.optimal":
                        builder.optimalThreshold(Integer.parseInt(value));
                        break;
                    case "--scoring.good":
                        builder.goodThreshold(Integer.parseInt(value));
                        break;
                    case "--scoring.best-night-confidence":
                        builder.bestNightConfidenceThreshold(Integer.parseInt(value));
                        break;
                    case "--scoring.learned-confidence":
                        builder.learnedConfidenceThreshold(Integer.parseInt(value));
                        break;
                    case "--scoring.sound-tolerance":
                        builder.bestNightSoundTolerance(Double.parseDouble(value));
                        break;
                    case "--scoring.light-tolerance":
                        builder.bestNightLightTolerance(Double.parseDouble(value));
                        break;
                    case "--scoring.range-tolerance":
                        builder.rangeToleranceFraction(Double.parseDouble(value));
                        break;
                    case "--scoring.min-capacity":
                        builder.minimumEstimatedCapacity(Integer.parseInt(value));
                        break;
                    case "--scoring.profile":
                        builder.profileName(value);
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for scoring configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Scoring Configuration Options:

            CLI Arguments:
              --scoring.optimal <num>               Minimum score for 'optimal' status
              --scoring.good <num>                  Minimum score for 'good' status
              --scoring.best-night-confidence <num> Best-night profile confidence gate (0-100)
              --scoring.learned-confidence <num>    Learned ranges confidence gate (0-100)
              --scoring.sound-tolerance <num>       Best-night sound band half-width (dB)
              --scoring.light-tolerance <num>       Best-night light band half-width (lux)
              --scoring.range-tolerance <num>       Falloff outside a range, as a fraction of its width
              --scoring.min-capacity <num>          Floor for estimated venue capacity
              --scoring.profile <name>              Label for this configuration

            Environment Variables:
              PULSE_OPTIMAL_THRESHOLD               Same as --scoring.optimal
              PULSE_GOOD_THRESHOLD                  Same as --scoring.good
              PULSE_BEST_NIGHT_CONFIDENCE           Same as --scoring.best-night-confidence
              PULSE_LEARNED_CONFIDENCE              Same as --scoring.learned-confidence
              PULSE_SOUND_TOLERANCE                 Same as --scoring.sound-tolerance
              PULSE_LIGHT_TOLERANCE                 Same as --scoring.light-tolerance
              PULSE_RANGE_TOLERANCE                 Same as --scoring.range-tolerance
              PULSE_MIN_CAPACITY                    Same as --scoring.min-capacity
              PULSE_PROFILE                         Same as --scoring.profile

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Built-in defaults
            """;
    }
}
