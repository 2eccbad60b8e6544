package org.carball.pulse.config;

import lombok.Getter;
import org.carball.pulse.model.range.OptimalRange;

/**
 * Named sound/light calibrations for common kinds of venue.
 */
@Getter
public enum VenueTypePreset {

    DIVE_BAR("dive_bar", "Dive Bar", "Casual, loud, low lighting",
            OptimalRange.of(72, 82), OptimalRange.of(30, 150)),

    COCKTAIL_LOUNGE("cocktail_lounge", "Cocktail Lounge", "Upscale, conversational, ambient",
            OptimalRange.of(62, 72), OptimalRange.of(50, 200)),

    SPORTS_BAR("sports_bar", "Sports Bar", "Game nights can get loud",
            OptimalRange.of(70, 85), OptimalRange.of(100, 400)),

    NIGHTCLUB("nightclub", "Nightclub", "High energy, dark, loud",
            OptimalRange.of(78, 90), OptimalRange.of(20, 100)),

    RESTAURANT_BAR("restaurant_bar", "Restaurant Bar", "Dining-friendly, conversational",
            OptimalRange.of(58, 70), OptimalRange.of(150, 400));

    private final String name;
    private final String label;
    private final String description;
    private final OptimalRange sound;
    private final OptimalRange light;

    VenueTypePreset(String name, String label, String description, OptimalRange sound, OptimalRange light) {
        this.name = name;
        this.label = label;
        this.description = description;
        this.sound = sound;
        this.light = light;
    }

    /**
     * Finds preset by name (case-insensitive, dashes and underscores are interchangeable).
     */
    public static VenueTypePreset fromName(String name) {
        String normalized = name == null ? "" : name.trim().replace('-', '_');
        for (VenueTypePreset preset : values()) {
            if (preset.getName().equalsIgnoreCase(normalized)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown venue type preset: " + name +
                ". Available presets: " + getAvailablePresets());
    }

    public static String getAvailablePresets() {
        StringBuilder sb = new StringBuilder();
        for (VenueTypePreset preset : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(preset.getName());
        }
        return sb.toString();
    }

    public static String getPresetHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Venue Type Presets:\n\n");
        for (VenueTypePreset preset : values()) {
            help.append(String.format("  %-16s %-40s sound %s dB, light %s lux\n",
                    preset.getName(), preset.getDescription(), preset.getSound(), preset.getLight()));
        }
        return help.toString();
    }
}
