package org.carball.pulse.model.range;

public enum Factor {
    SOUND("Sound", "dB"),
    LIGHT("Light", "lux"),
    CROWD("Crowd", "%"),
    MUSIC("Music", "");

    private final String displayName;
    private final String unit;

    Factor(String displayName, String unit) {
        this.displayName = displayName;
        this.unit = unit;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getUnit() {
        return unit;
    }
}
