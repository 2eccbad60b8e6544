package org.carball.pulse.model.learning;

public enum LearningStatus {
    LEARNING,
    REFINING,
    OPTIMIZED;

    public static LearningStatus fromConfidence(double confidence) {
        if (confidence < 0.3) return LEARNING;
        if (confidence < 0.7) return REFINING;
        return OPTIMIZED;
    }

    public String describe(double confidence) {
        int percent = (int) Math.round(confidence * 100);
        return switch (this) {
            case LEARNING -> "Learning your venue's patterns... " + percent + "% complete";
            case REFINING -> "Refining optimal ranges... " + percent + "% confidence";
            case OPTIMIZED -> "Optimized for your venue - " + percent + "% confidence";
        };
    }
}
