package org.carball.pulse.model.score;

public enum ScoreStatus {
    OPTIMAL("Peak Performance", "Optimal"),
    GOOD("Almost There", "Good"),
    POOR("Quick Fix Needed", "Adjust"),
    NO_DATA("No Data", "No Data");

    private final String historicalLabel;
    private final String neutralLabel;

    ScoreStatus(String historicalLabel, String neutralLabel) {
        this.historicalLabel = historicalLabel;
        this.neutralLabel = neutralLabel;
    }

    public static ScoreStatus fromScore(int score, int optimalThreshold, int goodThreshold) {
        if (score >= optimalThreshold) return OPTIMAL;
        if (score >= goodThreshold) return GOOD;
        return POOR;
    }

    /**
     * Outcome framing when scored against the venue's own history, neutral framing otherwise.
     */
    public String label(RangeSource source) {
        return source != null && source.isHistorical() ? historicalLabel : neutralLabel;
    }
}
