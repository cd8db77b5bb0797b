package com.fallacylens.domain.analysis.model;

/**
 * Three-tier classification of a fallacy confidence score.
 * Boundaries are exact: scores below 60 are LOW, 60 up to 79 are MEDIUM, 80 and above are HIGH.
 */
public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static final int MEDIUM_THRESHOLD = 60;
    public static final int HIGH_THRESHOLD = 80;

    /**
     * Map a score to its level. Scores are expected in [0, 100]; callers clamp before mapping.
     */
    public static ConfidenceLevel fromScore(int score) {
        if (score >= HIGH_THRESHOLD) return HIGH;
        if (score >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }
}
