package com.fallacylens.domain.analysis.model;

public enum AnalysisStatus {
    /** Fallacies found and every stage settled normally. */
    COMPLETE,
    /** No fallacies survived; the text reads as sound. */
    SOUND,
    /** Fallacies found but some content degraded (budget, fallback explanation, failed rewrite). */
    PARTIAL,
    /** Detection produced no data at all. */
    INDETERMINATE
}
