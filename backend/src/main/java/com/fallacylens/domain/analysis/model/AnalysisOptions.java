package com.fallacylens.domain.analysis.model;

/**
 * Caller options for one analysis.
 *
 * @param includeRewrite whether a balanced rewrite should be attempted
 * @param minConfidence  fallacies scoring strictly below this are dropped, in [0, 100]
 */
public record AnalysisOptions(boolean includeRewrite, int minConfidence) {

    public static final AnalysisOptions DEFAULT = new AnalysisOptions(true, 0);

    public AnalysisOptions {
        if (minConfidence < 0 || minConfidence > 100) {
            throw new IllegalArgumentException("minConfidence must be between 0 and 100, got " + minConfidence);
        }
    }

    public static AnalysisOptions of(Boolean includeRewrite, Integer minConfidence) {
        return new AnalysisOptions(
                includeRewrite == null || includeRewrite,
                minConfidence == null ? 0 : minConfidence);
    }
}
