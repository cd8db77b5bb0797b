package com.fallacylens.domain.analysis.model;

/**
 * A validated, explained and classified fallacy. Immutable once constructed.
 *
 * @param explanationFallback true when {@code explanation} is the generic text for the kind
 */
public record DetectedFallacy(
        String kind,
        int start,
        int end,
        String excerpt,
        int confidence,
        ConfidenceLevel confidenceLevel,
        Explanation explanation,
        boolean explanationFallback
) {

    public static DetectedFallacy of(CandidateFallacy candidate, ExplanationOutcome outcome) {
        return new DetectedFallacy(
                candidate.kind(),
                candidate.start(),
                candidate.end(),
                candidate.excerpt(),
                candidate.rawConfidence(),
                ConfidenceLevel.fromScore(candidate.rawConfidence()),
                outcome.explanation(),
                outcome.degraded());
    }
}
