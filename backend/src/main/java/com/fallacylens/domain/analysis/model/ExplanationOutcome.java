package com.fallacylens.domain.analysis.model;

/**
 * Per-fallacy result of the explanation stage, carried forward as data instead of an exception.
 *
 * @param explanation   the explanation to attach (never null: either the service's or the fallback)
 * @param degraded      true when the fallback text was used
 * @param failureReason why the service explanation was not used (null when not degraded)
 */
public record ExplanationOutcome(
        Explanation explanation,
        boolean degraded,
        String failureReason
) {

    public static ExplanationOutcome succeeded(Explanation explanation) {
        return new ExplanationOutcome(explanation, false, null);
    }

    public static ExplanationOutcome fallback(Explanation fallback, String failureReason) {
        return new ExplanationOutcome(fallback, true, failureReason);
    }
}
