package com.fallacylens.domain.analysis.model;

/**
 * Internal failure or notable event raised during a run. Never sent to the client.
 *
 * @param type        what happened
 * @param stage       stage that was active
 * @param detail      short description, without user text
 * @param textExcerpt truncated reference to the affected text (may be empty)
 */
public record DiagnosticEvent(
        Type type,
        PipelineStage stage,
        String detail,
        String textExcerpt
) {
    public enum Type {
        PARSE_FAILURE,
        TRANSPORT_FAILURE,
        RETRY_EXHAUSTED,
        TIMEOUT,
        BUDGET_EXCEEDED,
        CANDIDATE_DISCARDED,
        CANDIDATE_REPAIRED,
        EXPLANATION_FALLBACK,
        REWRITE_SKIPPED,
        REWRITE_FAILED,
        LANGUAGE_GATE_BYPASSED
    }
}
