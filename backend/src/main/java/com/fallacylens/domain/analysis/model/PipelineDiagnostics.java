package com.fallacylens.domain.analysis.model;

import java.util.List;
import java.util.Map;

/**
 * Per-run internal diagnostics, attached to the result for logging and tests only.
 */
public record PipelineDiagnostics(
        List<DiagnosticEvent> events,
        RewriteStatus rewriteStatus,
        int candidatesReported,
        int candidatesDiscarded,
        int explanationFallbacks,
        boolean budgetExceeded,
        Map<PipelineStage, Long> stageDurationsMs
) {

    public boolean has(DiagnosticEvent.Type type) {
        return events.stream().anyMatch(e -> e.type() == type);
    }
}
