package com.fallacylens.domain.analysis.model;

import java.util.List;

/**
 * Final immutable output of one analysis.
 *
 * @param inputText         the normalized text that was analyzed
 * @param detectedFallacies surviving fallacies, confidence descending, detector order on ties
 * @param summary           statistics over {@code detectedFallacies}
 * @param rewrite           balanced rewrite, or null (see {@link PipelineDiagnostics#rewriteStatus()})
 * @param elapsedMs         wall-clock time from validation pass to assembly
 * @param status            overall outcome
 * @param diagnostics       internal run diagnostics
 */
public record AnalysisResult(
        String inputText,
        List<DetectedFallacy> detectedFallacies,
        AnalysisSummary summary,
        BalancedRewrite rewrite,
        long elapsedMs,
        AnalysisStatus status,
        PipelineDiagnostics diagnostics
) {
    public AnalysisResult {
        detectedFallacies = List.copyOf(detectedFallacies);
    }
}
