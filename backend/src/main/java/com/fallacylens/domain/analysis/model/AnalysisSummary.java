package com.fallacylens.domain.analysis.model;

import java.util.Map;

/**
 * Statistics over the fallacies that survived filtering. Recomputed on every run.
 *
 * @param totalCount        number of surviving fallacies
 * @param countsByKind      surviving fallacies per kind, in ranked order of first appearance
 * @param averageConfidence mean score of survivors, null when there are none
 * @param message           human-readable one-line verdict
 */
public record AnalysisSummary(
        int totalCount,
        Map<String, Integer> countsByKind,
        Double averageConfidence,
        String message
) {}
