package com.fallacylens.interfaces.api.dto;

import com.fallacylens.domain.analysis.model.AnalysisResult;
import com.fallacylens.domain.analysis.model.BalancedRewrite;
import com.fallacylens.domain.analysis.model.DetectedFallacy;

import java.util.List;
import java.util.Map;

public record AnalysisResponse(
        String status,
        String inputText,
        List<FallacyEntry> fallacies,
        SummaryEntry summary,
        RewriteEntry rewrite,
        long elapsedMs
) {
    public record FallacyEntry(
            String kind,
            int start,
            int end,
            String excerpt,
            int confidence,
            String confidenceLevel,
            String definition,
            String rationale,
            String educationalNote,
            boolean genericExplanation
    ) {}

    public record SummaryEntry(
            int totalFallacies,
            Map<String, Integer> countsByKind,
            Double averageConfidence,
            String message
    ) {}

    public record ChangeEntry(String original, String revised, String reason) {}

    public record RewriteEntry(String text, List<ChangeEntry> changes) {}

    /**
     * Map the domain result. Internal diagnostics are deliberately left out.
     */
    public static AnalysisResponse from(AnalysisResult result) {
        return new AnalysisResponse(
                result.status().name(),
                result.inputText(),
                result.detectedFallacies().stream().map(AnalysisResponse::toEntry).toList(),
                new SummaryEntry(
                        result.summary().totalCount(),
                        result.summary().countsByKind(),
                        result.summary().averageConfidence(),
                        result.summary().message()),
                toEntry(result.rewrite()),
                result.elapsedMs());
    }

    private static FallacyEntry toEntry(DetectedFallacy f) {
        return new FallacyEntry(
                f.kind(), f.start(), f.end(), f.excerpt(),
                f.confidence(), f.confidenceLevel().name().toLowerCase(),
                f.explanation().definition(),
                f.explanation().rationale(),
                f.explanation().educationalNote(),
                f.explanationFallback());
    }

    private static RewriteEntry toEntry(BalancedRewrite rewrite) {
        if (rewrite == null) return null;
        return new RewriteEntry(rewrite.text(), rewrite.changes().stream()
                .map(c -> new ChangeEntry(c.originalSegment(), c.revisedSegment(), c.reason()))
                .toList());
    }
}
