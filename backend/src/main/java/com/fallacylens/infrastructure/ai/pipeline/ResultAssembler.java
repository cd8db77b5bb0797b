package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.InternalInvariantViolationException;
import com.fallacylens.domain.analysis.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the immutable {@link AnalysisResult}. No external calls; the only failure
 * is an invariant violation, which is a programming defect and is never degraded.
 */
@Slf4j
@Component
public class ResultAssembler {

    static final String SOUND_MESSAGE =
            "No reasoning fallacies were detected. The argument appears logically sound.";
    static final String FILTERED_SOUND_MESSAGE =
            "No fallacies met the minimum confidence of %d. The argument appears logically sound at this threshold.";
    static final String INDETERMINATE_MESSAGE =
            "Fallacy detection is temporarily unavailable, so the text could not be assessed. Please try again.";

    public AnalysisResult assemble(AnalysisPipelineContext ctx) {
        String text = ctx.getText();
        List<DetectedFallacy> fallacies = ctx.getRankedFallacies();

        checkInvariants(text, fallacies, ctx.getOptions().minConfidence());

        AnalysisStatus status = determineStatus(ctx, fallacies);
        AnalysisSummary summary = summarize(fallacies, status, ctx);
        long elapsedMs = Duration.between(ctx.getStartedAt(), ctx.getClock().instant()).toMillis();

        return new AnalysisResult(
                text,
                fallacies,
                summary,
                ctx.getRewrite(),
                elapsedMs,
                status,
                ctx.toDiagnostics());
    }

    AnalysisStatus determineStatus(AnalysisPipelineContext ctx, List<DetectedFallacy> fallacies) {
        if (!ctx.isDetectionSucceeded()) {
            return AnalysisStatus.INDETERMINATE;
        }
        if (fallacies.isEmpty()) {
            return AnalysisStatus.SOUND;
        }
        boolean degraded = ctx.isBudgetExceeded()
                || fallacies.stream().anyMatch(DetectedFallacy::explanationFallback)
                || ctx.getRewriteStatus() == RewriteStatus.FAILED
                || ctx.getRewriteStatus() == RewriteStatus.ABANDONED;
        return degraded ? AnalysisStatus.PARTIAL : AnalysisStatus.COMPLETE;
    }

    AnalysisSummary summarize(List<DetectedFallacy> fallacies, AnalysisStatus status, AnalysisPipelineContext ctx) {
        Map<String, Integer> countsByKind = new LinkedHashMap<>();
        for (DetectedFallacy f : fallacies) {
            countsByKind.merge(f.kind(), 1, Integer::sum);
        }

        Double average = fallacies.isEmpty()
                ? null
                : fallacies.stream().mapToInt(DetectedFallacy::confidence).average().orElseThrow();

        String message = switch (status) {
            case INDETERMINATE -> INDETERMINATE_MESSAGE;
            case SOUND -> ctx.getCandidates().isEmpty()
                    ? SOUND_MESSAGE
                    : String.format(FILTERED_SOUND_MESSAGE, ctx.getOptions().minConfidence());
            case COMPLETE, PARTIAL -> String.format("Detected %d fallac%s across %d kind%s.",
                    fallacies.size(), fallacies.size() == 1 ? "y" : "ies",
                    countsByKind.size(), countsByKind.size() == 1 ? "" : "s");
        };

        return new AnalysisSummary(fallacies.size(), Collections.unmodifiableMap(countsByKind), average, message);
    }

    void checkInvariants(String text, List<DetectedFallacy> fallacies, int minConfidence) {
        int previous = Integer.MAX_VALUE;
        for (DetectedFallacy f : fallacies) {
            if (f.start() < 0 || f.start() >= f.end() || f.end() > text.length()) {
                fail("Span [" + f.start() + ", " + f.end() + ") out of bounds for text of length " + text.length());
            }
            if (f.confidence() < 0 || f.confidence() > 100) {
                fail("Confidence " + f.confidence() + " outside [0, 100]");
            }
            if (f.confidence() < minConfidence) {
                fail("Fallacy below minimum confidence survived filtering");
            }
            if (f.confidence() > previous) {
                fail("Fallacies are not ordered by confidence");
            }
            if (f.explanation() == null) {
                fail("Fallacy " + f.kind() + " has no explanation attached");
            }
            if (f.confidenceLevel() != ConfidenceLevel.fromScore(f.confidence())) {
                fail("Confidence level does not match score " + f.confidence());
            }
            previous = f.confidence();
        }
    }

    private static void fail(String message) {
        log.error("[Assembler] Invariant violation: {}", message);
        throw new InternalInvariantViolationException(message);
    }
}
