package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.ReasoningServiceParseException;
import com.fallacylens.domain.analysis.exception.ReasoningServiceTransportException;
import com.fallacylens.domain.analysis.model.CandidateFallacy;
import com.fallacylens.domain.analysis.model.DiagnosticEvent;
import com.fallacylens.domain.analysis.service.ReasoningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Detection stage: one reasoning call per input, then per-candidate validation.
 *
 * Candidates are repaired rather than rejected where possible: confidence is clamped
 * to [0, 100] and spans that are out of bounds or disagree with the reported excerpt
 * are relocated by searching the input for the excerpt. Candidates without a kind or
 * with an unlocatable span are discarded. Repeated (kind, span) pairs keep the first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallacyDetectorStage {

    private final ReasoningService reasoningService;
    private final BudgetedExecutor budgetedExecutor;

    public record DetectionOutcome(boolean succeeded, List<CandidateFallacy> candidates) {

        static DetectionOutcome failed() {
            return new DetectionOutcome(false, List.of());
        }
    }

    public DetectionOutcome detect(AnalysisPipelineContext ctx) {
        String text = ctx.getText();

        List<CandidateFallacy> reported;
        try {
            reported = budgetedExecutor.callWithin(ctx.getDeadline(),
                    () -> reasoningService.detectFallacies(text));
        } catch (BudgetExceededException e) {
            ctx.record(DiagnosticEvent.Type.TIMEOUT, "Detection abandoned: " + e.getMessage(), text);
            ctx.markBudgetExceeded();
            return DetectionOutcome.failed();
        } catch (ReasoningServiceParseException e) {
            ctx.record(DiagnosticEvent.Type.PARSE_FAILURE, e.getMessage(), text);
            return DetectionOutcome.failed();
        } catch (ReasoningServiceTransportException e) {
            ctx.record(DiagnosticEvent.Type.RETRY_EXHAUSTED, e.getMessage(), text);
            return DetectionOutcome.failed();
        } catch (RuntimeException e) {
            log.error("[Detection] Unexpected reasoning failure", e);
            ctx.record(DiagnosticEvent.Type.TRANSPORT_FAILURE, "Detection failed: " + e.getMessage(), text);
            return DetectionOutcome.failed();
        }

        if (reported == null) {
            reported = List.of();
        }
        ctx.setCandidatesReported(reported.size());

        List<CandidateFallacy> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int discarded = 0;
        for (CandidateFallacy raw : reported) {
            Optional<CandidateFallacy> validated = validate(raw, text, ctx);
            if (validated.isEmpty()) {
                discarded++;
                continue;
            }
            CandidateFallacy c = validated.get();
            if (!seen.add(c.kind() + "@" + c.start() + ":" + c.end())) {
                discarded++;
                ctx.record(DiagnosticEvent.Type.CANDIDATE_DISCARDED, "Duplicate " + c.kind() + " candidate", c.excerpt());
                continue;
            }
            accepted.add(c);
        }
        ctx.setCandidatesDiscarded(discarded);

        log.info("[Detector] reported={}, accepted={}, discarded={}", reported.size(), accepted.size(), discarded);
        return new DetectionOutcome(true, List.copyOf(accepted));
    }

    /**
     * Validate one raw candidate against the input text.
     */
    Optional<CandidateFallacy> validate(CandidateFallacy raw, String text, AnalysisPipelineContext ctx) {
        if (raw == null) {
            return Optional.empty();
        }

        String kind = CandidateFallacy.canonicalKind(raw.kind());
        if (kind.isEmpty()) {
            ctx.record(DiagnosticEvent.Type.CANDIDATE_DISCARDED, "Candidate without a kind", raw.excerpt());
            return Optional.empty();
        }

        int confidence = clamp(raw.rawConfidence());
        String reported = raw.excerpt() == null ? "" : raw.excerpt().strip();
        int start = raw.start();
        int end = raw.end();
        boolean inBounds = start >= 0 && start < end && end <= text.length();

        if (inBounds) {
            String actual = text.substring(start, end);
            if (reported.isEmpty() || actual.equals(reported) || actual.strip().equals(reported)) {
                return Optional.of(new CandidateFallacy(kind, start, end, actual, confidence));
            }
            int found = locateNearest(text, reported, start);
            if (found >= 0) {
                ctx.record(DiagnosticEvent.Type.CANDIDATE_REPAIRED,
                        "Span of " + kind + " moved to match reported excerpt", reported);
                return Optional.of(new CandidateFallacy(kind, found, found + reported.length(), reported, confidence));
            }
            // Excerpt is paraphrased; positions are the better evidence.
            return Optional.of(new CandidateFallacy(kind, start, end, actual, confidence));
        }

        if (!reported.isEmpty()) {
            int found = locateNearest(text, reported, Math.max(start, 0));
            if (found >= 0) {
                ctx.record(DiagnosticEvent.Type.CANDIDATE_REPAIRED,
                        "Out-of-bounds span of " + kind + " relocated from excerpt", reported);
                return Optional.of(new CandidateFallacy(kind, found, found + reported.length(), reported, confidence));
            }
        }

        ctx.record(DiagnosticEvent.Type.CANDIDATE_DISCARDED,
                "Span [" + start + ", " + end + ") of " + kind + " is outside the text and excerpt not found", reported);
        return Optional.empty();
    }

    static int clamp(int confidence) {
        return Math.max(0, Math.min(100, confidence));
    }

    /**
     * Occurrence of {@code needle} whose start is closest to {@code hint}, or -1.
     */
    static int locateNearest(String text, String needle, int hint) {
        if (needle.isEmpty()) return -1;
        int best = -1;
        int idx = text.indexOf(needle);
        while (idx >= 0) {
            if (best < 0 || Math.abs(idx - hint) < Math.abs(best - hint)) {
                best = idx;
            }
            idx = text.indexOf(needle, idx + 1);
        }
        return best;
    }
}
