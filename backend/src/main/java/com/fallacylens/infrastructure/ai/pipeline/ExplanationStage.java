package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.ReasoningServiceParseException;
import com.fallacylens.domain.analysis.exception.ReasoningServiceTransportException;
import com.fallacylens.domain.analysis.model.CandidateFallacy;
import com.fallacylens.domain.analysis.model.DiagnosticEvent;
import com.fallacylens.domain.analysis.model.Explanation;
import com.fallacylens.domain.analysis.model.ExplanationOutcome;
import com.fallacylens.domain.analysis.service.ReasoningService;
import com.fallacylens.infrastructure.config.AnalysisProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Explanation stage: one independent reasoning call per candidate, fanned out over
 * at most {@code explanation-concurrency} lanes and joined before ranking.
 *
 * Each lane pulls the next unexplained candidate and checks the deadline before calling.
 * A failed, malformed or unfinished explanation is replaced by the catalogue fallback,
 * so every candidate comes out with an outcome, index-aligned with the input list.
 */
@Slf4j
@Component
public class ExplanationStage {

    private final ReasoningService reasoningService;
    private final BudgetedExecutor budgetedExecutor;
    private final FallbackExplanations fallbackExplanations;
    private final int maxConcurrency;

    public ExplanationStage(ReasoningService reasoningService,
                            BudgetedExecutor budgetedExecutor,
                            FallbackExplanations fallbackExplanations,
                            AnalysisProperties properties) {
        this.reasoningService = reasoningService;
        this.budgetedExecutor = budgetedExecutor;
        this.fallbackExplanations = fallbackExplanations;
        this.maxConcurrency = Math.max(1, properties.getPipeline().getExplanationConcurrency());
    }

    public List<ExplanationOutcome> explainAll(AnalysisPipelineContext ctx) {
        List<CandidateFallacy> candidates = ctx.getCandidates();
        int n = candidates.size();
        if (n == 0) {
            return List.of();
        }

        AtomicReferenceArray<ExplanationOutcome> settled = new AtomicReferenceArray<>(n);
        AtomicBoolean closed = new AtomicBoolean();
        AnalysisDeadline deadline = ctx.getDeadline();

        if (deadline.isExpired()) {
            ctx.markBudgetExceeded();
        } else {
            AtomicInteger next = new AtomicInteger();
            int lanes = Math.min(maxConcurrency, n);
            List<CompletableFuture<Void>> futures = new ArrayList<>(lanes);
            for (int lane = 0; lane < lanes; lane++) {
                try {
                    futures.add(CompletableFuture.runAsync(
                            () -> drain(candidates, next, settled, closed, ctx), budgetedExecutor.executor()));
                } catch (RejectedExecutionException e) {
                    log.warn("[Explanation] Reasoning pool saturated, running with {} of {} lane(s)", lane, lanes);
                    ctx.record(DiagnosticEvent.Type.TRANSPORT_FAILURE,
                            "Explanation lane rejected: reasoning pool saturated", null);
                    break;
                }
            }
            if (!futures.isEmpty()) {
                join(futures, deadline, ctx);
            }
        }

        // Lanes still running past this point may neither settle nor record
        closed.set(true);

        List<ExplanationOutcome> outcomes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            CandidateFallacy c = candidates.get(i);
            String reason = "abandoned: analysis budget exhausted";
            if (settled.compareAndSet(i, null, fallback(c, reason))) {
                recordFallback(c, reason, ctx);
            }
            outcomes.add(settled.get(i));
        }

        int fallbacks = (int) outcomes.stream().filter(ExplanationOutcome::degraded).count();
        ctx.setExplanationFallbacks(fallbacks);
        log.info("[Explanation] candidates={}, lanes={}, fallbacks={}", n, Math.min(maxConcurrency, n), fallbacks);
        return List.copyOf(outcomes);
    }

    private void drain(List<CandidateFallacy> candidates, AtomicInteger next,
                       AtomicReferenceArray<ExplanationOutcome> settled, AtomicBoolean closed,
                       AnalysisPipelineContext ctx) {
        int i;
        while (!closed.get() && (i = next.getAndIncrement()) < candidates.size()) {
            if (ctx.getDeadline().isExpired()) {
                ctx.markBudgetExceeded();
                return;
            }
            CandidateFallacy candidate = candidates.get(i);
            ExplanationOutcome outcome = explainOne(candidate, ctx, closed);
            if (!closed.get() && settled.compareAndSet(i, null, outcome) && outcome.degraded()) {
                recordFallback(candidate, outcome.failureReason(), ctx);
            }
        }
    }

    private void join(List<CompletableFuture<Void>> futures, AnalysisDeadline deadline, AnalysisPipelineContext ctx) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
        try {
            all.get(Math.max(1, deadline.remainingMs()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            ctx.record(DiagnosticEvent.Type.TIMEOUT, "Explanation fan-out abandoned at budget", null);
            ctx.markBudgetExceeded();
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
        } catch (ExecutionException e) {
            // explainOne settles every failure itself; reaching here means a lane died unexpectedly
            log.error("[Explanation] Lane failed", e.getCause());
        }
    }

    private ExplanationOutcome explainOne(CandidateFallacy candidate, AnalysisPipelineContext ctx, AtomicBoolean closed) {
        try {
            Explanation explanation = reasoningService.explainFallacy(candidate.kind(), candidate.excerpt());
            if (explanation == null) {
                throw new ReasoningServiceParseException("No explanation returned");
            }
            return ExplanationOutcome.succeeded(explanation);
        } catch (ReasoningServiceParseException e) {
            recordUnlessClosed(closed, ctx, DiagnosticEvent.Type.PARSE_FAILURE,
                    "Explanation for " + candidate.kind() + ": " + e.getMessage(), candidate.excerpt());
            return fallback(candidate, "malformed explanation");
        } catch (ReasoningServiceTransportException e) {
            recordUnlessClosed(closed, ctx, DiagnosticEvent.Type.RETRY_EXHAUSTED,
                    "Explanation for " + candidate.kind() + ": " + e.getMessage(), candidate.excerpt());
            return fallback(candidate, "reasoning service unavailable");
        } catch (RuntimeException e) {
            log.error("[Explanation] Unexpected failure explaining {}", candidate.kind(), e);
            recordUnlessClosed(closed, ctx, DiagnosticEvent.Type.TRANSPORT_FAILURE,
                    "Explanation for " + candidate.kind() + ": " + e, candidate.excerpt());
            return fallback(candidate, "unexpected failure");
        }
    }

    private static void recordUnlessClosed(AtomicBoolean closed, AnalysisPipelineContext ctx,
                                           DiagnosticEvent.Type type, String detail, String subjectText) {
        if (!closed.get()) {
            ctx.record(type, detail, subjectText);
        }
    }

    private ExplanationOutcome fallback(CandidateFallacy candidate, String reason) {
        return ExplanationOutcome.fallback(fallbackExplanations.forKind(candidate.kind()), reason);
    }

    private static void recordFallback(CandidateFallacy candidate, String reason, AnalysisPipelineContext ctx) {
        ctx.record(DiagnosticEvent.Type.EXPLANATION_FALLBACK,
                "Fallback explanation for " + candidate.kind() + " (" + reason + ")", candidate.excerpt());
    }
}
