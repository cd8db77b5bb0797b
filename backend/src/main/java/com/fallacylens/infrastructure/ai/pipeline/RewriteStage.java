package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.ReasoningServiceParseException;
import com.fallacylens.domain.analysis.exception.ReasoningServiceTransportException;
import com.fallacylens.domain.analysis.model.BalancedRewrite;
import com.fallacylens.domain.analysis.model.DetectedFallacy;
import com.fallacylens.domain.analysis.model.DiagnosticEvent;
import com.fallacylens.domain.analysis.model.RewriteStatus;
import com.fallacylens.domain.analysis.service.ReasoningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rewrite stage: one reasoning call conditioned on the full ranked fallacy set.
 * Attempted only when at least one fallacy survived and the caller asked for it.
 * Any failure leaves the rewrite null; the status records why.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewriteStage {

    private final ReasoningService reasoningService;
    private final BudgetedExecutor budgetedExecutor;

    public record RewriteOutcome(BalancedRewrite rewrite, RewriteStatus status) {

        static RewriteOutcome without(RewriteStatus status) {
            return new RewriteOutcome(null, status);
        }
    }

    public RewriteOutcome rewrite(AnalysisPipelineContext ctx) {
        List<DetectedFallacy> ranked = ctx.getRankedFallacies();
        String text = ctx.getText();

        if (ranked.isEmpty()) {
            ctx.record(DiagnosticEvent.Type.REWRITE_SKIPPED, "No rewrite necessary: no surviving fallacies", null);
            return RewriteOutcome.without(RewriteStatus.NOT_NEEDED);
        }
        if (!ctx.getOptions().includeRewrite()) {
            log.debug("[Rewrite] Not requested");
            return RewriteOutcome.without(RewriteStatus.NOT_REQUESTED);
        }
        if (ctx.getDeadline().isExpired()) {
            ctx.markBudgetExceeded();
            ctx.record(DiagnosticEvent.Type.REWRITE_SKIPPED, "Rewrite abandoned: budget exhausted before start", null);
            return RewriteOutcome.without(RewriteStatus.ABANDONED);
        }

        try {
            BalancedRewrite rewrite = budgetedExecutor.callWithin(ctx.getDeadline(),
                    () -> reasoningService.generateRewrite(text, ranked));
            if (rewrite == null || rewrite.text() == null || rewrite.text().isBlank()) {
                throw new ReasoningServiceParseException("Empty rewrite");
            }
            log.info("[Rewrite] Succeeded with {} change(s)", rewrite.changes().size());
            return new RewriteOutcome(rewrite, RewriteStatus.SUCCEEDED);
        } catch (BudgetExceededException e) {
            ctx.record(DiagnosticEvent.Type.TIMEOUT, "Rewrite abandoned: " + e.getMessage(), text);
            ctx.markBudgetExceeded();
            return RewriteOutcome.without(RewriteStatus.ABANDONED);
        } catch (ReasoningServiceParseException e) {
            ctx.record(DiagnosticEvent.Type.PARSE_FAILURE, "Rewrite: " + e.getMessage(), text);
            ctx.record(DiagnosticEvent.Type.REWRITE_FAILED, "Rewrite output unusable", text);
            return RewriteOutcome.without(RewriteStatus.FAILED);
        } catch (ReasoningServiceTransportException e) {
            ctx.record(DiagnosticEvent.Type.RETRY_EXHAUSTED, "Rewrite: " + e.getMessage(), text);
            ctx.record(DiagnosticEvent.Type.REWRITE_FAILED, "Reasoning service unavailable for rewrite", text);
            return RewriteOutcome.without(RewriteStatus.FAILED);
        } catch (RuntimeException e) {
            log.error("[Rewrite] Unexpected reasoning failure", e);
            ctx.record(DiagnosticEvent.Type.TRANSPORT_FAILURE, "Rewrite: " + e.getMessage(), text);
            ctx.record(DiagnosticEvent.Type.REWRITE_FAILED, "Rewrite failed unexpectedly", text);
            return RewriteOutcome.without(RewriteStatus.FAILED);
        }
    }
}
