package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.ReasoningServiceParseException;
import com.fallacylens.domain.analysis.exception.ReasoningServiceTransportException;
import com.fallacylens.domain.analysis.model.*;
import com.fallacylens.domain.analysis.service.ReasoningService;
import com.fallacylens.support.FakeClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RewriteStageTest {

    private static final String TEXT =
            "You can't trust his plan because he failed in school. Everyone agrees, so it must be right.";

    private static final List<DetectedFallacy> RANKED = List.of(
            DetectedFallacy.of(
                    new CandidateFallacy("ad_hominem", 33, 52, "he failed in school", 90),
                    ExplanationOutcome.succeeded(new Explanation("d", "r", "n"))));

    @Mock
    private ReasoningService reasoningService;

    private FakeClock clock;
    private RewriteStage stage;

    @BeforeEach
    void setUp() {
        clock = new FakeClock();
        stage = new RewriteStage(reasoningService, new BudgetedExecutor(Runnable::run));
    }

    private AnalysisPipelineContext context(boolean includeRewrite, List<DetectedFallacy> ranked) {
        AnalysisPipelineContext ctx = new AnalysisPipelineContext(new AnalysisOptions(includeRewrite, 0), clock, 40);
        ctx.begin(TEXT, Duration.ofSeconds(10));
        ctx.setRankedFallacies(ranked);
        return ctx;
    }

    @Test
    @DisplayName("Rewrite is produced from the ranked fallacies")
    void succeeds() {
        BalancedRewrite balanced = new BalancedRewrite("His plan deserves a look on its merits.",
                List.of(new RewriteChange("he failed in school", "the plan lacks detail", "removes the personal attack")));
        when(reasoningService.generateRewrite(TEXT, RANKED)).thenReturn(balanced);

        RewriteStage.RewriteOutcome outcome = stage.rewrite(context(true, RANKED));

        assertThat(outcome.status()).isEqualTo(RewriteStatus.SUCCEEDED);
        assertThat(outcome.rewrite()).isEqualTo(balanced);
    }

    @Test
    @DisplayName("Nothing to fix is a skip, not a failure")
    void notNeeded() {
        AnalysisPipelineContext ctx = context(true, List.of());

        RewriteStage.RewriteOutcome outcome = stage.rewrite(ctx);

        assertThat(outcome.status()).isEqualTo(RewriteStatus.NOT_NEEDED);
        assertThat(outcome.rewrite()).isNull();
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.REWRITE_SKIPPED)).isTrue();
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.REWRITE_FAILED)).isFalse();
        verifyNoInteractions(reasoningService);
    }

    @Test
    @DisplayName("Caller opting out skips the call")
    void notRequested() {
        RewriteStage.RewriteOutcome outcome = stage.rewrite(context(false, RANKED));

        assertThat(outcome.status()).isEqualTo(RewriteStatus.NOT_REQUESTED);
        verifyNoInteractions(reasoningService);
    }

    @Test
    @DisplayName("Malformed rewrite output is a failure, distinct from a skip")
    void parseFailure() {
        when(reasoningService.generateRewrite(TEXT, RANKED)).thenThrow(new ReasoningServiceParseException("garbled"));
        AnalysisPipelineContext ctx = context(true, RANKED);

        RewriteStage.RewriteOutcome outcome = stage.rewrite(ctx);

        assertThat(outcome.status()).isEqualTo(RewriteStatus.FAILED);
        assertThat(outcome.rewrite()).isNull();
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.REWRITE_FAILED)).isTrue();
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.REWRITE_SKIPPED)).isFalse();
    }

    @Test
    @DisplayName("Unreachable service is a failure")
    void transportFailure() {
        when(reasoningService.generateRewrite(TEXT, RANKED))
                .thenThrow(new ReasoningServiceTransportException("rewrite failed after 3 attempt(s)", false));
        AnalysisPipelineContext ctx = context(true, RANKED);

        assertThat(stage.rewrite(ctx).status()).isEqualTo(RewriteStatus.FAILED);
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.RETRY_EXHAUSTED)).isTrue();
    }

    @Test
    @DisplayName("Blank rewrite text is treated as malformed")
    void blankRewrite() {
        when(reasoningService.generateRewrite(TEXT, RANKED)).thenReturn(new BalancedRewrite("  ", List.of()));

        assertThat(stage.rewrite(context(true, RANKED)).status()).isEqualTo(RewriteStatus.FAILED);
    }

    @Test
    @DisplayName("Exhausted budget abandons the rewrite")
    void budgetGone() {
        AnalysisPipelineContext ctx = context(true, RANKED);
        clock.advance(Duration.ofSeconds(10));

        RewriteStage.RewriteOutcome outcome = stage.rewrite(ctx);

        assertThat(outcome.status()).isEqualTo(RewriteStatus.ABANDONED);
        assertThat(ctx.isBudgetExceeded()).isTrue();
        verifyNoInteractions(reasoningService);
    }
}
