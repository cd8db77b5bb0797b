package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.ReasoningServiceParseException;
import com.fallacylens.domain.analysis.exception.ReasoningServiceTransportException;
import com.fallacylens.domain.analysis.model.AnalysisOptions;
import com.fallacylens.domain.analysis.model.CandidateFallacy;
import com.fallacylens.domain.analysis.model.DiagnosticEvent;
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
class FallacyDetectorStageTest {

    private static final String TEXT =
            "You can't trust his plan because he failed in school. Everyone agrees, so it must be right.";

    @Mock
    private ReasoningService reasoningService;

    private FakeClock clock;
    private AnalysisPipelineContext ctx;
    private FallacyDetectorStage stage;

    @BeforeEach
    void setUp() {
        clock = new FakeClock();
        ctx = new AnalysisPipelineContext(AnalysisOptions.DEFAULT, clock, 40);
        ctx.begin(TEXT, Duration.ofSeconds(10));
        stage = new FallacyDetectorStage(reasoningService, new BudgetedExecutor(Runnable::run));
    }

    @Test
    @DisplayName("Candidates are clamped, relocated, deduplicated or discarded")
    void validatesCandidates() {
        when(reasoningService.detectFallacies(TEXT)).thenReturn(List.of(
                new CandidateFallacy("ad_hominem", 33, 52, "he failed in school", 150),
                new CandidateFallacy("Bandwagon", 54, 69, "Everyone agrees", -5),
                new CandidateFallacy("circular_reasoning", 500, 520, "it must be right", 70),
                new CandidateFallacy("red_herring", 200, 210, "the moon landing", 60),
                new CandidateFallacy("  ", 10, 24, "trust his plan", 50),
                new CandidateFallacy("Ad Hominem", 33, 52, "he failed in school", 40)
        ));

        FallacyDetectorStage.DetectionOutcome outcome = stage.detect(ctx);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.candidates()).containsExactly(
                new CandidateFallacy("ad_hominem", 33, 52, "he failed in school", 100),
                new CandidateFallacy("bandwagon", 54, 69, "Everyone agrees", 0),
                new CandidateFallacy("circular_reasoning", 74, 90, "it must be right", 70));
        assertThat(ctx.getCandidatesReported()).isEqualTo(6);
        assertThat(ctx.getCandidatesDiscarded()).isEqualTo(3);
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.CANDIDATE_DISCARDED)).isTrue();
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.CANDIDATE_REPAIRED)).isTrue();
    }

    @Test
    @DisplayName("Every accepted span lies inside the text")
    void spansInBounds() {
        when(reasoningService.detectFallacies(TEXT)).thenReturn(List.of(
                new CandidateFallacy("straw_man", 0, 10, "trust his plan", 65),
                new CandidateFallacy("hasty_generalization", 54, 69, "most people agree", 55),
                new CandidateFallacy("false_dilemma", 80, 95, "", 50)
        ));

        List<CandidateFallacy> accepted = stage.detect(ctx).candidates();

        assertThat(accepted).extracting(CandidateFallacy::start).containsExactly(10, 54);
        assertThat(accepted).allSatisfy(c -> {
            assertThat(c.start()).isGreaterThanOrEqualTo(0);
            assertThat(c.end()).isGreaterThan(c.start()).isLessThanOrEqualTo(TEXT.length());
            assertThat(TEXT.substring(c.start(), c.end())).isEqualTo(c.excerpt());
        });
    }

    @Test
    @DisplayName("No fallacies is a successful detection")
    void nothingFound() {
        when(reasoningService.detectFallacies(TEXT)).thenReturn(List.of());

        FallacyDetectorStage.DetectionOutcome outcome = stage.detect(ctx);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.candidates()).isEmpty();
    }

    @Test
    @DisplayName("Malformed detection output fails detection with a parse diagnostic")
    void parseFailure() {
        when(reasoningService.detectFallacies(TEXT)).thenThrow(new ReasoningServiceParseException("not json"));

        FallacyDetectorStage.DetectionOutcome outcome = stage.detect(ctx);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.PARSE_FAILURE)).isTrue();
    }

    @Test
    @DisplayName("Unreachable service fails detection with a retry-exhausted diagnostic")
    void transportFailure() {
        when(reasoningService.detectFallacies(TEXT))
                .thenThrow(new ReasoningServiceTransportException("detect failed after 3 attempt(s)", false));

        FallacyDetectorStage.DetectionOutcome outcome = stage.detect(ctx);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.RETRY_EXHAUSTED)).isTrue();
    }

    @Test
    @DisplayName("An exhausted budget abandons detection without calling the service")
    void budgetGone() {
        clock.advance(Duration.ofSeconds(11));

        FallacyDetectorStage.DetectionOutcome outcome = stage.detect(ctx);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(ctx.isBudgetExceeded()).isTrue();
        assertThat(ctx.toDiagnostics().has(DiagnosticEvent.Type.TIMEOUT)).isTrue();
        verifyNoInteractions(reasoningService);
    }

    @Test
    @DisplayName("Nearest occurrence wins when the excerpt repeats")
    void locateNearest() {
        String text = "no way, no way at all, no way";

        assertThat(FallacyDetectorStage.locateNearest(text, "no way", 20)).isEqualTo(23);
        assertThat(FallacyDetectorStage.locateNearest(text, "no way", 0)).isZero();
        assertThat(FallacyDetectorStage.locateNearest(text, "maybe", 0)).isEqualTo(-1);
    }

    @Test
    @DisplayName("Confidence is clamped into 0-100")
    void clamp() {
        assertThat(FallacyDetectorStage.clamp(150)).isEqualTo(100);
        assertThat(FallacyDetectorStage.clamp(-5)).isZero();
        assertThat(FallacyDetectorStage.clamp(42)).isEqualTo(42);
    }
}
