package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.InternalInvariantViolationException;
import com.fallacylens.domain.analysis.model.*;
import com.fallacylens.util.TextExcerpts;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable state of one analysis run, owned by the orchestrator and passed through the stages.
 * Diagnostic recording may be touched from explanation worker threads; the fallback count is
 * set once by the explanation stage after its lanes are joined.
 */
@Slf4j
@Getter
@Setter
public class AnalysisPipelineContext {

    private static final Set<DiagnosticEvent.Type> INFO_EVENTS = Set.of(
            DiagnosticEvent.Type.CANDIDATE_REPAIRED,
            DiagnosticEvent.Type.REWRITE_SKIPPED,
            DiagnosticEvent.Type.LANGUAGE_GATE_BYPASSED
    );

    // --- Fixed per run ---
    private final AnalysisOptions options;
    private final Clock clock;
    private final int excerptLength;

    // --- Lifecycle ---
    @Setter(AccessLevel.NONE)
    private volatile PipelineStage stage = PipelineStage.VALIDATING;
    @Setter(AccessLevel.NONE)
    private Instant stageStartedAt;
    private final Map<PipelineStage, Long> stageDurationsMs = new EnumMap<>(PipelineStage.class);

    // --- Input ---
    @Setter(AccessLevel.NONE)
    private String text;
    @Setter(AccessLevel.NONE)
    private Instant startedAt;
    @Setter(AccessLevel.NONE)
    private AnalysisDeadline deadline;

    // --- Detection ---
    private boolean detectionSucceeded;
    private int candidatesReported;
    private int candidatesDiscarded;
    private List<CandidateFallacy> candidates = List.of();

    // --- Explanation / ranking / rewrite ---
    private List<ExplanationOutcome> explanationOutcomes = List.of();
    private List<DetectedFallacy> rankedFallacies = List.of();
    private BalancedRewrite rewrite;
    private RewriteStatus rewriteStatus = RewriteStatus.ABANDONED;

    // --- Diagnostics ---
    private final List<DiagnosticEvent> events = new CopyOnWriteArrayList<>();
    private int explanationFallbacks;
    @Setter(AccessLevel.NONE)
    private volatile boolean budgetExceeded;

    public AnalysisPipelineContext(AnalysisOptions options, Clock clock, int excerptLength) {
        this.options = options;
        this.clock = clock;
        this.excerptLength = excerptLength;
        this.stageStartedAt = clock.instant();
    }

    /**
     * Called once validation passed: fixes the analyzed text and starts the budget.
     */
    public void begin(String normalizedText, Duration budget) {
        this.text = normalizedText;
        this.startedAt = clock.instant();
        this.deadline = AnalysisDeadline.start(clock, budget);
    }

    public void transition(PipelineStage next) {
        if (!stage.canTransitionTo(next)) {
            throw new InternalInvariantViolationException(
                    "Illegal pipeline transition " + stage + " -> " + next);
        }
        Instant now = clock.instant();
        stageDurationsMs.put(stage, Duration.between(stageStartedAt, now).toMillis());
        log.debug("[Pipeline] {} -> {}", stage, next);
        stage = next;
        stageStartedAt = now;
    }

    public void record(DiagnosticEvent.Type type, String detail, String subjectText) {
        DiagnosticEvent event = new DiagnosticEvent(type, stage, detail,
                TextExcerpts.truncate(subjectText, excerptLength));
        events.add(event);
        if (INFO_EVENTS.contains(type)) {
            log.info("[Pipeline] {} during {}: {} (text: \"{}\")", type, event.stage(), detail, event.textExcerpt());
        } else {
            log.warn("[Pipeline] {} during {}: {} (text: \"{}\")", type, event.stage(), detail, event.textExcerpt());
        }
    }

    public synchronized void markBudgetExceeded() {
        if (!budgetExceeded) {
            budgetExceeded = true;
            record(DiagnosticEvent.Type.BUDGET_EXCEEDED, "Analysis budget exhausted", null);
        }
    }

    public PipelineDiagnostics toDiagnostics() {
        return new PipelineDiagnostics(
                List.copyOf(events),
                rewriteStatus,
                candidatesReported,
                candidatesDiscarded,
                explanationFallbacks,
                budgetExceeded,
                Collections.unmodifiableMap(new EnumMap<>(stageDurationsMs)));
    }
}
