package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.InputValidationException;
import com.fallacylens.domain.analysis.model.*;
import com.fallacylens.infrastructure.ai.preprocessing.InputValidationResult;
import com.fallacylens.infrastructure.ai.preprocessing.TextValidator;
import com.fallacylens.infrastructure.config.AnalysisProperties;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Fallacy analysis orchestrator.
 *
 * Pipeline:
 *   Validating → Detecting → Explaining (fan-out/fan-in) → Ranking → Rewriting → Assembling → Done
 *
 * Only validation can stop a run (terminal Failed). Every later stage degrades internally,
 * and a detection that yields no data skips straight to Assembling with an INDETERMINATE result.
 * The budget spans Detecting through Rewriting and is checked cooperatively at each stage;
 * once it is gone, remaining reasoning calls are abandoned and the run assembles what it has.
 */
@Slf4j
@Component
public class FallacyAnalysisPipeline {

    private static final String MDC_KEY = "analysisId";

    private final TextValidator textValidator;
    private final FallacyDetectorStage detectorStage;
    private final ExplanationStage explanationStage;
    private final ConfidenceRanker confidenceRanker;
    private final RewriteStage rewriteStage;
    private final ResultAssembler resultAssembler;
    private final Clock clock;
    private final Duration budget;
    private final int excerptLength;

    public FallacyAnalysisPipeline(TextValidator textValidator,
                                   FallacyDetectorStage detectorStage,
                                   ExplanationStage explanationStage,
                                   ConfidenceRanker confidenceRanker,
                                   RewriteStage rewriteStage,
                                   ResultAssembler resultAssembler,
                                   Clock clock,
                                   AnalysisProperties properties) {
        this.textValidator = textValidator;
        this.detectorStage = detectorStage;
        this.explanationStage = explanationStage;
        this.confidenceRanker = confidenceRanker;
        this.rewriteStage = rewriteStage;
        this.resultAssembler = resultAssembler;
        this.clock = clock;
        this.budget = properties.getPipeline().getBudget();
        this.excerptLength = properties.getPipeline().getDiagnosticExcerptLength();
    }

    /**
     * Analyze one text.
     *
     * @throws InputValidationException if the text fails validation
     */
    public AnalysisResult analyze(String rawText, AnalysisOptions options) {
        Objects.requireNonNull(options, "options");
        MDC.put(MDC_KEY, UUID.randomUUID().toString().substring(0, 8));
        try {
            return run(rawText, options);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private AnalysisResult run(String rawText, AnalysisOptions options) {
        AnalysisPipelineContext ctx = new AnalysisPipelineContext(options, clock, excerptLength);

        // Validating
        InputValidationResult validation = textValidator.validate(rawText);
        if (!validation.valid()) {
            ctx.transition(PipelineStage.FAILED);
            log.info("[Pipeline] Input rejected: {} (raw length {})",
                    validation.error().type(), rawText == null ? 0 : rawText.length());
            throw new InputValidationException(validation.error());
        }
        ctx.begin(validation.normalizedText(), budget);
        if (validation.languageGateBypassed()) {
            ctx.record(DiagnosticEvent.Type.LANGUAGE_GATE_BYPASSED,
                    "Mostly non-ASCII input analyzed under permissive language policy", ctx.getText());
        }

        // Detecting
        ctx.transition(PipelineStage.DETECTING);
        FallacyDetectorStage.DetectionOutcome detection = detectorStage.detect(ctx);
        ctx.setDetectionSucceeded(detection.succeeded());
        ctx.setCandidates(detection.candidates());

        if (detection.succeeded()) {
            // Explaining
            ctx.transition(PipelineStage.EXPLAINING);
            ctx.setExplanationOutcomes(explanationStage.explainAll(ctx));

            // Ranking
            ctx.transition(PipelineStage.RANKING);
            ctx.setRankedFallacies(confidenceRanker.rank(
                    ctx.getCandidates(), ctx.getExplanationOutcomes(), options.minConfidence()));

            // Rewriting
            ctx.transition(PipelineStage.REWRITING);
            RewriteStage.RewriteOutcome rewrite = rewriteStage.rewrite(ctx);
            ctx.setRewrite(rewrite.rewrite());
            ctx.setRewriteStatus(rewrite.status());
        } else {
            log.warn("[Pipeline] Detection produced no data; assembling indeterminate result");
        }

        // Assembling
        ctx.transition(PipelineStage.ASSEMBLING);
        AnalysisResult result = resultAssembler.assemble(ctx);
        ctx.transition(PipelineStage.DONE);

        log.info("[Pipeline] Analysis complete: status={}, fallacies={}, reported={}, discarded={}, "
                        + "fallbacks={}, rewrite={}, budgetExceeded={}, elapsedMs={}",
                result.status(), result.summary().totalCount(), ctx.getCandidatesReported(),
                ctx.getCandidatesDiscarded(), ctx.getExplanationFallbacks(), ctx.getRewriteStatus(),
                ctx.isBudgetExceeded(), result.elapsedMs());
        return result;
    }
}
