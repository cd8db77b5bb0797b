package com.fallacylens.infrastructure.ai;

import com.fallacylens.domain.analysis.model.CandidateFallacy;
import com.fallacylens.domain.analysis.model.DetectedFallacy;
import com.fallacylens.domain.analysis.model.Explanation;
import com.fallacylens.domain.analysis.model.ExplanationOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FallacyPromptBuilderTest {

    private final FallacyPromptBuilder builder = new FallacyPromptBuilder();

    @Test
    @DisplayName("Rewrite message lists fallacies in ranked order before the text")
    void rewriteMessage() {
        ExplanationOutcome explained = ExplanationOutcome.succeeded(new Explanation("d", "r", "n"));
        List<DetectedFallacy> ranked = List.of(
                DetectedFallacy.of(new CandidateFallacy("bandwagon", 54, 69, "Everyone agrees", 92), explained),
                DetectedFallacy.of(new CandidateFallacy("ad_hominem", 33, 52, "he failed in school", 85), explained));

        String message = builder.buildRewriteUserMessage("Original argument.", ranked);

        assertThat(message).contains("1. bandwagon (confidence 92): \"Everyone agrees\"");
        assertThat(message).contains("2. ad hominem (confidence 85)");
        assertThat(message.indexOf("bandwagon")).isLessThan(message.indexOf("ad hominem"));
        assertThat(message).endsWith("[Original text]\nOriginal argument.");
    }

    @Test
    @DisplayName("Every system prompt asks for JSON only")
    void jsonPrompts() {
        assertThat(builder.getDetectionSystemPrompt()).contains("\"fallacies\"");
        assertThat(builder.getExplanationSystemPrompt()).contains("\"educational_note\"");
        assertThat(builder.getRewriteSystemPrompt()).contains("\"rewritten_text\"");
    }

    @Test
    @DisplayName("Kinds are humanized for the model")
    void humanize() {
        assertThat(FallacyPromptBuilder.humanize("appeal_to_authority")).isEqualTo("appeal to authority");
        assertThat(builder.buildExplanationUserMessage("straw_man", "so you want chaos"))
                .startsWith("Fallacy: straw man");
    }
}
