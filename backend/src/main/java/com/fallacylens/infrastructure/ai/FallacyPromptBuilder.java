package com.fallacylens.infrastructure.ai;

import com.fallacylens.domain.analysis.model.DetectedFallacy;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds system prompts and user messages for the three reasoning operations.
 * Every prompt asks for a single JSON object; {@link ReasoningOutputParser} reads the answers.
 */
@Component
public class FallacyPromptBuilder {

    private static final String DETECTION_SYSTEM_PROMPT = """
            Role: expert in informal logic and argument analysis.
            Task: find reasoning fallacies in the user's text.

            Respond with one JSON object:
            {
              "fallacies": [
                {
                  "kind": "snake_case fallacy name, e.g. ad_hominem, straw_man, false_dilemma",
                  "start": 0-based character offset where the flawed passage begins,
                  "end": character offset just after it ends,
                  "excerpt": "exact substring of the text covering the passage",
                  "confidence": integer 0-100
                }
              ]
            }

            Rules:
            - excerpt must be copied verbatim from the text.
            - Only report a fallacy when the passage actually argues something.
            - Plain factual statements are not fallacies. Return {"fallacies": []} when none exist.
            - Do not add commentary outside the JSON object.""";

    private static final String EXPLANATION_SYSTEM_PROMPT = """
            Role: patient logic tutor.
            Task: explain one reasoning fallacy found in a passage.

            Respond with one JSON object:
            {
              "definition": "one or two sentences defining the fallacy in general",
              "rationale": "why this specific passage commits it",
              "educational_note": "one practical tip for avoiding it"
            }

            Be neutral toward the author. No text outside the JSON object.""";

    private static final String REWRITE_SYSTEM_PROMPT = """
            Role: careful editor producing balanced arguments.
            Task: rewrite the text so the listed fallacies are removed while the author's position,
            facts and tone are kept.

            Respond with one JSON object:
            {
              "rewritten_text": "the full rewritten text",
              "changes": [
                {
                  "original_segment": "exact passage from the original",
                  "revised_segment": "what replaced it",
                  "reason": "which fallacy this fixes and how"
                }
              ]
            }

            Change only what is needed to address the fallacies. No text outside the JSON object.""";

    public String getDetectionSystemPrompt() {
        return DETECTION_SYSTEM_PROMPT;
    }

    public String getExplanationSystemPrompt() {
        return EXPLANATION_SYSTEM_PROMPT;
    }

    public String getRewriteSystemPrompt() {
        return REWRITE_SYSTEM_PROMPT;
    }

    public String buildDetectionUserMessage(String text) {
        return "Text (" + text.length() + " characters):\n" + text;
    }

    public String buildExplanationUserMessage(String kind, String excerpt) {
        return "Fallacy: " + humanize(kind) + "\n\nPassage:\n" + excerpt;
    }

    public String buildRewriteUserMessage(String text, List<DetectedFallacy> fallacies) {
        StringBuilder sb = new StringBuilder();
        sb.append("[Detected fallacies, most confident first]\n");
        for (int i = 0; i < fallacies.size(); i++) {
            DetectedFallacy f = fallacies.get(i);
            sb.append(i + 1).append(". ")
                    .append(humanize(f.kind()))
                    .append(" (confidence ").append(f.confidence()).append("): \"")
                    .append(f.excerpt()).append("\"\n");
        }
        sb.append("\n[Original text]\n").append(text);
        return sb.toString();
    }

    static String humanize(String kind) {
        return kind == null ? "" : kind.replace('_', ' ');
    }
}
