package com.fallacylens.infrastructure.ai;

import com.fallacylens.domain.analysis.exception.ReasoningServiceParseException;
import com.fallacylens.domain.analysis.model.BalancedRewrite;
import com.fallacylens.domain.analysis.model.CandidateFallacy;
import com.fallacylens.domain.analysis.model.Explanation;
import com.fallacylens.domain.analysis.model.RewriteChange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient reader for the near-structured JSON the model returns.
 *
 * Tolerates markdown code fences, leading/trailing prose, camelCase or snake_case keys
 * and a bare array instead of the wrapping object. Anything that still cannot be read
 * raises {@link ReasoningServiceParseException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReasoningOutputParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public List<CandidateFallacy> parseCandidates(String content) {
        JsonNode root = readJson(content, "detection");
        JsonNode items = root.isArray() ? root : root.path("fallacies");
        if (!items.isArray()) {
            throw new ReasoningServiceParseException("Detection output has no 'fallacies' array");
        }

        List<CandidateFallacy> candidates = new ArrayList<>();
        for (JsonNode item : items) {
            if (!item.isObject()) {
                log.debug("[Parser] Skipping non-object fallacy entry: {}", item.getNodeType());
                continue;
            }
            JsonNode span = item.path("span");
            candidates.add(new CandidateFallacy(
                    text(item, "kind", "type", "name"),
                    integer(span.isObject() ? span : item, "start", -1),
                    integer(span.isObject() ? span : item, "end", -1),
                    text(item, "excerpt", "text", "quote"),
                    integer(item, "confidence", 0)
            ));
        }
        return candidates;
    }

    public Explanation parseExplanation(String content) {
        JsonNode root = requireObject(readJson(content, "explanation"), "explanation");

        String definition = text(root, "definition");
        String rationale = text(root, "rationale", "explanation", "reason");
        String note = text(root, "educational_note", "educationalNote", "tip");

        if (definition.isBlank() && rationale.isBlank()) {
            throw new ReasoningServiceParseException("Explanation output has neither definition nor rationale");
        }
        return new Explanation(definition, rationale, note);
    }

    public BalancedRewrite parseRewrite(String content) {
        JsonNode root = requireObject(readJson(content, "rewrite"), "rewrite");

        String rewritten = text(root, "rewritten_text", "rewrittenText", "text");
        if (rewritten.isBlank()) {
            throw new ReasoningServiceParseException("Rewrite output has no rewritten text");
        }

        List<RewriteChange> changes = new ArrayList<>();
        JsonNode items = root.path("changes");
        if (items.isArray()) {
            for (JsonNode item : items) {
                if (!item.isObject()) continue;
                String original = text(item, "original_segment", "originalSegment", "original");
                String revised = text(item, "revised_segment", "revisedSegment", "revised");
                if (original.isBlank() && revised.isBlank()) continue;
                changes.add(new RewriteChange(original, revised, text(item, "reason")));
            }
        }
        return new BalancedRewrite(rewritten.strip(), changes);
    }

    /**
     * Strip fences and surrounding prose, then parse.
     */
    JsonNode readJson(String content, String operation) {
        if (content == null || content.isBlank()) {
            throw new ReasoningServiceParseException("Empty " + operation + " output");
        }

        String body = content.strip();
        Matcher fence = CODE_FENCE.matcher(body);
        if (fence.find()) {
            body = fence.group(1);
        }
        body = trimToJson(body);

        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ReasoningServiceParseException("Malformed " + operation + " output: " + e.getOriginalMessage(), e);
        }
    }

    private static String trimToJson(String body) {
        int objStart = body.indexOf('{');
        int arrStart = body.indexOf('[');
        int start;
        char close;
        if (objStart >= 0 && (arrStart < 0 || objStart < arrStart)) {
            start = objStart;
            close = '}';
        } else if (arrStart >= 0) {
            start = arrStart;
            close = ']';
        } else {
            return body;
        }
        int end = body.lastIndexOf(close);
        return end > start ? body.substring(start, end + 1) : body.substring(start);
    }

    private static JsonNode requireObject(JsonNode node, String operation) {
        if (!node.isObject()) {
            throw new ReasoningServiceParseException("Expected a JSON object for " + operation + " output");
        }
        return node;
    }

    private static String text(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull() && value.isValueNode()) {
                return value.asText().strip();
            }
        }
        return "";
    }

    /**
     * Read an integer field leniently: numbers are rounded, "85%" or "85" strings are accepted.
     */
    private static int integer(JsonNode node, String key, int defaultValue) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) return defaultValue;
        if (value.isNumber()) return (int) Math.round(value.asDouble());
        if (value.isTextual()) {
            String raw = value.asText().replace("%", "").strip();
            try {
                return (int) Math.round(Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                log.debug("[Parser] Unreadable number for '{}': {}", key, raw);
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
