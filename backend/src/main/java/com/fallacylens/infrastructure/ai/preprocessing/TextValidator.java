package com.fallacylens.infrastructure.ai.preprocessing;

import com.fallacylens.domain.analysis.model.ValidationError;
import com.fallacylens.infrastructure.config.AnalysisProperties;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes raw input and checks it against the analysis eligibility rules,
 * first failing rule wins:
 * <ol>
 *   <li>empty after trimming</li>
 *   <li>shorter than the minimum length</li>
 *   <li>longer than the maximum length (never truncated)</li>
 *   <li>ASCII share below the minimum ratio (approximate English gate, not a language detector)</li>
 * </ol>
 * Pure and deterministic; lengths are counted in code points.
 */
@Component
public class TextValidator {

    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060]"
    );

    private final AnalysisProperties.Validation config;

    public TextValidator(AnalysisProperties properties) {
        this.config = properties.getValidation();
    }

    public InputValidationResult validate(String rawText) {
        String text = normalize(rawText);

        if (text.isEmpty()) {
            return InputValidationResult.fail(ValidationError.Type.EMPTY,
                    "Text must not be empty.");
        }

        int length = text.codePointCount(0, text.length());
        if (length < config.getMinLength()) {
            return InputValidationResult.fail(ValidationError.Type.TOO_SHORT,
                    String.format("Text must be at least %d characters (got %d).", config.getMinLength(), length));
        }
        if (length > config.getMaxLength()) {
            return InputValidationResult.fail(ValidationError.Type.TOO_LONG,
                    String.format("Text must not exceed %d characters (got %d). Shorten it and try again.",
                            config.getMaxLength(), length));
        }

        double ratio = asciiRatio(text);
        if (ratio < config.getMinAsciiRatio()) {
            if (config.getLanguagePolicy() == LanguagePolicy.REJECT) {
                return InputValidationResult.fail(ValidationError.Type.LANGUAGE_MISMATCH,
                        "Only English text is supported at the moment.");
            }
            return InputValidationResult.ok(text, true);
        }

        return InputValidationResult.ok(text, false);
    }

    /**
     * NFC, invisible characters removed, line endings unified, outer whitespace trimmed.
     * Interior whitespace is kept so reported offsets line up with what the user wrote.
     */
    String normalize(String rawText) {
        if (rawText == null) {
            return "";
        }
        String result = Normalizer.normalize(rawText, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = result.replace("\r\n", "\n").replace('\r', '\n');
        return result.strip();
    }

    /**
     * Share of code points in the single-byte ASCII range.
     */
    static double asciiRatio(String text) {
        int total = 0;
        int ascii = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            total++;
            if (cp <= 0x7F) ascii++;
            i += Character.charCount(cp);
        }
        return total == 0 ? 0 : (double) ascii / total;
    }
}
