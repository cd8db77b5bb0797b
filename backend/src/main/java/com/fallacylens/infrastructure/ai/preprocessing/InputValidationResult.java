package com.fallacylens.infrastructure.ai.preprocessing;

import com.fallacylens.domain.analysis.model.ValidationError;

/**
 * Outcome of input validation: either the normalized text or the first failing rule.
 *
 * @param normalizedText text to analyze (null when invalid)
 * @param error          first failing rule (null when valid)
 * @param languageGateBypassed true when the text failed the language heuristic but policy let it through
 */
public record InputValidationResult(
        String normalizedText,
        ValidationError error,
        boolean languageGateBypassed
) {

    public static InputValidationResult ok(String normalizedText, boolean languageGateBypassed) {
        return new InputValidationResult(normalizedText, null, languageGateBypassed);
    }

    public static InputValidationResult fail(ValidationError.Type type, String message) {
        return new InputValidationResult(null, new ValidationError(type, message), false);
    }

    public boolean valid() {
        return error == null;
    }
}
