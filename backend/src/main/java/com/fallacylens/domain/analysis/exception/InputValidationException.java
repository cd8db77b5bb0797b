package com.fallacylens.domain.analysis.exception;

import com.fallacylens.domain.analysis.model.ValidationError;

public class InputValidationException extends RuntimeException {

    private final ValidationError error;

    public InputValidationException(ValidationError error) {
        super(error.message());
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }
}
