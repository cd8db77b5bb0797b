package com.fallacylens.domain.analysis.exception;

/**
 * Base type for failures of the external reasoning service.
 */
public class ReasoningServiceException extends RuntimeException {

    public ReasoningServiceException(String message) {
        super(message);
    }

    public ReasoningServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
