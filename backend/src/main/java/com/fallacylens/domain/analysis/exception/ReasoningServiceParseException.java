package com.fallacylens.domain.analysis.exception;

/**
 * The reasoning service answered, but its output was malformed. Never retried.
 */
public class ReasoningServiceParseException extends ReasoningServiceException {

    public ReasoningServiceParseException(String message) {
        super(message);
    }

    public ReasoningServiceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
