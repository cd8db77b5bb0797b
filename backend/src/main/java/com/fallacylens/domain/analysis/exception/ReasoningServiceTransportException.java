package com.fallacylens.domain.analysis.exception;

/**
 * The reasoning service could not be reached or did not answer in time.
 * Only retryable instances are retried.
 */
public class ReasoningServiceTransportException extends ReasoningServiceException {

    private final boolean retryable;

    public ReasoningServiceTransportException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ReasoningServiceTransportException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
