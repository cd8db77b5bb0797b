package com.fallacylens.domain.analysis.exception;

/**
 * A programming defect: pipeline data broke an invariant that earlier stages guarantee.
 */
public class InternalInvariantViolationException extends RuntimeException {

    public InternalInvariantViolationException(String message) {
        super(message);
    }
}
