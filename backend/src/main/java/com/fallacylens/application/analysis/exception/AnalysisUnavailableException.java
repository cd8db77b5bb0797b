package com.fallacylens.application.analysis.exception;

/**
 * Detection produced no data, so there is nothing meaningful to return.
 */
public class AnalysisUnavailableException extends RuntimeException {

    public AnalysisUnavailableException(String message) {
        super(message);
    }
}
