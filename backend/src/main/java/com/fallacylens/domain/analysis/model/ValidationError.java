package com.fallacylens.domain.analysis.model;

/**
 * Reason an input was rejected before analysis.
 */
public record ValidationError(Type type, String message) {

    public enum Type {
        EMPTY,
        TOO_SHORT,
        TOO_LONG,
        LANGUAGE_MISMATCH
    }
}
