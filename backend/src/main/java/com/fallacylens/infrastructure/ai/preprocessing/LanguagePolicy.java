package com.fallacylens.infrastructure.ai.preprocessing;

/**
 * What to do with input that fails the ASCII-ratio English-eligibility heuristic.
 */
public enum LanguagePolicy {
    /** Reject with a language-mismatch validation error. */
    REJECT,
    /** Analyze the whole text anyway and record a diagnostic. */
    PERMISSIVE
}
