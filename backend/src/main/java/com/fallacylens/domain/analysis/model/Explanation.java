package com.fallacylens.domain.analysis.model;

/**
 * Educational explanation attached to a detected fallacy.
 *
 * @param definition      what the fallacy is in general
 * @param rationale       why the flagged excerpt matches it
 * @param educationalNote a short tip on avoiding the fallacy
 */
public record Explanation(
        String definition,
        String rationale,
        String educationalNote
) {}
