package com.fallacylens.domain.analysis.model;

import java.util.Locale;

/**
 * A fallacy as reported by the reasoning service, before explanation and ranking.
 * Instances coming straight from the service are unvalidated; the detector stage
 * re-creates them with in-bounds spans and clamped confidence.
 *
 * @param kind          fallacy category, e.g. "ad_hominem"
 * @param start         start offset in the input text (inclusive)
 * @param end           end offset in the input text (exclusive)
 * @param excerpt       the text covered by the span
 * @param rawConfidence confidence score, 0-100 once validated
 */
public record CandidateFallacy(
        String kind,
        int start,
        int end,
        String excerpt,
        int rawConfidence
) {

    /**
     * Canonical kind key: trimmed, lower case, runs of spaces/hyphens collapsed to '_'.
     * Returns an empty string for null or blank input.
     */
    public static String canonicalKind(String kind) {
        if (kind == null || kind.isBlank()) return "";
        return kind.strip()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[\\s\\-/]+", "_")
                .replaceAll("[^a-z0-9_]", "")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
    }
}
