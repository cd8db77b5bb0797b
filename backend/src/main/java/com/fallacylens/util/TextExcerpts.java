package com.fallacylens.util;

/** Privacy-safe previews of user text for logs and diagnostics. */
public final class TextExcerpts {

    private static final String ELLIPSIS = "...";

    private TextExcerpts() {}

    /**
     * Truncate to at most {@code max} characters (ellipsis appended when cut), newlines flattened.
     * Returns "" for null or a non-positive limit.
     */
    public static String truncate(String text, int max) {
        if (text == null || max <= 0) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ").strip();
        return flat.length() <= max ? flat : flat.substring(0, max) + ELLIPSIS;
    }
}
