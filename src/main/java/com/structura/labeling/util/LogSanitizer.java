package com.structura.labeling.util;

/** Utility for privacy-safe logging and prompting of paragraph text previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max code points; returns "" for null.
     * Surrogate pairs are never split.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        if (s.length() <= max || s.codePointCount(0, s.length()) <= max) {
            return s;
        }
        return s.substring(0, s.offsetByCodePoints(0, max));
    }

    /**
     * Like {@link #truncate(String, int)} but collapses line breaks and tabs to single spaces,
     * so a preview always fits on one log line.
     */
    public static String singleLine(String s, int max) {
        return truncate(s, max).replaceAll("[\\r\\n\\t]+", " ");
    }
}
