package com.phillippitts.shato.util;

/** Renders user utterances and model output as short single-line log previews. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Collapses line breaks and tabs into spaces and cuts the text to at most {@code max}
     * characters, marking the cut with an ellipsis. Returns "" for null or a non-positive max.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n\\t]+", " ").strip();
        if (flat.length() <= max) {
            return flat;
        }
        if (max <= ELLIPSIS.length()) {
            return flat.substring(0, max);
        }
        return flat.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }
}
