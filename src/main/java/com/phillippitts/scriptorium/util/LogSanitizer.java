package com.phillippitts.scriptorium.util;

/** Utility for privacy-safe logging of transcription text. */
public final class LogSanitizer {

    /** Default preview length for transcription text in log lines. */
    public static final int PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short single-line preview of transcription text with its total length, e.g. {@code "Dear Sir…" (812 chars)}.
     */
    public static String preview(String text) {
        if (text == null) {
            return "<null>";
        }
        String flat = truncate(text, PREVIEW_CHARS).replace('\n', ' ').replace('\r', ' ');
        String ellipsis = text.length() > PREVIEW_CHARS ? "…" : "";
        return "\"" + flat + ellipsis + "\" (" + text.length() + " chars)";
    }
}
