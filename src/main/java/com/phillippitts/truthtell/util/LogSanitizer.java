package com.phillippitts.truthtell.util;

/** Privacy-safe previews of transcribed or submitted text for log lines. */
public final class LogSanitizer {

    /** Default preview length used by {@link #preview(String)}. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncates to at most {@code max} characters; returns "" for null or non-positive max.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: line breaks collapsed to spaces, cut to {@value #DEFAULT_PREVIEW_CHARS}
     * characters with a trailing "..." when shortened.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n]+", " ");
        if (flat.length() <= DEFAULT_PREVIEW_CHARS) {
            return flat;
        }
        return truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
