package com.phillippitts.pingwatch.util;

import java.util.Set;

/** Utility for log-safe previews and file-system-safe names. */
public final class LogSanitizer {

    private static final Set<Character> INVALID_FILE_CHARS =
            Set.of('<', '>', ':', '"', '/', '\\', '|', '?', '*');
    private static final int MAX_FILE_NAME_CHARS = 120;

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
     * Replaces characters that are invalid in file names (on any supported OS) with {@code _},
     * drops control characters the same way and caps the result at 120 characters.
     * Returns {@code "unknown"} for null or empty input.
     */
    public static String sanitizeFileName(String name) {
        if (name == null || name.isEmpty()) {
            return "unknown";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            sb.append(INVALID_FILE_CHARS.contains(c) || Character.isISOControl(c) ? '_' : c);
        }
        return truncate(sb.toString(), MAX_FILE_NAME_CHARS);
    }
}
