package com.example.cliporganizer.common.util;

/**
 * Makes user-controlled text safe to put on a single log line.
 */
public final class LogSanitizer {

    private static final int MAX_LENGTH = 500;

    private LogSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(Math.min(value.length(), MAX_LENGTH));
        for (int i = 0; i < value.length() && sb.length() < MAX_LENGTH; i++) {
            char c = value.charAt(i);
            if (c == '\r' || c == '\n' || c == '\t') {
                sb.append(' ');
            } else if (!Character.isISOControl(c)) {
                sb.append(c);
            }
        }
        if (value.length() > MAX_LENGTH) {
            sb.append("...");
        }
        return sb.toString();
    }

    /**
     * Keeps only the last two segments of a path so that home directories and user names stay out of logs.
     */
    public static String sanitizePath(String path) {
        if (path == null) {
            return null;
        }
        String normalized = path.replace('\\', '/');
        int last = normalized.lastIndexOf('/');
        if (last <= 0) {
            return sanitize(normalized);
        }
        int previous = normalized.lastIndexOf('/', last - 1);
        if (previous < 0) {
            return sanitize(normalized);
        }
        return sanitize(".../" + normalized.substring(previous + 1));
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
