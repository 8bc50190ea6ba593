package com.jreinhal.knowledge.util;

import java.util.regex.Pattern;

/**
 * Helpers for putting caller-supplied values into log lines.
 */
public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int DEFAULT_PREVIEW = 80;

    private LogSanitizer() {
    }

    /**
     * Describes free text by length and hash so message bodies never reach the log.
     */
    public static String textSummary(String text) {
        if (text == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + text.length() + ",id=" + Integer.toHexString(text.hashCode()) + "]";
    }

    /**
     * Strips control characters and folds line breaks so a value stays on one log line.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }

    public static String preview(String value) {
        return preview(value, DEFAULT_PREVIEW);
    }

    public static String preview(String value, int maxChars) {
        String clean = sanitize(value);
        if (clean.length() <= maxChars) {
            return clean;
        }
        return clean.substring(0, Math.max(0, maxChars)) + "...";
    }

    /**
     * Keeps the first character and the domain of an email address.
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "";
        }
        String clean = sanitize(email.trim());
        int at = clean.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return clean.charAt(0) + "***" + clean.substring(at);
    }
}
