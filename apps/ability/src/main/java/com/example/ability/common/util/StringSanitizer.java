package com.example.ability.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Renders caller-supplied values (ids, subject types, error messages) safely for log lines.
 */
public final class StringSanitizer {

    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final String TRUNCATION_MARKER = "...";

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    /**
     * Drop control characters (no forged log lines) and cap the length, marking a cut with "...".
     */
    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        StringBuilder sanitized = new StringBuilder(Math.min(value.length(), maxLength));
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isISOControl(c)) {
                continue;
            }
            if (sanitized.length() == maxLength) {
                return sanitized.append(TRUNCATION_MARKER).toString();
            }
            sanitized.append(c);
        }
        return sanitized.toString();
    }
}
