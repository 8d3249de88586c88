package com.ownmyhealth.phi.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    // Control characters enable log injection and forged lines.
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private LogSanitizer() {
    }

    /**
     * Strip control characters and flatten line breaks before a value enters log output.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }

    /**
     * "jane.doe@example.com" becomes "j***@example.com". Anything that is not an
     * address collapses to "***".
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "***";
        }
        String trimmed = sanitize(email.trim());
        int at = trimmed.indexOf('@');
        if (at <= 0 || at == trimmed.length() - 1) {
            return "***";
        }
        return trimmed.charAt(0) + "***" + trimmed.substring(at);
    }
}
