package com.ownmyhealth.phi.util;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.regex.Pattern;

/**
 * Last-line PHI scrubbing for every log message, installed as {@code %maskedMsg}
 * in logback-spring.xml. Code should still never log PHI in the first place.
 */
public class PhiMaskingConverter extends ClassicConverter {
    private static final Pattern JWT = Pattern.compile("\\beyJ[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+");
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-?\\d{2}-?\\d{4}\\b");
    private static final Pattern EMAIL = Pattern.compile(
        "\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern PHONE = Pattern.compile("\\b(?:\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b");
    private static final Pattern IPV4 = Pattern.compile("\\b(?:(?:25[0-5]|2[0-4]\\d|[01]?\\d\\d?)\\.){3}(?:25[0-5]|2[0-4]\\d|[01]?\\d\\d?)\\b");
    // Medical record numbers and similar 10-digit identifiers.
    private static final Pattern TEN_DIGIT_ID = Pattern.compile("\\b\\d{10}\\b");

    @Override
    public String convert(ILoggingEvent event) {
        return mask(event.getFormattedMessage());
    }

    public static String mask(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }
        String masked = JWT.matcher(message).replaceAll("[TOKEN-REDACTED]");
        masked = SSN.matcher(masked).replaceAll("[SSN-REDACTED]");
        masked = EMAIL.matcher(masked).replaceAll("[EMAIL-REDACTED]");
        masked = PHONE.matcher(masked).replaceAll("[PHONE-REDACTED]");
        masked = IPV4.matcher(masked).replaceAll("[IP-REDACTED]");
        masked = TEN_DIGIT_ID.matcher(masked).replaceAll("[ID-REDACTED]");
        return masked;
    }
}
