package com.yoursp.ledger.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks secrets that slip into log messages.
 * <ul>
 * <li>password / new_password values: "[REDACTED]"</li>
 * <li>token values and Bearer tokens: first 4 chars + "..."</li>
 * <li>vault key / passphrase / salt values: "[REDACTED]"</li>
 * <li>encoding vectors: "[REDACTED]"</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.ledger.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // password=..., "password":"...", new_password=...
    private static final Pattern PASSWORD_PATTERN = Pattern
            .compile("((?:new_)?password[\"']?\\s*[=:]\\s*[\"']?)[^\"'&\\s,}]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{4})[A-Za-z0-9_\\-./+=]+");

    // token=..., "token":"..." (also reset_token, access_token)
    private static final Pattern TOKEN_PATTERN = Pattern
            .compile("(token[\"']?\\s*[=:]\\s*[\"']?)([A-Za-z0-9_\\-]{4})[A-Za-z0-9_\\-./+=]*",
                    Pattern.CASE_INSENSITIVE);

    private static final Pattern KEY_PATTERN = Pattern
            .compile("((?:vault[._-]?key|passphrase|salt)[\"']?\\s*[=:]\\s*[\"']?)[A-Za-z0-9_\\-./+=]+",
                    Pattern.CASE_INSENSITIVE);

    // encoding=[0.1, -0.2, ...] or "encoding":[...]
    private static final Pattern ENCODING_PATTERN = Pattern
            .compile("(encodings?[\"']?\\s*[=:]\\s*)\\[(?:[^\\[\\]]|\\[[^\\]]*\\])*\\]",
                    Pattern.CASE_INSENSITIVE);

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = PASSWORD_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = TOKEN_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = KEY_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = ENCODING_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");

        return masked;
    }
}
