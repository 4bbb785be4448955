// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts authorization material carried in protocol frames</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Logs exceeding this will be truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Matches "Authorization":"..." and "x-api-key":"..." JSON values, case-insensitively. */
    private static final Pattern CREDENTIAL_PATTERN =
            Pattern.compile("\"(authorization|x-api-key)\"\\s*:\\s*\"[^\"]*\"", Pattern.CASE_INSENSITIVE);

    /** Matches "keyId":"..." JSON values. Key ids identify the device key that unseals a record. */
    private static final Pattern KEY_ID_PATTERN =
            Pattern.compile("\"keyId\"\\s*:\\s*\"[^\"]*\"");

    private static final String KEY_ID_REPLACEMENT = "\"keyId\":\"***[REDACTED]***\"";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        String lower = sanitized.toLowerCase();
        if (lower.contains("\"authorization\"") || lower.contains("\"x-api-key\"")) {
            sanitized = CREDENTIAL_PATTERN.matcher(sanitized).replaceAll("\"$1\":\"***[REDACTED]***\"");
        }

        if (sanitized.contains("\"keyId\"")) {
            sanitized = KEY_ID_PATTERN.matcher(sanitized).replaceAll(KEY_ID_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
