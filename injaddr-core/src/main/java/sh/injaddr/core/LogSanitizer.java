// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core;

import java.util.regex.Pattern;

/**
 * Makes untrusted text safe to put in a log line.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Replaces control characters (including CR and LF) so one input cannot forge extra log lines</li>
 * <li>Truncates excessively long logs, as batch inputs are caller-sized</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** C0 controls and DEL, except the ANSI escape used by {@link LogFormatter} colors. */
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1a\\x1c-\\x1f\\x7f]");

    private static final String CONTROL_REPLACEMENT = "?";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = CONTROL_CHARS.matcher(input).replaceAll(CONTROL_REPLACEMENT);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
