// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for conversion tracing.
 *
 * <p>Lines go to the {@code sh.injaddr.debug} SLF4J logger at INFO level, only when the
 * matching {@link InjAddrDebug} flag is on. Every line passes through {@link LogSanitizer}
 * because address strings come straight from callers.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.injaddr.debug");

    private DebugLogger() {
    }

    public static void logConversion(final String message, final Object... args) {
        if (!InjAddrDebug.isConversionLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logBatch(final String message, final Object... args) {
        if (!InjAddrDebug.isBatchLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!InjAddrDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
