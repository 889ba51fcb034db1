// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core;

/**
 * Global toggle for verbose debug logging of conversions.
 *
 * <p>Thread safety: the flags are volatile. {@link #isEnabled()} reads them
 * non-atomically, which only affects whether a log line is emitted, never a result.
 */
public final class InjAddrDebug {

    private static volatile boolean conversionLogging = false;
    private static volatile boolean batchLogging = false;

    private InjAddrDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either conversion or batch logging is enabled
     */
    public static boolean isEnabled() {
        return conversionLogging || batchLogging;
    }

    public static void setEnabled(final boolean enabled) {
        conversionLogging = enabled;
        batchLogging = enabled;
    }

    public static void setConversionLogging(final boolean enabled) {
        conversionLogging = enabled;
    }

    public static boolean isConversionLoggingEnabled() {
        return conversionLogging;
    }

    public static void setBatchLogging(final boolean enabled) {
        batchLogging = enabled;
    }

    public static boolean isBatchLoggingEnabled() {
        return batchLogging;
    }
}
