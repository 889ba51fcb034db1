// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core;

import static sh.injaddr.core.AnsiColors.*;

/**
 * Formats debug log lines for conversions and batches.
 *
 * <p>Status symbols (✓ ✗) mark outcome, bracketed tags mark the operation, and long
 * addresses are shortened to {@code inj14a...fqku} form.
 */
public final class LogFormatter {

    private static final int ADDRESS_PREFIX_LENGTH = 6;
    private static final int ADDRESS_SUFFIX_LENGTH = 4;
    private static final int ADDRESS_SHORTEN_THRESHOLD = ADDRESS_PREFIX_LENGTH + ADDRESS_SUFFIX_LENGTH + 3;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [CONVERT] source=cosmos input=cosmos...yyy inj=inj14a...fqku evm=0xaf79...4902
     */
    public static String formatConversion(String sourceType, String input, String injectiveAddress, String evmAddress) {
        return String.format(
                "%s✓%s %s[CONVERT]%s source=%s input=%s inj=%s evm=%s",
                TEAL, RESET,
                TEAL, RESET,
                sourceType,
                shortenAddress(input),
                shortenAddress(injectiveAddress),
                shortenAddress(evmAddress));
    }

    /**
     * Format: ✗ [CONVERT-ERROR] input=garbage kind=UNRECOGNIZED_FORMAT
     */
    public static String formatConversionError(String input, Object kind) {
        return String.format(
                "%s✗%s %s[CONVERT-ERROR]%s input=%s kind=%s",
                CORAL, RESET,
                CORAL, RESET,
                shortenAddress(input),
                CORAL + kind + RESET);
    }

    /**
     * Format: [BATCH] size=3 converted=2 failed=1 duration=0.12ms
     */
    public static String formatBatch(int size, int converted, int failed, long durationMicros) {
        return String.format(
                "%s[BATCH]%s size=%d converted=%d failed=%d %s",
                INDIGO, RESET,
                size,
                converted,
                failed,
                duration(durationMicros));
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    /**
     * Shortens an address to its first {@value #ADDRESS_PREFIX_LENGTH} and last
     * {@value #ADDRESS_SUFFIX_LENGTH} characters.
     */
    static String shortenAddress(String address) {
        if (address == null || address.length() <= ADDRESS_SHORTEN_THRESHOLD) {
            return address;
        }
        return address.substring(0, ADDRESS_PREFIX_LENGTH)
                + "..."
                + address.substring(address.length() - ADDRESS_SUFFIX_LENGTH);
    }
}
