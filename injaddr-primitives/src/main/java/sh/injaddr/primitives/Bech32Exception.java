// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.primitives;

import java.util.Objects;

/**
 * Thrown when a bech32 string cannot be encoded or decoded.
 *
 * <p>{@link #reason()} identifies the structural rule that was violated, so callers can
 * tell a checksum failure apart from a charset failure without inspecting the message.
 *
 * @since 0.1.0
 */
public final class Bech32Exception extends IllegalArgumentException {

    /** The rule a bech32 string or encode request broke. */
    public enum Reason {
        /** No {@code 1} separator between prefix and data. */
        MISSING_SEPARATOR,
        /** The human-readable prefix is empty. */
        EMPTY_PREFIX,
        /** The prefix holds a character outside ASCII 33..126. */
        INVALID_PREFIX,
        /** A data character is outside the bech32 charset. */
        INVALID_CHARACTER,
        /** Upper and lower case letters are mixed. */
        MIXED_CASE,
        /** A data value to encode exceeds 5 bits. */
        INVALID_DATA,
        /** Fewer than six characters follow the separator. */
        TOO_SHORT,
        /** The string exceeds 90 characters. */
        TOO_LONG,
        /** The checksum does not verify. */
        INVALID_CHECKSUM
    }

    private final Reason reason;

    public Bech32Exception(final Reason reason, final String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
