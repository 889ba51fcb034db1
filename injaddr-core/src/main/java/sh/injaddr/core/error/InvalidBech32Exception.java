// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

import java.util.Objects;

import sh.injaddr.primitives.BitConversionException;
import sh.injaddr.primitives.Bech32Exception;

/**
 * Thrown when a bech32 address fails structural decoding.
 *
 * <p>The kind is {@link ErrorKind#INVALID_BECH32_CHECKSUM} for a checksum failure,
 * {@link ErrorKind#INVALID_BECH32_CHARSET} for illegal characters or mixed case, and
 * {@link ErrorKind#INVALID_BECH32} otherwise. The codec exception is kept as the cause.
 *
 * @since 0.1.0
 */
public final class InvalidBech32Exception extends AddressException {

    private final ErrorKind kind;

    public InvalidBech32Exception(final String input, final Bech32Exception cause) {
        super(input, "Invalid bech32 address: '" + input + "' (" + cause.getMessage() + ")", cause);
        this.kind = classify(cause.reason());
    }

    public InvalidBech32Exception(final String input, final BitConversionException cause) {
        super(input, "Failed to decode bech32 data for address: '" + input + "' (" + cause.getMessage() + ")", cause);
        this.kind = ErrorKind.INVALID_BECH32;
    }

    @Override
    public ErrorKind kind() {
        return kind;
    }

    private static ErrorKind classify(final Bech32Exception.Reason reason) {
        Objects.requireNonNull(reason, "reason");
        return switch (reason) {
            case INVALID_CHECKSUM -> ErrorKind.INVALID_BECH32_CHECKSUM;
            case INVALID_CHARACTER, MIXED_CASE -> ErrorKind.INVALID_BECH32_CHARSET;
            default -> ErrorKind.INVALID_BECH32;
        };
    }
}
