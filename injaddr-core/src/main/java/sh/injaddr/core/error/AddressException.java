// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

import java.util.Objects;

/**
 * Thrown when a single address cannot be detected, decoded or re-encoded.
 *
 * @since 0.1.0
 */
public abstract sealed class AddressException extends InjAddrException
        permits InvalidEvmAddressException,
        UnrecognizedFormatException,
        InvalidBech32Exception,
        PrefixMismatchException,
        InvalidAddressLengthException,
        InvalidPrefixException {

    private final String input;

    protected AddressException(final String input, final String message) {
        super(message);
        this.input = Objects.requireNonNull(input, "input");
    }

    protected AddressException(final String input, final String message, final Throwable cause) {
        super(message, cause);
        this.input = Objects.requireNonNull(input, "input");
    }

    /**
     * Returns the offending value exactly as the caller supplied it.
     *
     * @return the input address or prefix
     */
    public String input() {
        return input;
    }
}
