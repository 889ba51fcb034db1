// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

/**
 * Thrown when a bech32 address decodes to a payload that is not 20 bytes long.
 *
 * @since 0.1.0
 */
public final class InvalidAddressLengthException extends AddressException {

    private final int expectedLength;
    private final int actualLength;

    public InvalidAddressLengthException(final String input, final int expectedLength, final int actualLength) {
        super(input, "Invalid address length: expected " + expectedLength + " bytes, got "
                + actualLength + " for '" + input + "'");
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public int expectedLength() {
        return expectedLength;
    }

    public int actualLength() {
        return actualLength;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_ADDRESS_LENGTH;
    }
}
