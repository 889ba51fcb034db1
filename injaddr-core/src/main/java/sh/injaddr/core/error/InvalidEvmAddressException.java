// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

/**
 * Thrown when a string is not {@code 0x} followed by exactly 40 hex digits.
 *
 * @since 0.1.0
 */
public final class InvalidEvmAddressException extends AddressException {

    public InvalidEvmAddressException(final String input) {
        super(input, "Invalid EVM address: '" + input + "'. Must be 0x followed by 40 hex characters.");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_EVM_ADDRESS;
    }
}
