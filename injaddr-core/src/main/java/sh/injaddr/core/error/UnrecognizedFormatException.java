// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

/**
 * Thrown by format detection when a string looks like neither an EVM nor a bech32 address.
 *
 * @since 0.1.0
 */
public final class UnrecognizedFormatException extends AddressException {

    public UnrecognizedFormatException(final String input) {
        super(input, "Unrecognised address format: '" + input + "'. "
                + "Expected a 0x hex address or a bech32 address (e.g. inj1..., cosmos1..., osmo1...).");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNRECOGNIZED_FORMAT;
    }
}
