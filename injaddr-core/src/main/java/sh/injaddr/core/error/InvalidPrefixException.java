// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

import sh.injaddr.primitives.Bech32Exception;

/**
 * Thrown when a prefix requested for encoding is empty or holds illegal characters.
 *
 * <p>{@link #input()} is the rejected prefix.
 *
 * @since 0.1.0
 */
public final class InvalidPrefixException extends AddressException {

    public InvalidPrefixException(final String prefix) {
        super(prefix, "Invalid bech32 prefix: '" + prefix + "'. Must be one or more lowercase letters or digits.");
    }

    public InvalidPrefixException(final String prefix, final Bech32Exception cause) {
        super(prefix, "Invalid bech32 prefix: '" + prefix + "' (" + cause.getMessage() + ")", cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_PREFIX;
    }
}
