// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

/**
 * Thrown when a decoded bech32 prefix differs from the prefix the operation requires.
 *
 * @since 0.1.0
 */
public final class PrefixMismatchException extends AddressException {

    private final String expectedPrefix;
    private final String actualPrefix;

    public PrefixMismatchException(final String input, final String expectedPrefix, final String actualPrefix) {
        super(input, "Expected prefix '" + expectedPrefix + "', got '" + actualPrefix + "' in address '" + input + "'");
        this.expectedPrefix = expectedPrefix;
        this.actualPrefix = actualPrefix;
    }

    public String expectedPrefix() {
        return expectedPrefix;
    }

    public String actualPrefix() {
        return actualPrefix;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PREFIX_MISMATCH;
    }
}
