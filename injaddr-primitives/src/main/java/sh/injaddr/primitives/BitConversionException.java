// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.primitives;

/**
 * Thrown when a sequence of values cannot be regrouped into a different bit width.
 *
 * @since 0.1.0
 * @see BitGroups
 */
public final class BitConversionException extends IllegalArgumentException {

    public BitConversionException(final String message) {
        super(message);
    }
}
