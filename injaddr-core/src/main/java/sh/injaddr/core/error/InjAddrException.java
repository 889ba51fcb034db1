// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

/**
 * Base runtime exception for all address conversion failures.
 *
 * <p>
 * This sealed class is the root of the exception hierarchy, so every failure can be
 * caught with a single clause while {@link #kind()} still lets callers branch on the
 * failure without parsing messages.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * InjAddrException
 * ├── {@link AddressException} - a single address could not be converted
 * │   ├── {@link InvalidEvmAddressException}
 * │   ├── {@link UnrecognizedFormatException}
 * │   ├── {@link InvalidBech32Exception}
 * │   ├── {@link PrefixMismatchException}
 * │   ├── {@link InvalidAddressLengthException}
 * │   └── {@link InvalidPrefixException}
 * └── {@link BatchException} - a batch was rejected as a whole
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     converter.convertAddress(input);
 * } catch (PrefixMismatchException e) {
 *     // e.expectedPrefix(), e.actualPrefix()
 * } catch (InjAddrException e) {
 *     switch (e.kind()) { ... }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public abstract sealed class InjAddrException extends RuntimeException
        permits AddressException, BatchException {

    protected InjAddrException(final String message) {
        super(message);
    }

    protected InjAddrException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the failure classification.
     *
     * @return the error kind, never null
     */
    public abstract ErrorKind kind();
}
