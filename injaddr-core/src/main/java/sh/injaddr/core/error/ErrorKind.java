// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

/**
 * Classification of conversion failures.
 *
 * <p>Every failure is a local input-validation failure: none is retryable, and none
 * leaves state behind.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
    /** Not {@code 0x} followed by 40 hex digits. */
    INVALID_EVM_ADDRESS,
    /** Matches neither the EVM nor the bech32 address shape. */
    UNRECOGNIZED_FORMAT,
    /** Bech32 checksum does not verify. */
    INVALID_BECH32_CHECKSUM,
    /** Bech32 string holds characters outside the charset or mixes case. */
    INVALID_BECH32_CHARSET,
    /** Any other bech32 structural failure: separator, length bounds or padding bits. */
    INVALID_BECH32,
    /** Decoded prefix differs from the required one. */
    PREFIX_MISMATCH,
    /** Decoded payload is not exactly 20 bytes. */
    INVALID_ADDRESS_LENGTH,
    /** Requested encode prefix is empty or holds illegal characters. */
    INVALID_PREFIX,
    /** Batch holds more entries than the configured ceiling. */
    BATCH_TOO_LARGE,
    /** Batch holds no entries. */
    EMPTY_BATCH
}
