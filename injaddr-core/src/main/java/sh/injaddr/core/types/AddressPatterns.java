// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for recognising address shapes.
 *
 * <p>These are shape heuristics used for format detection, not full validation: a string
 * matching {@link #BECH32_SHAPE} may still fail checksum verification.
 *
 * @since 0.1.0
 */
public final class AddressPatterns {

    /** {@code 0x} followed by exactly 40 hex digits, any case. */
    public static final Pattern EVM = fixedLengthHex(CanonicalAddress.LENGTH);

    /**
     * Lowercase letter prefix, separator, then at least 38 lowercase alphanumerics.
     * <p>
     * The lower bound is loose: a 20-byte payload always yields 38 characters after the
     * separator (32 data plus 6 checksum), but longer payloads also match.
     */
    public static final Pattern BECH32_SHAPE = Pattern.compile("^[a-z]+1[a-z0-9]{38,}$");

    /** Prefixes accepted when encoding to a caller-chosen chain. */
    public static final Pattern PREFIX = Pattern.compile("^[a-z0-9]+$");

    private AddressPatterns() {}

    /**
     * Creates a pattern matching {@code 0x}-prefixed hex strings of exactly {@code byteLength} bytes.
     *
     * @param byteLength the number of bytes the hex string must represent
     * @return a compiled pattern
     */
    public static Pattern fixedLengthHex(int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + byteLength * 2 + "}$");
    }

    public static boolean isEvm(String value) {
        return value != null && EVM.matcher(value).matches();
    }

    public static boolean isBech32Shaped(String value) {
        return value != null && BECH32_SHAPE.matcher(value).matches();
    }

    public static boolean isValidPrefix(String prefix) {
        return prefix != null && PREFIX.matcher(prefix).matches();
    }
}
