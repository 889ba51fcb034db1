// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.primitives;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Bech32 encoding as defined by BIP-173.
 *
 * <p>Works on 5-bit symbols: callers regroup raw bytes with {@link BitGroups} before
 * encoding and after decoding. Only the original bech32 checksum constant is supported.
 *
 * <p>All methods are stateless and safe to call from any thread.
 *
 * @since 0.1.0
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0173.mediawiki">BIP-173</a>
 */
public final class Bech32 {

    /** Separator between the human-readable prefix and the data part. */
    public static final char SEPARATOR = '1';

    /** Maximum total length of a bech32 string. */
    public static final int MAX_LENGTH = 90;

    static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";

    private static final int CHECKSUM_LENGTH = 6;
    private static final int[] GENERATORS = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};
    private static final byte[] CHARSET_REV = new byte[128];

    static {
        Arrays.fill(CHARSET_REV, (byte) -1);
        for (int i = 0; i < CHARSET.length(); i++) {
            final char c = CHARSET.charAt(i);
            CHARSET_REV[c] = (byte) i;
            CHARSET_REV[Character.toUpperCase(c)] = (byte) i;
        }
    }

    private Bech32() {
        // Utility class
    }

    /**
     * A decoded bech32 string.
     *
     * @param prefix the lowercase human-readable part
     * @param data   the 5-bit data symbols, checksum excluded
     */
    public record Decoded(String prefix, byte[] data) {

        public Decoded {
            Objects.requireNonNull(prefix, "prefix");
            Objects.requireNonNull(data, "data");
            data = data.clone();
        }

        @Override
        public byte[] data() {
            return data.clone();
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof Decoded other && prefix.equals(other.prefix) && Arrays.equals(data, other.data);
        }

        @Override
        public int hashCode() {
            return 31 * prefix.hashCode() + Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return "Decoded[prefix=" + prefix + ", symbols=" + data.length + "]";
        }
    }

    /**
     * Encodes a prefix and 5-bit data symbols as {@code prefix + "1" + data + checksum}.
     *
     * @param prefix the human-readable part; emitted in lowercase
     * @param data   5-bit symbols, each 0 to 31
     * @return the bech32 string
     * @throws Bech32Exception if the prefix is empty, mixes case or holds characters
     *                         outside ASCII 33..126, if a symbol exceeds 5 bits, or if
     *                         the result would exceed {@value #MAX_LENGTH} characters
     */
    public static String encode(final String prefix, final byte[] data) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(data, "data");
        final String hrp = validatePrefix(prefix);

        final int length = hrp.length() + 1 + data.length + CHECKSUM_LENGTH;
        if (length > MAX_LENGTH) {
            throw new Bech32Exception(Bech32Exception.Reason.TOO_LONG,
                    "bech32 string would be " + length + " characters, maximum is " + MAX_LENGTH);
        }
        for (int i = 0; i < data.length; i++) {
            if ((data[i] & 0xFF) > 31) {
                throw new Bech32Exception(Bech32Exception.Reason.INVALID_DATA,
                        "data value " + (data[i] & 0xFF) + " at index " + i + " exceeds 5 bits");
            }
        }

        final byte[] checksum = createChecksum(hrp, data);
        final StringBuilder sb = new StringBuilder(length);
        sb.append(hrp).append(SEPARATOR);
        for (final byte b : data) {
            sb.append(CHARSET.charAt(b));
        }
        for (final byte b : checksum) {
            sb.append(CHARSET.charAt(b));
        }
        return sb.toString();
    }

    /**
     * Decodes a bech32 string and verifies its checksum.
     *
     * <p>The separator is the last {@code 1} in the string. All-uppercase input is accepted;
     * the returned prefix is always lowercase.
     *
     * @param bech32 the string to decode
     * @return the prefix and data symbols
     * @throws Bech32Exception if the string is too long, mixes case, has no separator or an
     *                         empty prefix, holds characters outside the charset, is too
     *                         short to carry a checksum, or fails checksum verification
     */
    public static Decoded decode(final String bech32) {
        Objects.requireNonNull(bech32, "bech32");
        if (bech32.length() > MAX_LENGTH) {
            throw new Bech32Exception(Bech32Exception.Reason.TOO_LONG,
                    "bech32 string is " + bech32.length() + " characters, maximum is " + MAX_LENGTH);
        }

        boolean lower = false;
        boolean upper = false;
        for (int i = 0; i < bech32.length(); i++) {
            final char c = bech32.charAt(i);
            if (c < 33 || c > 126) {
                throw new Bech32Exception(Bech32Exception.Reason.INVALID_CHARACTER,
                        "invalid character at position " + i + " in '" + bech32 + "'");
            }
            lower |= c >= 'a' && c <= 'z';
            upper |= c >= 'A' && c <= 'Z';
        }
        if (lower && upper) {
            throw new Bech32Exception(Bech32Exception.Reason.MIXED_CASE, "mixed case in '" + bech32 + "'");
        }

        final int pos = bech32.lastIndexOf(SEPARATOR);
        if (pos < 0) {
            throw new Bech32Exception(Bech32Exception.Reason.MISSING_SEPARATOR,
                    "missing separator '1' in '" + bech32 + "'");
        }
        if (pos == 0) {
            throw new Bech32Exception(Bech32Exception.Reason.EMPTY_PREFIX, "empty prefix in '" + bech32 + "'");
        }
        final int dataLength = bech32.length() - pos - 1;
        if (dataLength < CHECKSUM_LENGTH) {
            throw new Bech32Exception(Bech32Exception.Reason.TOO_SHORT,
                    "data part shorter than checksum in '" + bech32 + "'");
        }

        final String hrp = bech32.substring(0, pos).toLowerCase(Locale.ROOT);
        final byte[] values = new byte[dataLength];
        for (int i = 0; i < dataLength; i++) {
            final char c = bech32.charAt(pos + 1 + i);
            final byte v = CHARSET_REV[c];
            if (v == -1) {
                throw new Bech32Exception(Bech32Exception.Reason.INVALID_CHARACTER,
                        "invalid data character '" + c + "' at position " + (pos + 1 + i) + " in '" + bech32 + "'");
            }
            values[i] = v;
        }

        if (!verifyChecksum(hrp, values)) {
            throw new Bech32Exception(Bech32Exception.Reason.INVALID_CHECKSUM,
                    "invalid checksum in '" + bech32 + "'");
        }
        return new Decoded(hrp, Arrays.copyOfRange(values, 0, dataLength - CHECKSUM_LENGTH));
    }

    /**
     * Returns {@code true} if {@code prefix} is usable as a human-readable part.
     *
     * @param prefix the candidate prefix, may be null
     * @return whether {@link #encode} would accept it
     */
    public static boolean isValidPrefix(final String prefix) {
        if (prefix == null) {
            return false;
        }
        try {
            validatePrefix(prefix);
            return true;
        } catch (Bech32Exception e) {
            return false;
        }
    }

    private static String validatePrefix(final String prefix) {
        if (prefix.isEmpty()) {
            throw new Bech32Exception(Bech32Exception.Reason.EMPTY_PREFIX, "prefix cannot be empty");
        }
        boolean lower = false;
        boolean upper = false;
        for (int i = 0; i < prefix.length(); i++) {
            final char c = prefix.charAt(i);
            if (c < 33 || c > 126) {
                throw new Bech32Exception(Bech32Exception.Reason.INVALID_PREFIX,
                        "invalid prefix character at position " + i + " in '" + prefix + "'");
            }
            lower |= c >= 'a' && c <= 'z';
            upper |= c >= 'A' && c <= 'Z';
        }
        if (lower && upper) {
            throw new Bech32Exception(Bech32Exception.Reason.MIXED_CASE, "mixed case in prefix '" + prefix + "'");
        }
        return prefix.toLowerCase(Locale.ROOT);
    }

    private static int polymod(final byte[] values) {
        int chk = 1;
        for (final byte v : values) {
            final int top = chk >>> 25;
            chk = ((chk & 0x1ffffff) << 5) ^ (v & 0xff);
            for (int i = 0; i < 5; i++) {
                if (((top >>> i) & 1) == 1) {
                    chk ^= GENERATORS[i];
                }
            }
        }
        return chk;
    }

    private static byte[] expandPrefix(final String hrp) {
        final int len = hrp.length();
        final byte[] ret = new byte[len * 2 + 1];
        for (int i = 0; i < len; i++) {
            final char c = hrp.charAt(i);
            ret[i] = (byte) (c >>> 5);
            ret[len + 1 + i] = (byte) (c & 0x1f);
        }
        return ret;
    }

    private static boolean verifyChecksum(final String hrp, final byte[] values) {
        final byte[] expanded = expandPrefix(hrp);
        final byte[] combined = new byte[expanded.length + values.length];
        System.arraycopy(expanded, 0, combined, 0, expanded.length);
        System.arraycopy(values, 0, combined, expanded.length, values.length);
        return polymod(combined) == 1;
    }

    private static byte[] createChecksum(final String hrp, final byte[] data) {
        final byte[] expanded = expandPrefix(hrp);
        final byte[] values = new byte[expanded.length + data.length + CHECKSUM_LENGTH];
        System.arraycopy(expanded, 0, values, 0, expanded.length);
        System.arraycopy(data, 0, values, expanded.length, data.length);
        final int mod = polymod(values) ^ 1;
        final byte[] ret = new byte[CHECKSUM_LENGTH];
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            ret[i] = (byte) ((mod >>> (5 * (5 - i))) & 31);
        }
        return ret;
    }
}
