// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.primitives;

/**
 * Regroups a sequence of unsigned values from one bit width into another.
 *
 * <p>Bits are consumed and produced most-significant-bit first. The usual pairs are
 * 8 to 5 (bytes into bech32 symbols, padded) and 5 to 8 (bech32 symbols back into
 * bytes, unpadded).
 *
 * <pre>{@code
 * byte[] symbols = BitGroups.convert(addressBytes, 8, 5, true);
 * byte[] bytes = BitGroups.convert(symbols, 5, 8, false);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class BitGroups {

    private BitGroups() {
        // Utility class
    }

    /**
     * Regroups {@code data} from {@code fromBits}-wide values into {@code toBits}-wide values.
     *
     * <p>Each input byte is read as an unsigned value. With {@code pad} set, a trailing
     * partial group is completed with zero bits. Without it, the leftover bits must be
     * fewer than {@code fromBits} and all zero.
     *
     * @param data     the input values
     * @param fromBits width of each input value, 1 to 8
     * @param toBits   width of each output value, 1 to 8
     * @param pad      whether to zero-pad a trailing partial group
     * @return the regrouped values, one per byte
     * @throws BitConversionException if an input value does not fit in {@code fromBits},
     *                                or if {@code pad} is false and the leftover bits are invalid
     * @throws IllegalArgumentException if {@code data} is null or a width is out of range
     */
    public static byte[] convert(final byte[] data, final int fromBits, final int toBits, final boolean pad) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        checkWidth("fromBits", fromBits);
        checkWidth("toBits", toBits);

        final int maxValue = (1 << toBits) - 1;
        final int maxAcc = (1 << (fromBits + toBits - 1)) - 1;
        final int capacity = (data.length * fromBits + toBits - 1) / toBits;
        final byte[] out = new byte[capacity];

        int acc = 0;
        int bits = 0;
        int pos = 0;
        for (int i = 0; i < data.length; i++) {
            final int value = data[i] & 0xFF;
            if ((value >>> fromBits) != 0) {
                throw new BitConversionException(
                        "value " + value + " at index " + i + " exceeds " + fromBits + " bits");
            }
            acc = ((acc << fromBits) | value) & maxAcc;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out[pos++] = (byte) ((acc >>> bits) & maxValue);
            }
        }

        if (pad) {
            if (bits > 0) {
                out[pos++] = (byte) ((acc << (toBits - bits)) & maxValue);
            }
        } else if (bits >= fromBits) {
            throw new BitConversionException("excess padding: " + bits + " leftover bits");
        } else if (((acc << (toBits - bits)) & maxValue) != 0) {
            throw new BitConversionException("non-zero padding bits");
        }

        if (pos == out.length) {
            return out;
        }
        final byte[] trimmed = new byte[pos];
        System.arraycopy(out, 0, trimmed, 0, pos);
        return trimmed;
    }

    private static void checkWidth(final String name, final int width) {
        if (width < 1 || width > 8) {
            throw new IllegalArgumentException(name + " must be between 1 and 8, got: " + width);
        }
    }
}
