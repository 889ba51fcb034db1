// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BitGroupsTest {

    @Test
    void regroupsBytesIntoPaddedFiveBitSymbols() {
        // 0xff = 11111111 -> 11111 111(00)
        assertArrayEquals(new byte[] {31, 28}, BitGroups.convert(new byte[] {(byte) 0xFF}, 8, 5, true));
        // 0x00 0x01 -> 00000 00000 00000 1(0000)
        assertArrayEquals(new byte[] {0, 0, 0, 16}, BitGroups.convert(new byte[] {0x00, 0x01}, 8, 5, true));
    }

    @Test
    void twentyBytesBecomeThirtyTwoSymbols() {
        byte[] bytes = new byte[20];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) (i * 13 + 7);
        }

        byte[] symbols = BitGroups.convert(bytes, 8, 5, true);

        assertEquals(32, symbols.length);
        for (byte s : symbols) {
            assertTrue(s >= 0 && s < 32);
        }
        assertArrayEquals(bytes, BitGroups.convert(symbols, 5, 8, false));
    }

    @Test
    void emptyInputProducesEmptyOutput() {
        assertEquals(0, BitGroups.convert(new byte[0], 8, 5, true).length);
        assertEquals(0, BitGroups.convert(new byte[0], 5, 8, false).length);
    }

    @Test
    void rejectsValueWiderThanSourceWidth() {
        BitConversionException ex = assertThrows(BitConversionException.class,
                () -> BitGroups.convert(new byte[] {3, 32}, 5, 8, false));
        assertTrue(ex.getMessage().contains("index 1"));
    }

    @Test
    void rejectsNonZeroPaddingWithoutPad() {
        // 11111 11111 -> 11111111 + leftover 11 which is non-zero
        assertThrows(BitConversionException.class, () -> BitGroups.convert(new byte[] {31, 31}, 5, 8, false));
    }

    @Test
    void rejectsExcessPaddingWithoutPad() {
        // two symbols of zeros leave 10 bits: one byte plus 2 zero bits, acceptable
        assertArrayEquals(new byte[] {0}, BitGroups.convert(new byte[] {0, 0}, 5, 8, false));
        // six symbols hold 30 bits: three bytes plus 6 leftover bits, more than a whole symbol
        assertThrows(BitConversionException.class, () -> BitGroups.convert(new byte[] {0, 0, 0, 0, 0, 0}, 5, 8, false));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 9, -1})
    void rejectsUnsupportedWidths(int width) {
        assertThrows(IllegalArgumentException.class, () -> BitGroups.convert(new byte[] {1}, width, 5, true));
        assertThrows(IllegalArgumentException.class, () -> BitGroups.convert(new byte[] {1}, 8, width, true));
    }

    @Test
    void rejectsNullData() {
        assertThrows(IllegalArgumentException.class, () -> BitGroups.convert(null, 8, 5, true));
    }
}
