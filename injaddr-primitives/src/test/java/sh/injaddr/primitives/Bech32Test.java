// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class Bech32Test {

    private static final byte[] ADDRESS_BYTES = Hex.decode("0xaf79152ac5df276d9a8e1e2e22822f9713474902");

    @Test
    void encodesKnownInjectiveAddress() {
        String encoded = Bech32.encode("inj", BitGroups.convert(ADDRESS_BYTES, 8, 5, true));
        assertEquals("inj14au322k9munkmx5wrchz9q30juf5wjgz2cfqku", encoded);
    }

    @Test
    void sameBytesUnderDifferentPrefixes() {
        byte[] symbols = BitGroups.convert(ADDRESS_BYTES, 8, 5, true);
        assertEquals("cosmos14au322k9munkmx5wrchz9q30juf5wjgzq37yyy", Bech32.encode("cosmos", symbols));
        assertEquals("osmo14au322k9munkmx5wrchz9q30juf5wjgzg2d5jk", Bech32.encode("osmo", symbols));
    }

    @Test
    void decodesKnownAddress() {
        Bech32.Decoded decoded = Bech32.decode("inj14au322k9munkmx5wrchz9q30juf5wjgz2cfqku");

        assertEquals("inj", decoded.prefix());
        assertArrayEquals(ADDRESS_BYTES, BitGroups.convert(decoded.data(), 5, 8, false));
    }

    @Test
    void decodesFullCharsetInOrder() {
        Bech32.Decoded decoded = Bech32.decode("abcdef1qpzry9x8gf2tvdw0s3jn54khce6mua7lmqqqxw");

        assertEquals("abcdef", decoded.prefix());
        byte[] data = decoded.data();
        assertEquals(32, data.length);
        for (int i = 0; i < data.length; i++) {
            assertEquals(i, data[i]);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "A12UEL5L",
        "a12uel5l",
        "split1checkupstagehandshakeupstreamerranterredcaperred2y9e3w",
        "?1ezyfcl",
        "an83characterlonghumanreadablepartthatcontainsthenumber1andtheexcludedcharactersbio1tt5tgs"
    })
    void acceptsReferenceVectors(String input) {
        Bech32.Decoded decoded = Bech32.decode(input);
        assertEquals(input.substring(0, input.lastIndexOf('1')).toLowerCase(), decoded.prefix());
    }

    @ParameterizedTest
    @CsvSource({
        "pzry9x0s0muk, MISSING_SEPARATOR",
        "1pzry9x0s0muk, EMPTY_PREFIX",
        "10a06t8, EMPTY_PREFIX",
        "x1b4n0q5v, INVALID_CHARACTER",
        "li1dgmt3, TOO_SHORT",
        "A1G7SGD8, INVALID_CHECKSUM",
        "A12uEL5L, MIXED_CASE",
        "inj14au322k9munkmx5wrchz9q30juf5wjgz2cfqkv, INVALID_CHECKSUM"
    })
    void rejectsMalformedStrings(String input, Bech32Exception.Reason reason) {
        Bech32Exception ex = assertThrows(Bech32Exception.class, () -> Bech32.decode(input));
        assertEquals(reason, ex.reason());
    }

    @Test
    void rejectsControlCharacters() {
        Bech32Exception ex = assertThrows(Bech32Exception.class, () -> Bech32.decode("a1\u007fqqqqqq"));
        assertEquals(Bech32Exception.Reason.INVALID_CHARACTER, ex.reason());
    }

    @Test
    void rejectsOverlongString() {
        String tooLong = "an84characterslonghumanreadablepartthatcontainsthenumber1andtheexcludedcharactersbio1569pvx";
        Bech32Exception ex = assertThrows(Bech32Exception.class, () -> Bech32.decode(tooLong));
        assertEquals(Bech32Exception.Reason.TOO_LONG, ex.reason());
    }

    @Test
    void encodeLowercasesUppercasePrefix() {
        byte[] symbols = BitGroups.convert(ADDRESS_BYTES, 8, 5, true);
        assertEquals(Bech32.encode("inj", symbols), Bech32.encode("INJ", symbols));
    }

    @Test
    void encodeRejectsInvalidPrefixes() {
        byte[] symbols = new byte[] {0, 1, 2};
        assertEquals(Bech32Exception.Reason.EMPTY_PREFIX,
                assertThrows(Bech32Exception.class, () -> Bech32.encode("", symbols)).reason());
        assertEquals(Bech32Exception.Reason.INVALID_PREFIX,
                assertThrows(Bech32Exception.class, () -> Bech32.encode("co smos", symbols)).reason());
        assertEquals(Bech32Exception.Reason.MIXED_CASE,
                assertThrows(Bech32Exception.class, () -> Bech32.encode("Cosmos", symbols)).reason());
    }

    @Test
    void encodeRejectsWideSymbols() {
        Bech32Exception ex = assertThrows(Bech32Exception.class, () -> Bech32.encode("inj", new byte[] {1, 32}));
        assertEquals(Bech32Exception.Reason.INVALID_DATA, ex.reason());
    }

    @Test
    void encodeRejectsResultLongerThanLimit() {
        // 32-byte payload is 52 symbols, so a 32-character prefix pushes the total to 91
        byte[] symbols = BitGroups.convert(new byte[32], 8, 5, true);
        String prefix = "a".repeat(32);
        Bech32Exception ex = assertThrows(Bech32Exception.class, () -> Bech32.encode(prefix, symbols));
        assertEquals(Bech32Exception.Reason.TOO_LONG, ex.reason());
        assertEquals(90, Bech32.encode(prefix.substring(1), symbols).length());
    }

    @Test
    void validPrefixCheck() {
        assertTrue(Bech32.isValidPrefix("cosmos"));
        assertTrue(Bech32.isValidPrefix("OSMO"));
        assertFalse(Bech32.isValidPrefix(""));
        assertFalse(Bech32.isValidPrefix(null));
        assertFalse(Bech32.isValidPrefix("inj\n"));
    }

    @Test
    void decodedCopiesItsData() {
        byte[] data = new byte[] {1, 2, 3};
        Bech32.Decoded decoded = new Bech32.Decoded("inj", data);
        data[0] = 9;
        decoded.data()[1] = 9;

        assertArrayEquals(new byte[] {1, 2, 3}, decoded.data());
        assertEquals(new Bech32.Decoded("inj", new byte[] {1, 2, 3}), decoded);
    }
}
