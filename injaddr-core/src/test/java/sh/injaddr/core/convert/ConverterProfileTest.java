// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.convert;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConverterProfileTest {

    @Test
    void injectiveDefaults() {
        assertEquals("inj", ConverterProfiles.INJECTIVE.targetPrefix());
        assertEquals(50, ConverterProfiles.INJECTIVE.maxBatchSize());
        assertSame(ConverterProfiles.INJECTIVE, AddressConverter.injective().profile());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Inj", "in j", "abc2", "inj1"})
    void rejectsMalformedTargetPrefix(String prefix) {
        assertThrows(IllegalArgumentException.class, () -> ConverterProfile.of(prefix, 10));
    }

    @Test
    void rejectsPrefixTooLongForAddresses() {
        assertThrows(IllegalArgumentException.class, () -> ConverterProfile.of("a".repeat(52), 10));
        assertEquals(51, ConverterProfile.of("a".repeat(51), 10).targetPrefix().length());
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> ConverterProfile.of("inj", 0));
        assertThrows(IllegalArgumentException.class, () -> ConverterProfiles.INJECTIVE.withMaxBatchSize(-1));
    }

    @Test
    void rejectsNullPrefix() {
        assertThrows(NullPointerException.class, () -> ConverterProfile.of(null, 10));
    }

    @Test
    void withMaxBatchSizeKeepsPrefix() {
        ConverterProfile profile = ConverterProfiles.INJECTIVE.withMaxBatchSize(200);
        assertEquals("inj", profile.targetPrefix());
        assertEquals(200, profile.maxBatchSize());
    }

    @Test
    void detectedAddressRequiresPrefixForBech32Only() {
        assertThrows(IllegalArgumentException.class, () -> new DetectedAddress(SourceType.EVM, "inj"));
        assertThrows(IllegalArgumentException.class, () -> new DetectedAddress(SourceType.COSMOS, null));
    }
}
