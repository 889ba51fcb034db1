// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.convert;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a converted address came from.
 *
 * @since 0.1.0
 */
public enum SourceType {
    /** EVM hex ({@code 0x...}). */
    EVM("evm"),
    /** Bech32 under the converter's own target prefix ({@code inj1...} by default). */
    INJECTIVE("injective"),
    /** Bech32 under any other prefix ({@code cosmos1...}, {@code osmo1...}). */
    COSMOS("cosmos");

    private final String wireName;

    SourceType(final String wireName) {
        this.wireName = wireName;
    }

    /** Lowercase name used on the wire. */
    @JsonValue
    public String wireName() {
        return wireName;
    }
}
