// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.types;

import java.util.Objects;

/**
 * The textual encoding an address string uses.
 *
 * <p>Closed set: an input is either EVM hex or bech32 under some prefix.
 *
 * @since 0.1.0
 */
public sealed interface AddressFormat permits AddressFormat.Evm, AddressFormat.Bech32 {

    /** {@code 0x}-prefixed hex. */
    record Evm() implements AddressFormat {
    }

    /**
     * Bech32 under a human-readable prefix.
     *
     * @param prefix the prefix before the {@code 1} separator
     */
    record Bech32(String prefix) implements AddressFormat {
        public Bech32 {
            Objects.requireNonNull(prefix, "prefix");
        }
    }
}
