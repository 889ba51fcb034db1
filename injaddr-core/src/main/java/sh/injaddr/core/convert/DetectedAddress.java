// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.convert;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.injaddr.core.types.AddressFormat;

/**
 * Outcome of format detection.
 *
 * @param sourceType  the detected source
 * @param chainPrefix the bech32 prefix, or null for EVM input
 */
public record DetectedAddress(SourceType sourceType, @Nullable String chainPrefix) {

    public DetectedAddress {
        Objects.requireNonNull(sourceType, "sourceType");
        if ((sourceType == SourceType.EVM) != (chainPrefix == null)) {
            throw new IllegalArgumentException("chainPrefix must be null exactly when sourceType is EVM");
        }
    }

    /** The encoding of the detected input. */
    public AddressFormat format() {
        return chainPrefix == null ? new AddressFormat.Evm() : new AddressFormat.Bech32(chainPrefix);
    }
}
