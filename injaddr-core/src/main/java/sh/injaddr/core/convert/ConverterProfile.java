// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.convert;

import java.util.Objects;
import java.util.regex.Pattern;

import sh.injaddr.primitives.Bech32;

/**
 * Settings for an {@link AddressConverter}.
 *
 * <p>
 * <strong>Field constraints:</strong>
 * <ul>
 * <li>{@code targetPrefix} - one or more lowercase letters, at most {@value #MAX_PREFIX_LENGTH}
 * characters so a 20-byte address stays within the bech32 length limit</li>
 * <li>{@code maxBatchSize} - must be positive</li>
 * </ul>
 *
 * @param targetPrefix the bech32 prefix every conversion produces ({@code inj} for Injective)
 * @param maxBatchSize the largest batch {@link AddressConverter#convertBatch(java.util.List)} accepts
 *
 * @see ConverterProfiles
 */
public record ConverterProfile(String targetPrefix, int maxBatchSize) {

    /** Separator, 32 data characters and 6 checksum characters of a 20-byte address. */
    private static final int ADDRESS_DATA_LENGTH = 39;

    public static final int MAX_PREFIX_LENGTH = Bech32.MAX_LENGTH - ADDRESS_DATA_LENGTH;

    private static final Pattern TARGET_PREFIX = Pattern.compile("^[a-z]+$");

    /**
     * Validates all fields meet their constraints.
     *
     * @throws IllegalArgumentException if the prefix is malformed or maxBatchSize is not positive
     * @throws NullPointerException if targetPrefix is null
     */
    public ConverterProfile {
        Objects.requireNonNull(targetPrefix, "targetPrefix cannot be null");
        if (!TARGET_PREFIX.matcher(targetPrefix).matches()) {
            throw new IllegalArgumentException("targetPrefix must be lowercase letters, got: '" + targetPrefix + "'");
        }
        if (targetPrefix.length() > MAX_PREFIX_LENGTH) {
            throw new IllegalArgumentException(
                    "targetPrefix must be at most " + MAX_PREFIX_LENGTH + " characters, got: " + targetPrefix.length());
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive, got: " + maxBatchSize);
        }
    }

    public static ConverterProfile of(final String targetPrefix, final int maxBatchSize) {
        return new ConverterProfile(targetPrefix, maxBatchSize);
    }

    /**
     * Returns a copy with a different batch ceiling.
     *
     * @param maxBatchSize the new ceiling
     * @return a new profile
     */
    public ConverterProfile withMaxBatchSize(final int maxBatchSize) {
        return new ConverterProfile(targetPrefix, maxBatchSize);
    }
}
