// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.convert;

import java.util.List;

/**
 * Pre-configured converter profiles and well-known Cosmos prefixes.
 *
 * <p>
 * <strong>Example: custom target chain</strong>
 *
 * <pre>{@code
 * AddressConverter toOsmosis = new AddressConverter(ConverterProfile.of("osmo", 100));
 * }</pre>
 *
 * @see ConverterProfile
 */
public final class ConverterProfiles {
    private ConverterProfiles() {}

    /** Default batch ceiling. */
    public static final int DEFAULT_MAX_BATCH_SIZE = 50;

    /** Injective: target prefix {@code inj}, batches of up to 50 addresses. */
    public static final ConverterProfile INJECTIVE = ConverterProfile.of("inj", DEFAULT_MAX_BATCH_SIZE);

    /**
     * Prefixes of widely used Cosmos-SDK chains that share the 20-byte account format.
     * Informational only: conversion accepts any syntactically valid prefix.
     */
    public static final List<String> KNOWN_PREFIXES =
            List.of("cosmos", "osmo", "terra", "juno", "stars", "axelar", "celestia", "neutron");
}
