// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.types;

import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.injaddr.core.error.InvalidAddressLengthException;
import sh.injaddr.core.error.InvalidBech32Exception;
import sh.injaddr.core.error.InvalidPrefixException;
import sh.injaddr.core.error.PrefixMismatchException;
import sh.injaddr.primitives.Bech32;
import sh.injaddr.primitives.Bech32Exception;
import sh.injaddr.primitives.BitConversionException;
import sh.injaddr.primitives.BitGroups;
import sh.injaddr.primitives.Hex;

/**
 * The 20 raw bytes shared by every textual form of one account.
 *
 * <p>Instances are immutable and always hold exactly {@value #LENGTH} bytes; a decode
 * either yields a complete address or throws. Byte arrays are copied on the way in and out.
 *
 * <pre>{@code
 * CanonicalAddress account = CanonicalAddress.fromEvm("0xAF79152AC5dF276D9A8e1E2E22822f9713474902");
 * account.toBech32("inj");   // inj14au322k9munkmx5wrchz9q30juf5wjgz2cfqku
 * account.toEvm().value();   // 0xaf79152ac5df276d9a8e1e2e22822f9713474902
 * }</pre>
 *
 * @since 0.1.0
 */
public final class CanonicalAddress {

    /** Byte length of an account address. */
    public static final int LENGTH = 20;

    private final byte[] bytes;

    private CanonicalAddress(final byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps a copy of {@code bytes}.
     *
     * @param bytes exactly 20 bytes
     * @return the address
     * @throws IllegalArgumentException if {@code bytes} is null or not 20 bytes long
     */
    public static CanonicalAddress fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("CanonicalAddress must be exactly " + LENGTH + " bytes");
        }
        return new CanonicalAddress(bytes.clone());
    }

    /**
     * Parses an EVM hex address.
     *
     * @param hex {@code 0x} followed by 40 hex digits, any case
     * @return the address
     * @throws sh.injaddr.core.error.InvalidEvmAddressException if {@code hex} has the wrong shape
     */
    public static CanonicalAddress fromEvm(final String hex) {
        return new CanonicalAddress(new Address(hex).toBytes());
    }

    /**
     * Decodes a bech32 address under any prefix.
     *
     * @param bech32 the address
     * @return the address
     * @throws InvalidBech32Exception if decoding fails
     * @throws InvalidAddressLengthException if the payload is not 20 bytes
     */
    public static CanonicalAddress fromBech32(final String bech32) {
        return fromBech32(bech32, null);
    }

    /**
     * Decodes a bech32 address, optionally requiring a specific prefix.
     *
     * <p>Checks run in order: structure and checksum, then prefix, then payload length.
     *
     * @param bech32         the address
     * @param requiredPrefix the prefix the address must carry, or null for any
     * @return the address
     * @throws InvalidBech32Exception if decoding fails
     * @throws PrefixMismatchException if the prefix differs from {@code requiredPrefix}
     * @throws InvalidAddressLengthException if the payload is not 20 bytes
     */
    public static CanonicalAddress fromBech32(final String bech32, final @Nullable String requiredPrefix) {
        Objects.requireNonNull(bech32, "bech32");
        final Bech32.Decoded decoded;
        try {
            decoded = Bech32.decode(bech32);
        } catch (Bech32Exception e) {
            throw new InvalidBech32Exception(bech32, e);
        }

        if (requiredPrefix != null && !decoded.prefix().equals(requiredPrefix)) {
            throw new PrefixMismatchException(bech32, requiredPrefix, decoded.prefix());
        }

        final byte[] payload;
        try {
            payload = BitGroups.convert(decoded.data(), 5, 8, false);
        } catch (BitConversionException e) {
            throw new InvalidBech32Exception(bech32, e);
        }
        if (payload.length != LENGTH) {
            throw new InvalidAddressLengthException(bech32, LENGTH, payload.length);
        }
        return new CanonicalAddress(payload);
    }

    /**
     * Encodes this address as bech32 under {@code prefix}.
     *
     * @param prefix one or more lowercase letters or digits
     * @return the bech32 string
     * @throws InvalidPrefixException if the prefix is empty, holds other characters, or is
     *                                too long for the bech32 length limit
     */
    public String toBech32(final String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (!AddressPatterns.isValidPrefix(prefix)) {
            throw new InvalidPrefixException(prefix);
        }
        try {
            return Bech32.encode(prefix, BitGroups.convert(bytes, 8, 5, true));
        } catch (Bech32Exception e) {
            throw new InvalidPrefixException(prefix, e);
        }
    }

    /**
     * Formats this address as lowercase EVM hex.
     *
     * @return the EVM address
     */
    public Address toEvm() {
        return Address.fromBytes(bytes);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof CanonicalAddress other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "CanonicalAddress[" + Hex.encode(bytes) + "]";
    }
}
