// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.types;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.injaddr.core.error.InvalidEvmAddressException;
import sh.injaddr.primitives.Hex;

/**
 * Hex-encoded 20-byte EVM address.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes), any case</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so two addresses differing only in case are equal.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {

    public Address {
        Objects.requireNonNull(value, "address");
        if (!AddressPatterns.isEvm(value)) {
            throw new InvalidEvmAddressException(value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Decodes this address to a fresh 20-byte array.
     *
     * @return 20-byte array representation
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != CanonicalAddress.LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + CanonicalAddress.LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
