// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.convert;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import sh.injaddr.core.error.AddressException;
import sh.injaddr.core.error.ErrorKind;

/**
 * A batch entry that failed to convert.
 *
 * @param address the entry as supplied
 * @param error   the failure message
 * @param kind    the failure classification
 */
@JsonPropertyOrder({"address", "error", "kind"})
public record BatchFailure(
        @JsonProperty("address") String address,
        @JsonProperty("error") String error,
        @JsonProperty("kind") ErrorKind kind) {

    public BatchFailure {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(kind, "kind");
    }

    static BatchFailure of(final String address, final AddressException e) {
        return new BatchFailure(address, e.getMessage(), e.kind());
    }
}
