// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.convert;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of a batch conversion.
 *
 * <p>Every input lands in exactly one of the two lists, and each list keeps input order.
 *
 * @param conversions successful conversions
 * @param errors      entries that failed, with their messages
 * @since 0.1.0
 */
@JsonPropertyOrder({"conversions", "total", "errors"})
public record BatchReport(
        @JsonProperty("conversions") List<ConversionResult> conversions,
        @JsonProperty("errors") List<BatchFailure> errors) {

    public BatchReport {
        conversions = List.copyOf(Objects.requireNonNull(conversions, "conversions"));
        errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    /** Number of successful conversions. */
    @JsonProperty("total")
    public int total() {
        return conversions.size();
    }

    /** Number of entries in the batch. */
    public int size() {
        return conversions.size() + errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
