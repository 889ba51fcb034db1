// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.convert;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

/**
 * Both representations of one account, plus where the input came from.
 *
 * <p>{@code injectiveAddress} and {@code evmAddress} always decode to the same 20 bytes.
 *
 * @param input             the address as supplied
 * @param injectiveAddress  bech32 under the converter's target prefix
 * @param evmAddress        lowercase {@code 0x} hex
 * @param sourceType        detected or asserted source format
 * @param sourceChainPrefix bech32 prefix of the input, null for EVM input
 * @since 0.1.0
 */
@JsonPropertyOrder({"input_address", "injective_address", "evm_address", "source_type", "source_chain_prefix"})
public record ConversionResult(
        @JsonProperty("input_address") String input,
        @JsonProperty("injective_address") String injectiveAddress,
        @JsonProperty("evm_address") String evmAddress,
        @JsonProperty("source_type") SourceType sourceType,
        @JsonProperty("source_chain_prefix") @Nullable String sourceChainPrefix) {

    public ConversionResult {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(injectiveAddress, "injectiveAddress");
        Objects.requireNonNull(evmAddress, "evmAddress");
        Objects.requireNonNull(sourceType, "sourceType");
    }
}
