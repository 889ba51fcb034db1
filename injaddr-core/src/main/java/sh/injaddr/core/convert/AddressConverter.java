// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.injaddr.core.DebugLogger;
import sh.injaddr.core.LogFormatter;
import sh.injaddr.core.LogSanitizer;
import sh.injaddr.core.error.AddressException;
import sh.injaddr.core.error.BatchException;
import sh.injaddr.core.error.InvalidAddressLengthException;
import sh.injaddr.core.error.InvalidBech32Exception;
import sh.injaddr.core.error.InvalidEvmAddressException;
import sh.injaddr.core.error.InvalidPrefixException;
import sh.injaddr.core.error.PrefixMismatchException;
import sh.injaddr.core.error.UnrecognizedFormatException;
import sh.injaddr.core.types.Address;
import sh.injaddr.core.types.AddressFormat;
import sh.injaddr.core.types.AddressPatterns;
import sh.injaddr.core.types.CanonicalAddress;

/**
 * Converts account addresses between EVM hex and bech32 under any Cosmos-SDK prefix.
 *
 * <p>
 * Every conversion passes through the 20-byte {@link CanonicalAddress}: the input is
 * decoded once, and every output is encoded from those bytes. The converter's
 * {@linkplain ConverterProfile#targetPrefix() target prefix} ({@code inj} by default)
 * is the bech32 form every result carries.
 *
 * <p>
 * <strong>Detection:</strong> an input matching {@code ^0x[0-9a-fA-F]{40}$} is EVM; otherwise
 * an input matching {@code ^[a-z]+1[a-z0-9]{38,}$} is bech32, reported as
 * {@link SourceType#INJECTIVE} when its prefix equals the target prefix and
 * {@link SourceType#COSMOS} otherwise. Anything else is rejected.
 *
 * <p>
 * <strong>Errors:</strong> single-address methods throw the first failure as an
 * {@link AddressException} subclass. Batch methods reject an empty or oversized batch
 * with {@link BatchException} and otherwise never throw for a bad entry; the entry is
 * reported in {@link BatchReport#errors()} instead.
 *
 * <p>
 * <strong>Thread safety:</strong> instances are immutable and hold no per-call state, so
 * one converter may be shared freely across threads.
 *
 * <pre>{@code
 * AddressConverter converter = AddressConverter.injective();
 *
 * ConversionResult result = converter.convertAddress("cosmos14au322k9munkmx5wrchz9q30juf5wjgzq37yyy");
 * result.injectiveAddress(); // inj14au322k9munkmx5wrchz9q30juf5wjgz2cfqku
 * result.evmAddress();       // 0xaf79152ac5df276d9a8e1e2e22822f9713474902
 *
 * BatchReport report = converter.convertBatch(List.of("0xAF79152AC5dF276D9A8e1E2E22822f9713474902", "garbage"));
 * report.total();            // 1
 * }</pre>
 *
 * @since 0.1.0
 */
public final class AddressConverter {

    private static final Logger LOG = LoggerFactory.getLogger(AddressConverter.class);

    private static final AddressConverter INJECTIVE = new AddressConverter(ConverterProfiles.INJECTIVE);

    private final ConverterProfile profile;

    public AddressConverter(final ConverterProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    /**
     * Returns the shared converter for the {@link ConverterProfiles#INJECTIVE} profile.
     *
     * @return the Injective converter
     */
    public static AddressConverter injective() {
        return INJECTIVE;
    }

    public ConverterProfile profile() {
        return profile;
    }

    /**
     * Detects the format of {@code address} from its shape alone.
     *
     * <p>No checksum is verified here. The EVM pattern is tested first.
     *
     * @param address the address to classify
     * @return the source type and, for bech32, the prefix
     * @throws UnrecognizedFormatException if neither pattern matches
     */
    public DetectedAddress detectAddressType(final String address) {
        Objects.requireNonNull(address, "address");
        if (AddressPatterns.isEvm(address)) {
            return new DetectedAddress(SourceType.EVM, null);
        }
        if (AddressPatterns.isBech32Shaped(address)) {
            final String prefix = address.substring(0, address.indexOf('1'));
            final SourceType type = prefix.equals(profile.targetPrefix()) ? SourceType.INJECTIVE : SourceType.COSMOS;
            return new DetectedAddress(type, prefix);
        }
        throw new UnrecognizedFormatException(address);
    }

    /**
     * Converts an EVM hex address to bech32 under the target prefix.
     *
     * @param hexAddress {@code 0x} followed by 40 hex digits, any case
     * @return the target bech32 address
     * @throws InvalidEvmAddressException if the input has the wrong shape
     */
    public String evmToTarget(final String hexAddress) {
        return CanonicalAddress.fromEvm(hexAddress).toBech32(profile.targetPrefix());
    }

    /**
     * Converts a bech32 address under the target prefix to lowercase EVM hex.
     *
     * @param bech32Address the target bech32 address
     * @return the EVM address
     * @throws InvalidBech32Exception if decoding fails
     * @throws PrefixMismatchException if the prefix is not the target prefix
     * @throws InvalidAddressLengthException if the payload is not 20 bytes
     */
    public String targetToEvm(final String bech32Address) {
        return CanonicalAddress.fromBech32(bech32Address, profile.targetPrefix()).toEvm().value();
    }

    /**
     * Re-encodes a bech32 address under any prefix with the target prefix.
     *
     * @param bech32Address a bech32 address, e.g. {@code cosmos1...}
     * @return the target bech32 address
     * @throws InvalidBech32Exception if decoding fails
     * @throws InvalidAddressLengthException if the payload is not 20 bytes
     */
    public String foreignToTarget(final String bech32Address) {
        return CanonicalAddress.fromBech32(bech32Address).toBech32(profile.targetPrefix());
    }

    /**
     * Re-encodes a target bech32 address under a foreign prefix.
     *
     * @param targetAddress the target bech32 address
     * @param foreignPrefix lowercase letters or digits, e.g. {@code osmo}
     * @return the foreign bech32 address
     * @throws InvalidPrefixException if the foreign prefix is empty, malformed or too long
     * @throws InvalidBech32Exception if decoding fails
     * @throws PrefixMismatchException if the address is not under the target prefix
     * @throws InvalidAddressLengthException if the payload is not 20 bytes
     */
    public String targetToForeign(final String targetAddress, final String foreignPrefix) {
        Objects.requireNonNull(foreignPrefix, "foreignPrefix");
        if (!AddressPatterns.isValidPrefix(foreignPrefix)) {
            throw new InvalidPrefixException(foreignPrefix);
        }
        return CanonicalAddress.fromBech32(targetAddress, profile.targetPrefix()).toBech32(foreignPrefix);
    }

    /**
     * Detects the input format and produces both the target bech32 and EVM forms.
     *
     * <p>Bech32 input is decoded once; both outputs are encoded from those bytes.
     *
     * @param address an EVM, target bech32 or foreign bech32 address
     * @return the conversion result
     * @throws AddressException on the first failure
     */
    public ConversionResult convertAddress(final String address) {
        try {
            final DetectedAddress detected = detectAddressType(address);
            final AddressFormat format = detected.format();
            final CanonicalAddress canonical;
            if (format instanceof AddressFormat.Bech32) {
                canonical = CanonicalAddress.fromBech32(address);
            } else {
                canonical = CanonicalAddress.fromEvm(address);
            }
            return result(address, canonical, detected.sourceType(), detected.chainPrefix());
        } catch (AddressException e) {
            DebugLogger.logConversion(LogFormatter.formatConversionError(address, e.kind()));
            throw e;
        }
    }

    /**
     * Converts an address the caller asserts is EVM hex.
     *
     * <p>Unlike {@link #convertAddress}, bech32 input is not detected: it fails as an invalid
     * EVM address.
     *
     * @param hexAddress {@code 0x} followed by 40 hex digits, any case
     * @return the conversion result, with the EVM form lowercased
     * @throws InvalidEvmAddressException if the assertion does not hold
     */
    public ConversionResult convertFromEvm(final String hexAddress) {
        return result(hexAddress, CanonicalAddress.fromEvm(hexAddress), SourceType.EVM, null);
    }

    /**
     * Converts an address the caller asserts is bech32 under the target prefix.
     *
     * @param bech32Address the target bech32 address
     * @return the conversion result
     * @throws InvalidBech32Exception if decoding fails
     * @throws PrefixMismatchException if the assertion does not hold
     * @throws InvalidAddressLengthException if the payload is not 20 bytes
     */
    public ConversionResult convertFromTarget(final String bech32Address) {
        final CanonicalAddress canonical = CanonicalAddress.fromBech32(bech32Address, profile.targetPrefix());
        return result(bech32Address, canonical, SourceType.INJECTIVE, profile.targetPrefix());
    }

    /**
     * Converts a batch using the profile's batch ceiling.
     *
     * @param addresses the addresses, none null
     * @return the report
     * @throws BatchException if the batch is empty or larger than the ceiling
     * @see #convertBatch(List, int)
     */
    public BatchReport convertBatch(final List<String> addresses) {
        return convertBatch(addresses, profile.maxBatchSize());
    }

    /**
     * Converts each address independently, in order.
     *
     * <p>A failing entry is recorded in {@link BatchReport#errors()} and never stops the
     * rest of the batch.
     *
     * @param addresses the addresses, none null
     * @param maxCount  the largest batch accepted
     * @return the report
     * @throws BatchException if the batch is empty or larger than {@code maxCount}
     */
    public BatchReport convertBatch(final List<String> addresses, final int maxCount) {
        final List<String> inputs = checkBatch(addresses, maxCount);
        final long start = System.nanoTime();

        final List<Outcome> outcomes = new ArrayList<>(inputs.size());
        for (final String address : inputs) {
            outcomes.add(attempt(address));
        }
        return report(outcomes, start);
    }

    /**
     * Converts a batch with entries spread over {@code executor}.
     *
     * <p>Entries may complete in any order; the report still lists them in input order.
     * The call blocks until every entry has finished.
     *
     * @param addresses the addresses, none null
     * @param executor  runs one task per entry
     * @return the report
     * @throws BatchException if the batch is empty or larger than the profile's ceiling
     */
    public BatchReport convertBatch(final List<String> addresses, final Executor executor) {
        Objects.requireNonNull(executor, "executor");
        final List<String> inputs = checkBatch(addresses, profile.maxBatchSize());
        final long start = System.nanoTime();

        final List<CompletableFuture<Outcome>> futures = new ArrayList<>(inputs.size());
        for (final String address : inputs) {
            futures.add(CompletableFuture.supplyAsync(() -> attempt(address), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        final List<Outcome> outcomes = new ArrayList<>(futures.size());
        for (final CompletableFuture<Outcome> future : futures) {
            outcomes.add(future.join());
        }
        return report(outcomes, start);
    }

    private ConversionResult result(
            final String input,
            final CanonicalAddress canonical,
            final SourceType sourceType,
            final @Nullable String chainPrefix) {
        final ConversionResult result = new ConversionResult(
                input,
                canonical.toBech32(profile.targetPrefix()),
                canonical.toEvm().value(),
                sourceType,
                chainPrefix);
        DebugLogger.logConversion(LogFormatter.formatConversion(
                sourceType.wireName(), input, result.injectiveAddress(), result.evmAddress()));
        return result;
    }

    private static List<String> checkBatch(final List<String> addresses, final int maxCount) {
        Objects.requireNonNull(addresses, "addresses");
        if (addresses.isEmpty()) {
            throw BatchException.empty(maxCount);
        }
        if (addresses.size() > maxCount) {
            throw BatchException.tooLarge(addresses.size(), maxCount);
        }
        return List.copyOf(addresses);
    }

    private Outcome attempt(final String address) {
        try {
            return new Outcome(convertAddress(address), null);
        } catch (AddressException e) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Batch entry '{}' failed: {}", LogSanitizer.sanitize(address), e.kind());
            }
            return new Outcome(null, BatchFailure.of(address, e));
        }
    }

    private static BatchReport report(final List<Outcome> outcomes, final long startNanos) {
        final List<ConversionResult> conversions = new ArrayList<>();
        final List<BatchFailure> errors = new ArrayList<>();
        for (final Outcome outcome : outcomes) {
            if (outcome.result() != null) {
                conversions.add(outcome.result());
            } else {
                errors.add(outcome.failure());
            }
        }
        final BatchReport report = new BatchReport(conversions, errors);
        DebugLogger.logBatch(LogFormatter.formatBatch(
                outcomes.size(), report.total(), errors.size(), (System.nanoTime() - startNanos) / 1_000));
        return report;
    }

    private record Outcome(@Nullable ConversionResult result, @Nullable BatchFailure failure) {
    }
}
