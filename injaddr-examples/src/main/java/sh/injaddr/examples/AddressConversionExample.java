// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.examples;

import sh.injaddr.core.InjAddrDebug;
import sh.injaddr.core.convert.AddressConverter;
import sh.injaddr.core.convert.ConversionResult;
import sh.injaddr.core.convert.ConverterProfiles;
import sh.injaddr.core.error.AddressException;
import sh.injaddr.core.error.PrefixMismatchException;

/**
 * Demonstrates single-address conversion, directional conversion and error handling.
 *
 * <p>Usage:
 * <pre>
 * java -cp &lt;classpath&gt; -Dinjaddr.examples.mode=auto sh.injaddr.examples.AddressConversionExample
 * </pre>
 *
 * <p>Modes: {@code auto} (default), {@code directional}, {@code errors}.
 * Set {@code -Dinjaddr.debug=true} to trace each conversion.
 */
public final class AddressConversionExample {

    private static final String EVM = "0xAF79152AC5dF276D9A8e1E2E22822f9713474902";

    private AddressConversionExample() {
    }

    public static void main(String[] args) {
        InjAddrDebug.setEnabled(Boolean.getBoolean("injaddr.debug"));

        final String mode = System.getProperty("injaddr.examples.mode", "auto");
        switch (mode) {
            case "auto" -> runAutoDetectDemo();
            case "directional" -> runDirectionalDemo();
            case "errors" -> runErrorsDemo();
            default -> {
                System.out.println("Unknown mode: " + mode);
                System.out.println("Use -Dinjaddr.examples.mode=auto, directional or errors");
            }
        }
    }

    private static void runAutoDetectDemo() {
        System.out.println("=== Auto-detect demo ===");
        final AddressConverter converter = AddressConverter.injective();

        final String inj = converter.evmToTarget(EVM);
        print(converter.convertAddress(EVM));
        print(converter.convertAddress(inj));
        for (String prefix : ConverterProfiles.KNOWN_PREFIXES) {
            print(converter.convertAddress(converter.targetToForeign(inj, prefix)));
        }
    }

    private static void runDirectionalDemo() {
        System.out.println("=== Directional demo ===");
        final AddressConverter converter = AddressConverter.injective();

        final ConversionResult fromEvm = converter.convertFromEvm(EVM);
        print(fromEvm);
        print(converter.convertFromTarget(fromEvm.injectiveAddress()));

        final String osmo = converter.targetToForeign(fromEvm.injectiveAddress(), "osmo");
        try {
            converter.convertFromTarget(osmo);
        } catch (PrefixMismatchException e) {
            System.out.println("convertFromTarget(" + osmo + ") rejected: expected '"
                    + e.expectedPrefix() + "', found '" + e.actualPrefix() + "'");
        }
    }

    private static void runErrorsDemo() {
        System.out.println("=== Error classification demo ===");
        final AddressConverter converter = AddressConverter.injective();
        final String[] inputs = {
            "0xINVALID",
            "garbage",
            "inj14au322k9munkmx5wrchz9q30juf5wjgz2cfqkv",
            "inj1qqqsyqcyq5rqwzqfq5cltv",
        };
        for (String input : inputs) {
            try {
                print(converter.convertAddress(input));
            } catch (AddressException e) {
                System.out.printf("%-45s -> %s%n", input, e.kind());
            }
        }
        try {
            converter.targetToEvm("inj1qqqsyqcyq5rqwzqfq5cltv");
        } catch (AddressException e) {
            System.out.printf("%-45s -> %s (%s)%n", "targetToEvm(10-byte payload)", e.kind(), e.getMessage());
        }
    }

    private static void print(ConversionResult result) {
        System.out.printf("%-9s %-46s inj=%s evm=%s%n",
                result.sourceType().wireName(), result.input(), result.injectiveAddress(), result.evmAddress());
    }
}
