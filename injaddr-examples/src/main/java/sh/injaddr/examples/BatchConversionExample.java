// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.examples;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import sh.injaddr.core.InjAddrDebug;
import sh.injaddr.core.convert.AddressConverter;
import sh.injaddr.core.convert.BatchReport;
import sh.injaddr.core.error.BatchException;

/**
 * Converts a mixed batch sequentially and on a thread pool, printing the report as JSON.
 *
 * <p>Usage:
 * <pre>
 * java -cp &lt;classpath&gt; sh.injaddr.examples.BatchConversionExample
 * </pre>
 */
public final class BatchConversionExample {

    private static final List<String> ADDRESSES = List.of(
            "0xAF79152AC5dF276D9A8e1E2E22822f9713474902",
            "inj14au322k9munkmx5wrchz9q30juf5wjgz2cfqku",
            "cosmos14au322k9munkmx5wrchz9q30juf5wjgzq37yyy",
            "osmo14au322k9munkmx5wrchz9q30juf5wjgzg2d5jk",
            "garbage",
            "0x1234");

    private BatchConversionExample() {
    }

    public static void main(String[] args) throws Exception {
        InjAddrDebug.setBatchLogging(true);

        final AddressConverter converter = AddressConverter.injective();
        final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

        System.out.println("=== Sequential batch ===");
        final BatchReport sequential = converter.convertBatch(ADDRESSES);
        System.out.println(mapper.writeValueAsString(sequential));

        System.out.println("=== Thread pool batch ===");
        final ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            final BatchReport parallel = converter.convertBatch(ADDRESSES, pool);
            System.out.println("same report as sequential: " + parallel.equals(sequential));
        } finally {
            pool.shutdown();
        }

        System.out.println("=== Rejected batches ===");
        try {
            converter.convertBatch(List.of());
        } catch (BatchException e) {
            System.out.println(e.kind() + ": " + e.getMessage());
        }
        try {
            converter.convertBatch(ADDRESSES, 3);
        } catch (BatchException e) {
            System.out.println(e.kind() + ": " + e.getMessage());
        }
    }
}
