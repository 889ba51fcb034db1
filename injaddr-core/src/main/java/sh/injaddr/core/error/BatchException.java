// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core.error;

/**
 * Thrown when a batch is rejected as a whole, before any entry is converted.
 *
 * @since 0.1.0
 */
public final class BatchException extends InjAddrException {

    private final ErrorKind kind;
    private final int size;
    private final int maxSize;

    private BatchException(final ErrorKind kind, final String message, final int size, final int maxSize) {
        super(message);
        this.kind = kind;
        this.size = size;
        this.maxSize = maxSize;
    }

    public static BatchException empty(final int maxSize) {
        return new BatchException(ErrorKind.EMPTY_BATCH, "Batch must contain at least one address", 0, maxSize);
    }

    public static BatchException tooLarge(final int size, final int maxSize) {
        return new BatchException(ErrorKind.BATCH_TOO_LARGE,
                "Batch of " + size + " addresses exceeds the maximum of " + maxSize, size, maxSize);
    }

    /** Number of entries in the rejected batch. */
    public int size() {
        return size;
    }

    /** Configured batch ceiling. */
    public int maxSize() {
        return maxSize;
    }

    @Override
    public ErrorKind kind() {
        return kind;
    }
}
