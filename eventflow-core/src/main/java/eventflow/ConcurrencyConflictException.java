package eventflow;

/**
 * Thrown when an append finds a stream whose current version differs from the
 * version the caller expected, or when a concurrent writer claimed the same
 * stream positions first.
 *
 * <p>The condition is retryable: reload the aggregate, re-run the command and
 * append again. {@link eventflow.aggregate.AggregateRepository#execute} does this
 * automatically up to its configured retry limit.
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final String partitionKey;
    private final long expectedVersion;
    private final long actualVersion;

    /**
     * @param partitionKey    the stream that was written
     * @param expectedVersion the version the caller based its events on
     * @param actualVersion   the version found in the store, or {@code -1} when unknown
     */
    public ConcurrencyConflictException(String partitionKey, long expectedVersion, long actualVersion) {
        this(partitionKey, expectedVersion, actualVersion, null);
    }

    public ConcurrencyConflictException(String partitionKey, long expectedVersion, long actualVersion,
                                        Throwable cause) {
        super(message(partitionKey, expectedVersion, actualVersion), cause);
        this.partitionKey = partitionKey;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String partitionKey() {
        return partitionKey;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    /**
     * Returns the stored version observed by the failed append, or {@code -1} when the
     * conflict was detected by a key violation and the winner's version was not read.
     */
    public long actualVersion() {
        return actualVersion;
    }

    private static String message(String partitionKey, long expected, long actual) {
        String found = actual < 0 ? "a concurrent append" : "version " + actual;
        return "Concurrency conflict on " + partitionKey + ": expected version " + expected + ", found " + found;
    }
}
