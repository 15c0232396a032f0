package eventflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Signals a failed attempt that should be retried after an explicit delay.
 *
 * <p>May be thrown by an {@link eventflow.spi.EventBus} (for example when the bus
 * answered with a throttling response) or by a saga step. The attempt still counts
 * against the maximum attempt count; only the delay of the
 * {@link eventflow.retry.RetryPolicy} is replaced by {@link #retryAfter()}.
 */
public class RetryAfterException extends RuntimeException {

    private final Duration retryAfter;

    /**
     * @param retryAfter how long to wait before retrying
     * @throws NullPointerException     if {@code retryAfter} is null
     * @throws IllegalArgumentException if {@code retryAfter} is negative
     */
    public RetryAfterException(Duration retryAfter) {
        this(retryAfter, "Retry after " + validate(retryAfter));
    }

    public RetryAfterException(Duration retryAfter, String message) {
        this(retryAfter, message, null);
    }

    public RetryAfterException(Duration retryAfter, String message, Throwable cause) {
        super(message, cause);
        this.retryAfter = validate(retryAfter);
    }

    /**
     * Returns the requested retry delay, never null and never negative.
     */
    public Duration retryAfter() {
        return retryAfter;
    }

    private static Duration validate(Duration retryAfter) {
        Objects.requireNonNull(retryAfter, "retryAfter must not be null");
        if (retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        return retryAfter;
    }
}
