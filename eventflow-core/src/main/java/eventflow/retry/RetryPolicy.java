package eventflow.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Strategy for computing the delay before retrying a failed delivery or saga step.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay before the next attempt.
     *
     * @param attempts the number of failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);

    /**
     * Returns a policy that always waits the same amount of time.
     */
    static RetryPolicy fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        long delayMs = delay.toMillis();
        return attempts -> attempts <= 0 ? 0L : delayMs;
    }
}
