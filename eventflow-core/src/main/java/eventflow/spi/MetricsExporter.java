package eventflow.spi;

/**
 * Observability hook for exporting counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of successful event store appends.
     */
    void incrementAppendSuccess();

    /**
     * Increments the count of appends rejected by a concurrency conflict.
     */
    void incrementAppendConflict();

    /**
     * Increments the count of outbox entries confirmed by the bus.
     */
    void incrementDelivered();

    /**
     * Increments the count of outbox entries that failed and will be retried.
     */
    void incrementDeliveryFailed();

    /**
     * Increments the count of outbox entries moved to DEAD.
     */
    void incrementDeliveryDead();

    default void incrementSagaStepCompleted() {
    }

    default void incrementSagaStepFailed() {
    }

    /**
     * Increments the count of sagas that ended FAILED or COMPENSATED.
     */
    default void incrementSagaFailed() {
    }

    /**
     * Records the age in milliseconds of the oldest undelivered outbox entry.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestLagMs(long lagMs);

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementAppendSuccess() {
        }

        @Override
        public void incrementAppendConflict() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementDeliveryFailed() {
        }

        @Override
        public void incrementDeliveryDead() {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
