package eventflow.outbox;

import eventflow.RetryAfterException;
import eventflow.bus.BusEntry;
import eventflow.bus.EventWireCodec;
import eventflow.bus.PublishResult;
import eventflow.model.OutboxEntry;
import eventflow.retry.ExponentialBackoffRetryPolicy;
import eventflow.retry.RetryPolicy;
import eventflow.spi.ConnectionProvider;
import eventflow.spi.EventBus;
import eventflow.spi.MetricsExporter;
import eventflow.spi.OutboxStore;
import eventflow.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains the outbox to the external {@link EventBus}.
 *
 * <p>Every cycle a worker claims up to {@code batchSize} due entries under its own owner
 * id, splits them into bus calls of at most {@code maxEntriesPerCall} entries with at
 * most one entry per aggregate, and sends the calls in order. Outcomes are recorded per
 * entry:
 * <ul>
 *   <li>accepted → DELIVERED</li>
 *   <li>rejected → FAILED with attempts + 1 and a backoff from the {@link RetryPolicy}</li>
 *   <li>rejected on the last allowed attempt → DEAD</li>
 * </ul>
 * A {@link eventflow.DeliveryException} (or any other failure of the call) fails every
 * entry of that call. Once an entry of an aggregate failed, the aggregate's later entries
 * of the cycle are released unsent so they cannot overtake it.
 *
 * <p>Delivery is at-least-once: if the process dies after the bus accepted a call but
 * before DELIVERED was recorded, the claim expires after {@code lockTimeout} and the
 * entries are sent again. Consumers deduplicate by event id.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} schedules the workers;
 * {@link #drainOnce()} runs a single cycle on the calling thread.
 */
public final class OutboxPublisher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(OutboxPublisher.class.getName());

    private final ConnectionProvider connectionProvider;
    private final OutboxStore outboxStore;
    private final EventBus eventBus;
    private final EventWireCodec wireCodec;
    private final String serviceName;
    private final RetryPolicy retryPolicy;
    private final int maxAttempts;
    private final int workerCount;
    private final int batchSize;
    private final int maxEntriesPerCall;
    private final long intervalMs;
    private final String ownerId;
    private final Duration lockTimeout;
    private final Duration drainTimeout;
    private final MetricsExporter metrics;
    private final Clock clock;

    private final AtomicBoolean wakeUpPending = new AtomicBoolean();
    private ScheduledExecutorService scheduler;
    private volatile boolean started;
    private volatile boolean closed;

    private OutboxPublisher(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
        this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
        this.serviceName = Objects.requireNonNull(builder.serviceName, "serviceName");
        if (builder.maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (builder.workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.maxEntriesPerCall <= 0) {
            throw new IllegalArgumentException("maxEntriesPerCall must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.lockTimeout.isNegative() || builder.lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
        this.wireCodec = builder.wireCodec != null ? builder.wireCodec : new EventWireCodec();
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(200, 60_000);
        this.maxAttempts = builder.maxAttempts;
        this.workerCount = builder.workerCount;
        this.batchSize = builder.batchSize;
        this.maxEntriesPerCall = builder.maxEntriesPerCall;
        this.intervalMs = builder.intervalMs;
        this.ownerId = builder.ownerId != null
                ? builder.ownerId : "publisher-" + UUID.randomUUID().toString().substring(0, 8);
        this.lockTimeout = builder.lockTimeout;
        this.drainTimeout = builder.drainTimeout;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts {@code workerCount} scheduled workers. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("OutboxPublisher has been closed");
        }
        if (started) {
            return;
        }
        // One extra thread serves wake-ups so they never queue behind a slow scheduled cycle.
        scheduler = Executors.newScheduledThreadPool(workerCount + 1, new DaemonThreadFactory("eventflow-publisher-"));
        for (int i = 0; i < workerCount; i++) {
            String workerOwner = ownerId + "-" + i;
            scheduler.scheduleWithFixedDelay(() -> drainSafely(workerOwner), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
        started = true;
    }

    /**
     * Requests an immediate drain cycle, typically right after a commit staged new entries.
     * Requests arriving while one is queued are coalesced. No-op unless started.
     */
    public void wakeUp() {
        if (!started || closed || !wakeUpPending.compareAndSet(false, true)) {
            return;
        }
        try {
            scheduler.execute(() -> {
                wakeUpPending.set(false);
                drainSafely(ownerId + "-wake");
            });
        } catch (RejectedExecutionException e) {
            wakeUpPending.set(false);
            logger.log(Level.FINE, "Wake-up rejected, publisher is shutting down", e);
        }
    }

    /**
     * Runs one drain cycle on the calling thread.
     *
     * @return number of entries claimed in this cycle
     */
    public int drainOnce() {
        return drain(ownerId);
    }

    private void drainSafely(String owner) {
        try {
            drain(owner);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Publish cycle failed", t);
        }
    }

    private int drain(String owner) {
        if (closed) {
            return 0;
        }
        Instant now = clock.instant();
        recordLag(now);
        List<OutboxEntry> claimed = claim(owner, now);
        if (claimed == null || claimed.isEmpty()) {
            return 0;
        }

        Set<String> failedPartitions = new HashSet<>();
        for (List<OutboxEntry> call : PartitionChunker.chunk(claimed, maxEntriesPerCall)) {
            List<OutboxEntry> sendable = new ArrayList<>(call.size());
            List<OutboxEntry> held = new ArrayList<>();
            for (OutboxEntry entry : call) {
                (failedPartitions.contains(entry.partitionKey()) ? held : sendable).add(entry);
            }
            release(held);
            if (!sendable.isEmpty()) {
                failedPartitions.addAll(send(sendable));
            }
        }
        return claimed.size();
    }

    private List<OutboxEntry> claim(String owner, Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            // Two-phase claim (UPDATE then SELECT) must run in a single transaction
            conn.setAutoCommit(false);
            try {
                List<OutboxEntry> claimed = outboxStore.claimDue(conn, owner, now, now.minus(lockTimeout), batchSize);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to claim outbox entries", e);
            return null;
        }
    }

    /**
     * Publishes one call and records the outcome of every entry.
     *
     * @return partition keys of the entries that failed
     */
    private Set<String> send(List<OutboxEntry> call) {
        Set<String> failed = new HashSet<>();
        List<OutboxEntry> encoded = new ArrayList<>(call.size());
        List<BusEntry> busEntries = new ArrayList<>(call.size());
        List<Outcome> outcomes = new ArrayList<>(call.size());
        for (OutboxEntry entry : call) {
            try {
                busEntries.add(wireCodec.encode(serviceName, entry.event()));
                encoded.add(entry);
            } catch (RuntimeException e) {
                // An entry that cannot be encoded will never be deliverable.
                outcomes.add(Outcome.dead(entry, "Encoding failed: " + e.getMessage()));
                failed.add(entry.partitionKey());
            }
        }

        if (!encoded.isEmpty()) {
            try {
                PublishResult result = eventBus.publish(busEntries);
                if (result == null || result.size() != encoded.size()) {
                    throw new IllegalStateException("Bus returned " + (result == null ? "no result" : result.size() + " results")
                            + " for " + encoded.size() + " entries");
                }
                for (int i = 0; i < encoded.size(); i++) {
                    OutboxEntry entry = encoded.get(i);
                    if (result.isAccepted(i)) {
                        outcomes.add(Outcome.delivered(entry));
                    } else {
                        outcomes.add(failure(entry, result.errorAt(i), null));
                        failed.add(entry.partitionKey());
                    }
                }
            } catch (RetryAfterException e) {
                for (OutboxEntry entry : encoded) {
                    outcomes.add(failure(entry, describe(e), e.retryAfter()));
                    failed.add(entry.partitionKey());
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Bus rejected a call of " + encoded.size() + " entries", e);
                for (OutboxEntry entry : encoded) {
                    outcomes.add(failure(entry, describe(e), null));
                    failed.add(entry.partitionKey());
                }
            }
        }
        record(outcomes);
        return failed;
    }

    private Outcome failure(OutboxEntry entry, String error, Duration retryAfter) {
        int attempts = entry.attempts() + 1;
        if (attempts >= maxAttempts) {
            return Outcome.dead(entry, error);
        }
        long delayMs = retryAfter != null ? retryAfter.toMillis() : retryPolicy.computeDelayMs(attempts);
        return Outcome.failed(entry, error, clock.instant().plusMillis(delayMs));
    }

    private void record(List<Outcome> outcomes) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            for (Outcome outcome : outcomes) {
                recordOne(conn, outcome);
            }
        } catch (SQLException e) {
            // Entries stay claimed; they are resent once the claim expires.
            logger.log(Level.SEVERE, "Failed to record delivery outcome of " + outcomes.size() + " entries", e);
        }
    }

    private void recordOne(Connection conn, Outcome outcome) {
        String eventId = outcome.entry.eventId();
        try {
            switch (outcome.kind) {
                case DELIVERED:
                    outboxStore.markDelivered(conn, eventId, clock.instant());
                    metrics.incrementDelivered();
                    break;
                case FAILED:
                    outboxStore.markFailed(conn, eventId, outcome.nextAttemptAt, outcome.error);
                    metrics.incrementDeliveryFailed();
                    logger.log(Level.WARNING, "Delivery of {0} failed (attempt {1}), retrying at {2}: {3}",
                            new Object[]{eventId, outcome.entry.attempts() + 1, outcome.nextAttemptAt, outcome.error});
                    break;
                case DEAD:
                    outboxStore.markDead(conn, eventId, outcome.error);
                    metrics.incrementDeliveryDead();
                    logger.log(Level.SEVERE, "Outbox entry {0} ({1} on {2}) is DEAD after {3} attempts: {4}",
                            new Object[]{eventId, outcome.entry.event().eventName(), outcome.entry.partitionKey(),
                                    outcome.entry.attempts() + 1, outcome.error});
                    break;
                default:
                    throw new IllegalStateException("Unexpected outcome " + outcome.kind);
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to record outcome " + outcome.kind + " for " + eventId, e);
        }
    }

    private void release(List<OutboxEntry> held) {
        if (held.isEmpty()) {
            return;
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            for (OutboxEntry entry : held) {
                outboxStore.release(conn, entry.eventId());
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.WARNING, "Failed to release " + held.size() + " held entries; they wait for claim expiry", e);
        }
    }

    /**
     * Age of the oldest undelivered entry, claimable or not, so entries stuck in backoff
     * or behind a blocked aggregate still show up as lag.
     */
    private void recordLag(Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            Optional<Instant> oldest = outboxStore.oldestPendingCreatedAt(conn);
            metrics.recordOldestLagMs(oldest.isEmpty() ? 0L : Math.max(0L, Duration.between(oldest.get(), now).toMillis()));
        } catch (SQLException | RuntimeException e) {
            // keep the last reading
            logger.log(Level.WARNING, "Failed to read outbox lag", e);
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null ? t.getClass().getName() : message;
    }

    /**
     * Stops the workers, waiting up to {@code drainTimeout} for running cycles to finish.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private enum Kind { DELIVERED, FAILED, DEAD }

    private static final class Outcome {
        private final OutboxEntry entry;
        private final Kind kind;
        private final String error;
        private final Instant nextAttemptAt;

        private Outcome(OutboxEntry entry, Kind kind, String error, Instant nextAttemptAt) {
            this.entry = entry;
            this.kind = kind;
            this.error = error;
            this.nextAttemptAt = nextAttemptAt;
        }

        static Outcome delivered(OutboxEntry entry) {
            return new Outcome(entry, Kind.DELIVERED, null, null);
        }

        static Outcome failed(OutboxEntry entry, String error, Instant nextAttemptAt) {
            return new Outcome(entry, Kind.FAILED, error, nextAttemptAt);
        }

        static Outcome dead(OutboxEntry entry, String error) {
            return new Outcome(entry, Kind.DEAD, error, null);
        }
    }

    /**
     * Builder for {@link OutboxPublisher}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private OutboxStore outboxStore;
        private EventBus eventBus;
        private EventWireCodec wireCodec;
        private String serviceName;
        private RetryPolicy retryPolicy;
        private int maxAttempts = 10;
        private int workerCount = 1;
        private int batchSize = 50;
        private int maxEntriesPerCall = 10;
        private long intervalMs = 1000;
        private String ownerId;
        private Duration lockTimeout = Duration.ofMinutes(5);
        private Duration drainTimeout = Duration.ofSeconds(10);
        private MetricsExporter metrics;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder outboxStore(OutboxStore outboxStore) {
            this.outboxStore = outboxStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        /**
         * Name of this service, sent as the {@code source} of every bus entry. <b>Required.</b>
         */
        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder wireCodec(EventWireCodec wireCodec) {
            this.wireCodec = wireCodec;
            return this;
        }

        /**
         * Backoff between attempts. Optional; defaults to exponential backoff from 200 ms up to 60 s.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Attempts before an entry goes DEAD. Default: 10.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /** Default: 1. */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Entries claimed per cycle. Default: 50.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Upper bound on entries per bus call. Default: 10.
         */
        public Builder maxEntriesPerCall(int maxEntriesPerCall) {
            this.maxEntriesPerCall = maxEntriesPerCall;
            return this;
        }

        /**
         * Delay between scheduled cycles of each worker. Default: 1000 ms.
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Claim owner prefix, e.g. host or pod name. Optional; defaults to a random id.
         */
        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        /**
         * How long a claim holds before other workers may take the entries over. Default: 5 minutes.
         */
        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
            return this;
        }

        /**
         * How long {@link #close()} waits for running cycles. Default: 10 seconds.
         */
        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public OutboxPublisher build() {
            return new OutboxPublisher(this);
        }
    }
}
