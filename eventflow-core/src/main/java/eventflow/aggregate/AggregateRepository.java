package eventflow.aggregate;

import eventflow.AggregateType;
import eventflow.ConcurrencyConflictException;
import eventflow.DomainEvent;
import eventflow.EventMetadata;
import eventflow.dispatch.LocalEventDispatcher;
import eventflow.outbox.OutboxWriter;
import eventflow.spi.EventStore;
import eventflow.spi.MetricsExporter;
import eventflow.spi.TransactionRunner;
import eventflow.spi.TxContext;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads aggregates from the {@link EventStore} and persists their pending events.
 *
 * <p>{@link #save} appends the pending events with an expected-version check and stages
 * them in the outbox, both in one transaction. After the commit the aggregate's pending
 * queue is cleared and the committed events go to the {@link LocalEventDispatcher}.
 * When called inside an active transaction (for example from a saga step) the save joins
 * it, and the post-commit work runs when that outer transaction commits.
 *
 * <p>{@link #execute} and {@link #executeAndGet} are the command entry points: load, run the command, save, and on a
 * {@link ConcurrencyConflictException} reload and retry up to {@code maxConflictRetries}
 * times.
 *
 * <pre>{@code
 * AggregateRepository<UserAccount> users = AggregateRepository.builder(UserAccount::new)
 *     .aggregateType("USER")
 *     .eventStore(eventStore)
 *     .outboxWriter(outboxWriter)
 *     .txContext(txContext)
 *     .transactionRunner(txRunner)
 *     .build();
 *
 * users.execute(userId, metadata, user -> user.changeRole(Role.TUTOR));
 * }</pre>
 *
 * @param <A> aggregate type
 */
public final class AggregateRepository<A extends AggregateRoot<A>> {
    private static final Logger logger = Logger.getLogger(AggregateRepository.class.getName());

    private final Function<String, A> factory;
    private final String aggregateType;
    private final EventStore eventStore;
    private final OutboxWriter outboxWriter;
    private final TxContext txContext;
    private final TransactionRunner transactionRunner;
    private final LocalEventDispatcher localDispatcher;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final int maxConflictRetries;

    private AggregateRepository(Builder<A> builder) {
        this.factory = builder.factory;
        this.aggregateType = Objects.requireNonNull(builder.aggregateType, "aggregateType");
        this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
        this.outboxWriter = builder.outboxWriter;
        this.txContext = Objects.requireNonNull(builder.txContext, "txContext");
        this.transactionRunner = Objects.requireNonNull(builder.transactionRunner, "transactionRunner");
        this.localDispatcher = builder.localDispatcher == null ? new LocalEventDispatcher() : builder.localDispatcher;
        this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
        this.clock = builder.clock;
        this.maxConflictRetries = builder.maxConflictRetries;
    }

    /**
     * @param factory creates an empty aggregate (version 0) for an id
     */
    public static <A extends AggregateRoot<A>> Builder<A> builder(Function<String, A> factory) {
        return new Builder<>(factory);
    }

    public String aggregateType() {
        return aggregateType;
    }

    /**
     * Rebuilds an aggregate from its stream.
     *
     * @return the aggregate, or empty if no events were stored for the id
     */
    public Optional<A> load(String aggregateId) {
        A aggregate = loadOrCreate(aggregateId);
        return aggregate.version() == 0 ? Optional.empty() : Optional.of(aggregate);
    }

    /**
     * Rebuilds an aggregate from its stream, or returns a fresh one if none was stored.
     */
    public A loadOrCreate(String aggregateId) {
        Objects.requireNonNull(aggregateId, "aggregateId");
        List<DomainEvent> history = transactionRunner.inTransaction(() ->
                eventStore.load(txContext.currentConnection(), aggregateType, aggregateId));
        A aggregate = newAggregate(aggregateId);
        aggregate.replay(history);
        return aggregate;
    }

    /**
     * Persists the aggregate's pending events.
     *
     * <p>If the commit fails with an unknown outcome, the store is checked for the first
     * pending event before deciding: when it is there the save is treated as committed,
     * otherwise the failure is rethrown. Events are never appended twice.
     *
     * @return the events that were saved, empty if nothing was pending
     * @throws ConcurrencyConflictException if the stream moved since the aggregate was loaded
     */
    public List<DomainEvent> save(A aggregate) {
        Objects.requireNonNull(aggregate, "aggregate");
        if (!aggregateType.equals(aggregate.aggregateType())) {
            throw new IllegalArgumentException("Repository for " + aggregateType
                    + " cannot save aggregate of type " + aggregate.aggregateType());
        }
        List<DomainEvent> events = List.copyOf(aggregate.pendingEvents());
        if (events.isEmpty()) {
            return List.of();
        }
        long expectedVersion = aggregate.version() - events.size();
        boolean joined = txContext.isTransactionActive();
        try {
            transactionRunner.inTransaction(() -> {
                eventStore.append(txContext.currentConnection(), aggregateType, aggregate.aggregateId(),
                        expectedVersion, events);
                if (outboxWriter != null) {
                    outboxWriter.stage(events);
                }
                txContext.afterCommit(() -> afterCommit(aggregate, events));
                return null;
            });
        } catch (ConcurrencyConflictException e) {
            metrics.incrementAppendConflict();
            throw e;
        } catch (RuntimeException e) {
            if (joined || !isStored(events.get(0), e)) {
                throw e;
            }
            logger.log(Level.WARNING, "Commit of " + events.size() + " event(s) on "
                    + events.get(0).partitionKey() + " reported a failure but the events are stored", e);
            afterCommit(aggregate, events);
        }
        return events;
    }

    /**
     * Runs a command against the current state of an aggregate and saves the result.
     *
     * @param metadata causality ids stamped on the raised events, may be {@code null}
     * @param command  business operation; must only change state by raising events
     * @return the command's result
     * @throws ConcurrencyConflictException if every retry lost the race
     */
    public <R> R executeAndGet(String aggregateId, EventMetadata metadata, Function<A, R> command) {
        Objects.requireNonNull(command, "command");
        // Inside an outer transaction a conflict has to abort the whole unit of work.
        int retries = txContext.isTransactionActive() ? 0 : maxConflictRetries;
        for (int attempt = 0; ; attempt++) {
            A aggregate = loadOrCreate(aggregateId);
            aggregate.useMetadata(metadata);
            R result = command.apply(aggregate);
            try {
                save(aggregate);
                return result;
            } catch (ConcurrencyConflictException e) {
                if (attempt >= retries) {
                    throw e;
                }
                logger.log(Level.FINE, "Conflict on {0}, retrying ({1}/{2})",
                        new Object[]{e.partitionKey(), attempt + 1, retries});
            }
        }
    }

    /**
     * Variant of {@link #executeAndGet} for commands without a result; returns the saved aggregate.
     */
    public A execute(String aggregateId, EventMetadata metadata, Consumer<A> command) {
        Objects.requireNonNull(command, "command");
        return executeAndGet(aggregateId, metadata, aggregate -> {
            command.accept(aggregate);
            return aggregate;
        });
    }

    private A newAggregate(String aggregateId) {
        A aggregate = Objects.requireNonNull(factory.apply(aggregateId), "factory returned null");
        if (clock != null) {
            aggregate.useClock(clock);
        }
        return aggregate;
    }

    private void afterCommit(A aggregate, List<DomainEvent> events) {
        aggregate.commit();
        metrics.incrementAppendSuccess();
        localDispatcher.dispatch(events);
    }

    private boolean isStored(DomainEvent first, RuntimeException failure) {
        try {
            return transactionRunner.inTransaction(() ->
                    eventStore.contains(txContext.currentConnection(), first.eventId()));
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            return false;
        }
    }

    /**
     * Builder for {@link AggregateRepository}.
     *
     * @param <A> aggregate type
     */
    public static final class Builder<A extends AggregateRoot<A>> {
        private final Function<String, A> factory;
        private String aggregateType;
        private EventStore eventStore;
        private OutboxWriter outboxWriter;
        private TxContext txContext;
        private TransactionRunner transactionRunner;
        private LocalEventDispatcher localDispatcher;
        private MetricsExporter metrics;
        private Clock clock;
        private int maxConflictRetries = 3;

        private Builder(Function<String, A> factory) {
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        /** <b>Required.</b> */
        public Builder<A> aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        /** <b>Required.</b> */
        public Builder<A> aggregateType(AggregateType aggregateType) {
            return aggregateType(Objects.requireNonNull(aggregateType, "aggregateType").name());
        }

        /** <b>Required.</b> */
        public Builder<A> eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * Outbox staging for saved events. Optional; without it events are stored but not published.
         */
        public Builder<A> outboxWriter(OutboxWriter outboxWriter) {
            this.outboxWriter = outboxWriter;
            return this;
        }

        /** <b>Required.</b> */
        public Builder<A> txContext(TxContext txContext) {
            this.txContext = txContext;
            return this;
        }

        /** <b>Required.</b> */
        public Builder<A> transactionRunner(TransactionRunner transactionRunner) {
            this.transactionRunner = transactionRunner;
            return this;
        }

        public Builder<A> localDispatcher(LocalEventDispatcher localDispatcher) {
            this.localDispatcher = localDispatcher;
            return this;
        }

        public Builder<A> metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Clock for event timestamps. Optional; defaults to each aggregate's UTC clock.
         */
        public Builder<A> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Number of reload-and-retry rounds after a conflict. Default: 3.
         */
        public Builder<A> maxConflictRetries(int maxConflictRetries) {
            if (maxConflictRetries < 0) {
                throw new IllegalArgumentException("maxConflictRetries must be >= 0, got: " + maxConflictRetries);
            }
            this.maxConflictRetries = maxConflictRetries;
            return this;
        }

        public AggregateRepository<A> build() {
            return new AggregateRepository<>(this);
        }
    }
}
