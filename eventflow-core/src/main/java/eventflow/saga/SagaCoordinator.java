package eventflow.saga;

import eventflow.DomainEvent;
import eventflow.RetryAfterException;
import eventflow.bus.EventWireCodec;
import eventflow.consumer.EventConsumer;
import eventflow.model.SagaState;
import eventflow.model.SagaStatus;
import eventflow.retry.ExponentialBackoffRetryPolicy;
import eventflow.retry.RetryPolicy;
import eventflow.spi.MetricsExporter;
import eventflow.spi.ProcessedEventStore;
import eventflow.spi.SagaStore;
import eventflow.spi.TransactionRunner;
import eventflow.spi.TxContext;
import eventflow.util.Ids;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives sagas from events and timers.
 *
 * <p>A trigger event creates the saga for {@code (sagaType, correlationId)} unless it exists
 * and schedules step 1. Each step runs in one transaction together with the advance of the
 * saga row, a compare-and-set on {@code (step, version)}: a duplicate delivery, a duplicate
 * timer or a step that already advanced changes nothing.
 *
 * <p>A failing step rolls back, and the saga records the attempt and sets {@code wakeAt} to the
 * end of the backoff. The event the failed run was given is kept on the row, so the retry
 * sees it again. When the step exhausted its attempts the compensation runs and the saga
 * ends COMPENSATED, or FAILED when there is no compensation or it failed too.
 *
 * <p>Timers are persisted as {@code wakeAt}; a {@link SagaTimerPoller} fires the due ones through
 * {@link #fireTimer(String, int)}.
 *
 * <p>The coordinator opens its own transactions and refuses to run inside one. Redelivered
 * trigger events are absorbed by the unique {@code (sagaType, correlationId)} row; redelivered
 * awaited events are absorbed by the optional {@link ProcessedEventStore}.
 */
public final class SagaCoordinator implements EventConsumer {
    private static final Logger logger = Logger.getLogger(SagaCoordinator.class.getName());

    private final Map<String, SagaDefinition> definitions;
    private final SagaStore sagaStore;
    private final ProcessedEventStore processedEvents;
    private final TxContext txContext;
    private final TransactionRunner transactionRunner;
    private final RetryPolicy retryPolicy;
    private final int defaultMaxAttempts;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final EventWireCodec eventCodec = new EventWireCodec();

    private SagaCoordinator(Builder builder) {
        if (builder.definitions.isEmpty()) {
            throw new IllegalArgumentException("At least one saga definition is required");
        }
        if (builder.maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.definitions = Map.copyOf(builder.definitions);
        this.sagaStore = Objects.requireNonNull(builder.sagaStore, "sagaStore");
        this.processedEvents = builder.processedEvents;
        this.txContext = Objects.requireNonNull(builder.txContext, "txContext");
        this.transactionRunner = Objects.requireNonNull(builder.transactionRunner, "transactionRunner");
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1000, 300_000);
        this.defaultMaxAttempts = builder.maxAttempts;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts sagas triggered by the event and advances sagas of the same correlation id that
     * wait for it.
     */
    @Override
    public void onEvent(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        requireNoTransaction();
        for (SagaDefinition definition : definitions.values()) {
            if (definition.startsOn(event)) {
                start(definition, event);
            }
        }
        List<SagaState> waiting = transactionRunner.inTransaction(() ->
                sagaStore.findActiveByCorrelation(txContext.currentConnection(), event.correlationId()));
        for (SagaState state : waiting) {
            SagaDefinition definition = definitions.get(state.sagaType());
            if (definition == null || state.step() > definition.steps().size() || state.wakeAt() != null) {
                continue;
            }
            if (definition.step(state.step()).awaits(event.eventName())) {
                run(state.sagaId(), state.step(), event, true);
            }
        }
    }

    /**
     * Runs the given step if it is still the saga's current step and its timer is due.
     * Safe to call any number of times.
     *
     * @return {@code true} if the step ran and the saga advanced
     */
    public boolean fireTimer(String sagaId, int step) {
        Objects.requireNonNull(sagaId, "sagaId");
        requireNoTransaction();
        return run(sagaId, step, null, false);
    }

    public Optional<SagaState> find(String sagaId) {
        return transactionRunner.inTransaction(() -> sagaStore.findById(txContext.currentConnection(), sagaId));
    }

    public Optional<SagaState> find(String sagaType, String correlationId) {
        return transactionRunner.inTransaction(() ->
                sagaStore.findByCorrelation(txContext.currentConnection(), sagaType, correlationId));
    }

    private void start(SagaDefinition definition, DomainEvent trigger) {
        Instant now = clock.instant();
        Map<String, String> data = new LinkedHashMap<>();
        definition.initialData(trigger).forEach((k, v) -> {
            if (k != null && v != null) {
                data.put(k, v);
            }
        });
        SagaState created = new SagaState(Ids.newSagaId(), definition.sagaType(), trigger.correlationId(), 1,
                SagaStatus.ACTIVE, data, wakeAt(definition.step(1), trigger.occurredAt(), now), 0, null,
                trigger.eventId(), trigger.occurredAt(), 0L, now, now);
        boolean inserted = transactionRunner.inTransaction(() ->
                sagaStore.insertIfAbsent(txContext.currentConnection(), created));
        if (inserted) {
            logger.log(Level.FINE, "Started saga {0} ({1}) for correlation {2}",
                    new Object[]{created.sagaId(), created.sagaType(), created.correlationId()});
            if (isDue(created, now)) {
                run(created.sagaId(), 1, trigger, false);
            }
        }
    }

    /**
     * Runs a step and then any following steps that are already due.
     */
    private boolean run(String sagaId, int step, DomainEvent event, boolean awaited) {
        boolean advancedAny = false;
        int current = step;
        DomainEvent currentEvent = event;
        boolean currentAwaited = awaited;
        while (true) {
            Optional<SagaState> next = runOnce(sagaId, current, currentEvent, currentAwaited);
            if (next.isEmpty()) {
                return advancedAny;
            }
            advancedAny = true;
            SagaState advanced = next.get();
            if (advanced.status() != SagaStatus.ACTIVE || !isDue(advanced, clock.instant())) {
                return true;
            }
            current = advanced.step();
            currentEvent = null;
            currentAwaited = false;
        }
    }

    private Optional<SagaState> runOnce(String sagaId, int step, DomainEvent event, boolean awaited) {
        try {
            return transactionRunner.inTransaction(() -> {
                Instant now = clock.instant();
                SagaState state = sagaStore.findById(txContext.currentConnection(), sagaId).orElse(null);
                if (state == null || state.status().isTerminal() || state.step() != step) {
                    return Optional.<SagaState>empty();
                }
                SagaDefinition definition = definitionOf(state);
                SagaStep sagaStep = definition.step(step);
                if (awaited) {
                    if (state.wakeAt() != null || !sagaStep.awaits(event.eventName())) {
                        return Optional.<SagaState>empty();
                    }
                    if (processedEvents != null && !processedEvents.markProcessed(txContext.currentConnection(),
                            "saga:" + sagaId, event.eventId(), now)) {
                        return Optional.<SagaState>empty();
                    }
                } else if (!isDue(state, now)) {
                    return Optional.<SagaState>empty();
                }

                DomainEvent runEvent = event;
                if (runEvent == null && state.retryEvent() != null) {
                    runEvent = retryEventOf(state);
                    if (processedEvents != null) {
                        // the failed run's ledger entry was rolled back with it
                        processedEvents.markProcessed(txContext.currentConnection(), "saga:" + sagaId,
                                runEvent.eventId(), now);
                    }
                }
                SagaContext context = new SagaContext(state, sagaStep, runEvent, now);
                sagaStep.action().execute(context);

                SagaState next = nextState(definition, state, context.snapshot(), now);
                if (!sagaStore.compareAndSet(txContext.currentConnection(), state, next)) {
                    throw new StaleSagaException();
                }
                return Optional.of(next);
            }).map(next -> {
                metrics.incrementSagaStepCompleted();
                if (next.status() == SagaStatus.COMPLETED) {
                    logger.log(Level.INFO, "Saga {0} ({1}) completed", new Object[]{sagaId, next.sagaType()});
                }
                return next;
            });
        } catch (StaleSagaException e) {
            logger.log(Level.FINE, "Saga {0} step {1} was advanced concurrently", new Object[]{sagaId, step});
            return Optional.empty();
        } catch (RuntimeException e) {
            metrics.incrementSagaStepFailed();
            recordFailure(sagaId, step, event, e);
            return Optional.empty();
        }
    }

    private SagaState nextState(SagaDefinition definition, SagaState state, Map<String, String> data, Instant now) {
        int nextStep = state.step() + 1;
        if (nextStep > definition.steps().size()) {
            return state.finish(SagaStatus.COMPLETED, nextStep, data, 0, null, now);
        }
        return state.advance(nextStep, data, wakeAt(definition.step(nextStep), state.triggerOccurredAt(), now), now);
    }

    private void recordFailure(String sagaId, int step, DomainEvent event, RuntimeException failure) {
        String error = describe(failure);
        try {
            SagaState state = transactionRunner.inTransaction(() ->
                    sagaStore.findById(txContext.currentConnection(), sagaId).orElse(null));
            if (state == null || state.status().isTerminal() || state.step() != step) {
                return;
            }
            SagaDefinition definition = definitionOf(state);
            int attempts = state.attempts() + 1;
            int maxAttempts = definition.maxAttempts() > 0 ? definition.maxAttempts() : defaultMaxAttempts;
            Instant now = clock.instant();
            if (attempts < maxAttempts) {
                long delayMs = failure instanceof RetryAfterException
                        ? ((RetryAfterException) failure).retryAfter().toMillis()
                        : retryPolicy.computeDelayMs(attempts);
                String retryEvent = event != null ? eventCodec.toJson(event) : state.retryEvent();
                SagaState retry = state.retryAt(now.plusMillis(delayMs), error, now, retryEvent);
                if (compareAndSet(state, retry)) {
                    logger.log(Level.WARNING, "Saga " + sagaId + " step " + step + " failed (attempt " + attempts
                            + "), retrying at " + retry.wakeAt(), failure);
                }
                return;
            }
            giveUp(definition, state, attempts, error, failure);
        } catch (RuntimeException e) {
            e.addSuppressed(failure);
            logger.log(Level.SEVERE, "Failed to record failure of saga " + sagaId + " step " + step, e);
        }
    }

    private void giveUp(SagaDefinition definition, SagaState state, int attempts, String error,
                        RuntimeException failure) {
        logger.log(Level.SEVERE, "Saga " + state.sagaId() + " (" + state.sagaType() + ") step " + state.step()
                + " exhausted " + attempts + " attempts", failure);
        String finalError = error;
        if (definition.compensation() != null) {
            SagaState failed = state.retryAt(null, error, clock.instant());
            try {
                boolean compensated = transactionRunner.inTransaction(() -> {
                    Instant now = clock.instant();
                    SagaContext context = new SagaContext(failed, definition.step(state.step()),
                            retryEventOf(state), now);
                    definition.compensation().execute(context);
                    SagaState done = state.finish(SagaStatus.COMPENSATED, state.step(), context.snapshot(),
                            attempts, error, now);
                    return sagaStore.compareAndSet(txContext.currentConnection(), state, done);
                });
                if (compensated) {
                    metrics.incrementSagaFailed();
                    logger.log(Level.WARNING, "Saga {0} compensated", state.sagaId());
                }
                return;
            } catch (RuntimeException e) {
                finalError = error + "; compensation failed: " + describe(e);
                logger.log(Level.SEVERE, "Compensation of saga " + state.sagaId() + " failed", e);
            }
        }
        SagaState terminal = state.finish(SagaStatus.FAILED, state.step(), state.data(), attempts, finalError,
                clock.instant());
        if (compareAndSet(state, terminal)) {
            metrics.incrementSagaFailed();
        }
    }

    private boolean compareAndSet(SagaState expected, SagaState next) {
        return transactionRunner.inTransaction(() ->
                sagaStore.compareAndSet(txContext.currentConnection(), expected, next));
    }

    private DomainEvent retryEventOf(SagaState state) {
        return state.retryEvent() == null ? null : eventCodec.fromJson(state.retryEvent());
    }

    private void requireNoTransaction() {
        // Every step needs its own transaction so a failure can be recorded after the rollback.
        if (txContext.isTransactionActive()) {
            throw new IllegalStateException("SagaCoordinator must be called outside a transaction");
        }
    }

    private SagaDefinition definitionOf(SagaState state) {
        SagaDefinition definition = definitions.get(state.sagaType());
        if (definition == null) {
            throw new IllegalStateException("No saga definition registered for type " + state.sagaType());
        }
        return definition;
    }

    private static Instant wakeAt(SagaStep step, Instant triggerOccurredAt, Instant now) {
        switch (step.start()) {
            case IMMEDIATELY:
                return now;
            case AFTER_DELAY:
                return triggerOccurredAt.plus(step.delay());
            case ON_EVENT:
                return null;
            default:
                throw new IllegalStateException("Unknown step start " + step.start());
        }
    }

    private static boolean isDue(SagaState state, Instant now) {
        return state.status() == SagaStatus.ACTIVE && state.wakeAt() != null && !state.wakeAt().isAfter(now);
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null ? t.getClass().getName() : message;
    }

    /** Rolls back a step whose saga row changed underneath it. */
    private static final class StaleSagaException extends RuntimeException {
        StaleSagaException() {
            super("saga advanced concurrently", null, false, false);
        }
    }

    /**
     * Builder for {@link SagaCoordinator}.
     */
    public static final class Builder {
        private final Map<String, SagaDefinition> definitions = new LinkedHashMap<>();
        private SagaStore sagaStore;
        private ProcessedEventStore processedEvents;
        private TxContext txContext;
        private TransactionRunner transactionRunner;
        private RetryPolicy retryPolicy;
        private int maxAttempts = 5;
        private MetricsExporter metrics;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * Registers a saga. <b>At least one required.</b>
         */
        public Builder register(SagaDefinition definition) {
            Objects.requireNonNull(definition, "definition");
            if (definitions.putIfAbsent(definition.sagaType(), definition) != null) {
                throw new IllegalStateException("Saga type already registered: " + definition.sagaType());
            }
            return this;
        }

        public Builder registerAll(List<SagaDefinition> definitions) {
            new ArrayList<>(definitions).forEach(this::register);
            return this;
        }

        /** <b>Required.</b> */
        public Builder sagaStore(SagaStore sagaStore) {
            this.sagaStore = sagaStore;
            return this;
        }

        /**
         * Ledger used to ignore redelivered events awaited by event steps. Optional.
         */
        public Builder processedEvents(ProcessedEventStore processedEvents) {
            this.processedEvents = processedEvents;
            return this;
        }

        /** <b>Required.</b> */
        public Builder txContext(TxContext txContext) {
            this.txContext = txContext;
            return this;
        }

        /** <b>Required.</b> */
        public Builder transactionRunner(TransactionRunner transactionRunner) {
            this.transactionRunner = transactionRunner;
            return this;
        }

        /**
         * Backoff between step attempts. Optional; defaults to exponential backoff from 1 s up to 5 min.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Attempts per step for definitions that do not set their own. Default: 5.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
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

        public SagaCoordinator build() {
            return new SagaCoordinator(this);
        }
    }
}
