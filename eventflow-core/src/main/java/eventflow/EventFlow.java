package eventflow;

import eventflow.aggregate.AggregateRepository;
import eventflow.aggregate.AggregateRoot;
import eventflow.consumer.EventConsumer;
import eventflow.consumer.IdempotentConsumer;
import eventflow.dispatch.LocalEventDispatcher;
import eventflow.outbox.DeadEntryManager;
import eventflow.outbox.DeliveredEntryPurger;
import eventflow.outbox.OutboxPublisher;
import eventflow.outbox.OutboxWriter;
import eventflow.retry.RetryPolicy;
import eventflow.saga.SagaCoordinator;
import eventflow.saga.SagaDefinition;
import eventflow.saga.SagaTimerPoller;
import eventflow.spi.ConnectionProvider;
import eventflow.spi.EventBus;
import eventflow.spi.EventStore;
import eventflow.spi.MetricsExporter;
import eventflow.spi.OutboxStore;
import eventflow.spi.ProcessedEventStore;
import eventflow.spi.SagaStore;
import eventflow.spi.TransactionRunner;
import eventflow.spi.TxContext;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Composite entry point wiring the event store, outbox writer and publisher, saga
 * coordinator and timer poller into one {@link AutoCloseable} unit.
 *
 * <p>With a {@link Builder#purgeRetention(Duration) purge retention} set, a
 * {@link DeliveredEntryPurger} runs alongside the publisher and removes old DELIVERED
 * entries.
 *
 * <p>Without an {@link EventBus} the instance runs writer-only: events are stored and
 * staged, and an external process drains the outbox. Without saga definitions no
 * coordinator or timer poller is created.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventFlow flow = EventFlow.builder()
 *     .serviceName("user.service")
 *     .connectionProvider(connectionProvider)
 *     .txContext(txContext)
 *     .transactionRunner(txManager)
 *     .eventStore(eventStore)
 *     .outboxStore(outboxStore)
 *     .eventBus(bus)
 *     .build()) {
 *   flow.start();
 *   AggregateRepository<UserAccount> users = flow.repository("USER", UserAccount::new);
 *   users.execute(userId, null, user -> user.activate());
 * }
 * }</pre>
 */
public final class EventFlow implements AutoCloseable {

  private final TxContext txContext;
  private final TransactionRunner transactionRunner;
  private final EventStore eventStore;
  private final ProcessedEventStore processedEventStore;
  private final OutboxWriter writer;
  private final OutboxPublisher publisher;
  private final DeliveredEntryPurger purger;
  private final DeadEntryManager deadEntries;
  private final SagaCoordinator sagaCoordinator;
  private final SagaTimerPoller sagaTimerPoller;
  private final LocalEventDispatcher localDispatcher;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int maxConflictRetries;

  private EventFlow(Builder builder, OutboxPublisher publisher, DeliveredEntryPurger purger,
                    SagaCoordinator sagaCoordinator, SagaTimerPoller sagaTimerPoller) {
    this.txContext = builder.txContext;
    this.transactionRunner = builder.transactionRunner;
    this.eventStore = builder.eventStore;
    this.processedEventStore = builder.processedEventStore;
    this.publisher = publisher;
    this.purger = purger;
    this.writer = new OutboxWriter(builder.txContext, builder.outboxStore,
        publisher == null ? null : publisher::wakeUp);
    this.deadEntries = new DeadEntryManager(builder.connectionProvider, builder.outboxStore);
    this.sagaCoordinator = sagaCoordinator;
    this.sagaTimerPoller = sagaTimerPoller;
    this.localDispatcher = builder.localDispatcher;
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.maxConflictRetries = builder.maxConflictRetries;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a repository for one aggregate type sharing this instance's stores,
   * outbox writer, local dispatcher and metrics.
   */
  public <A extends AggregateRoot<A>> AggregateRepository<A> repository(String aggregateType,
                                                                        Function<String, A> factory) {
    return AggregateRepository.builder(factory)
        .aggregateType(aggregateType)
        .eventStore(eventStore)
        .outboxWriter(writer)
        .txContext(txContext)
        .transactionRunner(transactionRunner)
        .localDispatcher(localDispatcher)
        .metrics(metrics)
        .clock(clock)
        .maxConflictRetries(maxConflictRetries)
        .build();
  }

  public <A extends AggregateRoot<A>> AggregateRepository<A> repository(AggregateType aggregateType,
                                                                        Function<String, A> factory) {
    return repository(Objects.requireNonNull(aggregateType, "aggregateType").name(), factory);
  }

  /**
   * Wraps a consumer so each event id is handled once under {@code consumerName}.
   *
   * @throws IllegalStateException if no processed-event store was configured
   */
  public IdempotentConsumer idempotent(String consumerName, EventConsumer consumer) {
    if (processedEventStore == null) {
      throw new IllegalStateException("No ProcessedEventStore configured");
    }
    return new IdempotentConsumer(consumerName, consumer, processedEventStore, txContext, transactionRunner, clock);
  }

  public OutboxWriter writer() {
    return writer;
  }

  /**
   * Returns the publisher, or {@code null} in writer-only mode.
   */
  public OutboxPublisher publisher() {
    return publisher;
  }

  /**
   * Returns the delivered-entry purger, or {@code null} when purging is disabled.
   */
  public DeliveredEntryPurger purger() {
    return purger;
  }

  public DeadEntryManager deadEntries() {
    return deadEntries;
  }

  /**
   * Returns the saga coordinator, or {@code null} when no saga is registered.
   */
  public SagaCoordinator sagaCoordinator() {
    return sagaCoordinator;
  }

  public LocalEventDispatcher localDispatcher() {
    return localDispatcher;
  }

  /**
   * Starts the publisher workers, the purger and the saga timer poller, where configured.
   */
  public void start() {
    if (publisher != null) {
      publisher.start();
    }
    if (purger != null) {
      purger.start();
    }
    if (sagaTimerPoller != null) {
      sagaTimerPoller.start();
    }
  }

  /**
   * Stops the timer poller, then the publisher and the purger.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (sagaTimerPoller != null) {
      try {
        sagaTimerPoller.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (publisher != null) {
      try {
        publisher.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (purger != null) {
      try {
        purger.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link EventFlow}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TxContext txContext;
    private TransactionRunner transactionRunner;
    private EventStore eventStore;
    private OutboxStore outboxStore;
    private SagaStore sagaStore;
    private ProcessedEventStore processedEventStore;
    private EventBus eventBus;
    private String serviceName;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Clock clock = Clock.systemUTC();
    private LocalEventDispatcher localDispatcher = new LocalEventDispatcher();
    private final List<SagaDefinition> sagas = new ArrayList<>();
    private int maxConflictRetries = 3;
    private RetryPolicy publisherRetryPolicy;
    private int workerCount = 1;
    private int batchSize = 50;
    private int maxEntriesPerCall = 10;
    private long intervalMs = 1000;
    private int maxAttempts = 10;
    private String ownerId;
    private Duration lockTimeout = Duration.ofMinutes(5);
    private RetryPolicy sagaRetryPolicy;
    private int sagaMaxAttempts = 5;
    private long sagaTimerIntervalMs = 1000;
    private int sagaTimerBatchSize = 50;
    private Duration purgeRetention;
    private Duration purgeInterval = Duration.ofHours(1);
    private int purgeBatchSize = 500;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
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

    /** <b>Required.</b> */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /**
     * Required when sagas are registered.
     */
    public Builder sagaStore(SagaStore sagaStore) {
      this.sagaStore = sagaStore;
      return this;
    }

    public Builder processedEventStore(ProcessedEventStore processedEventStore) {
      this.processedEventStore = processedEventStore;
      return this;
    }

    /**
     * Bus the publisher drains to. Optional; without it the instance is writer-only.
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Source name on every published entry. Required with an event bus.
     */
    public Builder serviceName(String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder localDispatcher(LocalEventDispatcher localDispatcher) {
      this.localDispatcher = Objects.requireNonNull(localDispatcher, "localDispatcher");
      return this;
    }

    public Builder saga(SagaDefinition definition) {
      sagas.add(Objects.requireNonNull(definition, "definition"));
      return this;
    }

    public Builder maxConflictRetries(int maxConflictRetries) {
      this.maxConflictRetries = maxConflictRetries;
      return this;
    }

    public Builder publisherRetryPolicy(RetryPolicy retryPolicy) {
      this.publisherRetryPolicy = retryPolicy;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder maxEntriesPerCall(int maxEntriesPerCall) {
      this.maxEntriesPerCall = maxEntriesPerCall;
      return this;
    }

    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      return this;
    }

    public Builder sagaRetryPolicy(RetryPolicy retryPolicy) {
      this.sagaRetryPolicy = retryPolicy;
      return this;
    }

    public Builder sagaMaxAttempts(int sagaMaxAttempts) {
      this.sagaMaxAttempts = sagaMaxAttempts;
      return this;
    }

    public Builder sagaTimerIntervalMs(long sagaTimerIntervalMs) {
      this.sagaTimerIntervalMs = sagaTimerIntervalMs;
      return this;
    }

    public Builder sagaTimerBatchSize(int sagaTimerBatchSize) {
      this.sagaTimerBatchSize = sagaTimerBatchSize;
      return this;
    }

    /**
     * How long DELIVERED entries are kept before the purger deletes them. Unset by
     * default, which leaves purging off.
     */
    public Builder purgeRetention(Duration purgeRetention) {
      this.purgeRetention = purgeRetention;
      return this;
    }

    /** Time between purge cycles. Default: 1 hour. */
    public Builder purgeInterval(Duration purgeInterval) {
      this.purgeInterval = Objects.requireNonNull(purgeInterval, "purgeInterval");
      return this;
    }

    /** Default: 500. */
    public Builder purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return this;
    }

    /**
     * @throws IllegalStateException if called twice on the same builder
     */
    public EventFlow build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(txContext, "txContext");
      Objects.requireNonNull(transactionRunner, "transactionRunner");
      Objects.requireNonNull(eventStore, "eventStore");
      Objects.requireNonNull(outboxStore, "outboxStore");

      OutboxPublisher publisher = null;
      if (eventBus != null) {
        publisher = OutboxPublisher.builder()
            .connectionProvider(connectionProvider)
            .outboxStore(outboxStore)
            .eventBus(eventBus)
            .serviceName(serviceName)
            .retryPolicy(publisherRetryPolicy)
            .maxAttempts(maxAttempts)
            .workerCount(workerCount)
            .batchSize(batchSize)
            .maxEntriesPerCall(maxEntriesPerCall)
            .intervalMs(intervalMs)
            .ownerId(ownerId)
            .lockTimeout(lockTimeout)
            .metrics(metrics)
            .clock(clock)
            .build();
      }

      DeliveredEntryPurger purger = null;
      if (publisher != null && purgeRetention != null) {
        purger = DeliveredEntryPurger.builder()
            .connectionProvider(connectionProvider)
            .outboxStore(outboxStore)
            .retention(purgeRetention)
            .batchSize(purgeBatchSize)
            .intervalSeconds(Math.max(1L, purgeInterval.getSeconds()))
            .clock(clock)
            .build();
      }

      SagaCoordinator coordinator = null;
      SagaTimerPoller timerPoller = null;
      if (!sagas.isEmpty()) {
        coordinator = SagaCoordinator.builder()
            .registerAll(sagas)
            .sagaStore(Objects.requireNonNull(sagaStore, "sagaStore"))
            .processedEvents(processedEventStore)
            .txContext(txContext)
            .transactionRunner(transactionRunner)
            .retryPolicy(sagaRetryPolicy)
            .maxAttempts(sagaMaxAttempts)
            .metrics(metrics)
            .clock(clock)
            .build();
        timerPoller = SagaTimerPoller.builder()
            .connectionProvider(connectionProvider)
            .sagaStore(sagaStore)
            .coordinator(coordinator)
            .intervalMs(sagaTimerIntervalMs)
            .batchSize(sagaTimerBatchSize)
            .ownerId(ownerId == null ? null : ownerId + "-saga")
            .lockTimeout(lockTimeout)
            .clock(clock)
            .build();
      }
      return new EventFlow(this, publisher, purger, coordinator, timerPoller);
    }
  }
}
