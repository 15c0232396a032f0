package eventflow.saga;

import eventflow.model.SagaState;
import eventflow.spi.ConnectionProvider;
import eventflow.spi.SagaStore;
import eventflow.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires persisted saga timers.
 *
 * <p>Each cycle claims due sagas ({@code wakeAt <= now}) under this poller's owner id and
 * hands them to {@link SagaCoordinator#fireTimer}. Claims expire after {@code lockTimeout},
 * so timers of a crashed node fire elsewhere; a restart fires overdue timers on the first cycle.
 */
public final class SagaTimerPoller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SagaTimerPoller.class.getName());

  private final ConnectionProvider connectionProvider;
  private final SagaStore sagaStore;
  private final SagaCoordinator coordinator;
  private final int batchSize;
  private final long intervalMs;
  private final String ownerId;
  private final Duration lockTimeout;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private SagaTimerPoller(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.sagaStore = Objects.requireNonNull(builder.sagaStore, "sagaStore");
    this.coordinator = Objects.requireNonNull(builder.coordinator, "coordinator");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.lockTimeout.isNegative() || builder.lockTimeout.isZero()) {
      throw new IllegalArgumentException("lockTimeout must be positive");
    }
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.ownerId = builder.ownerId != null ? builder.ownerId : "saga-timer-" + UUID.randomUUID().toString().substring(0, 8);
    this.lockTimeout = builder.lockTimeout;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SagaTimerPoller has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventflow-saga-timer-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, 0, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one cycle. Called by the scheduler; may be invoked directly.
   *
   * @return number of timers that advanced their saga
   */
  public int poll() {
    if (closed) {
      return 0;
    }
    int fired = 0;
    try {
      for (SagaState due : claimDue(clock.instant())) {
        if (coordinator.fireTimer(due.sagaId(), due.step())) {
          fired++;
        }
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Saga timer cycle failed", e);
    }
    return fired;
  }

  private List<SagaState> claimDue(Instant now) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        List<SagaState> claimed = sagaStore.claimDue(conn, ownerId, now, now.minus(lockTimeout), batchSize);
        conn.commit();
        return claimed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to claim due saga timers", e);
      return List.of();
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link SagaTimerPoller}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SagaStore sagaStore;
    private SagaCoordinator coordinator;
    private int batchSize = 50;
    private long intervalMs = 1000;
    private String ownerId;
    private Duration lockTimeout = Duration.ofMinutes(5);
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sagaStore(SagaStore sagaStore) {
      this.sagaStore = sagaStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder coordinator(SagaCoordinator coordinator) {
      this.coordinator = coordinator;
      return this;
    }

    /** Default: 50. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Default: 1000 ms. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /** Default: 5 minutes. */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public SagaTimerPoller build() {
      return new SagaTimerPoller(this);
    }
  }
}
