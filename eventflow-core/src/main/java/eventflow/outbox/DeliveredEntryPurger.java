package eventflow.outbox;

import eventflow.spi.ConnectionProvider;
import eventflow.spi.OutboxStore;
import eventflow.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically deletes DELIVERED outbox entries older than a retention period.
 *
 * <p>Each cycle deletes in batches until a batch comes back short. Every batch uses
 * its own auto-committed connection. DEAD entries are never purged.
 */
public final class DeliveredEntryPurger implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveredEntryPurger.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OutboxStore outboxStore;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private DeliveredEntryPurger(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
    if (builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.retention = builder.retention;
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DeliveredEntryPurger has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventflow-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Runs one purge cycle.
   *
   * @return number of entries deleted
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    long total = 0;
    try {
      Instant cutoff = clock.instant().minus(retention);
      int deleted;
      do {
        deleted = purgeBatch(cutoff);
        total += deleted;
      } while (deleted >= batchSize);
      if (total > 0) {
        logger.log(Level.INFO, "Purged {0} delivered outbox entries older than {1}", new Object[]{total, cutoff});
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Purge cycle failed", e);
    }
    return total;
  }

  private int purgeBatch(Instant cutoff) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return outboxStore.purgeDelivered(conn, cutoff, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for purge", e);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link DeliveredEntryPurger}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private OutboxStore outboxStore;
    private Duration retention = Duration.ofDays(7);
    private int batchSize = 500;
    private long intervalSeconds = 3600;
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

    /**
     * How long delivered entries are kept. Default: 7 days.
     */
    public Builder retention(Duration retention) {
      this.retention = Objects.requireNonNull(retention, "retention");
      return this;
    }

    /** Default: 500. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Default: 3600. */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public DeliveredEntryPurger build() {
      return new DeliveredEntryPurger(this);
    }
  }
}
