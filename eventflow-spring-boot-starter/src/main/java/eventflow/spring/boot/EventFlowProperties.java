package eventflow.spring.boot;

import eventflow.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for event-sourced aggregates, the outbox publisher and sagas.
 *
 * @see EventFlowAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventflow")
public class EventFlowProperties {

  /**
   * Source name stamped on every published bus entry.
   */
  private String serviceName = "eventflow";

  private final Publisher publisher = new Publisher();
  private final Retry retry = new Retry();
  private final Purge purge = new Purge();
  private final Saga saga = new Saga();
  private final Repository repository = new Repository();
  private final Tables tables = new Tables();
  private final Metrics metrics = new Metrics();

  public String getServiceName() {
    return serviceName;
  }

  public void setServiceName(String serviceName) {
    this.serviceName = serviceName;
  }

  public Publisher getPublisher() {
    return publisher;
  }

  public Retry getRetry() {
    return retry;
  }

  public Purge getPurge() {
    return purge;
  }

  public Saga getSaga() {
    return saga;
  }

  public Repository getRepository() {
    return repository;
  }

  public Tables getTables() {
    return tables;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Publisher {
    /**
     * Whether to publish outbox entries when an {@code EventBus} bean is present.
     */
    private boolean enabled = true;
    private int workerCount = 1;
    private int batchSize = 50;
    private int maxEntriesPerCall = 10;
    private long intervalMs = 1000;
    private Duration lockTimeout = Duration.ofMinutes(5);
    private int maxAttempts = 10;
    /**
     * Claim owner id; generated per worker when empty.
     */
    private String ownerId;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getMaxEntriesPerCall() {
      return maxEntriesPerCall;
    }

    public void setMaxEntriesPerCall(int maxEntriesPerCall) {
      this.maxEntriesPerCall = maxEntriesPerCall;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public Duration getLockTimeout() {
      return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public String getOwnerId() {
      return ownerId;
    }

    public void setOwnerId(String ownerId) {
      this.ownerId = ownerId;
    }
  }

  public static class Retry {
    private long baseDelayMs = 200;
    private long maxDelayMs = 60_000;

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }
  }

  /**
   * Removal of DELIVERED outbox entries. Runs only when the publisher does.
   */
  public static class Purge {
    private boolean enabled = false;
    /**
     * How long delivered entries are kept.
     */
    private Duration retention = Duration.ofDays(7);
    private long intervalMs = 3_600_000;
    private int batchSize = 500;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }
  }

  public static class Saga {
    private long timerIntervalMs = 1000;
    private int timerBatchSize = 50;
    private int maxAttempts = 5;

    public long getTimerIntervalMs() {
      return timerIntervalMs;
    }

    public void setTimerIntervalMs(long timerIntervalMs) {
      this.timerIntervalMs = timerIntervalMs;
    }

    public int getTimerBatchSize() {
      return timerBatchSize;
    }

    public void setTimerBatchSize(int timerBatchSize) {
      this.timerBatchSize = timerBatchSize;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }
  }

  public static class Repository {
    private int maxConflictRetries = 3;

    public int getMaxConflictRetries() {
      return maxConflictRetries;
    }

    public void setMaxConflictRetries(int maxConflictRetries) {
      this.maxConflictRetries = maxConflictRetries;
    }
  }

  public static class Tables {
    private String events = TableNames.EVENTS;
    private String outbox = TableNames.OUTBOX;
    private String sagas = TableNames.SAGAS;
    private String processed = TableNames.PROCESSED;

    public String getEvents() {
      return events;
    }

    public void setEvents(String events) {
      this.events = events;
    }

    public String getOutbox() {
      return outbox;
    }

    public void setOutbox(String outbox) {
      this.outbox = outbox;
    }

    public String getSagas() {
      return sagas;
    }

    public void setSagas(String sagas) {
      this.sagas = sagas;
    }

    public String getProcessed() {
      return processed;
    }

    public void setProcessed(String processed) {
      this.processed = processed;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "eventflow";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
