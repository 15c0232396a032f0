package eventflow.outbox;

import eventflow.model.OutboxEntry;
import eventflow.spi.ConnectionProvider;
import eventflow.spi.OutboxStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for outbox entries that exhausted their delivery attempts.
 *
 * <p>Manages connections internally. Replaying moves an entry from DEAD back to PENDING
 * with zero attempts so the publisher picks it up again.
 */
public final class DeadEntryManager {
  private static final Logger logger = Logger.getLogger(DeadEntryManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OutboxStore outboxStore;

  public DeadEntryManager(ConnectionProvider connectionProvider, OutboxStore outboxStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
  }

  /**
   * @param eventName     optional event name filter ({@code null} for all)
   * @param aggregateType optional aggregate type filter ({@code null} for all)
   * @return dead entries, oldest first; empty if the query failed
   */
  public List<OutboxEntry> query(String eventName, String aggregateType, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return outboxStore.queryDead(conn, eventName, aggregateType, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query dead outbox entries", e);
      return List.of();
    }
  }

  /**
   * @return {@code true} if the entry was DEAD and is now PENDING
   */
  public boolean replay(String eventId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return outboxStore.replayDead(conn, eventId) > 0;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to replay dead outbox entry " + eventId, e);
      return false;
    }
  }

  /**
   * Replays every DEAD entry matching the filters, {@code batchSize} at a time.
   *
   * @return number of entries replayed
   */
  public int replayAll(String eventName, String aggregateType, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int total = 0;
    List<OutboxEntry> batch;
    do {
      try (Connection conn = connectionProvider.getConnection()) {
        batch = outboxStore.queryDead(conn, eventName, aggregateType, batchSize);
        for (OutboxEntry entry : batch) {
          total += outboxStore.replayDead(conn, entry.eventId());
        }
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to replay dead outbox batch", e);
        break;
      }
    } while (batch.size() >= batchSize);
    return total;
  }

  /**
   * @param eventName optional event name filter ({@code null} for all)
   */
  public int count(String eventName) {
    try (Connection conn = connectionProvider.getConnection()) {
      return outboxStore.countDead(conn, eventName);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count dead outbox entries", e);
      return 0;
    }
  }
}
