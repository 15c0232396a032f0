package eventflow.jdbc.consumer;

import eventflow.jdbc.JdbcDialect;
import eventflow.jdbc.JdbcStoreException;
import eventflow.jdbc.JdbcTemplate;
import eventflow.jdbc.TableNames;
import eventflow.spi.ProcessedEventStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Objects;

/**
 * JDBC idempotency ledger keyed by {@code (consumer_name, event_id)}.
 */
public final class JdbcProcessedEventStore implements ProcessedEventStore {

  private final JdbcDialect dialect;
  private final String tableName;
  private final JdbcTemplate jdbc;

  public JdbcProcessedEventStore(JdbcDialect dialect) {
    this(dialect, TableNames.PROCESSED, JdbcTemplate.DEFAULT);
  }

  public JdbcProcessedEventStore(JdbcDialect dialect, String tableName, JdbcTemplate jdbc) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tableName = TableNames.validate(tableName);
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  @Override
  public boolean markProcessed(Connection conn, String consumerName, String eventId, Instant processedAt) {
    String insert = "INSERT INTO " + tableName + " (consumer_name, event_id, processed_at) VALUES (?,?,?)";
    if (dialect.supportsSkipLocked()) {
      return jdbc.update(conn, insert + " ON CONFLICT (consumer_name, event_id) DO NOTHING",
          consumerName, eventId, JdbcTemplate.timestamp(processedAt)) == 1;
    }
    if (isProcessed(conn, consumerName, eventId)) {
      return false;
    }
    try {
      return jdbc.update(conn, insert, consumerName, eventId, JdbcTemplate.timestamp(processedAt)) == 1;
    } catch (JdbcStoreException e) {
      if (e.isIntegrityViolation()) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public boolean isProcessed(Connection conn, String consumerName, String eventId) {
    return jdbc.queryForLong(conn,
        "SELECT COUNT(*) FROM " + tableName + " WHERE consumer_name=? AND event_id=?",
        consumerName, eventId) > 0;
  }
}
