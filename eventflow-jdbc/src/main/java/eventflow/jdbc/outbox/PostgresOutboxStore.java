package eventflow.jdbc.outbox;

import eventflow.jdbc.JdbcTemplate;
import eventflow.model.OutboxEntry;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL outbox store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip
 * claim. Claims against one table are serialized with a transaction-scoped advisory
 * lock: the partition check reads committed claims only, so two workers claiming at
 * once could otherwise take consecutive entries of one aggregate.
 */
public final class PostgresOutboxStore extends AbstractJdbcOutboxStore {

  public PostgresOutboxStore() {
    super();
  }

  public PostgresOutboxStore(String tableName, JdbcTemplate jdbc) {
    super(tableName, jdbc);
  }

  @Override
  public AbstractJdbcOutboxStore withTable(String tableName, JdbcTemplate jdbc) {
    return new PostgresOutboxStore(tableName, jdbc);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<OutboxEntry> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    jdbc().query(conn, "SELECT pg_advisory_xact_lock(?)", rs -> Boolean.TRUE, claimLockKey());
    String sql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=? " +
        "WHERE event_id IN (" + claimableSubquery() + " FOR UPDATE OF c SKIP LOCKED" +
        ") RETURNING " + COLUMNS;
    List<OutboxEntry> claimed = new ArrayList<>(jdbc().updateReturning(conn, sql, ENTRY_ROW_MAPPER,
        ownerId, JdbcTemplate.timestamp(nowMs),
        JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(lockExpiry),
        JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(lockExpiry), limit));
    claimed.sort(PARTITION_ORDER);
    return claimed;
  }

  private long claimLockKey() {
    return ("eventflow.outbox." + tableName()).hashCode();
  }
}
