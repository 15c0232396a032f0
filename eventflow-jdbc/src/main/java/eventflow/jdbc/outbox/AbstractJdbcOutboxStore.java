package eventflow.jdbc.outbox;

import eventflow.DomainEvent;
import eventflow.jdbc.JdbcTemplate;
import eventflow.jdbc.TableNames;
import eventflow.model.DeliveryStatus;
import eventflow.model.OutboxEntry;
import eventflow.spi.OutboxStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC outbox store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimDue} to provide database-specific claim
 * strategies. Register custom implementations via
 * {@code META-INF/services/eventflow.jdbc.outbox.AbstractJdbcOutboxStore}.
 *
 * <p>An entry is claimable when it is due, unclaimed (or its claim expired), and no
 * older entry of the same aggregate is still undelivered and either waiting for its
 * backoff or held by a live claim. DELIVERED and DEAD entries never block.
 *
 * @see JdbcOutboxStores
 */
public abstract class AbstractJdbcOutboxStore implements OutboxStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final int PENDING = DeliveryStatus.PENDING.code();
  protected static final int DELIVERED = DeliveryStatus.DELIVERED.code();
  protected static final int FAILED = DeliveryStatus.FAILED.code();
  protected static final int DEAD = DeliveryStatus.DEAD.code();
  protected static final String UNDELIVERED_STATUS_IN = "(" + PENDING + "," + FAILED + ")";

  protected static final String COLUMNS = "event_id, event_name, aggregate_type, aggregate_id, version, " +
      "occurred_at, payload, correlation_id, causation_id, partition_key, status, attempts, " +
      "next_attempt_at, last_error, created_at";

  protected static final JdbcTemplate.RowMapper<OutboxEntry> ENTRY_ROW_MAPPER = rs -> new OutboxEntry(
      DomainEvent.builder(rs.getString("event_name"))
          .eventId(rs.getString("event_id"))
          .aggregate(rs.getString("aggregate_type"), rs.getString("aggregate_id"))
          .version(rs.getLong("version"))
          .occurredAt(JdbcTemplate.instant(rs, "occurred_at"))
          .payloadJson(rs.getString("payload"))
          .correlationId(rs.getString("correlation_id"))
          .causationId(rs.getString("causation_id"))
          .build(),
      DeliveryStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      JdbcTemplate.instant(rs, "next_attempt_at"),
      rs.getString("last_error"),
      JdbcTemplate.instant(rs, "created_at"));

  protected static final Comparator<OutboxEntry> PARTITION_ORDER = Comparator
      .comparing(OutboxEntry::partitionKey)
      .thenComparingLong(e -> e.event().version());

  private final String tableName;
  private final JdbcTemplate jdbc;

  protected AbstractJdbcOutboxStore() {
    this(TableNames.OUTBOX, JdbcTemplate.DEFAULT);
  }

  protected AbstractJdbcOutboxStore(String tableName, JdbcTemplate jdbc) {
    this.tableName = TableNames.validate(tableName);
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  /**
   * Unique identifier for this outbox store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this outbox store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind using another table or statement timeout.
   */
  public abstract AbstractJdbcOutboxStore withTable(String tableName, JdbcTemplate jdbc);

  public String tableName() {
    return tableName;
  }

  protected JdbcTemplate jdbc() {
    return jdbc;
  }

  @Override
  public void insert(Connection conn, DomainEvent event) {
    jdbc.update(conn, insertSql(), insertParams(event));
  }

  @Override
  public void insertBatch(Connection conn, List<DomainEvent> events) {
    if (events.isEmpty()) {
      return;
    }
    List<Object[]> rows = new ArrayList<>(events.size());
    for (DomainEvent event : events) {
      rows.add(insertParams(event));
    }
    jdbc.batchUpdate(conn, insertSql(), rows);
  }

  @Override
  public List<OutboxEntry> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
    // Truncate to millis so the stored value matches the follow-up select
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE " + tableName + " SET locked_by=?, locked_at=? " +
        "WHERE event_id IN (" + claimableSubquery() + ")";
    int updated = jdbc.update(conn, claimSql,
        ownerId, JdbcTemplate.timestamp(nowMs),
        JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(lockExpiry),
        JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(lockExpiry), limit);
    if (updated == 0) return List.of();
    // Phase 2: SELECT rows claimed in this cycle
    return selectClaimed(conn, ownerId, nowMs);
  }

  /**
   * Selects event ids of claimable entries.
   *
   * <p>Candidates are ordered by the creation time of their partition's oldest undelivered
   * entry, then by partition and version. Entries of one partition are therefore contiguous
   * and in version order, so the limit can cut off later versions but never an earlier one,
   * whatever the creation timestamps of individual entries say.
   *
   * <p>Parameters: now, lockExpiry (candidate), now, lockExpiry (older entries), limit.
   */
  protected String claimableSubquery() {
    return "SELECT c.event_id FROM " + tableName + " c" +
        " JOIN (SELECT partition_key, MIN(created_at) AS head_created_at FROM " + tableName +
        " WHERE status IN " + UNDELIVERED_STATUS_IN + " GROUP BY partition_key) h" +
        " ON h.partition_key=c.partition_key" +
        " WHERE c.status IN " + UNDELIVERED_STATUS_IN +
        " AND (c.status=" + PENDING + " OR c.next_attempt_at <= ?)" +
        " AND (c.locked_by IS NULL OR c.locked_at < ?)" +
        " AND NOT EXISTS (SELECT 1 FROM " + tableName + " o" +
        " WHERE o.partition_key=c.partition_key AND o.version<c.version" +
        " AND o.status IN " + UNDELIVERED_STATUS_IN +
        " AND ((o.status=" + FAILED + " AND o.next_attempt_at > ?)" +
        " OR (o.locked_by IS NOT NULL AND o.locked_at >= ?)))" +
        " ORDER BY h.head_created_at, c.partition_key, c.version LIMIT ?";
  }

  /**
   * Selects rows previously claimed by the given owner at the given lock timestamp.
   * Shared by subclasses that use a two-phase claim (UPDATE then SELECT).
   */
  protected List<OutboxEntry> selectClaimed(Connection conn, String ownerId, Instant lockedAt) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE locked_by=? AND locked_at=? ORDER BY partition_key, version";
    return jdbc.query(conn, sql, ENTRY_ROW_MAPPER, ownerId, JdbcTemplate.timestamp(lockedAt));
  }

  @Override
  public int markDelivered(Connection conn, String eventId, Instant deliveredAt) {
    String sql = "UPDATE " + tableName +
        " SET status=" + DELIVERED + ", delivered_at=?, locked_by=NULL, locked_at=NULL" +
        " WHERE event_id=? AND status<>" + DELIVERED;
    return jdbc.update(conn, sql, JdbcTemplate.timestamp(deliveredAt), eventId);
  }

  @Override
  public int markFailed(Connection conn, String eventId, Instant nextAttemptAt, String error) {
    String sql = "UPDATE " + tableName +
        " SET status=" + FAILED +
        ", attempts=attempts+1, next_attempt_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE event_id=? AND status<>" + DELIVERED;
    return jdbc.update(conn, sql, JdbcTemplate.timestamp(nextAttemptAt), truncateError(error), eventId);
  }

  @Override
  public int markDead(Connection conn, String eventId, String error) {
    String sql = "UPDATE " + tableName +
        " SET status=" + DEAD + ", attempts=attempts+1, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE event_id=? AND status<>" + DELIVERED;
    return jdbc.update(conn, sql, truncateError(error), eventId);
  }

  @Override
  public int release(Connection conn, String eventId) {
    String sql = "UPDATE " + tableName + " SET locked_by=NULL, locked_at=NULL WHERE event_id=?";
    return jdbc.update(conn, sql, eventId);
  }

  @Override
  public List<OutboxEntry> queryDead(Connection conn, String eventName, String aggregateType, int limit) {
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE status=" + DEAD);
    List<Object> params = new ArrayList<>();
    if (eventName != null) {
      sql.append(" AND event_name=?");
      params.add(eventName);
    }
    if (aggregateType != null) {
      sql.append(" AND aggregate_type=?");
      params.add(aggregateType);
    }
    sql.append(" ORDER BY created_at, version LIMIT ?");
    params.add(limit);
    return jdbc.query(conn, sql.toString(), ENTRY_ROW_MAPPER, params.toArray());
  }

  @Override
  public int replayDead(Connection conn, String eventId) {
    String sql = "UPDATE " + tableName +
        " SET status=" + PENDING + ", attempts=0, next_attempt_at=NULL, locked_by=NULL, locked_at=NULL" +
        " WHERE event_id=? AND status=" + DEAD;
    return jdbc.update(conn, sql, eventId);
  }

  @Override
  public int countDead(Connection conn, String eventName) {
    if (eventName == null) {
      return (int) jdbc.queryForLong(conn, "SELECT COUNT(*) FROM " + tableName + " WHERE status=" + DEAD);
    }
    return (int) jdbc.queryForLong(conn,
        "SELECT COUNT(*) FROM " + tableName + " WHERE status=" + DEAD + " AND event_name=?", eventName);
  }

  @Override
  public int purgeDelivered(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName + " WHERE event_id IN (" +
        "SELECT event_id FROM " + tableName +
        " WHERE status=" + DELIVERED + " AND created_at < ? ORDER BY created_at LIMIT ?)";
    return jdbc.update(conn, sql, JdbcTemplate.timestamp(before), limit);
  }

  @Override
  public Optional<Instant> oldestPendingCreatedAt(Connection conn) {
    String sql = "SELECT MIN(created_at) AS created_at FROM " + tableName +
        " WHERE status IN " + UNDELIVERED_STATUS_IN;
    List<Instant> oldest = jdbc.query(conn, sql, rs -> JdbcTemplate.instant(rs, "created_at"));
    return oldest.isEmpty() ? Optional.empty() : Optional.ofNullable(oldest.get(0));
  }

  private String insertSql() {
    return "INSERT INTO " + tableName + " (" + COLUMNS + ", delivered_at, locked_by, locked_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,NULL,NULL,?,NULL,NULL,NULL)";
  }

  private static Object[] insertParams(DomainEvent event) {
    return new Object[]{
        event.eventId(), event.eventName(), event.aggregateType(), event.aggregateId(), event.version(),
        JdbcTemplate.timestamp(event.occurredAt()), event.payloadJson(), event.correlationId(),
        event.causationId(), event.partitionKey(), PENDING, 0,
        JdbcTemplate.timestamp(event.occurredAt())};
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
