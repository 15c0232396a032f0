package eventflow.jdbc.event;

import eventflow.ConcurrencyConflictException;
import eventflow.DomainEvent;
import eventflow.jdbc.JdbcStoreException;
import eventflow.jdbc.JdbcTemplate;
import eventflow.jdbc.TableNames;
import eventflow.spi.EventStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC event store for H2 and PostgreSQL.
 *
 * <p>Optimistic concurrency is enforced twice: the append first compares the stream's
 * current version with the expected one, and the unique key on
 * {@code (aggregate_type, aggregate_id, version)} rejects a concurrent writer that
 * passed the same check. Both cases surface as {@link ConcurrencyConflictException}.
 * On PostgreSQL the key violation aborts the caller's transaction, which must then be
 * rolled back; {@link eventflow.aggregate.AggregateRepository} does this before it
 * retries.
 */
public final class JdbcEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(JdbcEventStore.class.getName());

  private static final String COLUMNS = "event_id, aggregate_type, aggregate_id, version, event_name, " +
      "occurred_at, payload, correlation_id, causation_id, partition_key, sort_key";

  private static final JdbcTemplate.RowMapper<DomainEvent> EVENT_ROW_MAPPER = rs -> DomainEvent
      .builder(rs.getString("event_name"))
      .eventId(rs.getString("event_id"))
      .aggregate(rs.getString("aggregate_type"), rs.getString("aggregate_id"))
      .version(rs.getLong("version"))
      .occurredAt(JdbcTemplate.instant(rs, "occurred_at"))
      .payloadJson(rs.getString("payload"))
      .correlationId(rs.getString("correlation_id"))
      .causationId(rs.getString("causation_id"))
      .build();

  private final String tableName;
  private final JdbcTemplate jdbc;

  public JdbcEventStore() {
    this(TableNames.EVENTS, JdbcTemplate.DEFAULT);
  }

  public JdbcEventStore(String tableName, JdbcTemplate jdbc) {
    this.tableName = TableNames.validate(tableName);
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public long append(Connection conn, String aggregateType, String aggregateId, long expectedVersion,
      List<DomainEvent> events) {
    Objects.requireNonNull(aggregateType, "aggregateType");
    Objects.requireNonNull(aggregateId, "aggregateId");
    Objects.requireNonNull(events, "events");
    if (expectedVersion < 0) {
      throw new IllegalArgumentException("expectedVersion must be >= 0, got: " + expectedVersion);
    }
    if (events.isEmpty()) {
      return expectedVersion;
    }
    String partitionKey = DomainEvent.partitionKey(aggregateType, aggregateId);
    List<Object[]> rows = new ArrayList<>(events.size());
    long next = expectedVersion;
    for (DomainEvent event : events) {
      if (!event.aggregateType().equals(aggregateType) || !event.aggregateId().equals(aggregateId)) {
        throw new IllegalArgumentException("Event " + event.eventId() + " belongs to "
            + event.partitionKey() + ", not " + partitionKey);
      }
      if (event.version() != ++next) {
        throw new IllegalArgumentException("Event " + event.eventId() + " has version " + event.version()
            + ", expected " + next);
      }
      rows.add(new Object[]{
          event.eventId(), aggregateType, aggregateId, event.version(), event.eventName(),
          JdbcTemplate.timestamp(event.occurredAt()), event.payloadJson(), event.correlationId(),
          event.causationId(), partitionKey, event.sortKey()});
    }

    long current = currentVersion(conn, aggregateType, aggregateId);
    if (current != expectedVersion) {
      throw new ConcurrencyConflictException(partitionKey, expectedVersion, current);
    }
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    try {
      jdbc.batchUpdate(conn, sql, rows);
    } catch (JdbcStoreException e) {
      if (e.isIntegrityViolation() || e.isSerializationFailure()) {
        logger.log(Level.FINE, "Concurrent append detected on " + partitionKey, e);
        throw new ConcurrencyConflictException(partitionKey, expectedVersion, -1, e);
      }
      throw e;
    }
    return next;
  }

  @Override
  public List<DomainEvent> load(Connection conn, String aggregateType, String aggregateId) {
    return loadAfter(conn, aggregateType, aggregateId, 0);
  }

  @Override
  public List<DomainEvent> loadAfter(Connection conn, String aggregateType, String aggregateId, long afterVersion) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE aggregate_type=? AND aggregate_id=? AND version>? ORDER BY version";
    return jdbc.query(conn, sql, EVENT_ROW_MAPPER, aggregateType, aggregateId, afterVersion);
  }

  @Override
  public long currentVersion(Connection conn, String aggregateType, String aggregateId) {
    String sql = "SELECT COALESCE(MAX(version), 0) FROM " + tableName +
        " WHERE aggregate_type=? AND aggregate_id=?";
    return jdbc.queryForLong(conn, sql, aggregateType, aggregateId);
  }

  @Override
  public boolean contains(Connection conn, String eventId) {
    String sql = "SELECT COUNT(*) FROM " + tableName + " WHERE event_id=?";
    return jdbc.queryForLong(conn, sql, eventId) > 0;
  }
}
