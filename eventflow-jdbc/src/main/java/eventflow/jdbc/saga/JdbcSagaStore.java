package eventflow.jdbc.saga;

import eventflow.jdbc.JdbcDialect;
import eventflow.jdbc.JdbcStoreException;
import eventflow.jdbc.JdbcTemplate;
import eventflow.jdbc.TableNames;
import eventflow.model.SagaState;
import eventflow.model.SagaStatus;
import eventflow.spi.SagaStore;
import eventflow.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC saga store for H2 and PostgreSQL.
 *
 * <p>Saga data is stored as a flat JSON object. Timer claims use the same
 * {@code locked_by}/{@code locked_at} columns as the outbox; a successful
 * {@link #compareAndSet} clears the claim.
 */
public final class JdbcSagaStore implements SagaStore {

  private static final String COLUMNS = "saga_id, saga_type, correlation_id, step, status, data, wake_at, " +
      "attempts, last_error, trigger_event_id, trigger_occurred_at, version, created_at, updated_at, retry_event";

  private final JdbcDialect dialect;
  private final String tableName;
  private final JdbcTemplate jdbc;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<SagaState> rowMapper;

  public JdbcSagaStore(JdbcDialect dialect) {
    this(dialect, TableNames.SAGAS, JdbcTemplate.DEFAULT, JsonCodec.getDefault());
  }

  public JdbcSagaStore(JdbcDialect dialect, String tableName, JdbcTemplate jdbc, JsonCodec jsonCodec) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.tableName = TableNames.validate(tableName);
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new SagaState(
        rs.getString("saga_id"),
        rs.getString("saga_type"),
        rs.getString("correlation_id"),
        rs.getInt("step"),
        SagaStatus.fromCode(rs.getInt("status")),
        this.jsonCodec.parseStringMap(rs.getString("data")),
        JdbcTemplate.instant(rs, "wake_at"),
        rs.getInt("attempts"),
        rs.getString("last_error"),
        rs.getString("trigger_event_id"),
        JdbcTemplate.instant(rs, "trigger_occurred_at"),
        rs.getLong("version"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "updated_at"),
        rs.getString("retry_event"));
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public boolean insertIfAbsent(Connection conn, SagaState state) {
    Object[] params = {
        state.sagaId(), state.sagaType(), state.correlationId(), state.step(), state.status().code(),
        jsonCodec.toJson(state.data()), JdbcTemplate.timestamp(state.wakeAt()), state.attempts(),
        state.lastError(), state.triggerEventId(), JdbcTemplate.timestamp(state.triggerOccurredAt()),
        state.version(), JdbcTemplate.timestamp(state.createdAt()), JdbcTemplate.timestamp(state.updatedAt()),
        state.retryEvent()};
    String insert = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    if (dialect.supportsSkipLocked()) {
      return jdbc.update(conn, insert + " ON CONFLICT (saga_type, correlation_id) DO NOTHING", params) == 1;
    }
    if (findByCorrelation(conn, state.sagaType(), state.correlationId()).isPresent()) {
      return false;
    }
    try {
      return jdbc.update(conn, insert, params) == 1;
    } catch (JdbcStoreException e) {
      if (e.isIntegrityViolation()) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public Optional<SagaState> findById(Connection conn, String sagaId) {
    List<SagaState> rows = jdbc.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE saga_id=?", rowMapper, sagaId);
    return rows.stream().findFirst();
  }

  @Override
  public Optional<SagaState> findByCorrelation(Connection conn, String sagaType, String correlationId) {
    List<SagaState> rows = jdbc.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE saga_type=? AND correlation_id=?",
        rowMapper, sagaType, correlationId);
    return rows.stream().findFirst();
  }

  @Override
  public List<SagaState> findActiveByCorrelation(Connection conn, String correlationId) {
    return jdbc.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName +
            " WHERE correlation_id=? AND status=" + SagaStatus.ACTIVE.code() + " ORDER BY created_at, saga_id",
        rowMapper, correlationId);
  }

  @Override
  public boolean compareAndSet(Connection conn, SagaState expected, SagaState next) {
    if (!expected.sagaId().equals(next.sagaId())) {
      throw new IllegalArgumentException("Cannot replace saga " + expected.sagaId() + " with " + next.sagaId());
    }
    String sql = "UPDATE " + tableName + " SET step=?, status=?, data=?, wake_at=?, attempts=?, last_error=?," +
        " version=?, updated_at=?, retry_event=?, locked_by=NULL, locked_at=NULL" +
        " WHERE saga_id=? AND step=? AND version=?";
    return jdbc.update(conn, sql,
        next.step(), next.status().code(), jsonCodec.toJson(next.data()), JdbcTemplate.timestamp(next.wakeAt()),
        next.attempts(), next.lastError(), next.version(), JdbcTemplate.timestamp(next.updatedAt()), next.retryEvent(),
        expected.sagaId(), expected.step(), expected.version()) == 1;
  }

  @Override
  public List<SagaState> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String due = "SELECT saga_id FROM " + tableName +
        " WHERE status=" + SagaStatus.ACTIVE.code() + " AND wake_at <= ?" +
        " AND (locked_by IS NULL OR locked_at < ?) ORDER BY wake_at LIMIT ?";
    if (dialect.supportsSkipLocked()) {
      String sql = "UPDATE " + tableName + " SET locked_by=?, locked_at=? WHERE saga_id IN (" +
          due + " FOR UPDATE SKIP LOCKED) RETURNING " + COLUMNS;
      List<SagaState> claimed = new ArrayList<>(jdbc.updateReturning(conn, sql, rowMapper,
          ownerId, JdbcTemplate.timestamp(nowMs), JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(lockExpiry),
          limit));
      claimed.sort(Comparator.comparing(SagaState::wakeAt));
      return claimed;
    }
    int updated = jdbc.update(conn,
        "UPDATE " + tableName + " SET locked_by=?, locked_at=? WHERE saga_id IN (" + due + ")",
        ownerId, JdbcTemplate.timestamp(nowMs), JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(lockExpiry),
        limit);
    if (updated == 0) return List.of();
    return jdbc.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE locked_by=? AND locked_at=? ORDER BY wake_at",
        rowMapper, ownerId, JdbcTemplate.timestamp(nowMs));
  }
}
