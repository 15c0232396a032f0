package eventflow.spi;

import eventflow.model.SagaState;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for saga state rows.
 *
 * <p>A saga is unique per {@code (sagaType, correlationId)}. Updates are compare-and-set
 * on {@code (step, version)} so duplicate deliveries and duplicate timer fires cannot
 * advance a saga twice.
 */
public interface SagaStore {

  /**
   * Inserts a new saga unless one already exists for its {@code (sagaType, correlationId)}.
   *
   * @return {@code true} if the row was inserted
   */
  boolean insertIfAbsent(Connection conn, SagaState state);

  Optional<SagaState> findById(Connection conn, String sagaId);

  Optional<SagaState> findByCorrelation(Connection conn, String sagaType, String correlationId);

  /**
   * Returns the ACTIVE sagas of the given correlation id.
   */
  List<SagaState> findActiveByCorrelation(Connection conn, String correlationId);

  /**
   * Replaces the row with {@code next} if it still holds {@code expected.step()} and
   * {@code expected.version()}. Clears any timer claim.
   *
   * @return {@code true} if the row was updated
   */
  boolean compareAndSet(Connection conn, SagaState expected, SagaState next);

  /**
   * Claims up to {@code limit} ACTIVE sagas whose {@code wakeAt} is at or before
   * {@code now} and that are unclaimed or whose claim is older than {@code lockExpiry}.
   */
  List<SagaState> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit);
}
