package eventflow.spi;

import eventflow.DomainEvent;
import eventflow.model.OutboxEntry;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for outbox entries. Status transitions:
 * PENDING → DELIVERED, PENDING → FAILED → ... → DELIVERED, or FAILED → DEAD;
 * an operator replay moves DEAD back to PENDING.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code eventflow-jdbc} module.
 */
public interface OutboxStore {

    /**
     * Inserts one PENDING entry for the event.
     */
    void insert(Connection conn, DomainEvent event);

    /**
     * Inserts PENDING entries for the events. Default loops {@link #insert}.
     */
    default void insertBatch(Connection conn, List<DomainEvent> events) {
        for (DomainEvent event : events) {
            insert(conn, event);
        }
    }

    /**
     * Claims up to {@code limit} due entries for {@code ownerId}.
     *
     * <p>An entry is due when it is PENDING, or FAILED with a next-attempt time at or
     * before {@code now}, and is not claimed by another owner after {@code lockExpiry}.
     * Entries are not claimable while an older undelivered entry of the same aggregate
     * is waiting for its backoff or is held by another claim, so one aggregate's entries
     * are delivered in append order. DEAD entries never block.
     *
     * @return claimed entries ordered by aggregate and version
     */
    List<OutboxEntry> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit);

    /**
     * Marks an entry DELIVERED at {@code deliveredAt} and clears its claim.
     *
     * @return number of rows updated (0 or 1)
     */
    int markDelivered(Connection conn, String eventId, Instant deliveredAt);

    /**
     * Marks an entry FAILED, increments its attempt count and schedules the next attempt.
     * Clears the claim.
     *
     * @return number of rows updated (0 or 1)
     */
    int markFailed(Connection conn, String eventId, Instant nextAttemptAt, String error);

    /**
     * Marks an entry DEAD, increments its attempt count and clears the claim.
     *
     * @return number of rows updated (0 or 1)
     */
    int markDead(Connection conn, String eventId, String error);

    /**
     * Releases a claim without recording an attempt.
     *
     * @return number of rows updated (0 or 1)
     */
    int release(Connection conn, String eventId);

    /**
     * Queries DEAD entries, oldest first, with optional filters.
     *
     * @param eventName     optional event name filter ({@code null} for all)
     * @param aggregateType optional aggregate type filter ({@code null} for all)
     */
    List<OutboxEntry> queryDead(Connection conn, String eventName, String aggregateType, int limit);

    /**
     * Resets a DEAD entry to PENDING with zero attempts. Returns 0 when the entry is
     * missing or not DEAD.
     */
    int replayDead(Connection conn, String eventId);

    /**
     * Counts DEAD entries, optionally filtered by event name.
     */
    int countDead(Connection conn, String eventName);

    /**
     * Deletes up to {@code limit} DELIVERED entries created before {@code before}.
     *
     * @return number of rows deleted
     */
    int purgeDelivered(Connection conn, Instant before, int limit);

    /**
     * Returns the creation time of the oldest undelivered, non-dead entry.
     */
    Optional<Instant> oldestPendingCreatedAt(Connection conn);
}
