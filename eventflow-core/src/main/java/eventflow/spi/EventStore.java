package eventflow.spi;

import eventflow.ConcurrencyConflictException;
import eventflow.DomainEvent;

import java.sql.Connection;
import java.util.List;

/**
 * Append-only per-aggregate event log with optimistic concurrency.
 *
 * <p>Streams are keyed by {@code (aggregateType, aggregateId)}. Within a stream the
 * events form a total order by {@code version} without gaps; nothing is ordered across
 * streams. All methods receive an explicit {@link Connection} so the caller controls
 * the transaction boundary.
 */
public interface EventStore {

    /**
     * Appends events to a stream if its current version equals {@code expectedVersion}.
     *
     * <p>The events must carry versions {@code expectedVersion + 1 ... expectedVersion + n}
     * in order. Nothing is written when the list is empty.
     *
     * @return {@code expectedVersion + events.size()}
     * @throws ConcurrencyConflictException if the stream moved past {@code expectedVersion},
     *                                      or a concurrent writer claimed the same versions
     * @throws IllegalArgumentException     if an event belongs to another stream or carries
     *                                      an unexpected version
     */
    long append(Connection conn, String aggregateType, String aggregateId, long expectedVersion,
                List<DomainEvent> events);

    /**
     * Returns the full stream in version order, or an empty list when it does not exist.
     */
    List<DomainEvent> load(Connection conn, String aggregateType, String aggregateId);

    /**
     * Returns the events with a version strictly greater than {@code afterVersion}.
     */
    List<DomainEvent> loadAfter(Connection conn, String aggregateType, String aggregateId, long afterVersion);

    /**
     * Returns the highest stored version of a stream, {@code 0} when it does not exist.
     */
    long currentVersion(Connection conn, String aggregateType, String aggregateId);

    /**
     * Returns whether an event with the given id has been stored.
     */
    boolean contains(Connection conn, String eventId);
}
