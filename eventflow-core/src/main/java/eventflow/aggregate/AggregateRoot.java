package eventflow.aggregate;

import eventflow.AggregateType;
import eventflow.DomainEvent;
import eventflow.EventMetadata;
import eventflow.EventType;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for event-sourced entities.
 *
 * <p>State changes are expressed as events: a business operation validates its input,
 * then calls {@link #raise(EventType, Object)}, which builds the next event and hands it to
 * {@link #apply(DomainEvent)}. {@code apply} runs the registered mutation and queues the
 * event as pending. The {@link AggregateRepository} persists pending events and calls
 * {@link #commit()} once they are durable.
 *
 * <p>{@link #version()} is always the number of events applied to this instance,
 * replayed plus pending.
 *
 * <pre>{@code
 * public final class UserAccount extends AggregateRoot<UserAccount> {
 *   private static final EventMutators<UserAccount> MUTATORS = ...;
 *
 *   public void changeRole(Role role) {
 *     if (this.role == role) return;
 *     raise(UserEvents.ROLE_CHANGED, new RoleChanged(this.role, role));
 *   }
 *
 *   protected EventMutators<UserAccount> mutators() { return MUTATORS; }
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe; each command works on its own instance.
 *
 * @param <A> the concrete aggregate class
 */
public abstract class AggregateRoot<A extends AggregateRoot<A>> {

    private final String aggregateType;
    private final String aggregateId;
    private final List<DomainEvent> pending = new ArrayList<>();
    private long version;
    private EventMetadata metadata = EventMetadata.NONE;
    private Clock clock = Clock.systemUTC();

    protected AggregateRoot(AggregateType aggregateType, String aggregateId) {
        this(Objects.requireNonNull(aggregateType, "aggregateType").name(), aggregateId);
    }

    protected AggregateRoot(String aggregateType, String aggregateId) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        if (aggregateId.isEmpty()) {
            throw new IllegalArgumentException("aggregateId cannot be empty");
        }
    }

    /**
     * Returns the dispatch table of this aggregate type, normally a static constant.
     */
    protected abstract EventMutators<A> mutators();

    public final String aggregateType() {
        return aggregateType;
    }

    public final String aggregateId() {
        return aggregateId;
    }

    public final long version() {
        return version;
    }

    /**
     * Applies a new event: runs its mutation and queues it for persistence.
     *
     * @throws IllegalArgumentException if the event belongs to another aggregate, does not
     *                                  carry version {@code version() + 1}, or has no mutation
     */
    public final void apply(DomainEvent event) {
        checkNext(event);
        mutators().applyLive(self(), event);
        pending.add(event);
        version++;
    }

    /**
     * Returns the events applied since the last {@link #commit()}, in order.
     */
    public final List<DomainEvent> pendingEvents() {
        return Collections.unmodifiableList(pending);
    }

    public final boolean hasPendingEvents() {
        return !pending.isEmpty();
    }

    /**
     * Clears the pending events. Only call after they were durably stored.
     */
    public final void commit() {
        pending.clear();
    }

    /**
     * Rebuilds state from stored events, continuing from the current version.
     *
     * <p>Events must be contiguous and start at {@code version() + 1}. Replay does not
     * touch the pending queue and performs no I/O.
     *
     * @throws IllegalStateException        if there are pending events
     * @throws IllegalArgumentException     if the history is not contiguous or belongs elsewhere
     * @throws eventflow.ReplayException if an event cannot be applied
     */
    public final void replay(List<DomainEvent> history) {
        Objects.requireNonNull(history, "history");
        if (!pending.isEmpty()) {
            throw new IllegalStateException("Cannot replay onto an aggregate with pending events");
        }
        for (DomainEvent event : history) {
            checkNext(event);
            mutators().applyReplayed(self(), event);
            version++;
        }
    }

    /**
     * Builds the next event with the current metadata and clock and applies it.
     *
     * @param eventType the event name
     * @param payload   payload object, serialized with the mutators' codec
     * @return the applied event
     */
    protected final DomainEvent raise(EventType eventType, Object payload) {
        Objects.requireNonNull(eventType, "eventType");
        DomainEvent event = DomainEvent.builder(eventType)
                .aggregate(aggregateType, aggregateId)
                .version(version + 1)
                .occurredAt(clock.instant())
                .payloadJson(payload == null ? "{}" : mutators().jsonCodec().toJson(payload))
                .metadata(metadata)
                .build();
        apply(event);
        return event;
    }

    /**
     * Sets the causality ids stamped on events raised from now on.
     */
    public final void useMetadata(EventMetadata metadata) {
        this.metadata = metadata == null ? EventMetadata.NONE : metadata;
    }

    protected final EventMetadata metadata() {
        return metadata;
    }

    /**
     * Replaces the clock used for event timestamps.
     */
    public final void useClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    protected final Clock clock() {
        return clock;
    }

    private void checkNext(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        if (!aggregateType.equals(event.aggregateType()) || !aggregateId.equals(event.aggregateId())) {
            throw new IllegalArgumentException("Event " + event.eventId() + " belongs to "
                    + event.partitionKey() + ", not " + DomainEvent.partitionKey(aggregateType, aggregateId));
        }
        if (event.version() != version + 1) {
            throw new IllegalArgumentException("Expected version " + (version + 1)
                    + " but event " + event.eventId() + " has version " + event.version());
        }
    }

    @SuppressWarnings("unchecked")
    private A self() {
        return (A) this;
    }
}
