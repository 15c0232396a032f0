package eventflow;

import eventflow.util.Ids;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable fact recorded by an aggregate.
 *
 * <p>Each event belongs to exactly one aggregate stream, identified by
 * {@code (aggregateType, aggregateId)}, and occupies a 1-based {@code version}
 * position in that stream. The payload is a JSON object limited to
 * {@value #MAX_PAYLOAD_BYTES} bytes. Event ids are time-ordered UUIDs, so
 * sorting by id within one millisecond preserves creation order.
 *
 * <p>The causality envelope links events across services: {@code correlationId}
 * is shared by an entire request or saga chain, {@code causationId} names the
 * event or command that directly produced this one. When no correlation id is
 * given the event starts a new chain and uses its own id.
 *
 * @see eventflow.aggregate.AggregateRoot
 * @see EventMetadata
 */
public final class DomainEvent {
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB

    private final String eventId;
    private final String eventName;
    private final String aggregateType;
    private final String aggregateId;
    private final long version;
    private final Instant occurredAt;
    private final String payloadJson;
    private final String correlationId;
    private final String causationId;

    private DomainEvent(Builder builder) {
        this.eventId = builder.eventId == null ? Ids.newEventId() : builder.eventId;
        this.eventName = Objects.requireNonNull(builder.eventName, "eventName");
        if (this.eventName.isEmpty()) {
            throw new IllegalArgumentException("eventName cannot be empty");
        }
        this.aggregateType = Objects.requireNonNull(builder.aggregateType, "aggregateType");
        this.aggregateId = Objects.requireNonNull(builder.aggregateId, "aggregateId");
        if (builder.version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got: " + builder.version);
        }
        this.version = builder.version;
        this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;

        String payload = builder.payloadJson == null ? "{}" : builder.payloadJson;
        if (payload.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        this.payloadJson = payload;
        this.correlationId = builder.correlationId == null ? this.eventId : builder.correlationId;
        this.causationId = builder.causationId;
    }

    /**
     * Creates a builder for an event with a type-safe name.
     *
     * @param eventType the event type
     * @return a new builder
     */
    public static Builder builder(EventType eventType) {
        Objects.requireNonNull(eventType, "eventType");
        return new Builder(eventType.eventName());
    }

    /**
     * Creates a builder for an event with a string name.
     *
     * @param eventName the event name, e.g. {@code "user.created"}
     * @return a new builder
     */
    public static Builder builder(String eventName) {
        return new Builder(eventName);
    }

    public String eventId() {
        return eventId;
    }

    public String eventName() {
        return eventName;
    }

    public String aggregateType() {
        return aggregateType;
    }

    public String aggregateId() {
        return aggregateId;
    }

    /**
     * Position of this event in its aggregate stream, starting at 1.
     */
    public long version() {
        return version;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public String payloadJson() {
        return payloadJson;
    }

    public String correlationId() {
        return correlationId;
    }

    /**
     * Returns the id of the event or command that caused this event, or {@code null}
     * when the event was produced directly by an inbound request.
     */
    public String causationId() {
        return causationId;
    }

    /**
     * Partition key of the aggregate stream this event belongs to.
     *
     * @return {@code "<AGGREGATE_TYPE>#<aggregateId>"}
     */
    public String partitionKey() {
        return partitionKey(aggregateType, aggregateId);
    }

    /**
     * Sort key of this event inside its partition.
     *
     * @return {@code "EVENT#<occurredAt>#<eventId>"}
     */
    public String sortKey() {
        return "EVENT#" + occurredAt + "#" + eventId;
    }

    /**
     * Metadata for events caused by this one: same correlation, this event as cause.
     */
    public EventMetadata causedMetadata() {
        return EventMetadata.of(correlationId, eventId);
    }

    public static String partitionKey(String aggregateType, String aggregateId) {
        return aggregateType.toUpperCase(Locale.ROOT) + "#" + aggregateId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomainEvent other)) return false;
        return eventId.equals(other.eventId);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "DomainEvent{eventId=" + eventId
                + ", eventName=" + eventName
                + ", aggregate=" + partitionKey()
                + ", version=" + version + '}';
    }

    /**
     * Builder for {@link DomainEvent}.
     */
    public static final class Builder {
        private final String eventName;
        private String eventId;
        private String aggregateType;
        private String aggregateId;
        private long version;
        private Instant occurredAt;
        private String payloadJson;
        private String correlationId;
        private String causationId;

        private Builder(String eventName) {
            this.eventName = eventName;
        }

        /**
         * Sets the event id. Optional; defaults to a new time-ordered UUID.
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the aggregate stream this event belongs to. <b>Required.</b>
         */
        public Builder aggregate(String aggregateType, String aggregateId) {
            this.aggregateType = aggregateType;
            this.aggregateId = aggregateId;
            return this;
        }

        /**
         * Sets the aggregate stream this event belongs to. <b>Required.</b>
         */
        public Builder aggregate(AggregateType aggregateType, String aggregateId) {
            Objects.requireNonNull(aggregateType, "aggregateType");
            return aggregate(aggregateType.name(), aggregateId);
        }

        /**
         * Sets the 1-based stream position. <b>Required.</b>
         */
        public Builder version(long version) {
            this.version = version;
            return this;
        }

        /**
         * Sets the event timestamp. Optional; defaults to {@link Instant#now()}.
         */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        /**
         * Sets the JSON object payload. Optional; defaults to {@code "{}"}.
         */
        public Builder payloadJson(String payloadJson) {
            this.payloadJson = payloadJson;
            return this;
        }

        /**
         * Applies correlation and causation ids from the given metadata.
         */
        public Builder metadata(EventMetadata metadata) {
            if (metadata != null) {
                this.correlationId = metadata.correlationId();
                this.causationId = metadata.causationId();
            }
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        /**
         * Builds an immutable {@link DomainEvent}.
         *
         * @throws NullPointerException     if the name or aggregate is missing
         * @throws IllegalArgumentException if the name is empty, the version is below 1
         *                                  or the payload is too large
         */
        public DomainEvent build() {
            return new DomainEvent(this);
        }
    }
}
