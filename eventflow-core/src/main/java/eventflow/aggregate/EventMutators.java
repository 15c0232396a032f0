package eventflow.aggregate;

import eventflow.DomainEvent;
import eventflow.EventType;
import eventflow.ReplayException;
import eventflow.util.JsonCodec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dispatch table from event name to state mutation for one aggregate type.
 *
 * <p>Build it once per aggregate class and keep it in a static field:
 * <pre>{@code
 * private static final EventMutators<UserAccount> MUTATORS = EventMutators.<UserAccount>builder()
 *     .on(UserEvents.CREATED, UserCreated.class, UserAccount::onCreated)
 *     .on(UserEvents.ROLE_CHANGED, RoleChanged.class, UserAccount::onRoleChanged)
 *     .build();
 * }</pre>
 *
 * <p>Payloads are decoded into the registered type with the {@link JsonCodec}. Mutations
 * must only change in-memory state.
 *
 * @param <A> aggregate type
 */
public final class EventMutators<A> {
  private static final Logger logger = Logger.getLogger(EventMutators.class.getName());

  private final Map<String, BiConsumer<A, DomainEvent>> mutations;
  private final UnknownEventPolicy unknownEventPolicy;
  private final JsonCodec jsonCodec;

  private EventMutators(Builder<A> builder) {
    this.mutations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.mutations));
    this.unknownEventPolicy = builder.unknownEventPolicy;
    this.jsonCodec = builder.jsonCodec;
  }

  public static <A> Builder<A> builder() {
    return new Builder<>();
  }

  public boolean handles(String eventName) {
    return mutations.containsKey(eventName);
  }

  public Set<String> eventNames() {
    return mutations.keySet();
  }

  public UnknownEventPolicy unknownEventPolicy() {
    return unknownEventPolicy;
  }

  public JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /**
   * Applies a newly raised event. Unknown names are a programming error regardless of policy.
   *
   * @throws IllegalArgumentException if no mutation is registered for the event name
   */
  void applyLive(A aggregate, DomainEvent event) {
    BiConsumer<A, DomainEvent> mutation = mutations.get(event.eventName());
    if (mutation == null) {
      throw new IllegalArgumentException("No mutation registered for event '" + event.eventName() + "'");
    }
    mutation.accept(aggregate, event);
  }

  /**
   * Applies a stored event during replay, honouring the unknown event policy.
   *
   * @throws ReplayException if the event is unknown under {@link UnknownEventPolicy#FAIL}
   *                         or its payload cannot be decoded
   */
  void applyReplayed(A aggregate, DomainEvent event) {
    BiConsumer<A, DomainEvent> mutation = mutations.get(event.eventName());
    if (mutation == null) {
      if (unknownEventPolicy == UnknownEventPolicy.FAIL) {
        throw new ReplayException("Unknown event during replay", event);
      }
      logger.log(Level.WARNING, "Skipping unknown event {0} of {1} at version {2}",
          new Object[]{event.eventName(), event.partitionKey(), event.version()});
      return;
    }
    try {
      mutation.accept(aggregate, event);
    } catch (IllegalArgumentException e) {
      throw new ReplayException("Cannot apply stored event", event, e);
    }
  }

  /**
   * Builder for {@link EventMutators}.
   *
   * @param <A> aggregate type
   */
  public static final class Builder<A> {
    private final Map<String, BiConsumer<A, DomainEvent>> mutations = new LinkedHashMap<>();
    private UnknownEventPolicy unknownEventPolicy = UnknownEventPolicy.FAIL;
    private JsonCodec jsonCodec = JsonCodec.getDefault();

    private Builder() {
    }

    /**
     * Registers a mutation that receives the decoded payload.
     */
    public <P> Builder<A> on(String eventName, Class<P> payloadType, BiConsumer<A, P> mutation) {
      Objects.requireNonNull(payloadType, "payloadType");
      Objects.requireNonNull(mutation, "mutation");
      return onEvent(eventName, (aggregate, event) ->
          mutation.accept(aggregate, jsonCodec.fromJson(event.payloadJson(), payloadType)));
    }

    public <P> Builder<A> on(EventType eventType, Class<P> payloadType, BiConsumer<A, P> mutation) {
      Objects.requireNonNull(eventType, "eventType");
      return on(eventType.eventName(), payloadType, mutation);
    }

    /**
     * Registers a mutation that receives the whole event, for handlers that need the
     * timestamp or causality ids.
     */
    public Builder<A> onEvent(String eventName, BiConsumer<A, DomainEvent> mutation) {
      Objects.requireNonNull(eventName, "eventName");
      Objects.requireNonNull(mutation, "mutation");
      if (mutations.putIfAbsent(eventName, mutation) != null) {
        throw new IllegalStateException("Mutation already registered for event '" + eventName + "'");
      }
      return this;
    }

    public Builder<A> onEvent(EventType eventType, BiConsumer<A, DomainEvent> mutation) {
      Objects.requireNonNull(eventType, "eventType");
      return onEvent(eventType.eventName(), mutation);
    }

    public Builder<A> unknownEventPolicy(UnknownEventPolicy unknownEventPolicy) {
      this.unknownEventPolicy = Objects.requireNonNull(unknownEventPolicy, "unknownEventPolicy");
      return this;
    }

    /**
     * Sets the codec used to decode payloads. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder<A> jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
      return this;
    }

    public EventMutators<A> build() {
      return new EventMutators<>(this);
    }
  }
}
