package eventflow.consumer;

import eventflow.EventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe {@link ConsumerRegistry} with fluent registration.
 *
 * <p>Consumers registered under {@link #ALL_EVENTS} receive every event, after the
 * consumers registered for the specific name.
 */
public final class DefaultConsumerRegistry implements ConsumerRegistry {
  /** Wildcard event name. */
  public static final String ALL_EVENTS = "*";

  private final Map<String, List<EventConsumer>> consumers = new ConcurrentHashMap<>();

  public DefaultConsumerRegistry register(String eventName, EventConsumer consumer) {
    Objects.requireNonNull(eventName, "eventName");
    Objects.requireNonNull(consumer, "consumer");
    consumers.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(consumer);
    return this;
  }

  public DefaultConsumerRegistry register(EventType eventType, EventConsumer consumer) {
    Objects.requireNonNull(eventType, "eventType");
    return register(eventType.eventName(), consumer);
  }

  public DefaultConsumerRegistry registerAll(EventConsumer consumer) {
    return register(ALL_EVENTS, consumer);
  }

  @Override
  public List<EventConsumer> consumersFor(String eventName) {
    List<EventConsumer> specific = consumers.getOrDefault(eventName, List.of());
    List<EventConsumer> wildcard = ALL_EVENTS.equals(eventName) ? List.of() : consumers.getOrDefault(ALL_EVENTS, List.of());
    if (wildcard.isEmpty()) {
      return Collections.unmodifiableList(new ArrayList<>(specific));
    }
    List<EventConsumer> result = new ArrayList<>(specific.size() + wildcard.size());
    result.addAll(specific);
    result.addAll(wildcard);
    return Collections.unmodifiableList(result);
  }
}
