package eventflow.consumer;

import eventflow.DomainEvent;
import eventflow.bus.BusEntry;
import eventflow.bus.EventWireCodec;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for events received from the bus: decodes each entry and hands it to the
 * consumers registered for its event name.
 *
 * <p>Consumers run in registration order. The first failure stops the routing of that
 * event and is rethrown so the transport redelivers it; consumers that already succeeded
 * see the redelivery as a duplicate when they are idempotent.
 */
public final class InboundEventRouter {
  private static final Logger logger = Logger.getLogger(InboundEventRouter.class.getName());

  private final ConsumerRegistry registry;
  private final EventWireCodec wireCodec;

  public InboundEventRouter(ConsumerRegistry registry) {
    this(registry, new EventWireCodec());
  }

  public InboundEventRouter(ConsumerRegistry registry, EventWireCodec wireCodec) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.wireCodec = Objects.requireNonNull(wireCodec, "wireCodec");
  }

  /**
   * Decodes and routes one bus entry.
   *
   * @return the number of consumers invoked
   * @throws IllegalArgumentException if the entry cannot be decoded
   */
  public int route(BusEntry entry) {
    return route(wireCodec.decode(entry));
  }

  /**
   * Routes an already decoded event.
   *
   * @return the number of consumers invoked
   */
  public int route(DomainEvent event) {
    Objects.requireNonNull(event, "event");
    List<EventConsumer> consumers = registry.consumersFor(event.eventName());
    if (consumers.isEmpty()) {
      logger.log(Level.FINE, "No consumer for {0}, event {1} ignored", new Object[]{event.eventName(), event.eventId()});
      return 0;
    }
    for (EventConsumer consumer : consumers) {
      consumer.onEvent(event);
    }
    return consumers.size();
  }
}
