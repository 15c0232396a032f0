package eventflow.consumer;

import eventflow.DomainEvent;

/**
 * Reaction to an event delivered through the bus, local or remote.
 *
 * <p>Delivery is at-least-once, so implementations either are idempotent themselves
 * or are wrapped in an {@link IdempotentConsumer}.
 */
@FunctionalInterface
public interface EventConsumer {

  /**
   * @throws RuntimeException to signal failure; the event is redelivered later
   */
  void onEvent(DomainEvent event);
}
