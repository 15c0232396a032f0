package eventflow.consumer;

import java.util.List;

/**
 * Maps event names to the consumers interested in them.
 *
 * @see DefaultConsumerRegistry
 */
public interface ConsumerRegistry {

  /**
   * Returns the consumers registered for an event name, plus wildcard consumers.
   * Never {@code null}; empty when nobody is interested.
   */
  List<EventConsumer> consumersFor(String eventName);
}
