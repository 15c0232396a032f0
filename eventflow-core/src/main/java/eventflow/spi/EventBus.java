package eventflow.spi;

import eventflow.DeliveryException;
import eventflow.bus.BusEntry;
import eventflow.bus.PublishResult;

import java.util.List;

/**
 * External event bus that carries events to other services.
 *
 * <p>Implementations wrap a concrete broker client and are expected to apply their
 * own request timeout. The publisher never passes more than its configured
 * {@code maxEntriesPerCall} entries to one call.
 */
public interface EventBus {

  /**
   * Publishes a batch of entries.
   *
   * @return the outcome of every entry, by position
   * @throws DeliveryException           if the bus rejected the whole call
   * @throws eventflow.RetryAfterException if the bus asked to retry the whole call later
   */
  PublishResult publish(List<BusEntry> entries);
}
