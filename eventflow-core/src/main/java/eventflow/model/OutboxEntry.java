package eventflow.model;

import eventflow.DomainEvent;

import java.time.Instant;

/**
 * Read-only view of a persisted outbox row: the staged event plus its delivery state.
 *
 * @see eventflow.spi.OutboxStore#claimDue
 */
public record OutboxEntry(
    DomainEvent event,
    DeliveryStatus status,
    int attempts,
    Instant nextAttemptAt,
    String lastError,
    Instant createdAt
) {

  public String eventId() {
    return event.eventId();
  }

  public String partitionKey() {
    return event.partitionKey();
  }
}
