package eventflow.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Idempotency ledger: records which events each consumer already handled.
 */
public interface ProcessedEventStore {

  /**
   * Records {@code (consumerName, eventId)} if absent.
   *
   * @return {@code true} if the record is new, {@code false} if the event was already processed
   */
  boolean markProcessed(Connection conn, String consumerName, String eventId, Instant processedAt);

  boolean isProcessed(Connection conn, String consumerName, String eventId);
}
