package eventflow.consumer;

import eventflow.DomainEvent;
import eventflow.spi.ProcessedEventStore;
import eventflow.spi.TransactionRunner;
import eventflow.spi.TxContext;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wraps an {@link EventConsumer} so each event id has one observable effect per consumer name.
 *
 * <p>Within one transaction the event is recorded in the {@link ProcessedEventStore} and,
 * if the record is new, the delegate runs. A delegate failure rolls the record back, so a
 * redelivery retries; a redelivery after success is skipped. Work the delegate does through
 * the same {@link TxContext} commits atomically with the record.
 */
public final class IdempotentConsumer implements EventConsumer {
  private static final Logger logger = Logger.getLogger(IdempotentConsumer.class.getName());

  private final String consumerName;
  private final EventConsumer delegate;
  private final ProcessedEventStore processedEvents;
  private final TxContext txContext;
  private final TransactionRunner transactionRunner;
  private final Clock clock;

  public IdempotentConsumer(String consumerName, EventConsumer delegate, ProcessedEventStore processedEvents,
                            TxContext txContext, TransactionRunner transactionRunner) {
    this(consumerName, delegate, processedEvents, txContext, transactionRunner, Clock.systemUTC());
  }

  public IdempotentConsumer(String consumerName, EventConsumer delegate, ProcessedEventStore processedEvents,
                            TxContext txContext, TransactionRunner transactionRunner, Clock clock) {
    this.consumerName = Objects.requireNonNull(consumerName, "consumerName");
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.processedEvents = Objects.requireNonNull(processedEvents, "processedEvents");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.transactionRunner = Objects.requireNonNull(transactionRunner, "transactionRunner");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public String consumerName() {
    return consumerName;
  }

  @Override
  public void onEvent(DomainEvent event) {
    handle(event);
  }

  /**
   * @return {@code true} if the delegate ran, {@code false} if the event was a duplicate
   */
  public boolean handle(DomainEvent event) {
    Objects.requireNonNull(event, "event");
    boolean handled = transactionRunner.inTransaction(() -> {
      if (!processedEvents.markProcessed(txContext.currentConnection(), consumerName, event.eventId(), clock.instant())) {
        return false;
      }
      delegate.onEvent(event);
      return true;
    });
    if (!handled) {
      logger.log(Level.FINE, "Consumer {0} skipped duplicate event {1}", new Object[]{consumerName, event.eventId()});
    }
    return handled;
  }
}
