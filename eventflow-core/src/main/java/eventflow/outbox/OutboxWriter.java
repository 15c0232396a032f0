package eventflow.outbox;

import eventflow.DomainEvent;
import eventflow.spi.OutboxStore;
import eventflow.spi.TxContext;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stages committed-to-be events in the outbox inside the caller's transaction.
 *
 * <p>The event store append and the staging must share one transaction; staging
 * without an active transaction is refused. After the transaction commits the optional
 * commit callback runs, typically {@link OutboxPublisher#wakeUp()}, so delivery starts
 * without waiting for the next scheduled cycle.
 */
public final class OutboxWriter {
    private static final Logger logger = Logger.getLogger(OutboxWriter.class.getName());

    private final TxContext txContext;
    private final OutboxStore outboxStore;
    private final Runnable onCommit;

    /**
     * Creates a writer without a commit callback; entries wait for the scheduled drain.
     */
    public OutboxWriter(TxContext txContext, OutboxStore outboxStore) {
        this(txContext, outboxStore, null);
    }

    /**
     * @param onCommit runs after the staging transaction commits; {@code null} for none
     */
    public OutboxWriter(TxContext txContext, OutboxStore outboxStore, Runnable onCommit) {
        this.txContext = Objects.requireNonNull(txContext, "txContext");
        this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
        this.onCommit = onCommit;
    }

    /**
     * Inserts PENDING outbox entries for the events.
     *
     * @throws IllegalStateException if no transaction is active
     */
    public void stage(List<DomainEvent> events) {
        if (!txContext.isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            return;
        }
        outboxStore.insertBatch(txContext.currentConnection(), List.copyOf(events));
        if (onCommit != null) {
            txContext.afterCommit(this::notifyCommitted);
        }
    }

    private void notifyCommitted() {
        try {
            onCommit.run();
        } catch (RuntimeException ex) {
            logger.log(Level.WARNING, "Outbox commit callback failed", ex);
        }
    }
}
