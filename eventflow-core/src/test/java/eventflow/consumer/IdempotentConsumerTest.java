package eventflow.consumer;

import eventflow.DomainEvent;
import eventflow.support.InMemoryProcessedEventStore;
import eventflow.support.InMemoryTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static eventflow.support.Events.event;
import static org.junit.jupiter.api.Assertions.*;

class IdempotentConsumerTest {

  private InMemoryTransactions tx;
  private InMemoryProcessedEventStore processed;

  @BeforeEach
  void setUp() {
    tx = new InMemoryTransactions();
    processed = new InMemoryProcessedEventStore(tx);
  }

  @Test
  void duplicateDeliveryHasOneEffect() {
    List<String> effects = new ArrayList<>();
    IdempotentConsumer consumer = new IdempotentConsumer("notifications",
        e -> effects.add(e.eventId()), processed, tx, tx);
    DomainEvent event = event("user.created", "USER", "u-1", 1);

    assertTrue(consumer.handle(event));
    assertFalse(consumer.handle(event));
    consumer.onEvent(event);

    assertEquals(List.of(event.eventId()), effects);
  }

  @Test
  void failureRollsBackTheRecordSoRedeliveryRetries() {
    List<String> effects = new ArrayList<>();
    boolean[] fail = {true};
    IdempotentConsumer consumer = new IdempotentConsumer("search-index", e -> {
      if (fail[0]) {
        throw new IllegalStateException("index unavailable");
      }
      effects.add(e.eventId());
    }, processed, tx, tx);
    DomainEvent event = event("user.profile_updated", "USER", "u-1", 2);

    assertThrows(IllegalStateException.class, () -> consumer.handle(event));
    assertEquals(0, processed.size());

    fail[0] = false;
    assertTrue(consumer.handle(event));
    assertEquals(List.of(event.eventId()), effects);
  }

  @Test
  void consumersAreTrackedSeparately() {
    List<String> effects = new ArrayList<>();
    DomainEvent event = event("user.created", "USER", "u-1", 1);
    IdempotentConsumer mail = new IdempotentConsumer("mail", e -> effects.add("mail"), processed, tx, tx);
    IdempotentConsumer audit = new IdempotentConsumer("audit", e -> effects.add("audit"), processed, tx, tx);

    mail.onEvent(event);
    audit.onEvent(event);
    mail.onEvent(event);

    assertEquals(List.of("mail", "audit"), effects);
  }
}
