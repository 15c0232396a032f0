package eventflow.outbox;

import eventflow.DeliveryException;
import eventflow.DomainEvent;
import eventflow.RetryAfterException;
import eventflow.bus.BusEntry;
import eventflow.bus.PublishResult;
import eventflow.model.DeliveryStatus;
import eventflow.model.OutboxEntry;
import eventflow.retry.RetryPolicy;
import eventflow.support.InMemoryOutboxStore;
import eventflow.support.InMemoryTransactions;
import eventflow.support.MutableClock;
import eventflow.support.RecordingEventBus;
import eventflow.support.RecordingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static eventflow.support.Events.T0;
import static eventflow.support.Events.event;
import static org.junit.jupiter.api.Assertions.*;

class OutboxPublisherTest {

  private MutableClock clock;
  private InMemoryTransactions tx;
  private InMemoryOutboxStore store;
  private RecordingEventBus bus;
  private RecordingMetrics metrics;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    tx = new InMemoryTransactions();
    store = new InMemoryOutboxStore(tx, clock);
    bus = new RecordingEventBus();
    metrics = new RecordingMetrics();
  }

  private OutboxPublisher.Builder publisher() {
    return OutboxPublisher.builder()
        .connectionProvider(tx)
        .outboxStore(store)
        .eventBus(bus)
        .serviceName("user.service")
        .retryPolicy(RetryPolicy.fixed(Duration.ofSeconds(5)))
        .lockTimeout(Duration.ofMinutes(1))
        .ownerId("test")
        .metrics(metrics)
        .clock(clock);
  }

  private DomainEvent stage(String aggregateId, long version) {
    DomainEvent event = event("user.profile_updated", "USER", aggregateId, version);
    store.insert(null, event);
    return event;
  }

  private static List<String> ids(List<BusEntry> call) {
    return call.stream()
        .map(e -> e.detailJson().replaceAll(".*\"eventId\":\"([^\"]+)\".*", "$1"))
        .collect(Collectors.toList());
  }

  private static PublishResult errors(String... errors) {
    return PublishResult.of(Arrays.asList(errors));
  }

  @Test
  void deliversDueEntriesWithOneEntryPerAggregatePerCall() {
    DomainEvent a1 = stage("a", 1);
    DomainEvent a2 = stage("a", 2);
    DomainEvent b1 = stage("b", 1);

    int claimed = publisher().build().drainOnce();

    assertEquals(3, claimed);
    assertEquals(2, bus.calls().size());
    assertEquals(List.of(a1.eventId(), b1.eventId()), ids(bus.calls().get(0)));
    assertEquals(List.of(a2.eventId()), ids(bus.calls().get(1)));
    for (DomainEvent e : List.of(a1, a2, b1)) {
      assertEquals(DeliveryStatus.DELIVERED, store.entry(e.eventId()).status());
      assertNull(store.lockedBy(e.eventId()));
    }
    assertEquals(3, metrics.delivered.get());
    assertEquals("user.service", bus.published().get(0).source());
    assertEquals("user.profile_updated", bus.published().get(0).detailType());
  }

  @Test
  void partialFailureKeepsAggregateOrder() {
    DomainEvent a1 = stage("a", 1);
    DomainEvent a2 = stage("a", 2);
    DomainEvent b1 = stage("b", 1);
    bus.thenRespond(call -> errors("ThrottlingException", null));
    OutboxPublisher publisher = publisher().build();

    publisher.drainOnce();

    OutboxEntry failed = store.entry(a1.eventId());
    assertEquals(DeliveryStatus.FAILED, failed.status());
    assertEquals(1, failed.attempts());
    assertEquals("ThrottlingException", failed.lastError());
    assertEquals(T0.plusSeconds(5), failed.nextAttemptAt());
    assertEquals(DeliveryStatus.DELIVERED, store.entry(b1.eventId()).status());
    // a2 must not overtake a1: it was released unsent
    assertEquals(1, bus.calls().size());
    assertEquals(DeliveryStatus.PENDING, store.entry(a2.eventId()).status());
    assertNull(store.lockedBy(a2.eventId()));

    // Still in backoff: the whole aggregate waits
    assertEquals(0, publisher.drainOnce());

    clock.advance(Duration.ofSeconds(5));
    assertEquals(2, publisher.drainOnce());

    List<String> sent = ids(bus.published());
    assertEquals(List.of(a1.eventId(), b1.eventId(), a1.eventId(), a2.eventId()), sent);
    assertEquals(DeliveryStatus.DELIVERED, store.entry(a1.eventId()).status());
    assertEquals(DeliveryStatus.DELIVERED, store.entry(a2.eventId()).status());
  }

  @Test
  void deliveryExceptionFailsEveryEntryOfTheCall() {
    DomainEvent a1 = stage("a", 1);
    DomainEvent b1 = stage("b", 1);
    bus.thenRespond(call -> {
      throw new DeliveryException("bus unavailable");
    });

    publisher().build().drainOnce();

    for (DomainEvent e : List.of(a1, b1)) {
      OutboxEntry entry = store.entry(e.eventId());
      assertEquals(DeliveryStatus.FAILED, entry.status());
      assertEquals(1, entry.attempts());
      assertEquals("bus unavailable", entry.lastError());
    }
    assertEquals(2, metrics.deliveryFailed.get());
  }

  @Test
  void retryAfterOverridesBackoff() {
    DomainEvent a1 = stage("a", 1);
    bus.thenRespond(call -> {
      throw new RetryAfterException(Duration.ofSeconds(30), "slow down");
    });

    publisher().build().drainOnce();

    assertEquals(T0.plusSeconds(30), store.entry(a1.eventId()).nextAttemptAt());
  }

  @Test
  void mismatchedResultSizeFailsTheCall() {
    DomainEvent a1 = stage("a", 1);
    DomainEvent b1 = stage("b", 1);
    bus.thenRespond(call -> PublishResult.allAccepted(1));

    publisher().build().drainOnce();

    assertEquals(DeliveryStatus.FAILED, store.entry(a1.eventId()).status());
    assertEquals(DeliveryStatus.FAILED, store.entry(b1.eventId()).status());
  }

  @Test
  void entryGoesDeadAfterMaxAttemptsAndStopsBlockingItsAggregate() {
    DomainEvent a1 = stage("a", 1);
    DomainEvent a2 = stage("a", 2);
    for (int i = 0; i < 3; i++) {
      bus.thenRespond(call -> errors("InvalidDetail"));
    }
    OutboxPublisher publisher = publisher().maxAttempts(3).build();

    for (int round = 0; round < 3; round++) {
      publisher.drainOnce();
      clock.advance(Duration.ofSeconds(5));
    }

    OutboxEntry dead = store.entry(a1.eventId());
    assertEquals(DeliveryStatus.DEAD, dead.status());
    assertEquals(3, dead.attempts());
    assertEquals(1, metrics.deliveryDead.get());
    assertEquals(DeliveryStatus.PENDING, store.entry(a2.eventId()).status());

    publisher.drainOnce();

    assertEquals(DeliveryStatus.DELIVERED, store.entry(a2.eventId()).status());
    assertEquals(DeliveryStatus.DEAD, store.entry(a1.eventId()).status());
  }

  @Test
  void unencodableEntryGoesDeadWithoutCallingTheBus() {
    DomainEvent broken = DomainEvent.builder("user.created")
        .aggregate("USER", "x").version(1).payloadJson("{broken").build();
    store.insert(null, broken);

    publisher().build().drainOnce();

    assertEquals(DeliveryStatus.DEAD, store.entry(broken.eventId()).status());
    assertTrue(bus.calls().isEmpty());
  }

  @Test
  void claimedEntriesAreResentAfterLockExpiry() {
    DomainEvent a1 = stage("a", 1);
    // A worker claimed the entry and died before recording the outcome.
    store.claimDue(null, "crashed-worker", T0, T0.minus(Duration.ofMinutes(1)), 10);
    OutboxPublisher publisher = publisher().build();

    assertEquals(0, publisher.drainOnce());
    assertEquals("crashed-worker", store.lockedBy(a1.eventId()));

    clock.advance(Duration.ofMinutes(2));
    assertEquals(1, publisher.drainOnce());

    assertEquals(DeliveryStatus.DELIVERED, store.entry(a1.eventId()).status());
  }

  @Test
  void recordsLagOfOldestUndeliveredEntry() {
    stage("a", 1);
    clock.advance(Duration.ofSeconds(3));

    publisher().build().drainOnce();

    assertEquals(3000L, metrics.oldestLagMs.get());
  }

  @Test
  void emptyOutboxReportsZeroLag() {
    assertEquals(0, publisher().build().drainOnce());
    assertEquals(0L, metrics.oldestLagMs.get());
  }

  @Test
  void entriesWaitingForBackoffStillCountAsLag() {
    stage("a", 1);
    stage("a", 2);
    bus.thenRespond(call -> errors("ThrottlingException"));
    OutboxPublisher publisher = publisher().build();
    publisher.drainOnce();

    clock.advance(Duration.ofSeconds(4));
    assertEquals(0, publisher.drainOnce());

    assertEquals(4000L, metrics.oldestLagMs.get());
  }

  @Test
  void deliveryTimeComesFromTheClock() {
    DomainEvent a1 = stage("a", 1);
    clock.advance(Duration.ofSeconds(7));

    publisher().build().drainOnce();

    assertEquals(T0.plusSeconds(7), store.deliveredAt(a1.eventId()));
  }

  @Test
  void batchSizeLimitsClaim() {
    List<DomainEvent> staged = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      staged.add(stage("agg-" + i, 1));
    }

    assertEquals(2, publisher().batchSize(2).build().drainOnce());
    assertEquals(2, bus.published().size());
    assertEquals(5, staged.size());
  }

  @Test
  void startAfterCloseFails() {
    OutboxPublisher publisher = publisher().intervalMs(60_000).build();
    publisher.start();
    publisher.close();

    assertThrows(IllegalStateException.class, publisher::start);
    assertEquals(0, publisher.drainOnce());
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class, () -> publisher().maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class, () -> publisher().maxEntriesPerCall(0).build());
    assertThrows(IllegalArgumentException.class, () -> publisher().lockTimeout(Duration.ZERO).build());
    assertThrows(NullPointerException.class, () -> publisher().serviceName(null).build());
  }
}
