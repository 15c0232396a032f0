package eventflow;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DomainEventTest {

  @Test
  void defaultsAreFilledIn() {
    DomainEvent event = DomainEvent.builder("user.created")
        .aggregate("USER", "u-1")
        .version(1)
        .build();

    assertNotNull(event.eventId());
    assertNotNull(event.occurredAt());
    assertEquals("{}", event.payloadJson());
    assertEquals(event.eventId(), event.correlationId());
    assertNull(event.causationId());
  }

  @Test
  void partitionKeyUpperCasesAggregateType() {
    DomainEvent event = DomainEvent.builder("user.created")
        .aggregate("user", "u-1")
        .version(1)
        .build();

    assertEquals("USER#u-1", event.partitionKey());
  }

  @Test
  void sortKeyCombinesTimestampAndId() {
    Instant at = Instant.parse("2024-05-01T10:15:30Z");
    DomainEvent event = DomainEvent.builder("user.created")
        .eventId("evt-1")
        .aggregate("USER", "u-1")
        .version(1)
        .occurredAt(at)
        .build();

    assertEquals("EVENT#2024-05-01T10:15:30Z#evt-1", event.sortKey());
  }

  @Test
  void typedBuilderUsesEventName() {
    EventType type = EventType.of("user.activated");

    DomainEvent event = DomainEvent.builder(type).aggregate(AggregateType.of("USER"), "u-1").version(2).build();

    assertEquals("user.activated", event.eventName());
    assertEquals("USER", event.aggregateType());
  }

  @Test
  void rejectsVersionBelowOne() {
    DomainEvent.Builder builder = DomainEvent.builder("user.created").aggregate("USER", "u-1").version(0);

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  void rejectsMissingAggregate() {
    DomainEvent.Builder builder = DomainEvent.builder("user.created").version(1);

    assertThrows(NullPointerException.class, builder::build);
  }

  @Test
  void rejectsEmptyName() {
    DomainEvent.Builder builder = DomainEvent.builder("").aggregate("USER", "u-1").version(1);

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  void rejectsOversizedPayload() {
    String big = "{\"data\":\"" + "x".repeat(DomainEvent.MAX_PAYLOAD_BYTES) + "\"}";
    DomainEvent.Builder builder = DomainEvent.builder("user.created")
        .aggregate("USER", "u-1").version(1).payloadJson(big);

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  void causedMetadataChainsCorrelation() {
    DomainEvent first = DomainEvent.builder("user.created")
        .aggregate("USER", "u-1")
        .version(1)
        .metadata(EventMetadata.correlatedWith("req-1"))
        .build();

    EventMetadata next = first.causedMetadata();

    assertEquals("req-1", next.correlationId());
    assertEquals(first.eventId(), next.causationId());
  }

  @Test
  void equalityIsByEventId() {
    DomainEvent a = DomainEvent.builder("x.y").eventId("same").aggregate("X", "1").version(1).build();
    DomainEvent b = DomainEvent.builder("x.z").eventId("same").aggregate("X", "2").version(3).build();

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }

  @Test
  void generatedIdsAreTimeOrdered() {
    DomainEvent first = DomainEvent.builder("x.y").aggregate("X", "1").version(1).build();
    DomainEvent second = DomainEvent.builder("x.y").aggregate("X", "1").version(2).build();

    assertTrue(first.eventId().compareTo(second.eventId()) < 0,
        first.eventId() + " should sort before " + second.eventId());
  }
}
