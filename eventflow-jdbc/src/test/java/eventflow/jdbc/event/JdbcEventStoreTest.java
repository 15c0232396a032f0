package eventflow.jdbc.event;

import eventflow.ConcurrencyConflictException;
import eventflow.DomainEvent;
import eventflow.jdbc.support.H2Database;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventStoreTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private JdbcDataSource dataSource;
  private JdbcEventStore store;

  @BeforeEach
  void setUp() {
    dataSource = H2Database.create();
    store = new JdbcEventStore();
  }

  @Test
  void appendThenLoadReturnsEventsInVersionOrder() throws SQLException {
    DomainEvent created = event("user.created", "u-1", 1, "{\"email\":\"ada@school.test\"}");
    DomainEvent updated = DomainEvent.builder("user.profile_updated")
        .aggregate("USER", "u-1")
        .version(2)
        .occurredAt(T0.plusSeconds(5))
        .payloadJson("{\"displayName\":\"Ada\"}")
        .correlationId("req-9")
        .causationId(created.eventId())
        .build();

    try (Connection conn = dataSource.getConnection()) {
      assertEquals(2, store.append(conn, "USER", "u-1", 0, List.of(created, updated)));

      List<DomainEvent> loaded = store.load(conn, "USER", "u-1");
      assertEquals(2, loaded.size());
      assertEquals(created.eventId(), loaded.get(0).eventId());
      assertEquals(1, loaded.get(0).version());
      assertEquals(T0, loaded.get(0).occurredAt());
      assertEquals("{\"email\":\"ada@school.test\"}", loaded.get(0).payloadJson());

      DomainEvent second = loaded.get(1);
      assertEquals("user.profile_updated", second.eventName());
      assertEquals(2, second.version());
      assertEquals("req-9", second.correlationId());
      assertEquals(created.eventId(), second.causationId());
      assertEquals("USER#u-1", second.partitionKey());
      assertEquals(updated.sortKey(), second.sortKey());
    }
  }

  @Test
  void appendWithStaleVersionThrowsConflict() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.append(conn, "USER", "u-1", 0, List.of(event("user.created", "u-1", 1, "{}")));

      ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
          () -> store.append(conn, "USER", "u-1", 0, List.of(event("user.created", "u-1", 1, "{}"))));
      assertEquals("USER#u-1", e.partitionKey());
      assertEquals(0, e.expectedVersion());
      assertEquals(1, e.actualVersion());
      assertEquals(1, store.currentVersion(conn, "USER", "u-1"));
    }
  }

  @Test
  void keyViolationDuringInsertMapsToConflict() throws SQLException {
    DomainEvent created = event("user.created", "u-1", 1, "{}");
    try (Connection conn = dataSource.getConnection()) {
      store.append(conn, "USER", "u-1", 0, List.of(created));

      // Same event id on a fresh stream passes the version check and fails on the key.
      DomainEvent clash = DomainEvent.builder("user.created")
          .eventId(created.eventId())
          .aggregate("USER", "u-2")
          .version(1)
          .build();
      ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
          () -> store.append(conn, "USER", "u-2", 0, List.of(clash)));
      assertEquals(-1, e.actualVersion());
      assertNotNull(e.getCause());
      assertEquals(0, store.currentVersion(conn, "USER", "u-2"));
    }
  }

  @Test
  void emptyAppendWritesNothing() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(3, store.append(conn, "USER", "u-1", 3, List.of()));
      assertEquals(0, store.currentVersion(conn, "USER", "u-1"));
    }
  }

  @Test
  void appendRejectsEventsOfAnotherStream() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      assertThrows(IllegalArgumentException.class,
          () -> store.append(conn, "USER", "u-1", 0, List.of(event("user.created", "u-2", 1, "{}"))));
      assertEquals(0, store.currentVersion(conn, "USER", "u-1"));
    }
  }

  @Test
  void appendRejectsVersionGaps() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      assertThrows(IllegalArgumentException.class, () -> store.append(conn, "USER", "u-1", 0,
          List.of(event("user.created", "u-1", 1, "{}"), event("user.activated", "u-1", 3, "{}"))));
      assertTrue(store.load(conn, "USER", "u-1").isEmpty());
    }
  }

  @Test
  void loadAfterReturnsTail() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.append(conn, "USER", "u-1", 0, List.of(
          event("user.created", "u-1", 1, "{}"),
          event("user.activated", "u-1", 2, "{}"),
          event("user.deactivated", "u-1", 3, "{}")));

      List<DomainEvent> tail = store.loadAfter(conn, "USER", "u-1", 1);
      assertEquals(List.of(2L, 3L), tail.stream().map(DomainEvent::version).toList());
      assertTrue(store.loadAfter(conn, "USER", "u-1", 3).isEmpty());
    }
  }

  @Test
  void streamsAreIsolatedByAggregate() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.append(conn, "USER", "u-1", 0, List.of(event("user.created", "u-1", 1, "{}")));
      store.append(conn, "USER", "u-2", 0, List.of(event("user.created", "u-2", 1, "{}")));
      DomainEvent course = DomainEvent.builder("course.created").aggregate("COURSE", "u-1").version(1).build();
      store.append(conn, "COURSE", "u-1", 0, List.of(course));

      assertEquals(1, store.currentVersion(conn, "USER", "u-1"));
      assertEquals(1, store.load(conn, "COURSE", "u-1").size());
      assertEquals(0, store.currentVersion(conn, "USER", "u-3"));
      assertTrue(store.load(conn, "USER", "u-3").isEmpty());
    }
  }

  @Test
  void containsFindsStoredEventIds() throws SQLException {
    DomainEvent created = event("user.created", "u-1", 1, "{}");
    try (Connection conn = dataSource.getConnection()) {
      assertFalse(store.contains(conn, created.eventId()));
      store.append(conn, "USER", "u-1", 0, List.of(created));
      assertTrue(store.contains(conn, created.eventId()));
    }
  }

  @Test
  void rolledBackAppendLeavesNoTrace() throws SQLException {
    DomainEvent created = event("user.created", "u-1", 1, "{}");
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      store.append(conn, "USER", "u-1", 0, List.of(created));
      conn.rollback();
      conn.setAutoCommit(true);

      assertFalse(store.contains(conn, created.eventId()));
      assertEquals(0, store.currentVersion(conn, "USER", "u-1"));
    }
  }

  private static DomainEvent event(String name, String userId, long version, String payload) {
    return DomainEvent.builder(name)
        .aggregate("USER", userId)
        .version(version)
        .occurredAt(T0)
        .payloadJson(payload)
        .build();
  }
}
