package eventflow.jdbc.outbox;

import eventflow.jdbc.JdbcTemplate;
import eventflow.jdbc.support.H2Database;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOutboxStoresTest {

  @Test
  void builtInStoresAreRegistered() {
    assertEquals(2, JdbcOutboxStores.all().size());
    assertInstanceOf(H2OutboxStore.class, JdbcOutboxStores.get("h2"));
    assertInstanceOf(PostgresOutboxStore.class, JdbcOutboxStores.get("POSTGRESQL"));
  }

  @Test
  void unknownNameThrows() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.get("oracle"));
    assertTrue(e.getMessage().contains("oracle"));
  }

  @Test
  void detectsFromUrl() {
    assertInstanceOf(PostgresOutboxStore.class, JdbcOutboxStores.detect("jdbc:postgresql://db:5432/school"));
    assertInstanceOf(H2OutboxStore.class, JdbcOutboxStores.detect("jdbc:h2:mem:school"));
    assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.detect("jdbc:sqlite:school.db"));
    assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.detect(""));
  }

  @Test
  void detectsFromDataSource() {
    assertInstanceOf(H2OutboxStore.class, JdbcOutboxStores.detect(H2Database.create()));
  }

  @Test
  void withTableKeepsStoreKind() {
    AbstractJdbcOutboxStore store = JdbcOutboxStores.get("postgresql").withTable("school_outbox", new JdbcTemplate(5));

    assertInstanceOf(PostgresOutboxStore.class, store);
    assertEquals("school_outbox", store.tableName());
    assertEquals(5, store.jdbc().queryTimeoutSeconds());
    assertEquals("outbox_entry", JdbcOutboxStores.get("postgresql").tableName());
  }
}
