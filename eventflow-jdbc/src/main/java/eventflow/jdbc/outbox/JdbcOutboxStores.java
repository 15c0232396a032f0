package eventflow.jdbc.outbox;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC outbox stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/eventflow.jdbc.outbox.AbstractJdbcOutboxStore}.
 *
 * <pre>{@code
 * AbstractJdbcOutboxStore store = JdbcOutboxStores.detect(dataSource);
 * AbstractJdbcOutboxStore custom = JdbcOutboxStores.get("postgresql")
 *     .withTable("course_outbox", new JdbcTemplate(5));
 * }</pre>
 */
public final class JdbcOutboxStores {

  private static final List<AbstractJdbcOutboxStore> STORES;
  private static final Map<String, AbstractJdbcOutboxStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcOutboxStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcOutboxStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcOutboxStores() {
  }

  /**
   * Returns all registered outbox stores.
   */
  public static List<AbstractJdbcOutboxStore> all() {
    return STORES;
  }

  /**
   * Gets an outbox store by name.
   *
   * @param name store name (case-insensitive)
   * @throws IllegalArgumentException if no store has that name
   */
  public static AbstractJdbcOutboxStore get(String name) {
    AbstractJdbcOutboxStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown outbox store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the outbox store from a DataSource.
   *
   * @throws IllegalStateException if the URL cannot be read
   */
  public static AbstractJdbcOutboxStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect outbox store from DataSource", e);
    }
  }

  /**
   * Auto-detects the outbox store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no registered store handles the URL
   */
  public static AbstractJdbcOutboxStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    for (AbstractJdbcOutboxStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (jdbcUrl.startsWith(prefix)) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No outbox store for JDBC URL: " + jdbcUrl +
        ". Available: " + BY_NAME.keySet());
  }
}
