package eventflow.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * Database dialects supported by the stores in this module.
 *
 * <p>The stores share standard SQL and differ only in how they claim rows and how
 * they insert rows that may already exist:
 * <ul>
 *   <li>H2 claims with a two-phase UPDATE then SELECT and checks for an existing row
 *       before inserting; a statement failure does not abort its transaction.</li>
 *   <li>PostgreSQL claims with {@code FOR UPDATE SKIP LOCKED ... RETURNING} and inserts
 *       with {@code ON CONFLICT DO NOTHING}, since any failed statement aborts the
 *       surrounding transaction.</li>
 * </ul>
 */
public enum JdbcDialect {
  H2("h2", List.of("jdbc:h2:"), false),
  POSTGRESQL("postgresql", List.of("jdbc:postgresql:"), true);

  private final String dialectName;
  private final List<String> jdbcUrlPrefixes;
  private final boolean skipLocked;

  JdbcDialect(String dialectName, List<String> jdbcUrlPrefixes, boolean skipLocked) {
    this.dialectName = dialectName;
    this.jdbcUrlPrefixes = jdbcUrlPrefixes;
    this.skipLocked = skipLocked;
  }

  /**
   * Identifier used in configuration, e.g. {@code "postgresql"}.
   */
  public String dialectName() {
    return dialectName;
  }

  public List<String> jdbcUrlPrefixes() {
    return jdbcUrlPrefixes;
  }

  /**
   * Whether claims use {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING}
   * and inserts use {@code ON CONFLICT DO NOTHING}.
   */
  public boolean supportsSkipLocked() {
    return skipLocked;
  }

  /**
   * Looks a dialect up by name, case-insensitively.
   *
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static JdbcDialect get(String name) {
    for (JdbcDialect dialect : values()) {
      if (dialect.dialectName.equalsIgnoreCase(name)) {
        return dialect;
      }
    }
    throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + List.of("h2", "postgresql"));
  }

  /**
   * Detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL matches no dialect
   */
  public static JdbcDialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (JdbcDialect dialect : values()) {
      for (String prefix : dialect.jdbcUrlPrefixes) {
        if (url.startsWith(prefix)) {
          return dialect;
        }
      }
    }
    throw new IllegalArgumentException("No dialect for JDBC URL: " + jdbcUrl);
  }

  /**
   * Detects the dialect from the URL of a connection obtained from the data source.
   *
   * @throws IllegalStateException if the URL cannot be read
   */
  public static JdbcDialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
  }
}
